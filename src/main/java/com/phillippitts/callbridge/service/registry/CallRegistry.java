package com.phillippitts.callbridge.service.registry;

import com.phillippitts.callbridge.domain.Call;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.UnaryOperator;

/**
 * Process-wide table of live calls keyed by call id.
 *
 * <p>Every mutation runs inside {@link ConcurrentHashMap#compute}, so updates to one call id
 * are mutually exclusive while calls with different ids never contend. Records are immutable
 * {@link Call} snapshots; readers always see a consistent call.
 *
 * <p>Nothing is persisted. Removal on a terminal control event is the only way a record
 * leaves the table.
 */
@Component
public class CallRegistry {

    private static final Logger LOG = LogManager.getLogger(CallRegistry.class);

    private final ConcurrentMap<String, Call> calls = new ConcurrentHashMap<>();

    /**
     * Inserts the call unless a record with the same id is already live.
     *
     * @return true if inserted, false if the id was already tracked
     */
    public boolean insertIfAbsent(Call call) {
        Objects.requireNonNull(call, "call");
        boolean inserted = calls.putIfAbsent(call.callId(), call) == null;
        if (inserted) {
            LOG.debug("Registered call {} (live calls: {})", call.callId(), calls.size());
        }
        return inserted;
    }

    /**
     * Atomically applies {@code patch} only if the call is tracked.
     *
     * @return the updated record, empty if the call is not tracked
     */
    public Optional<Call> update(String callId, UnaryOperator<Call> patch) {
        Objects.requireNonNull(callId, "callId");
        return Optional.ofNullable(calls.computeIfPresent(callId, (id, existing) -> patch.apply(existing)));
    }

    /**
     * Compare-and-set on the {@code greeted} flag. Fails when the call is not tracked
     * or the flag does not hold {@code expected}.
     */
    public boolean compareAndSetGreeted(String callId, boolean expected, boolean newValue) {
        AtomicBoolean swapped = new AtomicBoolean(false);
        calls.computeIfPresent(callId, (id, existing) -> {
            if (existing.greeted() != expected) {
                return existing;
            }
            swapped.set(true);
            return existing.withGreeted(newValue);
        });
        return swapped.get();
    }

    public Optional<Call> get(String callId) {
        return callId == null ? Optional.empty() : Optional.ofNullable(calls.get(callId));
    }

    /**
     * Removes the record. Removing an unknown id is a no-op.
     *
     * @return the removed record, if any
     */
    public Optional<Call> remove(String callId) {
        if (callId == null) {
            return Optional.empty();
        }
        Call removed = calls.remove(callId);
        if (removed != null) {
            LOG.debug("Removed call {} (live calls: {})", callId, calls.size());
        }
        return Optional.ofNullable(removed);
    }

    public boolean contains(String callId) {
        return callId != null && calls.containsKey(callId);
    }

    public int size() {
        return calls.size();
    }

    public long greetedCount() {
        return calls.values().stream().filter(Call::greeted).count();
    }

    /**
     * Point-in-time copy of all live calls, for diagnostics.
     */
    public Collection<Call> snapshot() {
        return List.copyOf(calls.values());
    }
}
