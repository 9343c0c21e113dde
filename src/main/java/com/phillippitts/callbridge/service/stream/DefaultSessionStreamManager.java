package com.phillippitts.callbridge.service.stream;

import com.phillippitts.callbridge.config.properties.FunctionStreamProperties;
import com.phillippitts.callbridge.config.properties.GreetingProperties;
import com.phillippitts.callbridge.domain.StreamPurpose;
import com.phillippitts.callbridge.domain.StreamState;
import com.phillippitts.callbridge.domain.StreamTermination;
import com.phillippitts.callbridge.exception.StreamConnectionException;
import com.phillippitts.callbridge.service.action.ActionDispatcher;
import com.phillippitts.callbridge.service.metrics.CallMetrics;
import com.phillippitts.callbridge.service.registry.CallRegistry;
import com.phillippitts.callbridge.service.stream.event.FunctionStreamEndedEvent;
import com.phillippitts.callbridge.util.Sleeper;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Default {@link SessionStreamManager}.
 *
 * <p><b>Thread Model:</b> greeting delivery runs on {@code callExecutor}; each function stream
 * runs a {@link FunctionStreamSupervisor} loop on {@code streamExecutor}; heartbeats and the
 * greeting close-grace timer run on {@code streamScheduler}.
 *
 * <p><b>Shared state:</b> the supervisor map is the function-stream dedup guard. Entries are
 * added with {@code putIfAbsent} and removed only by the supervisor that owns them. A greeting
 * in flight is tracked as a {@link PendingGreeting} until it is sent or abandoned, so
 * {@link #stopStreams(String)} can abort it mid-connect.
 */
@Service
public class DefaultSessionStreamManager implements SessionStreamManager {

    private static final Logger LOG = LogManager.getLogger(DefaultSessionStreamManager.class);

    private final RealtimeTransport transport;
    private final ActionDispatcher dispatcher;
    private final CallRegistry registry;
    private final GreetingProperties greetingProps;
    private final FunctionStreamProperties functionProps;
    private final Executor callExecutor;
    private final Executor streamExecutor;
    private final TaskScheduler scheduler;
    private final ApplicationEventPublisher publisher;
    private final CallMetrics metrics;
    private final Sleeper sleeper;

    private final ConcurrentMap<String, FunctionStreamSupervisor> supervisors = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, RealtimeConnection> greetingConnections = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, PendingGreeting> pendingGreetings = new ConcurrentHashMap<>();

    @Autowired
    public DefaultSessionStreamManager(RealtimeTransport transport,
                                       ActionDispatcher dispatcher,
                                       CallRegistry registry,
                                       GreetingProperties greetingProps,
                                       FunctionStreamProperties functionProps,
                                       @Qualifier("callExecutor") Executor callExecutor,
                                       @Qualifier("streamExecutor") Executor streamExecutor,
                                       @Qualifier("streamScheduler") TaskScheduler scheduler,
                                       ApplicationEventPublisher publisher,
                                       CallMetrics metrics) {
        this(transport, dispatcher, registry, greetingProps, functionProps, callExecutor, streamExecutor,
                scheduler, publisher, metrics, Sleeper.SYSTEM);
    }

    public DefaultSessionStreamManager(RealtimeTransport transport,
                                       ActionDispatcher dispatcher,
                                       CallRegistry registry,
                                       GreetingProperties greetingProps,
                                       FunctionStreamProperties functionProps,
                                       Executor callExecutor,
                                       Executor streamExecutor,
                                       TaskScheduler scheduler,
                                       ApplicationEventPublisher publisher,
                                       CallMetrics metrics,
                                       Sleeper sleeper) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.greetingProps = Objects.requireNonNull(greetingProps, "greetingProps");
        this.functionProps = Objects.requireNonNull(functionProps, "functionProps");
        this.callExecutor = Objects.requireNonNull(callExecutor, "callExecutor");
        this.streamExecutor = Objects.requireNonNull(streamExecutor, "streamExecutor");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    @Override
    public CompletableFuture<Boolean> openGreetingStream(String callId, String greetingText) {
        if (!registry.contains(callId)) {
            LOG.warn("Greeting requested for untracked call={}; skipping", callId);
            return CompletableFuture.completedFuture(false);
        }
        // Claimed on the caller's thread so a concurrent trigger sees the flag immediately
        if (!registry.compareAndSetGreeted(callId, false, true)) {
            LOG.debug("Greeting already sent for call={}", callId);
            return CompletableFuture.completedFuture(true);
        }
        LOG.info("Triggering greeting for call={} with {}ms delay", callId, greetingProps.getDelayMs());
        PendingGreeting pending = new PendingGreeting();
        pendingGreetings.put(callId, pending);
        try {
            return CompletableFuture.supplyAsync(() -> deliverGreeting(callId, greetingText, pending), callExecutor);
        } catch (RejectedExecutionException ex) {
            LOG.error("Greeting rejected by executor for call={}", callId);
            pendingGreetings.remove(callId, pending);
            registry.compareAndSetGreeted(callId, true, false);
            metrics.recordGreeting("failed");
            return CompletableFuture.completedFuture(false);
        }
    }

    private boolean deliverGreeting(String callId, String greetingText, PendingGreeting pending) {
        ThreadContext.put("callId", callId);
        ThreadContext.put("stream", StreamPurpose.GREETING.label());
        try {
            sleeper.sleep(Duration.ofMillis(greetingProps.getDelayMs()));
            if (pending.isCancelled() || !registry.contains(callId)) {
                LOG.info("Call {} ended before greeting could be sent", callId);
                return false;
            }
            RealtimeConnection connection = connectGreeting(callId, pending);
            greetingConnections.put(callId, connection);
            // stopStreams cancels before it sweeps greetingConnections, so one side always closes
            if (pending.isCancelled() || !registry.contains(callId)) {
                greetingConnections.remove(callId, connection);
                connection.close(RealtimeConnection.NORMAL_CLOSURE);
                LOG.info("Call {} ended while greeting stream was connecting; not sent", callId);
                return false;
            }
            connection.send(RealtimeFrames.speakInstruction(greetingText));
            LOG.info("Greeting sent for call={}", callId);
            metrics.recordGreeting("sent");
            scheduleGreetingClose(callId, connection);
            return true;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            rollbackGreeting(callId, "interrupted");
            return false;
        } catch (CancellationException ex) {
            LOG.info("Greeting connect for call={} cancelled; call is ending", callId);
            return false;
        } catch (RuntimeException ex) {
            rollbackGreeting(callId, ex.getMessage());
            return false;
        } finally {
            pendingGreetings.remove(callId, pending);
            ThreadContext.remove("stream");
            ThreadContext.remove("callId");
        }
    }

    private RealtimeConnection connectGreeting(String callId, PendingGreeting pending) throws InterruptedException {
        CompletableFuture<RealtimeConnection> future =
                transport.connect(callId, StreamPurpose.GREETING, new GreetingListener(callId));
        pending.connecting(future);
        try {
            return future.get(greetingProps.getConnectTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            future.cancel(true);
            throw new StreamConnectionException(callId, StreamPurpose.GREETING,
                    "Connect timed out after " + greetingProps.getConnectTimeoutMs() + "ms");
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
            throw new StreamConnectionException(callId, StreamPurpose.GREETING, "Connect failed", cause);
        }
    }

    private void scheduleGreetingClose(String callId, RealtimeConnection connection) {
        Runnable close = () -> {
            greetingConnections.remove(callId, connection);
            connection.close(RealtimeConnection.NORMAL_CLOSURE);
        };
        try {
            scheduler.schedule(close, Instant.now().plusMillis(greetingProps.getCloseGraceMs()));
        } catch (RejectedExecutionException ex) {
            LOG.debug("Close timer rejected for call={}; closing greeting stream now", callId);
            close.run();
        }
    }

    private void rollbackGreeting(String callId, String reason) {
        boolean rolledBack = registry.compareAndSetGreeted(callId, true, false);
        RealtimeConnection stale = greetingConnections.remove(callId);
        if (stale != null) {
            stale.close(RealtimeConnection.NORMAL_CLOSURE);
        }
        metrics.recordGreeting("failed");
        LOG.error("Greeting failed for call={}: {} (flag rolled back: {})", callId, reason, rolledBack);
    }

    @Override
    public CompletableFuture<StreamTermination> openFunctionStream(String callId) {
        if (!registry.contains(callId)) {
            LOG.warn("Function stream requested for untracked call={}; skipping", callId);
            return CompletableFuture.completedFuture(StreamTermination.CANCELLED);
        }
        FunctionStreamSupervisor created = new FunctionStreamSupervisor(callId, transport, dispatcher,
                registry, functionProps, scheduler, publisher, metrics);
        FunctionStreamSupervisor existing = supervisors.putIfAbsent(callId, created);
        if (existing != null) {
            LOG.debug("Function stream already active for call={}", callId);
            return existing.termination();
        }

        LOG.info("Launching function stream for call={}", callId);
        created.termination().whenComplete((termination, error) -> {
            supervisors.remove(callId, created);
            String reason = error != null ? "error" : termination.name().toLowerCase(Locale.ROOT);
            metrics.recordStreamEnded(reason);
            if (termination != null) {
                publisher.publishEvent(new FunctionStreamEndedEvent(callId, termination, Instant.now()));
            }
        });
        try {
            streamExecutor.execute(created);
        } catch (RejectedExecutionException ex) {
            LOG.error("No stream thread available for call={}; function stream not started", callId);
            created.failToStart(new StreamConnectionException(callId, StreamPurpose.FUNCTION,
                    "Stream executor saturated", ex));
        }
        return created.termination();
    }

    @Override
    public void stopStreams(String callId) {
        FunctionStreamSupervisor supervisor = supervisors.get(callId);
        if (supervisor != null) {
            supervisor.cancel();
        }
        PendingGreeting pending = pendingGreetings.remove(callId);
        if (pending != null) {
            pending.cancel();
        }
        RealtimeConnection greeting = greetingConnections.remove(callId);
        if (greeting != null) {
            greeting.close(RealtimeConnection.NORMAL_CLOSURE);
        }
        if (supervisor != null || pending != null || greeting != null) {
            LOG.info("Stopped streams for call={}", callId);
        }
    }

    @Override
    public boolean hasLiveStreams(String callId) {
        return supervisors.containsKey(callId)
                || pendingGreetings.containsKey(callId)
                || greetingConnections.containsKey(callId);
    }

    @Override
    public Optional<StreamState> functionStreamState(String callId) {
        return Optional.ofNullable(supervisors.get(callId)).map(FunctionStreamSupervisor::state);
    }

    @Override
    public int activeFunctionStreamCount() {
        return supervisors.size();
    }

    /**
     * Cancels every supervisor so shutdown does not wait on live calls.
     */
    @PreDestroy
    void shutdown() {
        if (!supervisors.isEmpty()) {
            LOG.info("Stopping {} function stream(s) on shutdown", supervisors.size());
        }
        supervisors.values().forEach(FunctionStreamSupervisor::cancel);
        pendingGreetings.values().forEach(PendingGreeting::cancel);
        pendingGreetings.clear();
        greetingConnections.values().forEach(c -> c.close(RealtimeConnection.NORMAL_CLOSURE));
        greetingConnections.clear();
    }

    /** A greeting between trigger and send. Cancelling aborts its connect if one is in flight. */
    private static final class PendingGreeting {

        private volatile boolean cancelled;
        private volatile CompletableFuture<RealtimeConnection> connect;

        void connecting(CompletableFuture<RealtimeConnection> future) {
            connect = future;
            if (cancelled) {
                future.cancel(true);
            }
        }

        void cancel() {
            cancelled = true;
            CompletableFuture<RealtimeConnection> future = connect;
            if (future != null) {
                future.cancel(true);
            }
        }

        boolean isCancelled() {
            return cancelled;
        }
    }

    /** The greeting stream only logs what comes back; it never reconnects. */
    private static final class GreetingListener implements StreamListener {

        private final String callId;

        GreetingListener(String callId) {
            this.callId = callId;
        }

        @Override
        public void onMessage(String payload) {
            LOG.debug("Greeting stream frame for call={}: {}", callId, payload);
        }

        @Override
        public void onClose(int code, String reason) {
            LOG.debug("Greeting stream closed for call={} code={}", callId, code);
        }

        @Override
        public void onError(Throwable error) {
            LOG.warn("Greeting stream error for call={}: {}", callId, error.getMessage());
        }
    }
}
