package com.phillippitts.callbridge.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable snapshot of one telephony session.
 *
 * <p>Updates produce new instances through the {@code with*} methods and are applied
 * atomically per call id by {@link com.phillippitts.callbridge.service.registry.CallRegistry}.
 * The caller identifier is fixed at creation.
 *
 * @param callId            id assigned by the remote call-control system
 * @param callerIdentifier  caller number extracted at call start, or {@code "unknown"}
 * @param stage             current lifecycle stage
 * @param greeted           true once the greeting has been dispatched
 * @param hasFunctionStream true while a function-call stream is open
 * @param stats             advisory session counters
 */
public record Call(
        String callId,
        String callerIdentifier,
        LifecycleStage stage,
        boolean greeted,
        boolean hasFunctionStream,
        SessionStats stats
) {

    public Call {
        Objects.requireNonNull(callId, "callId");
        Objects.requireNonNull(callerIdentifier, "callerIdentifier");
        Objects.requireNonNull(stage, "stage");
        Objects.requireNonNull(stats, "stats");
    }

    /**
     * Creates a fresh record in the {@link LifecycleStage#INCOMING} stage.
     */
    public static Call incoming(String callId, String callerIdentifier, Instant now) {
        return new Call(callId, callerIdentifier, LifecycleStage.INCOMING, false, false,
                SessionStats.startingAt(now));
    }

    public Call withStage(LifecycleStage newStage) {
        return new Call(callId, callerIdentifier, newStage, greeted, hasFunctionStream, stats);
    }

    public Call withGreeted(boolean value) {
        return new Call(callId, callerIdentifier, stage, value, hasFunctionStream, stats);
    }

    public Call withFunctionStream(boolean value) {
        return new Call(callId, callerIdentifier, stage, greeted, value, stats);
    }

    public Call withStats(SessionStats newStats) {
        return new Call(callId, callerIdentifier, stage, greeted, hasFunctionStream, newStats);
    }

    public boolean isActive() {
        return stage == LifecycleStage.ACTIVE;
    }
}
