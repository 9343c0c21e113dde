package com.phillippitts.callbridge.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Advisory per-call counters. Never used for correctness decisions.
 *
 * @param startedAt      when the call record was created
 * @param lastActivityAt last inbound frame or control event
 * @param messageCount   inbound frames seen on the function stream
 * @param interrupted    whether the caller barged in on the response currently playing
 */
public record SessionStats(
        Instant startedAt,
        Instant lastActivityAt,
        long messageCount,
        boolean interrupted
) {

    public SessionStats {
        Objects.requireNonNull(startedAt, "startedAt");
        Objects.requireNonNull(lastActivityAt, "lastActivityAt");
    }

    public static SessionStats startingAt(Instant now) {
        return new SessionStats(now, now, 0, false);
    }

    public SessionStats recordMessage(Instant at) {
        return new SessionStats(startedAt, at, messageCount + 1, interrupted);
    }

    public SessionStats withInterrupted(boolean value) {
        return new SessionStats(startedAt, lastActivityAt, messageCount, value);
    }
}
