package com.phillippitts.callbridge.service.stream.event;

import java.time.Duration;
import java.time.Instant;

/**
 * Published when a function stream dropped abnormally and a reconnect has been scheduled.
 */
public record StreamReconnectScheduledEvent(
        String callId,
        int attempt,
        Duration delay,
        Instant at
) {
    public StreamReconnectScheduledEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
