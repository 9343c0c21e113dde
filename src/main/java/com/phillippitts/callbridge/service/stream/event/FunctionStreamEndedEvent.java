package com.phillippitts.callbridge.service.stream.event;

import com.phillippitts.callbridge.domain.StreamTermination;

import java.time.Instant;

/**
 * Published once when a call's function stream ends for good.
 */
public record FunctionStreamEndedEvent(
        String callId,
        StreamTermination termination,
        Instant at
) {
    public FunctionStreamEndedEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
