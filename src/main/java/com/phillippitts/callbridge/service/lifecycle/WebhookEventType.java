package com.phillippitts.callbridge.service.lifecycle;

/**
 * Control events the lifecycle controller reacts to, matched by type suffix so that any
 * namespace ({@code realtime.call.incoming}, ...) is accepted.
 */
public enum WebhookEventType {

    CALL_INCOMING(".call.incoming"),
    SESSION_UPDATED(".session.updated"),
    CALL_ENDED(".call.ended"),
    CALL_FAILED(".call.failed"),
    CALL_DISCONNECTED(".call.disconnected"),
    PARTICIPANT_DISCONNECTED(".call.participant.disconnected"),
    UNKNOWN(null);

    private final String suffix;

    WebhookEventType(String suffix) {
        this.suffix = suffix;
    }

    public static WebhookEventType fromType(String type) {
        if (type == null || type.isBlank()) {
            return UNKNOWN;
        }
        for (WebhookEventType candidate : values()) {
            if (candidate.suffix != null && type.endsWith(candidate.suffix)) {
                return candidate;
            }
        }
        return UNKNOWN;
    }

    /**
     * Whether this event ends the call.
     */
    public boolean isTerminal() {
        return this == CALL_ENDED || this == CALL_FAILED || this == CALL_DISCONNECTED
                || this == PARTICIPANT_DISCONNECTED;
    }
}
