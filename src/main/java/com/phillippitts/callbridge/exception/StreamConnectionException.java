package com.phillippitts.callbridge.exception;

import com.phillippitts.callbridge.domain.StreamPurpose;

/**
 * Thrown when a realtime stream cannot be established in time or fails while sending.
 */
public class StreamConnectionException extends CallBridgeException {

    private final String callId;
    private final StreamPurpose purpose;

    public StreamConnectionException(String callId, StreamPurpose purpose, String message) {
        super(message + " (call: " + callId + ", stream: " + purpose.label() + ")");
        this.callId = callId;
        this.purpose = purpose;
    }

    public StreamConnectionException(String callId, StreamPurpose purpose, String message, Throwable cause) {
        super(message + " (call: " + callId + ", stream: " + purpose.label() + ")", cause);
        this.callId = callId;
        this.purpose = purpose;
    }

    public String getCallId() {
        return callId;
    }

    public StreamPurpose getPurpose() {
        return purpose;
    }
}
