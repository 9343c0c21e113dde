package com.phillippitts.callbridge.exception;

/**
 * Thrown when a call could not be accepted, either on a fatal upstream status or after
 * the not-ready retry budget is spent. The call never reaches the active stage.
 */
public class CallAcceptException extends CallBridgeException {

    private final String callId;
    private final int attempts;
    private final int statusCode;

    public CallAcceptException(String callId, int attempts, CallControlException cause) {
        super("Accept failed for call " + callId + " after " + attempts + " attempt(s)", cause);
        this.callId = callId;
        this.attempts = attempts;
        this.statusCode = cause.getStatusCode();
    }

    public CallAcceptException(String callId, String message, Throwable cause) {
        super(message, cause);
        this.callId = callId;
        this.attempts = 0;
        this.statusCode = CallControlException.NO_RESPONSE;
    }

    public String getCallId() {
        return callId;
    }

    public int getAttempts() {
        return attempts;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
