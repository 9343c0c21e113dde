package com.phillippitts.callbridge.exception;

/**
 * Thrown when the remote call-control API answers with a non-2xx status or cannot be reached.
 */
public class CallControlException extends CallBridgeException {

    /** Status used when no HTTP response was received. */
    public static final int NO_RESPONSE = -1;

    private final int statusCode;
    private final String requestId;

    public CallControlException(String operation, int statusCode, String requestId, String body) {
        super(buildMessage(operation, statusCode, requestId, body));
        this.statusCode = statusCode;
        this.requestId = requestId;
    }

    public CallControlException(String operation, Throwable cause) {
        super(operation + " failed: " + cause.getMessage(), cause);
        this.statusCode = NO_RESPONSE;
        this.requestId = null;
    }

    public int getStatusCode() {
        return statusCode;
    }

    /**
     * Correlation id from the {@code x-request-id} response header, if any.
     */
    public String getRequestId() {
        return requestId;
    }

    public boolean isNotReady() {
        return statusCode == 404;
    }

    private static String buildMessage(String operation, int statusCode, String requestId, String body) {
        StringBuilder sb = new StringBuilder(operation).append(" failed (").append(statusCode).append(')');
        if (requestId != null && !requestId.isBlank()) {
            sb.append(" [request-id=").append(requestId).append(']');
        }
        if (body != null && !body.isBlank()) {
            sb.append(": ").append(body);
        }
        return sb.toString();
    }
}
