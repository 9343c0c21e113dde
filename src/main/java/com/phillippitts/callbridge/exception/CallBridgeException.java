package com.phillippitts.callbridge.exception;

/**
 * Base exception for all callbridge application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class CallBridgeException extends RuntimeException {

    public CallBridgeException(String message) {
        super(message);
    }

    public CallBridgeException(String message, Throwable cause) {
        super(message, cause);
    }

    public CallBridgeException(Throwable cause) {
        super(cause);
    }
}
