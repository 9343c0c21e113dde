package com.phillippitts.callbridge.domain;

/**
 * Connection state of a single stream.
 *
 * <pre>
 * CONNECTING → OPEN → CLOSED
 * CONNECTING → CLOSED (connect failure or timeout)
 * </pre>
 */
public enum StreamState {
    CONNECTING,
    OPEN,
    CLOSED
}
