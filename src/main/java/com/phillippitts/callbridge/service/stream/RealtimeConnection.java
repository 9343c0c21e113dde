package com.phillippitts.callbridge.service.stream;

import com.phillippitts.callbridge.exception.StreamConnectionException;

/**
 * One open bidirectional event channel to the realtime backend.
 */
public interface RealtimeConnection {

    /** Close code for a normal, intentional shutdown. */
    int NORMAL_CLOSURE = 1000;

    /**
     * Sends one JSON text frame. Safe to call from multiple threads.
     *
     * @throws StreamConnectionException if the frame could not be written
     */
    void send(String frame);

    /**
     * Sends a transport-level ping used for liveness only.
     */
    void ping();

    /**
     * Closes the connection with the given code. Closing an already closed connection is a no-op.
     */
    void close(int code);

    boolean isOpen();
}
