package com.phillippitts.callbridge.service.stream;

/**
 * Callbacks from a realtime stream connection. Invoked on transport threads; implementations
 * must hand work off rather than block.
 */
public interface StreamListener {

    void onMessage(String payload);

    void onClose(int code, String reason);

    void onError(Throwable error);

    default void onPong() {
    }
}
