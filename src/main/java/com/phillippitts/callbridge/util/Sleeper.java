package com.phillippitts.callbridge.util;

import java.time.Duration;

/**
 * Blocking pause, injectable so tests can observe waits without spending wall-clock time.
 */
@FunctionalInterface
public interface Sleeper {

    /** Sleeps on the current thread. */
    Sleeper SYSTEM = duration -> {
        if (!duration.isNegative() && !duration.isZero()) {
            Thread.sleep(duration.toMillis());
        }
    };

    void sleep(Duration duration) throws InterruptedException;
}
