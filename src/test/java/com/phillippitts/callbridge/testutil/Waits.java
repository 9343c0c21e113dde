package com.phillippitts.callbridge.testutil;

import java.util.function.BooleanSupplier;

/**
 * Polling helper for assertions on work done by background threads.
 */
public final class Waits {

    private static final long POLL_MILLIS = 5;

    private Waits() {}

    /**
     * Polls until the condition holds or the timeout passes.
     *
     * @return true if the condition held in time
     */
    public static boolean until(BooleanSupplier condition, long timeoutMillis) {
        long deadline = System.currentTimeMillis() + timeoutMillis;
        while (System.currentTimeMillis() < deadline) {
            if (condition.getAsBoolean()) {
                return true;
            }
            try {
                Thread.sleep(POLL_MILLIS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
        return condition.getAsBoolean();
    }
}
