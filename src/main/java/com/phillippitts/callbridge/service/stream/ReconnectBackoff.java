package com.phillippitts.callbridge.service.stream;

import java.time.Duration;

/**
 * Capped exponential backoff: {@code base * 2^(attempt-1)}, never above {@code max}.
 */
public final class ReconnectBackoff {

    private final long baseDelayMs;
    private final long maxDelayMs;

    public ReconnectBackoff(long baseDelayMs, long maxDelayMs) {
        if (baseDelayMs <= 0 || maxDelayMs <= 0) {
            throw new IllegalArgumentException("Backoff delays must be positive");
        }
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = Math.max(baseDelayMs, maxDelayMs);
    }

    /**
     * Delay before reconnect attempt {@code attempt} (1-based).
     */
    public Duration delayFor(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be >= 1, got: " + attempt);
        }
        // 2^62 overflows once multiplied; anything past that is capped anyway
        int shift = Math.min(attempt - 1, 62);
        long factor = 1L << shift;
        long delay = baseDelayMs > maxDelayMs / factor ? maxDelayMs : baseDelayMs * factor;
        return Duration.ofMillis(Math.min(delay, maxDelayMs));
    }
}
