package com.phillippitts.callbridge.config.properties;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Retry policy for accepting a call that the remote side does not know about yet.
 */
@Validated
@ConfigurationProperties(prefix = "callbridge.accept")
public class CallAcceptProperties {

    /** Total accept attempts, including the first. */
    @Positive(message = "Max accept attempts must be positive")
    private int maxAttempts = 3;

    /** Fixed wait before each retry after a not-ready answer. */
    @Min(0)
    private long retryDelayMs = 500;

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public long getRetryDelayMs() {
        return retryDelayMs;
    }

    public void setRetryDelayMs(long retryDelayMs) {
        this.retryDelayMs = retryDelayMs;
    }
}
