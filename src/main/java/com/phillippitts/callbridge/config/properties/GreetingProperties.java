package com.phillippitts.callbridge.config.properties;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Greeting stream pacing.
 */
@Validated
@ConfigurationProperties(prefix = "callbridge.greeting")
public class GreetingProperties {

    /** Pause before connecting, so the caller hears the greeting after the line settles. */
    @Min(0)
    private long delayMs = 400;

    /** How long the greeting connection stays open after sending, to let delivery finish. */
    @Min(0)
    private long closeGraceMs = 1000;

    @Positive
    private long connectTimeoutMs = 5000;

    public long getDelayMs() {
        return delayMs;
    }

    public void setDelayMs(long delayMs) {
        this.delayMs = delayMs;
    }

    public long getCloseGraceMs() {
        return closeGraceMs;
    }

    public void setCloseGraceMs(long closeGraceMs) {
        this.closeGraceMs = closeGraceMs;
    }

    public long getConnectTimeoutMs() {
        return connectTimeoutMs;
    }

    public void setConnectTimeoutMs(long connectTimeoutMs) {
        this.connectTimeoutMs = connectTimeoutMs;
    }
}
