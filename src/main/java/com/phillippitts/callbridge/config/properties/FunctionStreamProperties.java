package com.phillippitts.callbridge.config.properties;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Reconnect, heartbeat and timeout settings for the long-lived function-call stream.
 */
@Validated
@ConfigurationProperties(prefix = "callbridge.function-stream")
public class FunctionStreamProperties {

    /** Reconnects allowed after an abnormal disconnect before the stream is abandoned. */
    @Min(0)
    private int maxReconnectAttempts = 5;

    /** Delay before the first reconnect; doubles on each further attempt. */
    @Positive
    private long baseDelayMs = 500;

    /** Upper bound for the reconnect delay. */
    @Positive
    private long maxDelayMs = 8000;

    /** Interval between application-level pings while the stream is open. */
    @Positive
    private long heartbeatIntervalMs = 15_000;

    @Positive
    private long connectTimeoutMs = 10_000;

    public int getMaxReconnectAttempts() {
        return maxReconnectAttempts;
    }

    public void setMaxReconnectAttempts(int maxReconnectAttempts) {
        this.maxReconnectAttempts = maxReconnectAttempts;
    }

    public long getBaseDelayMs() {
        return baseDelayMs;
    }

    public void setBaseDelayMs(long baseDelayMs) {
        this.baseDelayMs = baseDelayMs;
    }

    public long getMaxDelayMs() {
        return maxDelayMs;
    }

    public void setMaxDelayMs(long maxDelayMs) {
        this.maxDelayMs = maxDelayMs;
    }

    public long getHeartbeatIntervalMs() {
        return heartbeatIntervalMs;
    }

    public void setHeartbeatIntervalMs(long heartbeatIntervalMs) {
        this.heartbeatIntervalMs = heartbeatIntervalMs;
    }

    public long getConnectTimeoutMs() {
        return connectTimeoutMs;
    }

    public void setConnectTimeoutMs(long connectTimeoutMs) {
        this.connectTimeoutMs = connectTimeoutMs;
    }
}
