package com.phillippitts.callbridge.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Connection and session settings for the realtime AI backend.
 */
@Validated
@ConfigurationProperties(prefix = "callbridge.realtime")
public class RealtimeProperties {

    /** Bearer credential for the call-control API and realtime streams. */
    @NotBlank(message = "callbridge.realtime.api-key must be configured")
    private String apiKey;

    @NotBlank
    private String apiBaseUrl = "https://api.openai.com/v1";

    @NotBlank
    private String websocketUrl = "wss://api.openai.com/v1/realtime";

    @NotBlank
    private String model = "gpt-4o-realtime-preview-2024-12-17";

    @NotBlank
    private String voice = "shimmer";

    /** Audio codec for both directions of the carrier leg. */
    @NotBlank
    private String audioFormat = "audio/pcmu";

    /** Turn detection mode sent with the accept request. */
    @NotBlank
    private String turnDetection = "server_vad";

    /** Connect and read timeout for outbound HTTP calls. */
    @Positive
    private int requestTimeoutMs = 10_000;

    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public String getApiBaseUrl() {
        return apiBaseUrl;
    }

    public void setApiBaseUrl(String apiBaseUrl) {
        this.apiBaseUrl = apiBaseUrl;
    }

    public String getWebsocketUrl() {
        return websocketUrl;
    }

    public void setWebsocketUrl(String websocketUrl) {
        this.websocketUrl = websocketUrl;
    }

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    public String getVoice() {
        return voice;
    }

    public void setVoice(String voice) {
        this.voice = voice;
    }

    public String getAudioFormat() {
        return audioFormat;
    }

    public void setAudioFormat(String audioFormat) {
        this.audioFormat = audioFormat;
    }

    public String getTurnDetection() {
        return turnDetection;
    }

    public void setTurnDetection(String turnDetection) {
        this.turnDetection = turnDetection;
    }

    public int getRequestTimeoutMs() {
        return requestTimeoutMs;
    }

    public void setRequestTimeoutMs(int requestTimeoutMs) {
        this.requestTimeoutMs = requestTimeoutMs;
    }
}
