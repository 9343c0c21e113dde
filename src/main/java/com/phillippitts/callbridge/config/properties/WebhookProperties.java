package com.phillippitts.callbridge.config.properties;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Webhook verification settings.
 *
 * <p>The secret is required: the application refuses to start without it rather than
 * accepting unsigned control events.
 */
@Validated
@ConfigurationProperties(prefix = "callbridge.webhook")
public class WebhookProperties {

    /** Shared signing secret, optionally carrying {@link #secretPrefix}, base64 encoded. */
    @NotBlank(message = "callbridge.webhook.secret must be configured")
    private String secret;

    /** Prefix stripped from the configured secret before base64 decoding. */
    private String secretPrefix = "whsec_";

    public String getSecret() {
        return secret;
    }

    public void setSecret(String secret) {
        this.secret = secret;
    }

    public String getSecretPrefix() {
        return secretPrefix;
    }

    public void setSecretPrefix(String secretPrefix) {
        this.secretPrefix = secretPrefix;
    }
}
