package com.phillippitts.callbridge.exception;

/**
 * Thrown when an inbound webhook fails signature verification.
 * The event is rejected before any of it is interpreted.
 */
public class InvalidSignatureException extends CallBridgeException {

    private final String webhookId;

    public InvalidSignatureException(String webhookId) {
        super("Webhook signature verification failed (webhook-id: " + webhookId + ")");
        this.webhookId = webhookId;
    }

    public String getWebhookId() {
        return webhookId;
    }
}
