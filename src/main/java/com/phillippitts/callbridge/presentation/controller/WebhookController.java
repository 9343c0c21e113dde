package com.phillippitts.callbridge.presentation.controller;

import com.phillippitts.callbridge.exception.InvalidSignatureException;
import com.phillippitts.callbridge.service.lifecycle.CallLifecycleController;
import com.phillippitts.callbridge.service.lifecycle.WebhookEvent;
import com.phillippitts.callbridge.service.metrics.CallMetrics;
import com.phillippitts.callbridge.service.security.WebhookSignatureVerifier;
import com.phillippitts.callbridge.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

import java.util.Optional;

/**
 * Receives signed control events from the call-control system.
 *
 * <p>The raw body is verified before it is parsed; an event that fails verification never
 * reaches the lifecycle controller.
 */
@RestController
class WebhookController {

    private static final Logger LOG = LogManager.getLogger(WebhookController.class);
    private static final int BODY_LOG_LIMIT = 200;

    private final WebhookSignatureVerifier verifier;
    private final CallLifecycleController lifecycle;
    private final CallMetrics metrics;

    WebhookController(WebhookSignatureVerifier verifier, CallLifecycleController lifecycle, CallMetrics metrics) {
        this.verifier = verifier;
        this.lifecycle = lifecycle;
        this.metrics = metrics;
    }

    @PostMapping("/openai-webhook")
    ResponseEntity<String> receive(@RequestHeader(name = "webhook-id", required = false) String webhookId,
                                   @RequestHeader(name = "webhook-timestamp", required = false) String timestamp,
                                   @RequestHeader(name = "webhook-signature", required = false) String signature,
                                   @RequestBody(required = false) String rawBody) {
        String body = rawBody != null ? rawBody : "";
        if (!verifier.verify(webhookId, timestamp, signature, body)) {
            metrics.incrementWebhookRejected();
            throw new InvalidSignatureException(webhookId);
        }

        Optional<WebhookEvent> event = WebhookEvent.parse(body);
        if (event.isEmpty()) {
            LOG.warn("Acknowledging unparseable webhook body: {}", LogSanitizer.truncate(body, BODY_LOG_LIMIT));
            return ResponseEntity.ok("ok");
        }
        lifecycle.handle(event.get());
        return ResponseEntity.ok("ok");
    }
}
