package com.phillippitts.callbridge.service.security;

import com.phillippitts.callbridge.config.properties.WebhookProperties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

/**
 * Verifies that an inbound webhook was signed by the trusted event source.
 *
 * <p>Signing string is {@code webhookId + "." + timestamp + "." + rawBody}, signed with
 * HMAC-SHA256 using the base64-decoded secret (after stripping the configured prefix).
 * The signature header holds one or more space-separated {@code version,signature} pairs
 * so that keys can be rotated; any matching signature is accepted.
 *
 * <p>Missing headers, an unconfigured or undecodable secret, and mismatches all return
 * {@code false}. There is no bypass.
 *
 * <p><b>Thread Safety:</b> Stateless apart from the immutable decoded key; a new
 * {@link Mac} is created per call.
 */
@Component
public class WebhookSignatureVerifier {

    private static final Logger LOG = LogManager.getLogger(WebhookSignatureVerifier.class);
    private static final String HMAC_ALGORITHM = "HmacSHA256";

    private final byte[] key;

    public WebhookSignatureVerifier(WebhookProperties properties) {
        this.key = decodeSecret(properties.getSecret(), properties.getSecretPrefix());
    }

    /**
     * Returns true when the computed digest matches any signature in the header.
     *
     * @param webhookId       value of the {@code webhook-id} header
     * @param timestamp       value of the {@code webhook-timestamp} header
     * @param signatureHeader value of the {@code webhook-signature} header
     * @param rawBody         request body exactly as received
     * @return authentic verdict
     */
    public boolean verify(String webhookId, String timestamp, String signatureHeader, String rawBody) {
        if (isBlank(webhookId) || isBlank(timestamp) || isBlank(signatureHeader)) {
            LOG.warn("Missing signature headers: webhookId={}, timestamp={}, signaturePresent={}",
                    webhookId, timestamp, !isBlank(signatureHeader));
            return false;
        }
        if (key == null) {
            LOG.error("Webhook secret is not configured or not valid base64; rejecting event");
            return false;
        }

        String payload = webhookId + "." + timestamp + "." + (rawBody == null ? "" : rawBody);
        byte[] expected = hmac(payload);

        for (byte[] candidate : parseSignatures(signatureHeader)) {
            if (MessageDigest.isEqual(expected, candidate)) {
                return true;
            }
        }
        LOG.warn("Signature validation failed: webhookId={}, timestamp={}", webhookId, timestamp);
        return false;
    }

    /**
     * Extracts the decoded signatures from a header such as {@code "v1,abc= v1,def="}.
     * Entries that are not valid base64 are skipped.
     */
    static List<byte[]> parseSignatures(String signatureHeader) {
        List<byte[]> signatures = new ArrayList<>();
        for (String entry : signatureHeader.trim().split("\\s+")) {
            if (entry.isEmpty()) {
                continue;
            }
            int comma = entry.indexOf(',');
            String encoded = comma >= 0 ? entry.substring(comma + 1) : entry;
            try {
                signatures.add(Base64.getDecoder().decode(encoded));
            } catch (IllegalArgumentException ex) {
                LOG.debug("Skipping undecodable signature entry");
            }
        }
        return signatures;
    }

    private byte[] hmac(String payload) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(key, HMAC_ALGORITHM));
            return mac.doFinal(payload.getBytes(StandardCharsets.UTF_8));
        } catch (GeneralSecurityException ex) {
            throw new IllegalStateException("HmacSHA256 unavailable", ex);
        }
    }

    private static byte[] decodeSecret(String secret, String prefix) {
        if (isBlank(secret)) {
            return null;
        }
        String stripped = (prefix != null && !prefix.isEmpty() && secret.startsWith(prefix))
                ? secret.substring(prefix.length())
                : secret;
        try {
            byte[] decoded = Base64.getDecoder().decode(stripped.trim());
            return decoded.length == 0 ? null : decoded;
        } catch (IllegalArgumentException ex) {
            LOG.error("Webhook secret is not valid base64");
            return null;
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
