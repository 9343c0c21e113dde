package com.phillippitts.callbridge.service.lifecycle;

import org.json.JSONException;
import org.json.JSONObject;

import java.util.Optional;

/**
 * A verified control event envelope {@code {type, data}}.
 *
 * @param type     raw event type, e.g. {@code realtime.call.incoming}
 * @param kind     classified type
 * @param data     event payload, empty object when absent
 */
public record WebhookEvent(String type, WebhookEventType kind, JSONObject data) {

    static final String UNKNOWN = "unknown";

    /**
     * Parses a raw webhook body. Returns empty when the body is not a JSON object.
     */
    public static Optional<WebhookEvent> parse(String rawBody) {
        if (rawBody == null || rawBody.isBlank()) {
            return Optional.empty();
        }
        try {
            JSONObject envelope = new JSONObject(rawBody);
            String type = envelope.optString("type", "");
            JSONObject data = envelope.optJSONObject("data");
            return Optional.of(new WebhookEvent(type, WebhookEventType.fromType(type),
                    data != null ? data : new JSONObject()));
        } catch (JSONException ex) {
            return Optional.empty();
        }
    }

    /**
     * Call id from {@code data.call_id}, falling back to {@code data.call.id}.
     */
    public Optional<String> callId() {
        String id = data.optString("call_id", "");
        if (id.isBlank()) {
            JSONObject call = data.optJSONObject("call");
            id = call != null ? call.optString("id", "") : "";
        }
        return id.isBlank() ? Optional.empty() : Optional.of(id);
    }

    public String sessionId() {
        String id = data.optString("session_id", "");
        if (id.isBlank()) {
            JSONObject session = data.optJSONObject("session");
            id = session != null ? session.optString("id", "") : "";
        }
        return id.isBlank() ? UNKNOWN : id;
    }

    public String leg() {
        return data.optString("leg", "?");
    }

    /**
     * First of {@code status}, {@code connection_state} or {@code reason} present in the payload.
     */
    public String status() {
        for (String key : new String[] {"status", "connection_state", "reason"}) {
            String value = data.optString(key, "");
            if (!value.isBlank()) {
                return value;
            }
        }
        return "";
    }

    /**
     * Whether this is a session update that declares a tool list.
     */
    public boolean hasSessionTools() {
        JSONObject session = data.optJSONObject("session");
        return session != null && session.has("tools") && !session.isNull("tools");
    }

    public boolean isRealtimeNamespace() {
        return type.startsWith("realtime.");
    }
}
