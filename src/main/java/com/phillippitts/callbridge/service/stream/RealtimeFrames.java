package com.phillippitts.callbridge.service.stream;

import org.json.JSONException;
import org.json.JSONObject;

import java.util.Optional;

/**
 * Builders and parsing for realtime JSON event frames.
 *
 * <p>Thread-safe: All methods are static and stateless.
 */
public final class RealtimeFrames {

    public static final String SPEECH_STARTED = "input_audio_buffer.speech_started";
    public static final String SPEECH_STOPPED = "input_audio_buffer.speech_stopped";
    public static final String RESPONSE_CREATED = "response.created";
    public static final String RESPONSE_DONE = "response.done";
    public static final String FUNCTION_CALL_ARGUMENTS_DONE = "response.function_call_arguments.done";

    static final String RESPONSE_CREATE = "response.create";
    static final String OUTPUT_AUDIO_BUFFER_CLEAR = "output_audio_buffer.clear";
    static final String CONVERSATION_ITEM_CREATE = "conversation.item.create";
    static final String FUNCTION_CALL_OUTPUT = "function_call_output";

    private RealtimeFrames() {
        // Utility class - prevent instantiation
    }

    /**
     * Parses a text frame. Returns empty for blank or malformed input.
     */
    public static Optional<JSONObject> parse(String payload) {
        if (payload == null || payload.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(new JSONObject(payload));
        } catch (JSONException ex) {
            return Optional.empty();
        }
    }

    public static String typeOf(JSONObject frame) {
        return frame.optString("type", "");
    }

    /** Asks the AI to speak the greeting verbatim. */
    public static String speakInstruction(String greetingText) {
        JSONObject response = new JSONObject();
        response.put("instructions", "Say to the caller: '" + greetingText + "'");
        return new JSONObject()
                .put("type", RESPONSE_CREATE)
                .put("response", response)
                .toString();
    }

    /** Cuts off audio playback when the caller starts talking over the AI. */
    public static String bufferClear() {
        return new JSONObject().put("type", OUTPUT_AUDIO_BUFFER_CLEAR).toString();
    }

    /**
     * Function result correlated to the AI's own function-call id.
     */
    public static String functionOutput(String correlationId, JSONObject output) {
        JSONObject item = new JSONObject()
                .put("type", FUNCTION_CALL_OUTPUT)
                .put("call_id", correlationId)
                .put("output", output.toString());
        return new JSONObject()
                .put("type", CONVERSATION_ITEM_CREATE)
                .put("item", item)
                .toString();
    }

    /** Asks the AI to continue the conversation after a function result. */
    public static String continueResponse() {
        return new JSONObject().put("type", RESPONSE_CREATE).toString();
    }
}
