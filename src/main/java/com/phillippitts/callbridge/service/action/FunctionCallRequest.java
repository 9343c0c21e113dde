package com.phillippitts.callbridge.service.action;

import org.json.JSONObject;

/**
 * An action the AI asked for, as read off a completed function-call frame.
 *
 * @param correlationId the AI's function-call id, echoed back with the result
 * @param name          action name, e.g. {@code transfer_call}
 * @param arguments     raw JSON arguments string
 */
public record FunctionCallRequest(String correlationId, String name, String arguments) {

    public static FunctionCallRequest fromFrame(JSONObject frame) {
        return new FunctionCallRequest(
                frame.optString("call_id", ""),
                frame.optString("name", ""),
                frame.optString("arguments", ""));
    }
}
