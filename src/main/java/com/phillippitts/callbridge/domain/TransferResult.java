package com.phillippitts.callbridge.domain;

import org.json.JSONObject;

/**
 * Outcome of a transfer attempt, relayed back to the conversational AI.
 *
 * @param success       true only when the call-control API acknowledged the transfer
 * @param message       human-readable outcome
 * @param transferredTo display name of the resolved destination, null on failure
 */
public record TransferResult(boolean success, String message, String transferredTo) {

    public static TransferResult succeeded(String destinationName) {
        return new TransferResult(true, "Call transferred to " + destinationName, destinationName);
    }

    public static TransferResult failed(String message) {
        return new TransferResult(false, message, null);
    }

    /**
     * JSON form used as the function-call output.
     */
    public JSONObject toJson() {
        JSONObject json = new JSONObject();
        json.put("success", success);
        json.put("message", message);
        if (transferredTo != null) {
            json.put("transferredTo", transferredTo);
        }
        return json;
    }
}
