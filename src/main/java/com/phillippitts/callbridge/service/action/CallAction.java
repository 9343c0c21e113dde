package com.phillippitts.callbridge.service.action;

import org.json.JSONObject;

/**
 * A side effect the conversational AI may request during a call.
 *
 * <p>Implementations are Spring beans; the dispatcher discovers them by {@link #name()}
 * and advertises their {@link #toolDefinition()} when a call is accepted.
 */
public interface CallAction {

    /** Tool name the AI uses to invoke this action. */
    String name();

    /** Function tool declaration sent with the accept request. */
    JSONObject toolDefinition();

    /**
     * Validates and executes the action once.
     *
     * @param callId    call the action applies to
     * @param arguments parsed arguments
     * @return structured result relayed to the AI; never null
     */
    JSONObject execute(String callId, JSONObject arguments);
}
