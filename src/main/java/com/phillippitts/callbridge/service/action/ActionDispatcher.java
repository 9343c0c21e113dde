package com.phillippitts.callbridge.service.action;

import com.phillippitts.callbridge.service.stream.RealtimeConnection;
import org.json.JSONArray;

/**
 * Executes AI-requested actions and writes their results back on the same stream.
 *
 * <p>Each request is executed at most once. Nothing is replayed after a reconnect; a request
 * lost with a dropped connection is not retried.
 */
public interface ActionDispatcher {

    /**
     * Looks up, executes and answers one function call. Results are sent as a function-output
     * item followed by a continue-response instruction. When the call has already been closed
     * or the connection is gone by the time the action finishes, the result is discarded.
     *
     * @param callId     call the request arrived on
     * @param request    function call read from the stream
     * @param connection stream to reply on
     */
    void dispatch(String callId, FunctionCallRequest request, RealtimeConnection connection);

    /**
     * Tool declarations for every registered action.
     */
    JSONArray toolDefinitions();
}
