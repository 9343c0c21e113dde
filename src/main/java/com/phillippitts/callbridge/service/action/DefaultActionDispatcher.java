package com.phillippitts.callbridge.service.action;

import com.phillippitts.callbridge.service.metrics.CallMetrics;
import com.phillippitts.callbridge.service.registry.CallRegistry;
import com.phillippitts.callbridge.service.stream.RealtimeConnection;
import com.phillippitts.callbridge.service.stream.RealtimeFrames;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Default {@link ActionDispatcher}: routes function calls to {@link CallAction} beans by name.
 *
 * <p>Runs on the function stream's supervisor thread, so requests from one stream execute one
 * at a time in arrival order. Unknown names and malformed arguments produce a failure result
 * relayed to the AI rather than an exception.
 */
@Service
public class DefaultActionDispatcher implements ActionDispatcher {

    private static final Logger LOG = LogManager.getLogger(DefaultActionDispatcher.class);

    private final Map<String, CallAction> actions = new LinkedHashMap<>();
    private final CallRegistry registry;
    private final CallMetrics metrics;

    public DefaultActionDispatcher(List<CallAction> actions, CallRegistry registry, CallMetrics metrics) {
        for (CallAction action : actions) {
            CallAction previous = this.actions.putIfAbsent(action.name(), action);
            if (previous != null) {
                throw new IllegalStateException("Duplicate action name: " + action.name());
            }
        }
        this.registry = registry;
        this.metrics = metrics;
        LOG.info("Registered call actions: {}", this.actions.keySet());
    }

    @Override
    public void dispatch(String callId, FunctionCallRequest request, RealtimeConnection connection) {
        JSONObject output = execute(callId, request);

        // The call may have ended while the action ran
        if (!registry.contains(callId) || !connection.isOpen()) {
            LOG.warn("Discarding result of {} for call={}; call closed before completion", request.name(), callId);
            metrics.recordAction(request.name(), "discarded");
            return;
        }
        try {
            connection.send(RealtimeFrames.functionOutput(request.correlationId(), output));
            connection.send(RealtimeFrames.continueResponse());
        } catch (RuntimeException ex) {
            LOG.warn("Failed to relay result of {} for call={}: {}", request.name(), callId, ex.getMessage());
            metrics.recordAction(request.name(), "undelivered");
            return;
        }
        metrics.recordAction(request.name(), output.optBoolean("success", false) ? "success" : "failure");
    }

    private JSONObject execute(String callId, FunctionCallRequest request) {
        CallAction action = actions.get(request.name());
        if (action == null) {
            LOG.warn("Unknown action '{}' requested on call={}", request.name(), callId);
            return failure("Unknown function: " + request.name());
        }
        JSONObject arguments;
        try {
            arguments = request.arguments().isBlank() ? new JSONObject() : new JSONObject(request.arguments());
        } catch (JSONException ex) {
            LOG.warn("Malformed arguments for {} on call={}: {}", request.name(), callId, ex.getMessage());
            return failure("Invalid arguments for " + request.name());
        }
        try {
            return action.execute(callId, arguments);
        } catch (RuntimeException ex) {
            LOG.error("Action {} failed on call={}", request.name(), callId, ex);
            return failure(request.name() + " failed: " + ex.getMessage());
        }
    }

    private static JSONObject failure(String message) {
        return new JSONObject().put("success", false).put("message", message);
    }

    @Override
    public JSONArray toolDefinitions() {
        JSONArray tools = new JSONArray();
        actions.values().forEach(a -> tools.put(a.toolDefinition()));
        return tools;
    }
}
