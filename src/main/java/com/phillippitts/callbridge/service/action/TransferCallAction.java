package com.phillippitts.callbridge.service.action;

import com.phillippitts.callbridge.domain.TransferDestination;
import com.phillippitts.callbridge.domain.TransferRequest;
import com.phillippitts.callbridge.domain.TransferResult;
import com.phillippitts.callbridge.exception.CallControlException;
import com.phillippitts.callbridge.service.callcontrol.CallControlClient;
import com.phillippitts.callbridge.service.data.DestinationResolver;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONObject;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Transfers the live call to a configured destination.
 *
 * <p>The destination key is resolved locally first; an unknown key fails without any outbound
 * request. Success is reported only after the call-control API acknowledges the refer.
 */
@Component
public class TransferCallAction implements CallAction {

    private static final Logger LOG = LogManager.getLogger(TransferCallAction.class);

    public static final String NAME = "transfer_call";
    static final String DESTINATION_ARG = "destination";

    private final DestinationResolver resolver;
    private final CallControlClient callControl;

    public TransferCallAction(DestinationResolver resolver, CallControlClient callControl) {
        this.resolver = resolver;
        this.callControl = callControl;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public JSONObject toolDefinition() {
        Map<String, TransferDestination> destinations = resolver.all();
        String options = destinations.values().stream()
                .map(d -> d.key() + " (" + d.name() + ")")
                .collect(Collectors.joining(", "));

        JSONObject destination = new JSONObject()
                .put("type", "string")
                .put("enum", new JSONArray(destinations.keySet()))
                .put("description", "The person or department to transfer to. Options: " + options);
        JSONObject parameters = new JSONObject()
                .put("type", "object")
                .put("properties", new JSONObject().put(DESTINATION_ARG, destination))
                .put("required", new JSONArray().put(DESTINATION_ARG));

        return new JSONObject()
                .put("type", "function")
                .put("name", NAME)
                .put("description", "Transfer the current call to another team member or department. "
                        + "Use this when the caller asks to speak with someone specific or needs specialized help.")
                .put("parameters", parameters);
    }

    @Override
    public JSONObject execute(String callId, JSONObject arguments) {
        return transfer(new TransferRequest(callId, arguments.optString(DESTINATION_ARG, ""))).toJson();
    }

    TransferResult transfer(TransferRequest request) {
        LOG.info("Attempting transfer of call={} to key={}", request.callId(), request.destinationKey());
        Optional<TransferDestination> resolved = resolver.resolve(request.destinationKey());
        if (resolved.isEmpty()) {
            LOG.error("Transfer destination not found: {}", request.destinationKey());
            return TransferResult.failed("Transfer destination \"" + request.destinationKey() + "\" not found");
        }

        TransferDestination destination = resolved.get();
        try {
            callControl.refer(request.callId(), destination.targetUri());
            LOG.info("Transfer initiated for call={} to {}", request.callId(), destination.name());
            return TransferResult.succeeded(destination.name());
        } catch (CallControlException ex) {
            LOG.error("Transfer failed for call={}: {}", request.callId(), ex.getMessage());
            return TransferResult.failed("Transfer error: " + ex.getMessage());
        }
    }
}
