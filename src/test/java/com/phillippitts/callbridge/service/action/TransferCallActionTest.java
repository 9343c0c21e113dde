package com.phillippitts.callbridge.service.action;

import com.phillippitts.callbridge.domain.TransferDestination;
import com.phillippitts.callbridge.domain.TransferRequest;
import com.phillippitts.callbridge.domain.TransferResult;
import com.phillippitts.callbridge.service.data.DestinationResolver;
import com.phillippitts.callbridge.testutil.FakeCallControlClient;
import org.json.JSONObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

import static org.assertj.core.api.Assertions.assertThat;

class TransferCallActionTest {

    private FakeCallControlClient callControl;
    private TransferCallAction action;

    @BeforeEach
    void setUp() {
        Map<String, TransferDestination> destinations = new TreeMap<>();
        destinations.put("sales", new TransferDestination("sales", "Sales Team", "+15550100", "New business"));
        destinations.put("support", new TransferDestination("support", "Technical Support", "tel:+15550101", ""));
        DestinationResolver resolver = new DestinationResolver() {
            @Override
            public Optional<TransferDestination> resolve(String key) {
                return Optional.ofNullable(destinations.get(key));
            }

            @Override
            public Map<String, TransferDestination> all() {
                return destinations;
            }
        };
        callControl = new FakeCallControlClient();
        action = new TransferCallAction(resolver, callControl);
    }

    @Test
    void knownDestinationIsReferredAsTelUri() {
        TransferResult result = action.transfer(new TransferRequest("c1", "sales"));

        assertThat(result.success()).isTrue();
        assertThat(result.transferredTo()).isEqualTo("Sales Team");
        assertThat(result.message()).contains("Sales Team");
        assertThat(callControl.referTargets()).containsExactly("tel:+15550100");
    }

    @Test
    void existingTelPrefixIsNotDoubled() {
        action.transfer(new TransferRequest("c1", "support"));

        assertThat(callControl.referTargets()).containsExactly("tel:+15550101");
    }

    @Test
    void unknownDestinationFailsWithoutOutboundRequest() {
        TransferResult result = action.transfer(new TransferRequest("c1", "billing"));

        assertThat(result.success()).isFalse();
        assertThat(result.message()).isEqualTo("Transfer destination \"billing\" not found");
        assertThat(callControl.referCount()).isZero();
    }

    @Test
    void rejectedReferIsReportedAsFailure() {
        callControl.setReferStatus(400);

        TransferResult result = action.transfer(new TransferRequest("c1", "sales"));

        assertThat(result.success()).isFalse();
        assertThat(result.message()).startsWith("Transfer error: ").contains("400");
        assertThat(result.transferredTo()).isNull();
    }

    @Test
    void executeReadsDestinationArgument() {
        JSONObject output = action.execute("c1", new JSONObject().put("destination", "sales"));

        assertThat(output.getBoolean("success")).isTrue();
        assertThat(output.getString("transferredTo")).isEqualTo("Sales Team");
    }

    @Test
    void missingDestinationArgumentIsUnknownDestination() {
        JSONObject output = action.execute("c1", new JSONObject());

        assertThat(output.getBoolean("success")).isFalse();
        assertThat(output.has("transferredTo")).isFalse();
        assertThat(callControl.referCount()).isZero();
    }

    @Test
    void toolDefinitionEnumeratesConfiguredKeys() {
        JSONObject tool = action.toolDefinition();

        assertThat(tool.getString("name")).isEqualTo("transfer_call");
        JSONObject destination = tool.getJSONObject("parameters").getJSONObject("properties")
                .getJSONObject("destination");
        assertThat(destination.getJSONArray("enum").toList()).containsExactly("sales", "support");
        assertThat(destination.getString("description"))
                .contains("sales (Sales Team)", "support (Technical Support)");
    }
}
