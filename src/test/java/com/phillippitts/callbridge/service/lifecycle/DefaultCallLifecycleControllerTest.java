package com.phillippitts.callbridge.service.lifecycle;

import com.phillippitts.callbridge.config.properties.CallAcceptProperties;
import com.phillippitts.callbridge.config.properties.RealtimeProperties;
import com.phillippitts.callbridge.domain.Call;
import com.phillippitts.callbridge.domain.LifecycleStage;
import com.phillippitts.callbridge.exception.CallAcceptException;
import com.phillippitts.callbridge.service.action.ActionDispatcher;
import com.phillippitts.callbridge.service.callcontrol.SessionConfigFactory;
import com.phillippitts.callbridge.service.data.InstructionBuilder;
import com.phillippitts.callbridge.service.metrics.CallMetrics;
import com.phillippitts.callbridge.service.registry.CallRegistry;
import com.phillippitts.callbridge.service.stream.SessionStreamManager;
import com.phillippitts.callbridge.testutil.FakeCallControlClient;
import com.phillippitts.callbridge.testutil.RecordingSleeper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class DefaultCallLifecycleControllerTest {

    private static final String CALL_ID = "rtc_c1";

    private CallRegistry registry;
    private SessionStreamManager streams;
    private FakeCallControlClient callControl;
    private InstructionBuilder instructionBuilder;
    private ActionDispatcher dispatcher;
    private RecordingSleeper sleeper;
    private SimpleMeterRegistry meters;
    private DefaultCallLifecycleController controller;

    @BeforeEach
    void setUp() {
        registry = new CallRegistry();
        streams = mock(SessionStreamManager.class);
        when(streams.openFunctionStream(anyString())).thenReturn(new CompletableFuture<>());
        when(streams.openGreetingStream(anyString(), anyString())).thenReturn(CompletableFuture.completedFuture(true));
        callControl = new FakeCallControlClient();
        instructionBuilder = mock(InstructionBuilder.class);
        when(instructionBuilder.buildInstructions(anyString())).thenReturn("You are a receptionist.");
        when(instructionBuilder.buildGreeting(anyString())).thenReturn("Thank you for calling!");
        dispatcher = mock(ActionDispatcher.class);
        when(dispatcher.toolDefinitions()).thenReturn(new JSONArray().put(new JSONObject().put("name", "transfer_call")));
        sleeper = new RecordingSleeper();
        meters = new SimpleMeterRegistry();

        CallAcceptProperties acceptProps = new CallAcceptProperties();
        acceptProps.setMaxAttempts(3);
        acceptProps.setRetryDelayMs(500);

        controller = new DefaultCallLifecycleController(registry, streams, callControl,
                new SessionConfigFactory(new RealtimeProperties()), instructionBuilder, dispatcher,
                acceptProps, new CallMetrics(meters), sleeper);
    }

    private static WebhookEvent event(String type, JSONObject data) {
        return WebhookEvent.parse(new JSONObject().put("type", type).put("data", data).toString()).orElseThrow();
    }

    private static WebhookEvent incoming(String callId, String from) {
        JSONArray headers = new JSONArray()
                .put(new JSONObject().put("name", "From").put("value", "<sip:" + from + "@carrier.example>"))
                .put(new JSONObject().put("name", "X-Twilio-CallSid").put("value", "CA123"));
        return event("realtime.call.incoming", new JSONObject().put("call_id", callId).put("sip_headers", headers));
    }

    @Test
    void incomingCallIsAcceptedAndStreamsLaunched() {
        controller.handle(incoming(CALL_ID, "+15551234567"));

        Call call = registry.get(CALL_ID).orElseThrow();
        assertThat(call.stage()).isEqualTo(LifecycleStage.ACTIVE);
        assertThat(call.callerIdentifier()).isEqualTo("15551234567");
        assertThat(callControl.acceptCount()).isEqualTo(1);
        JSONObject payload = callControl.acceptPayloads().get(0);
        assertThat(payload.getString("instructions")).isEqualTo("You are a receptionist.");
        assertThat(payload.getJSONArray("tools").length()).isEqualTo(1);
        verify(instructionBuilder).buildInstructions("15551234567");
        verify(streams).openFunctionStream(CALL_ID);
        verify(streams).openGreetingStream(CALL_ID, "Thank you for calling!");
        assertThat(sleeper.sleeps()).isEmpty();
        assertThat(meters.counter("callbridge.call.accept", "outcome", "accepted").count()).isEqualTo(1.0);
    }

    @Test
    void notReadyAcceptIsRetriedWithFixedDelay() {
        callControl.scriptAccept(404, 404, 200);

        controller.handle(incoming(CALL_ID, "+15551234567"));

        assertThat(callControl.acceptCount()).isEqualTo(3);
        assertThat(sleeper.sleeps()).containsExactly(Duration.ofMillis(500), Duration.ofMillis(500));
        assertThat(registry.get(CALL_ID).orElseThrow().stage()).isEqualTo(LifecycleStage.ACTIVE);
        verify(streams).openFunctionStream(CALL_ID);
    }

    @Test
    void notReadyOnEveryAttemptFailsAfterMaxAttempts() {
        callControl.scriptAccept(404, 404, 404, 404);

        assertThatThrownBy(() -> controller.handle(incoming(CALL_ID, "+15551234567")))
                .isInstanceOfSatisfying(CallAcceptException.class, ex -> {
                    assertThat(ex.getAttempts()).isEqualTo(3);
                    assertThat(ex.getStatusCode()).isEqualTo(404);
                });

        assertThat(callControl.acceptCount()).isEqualTo(3);
        assertThat(registry.contains(CALL_ID)).isFalse();
        verify(streams, never()).openFunctionStream(anyString());
        assertThat(meters.counter("callbridge.call.accept", "outcome", "failed").count()).isEqualTo(1.0);
    }

    @Test
    void nonRetryableAcceptFailureIsNotRetried() {
        callControl.scriptAccept(500);

        assertThatThrownBy(() -> controller.handle(incoming(CALL_ID, "+15551234567")))
                .isInstanceOf(CallAcceptException.class)
                .hasMessageContaining(CALL_ID);

        assertThat(callControl.acceptCount()).isEqualTo(1);
        assertThat(sleeper.sleeps()).isEmpty();
        assertThat(registry.contains(CALL_ID)).isFalse();
    }

    @Test
    void callEndingDuringRetryWaitStopsAccepting() {
        callControl.scriptAccept(404, 200);
        DefaultCallLifecycleController endingController = new DefaultCallLifecycleController(registry, streams,
                callControl, new SessionConfigFactory(new RealtimeProperties()), instructionBuilder, dispatcher,
                new CallAcceptProperties(), new CallMetrics(meters), d -> registry.remove(CALL_ID));

        endingController.handle(incoming(CALL_ID, "+15551234567"));

        assertThat(callControl.acceptCount()).isEqualTo(1);
        verify(streams, never()).openFunctionStream(anyString());
    }

    @Test
    void duplicateIncomingLeavesLiveCallUntouched() {
        controller.handle(incoming(CALL_ID, "+15551234567"));
        registry.update(CALL_ID, c -> c.withGreeted(true));

        controller.handle(incoming(CALL_ID, "+15559999999"));

        Call call = registry.get(CALL_ID).orElseThrow();
        assertThat(call.callerIdentifier()).isEqualTo("15551234567");
        assertThat(call.greeted()).isTrue();
        assertThat(callControl.acceptCount()).isEqualTo(1);
    }

    @Test
    void callerWithoutNumberUsesUnknownIdentifier() {
        controller.handle(event("realtime.call.incoming", new JSONObject().put("call_id", CALL_ID)));

        assertThat(registry.get(CALL_ID).orElseThrow().callerIdentifier()).isEqualTo("unknown");
        verify(instructionBuilder).buildGreeting("unknown");
    }

    @Test
    void terminalEventStopsStreamsAndRemovesCall() {
        controller.handle(incoming(CALL_ID, "+15551234567"));

        controller.handle(event("realtime.call.ended", new JSONObject().put("call_id", CALL_ID)));

        assertThat(registry.contains(CALL_ID)).isFalse();
        verify(streams).stopStreams(CALL_ID);
    }

    @Test
    void participantDisconnectIsTerminal() {
        registry.insertIfAbsent(Call.incoming(CALL_ID, "15551234567", Instant.now()).withStage(LifecycleStage.ACTIVE));

        controller.handle(event("realtime.call.participant.disconnected",
                new JSONObject().put("call", new JSONObject().put("id", CALL_ID))));

        assertThat(registry.contains(CALL_ID)).isFalse();
    }

    @Test
    void terminalEventForUnknownCallIsHarmless() {
        controller.handle(event("realtime.call.ended", new JSONObject().put("call_id", "never-seen")));

        assertThat(registry.size()).isZero();
        verify(streams).stopStreams("never-seen");
    }

    @Test
    void sessionUpdateWithToolsStartsFunctionStreamForActiveCall() {
        registry.insertIfAbsent(Call.incoming(CALL_ID, "15551234567", Instant.now()).withStage(LifecycleStage.ACTIVE));
        JSONObject data = new JSONObject().put("call_id", CALL_ID)
                .put("session", new JSONObject().put("tools", new JSONArray()));

        controller.handle(event("realtime.session.updated", data));

        verify(streams).openFunctionStream(CALL_ID);
    }

    @Test
    void sessionUpdateWithoutToolsOrForInactiveCallIsIgnored() {
        registry.insertIfAbsent(Call.incoming(CALL_ID, "15551234567", Instant.now()));

        controller.handle(event("realtime.session.updated", new JSONObject().put("call_id", CALL_ID)
                .put("session", new JSONObject().put("tools", new JSONArray()))));
        controller.handle(event("realtime.session.updated", new JSONObject().put("call_id", CALL_ID)));

        verify(streams, never()).openFunctionStream(anyString());
    }

    @Test
    void unknownAndCallIdlessEventsAreAcknowledgedWithoutEffect() {
        controller.handle(event("realtime.response.done", new JSONObject().put("call_id", CALL_ID)));
        controller.handle(event("batch.completed", new JSONObject()));
        controller.handle(event("realtime.call.incoming", new JSONObject()));

        assertThat(registry.size()).isZero();
        assertThat(callControl.acceptCount()).isZero();
        verifyNoInteractions(streams);
    }
}
