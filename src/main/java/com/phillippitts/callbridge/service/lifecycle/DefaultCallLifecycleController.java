package com.phillippitts.callbridge.service.lifecycle;

import com.phillippitts.callbridge.config.properties.CallAcceptProperties;
import com.phillippitts.callbridge.domain.Call;
import com.phillippitts.callbridge.domain.LifecycleStage;
import com.phillippitts.callbridge.exception.CallAcceptException;
import com.phillippitts.callbridge.exception.CallControlException;
import com.phillippitts.callbridge.service.action.ActionDispatcher;
import com.phillippitts.callbridge.service.callcontrol.CallControlClient;
import com.phillippitts.callbridge.service.callcontrol.SessionConfigFactory;
import com.phillippitts.callbridge.service.data.InstructionBuilder;
import com.phillippitts.callbridge.service.metrics.CallMetrics;
import com.phillippitts.callbridge.service.registry.CallRegistry;
import com.phillippitts.callbridge.service.stream.SessionStreamManager;
import com.phillippitts.callbridge.util.LogSanitizer;
import com.phillippitts.callbridge.util.Sleeper;
import com.phillippitts.callbridge.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.json.JSONArray;
import org.json.JSONObject;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Default {@link CallLifecycleController}.
 *
 * <p>Runs on the webhook request thread. Only the accept handshake (with its bounded not-ready
 * retry) blocks the response; greeting and function stream are launched through the
 * {@link SessionStreamManager} and never delay the acknowledgement.
 *
 * <p>A second {@code call.incoming} for a call id that is still tracked is treated as a
 * duplicate delivery and acknowledged without touching the live record.
 */
@Service
public class DefaultCallLifecycleController implements CallLifecycleController {

    private static final Logger LOG = LogManager.getLogger(DefaultCallLifecycleController.class);

    private final CallRegistry registry;
    private final SessionStreamManager streams;
    private final CallControlClient callControl;
    private final SessionConfigFactory sessionConfigFactory;
    private final InstructionBuilder instructionBuilder;
    private final ActionDispatcher dispatcher;
    private final CallAcceptProperties acceptProps;
    private final CallMetrics metrics;
    private final Sleeper sleeper;

    @Autowired
    public DefaultCallLifecycleController(CallRegistry registry,
                                          SessionStreamManager streams,
                                          CallControlClient callControl,
                                          SessionConfigFactory sessionConfigFactory,
                                          InstructionBuilder instructionBuilder,
                                          ActionDispatcher dispatcher,
                                          CallAcceptProperties acceptProps,
                                          CallMetrics metrics) {
        this(registry, streams, callControl, sessionConfigFactory, instructionBuilder, dispatcher,
                acceptProps, metrics, Sleeper.SYSTEM);
    }

    public DefaultCallLifecycleController(CallRegistry registry,
                                          SessionStreamManager streams,
                                          CallControlClient callControl,
                                          SessionConfigFactory sessionConfigFactory,
                                          InstructionBuilder instructionBuilder,
                                          ActionDispatcher dispatcher,
                                          CallAcceptProperties acceptProps,
                                          CallMetrics metrics,
                                          Sleeper sleeper) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.streams = Objects.requireNonNull(streams, "streams");
        this.callControl = Objects.requireNonNull(callControl, "callControl");
        this.sessionConfigFactory = Objects.requireNonNull(sessionConfigFactory, "sessionConfigFactory");
        this.instructionBuilder = Objects.requireNonNull(instructionBuilder, "instructionBuilder");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.acceptProps = Objects.requireNonNull(acceptProps, "acceptProps");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    @Override
    public void handle(WebhookEvent event) {
        Optional<String> callId = event.callId();
        callId.ifPresent(id -> ThreadContext.put("callId", id));
        try {
            LOG.info("[{}] call={} session={} leg={} status={}", event.type(), callId.orElse(WebhookEvent.UNKNOWN),
                    event.sessionId(), event.leg(), event.status());
            dispatch(event, callId);
        } finally {
            ThreadContext.remove("callId");
        }
    }

    private void dispatch(WebhookEvent event, Optional<String> callId) {
        WebhookEventType kind = event.kind();
        if (kind == WebhookEventType.UNKNOWN) {
            logUnhandled(event);
            return;
        }
        if (callId.isEmpty()) {
            LOG.warn("Ignoring {} without a call id", event.type());
            return;
        }
        if (kind == WebhookEventType.CALL_INCOMING) {
            onIncoming(callId.get(), event.data());
        } else if (kind == WebhookEventType.SESSION_UPDATED) {
            onSessionUpdated(callId.get(), event);
        } else if (kind.isTerminal()) {
            onTerminal(callId.get(), event.type());
        }
    }

    private void onIncoming(String callId, JSONObject data) {
        JSONArray sipHeaders = data.optJSONArray("sip_headers");
        String caller = CallerIdExtractor.callerNumber(sipHeaders);
        String carrierSid = CallerIdExtractor.carrierCallSid(sipHeaders).orElse("none");

        if (!registry.insertIfAbsent(Call.incoming(callId, caller, Instant.now()))) {
            LOG.info("Duplicate incoming event for live call={}; acknowledging without changes", callId);
            return;
        }
        LOG.info("Incoming call={} caller={} carrierSid={}", callId, LogSanitizer.maskPhone(caller), carrierSid);

        String greeting;
        long start = System.nanoTime();
        try {
            String instructions = instructionBuilder.buildInstructions(caller);
            greeting = instructionBuilder.buildGreeting(caller);
            JSONObject sessionConfig = sessionConfigFactory.build(instructions, dispatcher.toolDefinitions());
            registry.update(callId, c -> c.withStage(LifecycleStage.ACCEPTING));
            if (!acceptWithRetry(callId, sessionConfig)) {
                return;
            }
        } catch (CallAcceptException ex) {
            registry.remove(callId);
            metrics.recordAccept("failed", System.nanoTime() - start);
            LOG.error("Failed to accept call={}: {}", callId, ex.getMessage());
            throw ex;
        } catch (RuntimeException ex) {
            registry.remove(callId);
            metrics.recordAccept("failed", System.nanoTime() - start);
            LOG.error("Failed to prepare accept for call={}", callId, ex);
            throw new CallAcceptException(callId, "Accept failed for call " + callId + ": " + ex.getMessage(), ex);
        }
        metrics.recordAccept("accepted", System.nanoTime() - start);
        LOG.info("Call accepted call={} in {} ms", callId, TimeUtils.elapsedMillis(start));

        if (registry.update(callId, c -> c.withStage(LifecycleStage.ACTIVE)).isEmpty()) {
            LOG.info("Call {} ended during accept; not starting streams", callId);
            return;
        }
        startStreams(callId, greeting);
    }

    /**
     * Accepts the call, retrying only on not-ready answers with a fixed delay between attempts.
     *
     * @return false if the call ended while waiting to retry
     */
    private boolean acceptWithRetry(String callId, JSONObject sessionConfig) {
        int maxAttempts = acceptProps.getMaxAttempts();
        for (int attempt = 1; ; attempt++) {
            try {
                callControl.accept(callId, sessionConfig);
                return true;
            } catch (CallControlException ex) {
                if (!ex.isNotReady() || attempt >= maxAttempts) {
                    throw new CallAcceptException(callId, attempt, ex);
                }
                LOG.info("Call not ready yet (attempt {}/{}), retrying in {} ms",
                        attempt, maxAttempts, acceptProps.getRetryDelayMs());
            }
            pause(callId, attempt);
            if (!registry.contains(callId)) {
                LOG.info("Call {} ended while waiting to retry accept", callId);
                return false;
            }
        }
    }

    private void pause(String callId, int attempt) {
        try {
            sleeper.sleep(Duration.ofMillis(acceptProps.getRetryDelayMs()));
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new CallAcceptException(callId, "Accept interrupted for call " + callId
                    + " after " + attempt + " attempt(s)", ex);
        }
    }

    private void startStreams(String callId, String greeting) {
        streams.openFunctionStream(callId).whenComplete((termination, error) -> {
            if (error != null) {
                LOG.error("Function stream failed for call={}: {}", callId, error.getMessage());
            }
        });
        streams.openGreetingStream(callId, greeting).whenComplete((sent, error) -> {
            if (error != null || !Boolean.TRUE.equals(sent)) {
                LOG.warn("Greeting not delivered for call={}", callId);
            }
        });
    }

    private void onSessionUpdated(String callId, WebhookEvent event) {
        if (!event.hasSessionTools()) {
            return;
        }
        Optional<Call> call = registry.get(callId);
        if (call.isEmpty() || !call.get().isActive()) {
            LOG.debug("Session update with tools for inactive call={}; ignoring", callId);
            return;
        }
        streams.openFunctionStream(callId);
    }

    private void onTerminal(String callId, String type) {
        registry.update(callId, c -> c.withStage(LifecycleStage.ENDING));
        streams.stopStreams(callId);
        registry.remove(callId).ifPresentOrElse(
                call -> LOG.info("Call {} closed by {} after {} message(s)", callId, type,
                        call.stats().messageCount()),
                () -> LOG.debug("Terminal event {} for untracked call={}", type, callId));
    }

    private static void logUnhandled(WebhookEvent event) {
        if (event.isRealtimeNamespace()) {
            LOG.info("Unhandled realtime event type={}", event.type());
        } else {
            LOG.info("Unhandled non-realtime webhook type={}", event.type().isBlank() ? "<none>" : event.type());
        }
        LOG.debug("Unhandled payload: {}", event.data());
    }
}
