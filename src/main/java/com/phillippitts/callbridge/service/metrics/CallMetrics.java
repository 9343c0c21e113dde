package com.phillippitts.callbridge.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for call handling.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Rejected webhooks (signature failures)</li>
 *   <li>Accept outcomes and latency</li>
 *   <li>Greeting delivery outcomes</li>
 *   <li>Function stream reconnects and terminations</li>
 *   <li>Action (function call) outcomes</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available under /actuator/metrics.
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class CallMetrics {

    private static final String METRIC_PREFIX = "callbridge";

    private final MeterRegistry registry;

    public CallMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void incrementWebhookRejected() {
        Counter.builder(METRIC_PREFIX + ".webhook.rejected")
                .description("Webhooks rejected for failed signature verification")
                .register(registry)
                .increment();
    }

    /**
     * Records the outcome of accepting a call.
     *
     * @param outcome accepted, not_ready or failed
     * @param durationNanos time spent including retries
     */
    public void recordAccept(String outcome, long durationNanos) {
        Counter.builder(METRIC_PREFIX + ".call.accept")
                .description("Call accept outcomes")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
        Timer.builder(METRIC_PREFIX + ".call.accept.latency")
                .description("Time taken to accept a call, including retries")
                .tag("outcome", outcome)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * @param outcome sent or failed
     */
    public void recordGreeting(String outcome) {
        Counter.builder(METRIC_PREFIX + ".greeting")
                .description("Greeting delivery outcomes")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void incrementReconnect() {
        Counter.builder(METRIC_PREFIX + ".stream.reconnect")
                .description("Function stream reconnects scheduled after abnormal disconnects")
                .register(registry)
                .increment();
    }

    /**
     * @param termination why the stream ended (call_ended, cancelled, reconnects_exhausted, error)
     */
    public void recordStreamEnded(String termination) {
        Counter.builder(METRIC_PREFIX + ".stream.ended")
                .description("Function streams ended, by termination reason")
                .tag("termination", termination)
                .register(registry)
                .increment();
    }

    /**
     * @param action action name, e.g. transfer_call
     * @param outcome success, failure or rejected
     */
    public void recordAction(String action, String outcome) {
        Counter.builder(METRIC_PREFIX + ".action")
                .description("AI-requested actions executed, by outcome")
                .tag("action", action)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }
}
