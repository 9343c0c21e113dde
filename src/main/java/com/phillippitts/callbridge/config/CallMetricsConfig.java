package com.phillippitts.callbridge.config;

import com.phillippitts.callbridge.service.registry.CallRegistry;
import com.phillippitts.callbridge.service.stream.SessionStreamManager;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Gauges for live call state and the stream supervisor pool.
 *
 * <p>Exposes:
 * <ul>
 *   <li>callbridge.calls.active - calls currently tracked in the registry</li>
 *   <li>callbridge.calls.greeted - tracked calls whose greeting has been dispatched</li>
 *   <li>callbridge.streams.function.active - live function-stream supervisors</li>
 *   <li>callbridge.pool.stream.active - supervisor threads in use</li>
 * </ul>
 *
 * <p>Available via {@code GET /actuator/metrics/callbridge.calls.active}.
 * A summary is also logged every 5 minutes.
 */
@Configuration
public class CallMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(CallMetricsConfig.class);

    private final CallRegistry registry;
    private final SessionStreamManager streams;
    private final ObjectProvider<ThreadPoolTaskExecutor> streamExecutorProvider;

    public CallMetricsConfig(CallRegistry registry,
                             SessionStreamManager streams,
                             @Qualifier("streamExecutor") ObjectProvider<ThreadPoolTaskExecutor> streamExecutorProvider) {
        this.registry = registry;
        this.streams = streams;
        this.streamExecutorProvider = streamExecutorProvider;
    }

    @Bean
    public MeterBinder callStateMetrics() {
        return meters -> {
            Gauge.builder("callbridge.calls.active", registry, CallRegistry::size)
                    .description("Calls currently tracked")
                    .register(meters);

            Gauge.builder("callbridge.calls.greeted", registry, CallRegistry::greetedCount)
                    .description("Tracked calls whose greeting has been dispatched")
                    .register(meters);

            Gauge.builder("callbridge.streams.function.active", streams, SessionStreamManager::activeFunctionStreamCount)
                    .description("Live function-stream supervisors")
                    .register(meters);

            ThreadPoolTaskExecutor streamExecutor = streamExecutorProvider.getIfAvailable();
            if (streamExecutor != null) {
                Gauge.builder("callbridge.pool.stream.active", streamExecutor.getThreadPoolExecutor(),
                                ThreadPoolExecutor::getActiveCount)
                        .description("Stream supervisor threads in use")
                        .register(meters);
            }

            LOG.info("Call state metrics registered: callbridge.calls.* and callbridge.streams.* available via /actuator/metrics");
        };
    }

    /**
     * Logs a call state summary every 5 minutes for operational monitoring.
     */
    @Scheduled(fixedRate = 300_000) // 5 minutes
    public void logCallStateSummary() {
        LOG.info("Call state: active={}, greeted={}, functionStreams={}",
                registry.size(), registry.greetedCount(), streams.activeFunctionStreamCount());
    }
}
