package com.phillippitts.callbridge.service.health;

import com.phillippitts.callbridge.domain.Call;
import com.phillippitts.callbridge.service.registry.CallRegistry;
import com.phillippitts.callbridge.service.stream.SessionStreamManager;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for call handling.
 *
 * <p>Always UP while the process serves requests; a call whose function stream is missing is
 * reported as a detail rather than a status change, since the call itself may still be talking.
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class CallBridgeHealthIndicator implements HealthIndicator {

    private final CallRegistry registry;
    private final SessionStreamManager streams;

    public CallBridgeHealthIndicator(CallRegistry registry, SessionStreamManager streams) {
        this.registry = registry;
        this.streams = streams;
    }

    @Override
    public Health health() {
        long activeWithoutStream = registry.snapshot().stream()
                .filter(Call::isActive)
                .filter(c -> !streams.hasLiveStreams(c.callId()))
                .count();

        return Health.up()
                .withDetail("activeCalls", registry.size())
                .withDetail("greetedCalls", registry.greetedCount())
                .withDetail("activeFunctionStreams", streams.activeFunctionStreamCount())
                .withDetail("activeCallsWithoutStream", activeWithoutStream)
                .build();
    }
}
