package com.phillippitts.callbridge.service.health;

import com.phillippitts.callbridge.domain.Call;
import com.phillippitts.callbridge.domain.LifecycleStage;
import com.phillippitts.callbridge.service.registry.CallRegistry;
import com.phillippitts.callbridge.service.stream.SessionStreamManager;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class CallBridgeHealthIndicatorTest {

    @Test
    void reportsUpWithCallCounts() {
        CallRegistry registry = new CallRegistry();
        registry.insertIfAbsent(Call.incoming("streaming", "1", Instant.now()).withStage(LifecycleStage.ACTIVE));
        registry.insertIfAbsent(Call.incoming("silent", "2", Instant.now()).withStage(LifecycleStage.ACTIVE));
        registry.insertIfAbsent(Call.incoming("accepting", "3", Instant.now()).withStage(LifecycleStage.ACCEPTING));
        registry.compareAndSetGreeted("streaming", false, true);
        SessionStreamManager streams = mock(SessionStreamManager.class);
        when(streams.hasLiveStreams("streaming")).thenReturn(true);
        when(streams.activeFunctionStreamCount()).thenReturn(1);

        Health health = new CallBridgeHealthIndicator(registry, streams).health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails())
                .containsEntry("activeCalls", 3)
                .containsEntry("greetedCalls", 1L)
                .containsEntry("activeFunctionStreams", 1)
                .containsEntry("activeCallsWithoutStream", 1L);
    }

    @Test
    void staysUpWithNoCalls() {
        Health health = new CallBridgeHealthIndicator(new CallRegistry(), mock(SessionStreamManager.class)).health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsEntry("activeCalls", 0);
    }
}
