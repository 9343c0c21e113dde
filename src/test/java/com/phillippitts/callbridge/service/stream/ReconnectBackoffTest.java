package com.phillippitts.callbridge.service.stream;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReconnectBackoffTest {

    @Test
    void delayDoublesPerAttempt() {
        ReconnectBackoff backoff = new ReconnectBackoff(1_000, 30_000);

        assertThat(backoff.delayFor(1)).isEqualTo(Duration.ofSeconds(1));
        assertThat(backoff.delayFor(2)).isEqualTo(Duration.ofSeconds(2));
        assertThat(backoff.delayFor(3)).isEqualTo(Duration.ofSeconds(4));
        assertThat(backoff.delayFor(5)).isEqualTo(Duration.ofSeconds(16));
    }

    @Test
    void delayIsCappedAtMaximum() {
        ReconnectBackoff backoff = new ReconnectBackoff(1_000, 30_000);

        assertThat(backoff.delayFor(6)).isEqualTo(Duration.ofSeconds(30));
        assertThat(backoff.delayFor(100)).isEqualTo(Duration.ofSeconds(30));
        assertThat(backoff.delayFor(Integer.MAX_VALUE)).isEqualTo(Duration.ofSeconds(30));
    }

    @Test
    void maximumBelowBaseFallsBackToBase() {
        ReconnectBackoff backoff = new ReconnectBackoff(500, 100);

        assertThat(backoff.delayFor(1)).isEqualTo(Duration.ofMillis(500));
        assertThat(backoff.delayFor(4)).isEqualTo(Duration.ofMillis(500));
    }

    @Test
    void rejectsNonPositiveInputs() {
        assertThatThrownBy(() -> new ReconnectBackoff(0, 1_000))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ReconnectBackoff(1_000, 1_000).delayFor(0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("attempt must be >= 1");
    }
}
