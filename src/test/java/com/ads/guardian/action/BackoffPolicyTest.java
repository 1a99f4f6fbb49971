package com.ads.guardian.action;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DisplayName("BackoffPolicy Tests")
class BackoffPolicyTest {

    @Test
    @DisplayName("Delay doubles per attempt")
    void delayDoubles() {
        BackoffPolicy policy = new BackoffPolicy(500, 30_000, 0.0);

        assertThat(policy.delayFor(1)).isEqualTo(Duration.ofMillis(500));
        assertThat(policy.delayFor(2)).isEqualTo(Duration.ofMillis(1000));
        assertThat(policy.delayFor(3)).isEqualTo(Duration.ofMillis(2000));
    }

    @Test
    @DisplayName("Delay is capped at the maximum")
    void delayIsCapped() {
        BackoffPolicy policy = new BackoffPolicy(500, 3000, 0.0);

        assertThat(policy.delayFor(4)).isEqualTo(Duration.ofMillis(3000));
        assertThat(policy.delayFor(60)).isEqualTo(Duration.ofMillis(3000));
    }

    @Test
    @DisplayName("Jitter only shortens the delay, by at most the ratio")
    void jitterShortens() {
        BackoffPolicy policy = new BackoffPolicy(1000, 30_000, 0.2);

        assertThat(policy.delayFor(1, 0.0)).isEqualTo(Duration.ofMillis(1000));
        assertThat(policy.delayFor(1, 0.5)).isEqualTo(Duration.ofMillis(900));
        assertThat(policy.delayFor(1, 0.999).toMillis()).isGreaterThan(800);
    }

    @Test
    @DisplayName("Invalid arguments are rejected")
    void invalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> new BackoffPolicy(0, 10, 0.0));
        assertThrows(IllegalArgumentException.class, () -> new BackoffPolicy(100, 10, 0.0));
        assertThrows(IllegalArgumentException.class, () -> new BackoffPolicy(100, 1000, 1.0));
        assertThrows(IllegalArgumentException.class, () -> new BackoffPolicy(100, 1000, 0.0).delayFor(0));
    }
}
