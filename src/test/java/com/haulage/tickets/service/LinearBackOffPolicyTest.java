package com.haulage.tickets.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.retry.backoff.BackOffContext;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LinearBackOffPolicyTest {

    @Test
    @DisplayName("Each retry waits one more base interval than the last")
    void linearGrowth() {
        // Given
        List<Long> sleeps = new ArrayList<>();
        LinearBackOffPolicy policy = new LinearBackOffPolicy(Duration.ofSeconds(2), sleeps::add);

        // When
        BackOffContext context = policy.start(null);
        policy.backOff(context);
        policy.backOff(context);
        policy.backOff(context);

        // Then
        assertThat(sleeps).containsExactly(2000L, 4000L, 6000L);
    }

    @Test
    @DisplayName("Contexts are independent per retry sequence")
    void independentContexts() {
        List<Long> sleeps = new ArrayList<>();
        LinearBackOffPolicy policy = new LinearBackOffPolicy(Duration.ofMillis(10), sleeps::add);

        policy.backOff(policy.start(null));
        policy.backOff(policy.start(null));

        assertThat(sleeps).containsExactly(10L, 10L);
    }

    @Test
    @DisplayName("Zero base never sleeps")
    void zeroBase() {
        List<Long> sleeps = new ArrayList<>();
        LinearBackOffPolicy policy = new LinearBackOffPolicy(Duration.ZERO, sleeps::add);

        policy.backOff(policy.start(null));

        assertThat(sleeps).isEmpty();
    }

    @Test
    @DisplayName("Negative base is refused")
    void negativeBase() {
        assertThatThrownBy(() -> new LinearBackOffPolicy(Duration.ofMillis(-1)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
