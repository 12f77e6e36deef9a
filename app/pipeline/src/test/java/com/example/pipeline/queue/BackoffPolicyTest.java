package com.example.pipeline.queue;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class BackoffPolicyTest {

  @Test
  void fixedBackoffAlwaysWaitsTheSameDelay() {
    final BackoffPolicy policy = BackoffPolicy.fixed(Duration.ofSeconds(10));

    assertThat(policy.delayFor(0)).isEqualTo(Duration.ofSeconds(10));
    assertThat(policy.delayFor(4)).isEqualTo(Duration.ofSeconds(10));
  }

  @Test
  void exponentialBackoffDoublesFromTheBaseDelay() {
    final BackoffPolicy policy = BackoffPolicy.exponential(Duration.ofSeconds(5));

    assertThat(policy.delayFor(0)).isEqualTo(Duration.ofSeconds(5));
    assertThat(policy.delayFor(1)).isEqualTo(Duration.ofSeconds(10));
    assertThat(policy.delayFor(2)).isEqualTo(Duration.ofSeconds(20));
  }

  @Test
  void exponentialBackoffCapsTheExponent() {
    final BackoffPolicy policy = BackoffPolicy.exponential(Duration.ofMillis(1));

    assertThat(policy.delayFor(1_000)).isEqualTo(Duration.ofMillis(1L << 30));
    assertThat(policy.delayFor(-3)).isEqualTo(Duration.ofMillis(1));
  }

  @Test
  void negativeDelayIsRejected() {
    assertThatThrownBy(() -> BackoffPolicy.fixed(Duration.ofSeconds(-1)))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
