package com.example.pipeline.queue;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class JobOptionsTest {

  @Test
  void defaultsAreThreeAttemptsWithExponentialBackoff() {
    final JobOptions options = JobOptions.defaults();

    assertThat(options.attempts()).isEqualTo(3);
    assertThat(options.backoff()).isEqualTo(BackoffPolicy.exponential(Duration.ofSeconds(5)));
    assertThat(options.delay()).isZero();
    assertThat(options.priority()).isZero();
    assertThat(options.removeOnComplete()).isFalse();
  }

  @Test
  void nullDelayMeansNoDelay() {
    final JobOptions options =
        new JobOptions(1, BackoffPolicy.fixed(Duration.ofSeconds(1)), null, 0, false);

    assertThat(options.delay()).isZero();
  }

  @Test
  void invalidValuesAreRejected() {
    assertThatThrownBy(() -> JobOptions.defaults().withAttempts(0))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> JobOptions.defaults().withDelay(Duration.ofSeconds(-5)))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
