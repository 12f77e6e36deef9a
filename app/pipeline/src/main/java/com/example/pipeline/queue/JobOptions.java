/*
 * どこで: Job queue のモデル
 * 何を: job ごとの enqueue オプション
 */
package com.example.pipeline.queue;

import java.time.Duration;
import java.util.Objects;

public record JobOptions(
    int attempts, BackoffPolicy backoff, Duration delay, int priority, boolean removeOnComplete) {

  public static final int DEFAULT_ATTEMPTS = 3;
  public static final Duration DEFAULT_BACKOFF_DELAY = Duration.ofSeconds(5);

  public JobOptions {
    if (attempts < 1) {
      throw new IllegalArgumentException("attempts must be >= 1");
    }
    Objects.requireNonNull(backoff, "backoff");
    delay = delay == null ? Duration.ZERO : delay;
    if (delay.isNegative()) {
      throw new IllegalArgumentException("delay must not be negative");
    }
  }

  public static JobOptions defaults() {
    return new JobOptions(
        DEFAULT_ATTEMPTS,
        BackoffPolicy.exponential(DEFAULT_BACKOFF_DELAY),
        Duration.ZERO,
        0,
        false);
  }

  public JobOptions withAttempts(int value) {
    return new JobOptions(value, backoff, delay, priority, removeOnComplete);
  }

  public JobOptions withBackoff(BackoffPolicy value) {
    return new JobOptions(attempts, value, delay, priority, removeOnComplete);
  }

  public JobOptions withDelay(Duration value) {
    return new JobOptions(attempts, backoff, value, priority, removeOnComplete);
  }

  public JobOptions withPriority(int value) {
    return new JobOptions(attempts, backoff, delay, value, removeOnComplete);
  }

  public JobOptions withRemoveOnComplete(boolean value) {
    return new JobOptions(attempts, backoff, delay, priority, value);
  }
}
