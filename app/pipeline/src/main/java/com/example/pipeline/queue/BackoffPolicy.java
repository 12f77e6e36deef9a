/*
 * どこで: Job queue のモデル
 * 何を: 失敗 job の次回試行までの待ち時間
 */
package com.example.pipeline.queue;

import java.time.Duration;
import java.util.Objects;

public record BackoffPolicy(BackoffType type, Duration delay) {

  public BackoffPolicy {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(delay, "delay");
    if (delay.isNegative()) {
      throw new IllegalArgumentException("backoff delay must not be negative");
    }
  }

  public static BackoffPolicy fixed(Duration delay) {
    return new BackoffPolicy(BackoffType.FIXED, delay);
  }

  public static BackoffPolicy exponential(Duration delay) {
    return new BackoffPolicy(BackoffType.EXPONENTIAL, delay);
  }

  /**
   * Delay after a failure.
   *
   * @param attemptsMade attempts already recorded before the failing one, so the first retry
   *     waits exactly {@code delay} for both types
   */
  public Duration delayFor(int attemptsMade) {
    if (type == BackoffType.FIXED) {
      return delay;
    }
    // 指数は 30 で頭打ちにし、乗算を long の範囲に収める
    final int exponent = Math.min(Math.max(attemptsMade, 0), 30);
    return delay.multipliedBy(1L << exponent);
  }
}
