/*
 * どこで: Pipeline 設定バインド
 * 何を: queue ごとの job 既定値と一斉送信のペース
 * なぜ: retry 回数とプロバイダのレート制限を環境ごとに調整するため
 */
package com.example.pipeline.config;

import com.example.pipeline.queue.BackoffPolicy;
import com.example.pipeline.queue.BackoffType;
import com.example.pipeline.queue.JobOptions;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "pipeline.delivery")
public record DeliveryProperties(
    int bulkBatchSize,
    Duration bulkSendPause,
    JobDefaults email,
    JobDefaults notification,
    JobDefaults bulk) {

  public record JobDefaults(
      int attempts, BackoffType backoffType, Duration backoffDelay, boolean removeOnComplete) {

    public JobOptions toOptions() {
      return JobOptions.defaults()
          .withAttempts(attempts)
          .withBackoff(new BackoffPolicy(backoffType, backoffDelay))
          .withRemoveOnComplete(removeOnComplete);
    }
  }
}
