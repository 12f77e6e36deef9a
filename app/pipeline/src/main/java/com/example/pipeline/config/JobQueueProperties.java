/*
 * どこで: Pipeline 設定バインド
 * 何を: job queue のポーリング・リース・並列度の設定
 */
package com.example.pipeline.config;

import com.example.pipeline.queue.QueueName;
import java.time.Duration;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "pipeline.queue")
public record JobQueueProperties(
    boolean enabled,
    JobStoreType store,
    Duration pollInterval,
    Duration lease,
    int errorMessageMaxLength,
    Map<String, Integer> concurrency) {

  public JobQueueProperties {
    concurrency = concurrency == null ? Map.of() : Map.copyOf(concurrency);
  }

  public int concurrencyFor(QueueName queue) {
    final Integer configured = concurrency.get(queue.id());
    return configured == null || configured < 1 ? queue.defaultConcurrency() : configured;
  }

  public enum JobStoreType {
    MEMORY,
    JDBC
  }
}
