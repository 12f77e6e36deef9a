/*
 * どこで: Pipeline メトリクス
 * 何を: job 結果・チャネル結果・配信フォールバック・タスク実行・queue 滞留を記録する
 * なぜ: ログを読まずに Prometheus から非同期 pipeline を監視するため
 */
package com.example.pipeline.metrics;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry is a shared Spring-managed component and cannot be copied")
public class PipelineMetrics {

  static final String METRIC_JOB_TOTAL = "pipeline.job.total";
  static final String METRIC_CHANNEL_TOTAL = "pipeline.delivery.total";
  static final String METRIC_FALLBACK_TOTAL = "pipeline.delivery.fallback.total";
  static final String METRIC_TASK_TOTAL = "pipeline.task.total";
  static final String METRIC_QUEUE_WAITING = "pipeline.queue.waiting";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<Tags, Counter> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, AtomicInteger> waitingByQueue = new ConcurrentHashMap<>();

  public PipelineMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  public void recordJobResult(String queue, String result) {
    increment(METRIC_JOB_TOTAL, "Job attempt outcomes", Tags.of("queue", queue, "result", result));
  }

  public void recordChannelResult(String channel, String result) {
    increment(
        METRIC_CHANNEL_TOTAL,
        "Provider send outcomes",
        Tags.of("channel", channel, "result", result));
  }

  public void recordFallback(String channel) {
    increment(
        METRIC_FALLBACK_TOTAL,
        "Sends that bypassed the queue because it was unavailable",
        Tags.of("channel", channel));
  }

  public void recordTaskResult(String task, String result) {
    increment(METRIC_TASK_TOTAL, "Scheduled task runs", Tags.of("task", task, "result", result));
  }

  public void updateWaiting(String queue, int waiting) {
    waitingByQueue
        .computeIfAbsent(
            queue,
            name -> {
              final AtomicInteger holder = new AtomicInteger(0);
              Gauge.builder(METRIC_QUEUE_WAITING, holder, AtomicInteger::get)
                  .description("Jobs waiting to be claimed")
                  .tags(Tags.of("queue", name))
                  .register(meterRegistry);
              return holder;
            })
        .set(Math.max(waiting, 0));
  }

  private void increment(String name, String description, Tags tags) {
    counters
        .computeIfAbsent(
            Tags.of("metric", name).and(tags),
            ignored -> Counter.builder(name).description(description).tags(tags).register(meterRegistry))
        .increment();
  }
}
