/*
 * どこで: Pipeline 基盤設定
 * 何を: job queue・共有スケジューラプール・pipeline スケジューラを組み立てる
 * なぜ: スレッドを持つ部品なので、開始と停止を明示するため
 */
package com.example.pipeline.config;

import com.example.pipeline.audit.AuditLogRepository;
import com.example.pipeline.metrics.PipelineMetrics;
import com.example.pipeline.queue.JobQueue;
import com.example.pipeline.queue.QueueName;
import com.example.pipeline.queue.processor.BulkEmailJobProcessor;
import com.example.pipeline.queue.processor.EmailJobProcessor;
import com.example.pipeline.queue.processor.NotificationJobProcessor;
import com.example.pipeline.queue.store.JobStore;
import com.example.pipeline.scheduler.PipelineScheduler;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.util.concurrent.Executors;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

@Configuration
public class PipelineConfig {

  @Bean(destroyMethod = "shutdown")
  public JobQueue jobQueue(
      JobStore jobStore,
      JobQueueProperties properties,
      PipelineMetrics metrics,
      ObjectMapper objectMapper,
      Clock clock,
      EmailJobProcessor emailJobProcessor,
      NotificationJobProcessor notificationJobProcessor,
      BulkEmailJobProcessor bulkEmailJobProcessor) {
    final JobQueue jobQueue =
        new JobQueue(
            jobStore,
            properties,
            metrics,
            objectMapper,
            clock,
            queue ->
                Executors.newFixedThreadPool(
                    properties.concurrencyFor(queue),
                    new CustomizableThreadFactory("queue-" + queue.id() + "-")));
    jobQueue.registerProcessor(
        QueueName.EMAIL.id(), EmailJobProcessor.JOB_TYPE, emailJobProcessor);
    // トランザクション通知は email queue に載るが、履歴行は同じ processor が書く
    jobQueue.registerProcessor(
        QueueName.EMAIL.id(), NotificationJobProcessor.JOB_TYPE, notificationJobProcessor);
    jobQueue.registerProcessor(
        QueueName.NOTIFICATION.id(), NotificationJobProcessor.JOB_TYPE, notificationJobProcessor);
    jobQueue.registerProcessor(
        QueueName.BULK.id(), BulkEmailJobProcessor.JOB_TYPE, bulkEmailJobProcessor);
    // 前提: 無効化された queue は利用不可のままで、全送信が直接配信に回る
    if (properties.enabled()) {
      jobQueue.start();
    }
    return jobQueue;
  }

  @Bean(name = "pipelineTaskScheduler")
  public ThreadPoolTaskScheduler pipelineTaskScheduler(SchedulerProperties properties) {
    final ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
    scheduler.setPoolSize(Math.max(1, properties.poolSize()));
    scheduler.setThreadNamePrefix("pipeline-task-");
    scheduler.setWaitForTasksToCompleteOnShutdown(true);
    scheduler.setAwaitTerminationSeconds(30);
    return scheduler;
  }

  @Bean(destroyMethod = "shutdown")
  public PipelineScheduler pipelineScheduler(
      ThreadPoolTaskScheduler pipelineTaskScheduler,
      AuditLogRepository auditLogRepository,
      PipelineMetrics metrics,
      ObjectMapper objectMapper,
      Clock clock,
      SchedulerProperties properties) {
    return new PipelineScheduler(
        pipelineTaskScheduler,
        auditLogRepository,
        metrics,
        objectMapper,
        clock,
        properties.zone());
  }
}
