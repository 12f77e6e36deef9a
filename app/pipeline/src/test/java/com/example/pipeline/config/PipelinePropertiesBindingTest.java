/*
 * どこで: Pipeline 設定バインドのテスト
 * 何を: queue・配信・スケジューラ・保守の設定をプロパティ文字列からバインドする
 * なぜ: 環境変数の上書きでも Duration・enum・queue 別 Map が正しくバインドされるようにするため
 */
package com.example.pipeline.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.pipeline.config.JobQueueProperties.JobStoreType;
import com.example.pipeline.queue.BackoffPolicy;
import com.example.pipeline.queue.BackoffType;
import com.example.pipeline.queue.JobOptions;
import com.example.pipeline.queue.QueueName;
import java.time.Duration;
import java.time.ZoneId;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

class PipelinePropertiesBindingTest {

  private final ApplicationContextRunner contextRunner =
      new ApplicationContextRunner()
          .withUserConfiguration(TestConfiguration.class)
          .withPropertyValues(
              "pipeline.queue.enabled=true",
              "pipeline.queue.store=jdbc",
              "pipeline.queue.poll-interval=500ms",
              "pipeline.queue.lease=5m",
              "pipeline.queue.error-message-max-length=1000",
              "pipeline.queue.concurrency.bulk=10",
              "pipeline.delivery.bulk-batch-size=100",
              "pipeline.delivery.bulk-send-pause=100ms",
              "pipeline.delivery.email.attempts=3",
              "pipeline.delivery.email.backoff-type=exponential",
              "pipeline.delivery.email.backoff-delay=5s",
              "pipeline.delivery.bulk.attempts=3",
              "pipeline.delivery.bulk.backoff-type=fixed",
              "pipeline.delivery.bulk.backoff-delay=10s",
              "pipeline.delivery.bulk.remove-on-complete=true",
              "pipeline.scheduler.enabled=false",
              "pipeline.scheduler.zone=Africa/Algiers",
              "pipeline.scheduler.pool-size=4",
              "pipeline.scheduler.cron.calculate-stats=0 30 0 * * *",
              "pipeline.maintenance.notification-retention-days=90",
              "pipeline.maintenance.temp-dir=uploads/temp",
              "pipeline.maintenance.temp-file-max-age=24h",
              "pipeline.maintenance.archive-after-months=6",
              "pipeline.maintenance.verification-reminder-after=3d",
              "pipeline.maintenance.verification-reminder-batch-size=100",
              "pipeline.maintenance.completed-job-grace=1h");

  @Test
  void contextStartsAndBindsPipelineSettings() {
    contextRunner.run(
        context -> {
          assertThat(context).hasNotFailed();
          final JobQueueProperties queue = context.getBean(JobQueueProperties.class);
          final DeliveryProperties delivery = context.getBean(DeliveryProperties.class);
          final SchedulerProperties scheduler = context.getBean(SchedulerProperties.class);
          final MaintenanceProperties maintenance = context.getBean(MaintenanceProperties.class);

          assertThat(queue.store()).isEqualTo(JobStoreType.JDBC);
          assertThat(queue.pollInterval()).isEqualTo(Duration.ofMillis(500));
          assertThat(queue.lease()).isEqualTo(Duration.ofMinutes(5));
          assertThat(queue.concurrencyFor(QueueName.BULK)).isEqualTo(10);
          assertThat(queue.concurrencyFor(QueueName.EMAIL))
              .isEqualTo(QueueName.EMAIL.defaultConcurrency());

          assertThat(delivery.email().backoffType()).isEqualTo(BackoffType.EXPONENTIAL);
          final JobOptions bulkOptions = delivery.bulk().toOptions();
          assertThat(bulkOptions.backoff()).isEqualTo(BackoffPolicy.fixed(Duration.ofSeconds(10)));
          assertThat(bulkOptions.removeOnComplete()).isTrue();
          assertThat(delivery.bulkSendPause()).isEqualTo(Duration.ofMillis(100));

          assertThat(scheduler.enabled()).isFalse();
          assertThat(scheduler.zone()).isEqualTo(ZoneId.of("Africa/Algiers"));
          assertThat(scheduler.cronFor("calculate-stats", "0 0 1 * * *")).isEqualTo("0 30 0 * * *");
          assertThat(scheduler.cronFor("upcoming-events-check", "0 0 * * * *"))
              .isEqualTo("0 0 * * * *");

          assertThat(maintenance.verificationReminderAfter()).isEqualTo(Duration.ofDays(3));
          assertThat(maintenance.tempFileMaxAge()).isEqualTo(Duration.ofHours(24));
        });
  }

  @Configuration
  @EnableConfigurationProperties({
    JobQueueProperties.class,
    DeliveryProperties.class,
    SchedulerProperties.class,
    MaintenanceProperties.class
  })
  static class TestConfiguration {}
}
