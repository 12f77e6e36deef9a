/*
 * どこで: Pipeline スケジューラの単体テスト
 * 何を: 登録ルール・start/stop・手動実行・重複スキップ・失敗監査を確認する
 * なぜ: 失敗や遅延したタスクが自分のスケジュールや他のタスクを止めないようにするため
 */
package com.example.pipeline.scheduler;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import com.example.pipeline.audit.AuditLogRecord;
import com.example.pipeline.audit.AuditLogRepository;
import com.example.pipeline.metrics.PipelineMetrics;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.Trigger;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

@ExtendWith(MockitoExtension.class)
class PipelineSchedulerTest {

  private static final Instant NOW = Instant.parse("2026-01-17T00:00:00Z");

  @Mock private TaskScheduler taskScheduler;
  @Mock private ScheduledFuture<Object> future;
  @Mock private AuditLogRepository auditLogRepository;

  @Captor private ArgumentCaptor<Runnable> scheduledRun;

  private SimpleMeterRegistry meterRegistry;
  private PipelineScheduler scheduler;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    scheduler =
        new PipelineScheduler(
            taskScheduler,
            auditLogRepository,
            new PipelineMetrics(meterRegistry),
            new ObjectMapper(),
            Clock.fixed(NOW, ZoneOffset.UTC),
            ZoneId.of("Africa/Algiers"));
  }

  @Test
  void registeredTaskIsScheduledImmediately() {
    doReturn(future).when(taskScheduler).schedule(any(Runnable.class), any(Trigger.class));

    scheduler.registerTask("event-reminders", "0 0 * * * *", () -> {});

    assertThat(scheduler.status()).containsEntry("event-reminders", true);
    assertThat(scheduler.tasks())
        .singleElement()
        .extracting(ScheduledTask::cronExpression)
        .isEqualTo("0 0 * * * *");
  }

  @Test
  void deferredTaskStartsOnlyWhenAsked() {
    scheduler.registerTask("clean-temp-files", "0 0 4 * * *", () -> {}, true);
    assertThat(scheduler.status()).containsEntry("clean-temp-files", false);
    verify(taskScheduler, never()).schedule(any(Runnable.class), any(Trigger.class));

    doReturn(future).when(taskScheduler).schedule(any(Runnable.class), any(Trigger.class));
    assertThat(scheduler.start("clean-temp-files")).isTrue();
    assertThat(scheduler.start("clean-temp-files")).isTrue();

    assertThat(scheduler.status()).containsEntry("clean-temp-files", true);
    verify(taskScheduler, times(1)).schedule(any(Runnable.class), any(Trigger.class));
  }

  @Test
  void stopCancelsFutureRunsAndIsIdempotent() {
    doReturn(future).when(taskScheduler).schedule(any(Runnable.class), any(Trigger.class));
    scheduler.registerTask("calculate-stats", "0 0 1 * * *", () -> {});

    assertThat(scheduler.stop("calculate-stats")).isTrue();
    assertThat(scheduler.stop("calculate-stats")).isTrue();

    verify(future).cancel(false);
    assertThat(scheduler.status()).containsEntry("calculate-stats", false);
  }

  @Test
  void unknownTaskNamesAreReported() {
    assertThat(scheduler.start("missing")).isFalse();
    assertThat(scheduler.stop("missing")).isFalse();
    assertThatThrownBy(() -> scheduler.runNow("missing")).isInstanceOf(UnknownTaskException.class);
  }

  @Test
  void invalidRegistrationsAreRejected() {
    scheduler.registerTask("calculate-stats", "0 0 1 * * *", () -> {}, true);

    assertThatThrownBy(() -> scheduler.registerTask("calculate-stats", "0 0 2 * * *", () -> {}, true))
        .isInstanceOf(DuplicateTaskException.class);
    assertThatThrownBy(() -> scheduler.registerTask("broken", "every monday", () -> {}, true))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("invalid cron expression");
    assertThatThrownBy(() -> scheduler.registerTask(" ", "0 0 1 * * *", () -> {}, true))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void runNowExecutesOnTheCallingThread() {
    final AtomicInteger runs = new AtomicInteger();
    scheduler.registerTask("calculate-stats", "0 0 1 * * *", runs::incrementAndGet, true);

    assertThat(scheduler.runNow("calculate-stats")).isEqualTo(RunResult.COMPLETED);

    assertThat(runs).hasValue(1);
    assertThat(scheduler.tasks().get(0).lastRunAt()).isEqualTo(NOW);
    assertThat(meterRegistry.get("pipeline.task.total").tag("result", "completed").counter().count())
        .isEqualTo(1.0);
  }

  @Test
  void overlappingRunOfTheSameTaskIsSkipped() {
    final AtomicReference<RunResult> nested = new AtomicReference<>();
    final AtomicReference<Boolean> executingFlag = new AtomicReference<>();
    scheduler.registerTask(
        "event-reminders",
        "0 0 * * * *",
        () -> {
          executingFlag.set(scheduler.tasks().get(0).executing());
          nested.set(scheduler.runNow("event-reminders"));
        },
        true);

    assertThat(scheduler.runNow("event-reminders")).isEqualTo(RunResult.COMPLETED);

    assertThat(nested).hasValue(RunResult.ALREADY_RUNNING);
    assertThat(executingFlag).hasValue(true);
    assertThat(scheduler.tasks().get(0).executing()).isFalse();
  }

  @Test
  void failureIsAuditedAndClearedByTheNextSuccess() {
    final AtomicBoolean fail = new AtomicBoolean(true);
    scheduler.registerTask(
        "clean-expired-tokens",
        "0 0 3 * * *",
        () -> {
          if (fail.get()) {
            throw new IllegalStateException("database unreachable");
          }
        },
        true);

    assertThat(scheduler.runNow("clean-expired-tokens")).isEqualTo(RunResult.FAILED);

    final ArgumentCaptor<AuditLogRecord> audit = ArgumentCaptor.forClass(AuditLogRecord.class);
    verify(auditLogRepository).insert(audit.capture());
    assertThat(audit.getValue().action()).isEqualTo(PipelineScheduler.AUDIT_ACTION);
    assertThat(audit.getValue().entityType()).isEqualTo(PipelineScheduler.AUDIT_ENTITY_TYPE);
    assertThat(audit.getValue().entityId()).isEqualTo("clean-expired-tokens");
    assertThat(audit.getValue().detailsJson())
        .contains("\"taskName\":\"clean-expired-tokens\"")
        .contains("database unreachable")
        .contains("IllegalStateException");
    assertThat(scheduler.tasks().get(0).lastError()).isEqualTo("database unreachable");

    fail.set(false);
    assertThat(scheduler.runNow("clean-expired-tokens")).isEqualTo(RunResult.COMPLETED);
    assertThat(scheduler.tasks().get(0).lastError()).isNull();
  }

  @Test
  void auditInsertFailureDoesNotEscape() {
    doThrow(new DataAccessResourceFailureException("connection refused"))
        .when(auditLogRepository)
        .insert(any());
    scheduler.registerTask(
        "archive-old-events",
        "0 0 2 1 * *",
        () -> {
          throw new IllegalStateException("boom");
        },
        true);

    assertThat(scheduler.runNow("archive-old-events")).isEqualTo(RunResult.FAILED);
    assertThat(meterRegistry.get("pipeline.task.total").tag("result", "failed").counter().count())
        .isEqualTo(1.0);
  }

  @Test
  void startAllAndStopAllCoverEveryTask() {
    doReturn(future).when(taskScheduler).schedule(any(Runnable.class), any(Trigger.class));
    scheduler.registerTask("a", "0 0 1 * * *", () -> {}, true);
    scheduler.registerTask("b", "0 0 2 * * *", () -> {}, true);

    scheduler.startAll();
    assertThat(scheduler.status().values()).containsOnly(true);

    scheduler.stopAll();
    assertThat(scheduler.status().values()).containsOnly(false);
    assertThat(scheduler.tasks()).extracting(ScheduledTask::name).isEqualTo(List.of("a", "b"));
  }

  @Test
  void alwaysFailingTaskKeepsFiringNextToAHealthyTask() {
    doReturn(future).when(taskScheduler).schedule(any(Runnable.class), any(Trigger.class));
    final AtomicInteger failingRuns = new AtomicInteger();
    final AtomicInteger healthyRuns = new AtomicInteger();
    scheduler.registerTask(
        "event-reminders",
        "0 0 * * * *",
        () -> {
          failingRuns.incrementAndGet();
          throw new IllegalStateException("provider outage");
        });
    scheduler.registerTask("calculate-stats", "0 30 * * * *", healthyRuns::incrementAndGet);
    verify(taskScheduler, times(2)).schedule(scheduledRun.capture(), any(Trigger.class));
    final Runnable failingTick = scheduledRun.getAllValues().get(0);
    final Runnable healthyTick = scheduledRun.getAllValues().get(1);

    for (int i = 0; i < 3; i++) {
      failingTick.run();
      healthyTick.run();
    }

    assertThat(failingRuns).hasValue(3);
    assertThat(healthyRuns).hasValue(3);
    verify(future, never()).cancel(anyBoolean());
    verify(auditLogRepository, times(3)).insert(any());
    assertThat(scheduler.status())
        .containsEntry("event-reminders", true)
        .containsEntry("calculate-stats", true);
    assertThat(scheduler.tasks())
        .extracting(ScheduledTask::lastError)
        .containsExactly("provider outage", null);
    assertThat(meterRegistry.get("pipeline.task.total").tag("result", "failed").counter().count())
        .isEqualTo(3.0);
  }

  @Test
  void failingTaskKeepsItsScheduleOnARealPool() {
    final ThreadPoolTaskScheduler pool = new ThreadPoolTaskScheduler();
    pool.setPoolSize(2);
    pool.setThreadNamePrefix("pipeline-scheduler-test-");
    pool.initialize();
    final PipelineScheduler realScheduler =
        new PipelineScheduler(
            pool,
            auditLogRepository,
            new PipelineMetrics(meterRegistry),
            new ObjectMapper(),
            Clock.systemUTC(),
            ZoneId.of("Africa/Algiers"));
    final AtomicInteger failingRuns = new AtomicInteger();
    final AtomicInteger healthyRuns = new AtomicInteger();
    try {
      realScheduler.registerTask(
          "event-reminders",
          "* * * * * *",
          () -> {
            failingRuns.incrementAndGet();
            throw new IllegalStateException("provider outage");
          });
      realScheduler.registerTask("calculate-stats", "* * * * * *", healthyRuns::incrementAndGet);

      await()
          .atMost(Duration.ofSeconds(10))
          .untilAsserted(
              () -> {
                assertThat(failingRuns.get()).isGreaterThanOrEqualTo(3);
                assertThat(healthyRuns.get()).isGreaterThanOrEqualTo(3);
              });
      assertThat(realScheduler.status().values()).containsOnly(true);
    } finally {
      realScheduler.shutdown();
      pool.shutdown();
    }
  }
}
