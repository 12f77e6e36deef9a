/*
 * どこで: Pipeline スケジューラ
 * 何を: 共有 TaskScheduler 上の名前付き cron タスク（start/stop/runNow と失敗監査）
 * なぜ: 実行時に定期処理を操作でき、失敗したタスクもスケジュールを失わないようにするため
 */
package com.example.pipeline.scheduler;

import com.example.common.ErrorMessages;
import com.example.pipeline.audit.AuditLogRecord;
import com.example.pipeline.audit.AuditLogRepository;
import com.example.pipeline.metrics.PipelineMetrics;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Throwables;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.scheduling.support.CronTrigger;

/**
 * Registry of named cron tasks.
 *
 * <p>Every execution, scheduled or {@link #runNow(String) manual}, goes through one guarded
 * wrapper: a run that overlaps a still-executing run of the same task is skipped, failures are
 * logged, audited and counted, and the schedule stays in place. Different tasks run concurrently
 * on the shared pool.
 */
public class PipelineScheduler {

  private static final Logger logger = LoggerFactory.getLogger(PipelineScheduler.class);

  static final String AUDIT_ACTION = "scheduled_task_error";
  static final String AUDIT_ENTITY_TYPE = "cron_job";
  private static final String MDC_TASK_NAME = "task_name";
  private static final int ERROR_MAX_LENGTH = 1000;
  private static final int STACK_MAX_LENGTH = 8000;

  private final TaskScheduler taskScheduler;
  private final AuditLogRepository auditLogRepository;
  private final PipelineMetrics metrics;
  private final ObjectMapper objectMapper;
  private final Clock clock;
  private final ZoneId zone;
  private final Map<String, RegisteredTask> tasks = new LinkedHashMap<>();

  public PipelineScheduler(
      TaskScheduler taskScheduler,
      AuditLogRepository auditLogRepository,
      PipelineMetrics metrics,
      ObjectMapper objectMapper,
      Clock clock,
      ZoneId zone) {
    this.taskScheduler = taskScheduler;
    this.auditLogRepository = auditLogRepository;
    this.metrics = metrics;
    this.objectMapper = objectMapper;
    this.clock = clock;
    this.zone = zone;
  }

  public void registerTask(String name, String cronExpression, TaskBody body) {
    registerTask(name, cronExpression, body, false);
  }

  /**
   * Registers a task and starts it unless {@code deferStart} is set.
   *
   * @throws DuplicateTaskException when {@code name} is already registered
   * @throws IllegalArgumentException when the cron expression does not parse
   */
  public synchronized void registerTask(
      String name, String cronExpression, TaskBody body, boolean deferStart) {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("task name is required");
    }
    if (cronExpression == null || !CronExpression.isValidExpression(cronExpression)) {
      throw new IllegalArgumentException(
          "invalid cron expression for " + name + ": " + cronExpression);
    }
    if (tasks.containsKey(name)) {
      throw new DuplicateTaskException(name);
    }
    final RegisteredTask task = new RegisteredTask(name, cronExpression, body);
    tasks.put(name, task);
    logger.info(
        "scheduled task registered task={} cron={} deferred={}", name, cronExpression, deferStart);
    if (!deferStart) {
      schedule(task);
    }
  }

  /** Starts the schedule of {@code name}; returns false when no such task is registered. */
  public synchronized boolean start(String name) {
    final RegisteredTask task = tasks.get(name);
    if (task == null) {
      logger.warn("cannot start unknown task task={}", name);
      return false;
    }
    if (!task.isScheduled()) {
      schedule(task);
      logger.info("scheduled task started task={}", name);
    }
    return true;
  }

  /** Cancels future runs of {@code name}; an execution in progress finishes normally. */
  public synchronized boolean stop(String name) {
    final RegisteredTask task = tasks.get(name);
    if (task == null) {
      logger.warn("cannot stop unknown task task={}", name);
      return false;
    }
    if (task.isScheduled()) {
      task.future.cancel(false);
      logger.info("scheduled task stopped task={}", name);
    }
    task.future = null;
    return true;
  }

  /**
   * Runs {@code name} on the calling thread through the same wrapper as scheduled runs.
   *
   * @throws UnknownTaskException when no such task is registered
   */
  public RunResult runNow(String name) {
    final RegisteredTask task;
    synchronized (this) {
      task = tasks.get(name);
    }
    if (task == null) {
      throw new UnknownTaskException(name);
    }
    logger.info("scheduled task run requested task={}", name);
    return execute(task);
  }

  public synchronized Map<String, Boolean> status() {
    final Map<String, Boolean> status = new LinkedHashMap<>();
    tasks.forEach((name, task) -> status.put(name, task.isScheduled()));
    return status;
  }

  public synchronized List<ScheduledTask> tasks() {
    final List<ScheduledTask> snapshots = new ArrayList<>(tasks.size());
    for (RegisteredTask task : tasks.values()) {
      snapshots.add(
          new ScheduledTask(
              task.name,
              task.cronExpression,
              task.isScheduled(),
              task.executing.get(),
              task.lastRunAt,
              task.lastError));
    }
    return snapshots;
  }

  public synchronized void startAll() {
    tasks.keySet().forEach(this::start);
  }

  public synchronized void stopAll() {
    tasks.keySet().forEach(this::stop);
  }

  public synchronized void shutdown() {
    stopAll();
    logger.info("pipeline scheduler stopped tasks={}", tasks.size());
  }

  private void schedule(RegisteredTask task) {
    task.future =
        taskScheduler.schedule(() -> execute(task), new CronTrigger(task.cronExpression, zone));
  }

  private RunResult execute(RegisteredTask task) {
    if (!task.executing.compareAndSet(false, true)) {
      logger.warn("scheduled task still running; skipping this run task={}", task.name);
      metrics.recordTaskResult(task.name, "skipped");
      return RunResult.ALREADY_RUNNING;
    }
    MDC.put(MDC_TASK_NAME, task.name);
    final Instant startedAt = Instant.now(clock);
    try {
      logger.info("scheduled task started run task={}", task.name);
      task.body.run();
      task.lastError = null;
      metrics.recordTaskResult(task.name, "completed");
      logger.info(
          "scheduled task completed task={} durationMs={}",
          task.name,
          Instant.now(clock).toEpochMilli() - startedAt.toEpochMilli());
      return RunResult.COMPLETED;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      recordFailure(task, ex);
      return RunResult.FAILED;
    } catch (Exception ex) {
      recordFailure(task, ex);
      return RunResult.FAILED;
    } finally {
      task.lastRunAt = startedAt;
      task.executing.set(false);
      MDC.remove(MDC_TASK_NAME);
    }
  }

  private void recordFailure(RegisteredTask task, Exception ex) {
    final String message = ErrorMessages.describe(ex, ERROR_MAX_LENGTH);
    task.lastError = message;
    metrics.recordTaskResult(task.name, "failed");
    logger.error("scheduled task failed task={}", task.name, ex);
    try {
      final Map<String, String> details = new LinkedHashMap<>();
      details.put("taskName", task.name);
      details.put("message", message);
      details.put(
          "stack", ErrorMessages.truncate(Throwables.getStackTraceAsString(ex), STACK_MAX_LENGTH));
      auditLogRepository.insert(
          new AuditLogRecord(
              UUID.randomUUID(),
              AUDIT_ACTION,
              AUDIT_ENTITY_TYPE,
              task.name,
              objectMapper.writeValueAsString(details),
              Instant.now(clock)));
    } catch (DataAccessException | JsonProcessingException auditEx) {
      logger.error("audit log insert failed for task error task={}", task.name, auditEx);
    }
  }

  private static final class RegisteredTask {
    private final String name;
    private final String cronExpression;
    private final TaskBody body;
    private final AtomicBoolean executing = new AtomicBoolean(false);
    private volatile ScheduledFuture<?> future;
    private volatile Instant lastRunAt;
    private volatile String lastError;

    private RegisteredTask(String name, String cronExpression, TaskBody body) {
      this.name = name;
      this.cronExpression = cronExpression;
      this.body = body;
    }

    private boolean isScheduled() {
      return future != null && !future.isCancelled() && !future.isDone();
    }
  }
}
