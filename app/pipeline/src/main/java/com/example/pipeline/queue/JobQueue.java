/*
 * どこで: Job queue
 * 何を: 名前付き queue 上で job の enqueue・取得・実行・retry・管理を行う
 * なぜ: 送信をリクエスト経路から切り離し、プロバイダの一時障害を乗り越えるため
 */
package com.example.pipeline.queue;

import com.example.common.ErrorMessages;
import com.example.common.HostNames;
import com.example.pipeline.config.JobQueueProperties;
import com.example.pipeline.metrics.PipelineMetrics;
import com.example.pipeline.queue.store.JobStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.Lists;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessException;

/**
 * Queue facade shared by the orchestrator (producer side) and the poller (consumer side).
 *
 * <p>Each queue owns an executor sized to its concurrency and a semaphore with the same number
 * of permits; a poll never claims more jobs than there are free permits, so a claimed job always
 * has a worker.
 */
public class JobQueue {

  private static final Logger logger = LoggerFactory.getLogger(JobQueue.class);
  private static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(30);

  private final JobStore store;
  private final JobQueueProperties properties;
  private final PipelineMetrics metrics;
  private final ObjectMapper objectMapper;
  private final Clock clock;
  private final String workerId;
  private final Map<QueueName, Semaphore> permits = new EnumMap<>(QueueName.class);
  private final Map<QueueName, ExecutorService> executors = new EnumMap<>(QueueName.class);
  private final ConcurrentMap<String, JobProcessor> processors = new ConcurrentHashMap<>();
  private final AtomicBoolean running = new AtomicBoolean(false);

  public JobQueue(
      JobStore store,
      JobQueueProperties properties,
      PipelineMetrics metrics,
      ObjectMapper objectMapper,
      Clock clock,
      Function<QueueName, ExecutorService> executorFactory) {
    this.store = store;
    this.properties = properties;
    this.metrics = metrics;
    this.objectMapper = objectMapper;
    this.clock = clock;
    this.workerId = HostNames.resolve() + "-" + UUID.randomUUID().toString().substring(0, 8);
    for (QueueName queue : QueueName.values()) {
      permits.put(queue, new Semaphore(properties.concurrencyFor(queue)));
      executors.put(queue, executorFactory.apply(queue));
    }
  }

  public void start() {
    if (running.compareAndSet(false, true)) {
      logger.info("job queue started workerId={} store={}", workerId, store.getClass().getSimpleName());
    }
  }

  public void shutdown() {
    if (!running.compareAndSet(true, false)) {
      return;
    }
    executors.values().forEach(ExecutorService::shutdown);
    for (Map.Entry<QueueName, ExecutorService> entry : executors.entrySet()) {
      try {
        if (!entry.getValue().awaitTermination(SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
          logger.warn("job queue workers did not stop in time queue={}", entry.getKey().id());
          entry.getValue().shutdownNow();
        }
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        entry.getValue().shutdownNow();
      }
    }
    logger.info("job queue stopped workerId={}", workerId);
  }

  public boolean isAvailable() {
    return running.get();
  }

  public void registerProcessor(String queueName, String jobType, JobProcessor processor) {
    final QueueName queue = QueueName.fromId(queueName);
    final JobProcessor previous = processors.putIfAbsent(key(queue.id(), jobType), processor);
    if (previous != null) {
      throw new IllegalArgumentException(
          "processor already registered queue=" + queueName + " jobType=" + jobType);
    }
    logger.info("job processor registered queue={} jobType={}", queueName, jobType);
  }

  public JobHandle enqueue(String queueName, String jobType, Object payload, JobOptions options) {
    final QueueName queue = QueueName.fromId(queueName);
    ensureAvailable(queue);
    final Instant now = Instant.now(clock);
    final JobOptions effective = options == null ? JobOptions.defaults() : options;
    final boolean delayed = !effective.delay().isZero();
    final Job job =
        new Job(
            UUID.randomUUID(),
            queue.id(),
            jobType,
            toJson(payload),
            effective.attempts(),
            0,
            effective.backoff(),
            effective.priority(),
            effective.removeOnComplete(),
            delayed ? JobStatus.DELAYED : JobStatus.WAITING,
            delayed ? now.plus(effective.delay()) : null,
            0,
            null,
            null,
            null,
            null,
            now,
            null);
    try {
      store.insert(job);
    } catch (DataAccessException ex) {
      throw new QueueUnavailableException("job store unreachable queue=" + queue.id(), ex);
    }
    logger.debug("job enqueued queue={} jobType={} jobId={}", queue.id(), jobType, job.jobId());
    return new JobHandle(job.jobId(), queue.id());
  }

  /** Enqueues a job that becomes eligible at {@code sendAt}. */
  public JobHandle enqueueAt(
      String queueName, String jobType, Object payload, Instant sendAt, JobOptions options) {
    final Instant now = Instant.now(clock);
    if (!sendAt.isAfter(now)) {
      throw new IllegalArgumentException("scheduled time must be in the future sendAt=" + sendAt);
    }
    final JobOptions effective = options == null ? JobOptions.defaults() : options;
    return enqueue(queueName, jobType, payload, effective.withDelay(Duration.between(now, sendAt)));
  }

  /** Splits {@code items} into batches of at most {@code batchSize}, one job per batch. */
  public <T> BulkEnqueueResult enqueueBulk(
      String queueName,
      String jobType,
      List<T> items,
      int batchSize,
      Function<List<T>, Object> batchPayload,
      JobOptions options) {
    if (batchSize < 1) {
      throw new IllegalArgumentException("batchSize must be >= 1");
    }
    final List<UUID> jobIds = new ArrayList<>();
    for (List<T> batch : Lists.partition(items, batchSize)) {
      jobIds.add(enqueue(queueName, jobType, batchPayload.apply(batch), options).jobId());
    }
    logger.info(
        "bulk enqueued queue={} jobType={} batches={} recipients={}",
        queueName,
        jobType,
        jobIds.size(),
        items.size());
    return new BulkEnqueueResult(jobIds, jobIds.size(), items.size());
  }

  /** Claims and dispatches ready jobs on every queue; invoked by the poller. */
  public void pollAll() {
    if (!running.get()) {
      return;
    }
    for (QueueName queue : QueueName.values()) {
      try {
        pollOnce(queue);
      } catch (DataAccessException ex) {
        logger.warn("job queue poll failed queue={}", queue.id(), ex);
      }
    }
  }

  @VisibleForTesting
  void pollOnce(QueueName queue) {
    final Instant now = Instant.now(clock);
    final int released = store.releaseExpiredLeases(queue.id(), now);
    if (released > 0) {
      logger.warn("job leases expired and were released queue={} count={}", queue.id(), released);
    }
    metrics.updateWaiting(queue.id(), store.countByStatus(queue.id()).get(JobStatus.WAITING).intValue());
    if (store.isPaused(queue.id())) {
      return;
    }
    final Semaphore queuePermits = permits.get(queue);
    final int free = queuePermits.availablePermits();
    if (free == 0) {
      return;
    }
    final List<Job> claimed =
        store.claimReady(queue.id(), free, now, now.plus(properties.lease()), workerId);
    for (Job job : claimed) {
      queuePermits.acquireUninterruptibly();
      try {
        executors.get(queue).execute(() -> runClaimed(job, queuePermits));
      } catch (RejectedExecutionException ex) {
        queuePermits.release();
        logger.warn("job rejected by executor; lease will expire jobId={}", job.jobId(), ex);
      }
    }
  }

  private void runClaimed(Job job, Semaphore queuePermits) {
    MDC.put("job_id", job.jobId().toString());
    MDC.put("queue", job.queueName());
    try {
      final JobProcessor processor = processors.get(key(job.queueName(), job.jobType()));
      if (processor == null) {
        throw new PermanentJobFailureException("no processor registered for jobType=" + job.jobType());
      }
      final JobContext context =
          new JobContext(
              job.jobId(),
              job.queueName(),
              job.jobType(),
              readPayload(job),
              job.attemptsMade() + 1,
              job.attemptsMax(),
              percent -> store.updateProgress(job.jobId(), Math.max(0, Math.min(100, percent))));
      final Object result = processor.process(context);
      complete(job, result);
    } catch (PermanentJobFailureException | JsonProcessingException ex) {
      // processor の型に変換できない payload は何度試しても変換できない
      handleFailure(job, ex, true);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      handleFailure(job, ex, false);
    } catch (Exception ex) {
      handleFailure(job, ex, false);
    } finally {
      queuePermits.release();
      MDC.remove("job_id");
      MDC.remove("queue");
    }
  }

  private void complete(Job job, Object result) {
    final Instant now = Instant.now(clock);
    final int updated =
        store.markCompleted(job.jobId(), workerId, now, resultJson(result), job.removeOnComplete());
    if (updated == 0) {
      logger.warn("job completed but lease was lost jobId={}", job.jobId());
      return;
    }
    metrics.recordJobResult(job.queueName(), "completed");
    logger.info("job completed queue={} jobType={} jobId={}", job.queueName(), job.jobType(), job.jobId());
  }

  @VisibleForTesting
  void handleFailure(Job job, Exception ex, boolean permanent) {
    final Instant now = Instant.now(clock);
    final String error = ErrorMessages.describe(ex, properties.errorMessageMaxLength());
    final int attemptsMade = job.attemptsMade() + 1;
    if (permanent || attemptsMade >= job.attemptsMax()) {
      // 恒久的な失敗は残り回数をすべて消費し、attemptsMade == attemptsMax にする
      final int recorded = permanent ? job.attemptsMax() : attemptsMade;
      final int updated = store.markFailed(job.jobId(), workerId, recorded, now, error);
      if (updated == 0) {
        logger.warn("job failure skipped because lease was lost jobId={}", job.jobId());
        return;
      }
      metrics.recordJobResult(job.queueName(), "failed");
      logger.error(
          "job failed permanently queue={} jobType={} jobId={} attempts={} permanent={}",
          job.queueName(),
          job.jobType(),
          job.jobId(),
          recorded,
          permanent,
          ex);
      return;
    }
    final Duration backoff = job.backoff().delayFor(job.attemptsMade());
    final int updated =
        store.markDelayed(job.jobId(), workerId, attemptsMade, now.plus(backoff), error);
    if (updated == 0) {
      logger.warn("job retry skipped because lease was lost jobId={} attempt={}", job.jobId(), attemptsMade);
      return;
    }
    metrics.recordJobResult(job.queueName(), "retried");
    logger.warn(
        "job retry scheduled queue={} jobId={} attempt={} backoffMs={} error={}",
        job.queueName(),
        job.jobId(),
        attemptsMade,
        backoff.toMillis(),
        error);
  }

  public Map<String, QueueStats> getStats() {
    final Map<String, QueueStats> stats = new LinkedHashMap<>();
    for (QueueName queue : QueueName.values()) {
      stats.put(queue.id(), statsFor(queue));
    }
    return stats;
  }

  public QueueStats getStats(String queueName) {
    return statsFor(QueueName.fromId(queueName));
  }

  private QueueStats statsFor(QueueName queue) {
    final Map<JobStatus, Long> counts = store.countByStatus(queue.id());
    return new QueueStats(
        counts.getOrDefault(JobStatus.WAITING, 0L),
        counts.getOrDefault(JobStatus.ACTIVE, 0L),
        counts.getOrDefault(JobStatus.COMPLETED, 0L),
        counts.getOrDefault(JobStatus.FAILED, 0L),
        counts.getOrDefault(JobStatus.DELAYED, 0L),
        store.isPaused(queue.id()));
  }

  public Job getJob(String queueName, UUID jobId) {
    final QueueName queue = QueueName.fromId(queueName);
    return store
        .find(jobId)
        .filter(job -> job.queueName().equals(queue.id()))
        .orElseThrow(() -> new JobNotFoundException(queueName, jobId));
  }

  public List<Job> getFailedJobs(String queueName, int limit) {
    final QueueName queue = QueueName.fromId(queueName);
    return store.findByStatus(queue.id(), JobStatus.FAILED, limit);
  }

  public Job retryJob(String queueName, UUID jobId) {
    final Job job = getJob(queueName, jobId);
    if (!store.resetFailed(job.jobId())) {
      throw new IllegalStateException(
          "only failed jobs can be retried jobId=" + jobId + " status=" + job.status());
    }
    logger.info("job reset for retry queue={} jobId={}", queueName, jobId);
    return getJob(queueName, jobId);
  }

  public void pause(String queueName) {
    final QueueName queue = QueueName.fromId(queueName);
    store.setPaused(queue.id(), true);
    logger.info("queue paused queue={}", queue.id());
  }

  public void resume(String queueName) {
    final QueueName queue = QueueName.fromId(queueName);
    store.setPaused(queue.id(), false);
    logger.info("queue resumed queue={}", queue.id());
  }

  /** Removes waiting and delayed jobs; active and finished jobs are kept. */
  public int drain(String queueName) {
    final QueueName queue = QueueName.fromId(queueName);
    final int removed = store.deleteWaitingAndDelayed(queue.id());
    logger.info("queue drained queue={} removed={}", queue.id(), removed);
    return removed;
  }

  public int cleanCompleted(String queueName, Duration grace) {
    final QueueName queue = QueueName.fromId(queueName);
    final Instant threshold = Instant.now(clock).minus(grace);
    final int removed = store.deleteCompletedBefore(queue.id(), threshold);
    logger.info("completed jobs cleaned queue={} removed={} threshold={}", queue.id(), removed, threshold);
    return removed;
  }

  private void ensureAvailable(QueueName queue) {
    if (!running.get()) {
      throw new QueueUnavailableException("job queue is not running queue=" + queue.id());
    }
  }

  private JsonNode readPayload(Job job) {
    try {
      return objectMapper.readTree(job.payloadJson());
    } catch (JsonProcessingException ex) {
      throw new PermanentJobFailureException("job payload parse failure jobId=" + job.jobId(), ex);
    }
  }

  private String toJson(Object payload) {
    try {
      return objectMapper.writeValueAsString(payload);
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("job payload is not serializable", ex);
    }
  }

  private String resultJson(Object result) {
    if (result == null) {
      return null;
    }
    try {
      return objectMapper.writeValueAsString(result);
    } catch (JsonProcessingException ex) {
      logger.warn("job result not serializable; stored without result type={}", result.getClass().getName(), ex);
      return null;
    }
  }

  private static String key(String queueName, String jobType) {
    return queueName + ":" + jobType;
  }
}
