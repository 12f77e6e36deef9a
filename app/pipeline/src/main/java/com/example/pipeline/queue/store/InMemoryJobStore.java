/*
 * どこで: Job queue の永続化
 * 何を: プロセス内の job ストア
 * なぜ: 単一インスタンス構成とテストを DB なしの queue で動かすため
 */
package com.example.pipeline.queue.store;

import com.example.pipeline.queue.Job;
import com.example.pipeline.queue.JobStatus;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.UnaryOperator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(
    name = "pipeline.queue.store",
    havingValue = "memory",
    matchIfMissing = true)
public class InMemoryJobStore implements JobStore {

  // 挿入順をそのまま FIFO 順として使う
  private final Map<UUID, Job> jobs = new LinkedHashMap<>();
  private final Set<String> pausedQueues = new HashSet<>();

  @Override
  public synchronized void insert(Job job) {
    if (jobs.containsKey(job.jobId())) {
      throw new IllegalStateException("duplicate job id " + job.jobId());
    }
    jobs.put(job.jobId(), job);
  }

  @Override
  public synchronized Optional<Job> find(UUID jobId) {
    return Optional.ofNullable(jobs.get(jobId));
  }

  @Override
  public synchronized List<Job> claimReady(
      String queueName, int limit, Instant now, Instant leaseUntil, String lockedBy) {
    if (limit <= 0) {
      return List.of();
    }
    final List<Job> ready =
        jobs.values().stream()
            .filter(job -> job.queueName().equals(queueName))
            .filter(job -> job.isReady(now))
            .sorted(Comparator.comparingInt(Job::priority).reversed())
            .limit(limit)
            .toList();
    final List<Job> claimed = new ArrayList<>(ready.size());
    for (Job job : ready) {
      final Job active = job.claimed(lockedBy, leaseUntil);
      jobs.put(job.jobId(), active);
      claimed.add(active);
    }
    return claimed;
  }

  @Override
  public synchronized int markCompleted(
      UUID jobId, String lockedBy, Instant now, String resultJson, boolean remove) {
    if (!isOwnedBy(jobId, lockedBy)) {
      return 0;
    }
    if (remove) {
      jobs.remove(jobId);
      return 1;
    }
    return update(jobId, job -> job.completed(now, resultJson));
  }

  @Override
  public synchronized int markDelayed(
      UUID jobId, String lockedBy, int attemptsMade, Instant delayUntil, String error) {
    if (!isOwnedBy(jobId, lockedBy)) {
      return 0;
    }
    return update(jobId, job -> job.delayed(attemptsMade, delayUntil, error));
  }

  @Override
  public synchronized int markFailed(
      UUID jobId, String lockedBy, int attemptsMade, Instant now, String error) {
    if (!isOwnedBy(jobId, lockedBy)) {
      return 0;
    }
    return update(jobId, job -> job.failed(attemptsMade, now, error));
  }

  @Override
  public synchronized void updateProgress(UUID jobId, int progress) {
    update(jobId, job -> job.withProgress(progress));
  }

  @Override
  public synchronized boolean resetFailed(UUID jobId) {
    final Job job = jobs.get(jobId);
    if (job == null || job.status() != JobStatus.FAILED) {
      return false;
    }
    jobs.put(jobId, job.resetForRetry());
    return true;
  }

  @Override
  public synchronized int releaseExpiredLeases(String queueName, Instant now) {
    final List<Job> expired =
        jobs.values().stream()
            .filter(job -> job.queueName().equals(queueName))
            .filter(job -> job.status() == JobStatus.ACTIVE)
            .filter(job -> job.leaseUntil() != null && job.leaseUntil().isBefore(now))
            .toList();
    expired.forEach(job -> jobs.put(job.jobId(), job.released()));
    return expired.size();
  }

  @Override
  public synchronized Map<JobStatus, Long> countByStatus(String queueName) {
    final Map<JobStatus, Long> counts = new EnumMap<>(JobStatus.class);
    for (JobStatus status : JobStatus.values()) {
      counts.put(status, 0L);
    }
    jobs.values().stream()
        .filter(job -> job.queueName().equals(queueName))
        .forEach(job -> counts.merge(job.status(), 1L, Long::sum));
    return counts;
  }

  @Override
  public synchronized List<Job> findByStatus(String queueName, JobStatus status, int limit) {
    // JDBC ストアと同じく新しい順
    final List<Job> matching =
        new ArrayList<>(
            jobs.values().stream()
                .filter(job -> job.queueName().equals(queueName))
                .filter(job -> job.status() == status)
                .toList());
    Collections.reverse(matching);
    return matching.stream().limit(limit).toList();
  }

  @Override
  public synchronized int deleteWaitingAndDelayed(String queueName) {
    final List<UUID> removable =
        jobs.values().stream()
            .filter(job -> job.queueName().equals(queueName))
            .filter(
                job -> job.status() == JobStatus.WAITING || job.status() == JobStatus.DELAYED)
            .map(Job::jobId)
            .toList();
    removable.forEach(jobs::remove);
    return removable.size();
  }

  @Override
  public synchronized int deleteCompletedBefore(String queueName, Instant threshold) {
    final List<UUID> removable =
        jobs.values().stream()
            .filter(job -> job.queueName().equals(queueName))
            .filter(job -> job.status() == JobStatus.COMPLETED)
            .filter(job -> job.finishedAt() != null && job.finishedAt().isBefore(threshold))
            .map(Job::jobId)
            .toList();
    removable.forEach(jobs::remove);
    return removable.size();
  }

  @Override
  public synchronized void setPaused(String queueName, boolean paused) {
    if (paused) {
      pausedQueues.add(queueName);
    } else {
      pausedQueues.remove(queueName);
    }
  }

  @Override
  public synchronized boolean isPaused(String queueName) {
    return pausedQueues.contains(queueName);
  }

  private boolean isOwnedBy(UUID jobId, String lockedBy) {
    final Job job = jobs.get(jobId);
    return job != null
        && job.status() == JobStatus.ACTIVE
        && Objects.equals(job.lockedBy(), lockedBy);
  }

  private int update(UUID jobId, UnaryOperator<Job> change) {
    final Job job = jobs.get(jobId);
    if (job == null) {
      return 0;
    }
    jobs.put(jobId, change.apply(job));
    return 1;
  }
}
