/*
 * どこで: Job queue 永続化のポート
 * 何を: 永続的な job 状態とアトミックな取得
 * なぜ: job の保存先がメモリでも PostgreSQL でも queue の処理を同じにするため
 */
package com.example.pipeline.queue.store;

import com.example.pipeline.queue.Job;
import com.example.pipeline.queue.JobStatus;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Job storage.
 *
 * <p>{@link #claimReady} must hand each ready job to exactly one caller. Every state change
 * after a claim is conditioned on {@code lockedBy}; a return value of {@code 0} means the lease
 * was lost and the caller must not assume the change happened.
 */
public interface JobStore {

  void insert(Job job);

  Optional<Job> find(UUID jobId);

  /** Claims WAITING jobs and due DELAYED jobs, highest priority first, then oldest first. */
  List<Job> claimReady(String queueName, int limit, Instant now, Instant leaseUntil, String lockedBy);

  int markCompleted(UUID jobId, String lockedBy, Instant now, String resultJson, boolean remove);

  int markDelayed(UUID jobId, String lockedBy, int attemptsMade, Instant delayUntil, String error);

  int markFailed(UUID jobId, String lockedBy, int attemptsMade, Instant now, String error);

  void updateProgress(UUID jobId, int progress);

  /** FAILED to WAITING with attempts reset; false when the job is not FAILED. */
  boolean resetFailed(UUID jobId);

  /** Returns ACTIVE jobs whose lease expired to WAITING. */
  int releaseExpiredLeases(String queueName, Instant now);

  Map<JobStatus, Long> countByStatus(String queueName);

  List<Job> findByStatus(String queueName, JobStatus status, int limit);

  int deleteWaitingAndDelayed(String queueName);

  int deleteCompletedBefore(String queueName, Instant threshold);

  void setPaused(String queueName, boolean paused);

  boolean isPaused(String queueName);
}
