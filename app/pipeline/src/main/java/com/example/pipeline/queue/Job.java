/*
 * どこで: Job queue のモデル
 * 何を: pipeline_job 行のスナップショット
 * なぜ: ストア・ワーカー・管理 API で同じ不変の job 表現を共有するため
 */
package com.example.pipeline.queue;

import java.time.Instant;
import java.util.UUID;

public record Job(
    UUID jobId,
    String queueName,
    String jobType,
    String payloadJson,
    int attemptsMax,
    int attemptsMade,
    BackoffPolicy backoff,
    int priority,
    boolean removeOnComplete,
    JobStatus status,
    Instant delayUntil,
    int progress,
    String lastError,
    String resultJson,
    String lockedBy,
    Instant leaseUntil,
    Instant createdAt,
    Instant finishedAt) {

  public boolean isReady(Instant now) {
    if (status == JobStatus.WAITING) {
      return true;
    }
    return status == JobStatus.DELAYED && (delayUntil == null || !delayUntil.isAfter(now));
  }

  public Job claimed(String owner, Instant until) {
    return new Job(jobId, queueName, jobType, payloadJson, attemptsMax, attemptsMade, backoff,
        priority, removeOnComplete, JobStatus.ACTIVE, null, progress, lastError, resultJson,
        owner, until, createdAt, finishedAt);
  }

  public Job completed(Instant now, String result) {
    return new Job(jobId, queueName, jobType, payloadJson, attemptsMax, attemptsMade, backoff,
        priority, removeOnComplete, JobStatus.COMPLETED, null, 100, lastError, result,
        null, null, createdAt, now);
  }

  public Job delayed(int attempts, Instant until, String error) {
    return new Job(jobId, queueName, jobType, payloadJson, attemptsMax, attempts, backoff,
        priority, removeOnComplete, JobStatus.DELAYED, until, progress, error, resultJson,
        null, null, createdAt, null);
  }

  public Job failed(int attempts, Instant now, String error) {
    return new Job(jobId, queueName, jobType, payloadJson, attemptsMax, attempts, backoff,
        priority, removeOnComplete, JobStatus.FAILED, null, progress, error, resultJson,
        null, null, createdAt, now);
  }

  public Job resetForRetry() {
    return new Job(jobId, queueName, jobType, payloadJson, attemptsMax, 0, backoff,
        priority, removeOnComplete, JobStatus.WAITING, null, 0, lastError, null,
        null, null, createdAt, null);
  }

  public Job released() {
    return new Job(jobId, queueName, jobType, payloadJson, attemptsMax, attemptsMade, backoff,
        priority, removeOnComplete, JobStatus.WAITING, null, progress, lastError, resultJson,
        null, null, createdAt, finishedAt);
  }

  public Job withProgress(int value) {
    return new Job(jobId, queueName, jobType, payloadJson, attemptsMax, attemptsMade, backoff,
        priority, removeOnComplete, status, delayUntil, value, lastError, resultJson,
        lockedBy, leaseUntil, createdAt, finishedAt);
  }
}
