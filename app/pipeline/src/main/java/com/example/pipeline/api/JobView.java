package com.example.pipeline.api;

import com.example.pipeline.queue.BackoffType;
import com.example.pipeline.queue.JobStatus;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.UUID;

/** Admin view of a job; payload and result are returned as parsed JSON. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record JobView(
    UUID jobId,
    String queueName,
    String jobType,
    JobStatus status,
    int attemptsMade,
    int attemptsMax,
    BackoffType backoffType,
    long backoffDelayMs,
    int priority,
    int progress,
    Instant delayUntil,
    String lastError,
    JsonNode payload,
    JsonNode result,
    Instant createdAt,
    Instant finishedAt) {}
