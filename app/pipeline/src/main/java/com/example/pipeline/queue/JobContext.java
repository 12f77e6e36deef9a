package com.example.pipeline.queue;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.UUID;

/**
 * What a processor sees of the job it runs.
 *
 * @param attempt 1-based number of the current attempt
 * @param attemptsMax attempts the job may use before it fails for good
 */
public record JobContext(
    UUID jobId,
    String queueName,
    String jobType,
    JsonNode payload,
    int attempt,
    int attemptsMax,
    JobProgress progress) {

  /** True when a failure of this attempt leaves the job FAILED. */
  public boolean isLastAttempt() {
    return attempt >= attemptsMax;
  }
}
