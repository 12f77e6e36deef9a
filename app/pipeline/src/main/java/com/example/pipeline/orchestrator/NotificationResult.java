package com.example.pipeline.orchestrator;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * How many recipients the trigger concerned and what happened to them.
 *
 * <p>{@code notifiedCount} counts recipients reached for sure: in-app only notifications and
 * sends the provider accepted. {@code queuedCount} counts recipients handed to the job queue,
 * whose result is only known once the job runs.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NotificationResult(int notifiedCount, int queuedCount, int totalCount) {

  public NotificationResult(int notifiedCount, int totalCount) {
    this(notifiedCount, 0, totalCount);
  }

  public static NotificationResult empty() {
    return new NotificationResult(0, 0, 0);
  }
}
