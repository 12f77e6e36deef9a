package com.example.pipeline.scheduler;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

/** Point-in-time view of a registered task. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ScheduledTask(
    String name,
    String cronExpression,
    boolean enabled,
    boolean executing,
    Instant lastRunAt,
    String lastError) {}
