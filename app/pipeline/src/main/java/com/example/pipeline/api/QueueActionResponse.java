package com.example.pipeline.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/** Result of pause, resume, drain and clean; {@code affected} is 0 for pause and resume. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record QueueActionResponse(String queueName, String action, int affected) {}
