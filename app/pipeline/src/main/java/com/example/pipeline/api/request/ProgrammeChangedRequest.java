package com.example.pipeline.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/** Platform change codes such as horaire or lieu; unknown codes mean general. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ProgrammeChangedRequest(String changeType) {}
