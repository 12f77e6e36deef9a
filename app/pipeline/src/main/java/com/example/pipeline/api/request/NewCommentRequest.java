package com.example.pipeline.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotNull;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NewCommentRequest(
    @NotNull(message = "author_id is required") Long authorId, String excerpt) {}
