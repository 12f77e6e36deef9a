package com.example.pipeline.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

/** An empty or missing id list marks every notification of the user as read. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record MarkReadRequest(List<Long> notificationIds) {

  public MarkReadRequest {
    notificationIds = notificationIds == null ? List.of() : List.copyOf(notificationIds);
  }
}
