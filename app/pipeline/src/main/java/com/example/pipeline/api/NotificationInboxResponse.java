package com.example.pipeline.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NotificationInboxResponse(
    long userId, long total, int limit, int offset, List<NotificationView> notifications) {

  public NotificationInboxResponse {
    notifications = notifications == null ? List.of() : List.copyOf(notifications);
  }
}
