package com.example.pipeline.api;

import com.example.pipeline.notification.Notification;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NotificationView(
    long notificationId,
    String type,
    String title,
    String message,
    Long eventId,
    Long workId,
    Long programmeId,
    String actionUrl,
    String priority,
    boolean emailSent,
    boolean smsSent,
    boolean read,
    Instant createdAt,
    Instant readAt) {

  static NotificationView from(Notification notification) {
    return new NotificationView(
        notification.notificationId(),
        notification.type().code(),
        notification.title(),
        notification.message(),
        notification.eventId(),
        notification.workId(),
        notification.programmeId(),
        notification.actionUrl(),
        notification.priority().code(),
        notification.emailSent(),
        notification.smsSent(),
        notification.read(),
        notification.createdAt(),
        notification.readAt());
  }
}
