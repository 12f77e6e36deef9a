package com.example.pipeline.notification;

import java.time.Instant;

/**
 * Content of a notification row whose delivery result is not known yet.
 *
 * <p>Travels inside queued delivery jobs so the row is written with the provider's answer. Type
 * and priority are kept as their column codes.
 */
public record PendingNotification(
    long userId,
    String type,
    String title,
    String message,
    Long eventId,
    Long workId,
    Long programmeId,
    String actionUrl,
    String priority) {

  public static PendingNotification of(
      long userId,
      NotificationType type,
      String title,
      String message,
      Long eventId,
      Long workId,
      Long programmeId,
      String actionUrl,
      NotificationPriority priority) {
    return new PendingNotification(
        userId,
        type.code(),
        title,
        message,
        eventId,
        workId,
        programmeId,
        actionUrl,
        priority.code());
  }

  public Notification toNotification(boolean emailSent, boolean smsSent, Instant createdAt) {
    return new Notification(
        null,
        userId,
        NotificationType.fromCode(type),
        title,
        message,
        eventId,
        workId,
        programmeId,
        actionUrl,
        NotificationPriority.fromCode(priority),
        emailSent,
        smsSent,
        false,
        createdAt,
        null);
  }
}
