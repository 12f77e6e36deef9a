/*
 * どこで: 通知モデル
 * 何を: notification 行のスナップショット（1 配信のアプリ内履歴）
 * なぜ: 受信箱 API・掃除処理・オーケストレータで同じ行の表現を共有するため
 */
package com.example.pipeline.notification;

import java.time.Instant;

public record Notification(
    Long notificationId,
    long userId,
    NotificationType type,
    String title,
    String message,
    Long eventId,
    Long workId,
    Long programmeId,
    String actionUrl,
    NotificationPriority priority,
    boolean emailSent,
    boolean smsSent,
    boolean read,
    Instant createdAt,
    Instant readAt) {}
