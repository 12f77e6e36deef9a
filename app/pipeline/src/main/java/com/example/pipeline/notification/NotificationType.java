/*
 * どこで: 通知モデル
 * 何を: notification.type_notification の値と、それぞれの通知設定区分
 */
package com.example.pipeline.notification;

import com.example.pipeline.platform.NotificationCategory;
import java.util.Arrays;

public enum NotificationType {
  PARTICIPATION_DECISION("validation_participation", NotificationCategory.TRANSACTIONAL),
  EVENT_CANCELLED("annulation_evenement", NotificationCategory.PROGRAMME_CHANGES),
  PROGRAMME_CHANGED("modification_programme", NotificationCategory.PROGRAMME_CHANGES),
  NEW_EVENT("nouvel_evenement", NotificationCategory.NEW_EVENTS),
  NEW_WORK("nouvelle_oeuvre", NotificationCategory.FAVORITES),
  NEW_COMMENT("nouveau_commentaire", NotificationCategory.COMMENTS),
  NEW_FAVORITE("nouveau_favori", NotificationCategory.FAVORITES),
  MODERATION("message_admin", NotificationCategory.TRANSACTIONAL),
  EVENT_REMINDER("rappel_evenement", NotificationCategory.REMINDERS),
  ACCOUNT_VERIFICATION("validation_compte", NotificationCategory.TRANSACTIONAL),
  NEWSLETTER("newsletter", NotificationCategory.NEWSLETTER),
  OTHER("autre", NotificationCategory.TRANSACTIONAL);

  private final String code;
  private final NotificationCategory category;

  NotificationType(String code, NotificationCategory category) {
    this.code = code;
    this.category = category;
  }

  public String code() {
    return code;
  }

  public NotificationCategory category() {
    return category;
  }

  public static NotificationType fromCode(String code) {
    return Arrays.stream(values())
        .filter(type -> type.code.equals(code))
        .findFirst()
        .orElse(OTHER);
  }
}
