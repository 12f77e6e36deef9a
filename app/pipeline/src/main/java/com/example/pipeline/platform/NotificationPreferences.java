/*
 * どこで: プラットフォームのユーザーモデル
 * 何を: ユーザー行に保存された通知設定のスイッチ
 */
package com.example.pipeline.platform;

public record NotificationPreferences(
    boolean enabled,
    boolean email,
    boolean sms,
    boolean newEvents,
    boolean programmeChanges,
    boolean reminders,
    boolean comments,
    boolean favorites,
    boolean newsletter) {

  public static NotificationPreferences allEnabled() {
    return new NotificationPreferences(true, true, false, true, true, true, true, true, true);
  }

  public boolean allows(NotificationCategory category) {
    if (category == NotificationCategory.TRANSACTIONAL) {
      return true;
    }
    if (!enabled) {
      return false;
    }
    return switch (category) {
      case NEW_EVENTS -> newEvents;
      case PROGRAMME_CHANGES -> programmeChanges;
      case REMINDERS -> reminders;
      case COMMENTS -> comments;
      case FAVORITES -> favorites;
      case NEWSLETTER -> newsletter;
      case TRANSACTIONAL -> true;
    };
  }

  /** Transactional messages and the newsletter go by email even with the email switch off. */
  public boolean wantsEmail(NotificationCategory category) {
    return email
        || category == NotificationCategory.TRANSACTIONAL
        || category == NotificationCategory.NEWSLETTER;
  }
}
