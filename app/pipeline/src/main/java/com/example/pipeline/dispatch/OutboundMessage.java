package com.example.pipeline.dispatch;

import com.example.pipeline.channel.EmailMessage;
import com.example.pipeline.notification.NotificationType;
import com.example.pipeline.notification.PendingNotification;

/**
 * Channels requested for one recipient; a message with neither is in-app only. {@code history}
 * is the row a queued job writes once the provider has answered.
 */
public record OutboundMessage(
    long userId,
    NotificationType type,
    EmailMessage email,
    String smsTo,
    String smsText,
    PendingNotification history) {

  public OutboundMessage(
      long userId, NotificationType type, EmailMessage email, String smsTo, String smsText) {
    this(userId, type, email, smsTo, smsText, null);
  }

  public boolean hasEmail() {
    return email != null;
  }

  public boolean hasSms() {
    return smsTo != null && !smsTo.isBlank() && smsText != null && !smsText.isBlank();
  }

  public boolean isInAppOnly() {
    return !hasEmail() && !hasSms();
  }
}
