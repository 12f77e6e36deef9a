package com.example.pipeline.queue.processor;

import com.example.pipeline.channel.EmailMessage;
import com.example.pipeline.notification.PendingNotification;

/**
 * Payload of {@code send-notification}; {@code email} and the SMS pair are both optional.
 * {@code history}, when present, is written as a notification row after the send.
 */
public record NotificationJobPayload(
    long userId,
    String notificationType,
    EmailMessage email,
    String smsTo,
    String smsText,
    PendingNotification history) {

  public boolean hasEmail() {
    return email != null;
  }

  public boolean hasSms() {
    return smsTo != null && !smsTo.isBlank() && smsText != null;
  }
}
