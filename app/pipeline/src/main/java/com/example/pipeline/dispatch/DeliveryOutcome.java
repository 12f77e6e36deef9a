package com.example.pipeline.dispatch;

/**
 * What happened to one outbound message.
 *
 * <p>{@code emailSent} / {@code smsSent} are the provider's answer on the direct path. A {@code
 * queued} message has no answer yet: its job writes the notification row after the send, so the
 * caller writes none. {@code delivered} follows the primary channel: email when requested, else
 * SMS, else true for in-app only messages.
 */
public record DeliveryOutcome(
    boolean emailSent, boolean smsSent, boolean delivered, boolean queued) {

  public static DeliveryOutcome inAppOnly() {
    return new DeliveryOutcome(false, false, true, false);
  }

  public static DeliveryOutcome queuedForDelivery() {
    return new DeliveryOutcome(false, false, false, true);
  }

  public static DeliveryOutcome of(OutboundMessage message, boolean emailSent, boolean smsSent) {
    final boolean delivered;
    if (message.hasEmail()) {
      delivered = emailSent;
    } else if (message.hasSms()) {
      delivered = smsSent;
    } else {
      delivered = true;
    }
    return new DeliveryOutcome(emailSent, smsSent, delivered, false);
  }
}
