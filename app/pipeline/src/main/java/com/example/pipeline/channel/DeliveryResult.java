package com.example.pipeline.channel;

public record DeliveryResult(boolean success, String messageId, String error) {

  public static DeliveryResult sent(String messageId) {
    return new DeliveryResult(true, messageId, null);
  }

  public static DeliveryResult failure(String error) {
    return new DeliveryResult(false, null, error);
  }
}
