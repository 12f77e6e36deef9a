package com.example.pipeline.channel;

/** A provider rejected or failed a send; the job is retried if attempts remain. */
public class DeliveryFailedException extends RuntimeException {

  public DeliveryFailedException(String message) {
    super(message);
  }
}
