package com.example.pipeline.queue;

public class UnknownQueueException extends RuntimeException {

  public UnknownQueueException(String queueName) {
    super("unknown queue: " + queueName);
  }
}
