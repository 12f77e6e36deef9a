package com.example.pipeline.queue;

/** The queue cannot accept jobs right now; callers may fall back to a direct send. */
public class QueueUnavailableException extends RuntimeException {

  public QueueUnavailableException(String message) {
    super(message);
  }

  public QueueUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
