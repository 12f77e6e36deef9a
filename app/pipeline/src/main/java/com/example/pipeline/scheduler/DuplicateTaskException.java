package com.example.pipeline.scheduler;

public class DuplicateTaskException extends RuntimeException {

  public DuplicateTaskException(String taskName) {
    super("task already registered: " + taskName);
  }
}
