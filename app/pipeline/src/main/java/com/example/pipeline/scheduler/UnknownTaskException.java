package com.example.pipeline.scheduler;

public class UnknownTaskException extends RuntimeException {

  public UnknownTaskException(String taskName) {
    super("unknown task: " + taskName);
  }
}
