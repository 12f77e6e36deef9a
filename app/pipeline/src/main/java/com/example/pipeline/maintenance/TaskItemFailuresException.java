package com.example.pipeline.maintenance;

/** Some items of a batch task failed; the others were processed. */
public class TaskItemFailuresException extends RuntimeException {

  public TaskItemFailuresException(String taskName, int failed, int total, Throwable firstCause) {
    super(taskName + " failed for " + failed + " of " + total + " items", firstCause);
  }
}
