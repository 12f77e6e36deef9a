package com.example.pipeline.scheduler;

/** Work run by a scheduled task; any exception is caught and recorded by the scheduler. */
@FunctionalInterface
public interface TaskBody {

  void run() throws Exception;
}
