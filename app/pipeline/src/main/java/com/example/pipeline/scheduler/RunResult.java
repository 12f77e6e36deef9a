package com.example.pipeline.scheduler;

public enum RunResult {
  COMPLETED,
  FAILED,
  /** The same task was still executing, so this run was skipped. */
  ALREADY_RUNNING
}
