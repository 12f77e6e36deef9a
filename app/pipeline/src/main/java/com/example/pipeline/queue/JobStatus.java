package com.example.pipeline.queue;

public enum JobStatus {
  WAITING,
  ACTIVE,
  COMPLETED,
  FAILED,
  DELAYED
}
