package com.example.pipeline.queue;

import java.util.UUID;

public class JobNotFoundException extends RuntimeException {

  public JobNotFoundException(String queueName, UUID jobId) {
    super("job not found: queue=" + queueName + " jobId=" + jobId);
  }
}
