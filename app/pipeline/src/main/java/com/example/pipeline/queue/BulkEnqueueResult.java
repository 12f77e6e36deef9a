package com.example.pipeline.queue;

import java.util.List;
import java.util.UUID;

public record BulkEnqueueResult(List<UUID> jobIds, int batches, int totalRecipients) {

  public BulkEnqueueResult {
    jobIds = List.copyOf(jobIds);
  }
}
