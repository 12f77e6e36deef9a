package com.example.pipeline.queue.processor;

import java.util.List;

/** Result stored on a completed bulk job. */
public record BulkSendReport(int total, int sent, int failed, List<RecipientResult> results) {

  public BulkSendReport {
    results = List.copyOf(results);
  }

  public record RecipientResult(String to, boolean success, String messageId, String error) {}
}
