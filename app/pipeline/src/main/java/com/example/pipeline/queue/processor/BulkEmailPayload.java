package com.example.pipeline.queue.processor;

import java.util.List;

public record BulkEmailPayload(String campaign, List<BulkRecipient> recipients) {

  public BulkEmailPayload {
    recipients = recipients == null ? List.of() : List.copyOf(recipients);
  }
}
