/*
 * どこで: Job queue のモデル
 * 何を: pipeline の名前付き queue と既定ワーカー数
 * なぜ: 送信の種類ごとに滞留と並列度を分けるため
 */
package com.example.pipeline.queue;

import java.util.Arrays;

public enum QueueName {
  EMAIL("email", 1),
  NOTIFICATION("notification", 1),
  BULK("bulk", 10);

  private final String id;
  private final int defaultConcurrency;

  QueueName(String id, int defaultConcurrency) {
    this.id = id;
    this.defaultConcurrency = defaultConcurrency;
  }

  public String id() {
    return id;
  }

  public int defaultConcurrency() {
    return defaultConcurrency;
  }

  public static QueueName fromId(String id) {
    return Arrays.stream(values())
        .filter(queue -> queue.id.equals(id))
        .findFirst()
        .orElseThrow(() -> new UnknownQueueException(id));
  }
}
