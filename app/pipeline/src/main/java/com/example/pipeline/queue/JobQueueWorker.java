/*
 * どこで: Job queue のコンシューマ側
 * 何を: 固定間隔で全 queue をポーリングする
 * なぜ: 取得した job は queue ごとの executor で動くので、ポーリング自体は短く保てるため
 */
package com.example.pipeline.queue;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "pipeline.queue.enabled", havingValue = "true")
public class JobQueueWorker {

  private final JobQueue jobQueue;

  @Scheduled(fixedDelayString = "${pipeline.queue.poll-interval}")
  public void run() {
    jobQueue.pollAll();
  }
}
