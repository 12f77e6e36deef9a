/*
 * どこで: Pipeline 設定バインド
 * 何を: スケジューラの有効化・タイムゾーン・プールサイズ・タスク別 cron 上書き
 */
package com.example.pipeline.config;

import java.time.ZoneId;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "pipeline.scheduler")
public record SchedulerProperties(
    boolean enabled,
    ZoneId zone,
    int poolSize,
    boolean newsletterEnabled,
    Map<String, String> cron) {

  public SchedulerProperties {
    cron = cron == null ? Map.of() : Map.copyOf(cron);
  }

  public String cronFor(String taskName, String defaultExpression) {
    return cron.getOrDefault(taskName, defaultExpression);
  }
}
