/*
 * どこで: Pipeline 設定バインド
 * 何を: 保守タスクの保持期間・一時ディレクトリ・バッチサイズ
 * なぜ: 保持期間は環境ごとのポリシーであるため
 */
package com.example.pipeline.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "pipeline.maintenance")
public record MaintenanceProperties(
    int notificationRetentionDays,
    String tempDir,
    Duration tempFileMaxAge,
    int archiveAfterMonths,
    Duration verificationReminderAfter,
    int verificationReminderBatchSize,
    Duration completedJobGrace) {}
