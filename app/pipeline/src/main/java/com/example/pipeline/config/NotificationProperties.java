/*
 * どこで: Pipeline 設定バインド
 * 何を: 通知の組み立てに使う時間窓・上限・トークン有効期間
 */
package com.example.pipeline.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "pipeline.notification")
public record NotificationProperties(
    Duration reminderWindowStart,
    Duration reminderWindowEnd,
    Duration startingSoonWindow,
    int newEventRecipientLimit,
    Duration newsletterLookback,
    int newsletterItemLimit,
    Duration verificationTokenTtl,
    int excerptMaxLength) {}
