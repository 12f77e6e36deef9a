/*
 * どこで: プラットフォームデータのポート
 * 何を: プラットフォームテーブルへの一括保守更新
 */
package com.example.pipeline.maintenance;

import java.time.Instant;
import java.time.LocalDate;

public interface PlatformMaintenanceRepository {

  /** Deletes verification tokens that expired before {@code now} or were already used. */
  int deleteExpiredVerificationTokens(Instant now);

  /** Published events that have started and not yet ended become in progress. */
  int startEvents(Instant now);

  /** Published or in-progress events whose end has passed become finished. */
  int finishEvents(Instant now);

  int archiveEventsEndedBefore(Instant threshold);

  DailyStats computeDailyStats(LocalDate day, Instant from, Instant to);

  /** Inserts or replaces the row for {@code stats.statDate()}. */
  void saveDailyStats(DailyStats stats, Instant now);
}
