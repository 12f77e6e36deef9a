/*
 * どこで: プラットフォームのデータアクセス
 * 何を: トークン掃除・イベント状態遷移・アーカイブ・日次統計を SQL で行う
 * なぜ: テーブルサイズに依らず毎時ジョブを軽く保つため集合更新にする
 */
package com.example.pipeline.maintenance;

import static com.example.common.JdbcTimestampUtils.toTimestamp;

import java.sql.Date;
import java.time.Instant;
import java.time.LocalDate;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class JdbcPlatformMaintenanceRepository implements PlatformMaintenanceRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  @Override
  public int deleteExpiredVerificationTokens(Instant now) {
    final String sql =
        """
        DELETE FROM email_verifications
        WHERE expires_at < :now
           OR used_at IS NOT NULL
        """;
    return jdbcTemplate.update(sql, new MapSqlParameterSource("now", toTimestamp(now)));
  }

  @Override
  public int startEvents(Instant now) {
    final String sql =
        """
        UPDATE evenement
        SET statut = 'en_cours'
        WHERE statut = 'publie'
          AND date_debut <= :now
          AND (date_fin IS NULL OR date_fin >= :now)
        """;
    return jdbcTemplate.update(sql, new MapSqlParameterSource("now", toTimestamp(now)));
  }

  @Override
  public int finishEvents(Instant now) {
    final String sql =
        """
        UPDATE evenement
        SET statut = 'termine'
        WHERE statut IN ('publie', 'en_cours')
          AND date_fin < :now
        """;
    return jdbcTemplate.update(sql, new MapSqlParameterSource("now", toTimestamp(now)));
  }

  @Override
  public int archiveEventsEndedBefore(Instant threshold) {
    final String sql =
        """
        UPDATE evenement
        SET statut = 'archive'
        WHERE statut = 'termine'
          AND date_fin < :threshold
        """;
    return jdbcTemplate.update(
        sql, new MapSqlParameterSource("threshold", toTimestamp(threshold)));
  }

  @Override
  public DailyStats computeDailyStats(LocalDate day, Instant from, Instant to) {
    final String sql =
        """
        SELECT
          (SELECT COUNT(*) FROM "user"
            WHERE date_creation >= :from AND date_creation < :to) AS new_users,
          (SELECT COUNT(*) FROM oeuvre
            WHERE date_creation >= :from AND date_creation < :to) AS new_works,
          (SELECT COUNT(*) FROM evenement
            WHERE date_creation >= :from AND date_creation < :to) AS new_events,
          (SELECT COUNT(*) FROM "user"
            WHERE derniere_connexion >= :from AND derniere_connexion < :to) AS active_users,
          (SELECT COUNT(*) FROM notification
            WHERE date_creation >= :from AND date_creation < :to) AS notifications_created,
          (SELECT COUNT(*) FROM notification
            WHERE date_creation >= :from AND date_creation < :to
              AND email_envoye = TRUE) AS emails_sent
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("from", toTimestamp(from))
            .addValue("to", toTimestamp(to));
    return jdbcTemplate.queryForObject(
        sql,
        params,
        (rs, rowNum) ->
            new DailyStats(
                day,
                rs.getLong("new_users"),
                rs.getLong("new_works"),
                rs.getLong("new_events"),
                rs.getLong("active_users"),
                rs.getLong("notifications_created"),
                rs.getLong("emails_sent")));
  }

  @Override
  public void saveDailyStats(DailyStats stats, Instant now) {
    final String sql =
        """
        INSERT INTO pipeline_daily_stats (
          stat_date, new_users, new_works, new_events, active_users,
          notifications_created, emails_sent, computed_at
        ) VALUES (
          :statDate, :newUsers, :newWorks, :newEvents, :activeUsers,
          :notificationsCreated, :emailsSent, :computedAt
        )
        ON CONFLICT (stat_date) DO UPDATE SET
          new_users = EXCLUDED.new_users,
          new_works = EXCLUDED.new_works,
          new_events = EXCLUDED.new_events,
          active_users = EXCLUDED.active_users,
          notifications_created = EXCLUDED.notifications_created,
          emails_sent = EXCLUDED.emails_sent,
          computed_at = EXCLUDED.computed_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("statDate", Date.valueOf(stats.statDate()))
            .addValue("newUsers", stats.newUsers())
            .addValue("newWorks", stats.newWorks())
            .addValue("newEvents", stats.newEvents())
            .addValue("activeUsers", stats.activeUsers())
            .addValue("notificationsCreated", stats.notificationsCreated())
            .addValue("emailsSent", stats.emailsSent())
            .addValue("computedAt", toTimestamp(now));
    jdbcTemplate.update(sql, params);
  }
}
