/*
 * どこで: 通知のデータアクセス
 * 何を: notification テーブルの挿入・一覧・既読化・削除を行う
 * なぜ: オーケストレータの履歴書き込み・受信箱 API・保持期間掃除を支えるため
 */
package com.example.pipeline.notification;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class NotificationRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public int insertAll(List<Notification> notifications) {
    if (notifications.isEmpty()) {
      return 0;
    }
    final String sql =
        """
        INSERT INTO notification (
          id_user,
          type_notification,
          titre,
          message,
          id_evenement,
          id_oeuvre,
          id_programme,
          url_action,
          priorite,
          email_envoye,
          sms_envoye,
          lu,
          date_creation
        ) VALUES (
          :userId,
          :type,
          :title,
          :message,
          :eventId,
          :workId,
          :programmeId,
          :actionUrl,
          :priority,
          :emailSent,
          :smsSent,
          FALSE,
          :createdAt
        )
        """;
    final SqlParameterSource[] batch =
        notifications.stream().map(this::toParams).toArray(SqlParameterSource[]::new);
    final int[] counts = jdbcTemplate.batchUpdate(sql, batch);
    int inserted = 0;
    for (int count : counts) {
      // ドライバによっては件数の代わりに SUCCESS_NO_INFO (-2) を返す
      inserted += count == 0 ? 0 : 1;
    }
    return inserted;
  }

  public List<Notification> findByUser(long userId, int limit, int offset, boolean unreadOnly) {
    final String sql =
        """
        SELECT id_notification, id_user, type_notification, titre, message, id_evenement, id_oeuvre,
               id_programme, url_action, priorite, email_envoye, sms_envoye, lu, date_creation,
               date_lecture
        FROM notification
        WHERE id_user = :userId
          AND (:unreadOnly = FALSE OR lu = FALSE)
        ORDER BY date_creation DESC, id_notification DESC
        LIMIT :limit OFFSET :offset
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("userId", userId)
            .addValue("unreadOnly", unreadOnly)
            .addValue("limit", limit)
            .addValue("offset", offset);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public long countByUser(long userId, boolean unreadOnly) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM notification
        WHERE id_user = :userId
          AND (:unreadOnly = FALSE OR lu = FALSE)
        """;
    final Long count =
        jdbcTemplate.queryForObject(
            sql,
            new MapSqlParameterSource()
                .addValue("userId", userId)
                .addValue("unreadOnly", unreadOnly),
            Long.class);
    return count == null ? 0 : count;
  }

  /** Marks every unread notification of the user as read. */
  public int markAllRead(long userId, Instant now) {
    final String sql =
        """
        UPDATE notification
        SET lu = TRUE, date_lecture = :now
        WHERE id_user = :userId AND lu = FALSE
        """;
    return jdbcTemplate.update(
        sql, new MapSqlParameterSource().addValue("userId", userId).addValue("now", toTimestamp(now)));
  }

  /** Marks the given notifications as read; ids owned by other users are ignored. */
  public int markRead(long userId, Collection<Long> notificationIds, Instant now) {
    if (notificationIds.isEmpty()) {
      return 0;
    }
    final String sql =
        """
        UPDATE notification
        SET lu = TRUE, date_lecture = :now
        WHERE id_user = :userId AND lu = FALSE AND id_notification IN (:ids)
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("userId", userId)
            .addValue("ids", notificationIds)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  public int deleteReadOlderThan(Instant threshold) {
    final String sql =
        """
        DELETE FROM notification
        WHERE lu = TRUE
          AND date_creation < :threshold
        """;
    return jdbcTemplate.update(
        sql, new MapSqlParameterSource("threshold", toTimestamp(threshold)));
  }

  private MapSqlParameterSource toParams(Notification notification) {
    return new MapSqlParameterSource()
        .addValue("userId", notification.userId())
        .addValue("type", notification.type().code())
        .addValue("title", notification.title())
        .addValue("message", notification.message())
        .addValue("eventId", notification.eventId())
        .addValue("workId", notification.workId())
        .addValue("programmeId", notification.programmeId())
        .addValue("actionUrl", notification.actionUrl())
        .addValue("priority", notification.priority().code())
        .addValue("emailSent", notification.emailSent())
        .addValue("smsSent", notification.smsSent())
        .addValue("createdAt", toTimestamp(notification.createdAt()));
  }

  private Notification mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new Notification(
        rs.getLong("id_notification"),
        rs.getLong("id_user"),
        NotificationType.fromCode(rs.getString("type_notification")),
        rs.getString("titre"),
        rs.getString("message"),
        rs.getObject("id_evenement", Long.class),
        rs.getObject("id_oeuvre", Long.class),
        rs.getObject("id_programme", Long.class),
        rs.getString("url_action"),
        NotificationPriority.fromCode(rs.getString("priorite")),
        rs.getBoolean("email_envoye"),
        rs.getBoolean("sms_envoye"),
        rs.getBoolean("lu"),
        toInstant(rs, "date_creation"),
        toInstant(rs, "date_lecture"));
  }
}
