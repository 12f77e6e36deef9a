package com.example.pipeline.audit;

import static com.example.common.JdbcTimestampUtils.toTimestamp;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class AuditLogRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public void insert(AuditLogRecord auditLogRecord) {
    final String sql =
        """
        INSERT INTO audit_log (id, action, entity_type, entity_id, details, created_at)
        VALUES (:id, :action, :entityType, :entityId, CAST(:detailsJson AS jsonb), :createdAt)
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", auditLogRecord.id())
            .addValue("action", auditLogRecord.action())
            .addValue("entityType", auditLogRecord.entityType())
            .addValue("entityId", auditLogRecord.entityId())
            .addValue("detailsJson", auditLogRecord.detailsJson())
            .addValue("createdAt", toTimestamp(auditLogRecord.createdAt()));
    jdbcTemplate.update(sql, params);
  }
}
