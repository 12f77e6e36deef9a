package com.example.pipeline.audit;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.pipeline.AbstractPostgresContainerTest;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class AuditLogRepositoryTest extends AbstractPostgresContainerTest {

  @Autowired private AuditLogRepository auditLogRepository;

  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @BeforeEach
  void cleanup() {
    jdbcTemplate.update("DELETE FROM audit_log", new MapSqlParameterSource());
  }

  @Test
  void insertStoresDetailsAsJsonb() {
    final UUID id = UUID.randomUUID();
    auditLogRepository.insert(
        new AuditLogRecord(id, "scheduled_task_error", "scheduled_task", "calculate-stats",
            "{\"error\": \"boom\"}", Instant.parse("2026-01-17T00:00:00Z")));

    final Map<String, Object> row =
        jdbcTemplate.queryForMap(
            "SELECT action, entity_id, details ->> 'error' AS error FROM audit_log WHERE id = :id",
            new MapSqlParameterSource("id", id));
    assertThat(row.get("action")).isEqualTo("scheduled_task_error");
    assertThat(row.get("entity_id")).isEqualTo("calculate-stats");
    assertThat(row.get("error")).isEqualTo("boom");
  }
}
