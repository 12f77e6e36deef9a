/*
 * どこで: 保守データアクセスのテスト
 * 何を: トークン掃除・イベント状態遷移・アーカイブ・日次統計の SQL を確認する
 */
package com.example.pipeline.maintenance;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.pipeline.AbstractPostgresContainerTest;
import com.example.pipeline.PlatformFixtures;
import com.example.pipeline.notification.Notification;
import com.example.pipeline.notification.NotificationPriority;
import com.example.pipeline.notification.NotificationRepository;
import com.example.pipeline.notification.NotificationType;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class JdbcPlatformMaintenanceRepositoryTest extends AbstractPostgresContainerTest {

  private static final Instant NOW = Instant.parse("2026-01-17T00:00:00Z");

  @Autowired private JdbcPlatformMaintenanceRepository repository;

  @Autowired private NotificationRepository notificationRepository;

  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  private PlatformFixtures fixtures;

  @BeforeEach
  void setUp() {
    fixtures = new PlatformFixtures(jdbcTemplate);
    fixtures.clear();
    fixtures.user(1, "orga@example.dz").insert();
  }

  @Test
  void deleteExpiredVerificationTokensRemovesExpiredAndUsedTokens() {
    fixtures.verification(1, "expired", NOW.minusSeconds(1), null);
    fixtures.verification(1, "used", NOW.plus(Duration.ofHours(1)), NOW.minusSeconds(60));
    fixtures.verification(1, "valid", NOW.plus(Duration.ofHours(1)), null);

    assertThat(repository.deleteExpiredVerificationTokens(NOW)).isEqualTo(2);

    assertThat(
            jdbcTemplate.queryForList(
                "SELECT token FROM email_verifications", new MapSqlParameterSource(), String.class))
        .containsExactly("valid");
  }

  @Test
  void startAndFinishEventsFollowTheirDates() {
    fixtures.event(100, "{\"fr\": \"En cours\"}", NOW.minusSeconds(60), NOW.plusSeconds(3600),
        "publie", null, 1, NOW);
    fixtures.event(101, "{\"fr\": \"Futur\"}", NOW.plusSeconds(60), NOW.plusSeconds(3600),
        "publie", null, 1, NOW);
    fixtures.event(102, "{\"fr\": \"Fini\"}", NOW.minus(Duration.ofDays(2)), NOW.minus(Duration.ofDays(1)),
        "en_cours", null, 1, NOW);
    fixtures.event(103, "{\"fr\": \"Annulé\"}", NOW.minus(Duration.ofDays(2)), NOW.minus(Duration.ofDays(1)),
        "annule", null, 1, NOW);

    assertThat(repository.finishEvents(NOW)).isEqualTo(1);
    assertThat(repository.startEvents(NOW)).isEqualTo(1);

    assertThat(status(100)).isEqualTo("en_cours");
    assertThat(status(101)).isEqualTo("publie");
    assertThat(status(102)).isEqualTo("termine");
    assertThat(status(103)).isEqualTo("annule");
  }

  @Test
  void archiveEventsEndedBeforeOnlyTouchesFinishedEvents() {
    final Instant threshold = Instant.parse("2025-07-17T00:00:00Z");
    fixtures.event(100, "{\"fr\": \"Vieux\"}", threshold.minus(Duration.ofDays(10)),
        threshold.minus(Duration.ofDays(9)), "termine", null, 1, NOW);
    fixtures.event(101, "{\"fr\": \"Récent\"}", threshold.plus(Duration.ofDays(1)),
        threshold.plus(Duration.ofDays(2)), "termine", null, 1, NOW);

    assertThat(repository.archiveEventsEndedBefore(threshold)).isEqualTo(1);

    assertThat(status(100)).isEqualTo("archive");
    assertThat(status(101)).isEqualTo("termine");
  }

  @Test
  void computeDailyStatsCountsRowsInsideTheDay() {
    final Instant from = Instant.parse("2026-01-15T23:00:00Z");
    final Instant to = Instant.parse("2026-01-16T23:00:00Z");
    fixtures.user(2, "new@example.dz").createdAt(from.plusSeconds(60)).lastLogin(from.plusSeconds(120)).insert();
    fixtures.user(3, "late@example.dz").createdAt(to).insert();
    fixtures.work(20, "{\"fr\": \"Oeuvre\"}", 2, "publie", from.plusSeconds(300));
    fixtures.event(100, "{\"fr\": \"Festival\"}", NOW, null, "publie", null, 1, from);
    notificationRepository.insertAll(
        List.of(
            notification(2, true, from.plusSeconds(10)),
            notification(2, false, from.plusSeconds(20)),
            notification(2, true, to.plusSeconds(1))));

    final DailyStats stats = repository.computeDailyStats(LocalDate.of(2026, 1, 16), from, to);

    assertThat(stats.statDate()).isEqualTo(LocalDate.of(2026, 1, 16));
    assertThat(stats.newUsers()).isEqualTo(1);
    assertThat(stats.newWorks()).isEqualTo(1);
    assertThat(stats.newEvents()).isEqualTo(1);
    assertThat(stats.activeUsers()).isEqualTo(1);
    assertThat(stats.notificationsCreated()).isEqualTo(2);
    assertThat(stats.emailsSent()).isEqualTo(1);
  }

  @Test
  void saveDailyStatsUpsertsByDay() {
    final LocalDate day = LocalDate.of(2026, 1, 16);
    repository.saveDailyStats(new DailyStats(day, 1, 2, 3, 4, 5, 6), NOW);
    repository.saveDailyStats(new DailyStats(day, 10, 20, 30, 40, 50, 60), NOW.plusSeconds(60));

    final Map<String, Object> row =
        jdbcTemplate.queryForMap(
            "SELECT * FROM pipeline_daily_stats", new MapSqlParameterSource());
    assertThat(row.get("new_users")).isEqualTo(10L);
    assertThat(row.get("emails_sent")).isEqualTo(60L);
  }

  private String status(long eventId) {
    return jdbcTemplate.queryForObject(
        "SELECT statut FROM evenement WHERE id_evenement = :id",
        new MapSqlParameterSource("id", eventId),
        String.class);
  }

  private static Notification notification(long userId, boolean emailSent, Instant createdAt) {
    return new Notification(null, userId, NotificationType.NEW_EVENT, "Titre", "Message", null,
        null, null, null, NotificationPriority.NORMAL, emailSent, false, false, createdAt, null);
  }
}
