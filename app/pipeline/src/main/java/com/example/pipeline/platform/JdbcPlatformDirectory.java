/*
 * どこで: プラットフォームのデータアクセス
 * 何を: プラットフォームのテーブルからユーザー・イベント・プログラム・作品を読む
 * なぜ: DB はプラットフォームと共有し、必要なのは読み取りとリマインダーフラグだけのため
 */
package com.example.pipeline.platform;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.pipeline.config.PlatformProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class JdbcPlatformDirectory implements PlatformDirectory {

  private static final Logger logger = LoggerFactory.getLogger(JdbcPlatformDirectory.class);
  private static final TypeReference<Map<String, String>> LOCALIZED = new TypeReference<>() {};

  // "user" は PostgreSQL の予約語
  private static final String RECIPIENT_COLUMNS =
      """
      u.id_user, u.email, u.nom::text AS nom_json, u.prenom::text AS prenom_json, u.telephone,
      u.langue_preferee, t.nom_type AS type_user, u.email_verifie,
      COALESCE(u.notifications_actives, TRUE) AS notifications_actives,
      COALESCE(u.notifications_email, TRUE) AS notifications_email,
      COALESCE(u.notifications_sms, FALSE) AS notifications_sms,
      COALESCE(u.notification_nouveaux_evenements, TRUE) AS notification_nouveaux_evenements,
      COALESCE(u.notification_modifications_programme, TRUE) AS notification_modifications_programme,
      COALESCE(u.notification_rappels, TRUE) AS notification_rappels,
      COALESCE(u.notification_commentaires, TRUE) AS notification_commentaires,
      COALESCE(u.notification_favoris, TRUE) AS notification_favoris,
      COALESCE(u.accepte_newsletter, FALSE) AS accepte_newsletter
      """;

  private static final String RECIPIENT_FROM =
      """
      FROM "user" u
      LEFT JOIN type_user t ON t.id_type_user = u.id_type_user
      """;

  private static final String EVENT_SELECT =
      """
      SELECT e.id_evenement, e.nom_evenement::text AS nom_json, e.date_debut, e.date_fin, e.statut,
             l.nom AS lieu_nom, c.wilaya_id, e.id_user
      FROM evenement e
      LEFT JOIN lieu l ON l.id_lieu = e.id_lieu
      LEFT JOIN communes c ON c.id_commune = l."communeId"
      """;

  private static final String WORK_SELECT =
      """
      SELECT o.id_oeuvre, o.titre::text AS titre_json, o.saisi_par, o.statut, o.date_creation
      FROM oeuvre o
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final ObjectMapper objectMapper;
  private final PlatformProperties properties;

  @Override
  public Optional<EventView> findEvent(long eventId) {
    final String sql = EVENT_SELECT + "WHERE e.id_evenement = :eventId";
    return jdbcTemplate
        .query(sql, new MapSqlParameterSource("eventId", eventId), this::mapEvent)
        .stream()
        .findFirst();
  }

  @Override
  public Optional<ProgrammeView> findProgramme(long programmeId) {
    final String sql =
        """
        SELECT p.id_programme, p.id_evenement, p.titre::text AS titre_json,
               p.date_programme + COALESCE(p.heure_debut, TIME '00:00') AS starts_local,
               p.lieu_specifique
        FROM programme p
        WHERE p.id_programme = :programmeId
        """;
    return jdbcTemplate
        .query(sql, new MapSqlParameterSource("programmeId", programmeId), this::mapProgramme)
        .stream()
        .findFirst();
  }

  @Override
  public Optional<WorkView> findWork(long workId) {
    final String sql = WORK_SELECT + "WHERE o.id_oeuvre = :workId";
    return jdbcTemplate
        .query(sql, new MapSqlParameterSource("workId", workId), this::mapWork)
        .stream()
        .findFirst();
  }

  @Override
  public Optional<Recipient> findRecipient(long userId) {
    final String sql = "SELECT " + RECIPIENT_COLUMNS + RECIPIENT_FROM + "WHERE u.id_user = :userId";
    return jdbcTemplate
        .query(sql, new MapSqlParameterSource("userId", userId), this::mapRecipient)
        .stream()
        .findFirst();
  }

  @Override
  public List<Recipient> findEventParticipants(long eventId, Set<ParticipationStatus> statuses) {
    if (statuses.isEmpty()) {
      return List.of();
    }
    final String sql =
        "SELECT "
            + RECIPIENT_COLUMNS
            + RECIPIENT_FROM
            + """
            JOIN evenementusers eu ON eu.id_user = u.id_user
            WHERE eu.id_evenement = :eventId
              AND eu.statut_participation IN (:statuses)
            ORDER BY u.id_user
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("eventId", eventId)
            .addValue("statuses", statuses.stream().map(ParticipationStatus::code).toList());
    return jdbcTemplate.query(sql, params, this::mapRecipient);
  }

  @Override
  public List<Recipient> findFollowersOfCreator(long creatorId) {
    final String sql =
        "SELECT "
            + RECIPIENT_COLUMNS
            + RECIPIENT_FROM
            + """
            WHERE u.statut = 'actif'
              AND u.id_user <> :creatorId
              AND EXISTS (
                SELECT 1
                FROM favori f
                JOIN oeuvre o ON o.id_oeuvre = f.id_entite
                WHERE f.id_user = u.id_user
                  AND f.type_entite = 'oeuvre'
                  AND o.saisi_par = :creatorId
              )
            ORDER BY u.id_user
            """;
    return jdbcTemplate.query(
        sql, new MapSqlParameterSource("creatorId", creatorId), this::mapRecipient);
  }

  @Override
  public List<Recipient> findNewsletterSubscribers() {
    final String sql =
        "SELECT "
            + RECIPIENT_COLUMNS
            + RECIPIENT_FROM
            + """
            WHERE u.accepte_newsletter = TRUE
              AND u.statut = 'actif'
              AND u.email_verifie = TRUE
            ORDER BY u.id_user
            """;
    return jdbcTemplate.query(sql, new MapSqlParameterSource(), this::mapRecipient);
  }

  @Override
  public List<Recipient> findActiveUsers(Integer wilaya, int limit) {
    final String sql =
        "SELECT "
            + RECIPIENT_COLUMNS
            + RECIPIENT_FROM
            + """
            WHERE u.statut = 'actif'
              AND (CAST(:wilaya AS integer) IS NULL OR u.wilaya_residence = :wilaya)
            ORDER BY u.id_user
            LIMIT :limit
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("wilaya", wilaya).addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRecipient);
  }

  @Override
  public List<EventView> findEventsStartingBetween(Instant from, Instant to) {
    final String sql =
        EVENT_SELECT
            + """
            WHERE e.date_debut >= :from
              AND e.date_debut < :to
              AND e.statut IN ('planifie', 'publie')
            ORDER BY e.date_debut
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("from", toTimestamp(from))
            .addValue("to", toTimestamp(to));
    return jdbcTemplate.query(sql, params, this::mapEvent);
  }

  @Override
  public List<EventView> findEventsCreatedSince(Instant since, int limit) {
    final String sql =
        EVENT_SELECT
            + """
            WHERE e.date_creation >= :since
              AND e.statut IN ('planifie', 'publie', 'en_cours')
            ORDER BY e.date_creation DESC
            LIMIT :limit
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("since", toTimestamp(since)).addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapEvent);
  }

  @Override
  public List<WorkView> findWorksPublishedSince(Instant since, int limit) {
    final String sql =
        WORK_SELECT
            + """
            WHERE o.statut = 'publie'
              AND o.date_creation >= :since
            ORDER BY o.date_creation DESC
            LIMIT :limit
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("since", toTimestamp(since)).addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapWork);
  }

  @Override
  public boolean markReminderSent(long eventId, long userId, ReminderKind kind) {
    final String column = reminderColumn(kind);
    // 条件付き UPDATE の件数で、この実行が最初にマークしたかを判定する
    final String sql =
        "UPDATE evenementusers SET "
            + column
            + " = TRUE WHERE id_evenement = :eventId AND id_user = :userId AND "
            + column
            + " IS NOT TRUE";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("eventId", eventId).addValue("userId", userId);
    return jdbcTemplate.update(sql, params) > 0;
  }

  @Override
  public void clearReminderSent(long eventId, long userId, ReminderKind kind) {
    final String sql =
        "UPDATE evenementusers SET "
            + reminderColumn(kind)
            + " = FALSE WHERE id_evenement = :eventId AND id_user = :userId";
    jdbcTemplate.update(
        sql, new MapSqlParameterSource().addValue("eventId", eventId).addValue("userId", userId));
  }

  private static String reminderColumn(ReminderKind kind) {
    return switch (kind) {
      case DAY_BEFORE -> "rappel_24h_envoye";
      case STARTING_SOON -> "rappel_derniere_minute";
    };
  }

  @Override
  public List<Recipient> findUnverifiedUsersCreatedBefore(Instant threshold, int limit) {
    final String sql =
        "SELECT "
            + RECIPIENT_COLUMNS
            + RECIPIENT_FROM
            + """
            WHERE u.email_verifie = FALSE
              AND u.rappel_verification_envoye IS NOT TRUE
              AND u.date_creation < :threshold
            ORDER BY u.date_creation
            LIMIT :limit
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("threshold", toTimestamp(threshold))
            .addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRecipient);
  }

  @Override
  public void issueVerificationToken(long userId, String token, Instant expiresAt, Instant now) {
    final String insertSql =
        """
        INSERT INTO email_verifications (id_user, token, type, expires_at, created_at)
        VALUES (:userId, :token, 'email_verification', :expiresAt, :now)
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("userId", userId)
            .addValue("token", token)
            .addValue("expiresAt", toTimestamp(expiresAt))
            .addValue("now", toTimestamp(now));
    jdbcTemplate.update(insertSql, params);
    jdbcTemplate.update(
        "UPDATE \"user\" SET rappel_verification_envoye = TRUE WHERE id_user = :userId",
        new MapSqlParameterSource("userId", userId));
  }

  private Recipient mapRecipient(ResultSet rs, int rowNum) throws SQLException {
    final String language = rs.getString("langue_preferee");
    final Locale locale =
        language == null ? Recipient.DEFAULT_LOCALE : Locale.forLanguageTag(language);
    return new Recipient(
        rs.getLong("id_user"),
        rs.getString("email"),
        localized(rs.getString("prenom_json")).resolve(locale),
        localized(rs.getString("nom_json")).resolve(locale),
        rs.getString("telephone"),
        language,
        UserRole.fromPlatformLabel(rs.getString("type_user")),
        rs.getBoolean("email_verifie"),
        new NotificationPreferences(
            rs.getBoolean("notifications_actives"),
            rs.getBoolean("notifications_email"),
            rs.getBoolean("notifications_sms"),
            rs.getBoolean("notification_nouveaux_evenements"),
            rs.getBoolean("notification_modifications_programme"),
            rs.getBoolean("notification_rappels"),
            rs.getBoolean("notification_commentaires"),
            rs.getBoolean("notification_favoris"),
            rs.getBoolean("accepte_newsletter")));
  }

  private EventView mapEvent(ResultSet rs, int rowNum) throws SQLException {
    final Integer wilaya = rs.getObject("wilaya_id", Integer.class);
    return new EventView(
        rs.getLong("id_evenement"),
        localized(rs.getString("nom_json")),
        toInstant(rs, "date_debut"),
        toInstant(rs, "date_fin"),
        rs.getString("statut"),
        rs.getString("lieu_nom"),
        wilaya,
        rs.getLong("id_user"));
  }

  private ProgrammeView mapProgramme(ResultSet rs, int rowNum) throws SQLException {
    final LocalDateTime startsLocal = rs.getObject("starts_local", LocalDateTime.class);
    return new ProgrammeView(
        rs.getLong("id_programme"),
        rs.getLong("id_evenement"),
        localized(rs.getString("titre_json")),
        startsLocal == null ? null : startsLocal.atZone(properties.zone()).toInstant(),
        rs.getString("lieu_specifique"));
  }

  private WorkView mapWork(ResultSet rs, int rowNum) throws SQLException {
    return new WorkView(
        rs.getLong("id_oeuvre"),
        localized(rs.getString("titre_json")),
        rs.getLong("saisi_par"),
        rs.getString("statut"),
        toInstant(rs, "date_creation"));
  }

  private LocalizedText localized(String json) {
    if (json == null || json.isBlank()) {
      return new LocalizedText(Map.of());
    }
    try {
      return new LocalizedText(objectMapper.readValue(json, LOCALIZED));
    } catch (JsonProcessingException ex) {
      // 旧データは素の文字列を持つため、フランス語の値として扱う
      logger.debug("localized column is not a json object; using raw value");
      return LocalizedText.of(json);
    }
  }
}
