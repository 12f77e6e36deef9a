package com.example.pipeline;

import static com.example.common.JdbcTimestampUtils.toTimestamp;

import java.sql.Date;
import java.sql.Time;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

/** Inserts rows into the platform tables for repository tests. */
public final class PlatformFixtures {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public PlatformFixtures(NamedParameterJdbcTemplate jdbcTemplate) {
    this.jdbcTemplate = jdbcTemplate;
  }

  public void clear() {
    for (String table :
        new String[] {
          "email_verifications", "favori", "programme", "evenementusers", "evenement", "oeuvre",
          "\"user\"", "lieu", "communes", "type_user", "notification", "pipeline_daily_stats"
        }) {
      jdbcTemplate.update("DELETE FROM " + table, new MapSqlParameterSource());
    }
  }

  public void userType(long id, String label) {
    jdbcTemplate.update(
        "INSERT INTO type_user (id_type_user, nom_type) VALUES (:id, :label)",
        new MapSqlParameterSource().addValue("id", id).addValue("label", label));
  }

  public UserRow user(long id, String email) {
    return new UserRow(id, email);
  }

  public void venue(long venueId, String name, long communeId, int wilaya) {
    jdbcTemplate.update(
        "INSERT INTO communes (id_commune, wilaya_id) VALUES (:id, :wilaya)",
        new MapSqlParameterSource().addValue("id", communeId).addValue("wilaya", wilaya));
    jdbcTemplate.update(
        "INSERT INTO lieu (id_lieu, nom, \"communeId\") VALUES (:id, :name, :communeId)",
        new MapSqlParameterSource()
            .addValue("id", venueId)
            .addValue("name", name)
            .addValue("communeId", communeId));
  }

  public void event(
      long eventId, String nameJson, Instant startsAt, Instant endsAt, String status,
      Long venueId, long organizerId, Instant createdAt) {
    jdbcTemplate.update(
        """
        INSERT INTO evenement (
          id_evenement, nom_evenement, date_debut, date_fin, statut, id_lieu, id_user, date_creation
        ) VALUES (
          :id, CAST(:name AS jsonb), :startsAt, :endsAt, :status, :venueId, :organizerId, :createdAt
        )
        """,
        new MapSqlParameterSource()
            .addValue("id", eventId)
            .addValue("name", nameJson)
            .addValue("startsAt", toTimestamp(startsAt))
            .addValue("endsAt", toTimestamp(endsAt))
            .addValue("status", status)
            .addValue("venueId", venueId)
            .addValue("organizerId", organizerId)
            .addValue("createdAt", toTimestamp(createdAt)));
  }

  public void participant(long eventId, long userId, String status) {
    jdbcTemplate.update(
        """
        INSERT INTO evenementusers (id_evenement, id_user, statut_participation)
        VALUES (:eventId, :userId, :status)
        """,
        new MapSqlParameterSource()
            .addValue("eventId", eventId)
            .addValue("userId", userId)
            .addValue("status", status));
  }

  public void programme(
      long programmeId, long eventId, String titleJson, LocalDate day, LocalTime start, String place) {
    jdbcTemplate.update(
        """
        INSERT INTO programme (
          id_programme, id_evenement, titre, date_programme, heure_debut, lieu_specifique
        ) VALUES (:id, :eventId, CAST(:title AS jsonb), :day, :start, :place)
        """,
        new MapSqlParameterSource()
            .addValue("id", programmeId)
            .addValue("eventId", eventId)
            .addValue("title", titleJson)
            .addValue("day", day == null ? null : Date.valueOf(day))
            .addValue("start", start == null ? null : Time.valueOf(start))
            .addValue("place", place));
  }

  public void work(long workId, String titleJson, long creatorId, String status, Instant createdAt) {
    jdbcTemplate.update(
        """
        INSERT INTO oeuvre (id_oeuvre, titre, saisi_par, statut, date_creation)
        VALUES (:id, CAST(:title AS jsonb), :creatorId, :status, :createdAt)
        """,
        new MapSqlParameterSource()
            .addValue("id", workId)
            .addValue("title", titleJson)
            .addValue("creatorId", creatorId)
            .addValue("status", status)
            .addValue("createdAt", toTimestamp(createdAt)));
  }

  public void favorite(long userId, long workId) {
    jdbcTemplate.update(
        """
        INSERT INTO favori (id_user, type_entite, id_entite)
        VALUES (:userId, 'oeuvre', :workId)
        """,
        new MapSqlParameterSource().addValue("userId", userId).addValue("workId", workId));
  }

  public void verification(long userId, String token, Instant expiresAt, Instant usedAt) {
    jdbcTemplate.update(
        """
        INSERT INTO email_verifications (id_user, token, type, expires_at, used_at)
        VALUES (:userId, :token, 'email_verification', :expiresAt, :usedAt)
        """,
        new MapSqlParameterSource()
            .addValue("userId", userId)
            .addValue("token", token)
            .addValue("expiresAt", toTimestamp(expiresAt))
            .addValue("usedAt", toTimestamp(usedAt)));
  }

  /** Builder for a "user" row; unset columns keep their table defaults. */
  public final class UserRow {
    private final MapSqlParameterSource params = new MapSqlParameterSource();

    private UserRow(long id, String email) {
      params
          .addValue("id", id)
          .addValue("email", email)
          .addValue("nom", "{\"fr\": \"Haddad\"}")
          .addValue("prenom", "{\"fr\": \"Amina\"}")
          .addValue("telephone", null)
          .addValue("langue", "fr")
          .addValue("typeId", null)
          .addValue("statut", "actif")
          .addValue("verified", true)
          .addValue("newsletter", false)
          .addValue("wilaya", null)
          .addValue("sms", false)
          .addValue("createdAt", toTimestamp(Instant.parse("2026-01-01T00:00:00Z")))
          .addValue("lastLogin", null);
    }

    public UserRow names(String lastNameJson, String firstNameJson) {
      params.addValue("nom", lastNameJson).addValue("prenom", firstNameJson);
      return this;
    }

    public UserRow phone(String phone) {
      params.addValue("telephone", phone);
      return this;
    }

    public UserRow language(String language) {
      params.addValue("langue", language);
      return this;
    }

    public UserRow type(long typeId) {
      params.addValue("typeId", typeId);
      return this;
    }

    public UserRow status(String status) {
      params.addValue("statut", status);
      return this;
    }

    public UserRow verified(boolean verified) {
      params.addValue("verified", verified);
      return this;
    }

    public UserRow newsletter(boolean newsletter) {
      params.addValue("newsletter", newsletter);
      return this;
    }

    public UserRow wilaya(Integer wilaya) {
      params.addValue("wilaya", wilaya);
      return this;
    }

    public UserRow sms(boolean sms) {
      params.addValue("sms", sms);
      return this;
    }

    public UserRow createdAt(Instant createdAt) {
      params.addValue("createdAt", toTimestamp(createdAt));
      return this;
    }

    public UserRow lastLogin(Instant lastLogin) {
      params.addValue("lastLogin", toTimestamp(lastLogin));
      return this;
    }

    public void insert() {
      jdbcTemplate.update(
          """
          INSERT INTO "user" (
            id_user, email, nom, prenom, telephone, langue_preferee, id_type_user, statut,
            email_verifie, accepte_newsletter, wilaya_residence, notifications_sms,
            date_creation, derniere_connexion
          ) VALUES (
            :id, :email, CAST(:nom AS jsonb), CAST(:prenom AS jsonb), :telephone, :langue, :typeId,
            :statut, :verified, :newsletter, :wilaya, :sms, :createdAt, :lastLogin
          )
          """,
          params);
    }
  }
}
