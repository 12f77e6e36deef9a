/*
 * どこで: プラットフォームデータのポート
 * 何を: 通知のきっかけになるエンティティの読み取りとリマインダーマーカー
 * なぜ: オーケストレータがスキーマを所有せずにエンティティと受信者を解決するため
 */
package com.example.pipeline.platform;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

public interface PlatformDirectory {

  Optional<EventView> findEvent(long eventId);

  Optional<ProgrammeView> findProgramme(long programmeId);

  Optional<WorkView> findWork(long workId);

  Optional<Recipient> findRecipient(long userId);

  List<Recipient> findEventParticipants(long eventId, Set<ParticipationStatus> statuses);

  /** Users who favorited at least one work of {@code creatorId}, the creator excluded. */
  List<Recipient> findFollowersOfCreator(long creatorId);

  /** Active, verified users who accepted the newsletter. */
  List<Recipient> findNewsletterSubscribers();

  List<Recipient> findActiveUsers(Integer wilaya, int limit);

  List<EventView> findEventsStartingBetween(Instant from, Instant to);

  List<EventView> findEventsCreatedSince(Instant since, int limit);

  List<WorkView> findWorksPublishedSince(Instant since, int limit);

  /**
   * Marks a reminder as sent for one participant.
   *
   * @return false when it was already marked, so concurrent or adjacent runs send it once
   */
  boolean markReminderSent(long eventId, long userId, ReminderKind kind);

  /** Gives back a marker whose reminder could not be delivered. */
  void clearReminderSent(long eventId, long userId, ReminderKind kind);

  List<Recipient> findUnverifiedUsersCreatedBefore(Instant threshold, int limit);

  /** Stores a new email verification token and flags the reminder on the user. */
  void issueVerificationToken(long userId, String token, Instant expiresAt, Instant now);
}
