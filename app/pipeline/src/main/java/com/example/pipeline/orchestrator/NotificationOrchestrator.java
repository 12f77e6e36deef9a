/*
 * どこで: 通知オーケストレータ
 * 何を: プラットフォームのトリガーを受信者ごとの通知・配信・履歴行に変換する
 * なぜ: 全トリガーで 解決→絞り込み→生成→配信→保存 の同じ手順を踏むため
 */
package com.example.pipeline.orchestrator;

import com.example.pipeline.channel.EmailMessage;
import com.example.pipeline.config.NotificationProperties;
import com.example.pipeline.dispatch.DeliveryOutcome;
import com.example.pipeline.dispatch.DeliveryStrategySelector;
import com.example.pipeline.dispatch.OutboundMessage;
import com.example.pipeline.notification.Notification;
import com.example.pipeline.notification.NotificationPriority;
import com.example.pipeline.notification.NotificationRepository;
import com.example.pipeline.notification.NotificationType;
import com.example.pipeline.notification.PendingNotification;
import com.example.pipeline.platform.EventView;
import com.example.pipeline.platform.LocalizedText;
import com.example.pipeline.platform.NotificationPreferences;
import com.example.pipeline.platform.ParticipationStatus;
import com.example.pipeline.platform.PlatformDirectory;
import com.example.pipeline.platform.ProgrammeView;
import com.example.pipeline.platform.Recipient;
import com.example.pipeline.platform.ReminderKind;
import com.example.pipeline.platform.WorkView;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * One public method per platform trigger.
 *
 * <p>Each method throws {@link EntityNotFoundException} when the triggering entity does not
 * exist, returns a zero result when nobody is concerned, drops recipients whose preferences
 * exclude the notification before rendering anything, dispatches through {@link
 * DeliveryStrategySelector}, and writes one notification row per allowed recipient after the
 * delivery attempt. Rows of queued deliveries are written by their job instead, with the
 * provider's answer. Delivery and persistence failures are logged and counted, never thrown.
 */
@Service
@RequiredArgsConstructor
public class NotificationOrchestrator {

  private static final Logger logger = LoggerFactory.getLogger(NotificationOrchestrator.class);

  private static final String ENTITY_EVENT = "event";
  private static final String ENTITY_PROGRAMME = "programme";
  private static final String ENTITY_WORK = "work";
  private static final String ENTITY_USER = "user";

  private final PlatformDirectory directory;
  private final MessageRenderer renderer;
  private final DeliveryStrategySelector deliverySelector;
  private final NotificationRepository notificationRepository;
  private final NotificationProperties properties;
  private final Clock clock;

  public NotificationResult notifyParticipationDecision(
      long eventId, long userId, ParticipationDecision decision, String notes) {
    final EventView event = requireEvent(eventId);
    final Recipient recipient = requireUser(userId);
    final String key =
        decision == ParticipationDecision.ACCEPTED
            ? "participation.accepted"
            : "participation.refused";
    return notifyEach(
        NotificationType.PARTICIPATION_DECISION,
        List.of(recipient),
        r -> true,
        r ->
            draft(
                MessageSpec.of(key, event.name(), event.startsAt())
                    .withNote(notes)
                    .withActionUrl(eventPath(eventId)),
                r,
                eventId,
                null,
                null,
                NotificationPriority.HIGH,
                true,
                false));
  }

  public NotificationResult notifyEventCancelled(long eventId, String reason) {
    final EventView event = requireEvent(eventId);
    final List<Recipient> participants =
        directory.findEventParticipants(
            eventId,
            EnumSet.of(
                ParticipationStatus.REGISTERED,
                ParticipationStatus.CONFIRMED,
                ParticipationStatus.PENDING));
    return notifyEach(
        NotificationType.EVENT_CANCELLED,
        participants,
        r -> true,
        r ->
            draft(
                MessageSpec.of("event.cancelled", event.name(), event.startsAt())
                    .withNote(reason)
                    .withActionUrl(eventPath(eventId)),
                r,
                eventId,
                null,
                null,
                NotificationPriority.HIGH,
                true,
                true));
  }

  public NotificationResult notifyProgrammeChanged(
      long programmeId, ProgrammeChangeType changeType) {
    final ProgrammeView programme =
        directory
            .findProgramme(programmeId)
            .orElseThrow(() -> new EntityNotFoundException(ENTITY_PROGRAMME, programmeId));
    final EventView event = requireEvent(programme.eventId());
    final List<Recipient> participants =
        directory.findEventParticipants(event.eventId(), EnumSet.of(ParticipationStatus.CONFIRMED));
    final String location = programme.location() == null ? event.venue() : programme.location();
    return notifyEach(
        NotificationType.PROGRAMME_CHANGED,
        participants,
        r -> true,
        r ->
            draft(
                MessageSpec.of(
                        "programme." + changeType.code(),
                        programme.title(),
                        event.name(),
                        programme.startsAt(),
                        location)
                    .withActionUrl(eventPath(event.eventId())),
                r,
                event.eventId(),
                null,
                programmeId,
                changeType == ProgrammeChangeType.CANCELLED
                    ? NotificationPriority.HIGH
                    : NotificationPriority.NORMAL,
                true,
                false));
  }

  public NotificationResult notifyNewComment(long workId, long authorId, String excerpt) {
    final WorkView work = requireWork(workId);
    if (work.creatorId() == authorId) {
      return NotificationResult.empty();
    }
    final String authorName = displayNameOf(authorId);
    final String shortExcerpt = truncate(excerpt, properties.excerptMaxLength());
    return notifyEach(
        NotificationType.NEW_COMMENT,
        ownerOf(work),
        r -> true,
        r ->
            draft(
                MessageSpec.of("comment.new", authorName, work.title(), shortExcerpt)
                    .withActionUrl(workPath(workId)),
                r,
                null,
                workId,
                null,
                NotificationPriority.NORMAL,
                true,
                false));
  }

  public NotificationResult notifyNewFavorite(long workId, long userId) {
    final WorkView work = requireWork(workId);
    if (work.creatorId() == userId) {
      return NotificationResult.empty();
    }
    final String likerName = displayNameOf(userId);
    return notifyEach(
        NotificationType.NEW_FAVORITE,
        ownerOf(work),
        r -> true,
        r ->
            draft(
                MessageSpec.of("favorite.new", likerName, work.title())
                    .withActionUrl(workPath(workId)),
                r,
                null,
                workId,
                null,
                NotificationPriority.LOW,
                true,
                false));
  }

  public NotificationResult notifyNewWork(long workId) {
    final WorkView work = requireWork(workId);
    final String creatorName = displayNameOf(work.creatorId());
    final List<Recipient> followers = directory.findFollowersOfCreator(work.creatorId());
    return notifyEach(
        NotificationType.NEW_WORK,
        followers,
        r -> true,
        r ->
            draft(
                MessageSpec.of("work.new", creatorName, work.title())
                    .withActionUrl(workPath(workId)),
                r,
                null,
                workId,
                null,
                NotificationPriority.NORMAL,
                true,
                false));
  }

  public NotificationResult notifyModerationAction(
      long userId, ModerationAction action, Long workId, String reason) {
    final Recipient recipient = requireUser(userId);
    final LocalizedText workTitle = workId == null ? null : requireWork(workId).title();
    return notifyEach(
        NotificationType.MODERATION,
        List.of(recipient),
        r -> true,
        r ->
            draft(
                MessageSpec.of("moderation." + action.key(), workTitle)
                    .withNote(reason)
                    .withActionUrl(workId == null ? "/profil" : workPath(workId)),
                r,
                null,
                workId,
                null,
                action == ModerationAction.SUSPENDED
                    ? NotificationPriority.URGENT
                    : NotificationPriority.HIGH,
                true,
                false));
  }

  /** Weekly digest of new events and works; skipped when there is nothing new. */
  public NotificationResult sendNewsletter() {
    final Instant since = Instant.now(clock).minus(properties.newsletterLookback());
    final int limit = properties.newsletterItemLimit();
    final List<EventView> events = directory.findEventsCreatedSince(since, limit);
    final List<WorkView> works = directory.findWorksPublishedSince(since, limit);
    if (events.isEmpty() && works.isEmpty()) {
      logger.info("newsletter skipped because nothing was published since={}", since);
      return NotificationResult.empty();
    }
    final List<Recipient> subscribers = directory.findNewsletterSubscribers();
    if (subscribers.isEmpty()) {
      return NotificationResult.empty();
    }
    final List<Recipient> allowed = filter(subscribers, NotificationType.NEWSLETTER, r -> true);
    final List<NotificationDraft> drafts = new ArrayList<>(allowed.size());
    final List<OutboundMessage> messages = new ArrayList<>(allowed.size());
    for (Recipient recipient : allowed) {
      final NotificationDraft draft =
          draft(
              MessageSpec.of("newsletter.weekly", events.size(), works.size())
                  .withNote(newsletterItems(events, works, recipient.locale()))
                  .withActionUrl("/"),
              recipient,
              null,
              null,
              null,
              NotificationPriority.LOW,
              true,
              false);
      drafts.add(draft);
      messages.add(outbound(NotificationType.NEWSLETTER, recipient, draft));
    }
    final String campaign = "newsletter-" + Instant.now(clock).getEpochSecond();
    final List<DeliveryOutcome> outcomes = deliverySelector.deliverBulk(campaign, messages);
    return persistAndCount(
        NotificationType.NEWSLETTER, subscribers.size(), allowed, drafts, outcomes);
  }

  /**
   * 24h reminder for confirmed participants. Outside the reminder window (measured now, not when
   * the caller looked the event up) the call is a no-op; each participant is reminded once.
   */
  public NotificationResult sendEventReminder(long eventId) {
    final EventView event = requireEvent(eventId);
    final Instant now = Instant.now(clock);
    final Instant windowStart = now.plus(properties.reminderWindowStart());
    final Instant windowEnd = now.plus(properties.reminderWindowEnd());
    if (!isWithin(event.startsAt(), windowStart, windowEnd)) {
      logger.debug(
          "event reminder outside window eventId={} startsAt={}", eventId, event.startsAt());
      return NotificationResult.empty();
    }
    final List<Recipient> participants =
        directory.findEventParticipants(eventId, EnumSet.of(ParticipationStatus.CONFIRMED));
    return notifyEach(
        NotificationType.EVENT_REMINDER,
        participants,
        // トレードオフ: マーカーは送信前に確保し、直接送信が失敗したときだけ戻す
        // 理由: 重なった実行が同じ参加者へ二重に送らないようにする
        r -> directory.markReminderSent(eventId, r.userId(), ReminderKind.DAY_BEFORE),
        r -> directory.clearReminderSent(eventId, r.userId(), ReminderKind.DAY_BEFORE),
        r ->
            draft(
                MessageSpec.of("reminder.day_before", event.name(), event.startsAt(), event.venue())
                    .withActionUrl(eventPath(eventId)),
                r,
                eventId,
                null,
                null,
                NotificationPriority.HIGH,
                true,
                true));
  }

  /** In-app only reminder for events starting within the next hour. */
  public NotificationResult notifyEventStartingSoon(long eventId) {
    final EventView event = requireEvent(eventId);
    final Instant now = Instant.now(clock);
    if (!isWithin(event.startsAt(), now, now.plus(properties.startingSoonWindow()))) {
      return NotificationResult.empty();
    }
    final List<Recipient> participants =
        directory.findEventParticipants(eventId, EnumSet.of(ParticipationStatus.CONFIRMED));
    return notifyEach(
        NotificationType.EVENT_REMINDER,
        participants,
        r -> directory.markReminderSent(eventId, r.userId(), ReminderKind.STARTING_SOON),
        r ->
            draft(
                MessageSpec.of(
                        "reminder.starting_soon", event.name(), event.startsAt(), event.venue())
                    .withActionUrl(eventPath(eventId)),
                r,
                eventId,
                null,
                null,
                NotificationPriority.URGENT,
                false,
                false));
  }

  /** Announces an event to active users, optionally only those living in the event's wilaya. */
  public NotificationResult notifyNewEvent(long eventId, boolean regionOnly) {
    final EventView event = requireEvent(eventId);
    final Integer wilaya = regionOnly ? event.wilaya() : null;
    final List<Recipient> audience =
        directory.findActiveUsers(wilaya, properties.newEventRecipientLimit()).stream()
            .filter(r -> r.userId() != event.organizerId())
            .toList();
    return notifyEach(
        NotificationType.NEW_EVENT,
        audience,
        r -> true,
        r ->
            draft(
                MessageSpec.of("event.new", event.name(), event.startsAt(), event.venue())
                    .withActionUrl(eventPath(eventId)),
                r,
                eventId,
                null,
                null,
                NotificationPriority.NORMAL,
                true,
                false));
  }

  /** Issues a fresh verification token and mails it; verified users are skipped. */
  public NotificationResult remindEmailVerification(long userId) {
    final Recipient recipient = requireUser(userId);
    if (recipient.emailVerified()) {
      return NotificationResult.empty();
    }
    final Instant now = Instant.now(clock);
    final String token = UUID.randomUUID().toString().replace("-", "");
    directory.issueVerificationToken(
        userId, token, now.plus(properties.verificationTokenTtl()), now);
    return notifyEach(
        NotificationType.ACCOUNT_VERIFICATION,
        List.of(recipient),
        r -> true,
        r ->
            draft(
                MessageSpec.of("verification.reminder", properties.verificationTokenTtl().toHours())
                    .withActionUrl("/verify-email?token=" + token),
                r,
                null,
                null,
                null,
                NotificationPriority.HIGH,
                true,
                false));
  }

  private NotificationResult notifyEach(
      NotificationType type,
      List<Recipient> recipients,
      Predicate<Recipient> extraFilter,
      Function<Recipient, NotificationDraft> compose) {
    return notifyEach(type, recipients, extraFilter, r -> {}, compose);
  }

  /**
   * {@code onUndelivered} runs for recipients whose direct send failed, so a claim taken in
   * {@code extraFilter} (reminder markers) can be given back for the next tick.
   */
  private NotificationResult notifyEach(
      NotificationType type,
      List<Recipient> recipients,
      Predicate<Recipient> extraFilter,
      Consumer<Recipient> onUndelivered,
      Function<Recipient, NotificationDraft> compose) {
    if (recipients.isEmpty()) {
      return NotificationResult.empty();
    }
    final List<Recipient> allowed = filter(recipients, type, extraFilter);
    final List<NotificationDraft> drafts = new ArrayList<>(allowed.size());
    final List<DeliveryOutcome> outcomes = new ArrayList<>(allowed.size());
    for (Recipient recipient : allowed) {
      final NotificationDraft draft = compose.apply(recipient);
      drafts.add(draft);
      final DeliveryOutcome outcome = deliverySelector.deliver(outbound(type, recipient, draft));
      if (!outcome.delivered() && !outcome.queued()) {
        onUndelivered.accept(recipient);
      }
      outcomes.add(outcome);
    }
    return persistAndCount(type, recipients.size(), allowed, drafts, outcomes);
  }

  private List<Recipient> filter(
      List<Recipient> recipients, NotificationType type, Predicate<Recipient> extraFilter) {
    return recipients.stream()
        .filter(r -> preferencesOf(r).allows(type.category()))
        .filter(extraFilter)
        .toList();
  }

  private OutboundMessage outbound(
      NotificationType type, Recipient recipient, NotificationDraft draft) {
    final NotificationPreferences preferences = preferencesOf(recipient);
    final RenderedMessage message = draft.message();
    final EmailMessage email =
        draft.allowEmail() && preferences.wantsEmail(type.category()) && recipient.email() != null
            ? EmailMessage.of(
                recipient.email(),
                message.emailSubject(),
                message.emailText(),
                message.emailHtml())
            : null;
    final boolean sms =
        draft.allowSms() && preferences.sms() && recipient.hasPhone() && message.smsText() != null;
    return new OutboundMessage(
        recipient.userId(),
        type,
        email,
        sms ? recipient.phone() : null,
        sms ? message.smsText() : null,
        PendingNotification.of(
            recipient.userId(),
            type,
            message.title(),
            message.body(),
            draft.eventId(),
            draft.workId(),
            draft.programmeId(),
            draft.actionUrl(),
            draft.priority()));
  }

  private NotificationResult persistAndCount(
      NotificationType type,
      int totalCount,
      List<Recipient> allowed,
      List<NotificationDraft> drafts,
      List<DeliveryOutcome> outcomes) {
    final Instant now = Instant.now(clock);
    final List<Notification> rows = new ArrayList<>(allowed.size());
    int notified = 0;
    int queued = 0;
    for (int i = 0; i < allowed.size(); i++) {
      final DeliveryOutcome outcome = outcomes.get(i);
      final NotificationDraft draft = drafts.get(i);
      if (outcome.queued()) {
        // 前提: queue 経由の行はプロバイダの応答後に job が書く
        queued++;
        continue;
      }
      if (outcome.delivered()) {
        notified++;
      }
      rows.add(
          new Notification(
              null,
              allowed.get(i).userId(),
              type,
              draft.message().title(),
              draft.message().body(),
              draft.eventId(),
              draft.workId(),
              draft.programmeId(),
              draft.actionUrl(),
              draft.priority(),
              outcome.emailSent(),
              outcome.smsSent(),
              false,
              now,
              null));
    }
    persist(type, rows);
    logger.info(
        "notifications dispatched type={} notified={} queued={} allowed={} total={}",
        type.code(),
        notified,
        queued,
        allowed.size(),
        totalCount);
    return new NotificationResult(notified, queued, totalCount);
  }

  private void persist(NotificationType type, List<Notification> rows) {
    if (rows.isEmpty()) {
      return;
    }
    try {
      notificationRepository.insertAll(rows);
    } catch (DataAccessException ex) {
      // トレードオフ: 配信は済んでいるため、トリガーを失敗させず履歴行の欠落を許容する
      logger.error(
          "notification history insert failed type={} rows={}", type.code(), rows.size(), ex);
    }
  }

  private NotificationDraft draft(
      MessageSpec spec,
      Recipient recipient,
      Long eventId,
      Long workId,
      Long programmeId,
      NotificationPriority priority,
      boolean allowEmail,
      boolean allowSms) {
    return new NotificationDraft(
        renderer.render(spec, recipient),
        eventId,
        workId,
        programmeId,
        spec.actionUrl(),
        priority,
        allowEmail,
        allowSms);
  }

  private String newsletterItems(List<EventView> events, List<WorkView> works, Locale locale) {
    final List<String> lines = new ArrayList<>(events.size() + works.size());
    for (EventView event : events) {
      final String startsAt = renderer.formatInstant(event.startsAt(), locale);
      lines.add("- " + event.name().resolve(locale) + " (" + startsAt + ")");
    }
    for (WorkView work : works) {
      lines.add("- " + work.title().resolve(locale));
    }
    return String.join("\n", lines);
  }

  private EventView requireEvent(long eventId) {
    return directory
        .findEvent(eventId)
        .orElseThrow(() -> new EntityNotFoundException(ENTITY_EVENT, eventId));
  }

  private WorkView requireWork(long workId) {
    return directory
        .findWork(workId)
        .orElseThrow(() -> new EntityNotFoundException(ENTITY_WORK, workId));
  }

  private Recipient requireUser(long userId) {
    return directory
        .findRecipient(userId)
        .orElseThrow(() -> new EntityNotFoundException(ENTITY_USER, userId));
  }

  private List<Recipient> ownerOf(WorkView work) {
    return directory.findRecipient(work.creatorId()).map(List::of).orElse(List.of());
  }

  private String displayNameOf(long userId) {
    return directory.findRecipient(userId).map(Recipient::displayName).orElse("");
  }

  private static NotificationPreferences preferencesOf(Recipient recipient) {
    return recipient.preferences() == null
        ? NotificationPreferences.allEnabled()
        : recipient.preferences();
  }

  private static boolean isWithin(Instant value, Instant from, Instant to) {
    return value != null && !value.isBefore(from) && !value.isAfter(to);
  }

  private static String truncate(String value, int maxLength) {
    if (value == null || value.length() <= maxLength) {
      return value;
    }
    return value.substring(0, maxLength) + "...";
  }

  private static String eventPath(long eventId) {
    return "/evenements/" + eventId;
  }

  private static String workPath(long workId) {
    return "/oeuvres/" + workId;
  }
}
