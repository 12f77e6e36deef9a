/*
 * どこで: 定期タスクの本体
 * 何を: pipeline の各定期タスクが行う処理
 * なぜ: スケジューラと runNow とテストが同じコードを呼べるよう素のメソッドにするため
 */
package com.example.pipeline.maintenance;

import com.example.pipeline.config.MaintenanceProperties;
import com.example.pipeline.config.NotificationProperties;
import com.example.pipeline.config.PlatformProperties;
import com.example.pipeline.notification.NotificationRepository;
import com.example.pipeline.orchestrator.NotificationOrchestrator;
import com.example.pipeline.orchestrator.NotificationResult;
import com.example.pipeline.platform.EventView;
import com.example.pipeline.platform.PlatformDirectory;
import com.example.pipeline.platform.Recipient;
import com.example.pipeline.queue.JobQueue;
import com.example.pipeline.queue.QueueName;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import java.util.function.LongFunction;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Each method is one task body. Loops over events or users keep going when one item fails and
 * throw {@link TaskItemFailuresException} at the end, so the scheduler records the failure
 * without losing the items that succeeded.
 */
@Service
@RequiredArgsConstructor
public class MaintenanceTasks {

  private static final Logger logger = LoggerFactory.getLogger(MaintenanceTasks.class);

  private final PlatformDirectory directory;
  private final PlatformMaintenanceRepository maintenanceRepository;
  private final NotificationRepository notificationRepository;
  private final NotificationOrchestrator orchestrator;
  private final JobQueue jobQueue;
  private final MaintenanceProperties properties;
  private final NotificationProperties notificationProperties;
  private final PlatformProperties platformProperties;
  private final Clock clock;

  /** 24h reminders for events starting inside the reminder window. */
  public void sendEventReminders() {
    final Instant now = Instant.now(clock);
    final List<EventView> events =
        directory.findEventsStartingBetween(
            now.plus(notificationProperties.reminderWindowStart()),
            now.plus(notificationProperties.reminderWindowEnd()));
    forEachEvent("event-reminders", events, orchestrator::sendEventReminder);
  }

  /** In-app reminders for events starting within the next hour. */
  public void checkUpcomingEvents() {
    final Instant now = Instant.now(clock);
    final List<EventView> events =
        directory.findEventsStartingBetween(
            now, now.plus(notificationProperties.startingSoonWindow()));
    forEachEvent("upcoming-events-check", events, orchestrator::notifyEventStartingSoon);
  }

  public void cleanExpiredTokens() {
    final int deleted = maintenanceRepository.deleteExpiredVerificationTokens(Instant.now(clock));
    logger.info("verification token cleanup deleted={}", deleted);
  }

  public void cleanOldNotifications() {
    final Instant threshold =
        Instant.now(clock).minus(Duration.ofDays(properties.notificationRetentionDays()));
    final int deleted = notificationRepository.deleteReadOlderThan(threshold);
    logger.info("notification retention cleanup deleted={} threshold={}", deleted, threshold);
  }

  /** Computes the previous platform-local day; rerunning the same day replaces its row. */
  public DailyStats calculateDailyStats() {
    final ZoneId zone = platformProperties.zone();
    final Instant now = Instant.now(clock);
    final LocalDate day = LocalDate.ofInstant(now, zone).minusDays(1);
    final Instant from = day.atStartOfDay(zone).toInstant();
    final Instant to = day.plusDays(1).atStartOfDay(zone).toInstant();
    final DailyStats stats = maintenanceRepository.computeDailyStats(day, from, to);
    maintenanceRepository.saveDailyStats(stats, now);
    logger.info(
        "daily stats computed day={} newUsers={} newWorks={} newEvents={} notifications={}",
        day,
        stats.newUsers(),
        stats.newWorks(),
        stats.newEvents(),
        stats.notificationsCreated());
    return stats;
  }

  public void sendWeeklyNewsletter() {
    final NotificationResult result = orchestrator.sendNewsletter();
    logger.info(
        "weekly newsletter sent notified={} queued={} subscribers={}",
        result.notifiedCount(),
        result.queuedCount(),
        result.totalCount());
  }

  /** Deletes regular files in the upload temp directory older than the configured age. */
  public int cleanTempFiles() throws IOException {
    final Path dir = Paths.get(properties.tempDir());
    if (!Files.isDirectory(dir)) {
      logger.debug("temp dir missing; nothing to clean dir={}", dir);
      return 0;
    }
    final Instant threshold = Instant.now(clock).minus(properties.tempFileMaxAge());
    int deleted = 0;
    try (DirectoryStream<Path> files = Files.newDirectoryStream(dir)) {
      for (Path file : files) {
        if (!Files.isRegularFile(file)) {
          continue;
        }
        try {
          if (Files.getLastModifiedTime(file).toInstant().isBefore(threshold)) {
            Files.delete(file);
            deleted++;
          }
        } catch (NoSuchFileException ex) {
          // アップロード完了で並行して削除された
          logger.debug("temp file vanished during cleanup file={}", file.getFileName());
        }
      }
    }
    logger.info("temp file cleanup deleted={} dir={}", deleted, dir);
    return deleted;
  }

  public void updateEventStatuses() {
    final Instant now = Instant.now(clock);
    final int finished = maintenanceRepository.finishEvents(now);
    final int started = maintenanceRepository.startEvents(now);
    logger.info("event status update started={} finished={}", started, finished);
  }

  /** Verification reminders for accounts still unverified after the grace period. */
  public void sendEmailVerificationReminders() {
    final Instant threshold = Instant.now(clock).minus(properties.verificationReminderAfter());
    final List<Recipient> users =
        directory.findUnverifiedUsersCreatedBefore(
            threshold, properties.verificationReminderBatchSize());
    int failures = 0;
    RuntimeException firstFailure = null;
    for (Recipient user : users) {
      try {
        orchestrator.remindEmailVerification(user.userId());
      } catch (RuntimeException ex) {
        failures++;
        if (firstFailure == null) {
          firstFailure = ex;
        }
        logger.error("verification reminder failed userId={}", user.userId(), ex);
      }
    }
    logger.info("verification reminders sent={} failed={}", users.size() - failures, failures);
    if (firstFailure != null) {
      throw new TaskItemFailuresException(
          "email-verification-reminder", failures, users.size(), firstFailure);
    }
  }

  public void archiveOldEvents() {
    final ZoneId zone = platformProperties.zone();
    final Instant threshold =
        Instant.now(clock)
            .atZone(zone)
            .minusMonths(properties.archiveAfterMonths())
            .toInstant();
    final int archived = maintenanceRepository.archiveEventsEndedBefore(threshold);
    logger.info("event archival archived={} threshold={}", archived, threshold);
  }

  public void cleanCompletedJobs() {
    int removed = 0;
    for (QueueName queue : QueueName.values()) {
      removed += jobQueue.cleanCompleted(queue.id(), properties.completedJobGrace());
    }
    logger.info("completed job cleanup removed={}", removed);
  }

  private void forEachEvent(
      String taskName, List<EventView> events, LongFunction<NotificationResult> action) {
    int failures = 0;
    int notified = 0;
    int queued = 0;
    RuntimeException firstFailure = null;
    for (EventView event : events) {
      try {
        final NotificationResult result = action.apply(event.eventId());
        notified += result.notifiedCount();
        queued += result.queuedCount();
      } catch (RuntimeException ex) {
        failures++;
        if (firstFailure == null) {
          firstFailure = ex;
        }
        logger.error("task item failed task={} eventId={}", taskName, event.eventId(), ex);
      }
    }
    logger.info(
        "task events processed task={} events={} notified={} queued={} failed={}",
        taskName,
        events.size(),
        notified,
        queued,
        failures);
    if (firstFailure != null) {
      throw new TaskItemFailuresException(taskName, failures, events.size(), firstFailure);
    }
  }
}
