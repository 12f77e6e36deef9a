/*
 * どこで: Pipeline スケジューラの配線
 * 何を: アプリ起動完了後に pipeline の定期タスクを登録する
 * なぜ: タスクはメモリ上にしかないため、起動のたびに全件を登録し直す
 */
package com.example.pipeline.scheduler;

import com.example.pipeline.config.SchedulerProperties;
import com.example.pipeline.maintenance.MaintenanceTasks;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * With {@code pipeline.scheduler.enabled=false} the tasks are still registered, but deferred,
 * so operators can run or start them through the admin API.
 */
@Component
@RequiredArgsConstructor
public class PipelineTaskRegistrar {

  private static final Logger logger = LoggerFactory.getLogger(PipelineTaskRegistrar.class);

  public static final String EVENT_REMINDERS = "event-reminders";
  public static final String CLEAN_EXPIRED_TOKENS = "clean-expired-tokens";
  public static final String CLEAN_OLD_NOTIFICATIONS = "clean-old-notifications";
  public static final String CALCULATE_STATS = "calculate-stats";
  public static final String WEEKLY_NEWSLETTER = "weekly-newsletter";
  public static final String UPCOMING_EVENTS_CHECK = "upcoming-events-check";
  public static final String CLEAN_TEMP_FILES = "clean-temp-files";
  public static final String UPDATE_EVENT_STATUS = "update-event-status";
  public static final String EMAIL_VERIFICATION_REMINDER = "email-verification-reminder";
  public static final String ARCHIVE_OLD_EVENTS = "archive-old-events";
  public static final String CLEAN_COMPLETED_JOBS = "clean-completed-jobs";

  private final PipelineScheduler scheduler;
  private final MaintenanceTasks maintenanceTasks;
  private final SchedulerProperties properties;

  @EventListener(ApplicationReadyEvent.class)
  public void registerTasks() {
    final Map<String, TaskDefinition> definitions = definitions();
    final boolean deferStart = !properties.enabled();
    definitions.forEach(
        (name, definition) ->
            scheduler.registerTask(
                name,
                properties.cronFor(name, definition.defaultCron()),
                definition.body(),
                deferStart));
    logger.info(
        "pipeline tasks registered count={} started={}", definitions.size(), !deferStart);
  }

  Map<String, TaskDefinition> definitions() {
    final Map<String, TaskDefinition> definitions = new LinkedHashMap<>();
    definitions.put(
        EVENT_REMINDERS, new TaskDefinition("0 0 * * * *", maintenanceTasks::sendEventReminders));
    definitions.put(
        CLEAN_EXPIRED_TOKENS,
        new TaskDefinition("0 0 3 * * *", maintenanceTasks::cleanExpiredTokens));
    definitions.put(
        CLEAN_OLD_NOTIFICATIONS,
        new TaskDefinition("0 0 2 * * SUN", maintenanceTasks::cleanOldNotifications));
    definitions.put(
        CALCULATE_STATS, new TaskDefinition("0 0 1 * * *", maintenanceTasks::calculateDailyStats));
    if (properties.newsletterEnabled()) {
      definitions.put(
          WEEKLY_NEWSLETTER,
          new TaskDefinition("0 0 9 * * MON", maintenanceTasks::sendWeeklyNewsletter));
    }
    definitions.put(
        UPCOMING_EVENTS_CHECK,
        new TaskDefinition("0 */30 * * * *", maintenanceTasks::checkUpcomingEvents));
    definitions.put(
        CLEAN_TEMP_FILES, new TaskDefinition("0 0 4 * * *", maintenanceTasks::cleanTempFiles));
    definitions.put(
        UPDATE_EVENT_STATUS,
        new TaskDefinition("0 0 * * * *", maintenanceTasks::updateEventStatuses));
    definitions.put(
        EMAIL_VERIFICATION_REMINDER,
        new TaskDefinition("0 0 10 * * *", maintenanceTasks::sendEmailVerificationReminders));
    definitions.put(
        ARCHIVE_OLD_EVENTS,
        new TaskDefinition("0 0 2 1 * *", maintenanceTasks::archiveOldEvents));
    definitions.put(
        CLEAN_COMPLETED_JOBS,
        new TaskDefinition("0 30 * * * *", maintenanceTasks::cleanCompletedJobs));
    return definitions;
  }

  record TaskDefinition(String defaultCron, TaskBody body) {}
}
