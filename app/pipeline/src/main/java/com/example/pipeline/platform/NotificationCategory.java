package com.example.pipeline.platform;

/** Preference bucket a notification falls into; TRANSACTIONAL cannot be switched off. */
public enum NotificationCategory {
  TRANSACTIONAL,
  NEW_EVENTS,
  PROGRAMME_CHANGES,
  REMINDERS,
  COMMENTS,
  FAVORITES,
  NEWSLETTER
}
