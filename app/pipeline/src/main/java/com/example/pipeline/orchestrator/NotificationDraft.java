package com.example.pipeline.orchestrator;

import com.example.pipeline.notification.NotificationPriority;

/** A rendered notification plus the entity links and channels it may use. */
record NotificationDraft(
    RenderedMessage message,
    Long eventId,
    Long workId,
    Long programmeId,
    String actionUrl,
    NotificationPriority priority,
    boolean allowEmail,
    boolean allowSms) {}
