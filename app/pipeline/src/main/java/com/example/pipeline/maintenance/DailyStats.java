package com.example.pipeline.maintenance;

import java.time.LocalDate;

/** Activity counters for one platform-local day. */
public record DailyStats(
    LocalDate statDate,
    long newUsers,
    long newWorks,
    long newEvents,
    long activeUsers,
    long notificationsCreated,
    long emailsSent) {}
