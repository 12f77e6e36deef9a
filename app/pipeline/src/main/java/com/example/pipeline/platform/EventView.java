package com.example.pipeline.platform;

import java.time.Instant;

public record EventView(
    long eventId,
    LocalizedText name,
    Instant startsAt,
    Instant endsAt,
    String status,
    String venue,
    Integer wilaya,
    long organizerId) {}
