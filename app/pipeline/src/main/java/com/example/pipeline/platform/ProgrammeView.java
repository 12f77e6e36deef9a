package com.example.pipeline.platform;

import java.time.Instant;

public record ProgrammeView(
    long programmeId, long eventId, LocalizedText title, Instant startsAt, String location) {}
