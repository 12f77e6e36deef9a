package com.example.pipeline.platform;

import java.time.Instant;

public record WorkView(long workId, LocalizedText title, long creatorId, String status, Instant createdAt) {}
