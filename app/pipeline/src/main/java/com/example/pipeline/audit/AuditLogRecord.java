package com.example.pipeline.audit;

import java.time.Instant;
import java.util.UUID;

public record AuditLogRecord(
    UUID id,
    String action,
    String entityType,
    String entityId,
    String detailsJson,
    Instant createdAt) {}
