package com.example.pipeline.queue;

import java.util.UUID;

public record JobHandle(UUID jobId, String queueName) {}
