package com.example.pipeline.queue;

public record QueueStats(
    long waiting, long active, long completed, long failed, long delayed, boolean paused) {}
