package com.example.pipeline.platform;

public enum ReminderKind {
  DAY_BEFORE,
  STARTING_SOON
}
