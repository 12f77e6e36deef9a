package com.example.pipeline.orchestrator;

import java.util.Locale;

public enum ModerationAction {
  APPROVED,
  REJECTED,
  REMOVED,
  WARNING,
  SUSPENDED;

  public String key() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static ModerationAction parse(String value) {
    if (value == null) {
      throw new IllegalArgumentException("moderation action is required");
    }
    try {
      return valueOf(value.toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("unknown moderation action: " + value, ex);
    }
  }
}
