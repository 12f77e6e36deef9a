package com.example.pipeline.notification;

import java.util.Locale;

public enum NotificationPriority {
  LOW("basse"),
  NORMAL("normale"),
  HIGH("haute"),
  URGENT("urgente");

  private final String code;

  NotificationPriority(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }

  public static NotificationPriority fromCode(String code) {
    if (code == null) {
      return NORMAL;
    }
    for (NotificationPriority priority : values()) {
      if (priority.code.equals(code.toLowerCase(Locale.ROOT))) {
        return priority;
      }
    }
    return NORMAL;
  }
}
