package com.example.pipeline.platform;

import java.util.Locale;

public enum UserRole {
  VISITOR,
  PROFESSIONAL,
  ADMIN;

  /** Maps the platform's type_user label; anything unknown is treated as a visitor. */
  public static UserRole fromPlatformLabel(String label) {
    if (label == null) {
      return VISITOR;
    }
    return switch (label.toLowerCase(Locale.ROOT)) {
      case "professionnel", "professional", "artisan", "artiste", "organisateur" -> PROFESSIONAL;
      case "admin", "administrateur", "moderateur" -> ADMIN;
      default -> VISITOR;
    };
  }

  public String key() {
    return name().toLowerCase(Locale.ROOT);
  }
}
