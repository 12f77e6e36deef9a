/*
 * どこで: プラットフォームのユーザーモデル
 * 何を: 通知の宛先決定とレンダリングに必要なユーザー情報の一部
 */
package com.example.pipeline.platform;

import java.util.Locale;

public record Recipient(
    long userId,
    String email,
    String firstName,
    String lastName,
    String phone,
    String language,
    UserRole role,
    boolean emailVerified,
    NotificationPreferences preferences) {

  public static final Locale DEFAULT_LOCALE = Locale.FRENCH;

  public Locale locale() {
    if (language == null || language.isBlank()) {
      return DEFAULT_LOCALE;
    }
    return Locale.forLanguageTag(language);
  }

  public String displayName() {
    final String first = firstName == null ? "" : firstName.trim();
    final String last = lastName == null ? "" : lastName.trim();
    final String joined = (first + " " + last).trim();
    return joined.isEmpty() ? email : joined;
  }

  public boolean hasPhone() {
    return phone != null && !phone.isBlank();
  }
}
