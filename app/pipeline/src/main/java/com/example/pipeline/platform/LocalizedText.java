/*
 * どこで: プラットフォームのデータモデル
 * 何を: {"fr": "...", "ar": "...", "en": "..."} のような多言語カラム値
 */
package com.example.pipeline.platform;

import java.util.Locale;
import java.util.Map;

public record LocalizedText(Map<String, String> values) {

  private static final String FALLBACK_LANGUAGE = "fr";

  public LocalizedText {
    values = values == null ? Map.of() : Map.copyOf(values);
  }

  public static LocalizedText of(String french) {
    return new LocalizedText(Map.of(FALLBACK_LANGUAGE, french));
  }

  /** The value in the locale's language, else French, else any non-blank value, else "". */
  public String resolve(Locale locale) {
    final String requested = locale == null ? null : values.get(locale.getLanguage());
    if (hasText(requested)) {
      return requested;
    }
    final String french = values.get(FALLBACK_LANGUAGE);
    if (hasText(french)) {
      return french;
    }
    return values.values().stream().filter(LocalizedText::hasText).findFirst().orElse("");
  }

  private static boolean hasText(String value) {
    return value != null && !value.isBlank();
  }
}
