package com.example.pipeline.orchestrator;

import java.util.Arrays;
import java.util.Locale;

public enum ProgrammeChangeType {
  SCHEDULE("horaire"),
  VENUE("lieu"),
  CANCELLED("annule"),
  POSTPONED("reporte"),
  ADDED("nouveau"),
  GENERAL("general");

  private final String code;

  ProgrammeChangeType(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }

  /** Unknown or missing codes fall back to GENERAL. */
  public static ProgrammeChangeType parse(String value) {
    if (value == null) {
      return GENERAL;
    }
    final String normalized = value.toLowerCase(Locale.ROOT);
    return Arrays.stream(values())
        .filter(type -> type.code.equals(normalized) || type.name().equalsIgnoreCase(normalized))
        .findFirst()
        .orElse(GENERAL);
  }
}
