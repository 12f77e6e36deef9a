package com.example.pipeline.platform;

import java.util.Arrays;

/** Values of evenementusers.statut_participation. */
public enum ParticipationStatus {
  REGISTERED("inscrit"),
  CONFIRMED("confirme"),
  PENDING("en_attente"),
  ATTENDED("present"),
  ABSENT("absent"),
  CANCELLED("annule");

  private final String code;

  ParticipationStatus(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }

  public static ParticipationStatus fromCode(String code) {
    return Arrays.stream(values())
        .filter(status -> status.code.equals(code))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("unknown participation status: " + code));
  }
}
