package com.example.pipeline.orchestrator;

import java.util.Locale;

public enum ParticipationDecision {
  ACCEPTED,
  REFUSED;

  /** Accepts the platform's participation status codes as well as the enum names. */
  public static ParticipationDecision parse(String value) {
    if (value == null) {
      throw new IllegalArgumentException("decision is required");
    }
    return switch (value.toLowerCase(Locale.ROOT)) {
      case "accepted", "confirme", "valide" -> ACCEPTED;
      case "refused", "refuse", "rejete", "annule" -> REFUSED;
      default -> throw new IllegalArgumentException("unknown decision: " + value);
    };
  }
}
