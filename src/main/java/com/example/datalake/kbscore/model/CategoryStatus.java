package com.example.datalake.kbscore.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum CategoryStatus {
  EXCELLENT,
  GOOD,
  NEEDS_WORK,
  CRITICAL;

  /** Lower bounds are inclusive: 90, 70 and 50. */
  public static CategoryStatus fromScore(int score) {
    if (score >= 90) {
      return EXCELLENT;
    }
    if (score >= 70) {
      return GOOD;
    }
    if (score >= 50) {
      return NEEDS_WORK;
    }
    return CRITICAL;
  }

  @JsonValue
  public String id() {
    return name().toLowerCase(Locale.ROOT);
  }
}
