package com.example.datalake.kbscore.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Declared from most to least urgent; ordinal order is the ranking order. */
public enum RecommendationPriority {
  CRITICAL,
  HIGH,
  MEDIUM,
  LOW;

  @JsonValue
  public String id() {
    return name().toLowerCase(Locale.ROOT);
  }
}
