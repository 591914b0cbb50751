package com.example.datalake.kbscore.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum FieldPriority {
  ESSENTIAL,
  RECOMMENDED,
  OPTIONAL;

  @JsonValue
  public String id() {
    return name().toLowerCase(Locale.ROOT);
  }
}
