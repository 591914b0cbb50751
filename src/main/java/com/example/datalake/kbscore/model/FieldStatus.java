package com.example.datalake.kbscore.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Outcome of evaluating a single field against a snapshot. */
public enum FieldStatus {
  /** Present, active and meets its minimum length or count. */
  COMPLETE,
  /** Present but below its minimum length or count. */
  PARTIAL,
  /** Content matched a filler/test marker. */
  PLACEHOLDER,
  /** No matching record at all. */
  MISSING,
  /** Matching records exist but none of them is active. */
  DISABLED;

  @JsonValue
  public String id() {
    return name().toLowerCase(Locale.ROOT);
  }
}
