package com.example.datalake.kbscore.validation;

import java.util.List;
import java.util.Objects;

/** Thrown when a scoring request cannot be served because the call itself is malformed. */
public class ScoringRequestException extends RuntimeException {

  private final List<String> reasons;

  public ScoringRequestException(String message) {
    super(Objects.requireNonNull(message, "message"));
    this.reasons = List.of(message);
  }

  public ScoringRequestException(List<String> reasons) {
    super(formatMessage(reasons));
    this.reasons = List.copyOf(reasons);
  }

  public List<String> getReasons() {
    return reasons;
  }

  private static String formatMessage(List<String> reasons) {
    Objects.requireNonNull(reasons, "reasons");
    if (reasons.isEmpty()) {
      throw new IllegalArgumentException("reasons must not be empty");
    }
    if (reasons.stream().anyMatch(Objects::isNull)) {
      throw new IllegalArgumentException("reasons must not contain null entries");
    }
    return String.join("; ", reasons);
  }
}
