package com.example.datalake.kbscore.validation;

import java.util.List;

/** What the detector found in one piece of content. */
public record PlaceholderDetection(boolean placeholder, boolean generic, List<String> matchedPatterns) {

  public static final PlaceholderDetection NONE = new PlaceholderDetection(false, false, List.of());

  public PlaceholderDetection {
    matchedPatterns = matchedPatterns == null ? List.of() : List.copyOf(matchedPatterns);
  }
}
