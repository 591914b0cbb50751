package com.example.datalake.kbscore.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;
import lombok.Builder;

/**
 * Read-only snapshot of a business knowledge base. Any collection may be null; the scorer treats
 * that the same as an empty collection.
 */
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public record KbDataForScoring(
    List<KbRecord> instructions,
    List<KbRecord> policies,
    List<KbRecord> articles,
    List<KbRecord> templates,
    List<KbRecord> competitors,
    List<KbRecord> services,
    List<KbRecord> branches,
    List<KbRecord> staff) {

  public static KbDataForScoring empty() {
    return KbDataForScoring.builder().build();
  }
}
