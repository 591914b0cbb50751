package com.example.datalake.kbscore.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/** Evaluated outcome of one field for one scoring run. */
@Value
@Builder
public class FieldQualityResult {
  String fieldKey;
  String fieldLabel;
  ScoringCategory category;
  FieldPriority priority;

  // sub-scores, 0-100
  int existenceScore;
  int qualityScore;
  int completenessScore;

  /** Points earned toward the category, between 0 and {@link #maxPossibleScore}. */
  double weightedScore;
  int maxPossibleScore;

  FieldStatus status;
  @Singular List<QualityIssue> issues;
  @Singular List<String> suggestions;

  int contentLength;
  @JsonProperty("isPlaceholder") boolean placeholder;
  @JsonProperty("isGeneric") boolean generic;

  /** Mean of the three sub-scores. */
  public double fieldScore() {
    return (existenceScore + qualityScore + completenessScore) / 3.0;
  }

  public boolean isComplete() {
    return status == FieldStatus.COMPLETE;
  }
}
