package com.example.datalake.kbscore.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ScoringRecommendation {
  RecommendationPriority priority;
  String fieldKey;
  String fieldLabel;
  ScoringCategory category;
  String message;
  String suggestion;
  /** Total-score points gained by completing the field. */
  double estimatedImpact;
}
