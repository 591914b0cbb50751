package com.example.datalake.kbscore.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class CategoryScore {
  ScoringCategory category;
  String label;
  /** 0-100. */
  int score;
  /** The fixed category weight. */
  int maxScore;
  double earnedPoints;
  int possiblePoints;
  int completedFields;
  int totalFields;
  CategoryStatus status;
}
