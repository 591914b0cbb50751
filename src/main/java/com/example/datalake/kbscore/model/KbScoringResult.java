package com.example.datalake.kbscore.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class KbScoringResult {
  /** 0-100. */
  int totalScore;
  /** One entry per {@link ScoringCategory}, in declaration order. */
  Map<ScoringCategory, CategoryScore> categoryScores;
  List<FieldQualityResult> fieldResults;
  ScoringStats stats;
  List<ScoringRecommendation> recommendations;

  String vertical;
  Instant calculatedAt;
  String version;
}
