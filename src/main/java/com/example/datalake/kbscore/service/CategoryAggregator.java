package com.example.datalake.kbscore.service;

import com.example.datalake.kbscore.model.CategoryScore;
import com.example.datalake.kbscore.model.CategoryStatus;
import com.example.datalake.kbscore.model.FieldQualityResult;
import com.example.datalake.kbscore.model.ScoringCategory;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.springframework.stereotype.Component;

/** Rolls field results up into category scores and the weighted total. */
@Component
public class CategoryAggregator {

  /** Scores every category, including ones without fields. */
  public Map<ScoringCategory, CategoryScore> aggregate(List<FieldQualityResult> fieldResults) {
    Objects.requireNonNull(fieldResults, "fieldResults");
    Map<ScoringCategory, CategoryScore> scores = new EnumMap<>(ScoringCategory.class);
    for (ScoringCategory category : ScoringCategory.values()) {
      scores.put(category, score(category, fieldResults));
    }
    return Collections.unmodifiableMap(scores);
  }

  /**
   * A category with no applicable fields is vacuously satisfied and scores 100, so a vertical
   * without such fields is not penalized.
   */
  public CategoryScore score(ScoringCategory category, List<FieldQualityResult> fieldResults) {
    List<FieldQualityResult> inCategory = fieldResults.stream()
        .filter(r -> r.getCategory() == category)
        .toList();

    double earned = inCategory.stream().mapToDouble(FieldQualityResult::getWeightedScore).sum();
    int possible = inCategory.stream().mapToInt(FieldQualityResult::getMaxPossibleScore).sum();
    int completed = (int) inCategory.stream().filter(FieldQualityResult::isComplete).count();

    int score = possible == 0
        ? 100
        : (int) Math.max(0, Math.min(100, Math.round(100.0 * earned / possible)));

    return CategoryScore.builder()
        .category(category)
        .label(category.label())
        .score(score)
        .maxScore(category.weight())
        .earnedPoints(FieldEvaluator.round2(earned))
        .possiblePoints(possible)
        .completedFields(completed)
        .totalFields(inCategory.size())
        .status(scoreToStatus(score))
        .build();
  }

  /** Sum of category scores weighted by the fixed category percentages, rounded. */
  public int totalScore(Map<ScoringCategory, CategoryScore> categoryScores) {
    double total = 0;
    for (ScoringCategory category : ScoringCategory.values()) {
      CategoryScore score = categoryScores.get(category);
      if (score != null) {
        total += score.getScore() * category.weight() / 100.0;
      }
    }
    return (int) Math.max(0, Math.min(100, Math.round(total)));
  }

  public static CategoryStatus scoreToStatus(int score) {
    return CategoryStatus.fromScore(score);
  }
}
