package com.example.datalake.kbscore.service;

import com.example.datalake.kbscore.model.FieldPriority;
import com.example.datalake.kbscore.model.FieldQualityResult;
import com.example.datalake.kbscore.model.FieldStatus;
import com.example.datalake.kbscore.model.QualityIssue;
import com.example.datalake.kbscore.model.RecommendationPriority;
import com.example.datalake.kbscore.model.ScoringCategory;
import com.example.datalake.kbscore.model.ScoringRecommendation;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.springframework.stereotype.Component;

/**
 * Turns every non-complete field into a recommendation. The list is ordered by estimated impact,
 * then priority, then category weight, then field key, so equal inputs always give equal output.
 */
@Component
public class RecommendationRanker {

  static final Comparator<ScoringRecommendation> ORDER =
      Comparator.comparingDouble(ScoringRecommendation::getEstimatedImpact).reversed()
          .thenComparing(ScoringRecommendation::getPriority)
          .thenComparing(r -> r.getCategory().weight(), Comparator.reverseOrder())
          .thenComparing(ScoringRecommendation::getFieldKey);

  public List<ScoringRecommendation> rank(List<FieldQualityResult> fieldResults) {
    Objects.requireNonNull(fieldResults, "fieldResults");

    Map<ScoringCategory, Integer> possibleByCategory = new EnumMap<>(ScoringCategory.class);
    for (FieldQualityResult result : fieldResults) {
      possibleByCategory.merge(result.getCategory(), result.getMaxPossibleScore(), Integer::sum);
    }

    return fieldResults.stream()
        .filter(result -> !result.isComplete())
        .map(result -> toRecommendation(result, possibleByCategory.get(result.getCategory())))
        .sorted(ORDER)
        .toList();
  }

  /**
   * Total-score points gained by bringing the field to full marks: the missing field points as a
   * share of the category, scaled by the category percentage.
   */
  static double estimatedImpact(FieldQualityResult result, int categoryPossiblePoints) {
    if (categoryPossiblePoints <= 0) {
      return 0;
    }
    double missingPoints = Math.max(0, result.getMaxPossibleScore() - result.getWeightedScore());
    double impact = missingPoints / categoryPossiblePoints * result.getCategory().weight();
    return FieldEvaluator.round2(impact);
  }

  public static RecommendationPriority priorityFor(FieldPriority priority, FieldStatus status) {
    boolean absent = status == FieldStatus.MISSING || status == FieldStatus.DISABLED;
    return switch (priority) {
      case ESSENTIAL -> absent ? RecommendationPriority.CRITICAL : RecommendationPriority.HIGH;
      case RECOMMENDED -> absent ? RecommendationPriority.HIGH : RecommendationPriority.MEDIUM;
      case OPTIONAL -> RecommendationPriority.LOW;
    };
  }

  private ScoringRecommendation toRecommendation(FieldQualityResult result, int categoryPossiblePoints) {
    return ScoringRecommendation.builder()
        .priority(priorityFor(result.getPriority(), result.getStatus()))
        .fieldKey(result.getFieldKey())
        .fieldLabel(result.getFieldLabel())
        .category(result.getCategory())
        .message(messageFor(result))
        .suggestion(suggestionFor(result))
        .estimatedImpact(estimatedImpact(result, categoryPossiblePoints))
        .build();
  }

  private static String messageFor(FieldQualityResult result) {
    String label = result.getFieldLabel();
    return switch (result.getStatus()) {
      case MISSING -> label + " is missing";
      case DISABLED -> label + " is disabled";
      case PLACEHOLDER -> label + " contains placeholder content";
      case PARTIAL -> label + " is incomplete";
      case COMPLETE -> label + " is complete";
    };
  }

  private static String suggestionFor(FieldQualityResult result) {
    if (!result.getSuggestions().isEmpty()) {
      return result.getSuggestions().get(0);
    }
    return result.getIssues().stream()
        .map(QualityIssue::getSuggestion)
        .filter(Objects::nonNull)
        .findFirst()
        .orElse("Complete " + result.getFieldLabel());
  }
}
