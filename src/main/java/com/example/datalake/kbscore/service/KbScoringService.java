package com.example.datalake.kbscore.service;

import com.example.datalake.kbscore.catalog.FieldCatalog;
import com.example.datalake.kbscore.model.CategoryScore;
import com.example.datalake.kbscore.model.FieldPriority;
import com.example.datalake.kbscore.model.FieldQualityResult;
import com.example.datalake.kbscore.model.FieldStatus;
import com.example.datalake.kbscore.model.KbDataForScoring;
import com.example.datalake.kbscore.model.KbScoringResult;
import com.example.datalake.kbscore.model.ScoreableField;
import com.example.datalake.kbscore.model.ScoringCategory;
import com.example.datalake.kbscore.model.ScoringRecommendation;
import com.example.datalake.kbscore.model.ScoringStats;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Scores a full knowledge base snapshot for a vertical. Apart from {@code calculatedAt} the
 * result depends only on the snapshot and the vertical.
 */
@Slf4j
@Service
public class KbScoringService {

  public static final String SCHEMA_VERSION = "1.0.0";

  private final FieldEvaluator fieldEvaluator;
  private final CategoryAggregator categoryAggregator;
  private final RecommendationRanker recommendationRanker;
  private final Clock clock;

  public KbScoringService(FieldEvaluator fieldEvaluator,
                          CategoryAggregator categoryAggregator,
                          RecommendationRanker recommendationRanker,
                          Clock clock) {
    this.fieldEvaluator = fieldEvaluator;
    this.categoryAggregator = categoryAggregator;
    this.recommendationRanker = recommendationRanker;
    this.clock = clock;
  }

  public KbScoringResult calculate(KbDataForScoring data, String vertical) {
    Objects.requireNonNull(data, "data");
    Objects.requireNonNull(vertical, "vertical");

    List<ScoreableField> fields = FieldCatalog.getFieldsForVertical(vertical);
    List<FieldQualityResult> fieldResults = fields.stream()
        .map(field -> fieldEvaluator.evaluate(field, data))
        .toList();

    Map<ScoringCategory, CategoryScore> categoryScores = categoryAggregator.aggregate(fieldResults);
    int totalScore = categoryAggregator.totalScore(categoryScores);
    List<ScoringRecommendation> recommendations = recommendationRanker.rank(fieldResults);
    ScoringStats stats = stats(fieldResults);

    log.debug("Scored knowledge base vertical={} total={} completed={}/{} recommendations={}",
        vertical, totalScore, stats.getCompletedFields(), stats.getTotalFields(), recommendations.size());

    return KbScoringResult.builder()
        .totalScore(totalScore)
        .categoryScores(categoryScores)
        .fieldResults(fieldResults)
        .stats(stats)
        .recommendations(recommendations)
        .vertical(vertical)
        .calculatedAt(clock.instant())
        .version(SCHEMA_VERSION)
        .build();
  }

  static ScoringStats stats(List<FieldQualityResult> fieldResults) {
    int completed = 0;
    int withIssues = 0;
    int criticalMissing = 0;
    int placeholders = 0;
    for (FieldQualityResult result : fieldResults) {
      if (result.isComplete()) {
        completed++;
      }
      if (!result.getIssues().isEmpty()) {
        withIssues++;
      }
      if (result.getPriority() == FieldPriority.ESSENTIAL
          && (result.getStatus() == FieldStatus.MISSING || result.getStatus() == FieldStatus.DISABLED)) {
        criticalMissing++;
      }
      if (result.isPlaceholder()) {
        placeholders++;
      }
    }
    return ScoringStats.builder()
        .totalFields(fieldResults.size())
        .completedFields(completed)
        .fieldsWithIssues(withIssues)
        .criticalMissing(criticalMissing)
        .placeholdersDetected(placeholders)
        .build();
  }
}
