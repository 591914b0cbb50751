package com.example.datalake.kbscore.service;

import com.example.datalake.kbscore.catalog.QualityThresholds;
import com.example.datalake.kbscore.model.CategoryStatus;
import com.example.datalake.kbscore.model.KbScoringResult;
import com.example.datalake.kbscore.model.KbStatusSummary;
import com.example.datalake.kbscore.model.ScoringRecommendation;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import org.springframework.stereotype.Service;

/** Dashboard-level reading of a scoring result. */
@Service
public class KbStatusSummaryService {

  public KbStatusSummary summarize(KbScoringResult result) {
    Objects.requireNonNull(result, "result");
    int total = result.getTotalScore();
    CategoryStatus status = CategoryStatus.fromScore(total);
    int pending = result.getStats().getTotalFields() - result.getStats().getCompletedFields();

    return KbStatusSummary.builder()
        .totalScore(total)
        .status(status)
        .title(titleFor(status))
        .description(pending == 0
            ? "Every field is complete."
            : String.format(Locale.ROOT, "%d of %d fields need attention.",
                pending, result.getStats().getTotalFields()))
        .productionReady(total >= QualityThresholds.MIN_PRODUCTION_READY)
        .promptQualityReady(total >= QualityThresholds.MIN_PROMPT_QUALITY)
        .pendingFields(pending)
        .build();
  }

  /** The highest ranked recommendation, empty when nothing is left to do. */
  public Optional<ScoringRecommendation> nextStep(KbScoringResult result) {
    Objects.requireNonNull(result, "result");
    return result.getRecommendations().stream().findFirst();
  }

  private static String titleFor(CategoryStatus status) {
    return switch (status) {
      case EXCELLENT -> "Knowledge base ready";
      case GOOD -> "Almost there";
      case NEEDS_WORK -> "Needs attention";
      case CRITICAL -> "Configuration incomplete";
    };
  }
}
