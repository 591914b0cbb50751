package com.example.datalake.kbscore.service;

import com.example.datalake.kbscore.model.FieldPriority;
import com.example.datalake.kbscore.model.FieldQualityResult;
import com.example.datalake.kbscore.model.FieldStatus;
import com.example.datalake.kbscore.model.IssueSeverity;
import com.example.datalake.kbscore.model.KbDataForScoring;
import com.example.datalake.kbscore.model.KbRecord;
import com.example.datalake.kbscore.model.QualityIssue;
import com.example.datalake.kbscore.model.ScoreableField;
import com.example.datalake.kbscore.validation.PlaceholderDetection;
import com.example.datalake.kbscore.validation.PlaceholderDetector;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import org.springframework.stereotype.Component;

/**
 * Scores one resolved field against a snapshot.
 *
 * <p>Content fields read the first active record of the matching type in snapshot order. Quality
 * is {@code min(100, 100 * length / idealLength)}, minus up to {@value #KEYWORD_PENALTY} points
 * split evenly across missing required keywords, minus {@value #GENERIC_PENALTY} for stock
 * phrases, and capped at {@value #PLACEHOLDER_QUALITY_CAP} when placeholder text is found.
 */
@Component
public class FieldEvaluator {

  static final int KEYWORD_PENALTY = 15;
  static final int GENERIC_PENALTY = 20;
  static final int PLACEHOLDER_QUALITY_CAP = 10;

  private final PlaceholderDetector placeholderDetector;

  public FieldEvaluator(PlaceholderDetector placeholderDetector) {
    this.placeholderDetector = Objects.requireNonNull(placeholderDetector, "placeholderDetector");
  }

  public FieldQualityResult evaluate(ScoreableField field, KbDataForScoring data) {
    Objects.requireNonNull(field, "field");
    Objects.requireNonNull(data, "data");

    List<KbRecord> matching = field.getDataSource().records(data).stream()
        .filter(r -> field.getFilterType() == null || r.hasType(field.getFilterType()))
        .toList();
    List<KbRecord> active = matching.stream().filter(KbRecord::active).toList();

    if (matching.isEmpty()) {
      return missing(field, "NOT_CONFIGURED", field.getLabel() + " is not configured");
    }
    if (active.isEmpty()) {
      return disabled(field);
    }

    return switch (field.getKind()) {
      case COUNT -> evaluateCount(field, active.size());
      case SCHEDULE -> evaluateSchedule(field, active);
      case CONTENT -> evaluateContent(field, active.get(0));
    };
  }

  private FieldQualityResult evaluateCount(ScoreableField field, int activeCount) {
    int minCount = Math.max(1, field.getMinCount());
    int completeness = percent(activeCount, minCount);

    FieldQualityResult.FieldQualityResultBuilder result = base(field)
        .existenceScore(100)
        .completenessScore(completeness)
        .qualityScore(completeness)
        .status(activeCount < minCount ? FieldStatus.PARTIAL : FieldStatus.COMPLETE);

    if (activeCount < minCount) {
      int shortBy = minCount - activeCount;
      String suggestion = String.format(Locale.ROOT, "Add %d more %s (minimum %d)",
          shortBy, field.getLabel().toLowerCase(Locale.ROOT), minCount);
      result.issue(QualityIssue.builder()
          .code("INSUFFICIENT_ITEMS")
          .severity(shortfallSeverity(field))
          .message(String.format(Locale.ROOT, "Only %d of %d %s configured", activeCount, minCount, field.getLabel()))
          .suggestion(suggestion)
          .build());
      result.suggestion(suggestion);
    }
    return finish(field, result);
  }

  private FieldQualityResult evaluateSchedule(ScoreableField field, List<KbRecord> active) {
    boolean hasHours = active.stream().anyMatch(KbRecord::hasOperatingHours);
    if (!hasHours) {
      return missing(field, "NO_HOURS", "No active branch has operating hours configured");
    }
    return finish(field, base(field)
        .existenceScore(100)
        .qualityScore(100)
        .completenessScore(100)
        .status(FieldStatus.COMPLETE));
  }

  private FieldQualityResult evaluateContent(ScoreableField field, KbRecord record) {
    String content = Objects.requireNonNullElse(record.content(), "").strip();
    int length = content.length();
    String label = field.getLabel();
    PlaceholderDetection detection = placeholderDetector.detect(content);

    FieldQualityResult.FieldQualityResultBuilder result = base(field)
        .existenceScore(100)
        .contentLength(length)
        .placeholder(detection.placeholder())
        .generic(detection.generic());

    int completeness = field.getMinLength() <= 0
        ? (length > 0 ? 100 : 0)
        : percent(length, field.getMinLength());
    result.completenessScore(completeness);

    double quality;
    if (length == 0) {
      quality = 0;
      result.issue(QualityIssue.builder()
          .code("EMPTY_CONTENT")
          .severity(IssueSeverity.CRITICAL)
          .message(label + " has no content")
          .suggestion("Write the text for " + label)
          .build());
    } else {
      int ideal = Math.max(field.getIdealLength(), field.getMinLength());
      quality = ideal <= 0 ? 100 : Math.min(100.0, 100.0 * length / ideal);
      quality -= keywordPenalty(field, content, result);
      if (detection.generic()) {
        quality -= GENERIC_PENALTY;
        result.issue(QualityIssue.builder()
            .code("GENERIC_CONTENT")
            .severity(IssueSeverity.WARNING)
            .message(label + " reads as generic boilerplate")
            .suggestion("Personalize " + label + " with details specific to your business")
            .build());
        result.suggestion("Personalize " + label + " with details specific to your business");
      }
    }

    FieldStatus status;
    if (detection.placeholder()) {
      quality = Math.min(quality, PLACEHOLDER_QUALITY_CAP);
      status = FieldStatus.PLACEHOLDER;
      result.issue(QualityIssue.builder()
          .code("PLACEHOLDER_DETECTED")
          .severity(IssueSeverity.CRITICAL)
          .message("Content looks like placeholder text: " + String.join(", ", detection.matchedPatterns()))
          .suggestion("Replace it with real content specific to your business")
          .build());
      result.suggestion("Replace the test content in " + label + " with real information");
    } else if (length == 0 || length < field.getMinLength()) {
      status = FieldStatus.PARTIAL;
      result.issue(QualityIssue.builder()
          .code("TOO_SHORT")
          .severity(shortfallSeverity(field))
          .message(String.format(Locale.ROOT, "%s is too short (%d characters, minimum %d)",
              label, length, field.getMinLength()))
          .suggestion(String.format(Locale.ROOT, "Expand to at least %d characters", field.getMinLength()))
          .build());
      result.suggestion(String.format(Locale.ROOT, "Expand %s to at least %d characters",
          label, field.getMinLength()));
    } else {
      status = FieldStatus.COMPLETE;
    }

    result.qualityScore(clamp(quality)).status(status);
    return finish(field, result);
  }

  private double keywordPenalty(ScoreableField field, String content,
      FieldQualityResult.FieldQualityResultBuilder result) {
    List<String> required = field.getRequiredKeywords();
    if (required.isEmpty()) {
      return 0;
    }
    String lower = content.toLowerCase(Locale.ROOT);
    List<String> missingKeywords = required.stream()
        .filter(k -> !lower.contains(k.toLowerCase(Locale.ROOT)))
        .toList();
    if (missingKeywords.isEmpty()) {
      return 0;
    }
    result.issue(QualityIssue.builder()
        .code("MISSING_KEYWORDS")
        .severity(IssueSeverity.WARNING)
        .message(field.getLabel() + " does not mention: " + String.join(", ", missingKeywords))
        .suggestion("Consider covering " + String.join(", ", missingKeywords))
        .build());
    return (double) KEYWORD_PENALTY * missingKeywords.size() / required.size();
  }

  private FieldQualityResult missing(ScoreableField field, String code, String message) {
    return finish(field, base(field)
        .status(FieldStatus.MISSING)
        .issue(QualityIssue.builder()
            .code(code)
            .severity(field.getPriority() == FieldPriority.ESSENTIAL ? IssueSeverity.CRITICAL : IssueSeverity.WARNING)
            .message(message)
            .suggestion("Configure " + field.getLabel())
            .build())
        .suggestion("Configure " + field.getLabel() + " to improve the assistant's answers"));
  }

  private FieldQualityResult disabled(ScoreableField field) {
    return finish(field, base(field)
        .status(FieldStatus.DISABLED)
        .issue(QualityIssue.builder()
            .code("DISABLED")
            .severity(IssueSeverity.WARNING)
            .message(field.getLabel() + " exists but is not active")
            .suggestion("Activate it or add an active replacement")
            .build())
        .suggestion("Re-activate " + field.getLabel() + " so the assistant can use it"));
  }

  private static FieldQualityResult.FieldQualityResultBuilder base(ScoreableField field) {
    return FieldQualityResult.builder()
        .fieldKey(field.getKey())
        .fieldLabel(field.getLabel())
        .category(field.getCategory())
        .priority(field.getPriority())
        .maxPossibleScore(field.getWeight());
  }

  /** Computes the weighted score from the sub-scores already on the builder. */
  private static FieldQualityResult finish(ScoreableField field,
      FieldQualityResult.FieldQualityResultBuilder builder) {
    FieldQualityResult draft = builder.build();
    double points = field.getWeight() * draft.fieldScore() / 100.0;
    return builder.weightedScore(round2(points)).build();
  }

  private static IssueSeverity shortfallSeverity(ScoreableField field) {
    return field.getPriority() == FieldPriority.ESSENTIAL ? IssueSeverity.CRITICAL : IssueSeverity.WARNING;
  }

  private static int percent(int value, int target) {
    return (int) Math.min(100, Math.round(100.0 * value / target));
  }

  private static int clamp(double score) {
    return (int) Math.max(0, Math.min(100, Math.round(score)));
  }

  static double round2(double value) {
    return Math.round(value * 100.0) / 100.0;
  }
}
