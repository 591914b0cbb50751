package com.example.datalake.kbscore.display;

import com.example.datalake.kbscore.model.CategoryScore;
import com.example.datalake.kbscore.model.CategoryStatus;
import com.example.datalake.kbscore.model.FieldStatus;
import com.example.datalake.kbscore.model.KbScoringResult;
import com.example.datalake.kbscore.model.ScoringCategory;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import org.springframework.stereotype.Component;

/**
 * Maps field and category statuses to display colors, and categories to icons. Unknown status
 * ids fall back to the "missing" palette.
 */
@Component
public class StatusPalette {

  static final Palette GREEN = of("green-500", "green-700", "green-500", "green-50");
  static final Palette BLUE = of("blue-500", "blue-700", "blue-500", "blue-50");
  static final Palette AMBER = of("amber-500", "amber-700", "amber-500", "amber-50");
  static final Palette ORANGE = of("orange-500", "orange-700", "orange-500", "orange-50");
  static final Palette RED = of("red-500", "red-700", "red-500", "red-50");
  static final Palette GRAY = of("gray-400", "gray-600", "gray-400", "gray-50");
  static final Palette LIGHT_GRAY = of("gray-300", "gray-500", "gray-300", "gray-50");

  /** Colours for the headline status and every category of a result, plus category icons. */
  public DisplayHints hintsFor(KbScoringResult result) {
    Objects.requireNonNull(result, "result");
    Map<ScoringCategory, Palette> colors = new EnumMap<>(ScoringCategory.class);
    Map<ScoringCategory, String> icons = new EnumMap<>(ScoringCategory.class);
    Map<ScoringCategory, CategoryScore> scores =
        result.getCategoryScores() == null ? Map.of() : result.getCategoryScores();
    for (ScoringCategory category : ScoringCategory.values()) {
      CategoryScore score = scores.get(category);
      colors.put(category, colorFor(score == null ? null : score.getStatus()));
      icons.put(category, iconFor(category));
    }
    return new DisplayHints(
        colorFor(CategoryStatus.fromScore(result.getTotalScore())),
        Collections.unmodifiableMap(colors),
        Collections.unmodifiableMap(icons));
  }

  public Palette colorFor(FieldStatus status) {
    return colorFor(status == null ? null : status.id());
  }

  public Palette colorFor(CategoryStatus status) {
    return colorFor(status == null ? null : status.id());
  }

  public Palette colorFor(String statusId) {
    if (statusId == null) {
      return GRAY;
    }
    return switch (statusId) {
      case "excellent", "complete" -> GREEN;
      case "good" -> BLUE;
      case "partial", "needs_work" -> AMBER;
      case "placeholder" -> ORANGE;
      case "critical" -> RED;
      case "disabled" -> LIGHT_GRAY;
      default -> GRAY;
    };
  }

  public String iconFor(ScoringCategory category) {
    if (category == null) {
      return "•";
    }
    return switch (category) {
      case CORE_DATA -> "📊";
      case PERSONALITY -> "🎭";
      case POLICIES -> "📋";
      case KNOWLEDGE -> "📚";
      case ADVANCED -> "⚡";
    };
  }

  private static Palette of(String bg, String text, String border, String light) {
    return new Palette("bg-" + bg, "text-" + text, "border-" + border, "bg-" + light);
  }
}
