package com.example.datalake.kbscore.display;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.datalake.kbscore.model.CategoryScore;
import com.example.datalake.kbscore.model.CategoryStatus;
import com.example.datalake.kbscore.model.FieldStatus;
import com.example.datalake.kbscore.model.KbScoringResult;
import com.example.datalake.kbscore.model.ScoringCategory;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class StatusPaletteTest {

  private final StatusPalette palette = new StatusPalette();

  @Test
  void fieldStatusesMapToDistinctColors() {
    assertThat(palette.colorFor(FieldStatus.COMPLETE)).isEqualTo(StatusPalette.GREEN);
    assertThat(palette.colorFor(FieldStatus.PARTIAL)).isEqualTo(StatusPalette.AMBER);
    assertThat(palette.colorFor(FieldStatus.PLACEHOLDER)).isEqualTo(StatusPalette.ORANGE);
    assertThat(palette.colorFor(FieldStatus.DISABLED)).isEqualTo(StatusPalette.LIGHT_GRAY);
    assertThat(palette.colorFor(FieldStatus.MISSING)).isEqualTo(StatusPalette.GRAY);
  }

  @Test
  void categoryStatusesMapToColors() {
    assertThat(palette.colorFor(CategoryStatus.EXCELLENT)).isEqualTo(StatusPalette.GREEN);
    assertThat(palette.colorFor(CategoryStatus.GOOD)).isEqualTo(StatusPalette.BLUE);
    assertThat(palette.colorFor(CategoryStatus.NEEDS_WORK)).isEqualTo(StatusPalette.AMBER);
    assertThat(palette.colorFor(CategoryStatus.CRITICAL)).isEqualTo(StatusPalette.RED);
  }

  @Test
  void unknownStatusFallsBackToMissing() {
    assertThat(palette.colorFor("archived")).isEqualTo(palette.colorFor(FieldStatus.MISSING));
    assertThat(palette.colorFor((String) null)).isEqualTo(StatusPalette.GRAY);
    assertThat(palette.colorFor((FieldStatus) null)).isEqualTo(StatusPalette.GRAY);
  }

  @Test
  void paletteCarriesCssClasses() {
    assertThat(StatusPalette.GREEN.bg()).isEqualTo("bg-green-500");
    assertThat(StatusPalette.GREEN.text()).isEqualTo("text-green-700");
    assertThat(StatusPalette.GREEN.light()).isEqualTo("bg-green-50");
  }

  @Test
  void everyCategoryHasItsOwnIcon() {
    assertThat(Arrays.stream(ScoringCategory.values()).map(palette::iconFor))
        .doesNotHaveDuplicates()
        .doesNotContain("•");
    assertThat(palette.iconFor(null)).isEqualTo("•");
  }

  @Test
  void hintsColourTheTotalAndEachCategory() {
    Map<ScoringCategory, CategoryScore> scores = new EnumMap<>(ScoringCategory.class);
    for (ScoringCategory category : ScoringCategory.values()) {
      int score = category == ScoringCategory.POLICIES ? 40 : 95;
      scores.put(category, CategoryScore.builder()
          .category(category)
          .score(score)
          .status(CategoryStatus.fromScore(score))
          .build());
    }
    KbScoringResult result = KbScoringResult.builder().totalScore(84).categoryScores(scores).build();

    DisplayHints hints = palette.hintsFor(result);

    assertThat(hints.status()).isEqualTo(StatusPalette.BLUE);
    assertThat(hints.categoryColors().get(ScoringCategory.POLICIES)).isEqualTo(StatusPalette.RED);
    assertThat(hints.categoryColors().get(ScoringCategory.CORE_DATA)).isEqualTo(StatusPalette.GREEN);
    assertThat(hints.categoryIcons().get(ScoringCategory.KNOWLEDGE))
        .isEqualTo(palette.iconFor(ScoringCategory.KNOWLEDGE));
  }

  @Test
  void hintsForResultWithoutCategoriesUseTheMissingPalette() {
    DisplayHints hints = palette.hintsFor(KbScoringResult.builder().totalScore(0).build());

    assertThat(hints.status()).isEqualTo(StatusPalette.RED);
    assertThat(hints.categoryColors().values()).containsOnly(StatusPalette.GRAY);
  }
}
