package com.example.datalake.kbscore.validation;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class PlaceholderDetectorTest {

  private final PlaceholderDetector detector = new PlaceholderDetector();

  @Test
  void flagsLoremIpsumCaseInsensitively() {
    PlaceholderDetection detection = detector.detect("LOREM Ipsum dolor sit amet, consectetur.");

    assertThat(detection.placeholder()).isTrue();
    assertThat(detection.matchedPatterns()).contains("lorem ipsum");
  }

  @Test
  void flagsTemplateTokensAndRepeatedLetters() {
    assertThat(detector.detect("Hello {{business_name}}, how can we help?").placeholder()).isTrue();
    assertThat(detector.detect("[Insert your cancellation rules here]").placeholder()).isTrue();
    assertThat(detector.detect("aaaaaaa").placeholder()).isTrue();
  }

  @Test
  void matchesWholeWordsOnly() {
    PlaceholderDetection detection =
        detector.detect("Ask about our latest treatments and contest prizes.");

    assertThat(detection.placeholder()).isFalse();
    assertThat(detection.matchedPatterns()).isEmpty();
  }

  @ParameterizedTest
  @ValueSource(strings = {
      "This is a test",
      "test",
      "  Testing! ",
      "test test test",
      "Testing 1, 2, 3 for the greeting",
      "Esto es una prueba del mensaje"
  })
  void flagsTestFillerForms(String content) {
    assertThat(detector.detect(content).placeholder()).isTrue();
  }

  @ParameterizedTest
  @ValueSource(strings = {
      "Every new patient gets a free allergy test before any treatment.",
      "We run blood tests and pregnancy tests on site, results in 24 hours.",
      "Testing for cavities is included in every check-up.",
      "La prueba de alergia es gratuita para pacientes nuevos."
  })
  void ordinaryMentionsOfTestsAreRealContent(String content) {
    PlaceholderDetection detection = detector.detect(content);

    assertThat(detection.placeholder()).isFalse();
    assertThat(detection.matchedPatterns()).isEmpty();
  }

  @Test
  void flagsGenericPhrasesWithoutMarkingPlaceholder() {
    PlaceholderDetection detection =
        detector.detect("Welcome to our business! We offer the best service in town.");

    assertThat(detection.placeholder()).isFalse();
    assertThat(detection.generic()).isTrue();
    assertThat(detection.matchedPatterns())
        .containsExactly("we offer the best service", "welcome to our business");
  }

  @Test
  void blankContentIsNeitherPlaceholderNorGeneric() {
    assertThat(detector.detect(null)).isEqualTo(PlaceholderDetection.NONE);
    assertThat(detector.detect("   ")).isEqualTo(PlaceholderDetection.NONE);
  }

  @Test
  void acceptsConfiguredMarkers() {
    PlaceholderDetector custom = new PlaceholderDetector(List.of("Pendiente", " ", "DEMO"));

    assertThat(custom.detect("Horario pendiente de confirmar").placeholder()).isTrue();
    assertThat(custom.detect("demo content").placeholder()).isTrue();
    assertThat(custom.markers()).contains("pendiente", "demo").doesNotContain(" ");
  }
}
