package com.example.datalake.kbscore.controller;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.example.datalake.kbscore.config.ScoringProperties;
import com.example.datalake.kbscore.display.StatusPalette;
import com.example.datalake.kbscore.model.KbDataForScoring;
import com.example.datalake.kbscore.model.ScoringCategory;
import com.example.datalake.kbscore.model.ScoreableField;
import com.example.datalake.kbscore.response.KbScoreResponse;
import com.example.datalake.kbscore.service.CategoryAggregator;
import com.example.datalake.kbscore.service.FieldEvaluator;
import com.example.datalake.kbscore.service.KbScoringService;
import com.example.datalake.kbscore.service.KbStatusSummaryService;
import com.example.datalake.kbscore.service.RecommendationRanker;
import com.example.datalake.kbscore.validation.PlaceholderDetector;
import java.time.Clock;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.http.ResponseEntity;

class KbScoreControllerTest {

  private final KbScoringService scoringService = new KbScoringService(
      new FieldEvaluator(new PlaceholderDetector()),
      new CategoryAggregator(),
      new RecommendationRanker(),
      Clock.systemUTC());
  private final KbScoreController controller =
      new KbScoreController(scoringService, new KbStatusSummaryService(), new ScoringProperties(),
          new StatusPalette());

  @Test
  void scoreRejectsMissingSnapshot() {
    ResponseEntity<KbScoreResponse> response = controller.score(null, "dental").block();

    assertThat(response).isNotNull();
    assertThat(response.getStatusCode().value()).isEqualTo(400);
    assertThat(response.getBody()).isNotNull();
    assertThat(response.getBody().getErrors())
        .containsExactly("Request body must contain a knowledge base snapshot.");
    assertThat(response.getBody().getResult()).isNull();
  }

  @Test
  void scoreFallsBackToDefaultVerticalWithNotice() {
    ResponseEntity<KbScoreResponse> response = controller.score(KbDataForScoring.empty(), null).block();

    assertThat(response).isNotNull();
    assertThat(response.getStatusCode().value()).isEqualTo(200);
    assertThat(response.getBody().getResult().getVertical()).isEqualTo("general");
    assertThat(response.getBody().getNotices())
        .containsExactly("No vertical supplied; scored with default vertical 'general'.");
    assertThat(response.getBody().getErrors()).isEmpty();
  }

  @Test
  void scoreNormalizesVertical() {
    ResponseEntity<KbScoreResponse> response =
        controller.score(KbDataForScoring.empty(), "  Dental ").block();

    assertThat(response.getBody().getResult().getVertical()).isEqualTo("dental");
    assertThat(response.getBody().getResult().getStats().getCriticalMissing()).isEqualTo(8);
    assertThat(response.getBody().getNotices()).isEmpty();
  }

  @Test
  void summaryReturnsHeadlineAndNextStep() {
    ResponseEntity<KbScoreResponse> response =
        controller.summary(KbDataForScoring.empty(), "general").block();

    assertThat(response.getStatusCode().value()).isEqualTo(200);
    KbScoreResponse body = response.getBody();
    assertThat(body.getResult()).isNull();
    assertThat(body.getSummary().getTitle()).isEqualTo("Configuration incomplete");
    assertThat(body.getNextStep().getFieldKey()).isEqualTo("services_configured");
    assertThat(body.getDisplay().status().bg()).isEqualTo("bg-red-500");
    assertThat(body.getDisplay().categoryIcons()).containsOnlyKeys(ScoringCategory.values());
  }

  @Test
  void scoreLeavesDisplayHintsToTheSummary() {
    ResponseEntity<KbScoreResponse> response = controller.score(KbDataForScoring.empty(), "general").block();

    assertThat(response.getBody().getDisplay()).isNull();
  }

  @Test
  void scoreReportsUnexpectedErrors() {
    KbScoringService failing = mock(KbScoringService.class);
    when(failing.calculate(any(), anyString())).thenThrow(new IllegalStateException("boom"));
    KbScoreController failingController =
        new KbScoreController(failing, new KbStatusSummaryService(), new ScoringProperties(),
            new StatusPalette());

    ResponseEntity<KbScoreResponse> response =
        failingController.score(KbDataForScoring.empty(), "general").block();

    assertThat(response.getStatusCode().value()).isEqualTo(500);
    assertThat(response.getBody().getErrors()).containsExactly("Unexpected error: boom");
    assertThat(response.getBody().getNotices()).isEmpty();
  }

  @Test
  void fieldsAreResolvedForVertical() {
    List<ScoreableField> fields = controller.fields("restaurant").block();

    assertThat(fields).hasSize(16);
    assertThat(fields.get(0).getLabel()).isEqualTo("Dishes / menu");
  }

  @Test
  void unknownFieldIsNotFound() {
    ResponseEntity<ScoreableField> missing = controller.field("unknown_field", null).block();
    ResponseEntity<ScoreableField> found = controller.field("staff_configured", "clinic").block();

    assertThat(missing.getStatusCode().value()).isEqualTo(404);
    assertThat(found.getStatusCode().value()).isEqualTo(200);
    assertThat(found.getBody().getLabel()).isEqualTo("Physicians");
  }
}
