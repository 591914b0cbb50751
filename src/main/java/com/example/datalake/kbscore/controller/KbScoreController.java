package com.example.datalake.kbscore.controller;

import com.example.datalake.kbscore.catalog.FieldCatalog;
import com.example.datalake.kbscore.config.ScoringProperties;
import com.example.datalake.kbscore.display.StatusPalette;
import com.example.datalake.kbscore.model.KbDataForScoring;
import com.example.datalake.kbscore.model.KbScoringResult;
import com.example.datalake.kbscore.model.ScoreableField;
import com.example.datalake.kbscore.response.KbScoreResponse;
import com.example.datalake.kbscore.service.KbScoringService;
import com.example.datalake.kbscore.service.KbStatusSummaryService;
import com.example.datalake.kbscore.validation.ScoringRequestException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@Slf4j
@RestController
@RequestMapping("/v1/kb-score")
@Tag(name = "Knowledge Base Score", description = "Completeness scoring of a knowledge base snapshot")
@RequiredArgsConstructor
public class KbScoreController {

    private final KbScoringService scoringService;
    private final KbStatusSummaryService summaryService;
    private final ScoringProperties properties;
    private final StatusPalette statusPalette;

    @PostMapping
    @Operation(
            summary = "Score a knowledge base snapshot",
            description = "Evaluates every catalog field for the vertical and returns category scores, the total and ranked recommendations."
    )
    public Mono<ResponseEntity<KbScoreResponse>> score(
            @RequestBody(required = false) KbDataForScoring snapshot,
            @RequestParam(value = "vertical", required = false) String vertical) {
        return run(snapshot, vertical, result -> KbScoreResponse.builder().result(result));
    }

    @PostMapping("/summary")
    @Operation(
            summary = "Summarize a knowledge base snapshot",
            description = "Scores the snapshot and returns the headline status, the next recommended step and display hints."
    )
    public Mono<ResponseEntity<KbScoreResponse>> summary(
            @RequestBody(required = false) KbDataForScoring snapshot,
            @RequestParam(value = "vertical", required = false) String vertical) {
        return run(snapshot, vertical, result -> KbScoreResponse.builder()
                .summary(summaryService.summarize(result))
                .nextStep(summaryService.nextStep(result).orElse(null))
                .display(statusPalette.hintsFor(result)));
    }

    @GetMapping("/fields")
    @Operation(summary = "List the field catalog resolved for a vertical")
    public Mono<List<ScoreableField>> fields(@RequestParam(value = "vertical", required = false) String vertical) {
        return Mono.fromCallable(() -> FieldCatalog.getFieldsForVertical(resolveVertical(vertical)));
    }

    @GetMapping("/fields/{key}")
    @Operation(summary = "Get one field definition resolved for a vertical")
    public Mono<ResponseEntity<ScoreableField>> field(
            @PathVariable String key,
            @RequestParam(value = "vertical", required = false) String vertical) {
        return Mono.fromCallable(() -> FieldCatalog.getFieldDefinition(key, resolveVertical(vertical))
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build()));
    }

    private Mono<ResponseEntity<KbScoreResponse>> run(
            KbDataForScoring snapshot,
            String vertical,
            Function<KbScoringResult, KbScoreResponse.KbScoreResponseBuilder> view) {
        List<String> notices = new ArrayList<>();
        return Mono.fromCallable(() -> {
                    if (snapshot == null) {
                        throw new ScoringRequestException("Request body must contain a knowledge base snapshot.");
                    }
                    String resolved = resolveVertical(vertical);
                    if (vertical == null || vertical.isBlank()) {
                        notices.add("No vertical supplied; scored with default vertical '" + resolved + "'.");
                    }
                    return scoringService.calculate(snapshot, resolved);
                })
                .map(result -> ResponseEntity.ok(view.apply(result)
                        .notices(List.copyOf(notices))
                        .errors(List.of())
                        .build()))
                .onErrorResume(ScoringRequestException.class, ex ->
                        Mono.just(ResponseEntity.badRequest().body(toErrorResponse(ex))))
                .onErrorResume(ex -> {
                    log.error("Unexpected failure while scoring knowledge base", ex);
                    return Mono.just(ResponseEntity.internalServerError().body(toUnexpectedErrorResponse(ex)));
                });
    }

    private String resolveVertical(String vertical) {
        if (vertical == null || vertical.isBlank()) {
            return properties.getDefaultVertical();
        }
        return vertical.trim().toLowerCase(Locale.ROOT);
    }

    private KbScoreResponse toErrorResponse(ScoringRequestException ex) {
        return KbScoreResponse.builder()
                .notices(List.of())
                .errors(List.copyOf(ex.getReasons()))
                .build();
    }

    private KbScoreResponse toUnexpectedErrorResponse(Throwable ex) {
        String detail = ex.getMessage();
        String message = (detail == null || detail.isBlank())
                ? "Unexpected error occurred."
                : "Unexpected error: " + detail;
        return KbScoreResponse.builder()
                .notices(List.of())
                .errors(List.of(message))
                .build();
    }
}
