package com.example.datalake.kbscore.response;

import com.example.datalake.kbscore.display.DisplayHints;
import com.example.datalake.kbscore.model.KbScoringResult;
import com.example.datalake.kbscore.model.KbStatusSummary;
import com.example.datalake.kbscore.model.ScoringRecommendation;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.Accessors;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Accessors(chain = true, fluent = false)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class KbScoreResponse {
  private KbScoringResult result;
  private KbStatusSummary summary;
  private ScoringRecommendation nextStep;
  private DisplayHints display;

  private List<String> notices;
  private List<String> errors;
}
