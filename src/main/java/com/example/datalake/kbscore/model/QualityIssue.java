package com.example.datalake.kbscore.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class QualityIssue {
  String code;
  IssueSeverity severity;
  String message;
  String suggestion;
}
