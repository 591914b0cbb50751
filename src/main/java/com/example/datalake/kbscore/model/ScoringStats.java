package com.example.datalake.kbscore.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ScoringStats {
  int totalFields;
  int completedFields;
  int fieldsWithIssues;
  /** Essential fields that are missing or disabled. */
  int criticalMissing;
  int placeholdersDetected;
}
