package com.example.datalake.kbscore.model;

import lombok.Builder;
import lombok.Value;

/** Headline view of a scoring result for dashboards. */
@Value
@Builder
public class KbStatusSummary {
  int totalScore;
  CategoryStatus status;
  String title;
  String description;
  boolean productionReady;
  boolean promptQualityReady;
  int pendingFields;
}
