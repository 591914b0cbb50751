package com.example.datalake.kbscore.model;

import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Static scoring rule for one knowledge base field. Instances live in the field catalog and are
 * never mutated; vertical variants are derived with {@code toBuilder()}.
 */
@Value
@Builder(toBuilder = true)
public class ScoreableField {
  String key;
  String label;
  ScoringCategory category;
  /** Points within the category, always positive. */
  int weight;
  FieldPriority priority;

  @Builder.Default FieldKind kind = FieldKind.CONTENT;
  int minLength;
  int idealLength;
  int minCount;
  @Singular List<String> requiredKeywords;

  DataSource dataSource;
  /** Record type the field matches on; null means any record of the collection. */
  String filterType;

  /** Partial patches keyed by vertical id. */
  @Singular Map<String, FieldOverride> verticalOverrides;
}
