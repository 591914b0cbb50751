package com.example.datalake.kbscore.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Shallow patch over a {@link ScoreableField}. Every non-null attribute replaces the base value
 * wholesale; null means "keep the base value". Identity attributes (key, category, data source,
 * kind) cannot be overridden.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FieldOverride {
  String label;
  Integer weight;
  FieldPriority priority;
  Integer minLength;
  Integer idealLength;
  Integer minCount;
  List<String> requiredKeywords;
  String filterType;
}
