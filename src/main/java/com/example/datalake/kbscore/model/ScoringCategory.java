package com.example.datalake.kbscore.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;
import java.util.Optional;

/**
 * The five fixed groupings of scoreable fields. Weights add up to 100. The property names keep map
 * keys on the same wire ids as the values.
 */
public enum ScoringCategory {
  @JsonProperty("core_data")
  CORE_DATA("core_data", "Business data", 30),
  @JsonProperty("personality")
  PERSONALITY("personality", "Personality", 25),
  @JsonProperty("policies")
  POLICIES("policies", "Policies", 20),
  @JsonProperty("knowledge")
  KNOWLEDGE("knowledge", "Knowledge", 15),
  @JsonProperty("advanced")
  ADVANCED("advanced", "Advanced", 10);

  private final String id;
  private final String label;
  private final int weight;

  ScoringCategory(String id, String label, int weight) {
    this.id = id;
    this.label = label;
    this.weight = weight;
  }

  @JsonValue
  public String id() {
    return id;
  }

  public String label() {
    return label;
  }

  /** Percentage of the total score this category is worth. */
  public int weight() {
    return weight;
  }

  public static int totalWeight() {
    return Arrays.stream(values()).mapToInt(ScoringCategory::weight).sum();
  }

  public static Optional<ScoringCategory> find(String id) {
    if (id == null) {
      return Optional.empty();
    }
    return Arrays.stream(values()).filter(c -> c.id.equalsIgnoreCase(id.trim())).findFirst();
  }

  @JsonCreator
  static ScoringCategory fromId(String id) {
    return find(id).orElseThrow(() -> new IllegalArgumentException("Unknown category: " + id));
  }
}
