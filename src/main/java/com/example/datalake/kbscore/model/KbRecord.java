package com.example.datalake.kbscore.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;
import lombok.Builder;

/**
 * One row of a knowledge base collection as seen by the scorer. The aliases accept the property
 * names each collection uses upstream (instruction_type, policy_text, template_text, ...).
 */
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public record KbRecord(
    String id,
    @JsonAlias({"instruction_type", "policy_type", "category", "trigger_type", "role"})
        String type,
    @JsonAlias({"name", "competitor_name", "first_name"}) String title,
    @JsonAlias({"instruction", "policy_text", "template_text", "response_strategy"})
        String content,
    @JsonProperty("is_active") boolean active,
    @JsonProperty("operating_hours") Map<String, Object> operatingHours) {

  public boolean hasType(String expected) {
    return expected != null && expected.equals(type);
  }

  public boolean hasOperatingHours() {
    return operatingHours != null && !operatingHours.isEmpty();
  }
}
