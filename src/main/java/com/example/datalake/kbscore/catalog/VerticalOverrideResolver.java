package com.example.datalake.kbscore.catalog;

import com.example.datalake.kbscore.model.FieldOverride;
import com.example.datalake.kbscore.model.ScoreableField;
import java.util.List;
import java.util.Objects;

/**
 * Applies the override registered for a vertical on top of a base field definition. The merge is
 * shallow: an overridden attribute replaces the base one wholesale, lists included.
 */
public final class VerticalOverrideResolver {

  private VerticalOverrideResolver() {}

  public static ScoreableField resolve(ScoreableField base, String vertical) {
    Objects.requireNonNull(base, "base");
    Objects.requireNonNull(vertical, "vertical");

    FieldOverride patch = base.getVerticalOverrides().get(vertical);
    if (patch == null) {
      return base;
    }
    return merge(base, patch);
  }

  static ScoreableField merge(ScoreableField base, FieldOverride patch) {
    ScoreableField.ScoreableFieldBuilder builder = base.toBuilder();
    if (patch.getLabel() != null) {
      builder.label(patch.getLabel());
    }
    if (patch.getWeight() != null) {
      builder.weight(patch.getWeight());
    }
    if (patch.getPriority() != null) {
      builder.priority(patch.getPriority());
    }
    if (patch.getMinLength() != null) {
      builder.minLength(patch.getMinLength());
    }
    if (patch.getIdealLength() != null) {
      builder.idealLength(patch.getIdealLength());
    }
    if (patch.getMinCount() != null) {
      builder.minCount(patch.getMinCount());
    }
    if (patch.getRequiredKeywords() != null) {
      List<String> keywords = List.copyOf(patch.getRequiredKeywords());
      builder.clearRequiredKeywords().requiredKeywords(keywords);
    }
    if (patch.getFilterType() != null) {
      builder.filterType(patch.getFilterType());
    }
    return builder.build();
  }
}
