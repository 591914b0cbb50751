package com.example.datalake.kbscore.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Function;

/** The snapshot collection a field reads from. */
public enum DataSource {
  INSTRUCTIONS(KbDataForScoring::instructions),
  POLICIES(KbDataForScoring::policies),
  ARTICLES(KbDataForScoring::articles),
  TEMPLATES(KbDataForScoring::templates),
  COMPETITORS(KbDataForScoring::competitors),
  SERVICES(KbDataForScoring::services),
  BRANCHES(KbDataForScoring::branches),
  STAFF(KbDataForScoring::staff);

  private final Function<KbDataForScoring, List<KbRecord>> accessor;

  DataSource(Function<KbDataForScoring, List<KbRecord>> accessor) {
    this.accessor = accessor;
  }

  /** Records of this collection in snapshot order, never null and without null entries. */
  public List<KbRecord> records(KbDataForScoring data) {
    List<KbRecord> records = data == null ? null : accessor.apply(data);
    if (records == null || records.isEmpty()) {
      return List.of();
    }
    return records.stream().filter(Objects::nonNull).toList();
  }

  @JsonValue
  public String id() {
    return name().toLowerCase(Locale.ROOT);
  }
}
