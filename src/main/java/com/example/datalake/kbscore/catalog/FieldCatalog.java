package com.example.datalake.kbscore.catalog;

import static com.example.datalake.kbscore.model.FieldPriority.ESSENTIAL;
import static com.example.datalake.kbscore.model.FieldPriority.OPTIONAL;
import static com.example.datalake.kbscore.model.FieldPriority.RECOMMENDED;

import com.example.datalake.kbscore.catalog.QualityThresholds.Length;
import com.example.datalake.kbscore.model.DataSource;
import com.example.datalake.kbscore.model.FieldKind;
import com.example.datalake.kbscore.model.FieldOverride;
import com.example.datalake.kbscore.model.FieldPriority;
import com.example.datalake.kbscore.model.ScoreableField;
import com.example.datalake.kbscore.model.ScoringCategory;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * The static table of scoreable fields. Built once at class initialization and never mutated;
 * every lookup resolves vertical overrides on read.
 */
public final class FieldCatalog {

  public static final List<ScoreableField> FIELDS = List.of(
      // core_data
      count("services_configured", "Configured services", ScoringCategory.CORE_DATA, 10, ESSENTIAL,
          DataSource.SERVICES, 3)
          .verticalOverride("dental", FieldOverride.builder().minCount(5).label("Dental treatments").build())
          .verticalOverride("restaurant", FieldOverride.builder().minCount(5).label("Dishes / menu").build())
          .verticalOverride("gym", FieldOverride.builder().minCount(3).label("Memberships / classes").build())
          .build(),
      count("branches_configured", "Branches with schedules", ScoringCategory.CORE_DATA, 8, ESSENTIAL,
          DataSource.BRANCHES, 1)
          .build(),
      count("staff_configured", "Professional staff", ScoringCategory.CORE_DATA, 7, RECOMMENDED,
          DataSource.STAFF, 1)
          .verticalOverride("dental", FieldOverride.builder().priority(ESSENTIAL).label("Doctors / specialists").build())
          .verticalOverride("clinic", FieldOverride.builder().priority(ESSENTIAL).label("Physicians").build())
          .build(),
      ScoreableField.builder()
          .key("business_hours")
          .label("Business hours")
          .category(ScoringCategory.CORE_DATA)
          .weight(5)
          .priority(ESSENTIAL)
          .kind(FieldKind.SCHEDULE)
          .dataSource(DataSource.BRANCHES)
          .build(),

      // personality
      content("identity", "Assistant identity", ScoringCategory.PERSONALITY, 10, ESSENTIAL,
          DataSource.INSTRUCTIONS, "identity", QualityThresholds.IDENTITY)
          .requiredKeyword("name")
          .requiredKeyword("personality")
          .requiredKeyword("tone")
          .build(),
      content("greeting", "Greeting message", ScoringCategory.PERSONALITY, 6, ESSENTIAL,
          DataSource.TEMPLATES, "greeting", QualityThresholds.GREETING)
          .build(),
      content("farewell", "Farewell message", ScoringCategory.PERSONALITY, 4, ESSENTIAL,
          DataSource.TEMPLATES, "farewell", QualityThresholds.FAREWELL)
          .build(),
      content("communication_style", "Communication style", ScoringCategory.PERSONALITY, 5, RECOMMENDED,
          DataSource.INSTRUCTIONS, "communication_style", QualityThresholds.INSTRUCTION)
          .build(),

      // policies
      content("cancellation_policy", "Cancellation policy", ScoringCategory.POLICIES, 7, RECOMMENDED,
          DataSource.POLICIES, "cancellation", QualityThresholds.POLICY)
          .requiredKeyword("cancel")
          .requiredKeyword("notice")
          .requiredKeyword("advance")
          .verticalOverride("dental", FieldOverride.builder().priority(ESSENTIAL).build())
          .verticalOverride("clinic", FieldOverride.builder().priority(ESSENTIAL).build())
          .verticalOverride("beauty", FieldOverride.builder().priority(ESSENTIAL).build())
          .build(),
      content("payment_policy", "Payment policy", ScoringCategory.POLICIES, 6, RECOMMENDED,
          DataSource.POLICIES, "payment", QualityThresholds.POLICY)
          .requiredKeyword("payment")
          .requiredKeyword("cash")
          .requiredKeyword("card")
          .build(),
      content("pricing_policy", "Pricing policy", ScoringCategory.POLICIES, 4, OPTIONAL,
          DataSource.POLICIES, "pricing", QualityThresholds.POLICY)
          .build(),
      content("warranty_policy", "Warranty policy", ScoringCategory.POLICIES, 3, OPTIONAL,
          DataSource.POLICIES, "warranty", QualityThresholds.POLICY)
          .verticalOverride("dental", FieldOverride.builder().priority(RECOMMENDED).label("Treatment warranty").build())
          .build(),

      // knowledge
      count("knowledge_articles", "Information articles", ScoringCategory.KNOWLEDGE, 6, RECOMMENDED,
          DataSource.ARTICLES, 2)
          .build(),
      content("about_us", "About us", ScoringCategory.KNOWLEDGE, 5, RECOMMENDED,
          DataSource.ARTICLES, "about_us", QualityThresholds.ARTICLE)
          .build(),
      content("differentiators", "Differentiators", ScoringCategory.KNOWLEDGE, 4, OPTIONAL,
          DataSource.ARTICLES, "differentiators", QualityThresholds.ARTICLE)
          .build(),

      // advanced
      count("competitor_handling", "Competitor handling", ScoringCategory.ADVANCED, 5, OPTIONAL,
          DataSource.COMPETITORS, 1)
          .build(),
      content("upselling_instructions", "Upselling instructions", ScoringCategory.ADVANCED, 3, OPTIONAL,
          DataSource.INSTRUCTIONS, "upselling", QualityThresholds.INSTRUCTION)
          .build(),
      count("response_templates", "Response templates", ScoringCategory.ADVANCED, 2, OPTIONAL,
          DataSource.TEMPLATES, 3)
          .build());

  static {
    checkInvariants(FIELDS);
  }

  private FieldCatalog() {}

  /** The field for {@code key} with the vertical's override applied, or empty if unknown. */
  public static Optional<ScoreableField> getFieldDefinition(String key, String vertical) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(vertical, "vertical");
    return FIELDS.stream()
        .filter(field -> field.getKey().equals(key))
        .findFirst()
        .map(field -> VerticalOverrideResolver.resolve(field, vertical));
  }

  /** The whole catalog, in declaration order, resolved for a vertical. */
  public static List<ScoreableField> getFieldsForVertical(String vertical) {
    Objects.requireNonNull(vertical, "vertical");
    return FIELDS.stream()
        .map(field -> VerticalOverrideResolver.resolve(field, vertical))
        .toList();
  }

  public static int getCategoryTotalWeight(ScoringCategory category, String vertical) {
    Objects.requireNonNull(category, "category");
    return getFieldsForVertical(vertical).stream()
        .filter(field -> field.getCategory() == category)
        .mapToInt(ScoreableField::getWeight)
        .sum();
  }

  static void checkInvariants(List<ScoreableField> fields) {
    if (ScoringCategory.totalWeight() != 100) {
      throw new IllegalStateException(
          "Category weights must sum to 100, got " + ScoringCategory.totalWeight());
    }
    Set<String> keys = new HashSet<>();
    for (ScoreableField field : fields) {
      if (!keys.add(field.getKey())) {
        throw new IllegalStateException("Duplicate field key: " + field.getKey());
      }
      if (field.getWeight() <= 0) {
        throw new IllegalStateException("Field weight must be positive: " + field.getKey());
      }
      field.getVerticalOverrides().forEach((vertical, patch) -> {
        if (patch.getWeight() != null && patch.getWeight() <= 0) {
          throw new IllegalStateException(
              "Override weight must be positive: " + field.getKey() + "@" + vertical);
        }
      });
    }
  }

  private static ScoreableField.ScoreableFieldBuilder count(String key, String label,
      ScoringCategory category, int weight, FieldPriority priority, DataSource source, int minCount) {
    return ScoreableField.builder()
        .key(key)
        .label(label)
        .category(category)
        .weight(weight)
        .priority(priority)
        .kind(FieldKind.COUNT)
        .dataSource(source)
        .minCount(minCount);
  }

  private static ScoreableField.ScoreableFieldBuilder content(String key, String label,
      ScoringCategory category, int weight, FieldPriority priority, DataSource source,
      String filterType, Length length) {
    return ScoreableField.builder()
        .key(key)
        .label(label)
        .category(category)
        .weight(weight)
        .priority(priority)
        .kind(FieldKind.CONTENT)
        .dataSource(source)
        .filterType(filterType)
        .minLength(length.min())
        .idealLength(length.ideal());
  }
}
