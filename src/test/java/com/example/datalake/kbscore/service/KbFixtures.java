package com.example.datalake.kbscore.service;

import com.example.datalake.kbscore.model.KbDataForScoring;
import com.example.datalake.kbscore.model.KbRecord;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;

/** Snapshot builders shared by the scoring tests. */
public final class KbFixtures {

  static final String IDENTITY_SENTENCE = "Your name is Sofia, the assistant of Clinica Sonrisa. "
      + "Your personality is warm and patient, and your tone is friendly yet professional. ";
  static final String CANCELLATION_SENTENCE =
      "To cancel an appointment please give notice at least one day in advance by phone or chat. ";
  static final String PAYMENT_SENTENCE =
      "We accept payment in cash, debit card or credit card, and bank transfer for larger treatments. ";
  static final String PLAIN_SENTENCE =
      "Our team in Monterrey answers questions about appointments, prices and treatments with care. ";

  private KbFixtures() {}

  /** Repeats {@code sentence} until the stripped text is at least {@code minLength} long. */
  public static String text(String sentence, int minLength) {
    StringBuilder sb = new StringBuilder();
    while (sb.toString().strip().length() < minLength) {
      sb.append(sentence);
    }
    return sb.toString().strip();
  }

  public static KbRecord typed(String id, String type, String content) {
    return KbRecord.builder().id(id).type(type).content(content).active(true).build();
  }

  public static KbRecord inactive(String id, String type, String content) {
    return KbRecord.builder().id(id).type(type).content(content).active(false).build();
  }

  public static KbRecord item(String id) {
    return KbRecord.builder().id(id).title("Item " + id).active(true).build();
  }

  public static List<KbRecord> items(String prefix, int count) {
    return IntStream.rangeClosed(1, count).mapToObj(i -> item(prefix + i)).toList();
  }

  public static KbRecord branchWithHours(String id) {
    return KbRecord.builder()
        .id(id)
        .title("Centro")
        .active(true)
        .operatingHours(Map.of("monday", "09:00-18:00", "saturday", "09:00-14:00"))
        .build();
  }

  /** Every catalog field at or beyond its ideal length/count, for any built-in vertical. */
  public static KbDataForScoring complete() {
    List<KbRecord> templates = new ArrayList<>();
    templates.add(typed("t1", "greeting", text(PLAIN_SENTENCE, 100)));
    templates.add(typed("t2", "farewell", text(PLAIN_SENTENCE, 50)));
    templates.add(typed("t3", "booking_confirmation", text(PLAIN_SENTENCE, 40)));

    return KbDataForScoring.builder()
        .services(items("s", 5))
        .branches(List.of(branchWithHours("b1")))
        .staff(items("st", 2))
        .instructions(List.of(
            typed("i1", "identity", text(IDENTITY_SENTENCE, 200)),
            typed("i2", "communication_style", text(PLAIN_SENTENCE, 100)),
            typed("i3", "upselling", text(PLAIN_SENTENCE, 100))))
        .templates(templates)
        .policies(List.of(
            typed("p1", "cancellation", text(CANCELLATION_SENTENCE, 150)),
            typed("p2", "payment", text(PAYMENT_SENTENCE, 150)),
            typed("p3", "pricing", text(PLAIN_SENTENCE, 150)),
            typed("p4", "warranty", text(PLAIN_SENTENCE, 150))))
        .articles(List.of(
            typed("a1", "about_us", text(PLAIN_SENTENCE, 300)),
            typed("a2", "differentiators", text(PLAIN_SENTENCE, 300))))
        .competitors(List.of(KbRecord.builder()
            .id("c1")
            .title("Dental Plus")
            .content("Highlight our warranty and direct pricing without criticizing them.")
            .active(true)
            .build()))
        .build();
  }
}
