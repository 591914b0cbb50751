package com.example.datalake.kbscore.validation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Flags filler/test text and stock marketing phrases in knowledge base content. Matching is
 * case-insensitive and word markers only match whole words. A plain mention of a test ("allergy
 * test") is not filler; "test test", "this is a test", "testing 123" or a lone "test" are.
 */
public class PlaceholderDetector {

  private static final Map<String, Pattern> BUILT_IN_PLACEHOLDERS = new LinkedHashMap<>();
  private static final Map<String, Pattern> GENERIC_PHRASES = new LinkedHashMap<>();

  static {
    for (String word : List.of("lorem ipsum", "placeholder", "sample text", "texto de prueba",
        "texto de ejemplo", "tbd", "xxx", "asdf", "qwerty", "foo")) {
      BUILT_IN_PLACEHOLDERS.put(word, wordPattern(word));
    }
    // test and prueba only count in their filler forms
    for (String phrase : List.of("test test", "this is a test", "prueba prueba",
        "esto es una prueba")) {
      BUILT_IN_PLACEHOLDERS.put(phrase, wordPattern(phrase));
    }
    BUILT_IN_PLACEHOLDERS.put("testing 123", Pattern.compile(
        "(?<![\\p{L}\\p{N}])(testing|probando)\\W*1\\W*2\\W*3(?!\\p{N})", Pattern.CASE_INSENSITIVE));
    BUILT_IN_PLACEHOLDERS.put("test-only", Pattern.compile(
        "^\\W*(test|testing|prueba)\\W*$", Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CHARACTER_CLASS));
    BUILT_IN_PLACEHOLDERS.put("[insert ...]",
        Pattern.compile("\\[\\s*insert[^\\]]*\\]", Pattern.CASE_INSENSITIVE));
    BUILT_IN_PLACEHOLDERS.put("{{...}}", Pattern.compile("\\{\\{[^}]*\\}\\}"));
    BUILT_IN_PLACEHOLDERS.put("<...>",
        Pattern.compile("<\\s*(your|insert|name|business)[^>]*>", Pattern.CASE_INSENSITIVE));
    // aaaaa, zzzzzz
    BUILT_IN_PLACEHOLDERS.put("repeated-letter", Pattern.compile("(\\p{L})\\1{4,}"));

    for (String phrase : List.of(
        "we offer the best service",
        "the best quality",
        "customer satisfaction is our priority",
        "welcome to our business",
        "we are the best",
        "your satisfaction is guaranteed",
        "high quality service")) {
      GENERIC_PHRASES.put(phrase, wordPattern(phrase));
    }
  }

  private final Map<String, Pattern> placeholders;

  public PlaceholderDetector() {
    this(List.of());
  }

  /** @param extraMarkers additional whole-word markers treated as placeholders */
  public PlaceholderDetector(List<String> extraMarkers) {
    Map<String, Pattern> merged = new LinkedHashMap<>(BUILT_IN_PLACEHOLDERS);
    if (extraMarkers != null) {
      for (String marker : extraMarkers) {
        if (marker != null && !marker.isBlank()) {
          String normalized = marker.trim().toLowerCase(Locale.ROOT);
          merged.putIfAbsent(normalized, wordPattern(normalized));
        }
      }
    }
    this.placeholders = Collections.unmodifiableMap(merged);
  }

  public PlaceholderDetection detect(String content) {
    if (content == null || content.isBlank()) {
      return PlaceholderDetection.NONE;
    }

    List<String> matched = new ArrayList<>();
    placeholders.forEach((marker, pattern) -> {
      if (pattern.matcher(content).find()) {
        matched.add(marker);
      }
    });
    boolean placeholder = !matched.isEmpty();

    boolean generic = false;
    for (Map.Entry<String, Pattern> entry : GENERIC_PHRASES.entrySet()) {
      if (entry.getValue().matcher(content).find()) {
        generic = true;
        matched.add(entry.getKey());
      }
    }
    return new PlaceholderDetection(placeholder, generic, matched);
  }

  public List<String> markers() {
    return List.copyOf(placeholders.keySet());
  }

  private static Pattern wordPattern(String words) {
    String body = Pattern.quote(words).replace(" ", "\\E\\s+\\Q");
    return Pattern.compile("(?<![\\p{L}\\p{N}])" + body + "(?![\\p{L}\\p{N}])",
        Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
  }
}
