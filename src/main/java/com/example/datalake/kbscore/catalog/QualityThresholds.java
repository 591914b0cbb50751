package com.example.datalake.kbscore.catalog;

/** Length thresholds per content type and the readiness cut-offs for the total score. */
public final class QualityThresholds {

  /** Total score at which a knowledge base is considered ready for production traffic. */
  public static final int MIN_PRODUCTION_READY = 70;

  /** Total score below which generated prompts are expected to be weak. */
  public static final int MIN_PROMPT_QUALITY = 50;

  static final Length IDENTITY = new Length(80, 200);
  static final Length GREETING = new Length(30, 100);
  static final Length FAREWELL = new Length(20, 50);
  static final Length POLICY = new Length(50, 150);
  static final Length ARTICLE = new Length(100, 300);
  static final Length INSTRUCTION = new Length(30, 100);

  private QualityThresholds() {}

  record Length(int min, int ideal) {}
}
