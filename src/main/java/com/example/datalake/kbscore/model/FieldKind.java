package com.example.datalake.kbscore.model;

/** How a field reads its data source. */
public enum FieldKind {
  /** A single free-text record selected by type. */
  CONTENT,
  /** The number of active records in the collection. */
  COUNT,
  /** At least one active record that carries operating hours. */
  SCHEDULE
}
