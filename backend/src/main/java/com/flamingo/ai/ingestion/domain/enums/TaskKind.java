package com.flamingo.ai.ingestion.domain.enums;

/** How an ingestion task was triggered. */
public enum TaskKind {
  MANUAL,
  SCHEDULED
}
