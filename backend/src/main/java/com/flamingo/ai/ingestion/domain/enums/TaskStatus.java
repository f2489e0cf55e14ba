package com.flamingo.ai.ingestion.domain.enums;

/** Lifecycle status of an ingestion task. Transitions only move forward. */
public enum TaskStatus {
  /** Task has been submitted but no worker has picked it up yet. */
  PENDING,

  /** A worker is extracting, chunking and writing the task's items. */
  IN_PROGRESS,

  /** All items were processed; per-item failures may still have been skipped. */
  COMPLETED,

  /** Task aborted on an unrecoverable error. */
  FAILED;

  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED;
  }

  /**
   * Returns whether a task in this status may move to {@code next}.
   *
   * <p>Pending tasks may fail before a worker starts them (rejected by a full pool, or the source
   * could not be read). Staying in the same non-terminal status is allowed so counters can be
   * updated while running.
   */
  public boolean canTransitionTo(TaskStatus next) {
    if (next == null || isTerminal()) {
      return false;
    }
    return switch (this) {
      case PENDING -> next == PENDING || next == IN_PROGRESS || next == FAILED;
      case IN_PROGRESS -> next == IN_PROGRESS || next.isTerminal();
      default -> false;
    };
  }
}
