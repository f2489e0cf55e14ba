package com.flamingo.ai.ingestion.exception;

import com.flamingo.ai.ingestion.domain.enums.TaskStatus;

/** Exception thrown when a task update would move its status backwards or reopen it. */
public class IllegalTaskTransitionException extends RuntimeException {

  private final String taskId;
  private final TaskStatus from;
  private final TaskStatus to;

  public IllegalTaskTransitionException(String taskId, TaskStatus from, TaskStatus to) {
    super(String.format("Task %s cannot move from %s to %s", taskId, from, to));
    this.taskId = taskId;
    this.from = from;
    this.to = to;
  }

  public String getTaskId() {
    return taskId;
  }

  public TaskStatus getFrom() {
    return from;
  }

  public TaskStatus getTo() {
    return to;
  }
}
