package com.flamingo.ai.ingestion.exception;

/** Exception thrown when an ingestion task is not found. */
public class TaskNotFoundException extends RuntimeException {

  private final String taskId;

  public TaskNotFoundException(String taskId) {
    super("Ingestion task not found: " + taskId);
    this.taskId = taskId;
  }

  public String getTaskId() {
    return taskId;
  }
}
