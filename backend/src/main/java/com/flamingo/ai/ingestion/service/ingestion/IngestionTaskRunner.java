package com.flamingo.ai.ingestion.service.ingestion;

import com.flamingo.ai.ingestion.config.AsyncConfig;
import com.flamingo.ai.ingestion.domain.entity.IngestionTask;
import com.flamingo.ai.ingestion.service.ingestion.model.SourceItem;
import com.flamingo.ai.ingestion.service.task.TaskLifecycleManager;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/** Runs ingestion tasks on the worker pools. */
@Component
@RequiredArgsConstructor
@Slf4j
public class IngestionTaskRunner {

  private final IngestionOrchestrator orchestrator;
  private final TaskLifecycleManager taskLifecycleManager;

  @Async(AsyncConfig.MANUAL_EXECUTOR)
  public CompletableFuture<IngestionTask> runManual(
      IngestionTask task, Supplier<? extends Iterable<SourceItem>> items) {
    return CompletableFuture.completedFuture(run(task, items));
  }

  @Async(AsyncConfig.SCHEDULED_EXECUTOR)
  public CompletableFuture<IngestionTask> runScheduled(
      IngestionTask task, Supplier<? extends Iterable<SourceItem>> items) {
    return CompletableFuture.completedFuture(run(task, items));
  }

  IngestionTask run(IngestionTask task, Supplier<? extends Iterable<SourceItem>> items) {
    Iterable<SourceItem> sourceItems;
    try {
      sourceItems = items.get();
    } catch (RuntimeException e) {
      log.error("Task {}: fetching source items failed: {}", task.getId(), e.getMessage(), e);
      return taskLifecycleManager.fail(task.getId(), "Source fetch failed: " + e.getMessage());
    }
    try {
      return orchestrator.ingest(task, sourceItems);
    } catch (RuntimeException e) {
      log.error("Task {} could not run: {}", task.getId(), e.getMessage(), e);
      return failIfOpen(task, e);
    }
  }

  /**
   * Marks a task failed after an error escaped the orchestrator, for example when it could not be
   * started. A task already in a terminal state is left alone and the error is rethrown.
   */
  private IngestionTask failIfOpen(IngestionTask task, RuntimeException cause) {
    boolean open =
        taskLifecycleManager.getStatus(task.getId()).map(s -> !s.isTerminal()).orElse(false);
    if (!open) {
      throw cause;
    }
    try {
      return taskLifecycleManager.fail(task.getId(), "Task could not run: " + cause.getMessage());
    } catch (RuntimeException e) {
      log.error("Task {} could not be marked failed: {}", task.getId(), e.getMessage(), e);
      cause.addSuppressed(e);
      throw cause;
    }
  }
}
