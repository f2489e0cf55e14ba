package com.flamingo.ai.ingestion.service.task;

import com.flamingo.ai.ingestion.domain.entity.IngestionTask;
import com.flamingo.ai.ingestion.domain.enums.SourceService;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Persistent store of ingestion tasks.
 *
 * <p>Every mutation targets a single task id. The store, not its callers, rejects updates that
 * would move a task backwards or touch a finished task.
 */
public interface TaskStore {

  /**
   * Persists a new task and evicts the owner's oldest finished tasks for the same service beyond
   * the configured history size.
   */
  IngestionTask insert(IngestionTask task);

  /**
   * Applies a mutation to one task and persists it.
   *
   * @param taskId the task to update
   * @param mutation changes to apply to the loaded task
   * @return the updated task
   * @throws com.flamingo.ai.ingestion.exception.TaskNotFoundException when no task has the id
   * @throws com.flamingo.ai.ingestion.exception.IllegalTaskTransitionException when the task is
   *     finished or the mutation moves its status backwards
   */
  IngestionTask update(String taskId, Consumer<IngestionTask> mutation);

  Optional<IngestionTask> find(String taskId);

  /** Returns in-progress tasks not updated for at least {@code staleAfter}. */
  List<IngestionTask> findStale(Duration staleAfter);

  /** Returns an owner's retained tasks for one service, newest first. */
  List<IngestionTask> history(String ownerId, SourceService service);
}
