package com.flamingo.ai.ingestion.service.task;

import com.flamingo.ai.ingestion.domain.entity.IngestionTask;
import com.flamingo.ai.ingestion.domain.enums.SourceService;
import com.flamingo.ai.ingestion.domain.enums.TaskKind;
import com.flamingo.ai.ingestion.domain.enums.TaskStatus;
import com.flamingo.ai.ingestion.domain.model.SourceQuery;
import com.flamingo.ai.ingestion.exception.TaskNotFoundException;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Drives ingestion tasks through {@code PENDING -> IN_PROGRESS -> COMPLETED | FAILED}.
 *
 * <p>Every transition and counter change is written to the {@link TaskStore} immediately. The
 * store is the only copy of task state; nothing is cached here.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TaskLifecycleManager {

  private final TaskStore taskStore;
  private final MeterRegistry meterRegistry;
  private final Clock clock;

  /**
   * Creates a pending task.
   *
   * @param ownerId user the task ingests for
   * @param service source service
   * @param kind manual or scheduled
   * @param query what to collect
   * @return the persisted task
   */
  public IngestionTask submit(
      String ownerId, SourceService service, TaskKind kind, SourceQuery query) {
    LocalDateTime now = LocalDateTime.now(clock);
    IngestionTask task =
        IngestionTask.builder()
            .id(UUID.randomUUID().toString())
            .ownerId(ownerId)
            .service(service)
            .kind(kind)
            .status(TaskStatus.PENDING)
            .sourceQuery(query)
            .createdAt(now)
            .updatedAt(now)
            .build();
    IngestionTask saved = taskStore.insert(task);
    meterRegistry.counter("ingestion.task.submitted", "kind", kind.name()).increment();
    log.info(
        "Submitted {} task {} for owner {} on {}", kind, saved.getId(), ownerId, service.getKey());
    return saved;
  }

  /** Marks a task as running, echoing the query it was started with. */
  public IngestionTask start(String taskId, SourceQuery query) {
    IngestionTask task = taskStore.update(taskId, t -> t.start(query));
    log.info("Task {} started", taskId);
    return task;
  }

  public void recordProcessed(String taskId) {
    taskStore.update(taskId, t -> t.setProcessedCount(t.getProcessedCount() + 1));
  }

  public void recordFailedItem(String taskId) {
    taskStore.update(taskId, t -> t.setFailedItemCount(t.getFailedItemCount() + 1));
  }

  public IngestionTask complete(String taskId) {
    IngestionTask task = taskStore.update(taskId, IngestionTask::markCompleted);
    meterRegistry.counter("ingestion.task.completed").increment();
    log.info(
        "Task {} completed: {} items processed, {} skipped",
        taskId,
        task.getProcessedCount(),
        task.getFailedItemCount());
    return task;
  }

  /**
   * Marks a task as failed.
   *
   * @param taskId the task
   * @param error message of the first unrecoverable error
   */
  public IngestionTask fail(String taskId, String error) {
    IngestionTask task = taskStore.update(taskId, t -> t.markFailed(error));
    meterRegistry.counter("ingestion.task.failed").increment();
    log.error("Task {} failed after {} items: {}", taskId, task.getProcessedCount(), error);
    return task;
  }

  /** Returns the task's status, or empty when no such task exists. */
  public Optional<TaskStatus> getStatus(String taskId) {
    return taskStore.find(taskId).map(IngestionTask::getStatus);
  }

  public IngestionTask getTask(String taskId) {
    return taskStore.find(taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
  }

  public List<IngestionTask> history(String ownerId, SourceService service) {
    return taskStore.history(ownerId, service);
  }
}
