package com.flamingo.ai.ingestion.service.task;

import com.flamingo.ai.ingestion.config.IngestionConfig;
import com.flamingo.ai.ingestion.domain.entity.IngestionTask;
import com.flamingo.ai.ingestion.domain.enums.SourceService;
import com.flamingo.ai.ingestion.domain.enums.TaskStatus;
import com.flamingo.ai.ingestion.domain.repository.IngestionTaskRepository;
import com.flamingo.ai.ingestion.exception.IllegalTaskTransitionException;
import com.flamingo.ai.ingestion.exception.TaskNotFoundException;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * {@link TaskStore} on Spring Data JPA.
 *
 * <p>SQLite allows a single writer, so updates retry on lock contention. Each attempt runs in its
 * own transaction and reloads the task, so a mutation is never applied twice to the same state.
 */
@Component
@Slf4j
public class JpaTaskStore implements TaskStore {

  private static final int MAX_RETRIES = 3;
  private static final long RETRY_DELAY_MS = 100;

  private final IngestionTaskRepository taskRepository;
  private final IngestionConfig ingestionConfig;
  private final TransactionTemplate requiresNew;
  private final Clock clock;

  public JpaTaskStore(
      IngestionTaskRepository taskRepository,
      IngestionConfig ingestionConfig,
      PlatformTransactionManager transactionManager,
      Clock clock) {
    this.taskRepository = taskRepository;
    this.ingestionConfig = ingestionConfig;
    this.requiresNew = new TransactionTemplate(transactionManager);
    this.requiresNew.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    this.clock = clock;
  }

  @Override
  @Transactional
  public IngestionTask insert(IngestionTask task) {
    IngestionTask saved = taskRepository.saveAndFlush(task);
    evictHistory(saved.getOwnerId(), saved.getService());
    return saved;
  }

  private void evictHistory(String ownerId, SourceService service) {
    int historySize = ingestionConfig.getTasks().getHistorySize();
    List<IngestionTask> tasks =
        taskRepository.findByOwnerIdAndServiceOrderByCreatedAtDesc(ownerId, service);
    if (tasks.size() <= historySize) {
      return;
    }
    // Running tasks are never evicted, even when they push the history over its size.
    List<IngestionTask> evicted =
        tasks.subList(historySize, tasks.size()).stream()
            .filter(t -> t.getStatus().isTerminal())
            .toList();
    if (!evicted.isEmpty()) {
      taskRepository.deleteAll(evicted);
      log.debug(
          "Evicted {} old tasks for owner {} and service {}",
          evicted.size(),
          ownerId,
          service.getKey());
    }
  }

  @Override
  public IngestionTask update(String taskId, Consumer<IngestionTask> mutation) {
    for (int attempt = 1; ; attempt++) {
      try {
        return requiresNew.execute(status -> applyUpdate(taskId, mutation));
      } catch (CannotAcquireLockException e) {
        if (attempt == MAX_RETRIES) {
          log.error("Failed to update task {} after {} retries", taskId, MAX_RETRIES);
          throw e;
        }
        log.warn("SQLite lock contention on task {}, retry {}/{}", taskId, attempt, MAX_RETRIES);
        try {
          Thread.sleep(RETRY_DELAY_MS * attempt);
        } catch (InterruptedException ie) {
          Thread.currentThread().interrupt();
          throw new IllegalStateException("Interrupted during retry", ie);
        }
      }
    }
  }

  private IngestionTask applyUpdate(String taskId, Consumer<IngestionTask> mutation) {
    IngestionTask task =
        taskRepository.findById(taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
    TaskStatus from = task.getStatus();
    if (from.isTerminal()) {
      throw new IllegalTaskTransitionException(taskId, from, from);
    }
    mutation.accept(task);
    TaskStatus to = task.getStatus();
    if (!from.canTransitionTo(to)) {
      throw new IllegalTaskTransitionException(taskId, from, to);
    }
    task.setUpdatedAt(LocalDateTime.now(clock));
    return taskRepository.saveAndFlush(task);
  }

  @Override
  @Transactional(readOnly = true)
  public Optional<IngestionTask> find(String taskId) {
    return taskRepository.findById(taskId);
  }

  @Override
  @Transactional(readOnly = true)
  public List<IngestionTask> findStale(Duration staleAfter) {
    LocalDateTime cutoff = LocalDateTime.now(clock).minus(staleAfter);
    return taskRepository.findByStatusAndUpdatedAtBefore(TaskStatus.IN_PROGRESS, cutoff);
  }

  @Override
  @Transactional(readOnly = true)
  public List<IngestionTask> history(String ownerId, SourceService service) {
    return taskRepository.findByOwnerIdAndServiceOrderByCreatedAtDesc(ownerId, service);
  }
}
