package com.flamingo.ai.ingestion.service.ingestion;

import com.flamingo.ai.ingestion.domain.entity.IngestionTask;
import com.flamingo.ai.ingestion.domain.enums.SourceService;
import com.flamingo.ai.ingestion.domain.enums.TaskKind;
import com.flamingo.ai.ingestion.domain.model.SourceQuery;
import com.flamingo.ai.ingestion.exception.UnsupportedMediaTypeException;
import com.flamingo.ai.ingestion.service.extraction.ContentExtractorRegistry;
import com.flamingo.ai.ingestion.service.ingestion.model.SourceItem;
import com.flamingo.ai.ingestion.service.ingestion.model.SourcePart;
import com.flamingo.ai.ingestion.service.task.TaskLifecycleManager;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

/**
 * Entry point for starting ingestion: creates the task, then hands it to a worker pool.
 *
 * <p>Submission returns as soon as the task is queued. Callers poll the task's status.
 */
@Service
@Slf4j
public class IngestionJobLauncher {

  private final TaskLifecycleManager taskLifecycleManager;
  private final IngestionTaskRunner taskRunner;
  private final ContentExtractorRegistry extractorRegistry;
  private final Map<SourceService, SourceConnector> connectors;

  public IngestionJobLauncher(
      TaskLifecycleManager taskLifecycleManager,
      IngestionTaskRunner taskRunner,
      ContentExtractorRegistry extractorRegistry,
      ObjectProvider<SourceConnector> connectorProvider) {
    this.taskLifecycleManager = taskLifecycleManager;
    this.taskRunner = taskRunner;
    this.extractorRegistry = extractorRegistry;
    this.connectors = new EnumMap<>(SourceService.class);
    connectorProvider
        .orderedStream()
        .forEach(
            connector -> {
              SourceConnector previous = connectors.putIfAbsent(connector.service(), connector);
              if (previous != null) {
                throw new IllegalStateException(
                    "Duplicate source connector for " + connector.service().getKey());
              }
            });
    log.info("Registered source connectors: {}", connectors.keySet());
  }

  /**
   * Queues ingestion of an uploaded file.
   *
   * @param ownerId uploading user
   * @param fileName original file name; identifies the file for later re-uploads
   * @param mediaType declared media type, may be null
   * @param content file bytes
   * @return the pending task
   * @throws UnsupportedMediaTypeException when no extractor handles the file; no task is created
   */
  public IngestionTask submitUpload(
      String ownerId, String fileName, String mediaType, byte[] content) {
    if (fileName == null || fileName.isBlank()) {
      throw new IllegalArgumentException("Uploaded file must have a name");
    }
    if (!extractorRegistry.supports(mediaType, fileName)) {
      throw new UnsupportedMediaTypeException(mediaType, fileName);
    }
    SourceItem item =
        new SourceItem(fileName, Map.of(), List.of(SourcePart.of(fileName, mediaType, content)));
    IngestionTask task =
        taskLifecycleManager.submit(
            ownerId, SourceService.FILE, TaskKind.MANUAL, SourceQuery.empty());
    dispatch(task, TaskKind.MANUAL, () -> List.of(item));
    return task;
  }

  /**
   * Queues a user-triggered pull from a source service.
   *
   * @throws IllegalArgumentException when no connector serves the service
   * @throws IllegalStateException when the owner's credentials for the service are unusable
   */
  public IngestionTask submitManual(String ownerId, SourceService service, SourceQuery query) {
    SourceConnector connector = requireConnector(service);
    if (!connector.canFetch(ownerId)) {
      throw new IllegalStateException(
          "Credentials for " + service.getKey() + " are not usable for owner " + ownerId);
    }
    return submit(connector, ownerId, query, TaskKind.MANUAL);
  }

  /** Queues a scheduled pull on the bounded scheduled pool. */
  public IngestionTask submitScheduled(String ownerId, SourceService service, SourceQuery query) {
    return submit(requireConnector(service), ownerId, query, TaskKind.SCHEDULED);
  }

  /** Returns whether a connector exists for the service and can fetch for the owner. */
  public boolean canFetch(SourceService service, String ownerId) {
    return connector(service).map(c -> c.canFetch(ownerId)).orElse(false);
  }

  private IngestionTask submit(
      SourceConnector connector, String ownerId, SourceQuery query, TaskKind kind) {
    SourceQuery effective = query != null ? query : SourceQuery.empty();
    IngestionTask task =
        taskLifecycleManager.submit(ownerId, connector.service(), kind, effective);
    dispatch(task, kind, () -> connector.fetch(ownerId, effective));
    return task;
  }

  private void dispatch(
      IngestionTask task, TaskKind kind, Supplier<? extends Iterable<SourceItem>> items) {
    try {
      if (kind == TaskKind.SCHEDULED) {
        taskRunner.runScheduled(task, items);
      } else {
        taskRunner.runManual(task, items);
      }
    } catch (TaskRejectedException e) {
      log.warn("Worker pool rejected task {}: {}", task.getId(), e.getMessage());
      taskLifecycleManager.fail(task.getId(), "Worker pool is full: " + e.getMessage());
    }
  }

  private SourceConnector requireConnector(SourceService service) {
    return connector(service)
        .orElseThrow(
            () ->
                new IllegalArgumentException(
                    "No source connector registered for " + service.getKey()));
  }

  private Optional<SourceConnector> connector(SourceService service) {
    return Optional.ofNullable(connectors.get(service));
  }
}
