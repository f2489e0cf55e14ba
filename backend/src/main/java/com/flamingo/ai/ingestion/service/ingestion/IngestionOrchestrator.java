package com.flamingo.ai.ingestion.service.ingestion;

import com.flamingo.ai.ingestion.config.IngestionConfig;
import com.flamingo.ai.ingestion.domain.entity.IngestionTask;
import com.flamingo.ai.ingestion.domain.enums.SourceService;
import com.flamingo.ai.ingestion.domain.model.MetadataKeys;
import com.flamingo.ai.ingestion.domain.model.SourceQuery;
import com.flamingo.ai.ingestion.exception.VectorStoreException;
import com.flamingo.ai.ingestion.service.chunking.TokenTextSplitter;
import com.flamingo.ai.ingestion.service.extraction.ExtractorDispatcher;
import com.flamingo.ai.ingestion.service.extraction.model.ExtractedSegment;
import com.flamingo.ai.ingestion.service.extraction.model.ExtractionFailure;
import com.flamingo.ai.ingestion.service.extraction.model.ExtractionResult;
import com.flamingo.ai.ingestion.service.identity.ChunkIdentityResolver;
import com.flamingo.ai.ingestion.service.identity.DedupFilter;
import com.flamingo.ai.ingestion.service.ingestion.model.Chunk;
import com.flamingo.ai.ingestion.service.ingestion.model.SourceDocument;
import com.flamingo.ai.ingestion.service.ingestion.model.SourceItem;
import com.flamingo.ai.ingestion.service.relevance.RelevanceFilter;
import com.flamingo.ai.ingestion.service.task.TaskLifecycleManager;
import com.flamingo.ai.ingestion.service.vector.VectorUpsertClient;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Runs one ingestion task over the items a connector yields.
 *
 * <p>Items are processed sequentially in connector order: extract, chunk, filter by topic, assign
 * ids, then replace the source's stored chunks. A failing item is skipped and counted. A vector
 * store failure aborts the task, since it usually means the store itself is down.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IngestionOrchestrator {

  private final ExtractorDispatcher extractorDispatcher;
  private final TokenTextSplitter textSplitter;
  private final RelevanceFilter relevanceFilter;
  private final ChunkIdentityResolver identityResolver;
  private final VectorUpsertClient vectorUpsertClient;
  private final TaskLifecycleManager taskLifecycleManager;
  private final IngestionConfig ingestionConfig;
  private final MeterRegistry meterRegistry;

  /**
   * Ingests all items for a pending task and moves it to a terminal status.
   *
   * @param task the pending task
   * @param items items to ingest, consumed once
   * @return the task in its final state
   */
  @Timed(value = "ingestion.task.duration", description = "Time to run one ingestion task")
  public IngestionTask ingest(IngestionTask task, Iterable<SourceItem> items) {
    String taskId = task.getId();
    taskLifecycleManager.start(taskId, task.getSourceQuery());

    try {
      for (SourceItem item : items) {
        if (processItem(task, item)) {
          meterRegistry.counter("ingestion.items.processed").increment();
          taskLifecycleManager.recordProcessed(taskId);
        } else {
          meterRegistry.counter("ingestion.items.failed").increment();
          taskLifecycleManager.recordFailedItem(taskId);
        }
      }
    } catch (VectorStoreException e) {
      return taskLifecycleManager.fail(taskId, "Vector store write failed: " + e.getMessage());
    } catch (RuntimeException e) {
      log.error("Task {} aborted: {}", taskId, e.getMessage(), e);
      return taskLifecycleManager.fail(taskId, "Ingestion aborted: " + e.getMessage());
    }
    return taskLifecycleManager.complete(taskId);
  }

  /**
   * Ingests one item.
   *
   * @return false when the item was skipped
   * @throws VectorStoreException when writing the item's chunks failed
   */
  private boolean processItem(IngestionTask task, SourceItem item) {
    try {
      ExtractionResult extraction = extractorDispatcher.extract(item);
      for (ExtractionFailure failure : extraction.failures()) {
        log.warn(
            "Task {}: part {} of source {} skipped: {}",
            task.getId(),
            failure.sourceName(),
            item.sourceId(),
            failure.reason());
      }
      if (extraction.segments().isEmpty() && extraction.hasFailures()) {
        return false;
      }

      List<Chunk> chunks = chunk(task, item, extraction.segments());
      chunks = filterByTopic(task, chunks);
      if (chunks.isEmpty()) {
        log.info("Task {}: source {} produced no chunks to store", task.getId(), item.sourceId());
        return true;
      }

      SourceService service = task.getService();
      List<Chunk> identified =
          identityResolver.assignIds(service, task.getOwnerId(), item.sourceId(), chunks);
      DedupFilter filter =
          ingestionConfig.sourceSettings(service).isDedupDeleteEnabled()
              ? identityResolver.dedupFilter(service, task.getOwnerId(), item.sourceId())
              : DedupFilter.none();
      vectorUpsertClient.upload(task.getId(), identified, filter);
      log.info(
          "Task {}: stored {} chunks for source {}",
          task.getId(),
          identified.size(),
          item.sourceId());
      return true;
    } catch (VectorStoreException e) {
      throw e;
    } catch (RuntimeException e) {
      log.warn(
          "Task {}: skipping source {} after error: {}",
          task.getId(),
          item.sourceId(),
          e.getMessage());
      return false;
    }
  }

  private List<Chunk> chunk(IngestionTask task, SourceItem item, List<ExtractedSegment> segments) {
    List<Chunk> chunks = new ArrayList<>();
    for (ExtractedSegment segment : segments) {
      Map<String, Object> metadata = new LinkedHashMap<>(segment.metadata());
      metadata.put(MetadataKeys.SOURCE_SERVICE, task.getService().getKey());
      metadata.put(MetadataKeys.USER_ID, task.getOwnerId());
      metadata.put(MetadataKeys.SOURCE_ID, item.sourceId());
      metadata.put(MetadataKeys.TASK_ID, task.getId());
      chunks.addAll(textSplitter.split(new SourceDocument(segment.text(), metadata)));
    }
    return chunks;
  }

  private List<Chunk> filterByTopic(IngestionTask task, List<Chunk> chunks) {
    SourceQuery query = task.getSourceQuery();
    if (query == null
        || !query.hasTopics()
        || !ingestionConfig.sourceSettings(task.getService()).isRelevanceFilterEnabled()) {
      return chunks;
    }
    return relevanceFilter.filter(chunks, query.topics());
  }
}
