package com.flamingo.ai.ingestion.service.vector;

import com.flamingo.ai.ingestion.config.IngestionConfig;
import com.flamingo.ai.ingestion.exception.VectorStoreException;
import com.flamingo.ai.ingestion.exception.VectorStoreTransientException;
import com.flamingo.ai.ingestion.service.identity.DedupFilter;
import com.flamingo.ai.ingestion.service.ingestion.model.Chunk;
import com.flamingo.ai.ingestion.service.retry.RetryExecutor;
import com.flamingo.ai.ingestion.service.retry.RetryPolicy;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Replaces the stored chunks of one source: delete the previous generation, embed, write.
 *
 * <p>Transient store failures are retried with a fixed wait. Before every retry of the write, URLs
 * in the chunk text are replaced with a placeholder, since links are the usual cause of payloads
 * the store keeps rejecting. Delete and write are not atomic; when the write finally fails the
 * source may have no chunks until it is ingested again.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class VectorUpsertClient {

  private static final Pattern URL_PATTERN = Pattern.compile("https?://\\S+");

  private final VectorStore vectorStore;
  private final EmbeddingService embeddingService;
  private final RetryExecutor retryExecutor;
  private final IngestionConfig ingestionConfig;
  private final MeterRegistry meterRegistry;

  /**
   * Deletes what the filter matches, then embeds and writes the chunks.
   *
   * @param taskId task the write belongs to, for logging
   * @param chunks chunks with ids assigned
   * @param filter previous-generation filter; {@link DedupFilter#none()} skips the delete
   * @throws VectorStoreException when the store rejects the request or retries are exhausted
   */
  @Timed(value = "vector.upload", description = "Time to replace the chunks of one source")
  public void upload(String taskId, List<Chunk> chunks, DedupFilter filter) {
    if (chunks.isEmpty()) {
      return;
    }
    List<String> ids = chunks.stream().map(Chunk::id).toList();
    IngestionConfig.VectorStore settings = ingestionConfig.getVectorStore();
    RetryPolicy policy = retryPolicy();

    try {
      if (!filter.isEmpty()) {
        long deleted = delete(filter);
        log.info(
            "Task {}: deleted {} stale chunks matching {}", taskId, deleted, filter.criteria());
      }

      AtomicReference<List<Chunk>> payload = new AtomicReference<>(chunks);
      retryExecutor.execute(
          "vector-store-write",
          policy,
          () -> {
            write(payload.get());
            return null;
          },
          (attempt, failure) -> {
            meterRegistry.counter("vector_store.retry").increment();
            payload.set(redactUrls(payload.get(), settings.getUrlPlaceholder()));
          });
      meterRegistry.counter("vector_store.chunks.written").increment(chunks.size());
      log.info("Task {}: wrote {} chunks", taskId, chunks.size());
    } catch (RuntimeException e) {
      meterRegistry.counter("vector_store.write.failure").increment();
      log.error(
          "Task {}: vector store write failed after up to {} attempts. Failed IDs: {}. Cause: {}",
          taskId,
          settings.getMaxAttempts(),
          ids,
          e.getMessage(),
          e);
      if (e instanceof VectorStoreException vectorStoreException) {
        throw vectorStoreException;
      }
      throw new VectorStoreException("Vector store write failed: " + e.getMessage(), e);
    }
  }

  /**
   * Deletes every stored chunk the filter matches, retrying transient failures.
   *
   * @param filter non-empty filter
   * @return number of deleted chunks
   */
  public long delete(DedupFilter filter) {
    if (filter.isEmpty()) {
      throw new IllegalArgumentException("Refusing to delete with an empty filter");
    }
    return retryExecutor.execute(
        "vector-store-delete", retryPolicy(), () -> vectorStore.delete(filter.criteria()));
  }

  private RetryPolicy retryPolicy() {
    IngestionConfig.VectorStore settings = ingestionConfig.getVectorStore();
    return new RetryPolicy(
        settings.getMaxAttempts(),
        settings.getRetryBackoff(),
        VectorStoreTransientException.class::isInstance);
  }

  private void write(List<Chunk> chunks) {
    List<String> contents = chunks.stream().map(Chunk::content).toList();
    List<List<Float>> embeddings = embeddingService.embedTexts(contents);
    if (embeddings.size() != chunks.size()) {
      throw new VectorStoreTransientException(
          String.format(
              "Embedding generation failed: expected %d embeddings, got %d",
              chunks.size(), embeddings.size()));
    }

    List<VectorRecord> records = new ArrayList<>(chunks.size());
    for (int i = 0; i < chunks.size(); i++) {
      Chunk chunk = chunks.get(i);
      records.add(
          new VectorRecord(chunk.id(), chunk.content(), chunk.metadata(), embeddings.get(i)));
    }
    vectorStore.upsert(records);
  }

  private static List<Chunk> redactUrls(List<Chunk> chunks, String placeholder) {
    String replacement = Matcher.quoteReplacement(placeholder);
    return chunks.stream()
        .map(chunk -> chunk.withContent(redact(chunk.content(), replacement)))
        .toList();
  }

  private static String redact(String text, String replacement) {
    return URL_PATTERN.matcher(text).replaceAll(replacement);
  }
}
