package com.flamingo.ai.ingestion.service.relevance;

import com.flamingo.ai.ingestion.config.IngestionConfig;
import com.flamingo.ai.ingestion.exception.LlmServiceException;
import com.flamingo.ai.ingestion.service.ingestion.model.Chunk;
import com.flamingo.ai.ingestion.service.retry.RetryExecutor;
import com.flamingo.ai.ingestion.service.retry.RetryPolicy;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Drops chunks unrelated to the requested topics.
 *
 * <p>The filter fails open: a chunk is kept whenever the classifier cannot give a verdict. Rate
 * limit errors are waited out and retried a bounded number of times first.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RelevanceFilter {

  private final RelevanceClassifier relevanceClassifier;
  private final RetryExecutor retryExecutor;
  private final IngestionConfig ingestionConfig;
  private final MeterRegistry meterRegistry;

  /**
   * Keeps the chunks the classifier judges related to at least one topic.
   *
   * @param chunks chunks to filter
   * @param topics topics of interest; an empty list keeps every chunk
   * @return kept chunks in input order
   */
  @Timed(value = "relevance.filter", description = "Time to filter chunks by topic")
  public List<Chunk> filter(List<Chunk> chunks, List<String> topics) {
    if (topics == null || topics.isEmpty() || chunks.isEmpty()) {
      return chunks;
    }
    IngestionConfig.Relevance settings = ingestionConfig.getRelevance();
    RetryPolicy policy =
        new RetryPolicy(
            settings.getMaxAttempts(),
            settings.getRateLimitBackoff(),
            e -> e instanceof LlmServiceException llm && llm.isRateLimited());

    List<Chunk> kept = new ArrayList<>(chunks.size());
    for (Chunk chunk : chunks) {
      if (isRelevant(chunk, topics, policy)) {
        kept.add(chunk);
      }
    }
    int dropped = chunks.size() - kept.size();
    meterRegistry.counter("relevance.kept").increment(kept.size());
    meterRegistry.counter("relevance.dropped").increment(dropped);
    log.info(
        "Relevance filter kept {}/{} chunks for topics {}", kept.size(), chunks.size(), topics);
    return kept;
  }

  private boolean isRelevant(Chunk chunk, List<String> topics, RetryPolicy policy) {
    try {
      return retryExecutor.execute(
          "relevance-classifier",
          policy,
          () -> relevanceClassifier.classify(chunk.content(), topics),
          (attempt, failure) -> meterRegistry.counter("relevance.backoff").increment());
    } catch (RuntimeException e) {
      meterRegistry.counter("relevance.fail_open").increment();
      log.warn(
          "Topic classification failed for chunk {}, keeping it: {}",
          chunk.chunkIndex(),
          e.getMessage());
      return true;
    }
  }
}
