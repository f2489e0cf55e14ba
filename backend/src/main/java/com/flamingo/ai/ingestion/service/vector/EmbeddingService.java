package com.flamingo.ai.ingestion.service.vector;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Service for generating chunk embeddings using OpenAI's embedding model. */
@Service
@RequiredArgsConstructor
@Slf4j
public class EmbeddingService {

  private final EmbeddingModel embeddingModel;
  private final MeterRegistry meterRegistry;

  /**
   * Embeds texts in one batch.
   *
   * @param texts texts to embed
   * @return one vector per text, in input order; empty when the embedding service is unavailable
   */
  @CircuitBreaker(name = "openai", fallbackMethod = "embedTextsFallback")
  @Retry(name = "openai")
  public List<List<Float>> embedTexts(List<String> texts) {
    if (texts.isEmpty()) {
      return List.of();
    }
    Timer.Sample sample = Timer.start(meterRegistry);
    try {
      List<TextSegment> segments = texts.stream().map(TextSegment::from).toList();
      Response<List<Embedding>> response = embeddingModel.embedAll(segments);
      List<List<Float>> results = new ArrayList<>(texts.size());
      for (Embedding embedding : response.content()) {
        float[] vector = embedding.vector();
        List<Float> values = new ArrayList<>(vector.length);
        for (float f : vector) {
          values.add(f);
        }
        results.add(values);
      }
      meterRegistry.counter("embedding.requests.success").increment();
      log.debug("Embedded {} texts", texts.size());
      return results;
    } finally {
      sample.stop(meterRegistry.timer("embedding.batch.duration"));
    }
  }

  @SuppressWarnings("unused")
  private List<List<Float>> embedTextsFallback(List<String> texts, Throwable t) {
    log.error("Batch embedding of {} texts failed: {}", texts.size(), t.getMessage());
    meterRegistry.counter("embedding.requests.failure").increment();
    return List.of();
  }
}
