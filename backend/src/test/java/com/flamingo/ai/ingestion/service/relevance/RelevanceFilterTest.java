package com.flamingo.ai.ingestion.service.relevance;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.flamingo.ai.ingestion.config.IngestionConfig;
import com.flamingo.ai.ingestion.exception.LlmServiceException;
import com.flamingo.ai.ingestion.service.ingestion.model.Chunk;
import com.flamingo.ai.ingestion.service.retry.RetryExecutor;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("RelevanceFilter Tests")
class RelevanceFilterTest {

  private static final List<String> TOPICS = List.of("invoices", "contracts");

  @Mock private RelevanceClassifier classifier;

  private SimpleMeterRegistry meterRegistry;
  private RelevanceFilter filter;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    IngestionConfig config = new IngestionConfig();
    config.getRelevance().setRateLimitBackoff(Duration.ZERO);
    filter = new RelevanceFilter(classifier, new RetryExecutor(), config, meterRegistry);
  }

  @Test
  @DisplayName("Should return the input unchanged when no topics are given")
  void shouldBeNoOpWithoutTopics() {
    List<Chunk> chunks = List.of(chunk("a"), chunk("b"));

    assertThat(filter.filter(chunks, List.of())).isSameAs(chunks);
    verifyNoInteractions(classifier);
  }

  @Test
  @DisplayName("Should keep only chunks classified as relevant, in order")
  void shouldDropIrrelevantChunks() {
    when(classifier.classify("invoice 42 is overdue", TOPICS)).thenReturn(true);
    when(classifier.classify("lunch menu", TOPICS)).thenReturn(false);
    when(classifier.classify("contract renewal", TOPICS)).thenReturn(true);

    List<Chunk> kept =
        filter.filter(
            List.of(chunk("invoice 42 is overdue"), chunk("lunch menu"), chunk("contract renewal")),
            TOPICS);

    assertThat(kept)
        .extracting(Chunk::content)
        .containsExactly("invoice 42 is overdue", "contract renewal");
  }

  @Test
  @DisplayName("Should keep a chunk when the classifier fails with a non rate limit error")
  void shouldFailOpenImmediatelyOnOtherErrors() {
    when(classifier.classify(eq("malformed"), anyList()))
        .thenThrow(new LlmServiceException("Topic detector returned no verdict"));

    List<Chunk> kept = filter.filter(List.of(chunk("malformed")), TOPICS);

    assertThat(kept).hasSize(1);
    verify(classifier, times(1)).classify(eq("malformed"), anyList());
    assertThat(meterRegistry.counter("relevance.fail_open").count()).isEqualTo(1.0);
    assertThat(meterRegistry.counter("relevance.backoff").count()).isZero();
  }

  @Test
  @DisplayName("Should back off twice and then use the verdict of the third attempt")
  void shouldRetryRateLimitedCalls() {
    LlmServiceException rateLimited = new LlmServiceException("rate limited", true, null);
    when(classifier.classify(eq("busy"), anyList()))
        .thenThrow(rateLimited)
        .thenThrow(rateLimited)
        .thenReturn(false);

    List<Chunk> kept = filter.filter(List.of(chunk("busy")), TOPICS);

    assertThat(kept).isEmpty();
    verify(classifier, times(3)).classify(eq("busy"), anyList());
    assertThat(meterRegistry.counter("relevance.backoff").count()).isEqualTo(2.0);
    assertThat(meterRegistry.counter("relevance.fail_open").count()).isZero();
  }

  @Test
  @DisplayName("Should keep the chunk after rate limit retries are exhausted")
  void shouldFailOpenAfterRateLimitExhaustion() {
    when(classifier.classify(eq("busy"), anyList()))
        .thenThrow(new LlmServiceException("rate limited", true, null));

    List<Chunk> kept = filter.filter(List.of(chunk("busy")), TOPICS);

    assertThat(kept).hasSize(1);
    verify(classifier, times(3)).classify(eq("busy"), anyList());
    assertThat(meterRegistry.counter("relevance.backoff").count()).isEqualTo(2.0);
    assertThat(meterRegistry.counter("relevance.fail_open").count()).isEqualTo(1.0);
  }

  private static Chunk chunk(String content) {
    return new Chunk(null, content, Map.of(), 0, 1);
  }
}
