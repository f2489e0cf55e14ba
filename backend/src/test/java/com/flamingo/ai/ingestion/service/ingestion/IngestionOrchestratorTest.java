package com.flamingo.ai.ingestion.service.ingestion;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.ingestion.config.IngestionConfig;
import com.flamingo.ai.ingestion.domain.entity.IngestionTask;
import com.flamingo.ai.ingestion.domain.enums.SourceService;
import com.flamingo.ai.ingestion.domain.enums.TaskKind;
import com.flamingo.ai.ingestion.domain.model.SourceQuery;
import com.flamingo.ai.ingestion.exception.ExtractionException;
import com.flamingo.ai.ingestion.exception.VectorStoreException;
import com.flamingo.ai.ingestion.service.chunking.TokenCounter;
import com.flamingo.ai.ingestion.service.chunking.TokenTextSplitter;
import com.flamingo.ai.ingestion.service.extraction.ContentExtractorRegistry;
import com.flamingo.ai.ingestion.service.extraction.ExtractorDispatcher;
import com.flamingo.ai.ingestion.service.extraction.TikaContentExtractor;
import com.flamingo.ai.ingestion.service.extraction.model.ExtractedSegment;
import com.flamingo.ai.ingestion.service.extraction.model.ExtractionFailure;
import com.flamingo.ai.ingestion.service.extraction.model.ExtractionResult;
import com.flamingo.ai.ingestion.service.identity.ChunkIdentityResolver;
import com.flamingo.ai.ingestion.service.ingestion.model.SourceItem;
import com.flamingo.ai.ingestion.service.ingestion.model.SourcePart;
import com.flamingo.ai.ingestion.service.relevance.RelevanceFilter;
import com.flamingo.ai.ingestion.service.retry.RetryExecutor;
import com.flamingo.ai.ingestion.service.task.TaskLifecycleManager;
import com.flamingo.ai.ingestion.service.vector.EmbeddingService;
import com.flamingo.ai.ingestion.service.vector.VectorRecord;
import com.flamingo.ai.ingestion.service.vector.VectorStore;
import com.flamingo.ai.ingestion.service.vector.VectorUpsertClient;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("IngestionOrchestrator Tests")
class IngestionOrchestratorTest {

  private static final String LONG_TEXT =
      "The quarterly budget review covers hiring plans for the platform team. "
          + "Finance asked every group to submit revised forecasts before the end of March. "
          + "Travel spending is frozen until the new approval workflow goes live next month. "
          + "Please reply to this thread with any questions about the process.";

  @Mock private ExtractorDispatcher extractorDispatcher;
  @Mock private RelevanceFilter relevanceFilter;
  @Mock private EmbeddingService embeddingService;
  @Mock private TaskLifecycleManager taskLifecycleManager;

  private InMemoryVectorStore vectorStore;
  private IngestionConfig config;
  private SimpleMeterRegistry meterRegistry;
  private IngestionOrchestrator orchestrator;

  @BeforeEach
  void setUp() {
    vectorStore = new InMemoryVectorStore();
    config = new IngestionConfig();
    config.getVectorStore().setRetryBackoff(Duration.ZERO);
    meterRegistry = new SimpleMeterRegistry();

    lenient()
        .when(embeddingService.embedTexts(anyList()))
        .thenAnswer(
            invocation -> {
              List<String> texts = invocation.getArgument(0);
              return texts.stream().map(t -> List.of(1f, 0f, 0f)).toList();
            });

    VectorUpsertClient upsertClient =
        new VectorUpsertClient(
            vectorStore, embeddingService, new RetryExecutor(), config, meterRegistry);
    orchestrator =
        new IngestionOrchestrator(
            extractorDispatcher,
            new TokenTextSplitter(new TokenCounter(), 20, 0),
            relevanceFilter,
            new ChunkIdentityResolver(),
            upsertClient,
            taskLifecycleManager,
            config,
            meterRegistry);
  }

  @Test
  @DisplayName("Should store the same chunk ids when a source is ingested twice")
  void shouldBeIdempotentOnReingest() {
    // Given
    SourceItem item = item("thread-1");
    when(extractorDispatcher.extract(item)).thenReturn(extracted(LONG_TEXT));

    // When
    orchestrator.ingest(task("t1"), List.of(item));
    Map<String, VectorRecord> firstGeneration = Map.copyOf(vectorStore.records);
    orchestrator.ingest(task("t2"), List.of(item));

    // Then
    assertThat(firstGeneration).hasSizeGreaterThan(1);
    assertThat(vectorStore.records.keySet()).isEqualTo(firstGeneration.keySet());
    verify(taskLifecycleManager).complete("t1");
    verify(taskLifecycleManager).complete("t2");
    verify(taskLifecycleManager, times(1)).recordProcessed("t1");
  }

  @Test
  @DisplayName("Should keep both attachments when two parts of a thread share a file name")
  void shouldKeepSameNamedAttachments() {
    // Given
    ExtractorDispatcher realDispatcher =
        new ExtractorDispatcher(
            new ContentExtractorRegistry(List.of(new TikaContentExtractor())), meterRegistry);
    IngestionOrchestrator threadOrchestrator =
        new IngestionOrchestrator(
            realDispatcher,
            new TokenTextSplitter(new TokenCounter(), 20, 0),
            relevanceFilter,
            new ChunkIdentityResolver(),
            new VectorUpsertClient(
                vectorStore, embeddingService, new RetryExecutor(), config, meterRegistry),
            taskLifecycleManager,
            config,
            meterRegistry);
    SourceItem thread =
        new SourceItem(
            "thread-1",
            Map.of(),
            List.of(
                SourcePart.of(
                    "notes.txt",
                    "text/plain",
                    "First message attachment about budget.".getBytes(StandardCharsets.UTF_8)),
                SourcePart.of(
                    "notes.txt",
                    "text/plain",
                    "Second message attachment about hiring.".getBytes(StandardCharsets.UTF_8))));

    // When
    threadOrchestrator.ingest(task("t1"), List.of(thread));

    // Then
    assertThat(vectorStore.records).hasSize(2);
    assertThat(vectorStore.records.values())
        .extracting(VectorRecord::content)
        .containsExactlyInAnyOrder(
            "First message attachment about budget.", "Second message attachment about hiring.");
  }

  @Test
  @DisplayName("Should drop chunks of the previous generation when a source shrinks")
  void shouldReplacePreviousGeneration() {
    // Given
    SourceItem item = item("thread-1");
    when(extractorDispatcher.extract(item))
        .thenReturn(extracted(LONG_TEXT))
        .thenReturn(extracted("Budget approved."));

    // When
    orchestrator.ingest(task("t1"), List.of(item));
    int firstGenerationSize = vectorStore.records.size();
    orchestrator.ingest(task("t2"), List.of(item));

    // Then
    assertThat(firstGenerationSize).isGreaterThanOrEqualTo(3);
    assertThat(vectorStore.records).hasSize(1);
    VectorRecord remaining = vectorStore.records.values().iterator().next();
    assertThat(remaining.content()).isEqualTo("Budget approved.");
    assertThat(remaining.metadata())
        .containsEntry("sourceService", "gmail")
        .containsEntry("userId", "owner")
        .containsEntry("sourceId", "thread-1")
        .containsEntry("taskId", "t2")
        .containsEntry("chunkIndex", 0);
  }

  @Test
  @DisplayName("Should keep chunks of other sources untouched")
  void shouldNotTouchOtherSources() {
    // Given
    SourceItem first = item("thread-1");
    SourceItem second = item("thread-2");
    when(extractorDispatcher.extract(first)).thenReturn(extracted("First thread."));
    when(extractorDispatcher.extract(second)).thenReturn(extracted("Second thread."));

    // When
    orchestrator.ingest(task("t1"), List.of(first, second));
    orchestrator.ingest(task("t2"), List.of(first));

    // Then
    assertThat(vectorStore.records.values())
        .extracting(VectorRecord::content)
        .containsExactlyInAnyOrder("First thread.", "Second thread.");
  }

  @Test
  @DisplayName("Should skip a failing item and continue with the next one")
  void shouldContinueAfterItemFailure() {
    // Given
    SourceItem broken = item("thread-1");
    SourceItem healthy = item("thread-2");
    when(extractorDispatcher.extract(broken))
        .thenThrow(new ExtractionException("broken.pdf", "corrupt file"));
    when(extractorDispatcher.extract(healthy)).thenReturn(extracted("All good."));

    // When
    orchestrator.ingest(task("t1"), List.of(broken, healthy));

    // Then
    verify(taskLifecycleManager).recordFailedItem("t1");
    verify(taskLifecycleManager).recordProcessed("t1");
    verify(taskLifecycleManager).complete("t1");
    assertThat(vectorStore.records).hasSize(1);
    assertThat(meterRegistry.counter("ingestion.items.failed").count()).isEqualTo(1.0);
  }

  @Test
  @DisplayName("Should count an item as failed when every part failed to extract")
  void shouldCountFullyFailedExtractionAsFailure() {
    // Given
    SourceItem item = item("thread-1");
    when(extractorDispatcher.extract(item))
        .thenReturn(
            ExtractionResult.failed(
                new ExtractionFailure("photo.heic", "Unsupported media type", true)));

    // When
    orchestrator.ingest(task("t1"), List.of(item));

    // Then
    verify(taskLifecycleManager).recordFailedItem("t1");
    verify(taskLifecycleManager, never()).recordProcessed("t1");
    verify(taskLifecycleManager).complete("t1");
    assertThat(vectorStore.records).isEmpty();
  }

  @Test
  @DisplayName("Should fail the task and stop when the vector store rejects a write")
  void shouldFailTaskOnVectorStoreError() {
    // Given
    SourceItem first = item("thread-1");
    SourceItem second = item("thread-2");
    when(extractorDispatcher.extract(first)).thenReturn(extracted("First thread."));
    vectorStore.failWith = new VectorStoreException("mapper_parsing_exception");

    // When
    orchestrator.ingest(task("t1"), List.of(first, second));

    // Then
    verify(taskLifecycleManager)
        .fail(eq("t1"), startsWith("Vector store write failed: mapper_parsing_exception"));
    verify(taskLifecycleManager, never()).complete(any());
    verify(extractorDispatcher, never()).extract(second);
  }

  @Test
  @DisplayName("Should fail the task when the connector breaks mid-iteration")
  void shouldFailTaskWhenItemsCannotBeRead() {
    // Given
    Iterable<SourceItem> broken =
        () ->
            new Iterator<>() {
              @Override
              public boolean hasNext() {
                return true;
              }

              @Override
              public SourceItem next() {
                throw new IllegalStateException("token expired");
              }
            };

    // When
    orchestrator.ingest(task("t1"), broken);

    // Then
    verify(taskLifecycleManager).fail("t1", "Ingestion aborted: token expired");
  }

  @Test
  @DisplayName("Should run the relevance filter only when the task carries topics")
  void shouldFilterByTopics() {
    // Given
    SourceItem item = item("thread-1");
    when(extractorDispatcher.extract(item)).thenReturn(extracted("Budget approved."));
    when(relevanceFilter.filter(anyList(), eq(List.of("budget")))).thenReturn(List.of());
    IngestionTask withTopics = task("t1");
    withTopics.setSourceQuery(
        new SourceQuery(null, List.of("budget"), null, null, Map.of()));

    // When
    orchestrator.ingest(withTopics, List.of(item));
    orchestrator.ingest(task("t2"), List.of(item));

    // Then
    verify(relevanceFilter, times(1)).filter(anyList(), eq(List.of("budget")));
    assertThat(vectorStore.records).hasSize(1);
    verify(taskLifecycleManager).recordProcessed("t1");
  }

  @Test
  @DisplayName("Should skip the relevance filter when the source disables it")
  void shouldRespectDisabledRelevanceFilter() {
    // Given
    IngestionConfig.Source fileSettings = new IngestionConfig.Source();
    fileSettings.setRelevanceFilterEnabled(false);
    config.getSources().put(SourceService.FILE, fileSettings);
    SourceItem item = item("notes.txt");
    when(extractorDispatcher.extract(item)).thenReturn(extracted("Budget approved."));
    IngestionTask task = task("t1");
    task.setService(SourceService.FILE);
    task.setSourceQuery(new SourceQuery(null, List.of("budget"), null, null, Map.of()));

    // When
    orchestrator.ingest(task, List.of(item));

    // Then
    verify(relevanceFilter, never()).filter(anyList(), anyList());
    assertThat(vectorStore.records).hasSize(1);
  }

  private static IngestionTask task(String id) {
    return IngestionTask.builder()
        .id(id)
        .ownerId("owner")
        .service(SourceService.GMAIL)
        .kind(TaskKind.MANUAL)
        .sourceQuery(SourceQuery.empty())
        .build();
  }

  private static SourceItem item(String sourceId) {
    return new SourceItem(
        sourceId,
        Map.of(),
        List.of(
            SourcePart.of("body.txt", "text/plain", "ignored".getBytes(StandardCharsets.UTF_8))));
  }

  private static ExtractionResult extracted(String text) {
    return ExtractionResult.of(
        List.of(new ExtractedSegment(text, Map.of("partKey", "body.txt"))));
  }

  /** Keeps records in a map and applies delete criteria as exact metadata matches. */
  private static final class InMemoryVectorStore implements VectorStore {

    private final Map<String, VectorRecord> records = new LinkedHashMap<>();
    private VectorStoreException failWith;

    @Override
    public long delete(Map<String, Object> criteria) {
      List<String> matching =
          records.values().stream()
              .filter(r -> matches(r, criteria))
              .map(VectorRecord::id)
              .toList();
      matching.forEach(records::remove);
      return matching.size();
    }

    @Override
    public void upsert(List<VectorRecord> batch) {
      if (failWith != null) {
        throw failWith;
      }
      batch.forEach(r -> records.put(r.id(), r));
    }

    private static boolean matches(VectorRecord record, Map<String, Object> criteria) {
      return criteria.entrySet().stream()
          .allMatch(
              e -> Objects.equals(String.valueOf(record.metadata().get(e.getKey())), e.getValue()));
    }
  }
}
