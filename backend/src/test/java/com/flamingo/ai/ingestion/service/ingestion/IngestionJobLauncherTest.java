package com.flamingo.ai.ingestion.service.ingestion;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.flamingo.ai.ingestion.domain.entity.IngestionTask;
import com.flamingo.ai.ingestion.domain.enums.SourceService;
import com.flamingo.ai.ingestion.domain.enums.TaskKind;
import com.flamingo.ai.ingestion.domain.model.SourceQuery;
import com.flamingo.ai.ingestion.exception.UnsupportedMediaTypeException;
import com.flamingo.ai.ingestion.service.extraction.ContentExtractorRegistry;
import com.flamingo.ai.ingestion.service.ingestion.model.SourceItem;
import com.flamingo.ai.ingestion.service.task.TaskLifecycleManager;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.core.task.TaskRejectedException;

@ExtendWith(MockitoExtension.class)
@DisplayName("IngestionJobLauncher Tests")
class IngestionJobLauncherTest {

  @Mock private TaskLifecycleManager taskLifecycleManager;
  @Mock private IngestionTaskRunner taskRunner;
  @Mock private ContentExtractorRegistry extractorRegistry;
  @Mock private ObjectProvider<SourceConnector> connectorProvider;
  @Mock private SourceConnector gmailConnector;

  private IngestionJobLauncher launcher;

  @BeforeEach
  void setUp() {
    lenient().when(gmailConnector.service()).thenReturn(SourceService.GMAIL);
    lenient().when(connectorProvider.orderedStream()).thenReturn(Stream.of(gmailConnector));
    launcher =
        new IngestionJobLauncher(
            taskLifecycleManager, taskRunner, extractorRegistry, connectorProvider);
  }

  @Test
  @DisplayName("Should queue an uploaded file keyed by its name")
  @SuppressWarnings("unchecked")
  void shouldSubmitUpload() {
    // Given
    IngestionTask pending = task("t1", SourceService.FILE);
    when(extractorRegistry.supports("application/pdf", "report.pdf")).thenReturn(true);
    when(taskLifecycleManager.submit(
            "owner", SourceService.FILE, TaskKind.MANUAL, SourceQuery.empty()))
        .thenReturn(pending);
    byte[] bytes = "%PDF".getBytes(StandardCharsets.US_ASCII);

    // When
    IngestionTask result = launcher.submitUpload("owner", "report.pdf", "application/pdf", bytes);

    // Then
    assertThat(result).isSameAs(pending);
    ArgumentCaptor<Supplier<Iterable<SourceItem>>> captor = ArgumentCaptor.forClass(Supplier.class);
    verify(taskRunner).runManual(eq(pending), captor.capture());
    List<SourceItem> items = (List<SourceItem>) captor.getValue().get();
    assertThat(items).hasSize(1);
    assertThat(items.get(0).sourceId()).isEqualTo("report.pdf");
    assertThat(items.get(0).parts().get(0).content()).isEqualTo(bytes);
  }

  @Test
  @DisplayName("Should reject unsupported uploads before creating a task")
  void shouldRejectUnsupportedUpload() {
    when(extractorRegistry.supports("image/heic", "photo.heic")).thenReturn(false);

    assertThatThrownBy(
            () -> launcher.submitUpload("owner", "photo.heic", "image/heic", new byte[1]))
        .isInstanceOf(UnsupportedMediaTypeException.class);
    verifyNoInteractions(taskLifecycleManager, taskRunner);
  }

  @Test
  @DisplayName("Should reject uploads without a file name")
  void shouldRejectNamelessUpload() {
    assertThatThrownBy(() -> launcher.submitUpload("owner", " ", "text/plain", new byte[1]))
        .isInstanceOf(IllegalArgumentException.class);
    verifyNoInteractions(taskLifecycleManager);
  }

  @Test
  @DisplayName("Should fetch from the connector on the worker when a manual task runs")
  @SuppressWarnings("unchecked")
  void shouldSubmitManualPull() {
    // Given
    SourceQuery query = new SourceQuery("label:inbox", List.of(), null, null, Map.of());
    IngestionTask pending = task("t1", SourceService.GMAIL);
    when(gmailConnector.canFetch("owner")).thenReturn(true);
    when(taskLifecycleManager.submit("owner", SourceService.GMAIL, TaskKind.MANUAL, query))
        .thenReturn(pending);
    List<SourceItem> fetched = List.of(new SourceItem("thread-1", Map.of(), List.of()));
    when(gmailConnector.fetch("owner", query)).thenReturn(fetched);

    // When
    launcher.submitManual("owner", SourceService.GMAIL, query);

    // Then
    ArgumentCaptor<Supplier<Iterable<SourceItem>>> captor = ArgumentCaptor.forClass(Supplier.class);
    verify(taskRunner).runManual(eq(pending), captor.capture());
    verify(gmailConnector, never()).fetch(any(), any());
    assertThat(captor.getValue().get()).isSameAs(fetched);
  }

  @Test
  @DisplayName("Should refuse a manual pull when the owner's credentials are unusable")
  void shouldRefuseManualPullWithoutCredentials() {
    when(gmailConnector.canFetch("owner")).thenReturn(false);

    assertThatThrownBy(
            () -> launcher.submitManual("owner", SourceService.GMAIL, SourceQuery.empty()))
        .isInstanceOf(IllegalStateException.class);
    verifyNoInteractions(taskLifecycleManager);
  }

  @Test
  @DisplayName("Should refuse services without a registered connector")
  void shouldRefuseUnknownService() {
    assertThatThrownBy(
            () -> launcher.submitManual("owner", SourceService.DRIVE, SourceQuery.empty()))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("drive");
    assertThat(launcher.canFetch(SourceService.DRIVE, "owner")).isFalse();
  }

  @Test
  @DisplayName("Should route scheduled tasks to the scheduled pool")
  void shouldSubmitScheduledTask() {
    // Given
    IngestionTask pending = task("t1", SourceService.GMAIL);
    when(taskLifecycleManager.submit(
            "owner", SourceService.GMAIL, TaskKind.SCHEDULED, SourceQuery.empty()))
        .thenReturn(pending);

    // When
    launcher.submitScheduled("owner", SourceService.GMAIL, null);

    // Then
    verify(taskRunner).runScheduled(eq(pending), any());
    verify(taskRunner, never()).runManual(any(), any());
  }

  @Test
  @DisplayName("Should fail the task when the worker pool rejects it")
  void shouldFailTaskWhenPoolIsFull() {
    // Given
    IngestionTask pending = task("t1", SourceService.GMAIL);
    when(gmailConnector.canFetch("owner")).thenReturn(true);
    when(taskLifecycleManager.submit(
            "owner", SourceService.GMAIL, TaskKind.MANUAL, SourceQuery.empty()))
        .thenReturn(pending);
    when(taskRunner.runManual(eq(pending), any()))
        .thenThrow(new TaskRejectedException("queue capacity reached"));

    // When
    IngestionTask result = launcher.submitManual("owner", SourceService.GMAIL, null);

    // Then
    assertThat(result).isSameAs(pending);
    verify(taskLifecycleManager).fail(eq("t1"), startsWith("Worker pool is full"));
  }

  @Test
  @DisplayName("Should refuse two connectors for the same service")
  void shouldRejectDuplicateConnectors() {
    SourceConnector another = mock(SourceConnector.class);
    when(another.service()).thenReturn(SourceService.GMAIL);
    when(connectorProvider.orderedStream()).thenReturn(Stream.of(gmailConnector, another));

    assertThatThrownBy(
            () ->
                new IngestionJobLauncher(
                    taskLifecycleManager, taskRunner, extractorRegistry, connectorProvider))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("gmail");
  }

  private static IngestionTask task(String id, SourceService service) {
    return IngestionTask.builder()
        .id(id)
        .ownerId("owner")
        .service(service)
        .kind(TaskKind.MANUAL)
        .build();
  }
}
