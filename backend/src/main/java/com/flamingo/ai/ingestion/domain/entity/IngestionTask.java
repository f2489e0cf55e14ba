package com.flamingo.ai.ingestion.domain.entity;

import com.flamingo.ai.ingestion.domain.converter.SourceQueryConverter;
import com.flamingo.ai.ingestion.domain.enums.SourceService;
import com.flamingo.ai.ingestion.domain.enums.TaskKind;
import com.flamingo.ai.ingestion.domain.enums.TaskStatus;
import com.flamingo.ai.ingestion.domain.model.SourceQuery;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** Persisted record of one background ingestion job. */
@Entity
@Table(
    name = "ingestion_tasks",
    indexes = @Index(name = "idx_ingestion_tasks_owner", columnList = "ownerId,service,createdAt"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class IngestionTask {

  @Id private String id;

  @Column(nullable = false)
  private String ownerId;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  private SourceService service;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  private TaskKind kind;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  @Builder.Default
  private TaskStatus status = TaskStatus.PENDING;

  /** What the task was asked to collect, echoed when the task starts. */
  @Convert(converter = SourceQueryConverter.class)
  @Column(columnDefinition = "TEXT")
  private SourceQuery sourceQuery;

  @Builder.Default private int processedCount = 0;

  /** Items skipped because of extraction or media type errors. */
  @Builder.Default private int failedItemCount = 0;

  /** First unrecoverable error, set when the task fails. */
  @Column(columnDefinition = "TEXT")
  private String error;

  @Column(nullable = false, updatable = false)
  private LocalDateTime createdAt;

  @Column(nullable = false)
  private LocalDateTime updatedAt;

  @PrePersist
  protected void onCreate() {
    LocalDateTime now = LocalDateTime.now();
    if (createdAt == null) {
      createdAt = now;
    }
    if (updatedAt == null) {
      updatedAt = now;
    }
  }

  /** Marks the task as picked up by a worker. */
  public void start(SourceQuery query) {
    this.status = TaskStatus.IN_PROGRESS;
    if (query != null) {
      this.sourceQuery = query;
    }
  }

  /** Marks the task as finished. */
  public void markCompleted() {
    this.status = TaskStatus.COMPLETED;
  }

  /** Marks the task as failed with an operator-facing error message. */
  public void markFailed(String errorMessage) {
    this.status = TaskStatus.FAILED;
    this.error = errorMessage;
  }
}
