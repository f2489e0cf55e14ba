package com.flamingo.ai.ingestion.domain.entity;

import com.flamingo.ai.ingestion.domain.converter.SourceQueryConverter;
import com.flamingo.ai.ingestion.domain.enums.SourceService;
import com.flamingo.ai.ingestion.domain.model.SourceQuery;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.LocalDate;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** A user's standing request to re-ingest a source on every scheduled sweep. */
@Entity
@Table(name = "source_subscriptions")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SourceSubscription {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(nullable = false)
  private String ownerId;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  private SourceService service;

  @Convert(converter = SourceQueryConverter.class)
  @Column(columnDefinition = "TEXT")
  private SourceQuery sourceQuery;

  /** Date of the last sweep that submitted a task for this subscription. */
  private LocalDate lastCollectDate;

  private String lastTaskId;

  @Builder.Default private boolean enabled = true;
}
