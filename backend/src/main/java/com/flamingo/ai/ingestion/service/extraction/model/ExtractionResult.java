package com.flamingo.ai.ingestion.service.extraction.model;

import java.util.ArrayList;
import java.util.List;

/** Segments extracted from a part or item, together with the pieces that were dropped. */
public record ExtractionResult(List<ExtractedSegment> segments, List<ExtractionFailure> failures) {

  public ExtractionResult {
    segments = segments == null ? List.of() : List.copyOf(segments);
    failures = failures == null ? List.of() : List.copyOf(failures);
  }

  public static ExtractionResult of(List<ExtractedSegment> segments) {
    return new ExtractionResult(segments, List.of());
  }

  public static ExtractionResult failed(ExtractionFailure failure) {
    return new ExtractionResult(List.of(), List.of(failure));
  }

  public boolean hasFailures() {
    return !failures.isEmpty();
  }

  /** Returns a result holding the segments and failures of both results, this one first. */
  public ExtractionResult merge(ExtractionResult other) {
    List<ExtractedSegment> mergedSegments = new ArrayList<>(segments);
    mergedSegments.addAll(other.segments());
    List<ExtractionFailure> mergedFailures = new ArrayList<>(failures);
    mergedFailures.addAll(other.failures());
    return new ExtractionResult(mergedSegments, mergedFailures);
  }
}
