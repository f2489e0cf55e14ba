package com.flamingo.ai.ingestion.service.extraction.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Text extracted from one page, row, event or whole file, with its positional metadata. */
public record ExtractedSegment(String text, Map<String, Object> metadata) {

  public ExtractedSegment {
    text = text == null ? "" : text;
    metadata =
        metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
  }
}
