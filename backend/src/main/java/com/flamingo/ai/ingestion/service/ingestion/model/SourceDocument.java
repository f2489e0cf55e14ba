package com.flamingo.ai.ingestion.service.ingestion.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Extracted text of one part or page, ready for chunking.
 *
 * @param rawText extracted plain text, possibly empty
 * @param metadata source metadata: service, user, source id, and page or part details
 */
public record SourceDocument(String rawText, Map<String, Object> metadata) {

  public SourceDocument {
    rawText = rawText == null ? "" : rawText;
    metadata =
        metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
  }
}
