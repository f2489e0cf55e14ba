package com.flamingo.ai.ingestion.service.ingestion.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A bounded slice of a document's text, the unit written to the vector index.
 *
 * @param id deterministic identifier, null until assigned by the identity resolver
 * @param content chunk text
 * @param metadata document metadata plus the chunk index
 * @param chunkIndex zero-based position within the document
 * @param tokenCount token length of the content
 */
public record Chunk(
    String id, String content, Map<String, Object> metadata, int chunkIndex, int tokenCount) {

  public Chunk {
    metadata =
        metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
  }

  public Chunk withId(String newId) {
    return new Chunk(newId, content, metadata, chunkIndex, tokenCount);
  }

  public Chunk withContent(String newContent) {
    return new Chunk(id, newContent, metadata, chunkIndex, tokenCount);
  }
}
