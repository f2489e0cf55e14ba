package com.flamingo.ai.ingestion.service.vector;

import java.util.List;
import java.util.Map;

/**
 * One entry written to the vector store.
 *
 * @param id deterministic chunk id; writing the same id again replaces the entry
 * @param content chunk text
 * @param metadata chunk metadata
 * @param embedding embedding of the content
 */
public record VectorRecord(
    String id, String content, Map<String, Object> metadata, List<Float> embedding) {}
