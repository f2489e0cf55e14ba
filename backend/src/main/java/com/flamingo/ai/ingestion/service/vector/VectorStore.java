package com.flamingo.ai.ingestion.service.vector;

import java.util.List;
import java.util.Map;

/**
 * Storage contract the pipeline needs from a vector database.
 *
 * <p>Failures are reported as {@link com.flamingo.ai.ingestion.exception.VectorStoreException};
 * the {@link com.flamingo.ai.ingestion.exception.VectorStoreTransientException} subclass marks
 * failures worth retrying.
 */
public interface VectorStore {

  /**
   * Deletes every entry whose metadata matches all criteria exactly.
   *
   * @param criteria metadata field to value; must not be empty
   * @return number of deleted entries
   */
  long delete(Map<String, Object> criteria);

  /**
   * Inserts or replaces entries by id.
   *
   * @param records entries to write
   */
  void upsert(List<VectorRecord> records);
}
