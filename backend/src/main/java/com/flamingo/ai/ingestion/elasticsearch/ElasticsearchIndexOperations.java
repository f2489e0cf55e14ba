package com.flamingo.ai.ingestion.elasticsearch;

import java.util.List;
import java.util.Map;

/**
 * Write-side operations on one Elasticsearch index.
 *
 * @param <T> the document type stored in the index
 */
public interface ElasticsearchIndexOperations<T> {

  /**
   * Creates the index when missing, otherwise adds missing fields and checks existing ones.
   *
   * @throws IllegalStateException when an existing field has an incompatible type
   */
  void initIndex();

  /**
   * Indexes documents in one bulk request. Documents with an existing id are replaced.
   *
   * @param documents the documents to index
   */
  void indexDocuments(List<T> documents);

  /**
   * Deletes every document matching all criteria.
   *
   * @param criteria field to exact value
   * @return number of deleted documents
   */
  long deleteBy(Map<String, Object> criteria);

  /** Makes recent writes visible to search. */
  void refresh();

  String getIndexName();
}
