package com.flamingo.ai.ingestion.domain.model;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Parameters describing what a task was asked to collect.
 *
 * <p>Stored on the task for audit and reused by scheduled re-ingestion, which moves the {@code
 * after} cursor forward between runs.
 *
 * @param query free-form source query passed to the connector (for example a mailbox search)
 * @param topics topics used by the relevance filter; empty disables filtering
 * @param after only collect content newer than this date
 * @param before only collect content older than this date
 * @param options connector-specific options
 */
public record SourceQuery(
    String query,
    List<String> topics,
    LocalDate after,
    LocalDate before,
    Map<String, String> options) {

  public SourceQuery {
    topics = topics == null ? List.of() : List.copyOf(topics);
    options = options == null ? Map.of() : Map.copyOf(options);
    if (after != null && before != null && after.isAfter(before)) {
      throw new IllegalArgumentException(
          "Query 'after' (" + after + ") must not be later than 'before' (" + before + ")");
    }
  }

  public static SourceQuery empty() {
    return new SourceQuery(null, List.of(), null, null, Map.of());
  }

  public SourceQuery withAfter(LocalDate newAfter) {
    return new SourceQuery(query, topics, newAfter, before, options);
  }

  public boolean hasTopics() {
    return !topics.isEmpty();
  }
}
