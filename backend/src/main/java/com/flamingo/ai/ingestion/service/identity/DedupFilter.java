package com.flamingo.ai.ingestion.service.identity;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Exact-match criteria selecting every stored chunk of one logical source.
 *
 * @param criteria metadata field to expected value; empty means nothing is deleted
 */
public record DedupFilter(Map<String, Object> criteria) {

  private static final DedupFilter NONE = new DedupFilter(Map.of());

  public DedupFilter {
    criteria =
        criteria == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(criteria));
  }

  /** A filter that skips the delete step. */
  public static DedupFilter none() {
    return NONE;
  }

  public boolean isEmpty() {
    return criteria.isEmpty();
  }
}
