package com.flamingo.ai.ingestion.service.ingestion;

import com.flamingo.ai.ingestion.domain.enums.SourceService;
import com.flamingo.ai.ingestion.domain.model.SourceQuery;
import com.flamingo.ai.ingestion.service.ingestion.model.SourceItem;

/**
 * Pulls content from one external source service for a user.
 *
 * <p>Implementations own authentication and paging. Items are consumed in iteration order, one at
 * a time, so a connector may fetch lazily.
 */
public interface SourceConnector {

  SourceService service();

  /**
   * Returns the items matching the query.
   *
   * @param ownerId user whose content is fetched
   * @param query what to collect
   * @return items in source order
   */
  Iterable<SourceItem> fetch(String ownerId, SourceQuery query);

  /** Returns false when the owner's stored credentials can no longer be used. */
  default boolean canFetch(String ownerId) {
    return true;
  }
}
