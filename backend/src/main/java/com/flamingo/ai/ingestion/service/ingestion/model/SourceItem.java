package com.flamingo.ai.ingestion.service.ingestion.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One logical unit yielded by a source connector: an email thread, an uploaded file, a drive file.
 *
 * <p>All chunks produced from the item's parts belong to the same source and are replaced together
 * on re-ingestion.
 *
 * @param sourceId stable identifier of the source (thread id, file id, file name)
 * @param metadata item-level metadata such as subject, sender or timestamps
 * @param parts raw content to extract, in connector order
 */
public record SourceItem(String sourceId, Map<String, Object> metadata, List<SourcePart> parts) {

  public SourceItem {
    metadata =
        metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    parts = parts == null ? List.of() : List.copyOf(parts);
  }
}
