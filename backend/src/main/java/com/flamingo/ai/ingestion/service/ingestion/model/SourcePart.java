package com.flamingo.ai.ingestion.service.ingestion.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One piece of raw content within a source item: an email body, one attachment, one file.
 *
 * @param fileName file name, or a synthetic name such as {@code body.html} for email bodies
 * @param mediaType declared media type, may be null when only the extension is known
 * @param content raw bytes
 * @param metadata part-level metadata merged over the item metadata
 */
public record SourcePart(
    String fileName, String mediaType, byte[] content, Map<String, Object> metadata) {

  public SourcePart {
    content = content == null ? new byte[0] : content;
    metadata =
        metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
  }

  public static SourcePart of(String fileName, String mediaType, byte[] content) {
    return new SourcePart(fileName, mediaType, content, Map.of());
  }
}
