package com.flamingo.ai.ingestion.domain.enums;

import com.flamingo.ai.ingestion.domain.model.MetadataKeys;

/**
 * Originating source of ingested content.
 *
 * <p>Each service names the metadata field that identifies one logical source for de-duplication:
 * email threads and drive files are keyed by their source id, uploaded files by file name.
 */
public enum SourceService {
  GMAIL("gmail", MetadataKeys.SOURCE_ID),
  DRIVE("drive", MetadataKeys.SOURCE_ID),
  FILE("file", MetadataKeys.FILE_NAME);

  private final String key;
  private final String dedupField;

  SourceService(String key, String dedupField) {
    this.key = key;
    this.dedupField = dedupField;
  }

  /** Lower-case name stored in chunk metadata. */
  public String getKey() {
    return key;
  }

  public String getDedupField() {
    return dedupField;
  }
}
