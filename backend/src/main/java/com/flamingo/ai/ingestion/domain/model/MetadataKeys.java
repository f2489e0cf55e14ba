package com.flamingo.ai.ingestion.domain.model;

/** Metadata keys shared by extracted documents, chunks and the vector index. */
public final class MetadataKeys {

  public static final String SOURCE_SERVICE = "sourceService";
  public static final String USER_ID = "userId";
  public static final String SOURCE_ID = "sourceId";
  public static final String FILE_NAME = "fileName";
  public static final String ATTACHMENT_NAME = "attachmentName";
  public static final String TITLE = "title";
  public static final String EXT = "ext";
  public static final String MIME_TYPE = "mimeType";
  public static final String PAGE = "page";
  public static final String PART_KEY = "partKey";
  public static final String CHUNK_INDEX = "chunkIndex";
  public static final String TASK_ID = "taskId";
  public static final String EXTRACTION = "extraction";
  public static final String INGESTED_AT = "ingestedAt";

  private MetadataKeys() {}
}
