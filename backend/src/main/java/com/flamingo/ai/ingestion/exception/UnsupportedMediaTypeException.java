package com.flamingo.ai.ingestion.exception;

/** Exception thrown when no extractor handles a media type or file extension. */
public class UnsupportedMediaTypeException extends RuntimeException {

  private final String mediaType;
  private final String fileName;

  public UnsupportedMediaTypeException(String mediaType, String fileName) {
    super(String.format("Unsupported media type '%s' for file '%s'", mediaType, fileName));
    this.mediaType = mediaType;
    this.fileName = fileName;
  }

  public String getMediaType() {
    return mediaType;
  }

  public String getFileName() {
    return fileName;
  }
}
