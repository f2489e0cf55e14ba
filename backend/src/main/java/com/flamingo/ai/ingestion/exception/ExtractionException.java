package com.flamingo.ai.ingestion.exception;

/** Exception thrown when text cannot be extracted from a file or page. */
public class ExtractionException extends RuntimeException {

  private final String sourceName;

  public ExtractionException(String sourceName, String message) {
    super(message);
    this.sourceName = sourceName;
  }

  public ExtractionException(String sourceName, String message, Throwable cause) {
    super(message, cause);
    this.sourceName = sourceName;
  }

  /** File name (and page, when known) the extraction failed on. */
  public String getSourceName() {
    return sourceName;
  }
}
