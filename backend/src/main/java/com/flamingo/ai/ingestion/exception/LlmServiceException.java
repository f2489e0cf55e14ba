package com.flamingo.ai.ingestion.exception;

/** Exception thrown when an LLM call (vision OCR or topic classification) fails. */
public class LlmServiceException extends RuntimeException {

  private final boolean rateLimited;

  public LlmServiceException(String message) {
    super(message);
    this.rateLimited = false;
  }

  public LlmServiceException(String message, Throwable cause) {
    super(message, cause);
    this.rateLimited = false;
  }

  public LlmServiceException(String message, boolean rateLimited, Throwable cause) {
    super(message, cause);
    this.rateLimited = rateLimited;
  }

  /** Whether the provider rejected the call because of rate limiting. */
  public boolean isRateLimited() {
    return rateLimited;
  }
}
