package com.flamingo.ai.ingestion.exception;

/**
 * Exception thrown when the vector store rejects a request.
 *
 * <p>Instances of this class are not retried. Connection problems and backend overload are
 * reported with {@link VectorStoreTransientException} instead.
 */
public class VectorStoreException extends RuntimeException {

  public VectorStoreException(String message) {
    super(message);
  }

  public VectorStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
