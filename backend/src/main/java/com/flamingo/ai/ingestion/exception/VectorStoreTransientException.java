package com.flamingo.ai.ingestion.exception;

/** Vector store failure worth retrying: connection errors, timeouts, overloaded backend. */
public class VectorStoreTransientException extends VectorStoreException {

  public VectorStoreTransientException(String message) {
    super(message);
  }

  public VectorStoreTransientException(String message, Throwable cause) {
    super(message, cause);
  }
}
