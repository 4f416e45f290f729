package com.scholary.placeholdarr.backend;

/**
 * Exception thrown when a download backend call fails.
 *
 * <p>Raised after retries are exhausted or for non-retryable responses. The poller treats it as a
 * transient condition: the affected units keep their previous status for the cycle.
 */
public class BackendException extends RuntimeException {

  public BackendException(String message) {
    super(message);
  }

  public BackendException(String message, Throwable cause) {
    super(message, cause);
  }
}
