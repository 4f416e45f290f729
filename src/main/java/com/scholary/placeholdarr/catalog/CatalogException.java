package com.scholary.placeholdarr.catalog;

/** Exception thrown when a media catalog request fails. */
public class CatalogException extends RuntimeException {

  public CatalogException(String message) {
    super(message);
  }

  public CatalogException(String message, Throwable cause) {
    super(message, cause);
  }
}
