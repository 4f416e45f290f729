package com.scholary.placeholdarr.status;

import java.util.Objects;

/**
 * A status as shown to users in the catalog title.
 *
 * <p>{@code progressPercent} is only set for {@link StatusCode#DOWNLOADING} with a known size. The
 * {@code retried} flag only affects the label of {@link StatusCode#NOT_FOUND}.
 */
public record DisplayStatus(StatusCode code, Integer progressPercent, boolean retried) {

  public static final DisplayStatus SEARCHING =
      new DisplayStatus(StatusCode.SEARCHING, null, false);
  public static final DisplayStatus QUEUED = new DisplayStatus(StatusCode.QUEUED, null, false);
  public static final DisplayStatus PROCESSING =
      new DisplayStatus(StatusCode.PROCESSING, null, false);
  public static final DisplayStatus WARNING = new DisplayStatus(StatusCode.WARNING, null, false);
  public static final DisplayStatus RETRYING = new DisplayStatus(StatusCode.RETRYING, null, false);
  public static final DisplayStatus AVAILABLE =
      new DisplayStatus(StatusCode.AVAILABLE, null, false);

  public DisplayStatus {
    Objects.requireNonNull(code, "code");
    if (progressPercent != null) {
      if (code != StatusCode.DOWNLOADING) {
        throw new IllegalArgumentException("Progress is only valid while downloading");
      }
      if (progressPercent < 0 || progressPercent > 100) {
        throw new IllegalArgumentException("Progress must be within 0-100: " + progressPercent);
      }
    }
  }

  public static DisplayStatus downloading(int progressPercent) {
    return new DisplayStatus(StatusCode.DOWNLOADING, progressPercent, false);
  }

  public static DisplayStatus downloadingIndeterminate() {
    return new DisplayStatus(StatusCode.DOWNLOADING, null, false);
  }

  public static DisplayStatus notFound(boolean retried) {
    return new DisplayStatus(StatusCode.NOT_FOUND, null, retried);
  }

  public UnitState state() {
    return code.state();
  }

  /** Human readable label, e.g. {@code "Downloading 42%"}. */
  public String label() {
    switch (code) {
      case SEARCHING:
        return "Searching...";
      case QUEUED:
        return "Queued";
      case DOWNLOADING:
        return progressPercent == null ? "Downloading..." : "Downloading " + progressPercent + "%";
      case PROCESSING:
        return "Processing...";
      case WARNING:
        return "Warning";
      case RETRYING:
        return "Retrying...";
      case AVAILABLE:
        return "Available";
      case NOT_FOUND:
        return retried ? "Not Available" : "Not Found";
      default:
        throw new IllegalStateException("Unhandled status code: " + code);
    }
  }

  @Override
  public String toString() {
    return label();
  }
}
