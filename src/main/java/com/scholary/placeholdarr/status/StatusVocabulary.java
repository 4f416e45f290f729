package com.scholary.placeholdarr.status;

import com.scholary.placeholdarr.backend.BackendQueueItem;
import java.util.Locale;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Maps raw backend queue records onto the display status vocabulary.
 *
 * <p>Pure function of the record: no state, no I/O. Progress is the completed fraction of the
 * download. A record without a usable size yields an indeterminate "Downloading..." status.
 */
@Component
public class StatusVocabulary {

  private static final Set<String> PROCESSING = Set.of("completed", "importpending", "importing");
  private static final Set<String> QUEUED = Set.of("delay", "queued", "paused");
  private static final Set<String> FAILED = Set.of("failed", "error");

  public DisplayStatus classify(BackendQueueItem item) {
    String status = item.status() == null ? "" : item.status().trim().toLowerCase(Locale.ROOT);

    if (PROCESSING.contains(status)) {
      return DisplayStatus.PROCESSING;
    }
    if (QUEUED.contains(status)) {
      return DisplayStatus.QUEUED;
    }
    if ("warning".equals(status)) {
      return DisplayStatus.WARNING;
    }
    if (FAILED.contains(status)) {
      return DisplayStatus.RETRYING;
    }

    Integer percent = progressPercent(item.sizeTotal(), item.sizeRemaining());
    return percent == null
        ? DisplayStatus.downloadingIndeterminate()
        : DisplayStatus.downloading(percent);
  }

  /**
   * Completed percentage, {@code null} when the sizes cannot produce one.
   *
   * @param sizeTotal total bytes
   * @param sizeRemaining bytes left
   * @return 0-100, or null
   */
  public static Integer progressPercent(double sizeTotal, double sizeRemaining) {
    if (Double.isNaN(sizeTotal) || Double.isNaN(sizeRemaining)) {
      return null;
    }
    if (sizeTotal <= 0 || sizeRemaining < 0) {
      return null;
    }
    double completed = Math.max(0, sizeTotal - sizeRemaining);
    int percent = (int) Math.floor(100 * completed / sizeTotal);
    return Math.min(100, Math.max(0, percent));
  }
}
