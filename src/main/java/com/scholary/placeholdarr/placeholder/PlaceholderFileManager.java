package com.scholary.placeholdarr.placeholder;

import com.scholary.placeholdarr.registry.MonitoredUnit;

/**
 * Abstraction for the placeholder files standing in for missing media.
 *
 * <p>The cleanup path only needs to delete them once the real file is present. Keeping it behind an
 * interface lets the trigger be tested without touching a library folder.
 */
public interface PlaceholderFileManager {

  /**
   * Delete every placeholder file belonging to the unit.
   *
   * <p>Failures are logged and skipped. A missing placeholder is not an error.
   *
   * @param unit the unit whose real file arrived
   * @return number of files deleted
   */
  int delete(MonitoredUnit unit);
}
