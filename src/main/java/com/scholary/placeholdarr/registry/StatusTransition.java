package com.scholary.placeholdarr.registry;

import com.scholary.placeholdarr.status.DisplayStatus;
import java.time.Instant;

/**
 * A status change of one unit. {@code previous} is null for the initial status.
 *
 * @param unit snapshot of the unit after the change
 */
public record StatusTransition(
    MonitoredUnit unit, DisplayStatus previous, DisplayStatus current, Instant at) {

  public boolean stateChanged() {
    return previous == null || previous.state() != current.state();
  }
}
