package com.scholary.placeholdarr.status;

/**
 * Lifecycle state of a monitored unit.
 *
 * <p>{@link #NOT_FOUND} is terminal: it is only ever observed in the last transition emitted for a
 * unit before the unit is removed from the registry.
 */
public enum UnitState {
  SEARCHING,
  DOWNLOADING,
  RETRYING,
  AVAILABLE,
  NOT_FOUND
}
