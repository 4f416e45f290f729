package com.scholary.placeholdarr.registry;

/** Why a unit left the registry. */
public enum RemovalReason {
  /** Became available and survived the cleanup delay. */
  AVAILABLE_CLEANUP,
  /** Exceeded the monitoring time ceiling. */
  TIMED_OUT,
  /** Exceeded the poll attempt ceiling. */
  ATTEMPTS_EXHAUSTED,
  /** A download-imported event arrived for it. */
  IMPORTED,
  /** Removed on request, e.g. a delete event. */
  EXPLICIT
}
