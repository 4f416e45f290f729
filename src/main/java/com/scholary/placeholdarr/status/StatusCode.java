package com.scholary.placeholdarr.status;

/** Display status codes, each belonging to exactly one {@link UnitState}. */
public enum StatusCode {
  SEARCHING(UnitState.SEARCHING),
  QUEUED(UnitState.DOWNLOADING),
  DOWNLOADING(UnitState.DOWNLOADING),
  PROCESSING(UnitState.DOWNLOADING),
  WARNING(UnitState.DOWNLOADING),
  RETRYING(UnitState.RETRYING),
  AVAILABLE(UnitState.AVAILABLE),
  NOT_FOUND(UnitState.NOT_FOUND);

  private final UnitState state;

  StatusCode(UnitState state) {
    this.state = state;
  }

  public UnitState state() {
    return state;
  }
}
