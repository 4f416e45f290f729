package com.scholary.placeholdarr.backend;

/** File state of a single backend unit (movie or episode). */
public record BackendUnit(long backendUnitId, boolean hasFile) {}
