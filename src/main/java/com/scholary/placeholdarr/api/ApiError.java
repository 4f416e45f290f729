package com.scholary.placeholdarr.api;

/** Error body returned for rejected requests. */
public record ApiError(int status, String message) {}
