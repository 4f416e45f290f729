package com.scholary.placeholdarr.backend;

/**
 * One record of a backend download queue, as seen during a single poll cycle.
 *
 * @param backendUnitId Radarr movie id or Sonarr episode id the record belongs to
 * @param status free-text queue status, e.g. {@code downloading}, {@code completed}
 * @param sizeTotal total size in bytes
 * @param sizeRemaining bytes still to download
 */
public record BackendQueueItem(
    long backendUnitId, String status, double sizeTotal, double sizeRemaining) {}
