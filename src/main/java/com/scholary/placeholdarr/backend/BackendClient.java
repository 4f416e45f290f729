package com.scholary.placeholdarr.backend;

import com.scholary.placeholdarr.media.MediaKind;
import com.scholary.placeholdarr.media.QualityTier;
import java.util.List;

/**
 * Read side of one download backend instance (one kind, one quality tier).
 *
 * <p>Only polling lives here. Initiating searches belongs to the webhook layer.
 */
public interface BackendClient {

  MediaKind kind();

  QualityTier tier();

  /**
   * Fetch the whole download queue in one call.
   *
   * @return every queue record of this instance
   * @throws BackendException if the backend cannot be reached or answers with an error
   */
  List<BackendQueueItem> fetchQueue();

  /**
   * Fetch the file state of one unit.
   *
   * @param backendUnitId Radarr movie id or Sonarr episode id
   * @return the unit's file state
   * @throws BackendException if the backend cannot be reached or answers with an error
   */
  BackendUnit fetchUnit(long backendUnitId);
}
