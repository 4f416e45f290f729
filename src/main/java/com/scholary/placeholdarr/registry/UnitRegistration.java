package com.scholary.placeholdarr.registry;

import com.scholary.placeholdarr.media.QualityTier;
import java.util.Objects;

/**
 * Everything needed to start monitoring a unit.
 *
 * @param identity catalog identity
 * @param backendRef Radarr movie id or Sonarr episode id
 * @param displayTitle base title without status markers
 * @param qualityTier backend tier
 * @param catalogRef Plex rating key, may be null
 */
public record UnitRegistration(
    UnitIdentity identity,
    long backendRef,
    String displayTitle,
    QualityTier qualityTier,
    String catalogRef) {

  public UnitRegistration {
    Objects.requireNonNull(identity, "identity");
    Objects.requireNonNull(qualityTier, "qualityTier");
    if (backendRef <= 0) {
      throw new IllegalArgumentException("Backend reference must be positive: " + backendRef);
    }
    if (displayTitle == null || displayTitle.isBlank()) {
      displayTitle = identity.key();
    }
  }
}
