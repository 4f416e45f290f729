package com.scholary.placeholdarr.api;

import com.scholary.placeholdarr.media.MediaKind;
import com.scholary.placeholdarr.media.QualityTier;
import com.scholary.placeholdarr.registry.MonitoredUnit;
import com.scholary.placeholdarr.status.UnitState;
import java.time.Instant;

/**
 * Response for a monitored unit.
 *
 * <p>Shows the lifecycle state and the status label as it appears in the catalog title.
 */
public record UnitStatusResponse(
    String unit,
    MediaKind kind,
    String title,
    QualityTier tier,
    UnitState state,
    String status,
    Integer progress,
    int attempts,
    boolean retrying,
    Instant startedAt,
    Instant lastTransitionAt) {

  public static UnitStatusResponse from(MonitoredUnit unit) {
    return new UnitStatusResponse(
        unit.getIdentity().key(),
        unit.getKind(),
        unit.getDisplayTitle(),
        unit.getQualityTier(),
        unit.getState(),
        unit.getStatus().label(),
        unit.getProgressPercent(),
        unit.getAttemptCount(),
        unit.isRetrying(),
        unit.getStartedAt(),
        unit.getLastTransitionAt());
  }
}
