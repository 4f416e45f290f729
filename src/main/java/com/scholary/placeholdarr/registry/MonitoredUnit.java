package com.scholary.placeholdarr.registry;

import com.scholary.placeholdarr.media.MediaKind;
import com.scholary.placeholdarr.media.QualityTier;
import com.scholary.placeholdarr.status.DisplayStatus;
import com.scholary.placeholdarr.status.UnitState;
import java.time.Instant;

/**
 * A media unit awaiting its file.
 *
 * <p>Instances held by {@link MonitoringRegistry} are only mutated under the registry lock. Callers
 * outside the registry only ever see copies, so the setters are package-private.
 */
public class MonitoredUnit {

  private final UnitIdentity identity;
  private final long backendRef;
  private final String displayTitle;
  private final QualityTier qualityTier;
  private final String catalogRef;
  private final long registrationId;

  private DisplayStatus status;
  private Instant startedAt;
  private Instant lastTransitionAt;
  private int attemptCount;
  private boolean retrying;
  private boolean seenInQueue;

  MonitoredUnit(UnitRegistration registration, long registrationId, Instant now) {
    this.identity = registration.identity();
    this.backendRef = registration.backendRef();
    this.displayTitle = registration.displayTitle();
    this.qualityTier = registration.qualityTier();
    this.catalogRef = registration.catalogRef();
    this.registrationId = registrationId;
    this.status = DisplayStatus.SEARCHING;
    this.startedAt = now;
    this.lastTransitionAt = now;
  }

  private MonitoredUnit(MonitoredUnit other) {
    this.identity = other.identity;
    this.backendRef = other.backendRef;
    this.displayTitle = other.displayTitle;
    this.qualityTier = other.qualityTier;
    this.catalogRef = other.catalogRef;
    this.registrationId = other.registrationId;
    this.status = other.status;
    this.startedAt = other.startedAt;
    this.lastTransitionAt = other.lastTransitionAt;
    this.attemptCount = other.attemptCount;
    this.retrying = other.retrying;
    this.seenInQueue = other.seenInQueue;
  }

  MonitoredUnit copy() {
    return new MonitoredUnit(this);
  }

  public UnitIdentity getIdentity() {
    return identity;
  }

  public MediaKind getKind() {
    return identity.kind();
  }

  public long getBackendRef() {
    return backendRef;
  }

  public String getDisplayTitle() {
    return displayTitle;
  }

  public QualityTier getQualityTier() {
    return qualityTier;
  }

  public String getCatalogRef() {
    return catalogRef;
  }

  public long getRegistrationId() {
    return registrationId;
  }

  public DisplayStatus getStatus() {
    return status;
  }

  void setStatus(DisplayStatus status) {
    this.status = status;
  }

  public UnitState getState() {
    return status.state();
  }

  /** Last observed completion percentage, null unless downloading with a known size. */
  public Integer getProgressPercent() {
    return status.progressPercent();
  }

  public Instant getStartedAt() {
    return startedAt;
  }

  void setStartedAt(Instant startedAt) {
    this.startedAt = startedAt;
  }

  public Instant getLastTransitionAt() {
    return lastTransitionAt;
  }

  void setLastTransitionAt(Instant lastTransitionAt) {
    this.lastTransitionAt = lastTransitionAt;
  }

  public int getAttemptCount() {
    return attemptCount;
  }

  void setAttemptCount(int attemptCount) {
    this.attemptCount = attemptCount;
  }

  public boolean isRetrying() {
    return retrying;
  }

  void setRetrying(boolean retrying) {
    this.retrying = retrying;
  }

  public boolean isSeenInQueue() {
    return seenInQueue;
  }

  void setSeenInQueue(boolean seenInQueue) {
    this.seenInQueue = seenInQueue;
  }

  @Override
  public String toString() {
    return String.format(
        "MonitoredUnit[%s, title=%s, backendRef=%d, tier=%s, status=%s, attempts=%d]",
        identity, displayTitle, backendRef, qualityTier, status, attemptCount);
  }
}
