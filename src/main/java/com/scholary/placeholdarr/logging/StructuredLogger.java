package com.scholary.placeholdarr.logging;

import com.scholary.placeholdarr.media.MediaKind;
import com.scholary.placeholdarr.media.QualityTier;
import com.scholary.placeholdarr.registry.MonitoredUnit;
import com.scholary.placeholdarr.registry.RemovalReason;
import com.scholary.placeholdarr.registry.StatusTransition;
import com.scholary.placeholdarr.registry.UnitIdentity;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Provides methods to log monitoring events with structured fields that can be queried in
 * Kibana when the {@code json} logging profile is active.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log unit added to monitoring. */
  public void logUnitAdded(MonitoredUnit unit) {
    try {
      MDC.put("event_type", "unit_added");
      MDC.put("unit", unit.getIdentity().key());
      MDC.put("backendRef", String.valueOf(unit.getBackendRef()));
      MDC.put("tier", unit.getQualityTier().name());

      logger.info(
          "Monitoring {} '{}': unit={}, backendRef={}, tier={}",
          unit.getKind().name().toLowerCase(),
          unit.getDisplayTitle(),
          unit.getIdentity(),
          unit.getBackendRef(),
          unit.getQualityTier());
    } finally {
      clearEventFields();
    }
  }

  /** Log status transition. */
  public void logStatusTransition(StatusTransition transition) {
    MonitoredUnit unit = transition.unit();
    try {
      MDC.put("event_type", "status_transition");
      MDC.put("unit", unit.getIdentity().key());
      MDC.put("status", transition.current().code().name());
      MDC.put("state", transition.current().state().name());
      if (transition.current().progressPercent() != null) {
        MDC.put("progress", String.valueOf(transition.current().progressPercent()));
      }

      logger.info(
          "Status change for '{}': {} -> {}",
          unit.getDisplayTitle(),
          transition.previous() == null ? "-" : transition.previous().label(),
          transition.current().label());
    } finally {
      clearEventFields();
    }
  }

  /** Log unit removed from monitoring. */
  public void logUnitRemoved(MonitoredUnit unit, RemovalReason reason) {
    try {
      MDC.put("event_type", "unit_removed");
      MDC.put("unit", unit.getIdentity().key());
      MDC.put("reason", reason.name());
      MDC.put("attempts", String.valueOf(unit.getAttemptCount()));

      logger.info(
          "Stopped monitoring '{}': unit={}, reason={}, attempts={}",
          unit.getDisplayTitle(),
          unit.getIdentity(),
          reason,
          unit.getAttemptCount());
    } finally {
      clearEventFields();
    }
  }

  /** Log completed poll cycle. */
  public void logPollCycle(int units, int backendCalls, int transitions, long durationMs) {
    try {
      MDC.put("event_type", "poll_cycle");
      MDC.put("units", String.valueOf(units));
      MDC.put("backendCalls", String.valueOf(backendCalls));
      MDC.put("transitions", String.valueOf(transitions));
      MDC.put("durationMs", String.valueOf(durationMs));

      logger.debug(
          "Poll cycle: units={}, queueCalls={}, transitions={}, took={}ms",
          units,
          backendCalls,
          transitions,
          durationMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log failed backend call. The affected units keep their status. */
  public void logBackendFailure(
      MediaKind kind, QualityTier tier, String operation, String message) {
    try {
      MDC.put("event_type", "backend_failure");
      MDC.put("kind", kind.name());
      MDC.put("tier", tier.name());
      MDC.put("operation", operation);

      logger.warn(
          "Backend call failed: kind={}, tier={}, operation={}, message={}",
          kind,
          tier,
          operation,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Log scheduled cleanup. */
  public void logCleanupScheduled(UnitIdentity identity, Duration delay) {
    try {
      MDC.put("event_type", "cleanup_scheduled");
      MDC.put("unit", identity.key());

      logger.debug("Cleanup scheduled: unit={}, delay={}s", identity, delay.toSeconds());
    } finally {
      clearEventFields();
    }
  }

  /** Set unit context in MDC. */
  public static void setUnitContext(UnitIdentity identity) {
    MDC.put("unit", identity.key());
    MDC.put("kind", identity.kind().name());
  }

  /** Clear unit context from MDC. */
  public static void clearUnitContext() {
    MDC.remove("unit");
    MDC.remove("kind");
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("unit");
    MDC.remove("backendRef");
    MDC.remove("tier");
    MDC.remove("kind");
    MDC.remove("status");
    MDC.remove("state");
    MDC.remove("progress");
    MDC.remove("reason");
    MDC.remove("attempts");
    MDC.remove("units");
    MDC.remove("backendCalls");
    MDC.remove("transitions");
    MDC.remove("durationMs");
    MDC.remove("operation");
  }
}
