package com.scholary.placeholdarr.cleanup;

import com.scholary.placeholdarr.config.MonitorProperties;
import com.scholary.placeholdarr.logging.StructuredLogger;
import com.scholary.placeholdarr.placeholder.PlaceholderFileManager;
import com.scholary.placeholdarr.registry.MonitoredUnit;
import com.scholary.placeholdarr.registry.MonitoringRegistry;
import com.scholary.placeholdarr.registry.RegistryListener;
import com.scholary.placeholdarr.registry.RemovalReason;
import com.scholary.placeholdarr.registry.StatusTransition;
import com.scholary.placeholdarr.registry.UnitIdentity;
import com.scholary.placeholdarr.status.UnitState;
import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

/**
 * Schedules the delayed cleanup of a unit once it becomes Available.
 *
 * <p>After {@code monitor.cleanup-delay} the unit leaves the registry and its placeholder file is
 * deleted. The removal only applies to the registration that became Available, so an identity
 * removed and registered again in the meantime is left alone.
 */
@Component
public class CleanupTrigger implements RegistryListener {

  private static final Logger LOGGER = LoggerFactory.getLogger(CleanupTrigger.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final MonitoringRegistry registry;
  private final PlaceholderFileManager placeholderFiles;
  private final TaskScheduler scheduler;
  private final MonitorProperties properties;
  private final Clock clock;

  private final Map<UnitIdentity, PendingCleanup> pending = new ConcurrentHashMap<>();

  public CleanupTrigger(
      MonitoringRegistry registry,
      PlaceholderFileManager placeholderFiles,
      @Qualifier("monitorScheduler") TaskScheduler scheduler,
      MonitorProperties properties,
      Clock clock) {
    this.registry = registry;
    this.placeholderFiles = placeholderFiles;
    this.scheduler = scheduler;
    this.properties = properties;
    this.clock = clock;

    registry.addListener(this);
  }

  @Override
  public void onStatusChanged(StatusTransition transition) {
    if (transition.current().state() != UnitState.AVAILABLE) {
      return;
    }
    MonitoredUnit unit = transition.unit();
    long registrationId = unit.getRegistrationId();

    ScheduledFuture<?> future =
        scheduler.schedule(
            () -> cleanup(unit.getIdentity(), registrationId),
            clock.instant().plus(properties.cleanupDelay()));
    PendingCleanup previous =
        pending.put(unit.getIdentity(), new PendingCleanup(registrationId, future));
    if (previous != null) {
      previous.future().cancel(false);
    }
    structuredLogger.logCleanupScheduled(unit.getIdentity(), properties.cleanupDelay());
  }

  @Override
  public void onUnitRemoved(MonitoredUnit unit, RemovalReason reason) {
    if (reason == RemovalReason.AVAILABLE_CLEANUP) {
      return;
    }
    PendingCleanup cleanup = pending.remove(unit.getIdentity());
    if (cleanup != null) {
      cleanup.future().cancel(false);
      LOGGER.debug("Cancelled pending cleanup for {} ({})", unit.getIdentity(), reason);
    }
  }

  /** Number of cleanups waiting for their delay to elapse. */
  public int pendingCount() {
    return pending.size();
  }

  void cleanup(UnitIdentity identity, long registrationId) {
    pending.computeIfPresent(
        identity, (key, cleanup) -> cleanup.registrationId() == registrationId ? null : cleanup);
    registry
        .removeIfRegistration(identity, registrationId, RemovalReason.AVAILABLE_CLEANUP)
        .ifPresent(
            removed -> {
              int deleted = placeholderFiles.delete(removed);
              LOGGER.info(
                  "Cleaned up '{}': {} placeholder file(s) deleted",
                  removed.getDisplayTitle(),
                  deleted);
            });
  }

  private record PendingCleanup(long registrationId, ScheduledFuture<?> future) {}
}
