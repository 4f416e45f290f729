package com.scholary.placeholdarr.poller;

import com.scholary.placeholdarr.backend.BackendClient;
import com.scholary.placeholdarr.backend.BackendClients;
import com.scholary.placeholdarr.backend.BackendClients.BackendKey;
import com.scholary.placeholdarr.backend.BackendException;
import com.scholary.placeholdarr.backend.BackendQueueItem;
import com.scholary.placeholdarr.config.MonitorProperties;
import com.scholary.placeholdarr.logging.StructuredLogger;
import com.scholary.placeholdarr.registry.MonitoredUnit;
import com.scholary.placeholdarr.registry.MonitoringRegistry;
import com.scholary.placeholdarr.registry.RegistryListener;
import com.scholary.placeholdarr.registry.RemovalReason;
import com.scholary.placeholdarr.registry.UnitIdentity;
import com.scholary.placeholdarr.status.DisplayStatus;
import com.scholary.placeholdarr.status.StatusCode;
import com.scholary.placeholdarr.status.StatusVocabulary;
import com.scholary.placeholdarr.status.UnitState;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

/**
 * Recurring task that polls the backend queues for every monitored unit.
 *
 * <p>One task for the whole registry, never one timer per unit. Each cycle:
 *
 * <ol>
 *   <li>snapshot the registry, stopping if it is empty (the next first insertion restarts it)
 *   <li>count the cycle against every unit and expire units past the time or attempt ceiling
 *   <li>fetch the queue once per distinct (kind, quality tier)
 *   <li>join every unit against its backend's queue by backend id and apply the resulting status
 * </ol>
 *
 * <p>Backend I/O happens outside the registry lock; only the status updates take it. A failing
 * backend leaves its units untouched for the cycle while the other backends proceed.
 */
@Component
public class BatchPoller implements RegistryListener {

  private static final Logger LOGGER = LoggerFactory.getLogger(BatchPoller.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final MonitoringRegistry registry;
  private final BackendClients backends;
  private final StatusVocabulary vocabulary;
  private final TaskScheduler scheduler;
  private final MonitorProperties properties;
  private final Clock clock;

  private final AtomicBoolean running = new AtomicBoolean();
  private volatile ScheduledFuture<?> nextCycle;

  public BatchPoller(
      MonitoringRegistry registry,
      BackendClients backends,
      StatusVocabulary vocabulary,
      @Qualifier("monitorScheduler") TaskScheduler scheduler,
      MonitorProperties properties,
      Clock clock) {
    this.registry = registry;
    this.backends = backends;
    this.vocabulary = vocabulary;
    this.scheduler = scheduler;
    this.properties = properties;
    this.clock = clock;

    registry.addListener(this);
  }

  @Override
  public void onUnitAdded(MonitoredUnit unit, boolean firstUnit) {
    if (firstUnit) {
      wake();
    }
  }

  /**
   * Start the cycle if it is idle.
   *
   * @return true if this call started it
   */
  public boolean wake() {
    if (!running.compareAndSet(false, true)) {
      return false;
    }
    LOGGER.info(
        "Started batch monitoring (interval: {}s)", properties.checkInterval().toSeconds());
    scheduleNext();
    return true;
  }

  public boolean isRunning() {
    return running.get();
  }

  /** Execute one poll cycle and schedule the next one, unless the registry is empty. */
  public void runCycle() {
    List<MonitoredUnit> snapshot = registry.all();
    if (snapshot.isEmpty()) {
      stopIfIdle();
      return;
    }

    try {
      pollOnce(snapshot);
    } catch (RuntimeException e) {
      LOGGER.error("Error in batch check", e);
    }
    scheduleNext();
  }

  @PreDestroy
  public void shutdown() {
    ScheduledFuture<?> pending = nextCycle;
    if (pending != null) {
      pending.cancel(false);
    }
    running.set(false);
  }

  private void scheduleNext() {
    nextCycle =
        scheduler.schedule(this::runCycle, clock.instant().plus(properties.checkInterval()));
  }

  private void stopIfIdle() {
    running.set(false);
    nextCycle = null;
    LOGGER.debug("Registry empty, batch monitoring stopped");

    // An insertion may have slipped in while the flag was still set.
    if (!registry.isEmpty()) {
      wake();
    }
  }

  private void pollOnce(List<MonitoredUnit> snapshot) {
    long started = System.currentTimeMillis();
    Instant now = clock.instant();
    int transitions = 0;

    Map<BackendKey, List<MonitoredUnit>> groups = new LinkedHashMap<>();
    for (MonitoredUnit unit : snapshot) {
      if (unit.getState() == UnitState.AVAILABLE) {
        // Waiting for its cleanup action.
        continue;
      }
      Optional<MonitoredUnit> counted = registry.recordAttempt(unit.getIdentity());
      if (counted.isEmpty()) {
        continue;
      }
      MonitoredUnit current = counted.get();
      RemovalReason expiry = expiryReason(current, now);
      if (expiry != null) {
        LOGGER.info(
            "Giving up on '{}' after {} attempt(s): {}",
            current.getDisplayTitle(),
            current.getAttemptCount(),
            expiry);
        if (registry.expire(current.getIdentity(), expiry).isPresent()) {
          transitions++;
        }
        continue;
      }
      groups
          .computeIfAbsent(
              new BackendKey(current.getKind(), current.getQualityTier()), k -> new ArrayList<>())
          .add(current);
    }

    int queueCalls = 0;
    for (Map.Entry<BackendKey, List<MonitoredUnit>> group : groups.entrySet()) {
      BackendKey key = group.getKey();
      Optional<BackendClient> client = backends.find(key.kind(), key.tier());
      if (client.isEmpty()) {
        LOGGER.warn(
            "No backend configured for {}/{}, skipping {} unit(s)",
            key.kind(),
            key.tier(),
            group.getValue().size());
        continue;
      }

      List<BackendQueueItem> queue;
      queueCalls++;
      try {
        queue = client.get().fetchQueue();
      } catch (BackendException e) {
        structuredLogger.logBackendFailure(key.kind(), key.tier(), "fetchQueue", e.getMessage());
        continue;
      }

      Map<Long, BackendQueueItem> byUnit = new HashMap<>();
      for (BackendQueueItem item : queue) {
        byUnit.putIfAbsent(item.backendUnitId(), item);
      }

      for (MonitoredUnit unit : group.getValue()) {
        if (evaluate(unit, byUnit.get(unit.getBackendRef()), client.get())) {
          transitions++;
        }
      }
    }

    structuredLogger.logPollCycle(
        snapshot.size(), queueCalls, transitions, System.currentTimeMillis() - started);
  }

  private RemovalReason expiryReason(MonitoredUnit unit, Instant now) {
    if (Duration.between(unit.getStartedAt(), now).compareTo(properties.maxMonitorTime()) > 0) {
      return RemovalReason.TIMED_OUT;
    }
    if (unit.getAttemptCount() > properties.maxAttempts()) {
      return RemovalReason.ATTEMPTS_EXHAUSTED;
    }
    return null;
  }

  private boolean evaluate(MonitoredUnit unit, BackendQueueItem item, BackendClient client) {
    UnitIdentity identity = unit.getIdentity();
    StructuredLogger.setUnitContext(identity);
    try {
      if (item != null) {
        DisplayStatus status = vocabulary.classify(item);
        if (status.code() == StatusCode.RETRYING) {
          registry.markRetrying(identity);
        }
        return registry.updateStatus(identity, status);
      }

      if (shouldConfirmFile(unit)) {
        try {
          if (client.fetchUnit(unit.getBackendRef()).hasFile()) {
            return registry.updateStatus(identity, DisplayStatus.AVAILABLE);
          }
        } catch (BackendException e) {
          structuredLogger.logBackendFailure(
              unit.getKind(), unit.getQualityTier(), "fetchUnit", e.getMessage());
          return false;
        }
      }

      return registry.updateStatus(identity, statusWhileAbsent(unit));
    } finally {
      StructuredLogger.clearUnitContext();
    }
  }

  // Units never sighted in a queue are only confirmed every few cycles to spare the backend.
  private boolean shouldConfirmFile(MonitoredUnit unit) {
    return unit.isSeenInQueue()
        || unit.isRetrying()
        || unit.getAttemptCount() % properties.searchingConfirmEvery() == 0;
  }

  private DisplayStatus statusWhileAbsent(MonitoredUnit unit) {
    if (unit.getStatus().code() == StatusCode.PROCESSING) {
      // Left the queue for import, the file shows up shortly.
      return DisplayStatus.PROCESSING;
    }
    if (unit.isSeenInQueue() || unit.isRetrying()) {
      registry.markRetrying(unit.getIdentity());
      return DisplayStatus.RETRYING;
    }
    return DisplayStatus.SEARCHING;
  }
}
