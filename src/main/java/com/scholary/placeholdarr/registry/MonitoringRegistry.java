package com.scholary.placeholdarr.registry;

import com.scholary.placeholdarr.logging.StructuredLogger;
import com.scholary.placeholdarr.status.DisplayStatus;
import com.scholary.placeholdarr.status.UnitState;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

/**
 * In-memory table of units currently awaiting a file.
 *
 * <p>All reads and writes go through a single lock owned by the registry. Every operation is an
 * O(1) map mutation, never I/O. Callers only receive copies of the stored units, so {@link #all()}
 * is a stable snapshot that concurrent removals cannot disturb.
 *
 * <p>Listener callbacks are collected while the lock is held and dispatched after it is released.
 * The registry is volatile: a restart loses all tracking.
 */
@Repository
public class MonitoringRegistry {

  private static final Logger LOGGER = LoggerFactory.getLogger(MonitoringRegistry.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final ReentrantLock lock = new ReentrantLock();
  private final Map<UnitIdentity, MonitoredUnit> units = new LinkedHashMap<>();
  private final List<RegistryListener> listeners = new CopyOnWriteArrayList<>();
  private final AtomicLong registrationSequence = new AtomicLong();
  private final Clock clock;

  public MonitoringRegistry(Clock clock) {
    this.clock = clock;
  }

  public void addListener(RegistryListener listener) {
    listeners.add(listener);
  }

  /**
   * Start monitoring a unit.
   *
   * @param registration the unit to monitor
   * @return true if newly added, false if the identity was already monitored
   */
  public boolean add(UnitRegistration registration) {
    MonitoredUnit added;
    boolean firstUnit;

    lock.lock();
    try {
      if (units.containsKey(registration.identity())) {
        LOGGER.debug("Already monitoring {}, ignoring duplicate add", registration.identity());
        return false;
      }
      firstUnit = units.isEmpty();
      MonitoredUnit unit =
          new MonitoredUnit(registration, registrationSequence.incrementAndGet(), clock.instant());
      units.put(unit.getIdentity(), unit);
      added = unit.copy();
    } finally {
      lock.unlock();
    }

    structuredLogger.logUnitAdded(added);
    notifyListeners(listener -> listener.onUnitAdded(added, firstUnit));
    return true;
  }

  /**
   * Stop monitoring a unit.
   *
   * @return the removed unit, or empty if it was not monitored
   */
  public Optional<MonitoredUnit> remove(UnitIdentity identity, RemovalReason reason) {
    MonitoredUnit removed;
    lock.lock();
    try {
      MonitoredUnit unit = units.remove(identity);
      if (unit == null) {
        return Optional.empty();
      }
      removed = unit.copy();
    } finally {
      lock.unlock();
    }

    fireRemoved(removed, reason);
    return Optional.of(removed);
  }

  /**
   * Remove a unit only if it is still the same registration.
   *
   * <p>Used by delayed actions so that an identity removed and re-added in the meantime is left
   * alone.
   */
  public Optional<MonitoredUnit> removeIfRegistration(
      UnitIdentity identity, long registrationId, RemovalReason reason) {
    MonitoredUnit removed;
    lock.lock();
    try {
      MonitoredUnit unit = units.get(identity);
      if (unit == null || unit.getRegistrationId() != registrationId) {
        return Optional.empty();
      }
      units.remove(identity);
      removed = unit.copy();
    } finally {
      lock.unlock();
    }

    fireRemoved(removed, reason);
    return Optional.of(removed);
  }

  /**
   * Apply a new display status.
   *
   * <p>A vanished identity and an unchanged status are both no-ops that emit nothing.
   *
   * @return true if a transition was emitted
   */
  public boolean updateStatus(UnitIdentity identity, DisplayStatus status) {
    StatusTransition transition;
    lock.lock();
    try {
      MonitoredUnit unit = units.get(identity);
      if (unit == null || unit.getStatus().equals(status)) {
        return false;
      }
      transition = applyStatus(unit, status);
    } finally {
      lock.unlock();
    }

    fireTransition(transition);
    return true;
  }

  /**
   * Count one more poll cycle against a unit.
   *
   * @return copy of the unit after the increment, or empty if it vanished
   */
  public Optional<MonitoredUnit> recordAttempt(UnitIdentity identity) {
    lock.lock();
    try {
      MonitoredUnit unit = units.get(identity);
      if (unit == null) {
        return Optional.empty();
      }
      unit.setAttemptCount(unit.getAttemptCount() + 1);
      return Optional.of(unit.copy());
    } finally {
      lock.unlock();
    }
  }

  /**
   * Set the retry flag. The first time it is set the timeout clock restarts, giving the backend a
   * full monitoring window for its next attempt.
   *
   * @return true if the flag was newly set
   */
  public boolean markRetrying(UnitIdentity identity) {
    lock.lock();
    try {
      MonitoredUnit unit = units.get(identity);
      if (unit == null || unit.isRetrying()) {
        return false;
      }
      unit.setRetrying(true);
      unit.setStartedAt(clock.instant());
      return true;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Terminal outcome: apply "Not Found" and remove the unit in one step.
   *
   * @return the expired unit, or empty if it had already vanished
   */
  public Optional<MonitoredUnit> expire(UnitIdentity identity, RemovalReason reason) {
    StatusTransition transition;
    MonitoredUnit removed;
    lock.lock();
    try {
      MonitoredUnit unit = units.remove(identity);
      if (unit == null) {
        return Optional.empty();
      }
      transition = applyStatus(unit, DisplayStatus.notFound(unit.isRetrying()));
      removed = transition.unit();
    } finally {
      lock.unlock();
    }

    fireTransition(transition);
    fireRemoved(removed, reason);
    return Optional.of(removed);
  }

  public Optional<MonitoredUnit> find(UnitIdentity identity) {
    lock.lock();
    try {
      MonitoredUnit unit = units.get(identity);
      return unit == null ? Optional.empty() : Optional.of(unit.copy());
    } finally {
      lock.unlock();
    }
  }

  /** Snapshot of every monitored unit, in insertion order. */
  public List<MonitoredUnit> all() {
    lock.lock();
    try {
      List<MonitoredUnit> snapshot = new ArrayList<>(units.size());
      for (MonitoredUnit unit : units.values()) {
        snapshot.add(unit.copy());
      }
      return List.copyOf(snapshot);
    } finally {
      lock.unlock();
    }
  }

  public int size() {
    lock.lock();
    try {
      return units.size();
    } finally {
      lock.unlock();
    }
  }

  public boolean isEmpty() {
    return size() == 0;
  }

  // Caller holds the lock.
  private StatusTransition applyStatus(MonitoredUnit unit, DisplayStatus status) {
    Instant now = clock.instant();
    DisplayStatus previous = unit.getStatus();
    unit.setStatus(status);
    unit.setLastTransitionAt(now);
    if (status.state() == UnitState.DOWNLOADING) {
      unit.setSeenInQueue(true);
    }
    return new StatusTransition(unit.copy(), previous, status, now);
  }

  private void fireTransition(StatusTransition transition) {
    structuredLogger.logStatusTransition(transition);
    notifyListeners(listener -> listener.onStatusChanged(transition));
  }

  private void fireRemoved(MonitoredUnit unit, RemovalReason reason) {
    structuredLogger.logUnitRemoved(unit, reason);
    notifyListeners(listener -> listener.onUnitRemoved(unit, reason));
  }

  private void notifyListeners(Consumer<RegistryListener> callback) {
    for (RegistryListener listener : listeners) {
      try {
        callback.accept(listener);
      } catch (RuntimeException e) {
        LOGGER.error("Registry listener {} failed", listener.getClass().getSimpleName(), e);
      }
    }
  }
}
