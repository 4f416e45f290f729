package com.scholary.placeholdarr.registry;

/**
 * Callbacks fired by {@link MonitoringRegistry}.
 *
 * <p>Callbacks run on the mutating thread after the registry lock has been released, so they may
 * call back into the registry. Exceptions are logged by the registry and never propagated.
 */
public interface RegistryListener {

  /**
   * A unit was newly inserted.
   *
   * @param unit snapshot of the inserted unit
   * @param firstUnit true if the registry was empty before the insertion
   */
  default void onUnitAdded(MonitoredUnit unit, boolean firstUnit) {}

  default void onStatusChanged(StatusTransition transition) {}

  default void onUnitRemoved(MonitoredUnit unit, RemovalReason reason) {}
}
