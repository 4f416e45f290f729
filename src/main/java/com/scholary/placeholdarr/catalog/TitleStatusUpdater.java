package com.scholary.placeholdarr.catalog;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.scholary.placeholdarr.config.MonitorProperties;
import com.scholary.placeholdarr.registry.MonitoredUnit;
import com.scholary.placeholdarr.registry.MonitoringRegistry;
import com.scholary.placeholdarr.registry.RegistryListener;
import com.scholary.placeholdarr.registry.StatusTransition;
import com.scholary.placeholdarr.registry.UnitIdentity;
import com.scholary.placeholdarr.status.DisplayStatus;
import com.scholary.placeholdarr.status.TitleFormatter;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Mirrors every status change into the catalog title of the placeholder.
 *
 * <p>Viewers browsing the library see e.g. {@code "Dune - Downloading 42%"}. Catalog calls run on
 * the title update executor, never on the thread mutating the registry. Failures are logged and the
 * next transition tries again.
 *
 * <p>Renames of one unit are applied one at a time and in submission order. A rename that starts
 * after a newer one for the same unit is dropped, so the catalog ends on the latest status even
 * when the executor runs several updates concurrently.
 */
@Component
public class TitleStatusUpdater implements RegistryListener {

  private static final Logger LOGGER = LoggerFactory.getLogger(TitleStatusUpdater.class);

  private static final Duration ORDER_RETENTION = Duration.ofHours(1);

  private final CatalogClient catalog;
  private final Executor executor;
  private final boolean enabled;

  private final AtomicLong sequence = new AtomicLong();
  private final Cache<UnitIdentity, RenameOrder> orders =
      Caffeine.newBuilder().expireAfterAccess(ORDER_RETENTION).build();

  public TitleStatusUpdater(
      MonitoringRegistry registry,
      CatalogClient catalog,
      @Qualifier("titleUpdateExecutor") Executor executor,
      MonitorProperties properties) {
    this.catalog = catalog;
    this.executor = executor;
    this.enabled = properties.titleUpdates();

    registry.addListener(this);
    LOGGER.info("Catalog title updates {}", enabled ? "enabled" : "disabled");
  }

  @Override
  public void onUnitAdded(MonitoredUnit unit, boolean firstUnit) {
    submit(unit, unit.getStatus());
  }

  @Override
  public void onStatusChanged(StatusTransition transition) {
    submit(transition.unit(), transition.current());
  }

  private void submit(MonitoredUnit unit, DisplayStatus status) {
    if (!enabled) {
      return;
    }
    long seq = sequence.incrementAndGet();
    try {
      executor.execute(() -> applyInOrder(unit, status, seq));
    } catch (RejectedExecutionException e) {
      LOGGER.warn(
          "Title update queue full, skipping '{}' -> {}", unit.getDisplayTitle(), status.label());
    }
  }

  private void applyInOrder(MonitoredUnit unit, DisplayStatus status, long seq) {
    RenameOrder order = orders.get(unit.getIdentity(), identity -> new RenameOrder());
    synchronized (order) {
      if (seq <= order.lastStarted) {
        LOGGER.debug(
            "Skipping superseded title '{}' for {}", status.label(), unit.getIdentity());
        return;
      }
      order.lastStarted = seq;
      apply(unit, status);
    }
  }

  void apply(MonitoredUnit unit, DisplayStatus status) {
    String title = TitleFormatter.compose(unit.getDisplayTitle(), status);
    try {
      Optional<String> catalogRef =
          Optional.ofNullable(unit.getCatalogRef())
              .or(() -> catalog.findCatalogRef(unit.getIdentity(), unit.getQualityTier()));
      if (catalogRef.isEmpty()) {
        LOGGER.debug("No catalog item for {} yet, title not updated", unit.getIdentity());
        return;
      }
      if (catalog.renameTitle(
          unit.getIdentity(), unit.getQualityTier(), catalogRef.get(), title)) {
        LOGGER.info("Updated title for {} to: {}", unit.getIdentity(), title);
      }
    } catch (CatalogException e) {
      LOGGER.warn("Failed to update title for {}: {}", unit.getIdentity(), e.getMessage());
    }
  }

  // Guarded by its own monitor.
  private static final class RenameOrder {
    private long lastStarted;
  }
}
