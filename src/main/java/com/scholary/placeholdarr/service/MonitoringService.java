package com.scholary.placeholdarr.service;

import com.scholary.placeholdarr.config.MonitorProperties;
import com.scholary.placeholdarr.lookahead.EpisodeLookaheadSelector;
import com.scholary.placeholdarr.lookahead.EpisodeRange;
import com.scholary.placeholdarr.lookahead.EpisodeRef;
import com.scholary.placeholdarr.media.QualityTier;
import com.scholary.placeholdarr.placeholder.PlaceholderFileManager;
import com.scholary.placeholdarr.registry.MonitoredUnit;
import com.scholary.placeholdarr.registry.MonitoringRegistry;
import com.scholary.placeholdarr.registry.RemovalReason;
import com.scholary.placeholdarr.registry.UnitIdentity;
import com.scholary.placeholdarr.registry.UnitRegistration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point for the event handlers that feed the monitor.
 *
 * <p>Inserting and removing units is all an outside caller can do; status is written by the poller
 * alone. None of these operations perform backend I/O, so they are safe to call from a request
 * thread.
 */
@Service
public class MonitoringService {

  private static final Logger LOGGER = LoggerFactory.getLogger(MonitoringService.class);

  private final MonitoringRegistry registry;
  private final EpisodeLookaheadSelector selector;
  private final PlaceholderFileManager placeholderFiles;
  private final MonitorProperties properties;

  public MonitoringService(
      MonitoringRegistry registry,
      EpisodeLookaheadSelector selector,
      PlaceholderFileManager placeholderFiles,
      MonitorProperties properties) {
    this.registry = registry;
    this.selector = selector;
    this.placeholderFiles = placeholderFiles;
    this.properties = properties;
  }

  /**
   * Start monitoring a unit whose acquisition was just triggered.
   *
   * @return true if newly monitored, false if it already was
   */
  public boolean registerUnit(UnitRegistration registration) {
    return registry.add(registration);
  }

  public EpisodeRange computeLookahead(
      List<EpisodeRef> seriesEpisodes, EpisodeRef played, int lookahead, boolean includeSpecials) {
    return selector.computeLookahead(seriesEpisodes, played, lookahead, includeSpecials);
  }

  /** Apply the configured play mode, lookahead and specials policy. */
  public EpisodeRange selectEpisodes(List<EpisodeRef> seriesEpisodes, EpisodeRef played) {
    return selector.select(
        properties.playMode(),
        seriesEpisodes,
        played,
        properties.episodesLookahead(),
        properties.includeSpecials());
  }

  /**
   * Monitor every selected episode of a series.
   *
   * <p>Episodes without a backend id cannot be polled and are skipped.
   *
   * @param tvdbId series id
   * @param seriesTitle series title, used to build each episode's display title
   * @param tier backend tier of the series
   * @param selection episodes to monitor
   * @return identities newly added to the registry
   */
  public List<UnitIdentity> registerEpisodes(
      String tvdbId, String seriesTitle, QualityTier tier, EpisodeRange selection) {
    if (selection.isEmpty()) {
      LOGGER.debug("Nothing to acquire for '{}'", seriesTitle);
      return List.of();
    }
    List<UnitIdentity> added = new ArrayList<>();
    for (EpisodeRef ref : selection.episodes()) {
      if (ref.backendId() == null) {
        LOGGER.warn("No backend id for {} {}, not monitoring it", seriesTitle, ref.label());
        continue;
      }
      UnitIdentity identity = UnitIdentity.episode(tvdbId, ref.season(), ref.episode());
      UnitRegistration registration =
          new UnitRegistration(
              identity, ref.backendId(), seriesTitle + " - " + ref.label(), tier, null);
      if (registry.add(registration)) {
        added.add(identity);
      }
    }

    LOGGER.info(
        "Monitoring {} of {} selected episode(s) for '{}'",
        added.size(),
        selection.episodes().size(),
        seriesTitle);
    return added;
  }

  public Optional<MonitoredUnit> currentStatus(UnitIdentity identity) {
    return registry.find(identity);
  }

  public List<MonitoredUnit> listUnits() {
    return registry.all();
  }

  /**
   * The backend imported the real file: stop monitoring and delete the placeholder now.
   *
   * @return true if the unit was being monitored
   */
  public boolean markImported(UnitIdentity identity) {
    Optional<MonitoredUnit> removed = registry.remove(identity, RemovalReason.IMPORTED);
    removed.ifPresent(placeholderFiles::delete);
    return removed.isPresent();
  }

  /** Stop monitoring without touching the placeholder, e.g. when the media was deleted. */
  public boolean unregister(UnitIdentity identity) {
    return registry.remove(identity, RemovalReason.EXPLICIT).isPresent();
  }
}
