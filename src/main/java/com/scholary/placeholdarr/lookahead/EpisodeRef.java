package com.scholary.placeholdarr.lookahead;

import java.util.Comparator;

/**
 * A known episode of a series.
 *
 * @param season season number, 0 for specials
 * @param episode episode number within the season
 * @param hasFile whether the real file is already present
 * @param backendId Sonarr episode id, may be null when unknown
 */
public record EpisodeRef(int season, int episode, boolean hasFile, Long backendId) {

  public static final Comparator<EpisodeRef> ORDER =
      Comparator.comparingInt(EpisodeRef::season).thenComparingInt(EpisodeRef::episode);

  public EpisodeRef {
    if (season < 0 || episode < 0) {
      throw new IllegalArgumentException(
          String.format("Season and episode must not be negative: S%dE%d", season, episode));
    }
  }

  /** A position only, e.g. the episode that was just played. */
  public static EpisodeRef at(int season, int episode) {
    return new EpisodeRef(season, episode, false, null);
  }

  public boolean isSpecial() {
    return season == 0;
  }

  /** Compares positions only, ignoring file state and backend id. */
  public int compareTo(int otherSeason, int otherEpisode) {
    if (season != otherSeason) {
      return Integer.compare(season, otherSeason);
    }
    return Integer.compare(episode, otherEpisode);
  }

  public String label() {
    return String.format("S%02dE%02d", season, episode);
  }
}
