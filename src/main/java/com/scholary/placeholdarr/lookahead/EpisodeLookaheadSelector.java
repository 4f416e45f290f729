package com.scholary.placeholdarr.lookahead;

import java.util.ArrayList;
import java.util.List;
import java.util.NavigableMap;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Decides which episodes to acquire after an episode is played.
 *
 * <p>In {@link PlayMode#EPISODE} mode the selection is a window of {@code max(lookahead, 1)}
 * episode slots starting at the played episode. When the window runs past the highest known episode
 * number of a season, the overflow carries into the next known season starting at episode 1, as
 * many times as needed. Specials (season 0) take part only when enabled.
 *
 * <p>Only episodes without a file are returned.
 */
@Component
public class EpisodeLookaheadSelector {

  private static final Logger LOGGER = LoggerFactory.getLogger(EpisodeLookaheadSelector.class);

  /**
   * Select episodes for the given play mode.
   *
   * @param mode play mode policy
   * @param seriesEpisodes all known episodes of the series, any order
   * @param played the episode that was just played
   * @param lookahead window size for {@link PlayMode#EPISODE}
   * @param includeSpecials whether season 0 takes part
   * @return the selection
   */
  public EpisodeRange select(
      PlayMode mode,
      List<EpisodeRef> seriesEpisodes,
      EpisodeRef played,
      int lookahead,
      boolean includeSpecials) {
    switch (mode) {
      case EPISODE:
        return computeLookahead(seriesEpisodes, played, lookahead, includeSpecials);
      case SEASON:
        return selectSeason(seriesEpisodes, played, includeSpecials);
      case SERIES:
        return selectSeries(seriesEpisodes, includeSpecials);
      default:
        throw new IllegalArgumentException("Unsupported play mode: " + mode);
    }
  }

  /**
   * Compute the contiguous run of episodes starting at the played one.
   *
   * @param seriesEpisodes all known episodes of the series, any order
   * @param played the episode that was just played
   * @param lookahead number of episode slots, including the played one
   * @param includeSpecials whether season 0 takes part
   * @return episodes in {@code [played, end]} without a file, and whether the end reaches the last
   *     known episode
   */
  public EpisodeRange computeLookahead(
      List<EpisodeRef> seriesEpisodes, EpisodeRef played, int lookahead, boolean includeSpecials) {
    if (lookahead < 0) {
      throw new IllegalArgumentException("Lookahead must not be negative: " + lookahead);
    }
    if (played.isSpecial() && !includeSpecials) {
      return EpisodeRange.EMPTY;
    }

    List<EpisodeRef> known = eligible(seriesEpisodes, includeSpecials);
    if (known.isEmpty()) {
      return EpisodeRange.EMPTY;
    }

    NavigableMap<Integer, Integer> seasonMaxima = seasonMaxima(known);
    int season = played.season();
    int episode = played.episode();
    int remaining = Math.max(lookahead, 1) - 1;

    while (remaining > 0) {
      int seasonMax = Math.max(seasonMaxima.getOrDefault(season, episode), episode);
      int room = seasonMax - episode;
      if (remaining <= room) {
        episode += remaining;
        break;
      }
      Integer nextSeason = seasonMaxima.higherKey(season);
      if (nextSeason == null) {
        episode = seasonMax;
        break;
      }
      // Stepping onto episode 1 of the next season uses up one slot.
      remaining -= room + 1;
      season = nextSeason;
      episode = 1;
    }

    List<EpisodeRef> selected = between(known, played.season(), played.episode(), season, episode);
    EpisodeRef last = known.get(known.size() - 1);
    boolean reachedSeriesEnd = last.compareTo(season, episode) <= 0;

    LOGGER.debug(
        "Lookahead from {}: end=S{}E{}, selected={}, reachedSeriesEnd={}",
        played.label(),
        season,
        episode,
        selected.size(),
        reachedSeriesEnd);

    return new EpisodeRange(selected, reachedSeriesEnd);
  }

  private EpisodeRange selectSeason(
      List<EpisodeRef> seriesEpisodes, EpisodeRef played, boolean includeSpecials) {
    if (played.isSpecial() && !includeSpecials) {
      return EpisodeRange.EMPTY;
    }
    List<EpisodeRef> known = eligible(seriesEpisodes, includeSpecials);
    NavigableMap<Integer, Integer> seasonMaxima = seasonMaxima(known);
    Integer playedSeasonMax = seasonMaxima.get(played.season());
    if (playedSeasonMax == null) {
      return EpisodeRange.EMPTY;
    }

    int endSeason = played.season();
    int endEpisode = playedSeasonMax;
    Integer nextSeason = seasonMaxima.higherKey(played.season());
    if (played.episode() >= playedSeasonMax && nextSeason != null) {
      LOGGER.info(
          "Season {} finale played, adding season {}", played.season(), nextSeason);
      endSeason = nextSeason;
      endEpisode = seasonMaxima.get(nextSeason);
    }

    List<EpisodeRef> selected = between(known, played.season(), 0, endSeason, endEpisode);
    EpisodeRef last = known.get(known.size() - 1);
    return new EpisodeRange(selected, last.compareTo(endSeason, endEpisode) <= 0);
  }

  private EpisodeRange selectSeries(List<EpisodeRef> seriesEpisodes, boolean includeSpecials) {
    List<EpisodeRef> known = eligible(seriesEpisodes, includeSpecials);
    if (known.isEmpty()) {
      return EpisodeRange.EMPTY;
    }
    List<EpisodeRef> missing = new ArrayList<>();
    for (EpisodeRef ref : known) {
      if (!ref.hasFile()) {
        missing.add(ref);
      }
    }
    return new EpisodeRange(missing, true);
  }

  private static List<EpisodeRef> eligible(List<EpisodeRef> episodes, boolean includeSpecials) {
    List<EpisodeRef> eligible = new ArrayList<>();
    for (EpisodeRef ref : episodes) {
      if (includeSpecials || !ref.isSpecial()) {
        eligible.add(ref);
      }
    }
    eligible.sort(EpisodeRef.ORDER);
    return eligible;
  }

  private static NavigableMap<Integer, Integer> seasonMaxima(List<EpisodeRef> known) {
    NavigableMap<Integer, Integer> maxima = new TreeMap<>();
    for (EpisodeRef ref : known) {
      maxima.merge(ref.season(), ref.episode(), Math::max);
    }
    return maxima;
  }

  // Inclusive on both ends; known is sorted.
  private static List<EpisodeRef> between(
      List<EpisodeRef> known, int fromSeason, int fromEpisode, int toSeason, int toEpisode) {
    List<EpisodeRef> selected = new ArrayList<>();
    EpisodeRef previous = null;
    for (EpisodeRef ref : known) {
      if (ref.compareTo(fromSeason, fromEpisode) < 0 || ref.compareTo(toSeason, toEpisode) > 0) {
        continue;
      }
      if (previous != null && EpisodeRef.ORDER.compare(previous, ref) == 0) {
        continue;
      }
      previous = ref;
      if (!ref.hasFile()) {
        selected.add(ref);
      }
    }
    return selected;
  }
}
