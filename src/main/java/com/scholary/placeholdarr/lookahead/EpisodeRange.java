package com.scholary.placeholdarr.lookahead;

import java.util.List;

/**
 * Episodes to acquire together, ordered by season then episode.
 *
 * @param episodes episodes without a file, may be empty when all already have files
 * @param reachedSeriesEnd true if the selection reaches the last known episode of the series, in
 *     which case callers monitor the whole series rather than extending the range again later
 */
public record EpisodeRange(List<EpisodeRef> episodes, boolean reachedSeriesEnd) {

  public static final EpisodeRange EMPTY = new EpisodeRange(List.of(), false);

  public EpisodeRange {
    episodes = List.copyOf(episodes);
  }

  public boolean isEmpty() {
    return episodes.isEmpty();
  }
}
