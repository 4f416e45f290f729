package com.scholary.placeholdarr.lookahead;

/** How much of a series to acquire when one of its episodes is played. */
public enum PlayMode {
  /** The played episode plus a fixed lookahead, crossing season boundaries. */
  EPISODE,
  /** The played season, plus the next one when the season finale was played. */
  SEASON,
  /** Every episode of the series. */
  SERIES
}
