package com.scholary.placeholdarr.registry;

import com.scholary.placeholdarr.media.MediaKind;
import java.util.Objects;

/**
 * External catalog identity of a unit, used as registry key.
 *
 * <p>Movies are keyed by TMDB id. Episodes are keyed by TVDB series id plus season and episode
 * number.
 */
public record UnitIdentity(MediaKind kind, String externalId, Integer season, Integer episode) {

  public UnitIdentity {
    Objects.requireNonNull(kind, "kind");
    if (externalId == null || externalId.isBlank()) {
      throw new IllegalArgumentException("External id must not be blank");
    }
    if (kind == MediaKind.EPISODE && (season == null || episode == null)) {
      throw new IllegalArgumentException("Episode identity requires season and episode numbers");
    }
    if (kind == MediaKind.MOVIE && (season != null || episode != null)) {
      throw new IllegalArgumentException("Movie identity cannot carry season or episode numbers");
    }
  }

  public static UnitIdentity movie(String tmdbId) {
    return new UnitIdentity(MediaKind.MOVIE, tmdbId, null, null);
  }

  public static UnitIdentity episode(String tvdbId, int season, int episode) {
    return new UnitIdentity(MediaKind.EPISODE, tvdbId, season, episode);
  }

  /** Compact key, e.g. {@code tmdb:42} or {@code tvdb:81189:s01:e02}. */
  public String key() {
    if (kind == MediaKind.MOVIE) {
      return "tmdb:" + externalId;
    }
    return String.format("tvdb:%s:s%02d:e%02d", externalId, season, episode);
  }

  @Override
  public String toString() {
    return key();
  }
}
