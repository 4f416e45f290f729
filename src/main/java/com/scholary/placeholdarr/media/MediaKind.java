package com.scholary.placeholdarr.media;

/** The two kinds of trackable media unit. Movies are served by Radarr, episodes by Sonarr. */
public enum MediaKind {
  MOVIE,
  EPISODE
}
