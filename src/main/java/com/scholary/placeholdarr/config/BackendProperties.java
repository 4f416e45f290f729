package com.scholary.placeholdarr.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the download backends.
 *
 * <p>Radarr serves movies and Sonarr serves episodes. Each has a mandatory standard instance and an
 * optional high-quality instance; a missing high-quality instance disables that tier for the kind.
 * Every instance names the library folder its files land in and the Plex section showing it.
 */
@ConfigurationProperties(prefix = "backends")
@Validated
public record BackendProperties(
    @Valid @NotNull Instance radarr,
    @Valid Instance radarrHighQuality,
    @Valid @NotNull Instance sonarr,
    @Valid Instance sonarrHighQuality,
    @Positive int connectTimeout,
    @Positive int readTimeout,
    @Positive int maxRetries,
    @Positive int queuePageSize) {

  public record Instance(
      @NotBlank String url,
      @NotBlank String apiKey,
      @NotBlank String libraryFolder,
      @Positive int sectionId) {}
}
