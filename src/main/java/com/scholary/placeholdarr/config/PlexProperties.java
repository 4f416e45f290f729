package com.scholary.placeholdarr.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the Plex catalog client.
 *
 * <p>Timeouts are in seconds. Title updates run on their own bounded pool so that a slow Plex
 * server never holds up the poll cycle.
 */
@ConfigurationProperties(prefix = "plex")
@Validated
public record PlexProperties(
    @NotBlank String baseUrl,
    @NotBlank String token,
    @Positive int connectTimeout,
    @Positive int readTimeout,
    @Positive int maxRetries,
    @Positive int lookupCacheMinutes,
    @Positive int lookupCacheSize,
    @Positive int updateThreads,
    @Positive int updateQueueSize) {}
