package com.scholary.placeholdarr.config;

import com.scholary.placeholdarr.lookahead.PlayMode;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the monitoring engine.
 *
 * <p>Controls the poll interval, the terminal ceilings, the cleanup grace delay and the episode
 * lookahead policy.
 */
@ConfigurationProperties(prefix = "monitor")
@Validated
public record MonitorProperties(
    @NotNull Duration checkInterval,
    @NotNull Duration maxMonitorTime,
    @Positive int maxAttempts,
    @NotNull Duration cleanupDelay,
    @Positive int searchingConfirmEvery,
    @PositiveOrZero int episodesLookahead,
    boolean includeSpecials,
    @NotNull PlayMode playMode,
    boolean titleUpdates,
    @Positive int schedulerThreads) {}
