package com.scholary.placeholdarr.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.placeholdarr.catalog.CatalogClient;
import com.scholary.placeholdarr.catalog.PlexCatalogClient;
import com.scholary.placeholdarr.routing.QualityRouter;
import java.time.Duration;
import java.util.concurrent.Executor;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Configuration for the Plex catalog.
 *
 * <p>Sets up the catalog client and a bounded thread pool for title updates. The queue capacity
 * caps how many pending renames may pile up while Plex is slow.
 */
@Configuration
@EnableConfigurationProperties(PlexProperties.class)
public class PlexConfig {

  private static final Duration RETRY_BASE_BACKOFF = Duration.ofSeconds(1);

  @Bean
  public CatalogClient catalogClient(
      PlexProperties properties, QualityRouter router, ObjectMapper objectMapper) {
    return new PlexCatalogClient(properties, router, objectMapper, RETRY_BASE_BACKOFF);
  }

  @Bean(name = "titleUpdateExecutor")
  public Executor titleUpdateExecutor(PlexProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.updateThreads());
    executor.setMaxPoolSize(properties.updateThreads());
    executor.setQueueCapacity(properties.updateQueueSize());
    executor.setThreadNamePrefix("plex-");
    executor.initialize();
    return executor;
  }
}
