package com.scholary.placeholdarr.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.placeholdarr.backend.ArrBackendClient;
import com.scholary.placeholdarr.backend.BackendClient;
import com.scholary.placeholdarr.backend.BackendClients;
import com.scholary.placeholdarr.media.MediaKind;
import com.scholary.placeholdarr.media.QualityTier;
import com.scholary.placeholdarr.routing.QualityRouter;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the download backends.
 *
 * <p>Resolves the tier coordinates once through the {@link QualityRouter} and creates one client
 * per configured Radarr/Sonarr instance.
 */
@Configuration
@EnableConfigurationProperties(BackendProperties.class)
public class BackendConfig {

  private static final Duration RETRY_BASE_BACKOFF = Duration.ofSeconds(1);

  @Bean
  public QualityRouter qualityRouter(BackendProperties properties) {
    return new QualityRouter(properties);
  }

  @Bean
  public BackendClients backendClients(
      BackendProperties properties, QualityRouter router, ObjectMapper objectMapper) {
    List<BackendClient> clients = new ArrayList<>();
    for (MediaKind kind : MediaKind.values()) {
      for (QualityTier tier : QualityTier.values()) {
        router
            .find(kind, tier)
            .ifPresent(
                coordinates ->
                    clients.add(
                        new ArrBackendClient(
                            kind,
                            tier,
                            coordinates,
                            objectMapper,
                            Duration.ofSeconds(properties.connectTimeout()),
                            Duration.ofSeconds(properties.readTimeout()),
                            properties.maxRetries(),
                            properties.queuePageSize(),
                            RETRY_BASE_BACKOFF)));
      }
    }
    return new BackendClients(clients);
  }
}
