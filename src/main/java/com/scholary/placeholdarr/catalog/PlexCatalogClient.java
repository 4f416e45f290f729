package com.scholary.placeholdarr.catalog;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.scholary.placeholdarr.config.PlexProperties;
import com.scholary.placeholdarr.media.MediaKind;
import com.scholary.placeholdarr.media.QualityTier;
import com.scholary.placeholdarr.registry.UnitIdentity;
import com.scholary.placeholdarr.routing.QualityRouter;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP client for the Plex Media Server library API.
 *
 * <p>Items are located by their agent GUID ({@code tmdb://} for movies, {@code tvdb://} for the
 * show of an episode) within the library section of the unit's tier. Successful lookups are cached
 * with Caffeine; misses are not, since a placeholder may simply not be scanned yet.
 *
 * <p>Transient failures (I/O errors and 5xx answers) are retried with exponential backoff.
 */
public class PlexCatalogClient implements CatalogClient {

  private static final Logger LOGGER = LoggerFactory.getLogger(PlexCatalogClient.class);

  private static final int TYPE_MOVIE = 1;
  private static final int TYPE_SHOW = 2;
  private static final int TYPE_EPISODE = 4;

  private final PlexProperties properties;
  private final QualityRouter router;
  private final ObjectMapper objectMapper;
  private final Duration baseBackoff;
  private final HttpClient httpClient;
  private final Cache<String, String> lookups;
  private final String baseUrl;

  public PlexCatalogClient(
      PlexProperties properties,
      QualityRouter router,
      ObjectMapper objectMapper,
      Duration baseBackoff) {
    this.properties = properties;
    this.router = router;
    this.objectMapper = objectMapper;
    this.baseBackoff = baseBackoff;
    this.baseUrl = properties.baseUrl().replaceAll("/+$", "");

    this.httpClient =
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
            .build();

    this.lookups =
        Caffeine.newBuilder()
            .maximumSize(properties.lookupCacheSize())
            .expireAfterWrite(Duration.ofMinutes(properties.lookupCacheMinutes()))
            .recordStats()
            .build();

    LOGGER.info("Initialized Plex catalog client: baseUrl={}", baseUrl);
  }

  @Override
  public Optional<String> findCatalogRef(UnitIdentity identity, QualityTier tier) {
    String cacheKey = tier + ":" + identity.key();
    String cached = lookups.getIfPresent(cacheKey);
    if (cached != null) {
      LOGGER.debug("Catalog lookup cache hit: key={}", cacheKey);
      return Optional.of(cached);
    }

    int section = router.route(identity.kind(), tier).catalogSectionId();
    Optional<String> found =
        identity.kind() == MediaKind.MOVIE
            ? findMovie(section, identity.externalId())
            : findEpisode(section, identity);

    found.ifPresent(ref -> lookups.put(cacheKey, ref));
    if (found.isEmpty()) {
      LOGGER.debug("No catalog item for {} in section {}", identity, section);
    }
    return found;
  }

  @Override
  public boolean renameTitle(
      UnitIdentity identity, QualityTier tier, String catalogRef, String title) {
    int section = router.route(identity.kind(), tier).catalogSectionId();
    int type = identity.kind() == MediaKind.MOVIE ? TYPE_MOVIE : TYPE_EPISODE;
    String path =
        String.format(
            "/library/sections/%d/all?type=%d&id=%s&title.value=%s&title.locked=1",
            section, type, encode(catalogRef), encode(title));

    boolean renamed = sendWithRetry("PUT", path).isPresent();
    if (renamed) {
      LOGGER.debug("Renamed catalog item {} to '{}'", catalogRef, title);
    } else {
      // Stale reference, look it up again next time.
      lookups.invalidate(tier + ":" + identity.key());
      LOGGER.info("Catalog item {} no longer exists, title not updated", catalogRef);
    }
    return renamed;
  }

  /** Lookup cache statistics for monitoring. */
  public String getStats() {
    var stats = lookups.stats();
    return String.format(
        "CatalogLookups[size=%d, hitRate=%.2f%%, evictions=%d]",
        lookups.estimatedSize(), stats.hitRate() * 100, stats.evictionCount());
  }

  private Optional<String> findMovie(int section, String tmdbId) {
    return sendWithRetry("GET", guidQuery(section, TYPE_MOVIE, "tmdb://" + tmdbId))
        .flatMap(PlexCatalogClient::firstRatingKey);
  }

  private Optional<String> findEpisode(int section, UnitIdentity identity) {
    Optional<String> show =
        sendWithRetry("GET", guidQuery(section, TYPE_SHOW, "tvdb://" + identity.externalId()))
            .flatMap(PlexCatalogClient::firstRatingKey);
    if (show.isEmpty()) {
      return Optional.empty();
    }

    Optional<JsonNode> leaves =
        sendWithRetry("GET", "/library/metadata/" + encode(show.get()) + "/allLeaves");
    if (leaves.isEmpty()) {
      return Optional.empty();
    }
    for (JsonNode episode : leaves.get().path("MediaContainer").path("Metadata")) {
      if (episode.path("parentIndex").asInt(-1) == identity.season()
          && episode.path("index").asInt(-1) == identity.episode()) {
        return Optional.of(episode.path("ratingKey").asText());
      }
    }
    return Optional.empty();
  }

  private static String guidQuery(int section, int type, String guid) {
    return String.format("/library/sections/%d/all?type=%d&guid=%s", section, type, encode(guid));
  }

  private static Optional<String> firstRatingKey(JsonNode body) {
    for (JsonNode item : body.path("MediaContainer").path("Metadata")) {
      String ratingKey = item.path("ratingKey").asText("");
      if (!ratingKey.isEmpty()) {
        return Optional.of(ratingKey);
      }
    }
    return Optional.empty();
  }

  /**
   * Send a request, retrying transient failures.
   *
   * @return parsed body, or empty if Plex answered 404
   * @throws CatalogException on any other failure once retries are exhausted
   */
  private Optional<JsonNode> sendWithRetry(String method, String path) {
    int attempt = 0;
    Exception lastException = null;

    while (attempt < properties.maxRetries()) {
      try {
        return attemptSend(method, path);
      } catch (IOException e) {
        lastException = e;
        attempt++;
        if (attempt < properties.maxRetries()) {
          // Exponential backoff with jitter
          long backoffMs =
              (long) (Math.pow(2, attempt - 1) * baseBackoff.toMillis()
                  + Math.random() * baseBackoff.toMillis());
          LOGGER.warn(
              "Plex request {} attempt {} failed, retrying in {}ms: {}",
              method,
              attempt,
              backoffMs,
              e.getMessage());
          try {
            Thread.sleep(backoffMs);
          } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new CatalogException("Plex retry interrupted", ie);
          }
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new CatalogException("Plex request interrupted", e);
      }
    }

    throw new CatalogException(
        String.format("Plex %s request failed after %d attempts", method, properties.maxRetries()),
        lastException);
  }

  private Optional<JsonNode> attemptSend(String method, String path)
      throws IOException, InterruptedException {
    HttpRequest request =
        HttpRequest.newBuilder()
            .uri(URI.create(baseUrl + path))
            .timeout(Duration.ofSeconds(properties.readTimeout()))
            .header("X-Plex-Token", properties.token())
            .header("Accept", "application/json")
            .method(method, HttpRequest.BodyPublishers.noBody())
            .build();

    LOGGER.debug("Sending Plex request {} {}", method, request.uri());

    HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

    int status = response.statusCode();
    if (status >= 500) {
      throw new IOException(String.format("Plex returned status %d: %s", status, response.body()));
    }
    if (status == 404) {
      return Optional.empty();
    }
    if (status < 200 || status >= 300) {
      throw new CatalogException(
          String.format("Plex returned status %d for %s %s", status, method, path));
    }

    String body = response.body();
    if (body == null || body.isBlank()) {
      return Optional.of(objectMapper.createObjectNode());
    }
    try {
      return Optional.of(objectMapper.readTree(body));
    } catch (JsonProcessingException e) {
      throw new CatalogException("Malformed Plex response for " + method + " " + path, e);
    }
  }

  private static String encode(String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
  }
}
