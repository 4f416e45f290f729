package com.scholary.placeholdarr.backend;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.placeholdarr.media.MediaKind;
import com.scholary.placeholdarr.media.QualityTier;
import com.scholary.placeholdarr.routing.BackendCoordinates;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP client for the Radarr/Sonarr v3 API.
 *
 * <p>Handles the low-level HTTP communication: building authenticated requests, parsing queue and
 * unit responses, and retrying on transient failures (I/O errors and 5xx answers) with exponential
 * backoff. Other error answers fail immediately.
 */
public class ArrBackendClient implements BackendClient {

  private static final Logger LOGGER = LoggerFactory.getLogger(ArrBackendClient.class);

  private static final String API_PREFIX = "/api/v3";

  private final MediaKind kind;
  private final QualityTier tier;
  private final BackendCoordinates coordinates;
  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final Duration readTimeout;
  private final int maxRetries;
  private final int queuePageSize;
  private final Duration baseBackoff;

  public ArrBackendClient(
      MediaKind kind,
      QualityTier tier,
      BackendCoordinates coordinates,
      ObjectMapper objectMapper,
      Duration connectTimeout,
      Duration readTimeout,
      int maxRetries,
      int queuePageSize,
      Duration baseBackoff) {
    this.kind = kind;
    this.tier = tier;
    this.coordinates = coordinates;
    this.objectMapper = objectMapper;
    this.readTimeout = readTimeout;
    this.maxRetries = maxRetries;
    this.queuePageSize = queuePageSize;
    this.baseBackoff = baseBackoff;

    this.httpClient = HttpClient.newBuilder().connectTimeout(connectTimeout).build();

    LOGGER.info(
        "Initialized {} backend client: kind={}, tier={}, baseUrl={}",
        kind == MediaKind.MOVIE ? "Radarr" : "Sonarr",
        kind,
        tier,
        coordinates.backendUrl());
  }

  @Override
  public MediaKind kind() {
    return kind;
  }

  @Override
  public QualityTier tier() {
    return tier;
  }

  @Override
  public List<BackendQueueItem> fetchQueue() {
    String path = API_PREFIX + "/queue?page=1&pageSize=" + queuePageSize;
    JsonNode body = getWithRetry(path);

    String idField = kind == MediaKind.MOVIE ? "movieId" : "episodeId";
    List<BackendQueueItem> items = new ArrayList<>();
    for (JsonNode record : body.path("records")) {
      long unitId = record.path(idField).asLong(0);
      if (unitId <= 0) {
        // Unknown downloads not linked to a library item.
        continue;
      }
      items.add(
          new BackendQueueItem(
              unitId,
              record.path("status").asText(""),
              record.path("size").asDouble(0),
              record.path("sizeleft").asDouble(0)));
    }

    LOGGER.debug("Fetched {} queue: {} linked record(s)", kind, items.size());
    return items;
  }

  @Override
  public BackendUnit fetchUnit(long backendUnitId) {
    String resource = kind == MediaKind.MOVIE ? "/movie/" : "/episode/";
    JsonNode body = getWithRetry(API_PREFIX + resource + backendUnitId);
    return new BackendUnit(backendUnitId, body.path("hasFile").asBoolean(false));
  }

  private JsonNode getWithRetry(String path) {
    int attempt = 0;
    Exception lastException = null;

    while (attempt < maxRetries) {
      try {
        return attemptGet(path);
      } catch (IOException e) {
        lastException = e;
        attempt++;
        if (attempt < maxRetries) {
          // Exponential backoff with jitter
          long backoffMs =
              (long) (Math.pow(2, attempt - 1) * baseBackoff.toMillis()
                  + Math.random() * baseBackoff.toMillis());
          LOGGER.warn(
              "Backend request {} attempt {} failed, retrying in {}ms: {}",
              path,
              attempt,
              backoffMs,
              e.getMessage());
          sleep(backoffMs);
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new BackendException("Backend request interrupted: " + path, e);
      }
    }

    throw new BackendException(
        String.format("Backend request %s failed after %d attempts", path, maxRetries),
        lastException);
  }

  private JsonNode attemptGet(String path) throws IOException, InterruptedException {
    HttpRequest request =
        HttpRequest.newBuilder()
            .uri(URI.create(coordinates.backendUrl() + path))
            .timeout(readTimeout)
            .header("X-Api-Key", coordinates.backendKey())
            .header("Accept", "application/json")
            .GET()
            .build();

    LOGGER.debug("Sending backend request to {}", request.uri());

    HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

    int status = response.statusCode();
    if (status >= 500) {
      throw new IOException(
          String.format("Backend returned status %d: %s", status, response.body()));
    }
    if (status != 200) {
      throw new BackendException(
          String.format("Backend returned status %d for %s", status, request.uri()));
    }
    try {
      return objectMapper.readTree(response.body());
    } catch (JsonProcessingException e) {
      throw new BackendException("Malformed backend response from " + request.uri(), e);
    }
  }

  private static void sleep(long millis) {
    try {
      Thread.sleep(millis);
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
      throw new BackendException("Backend retry interrupted", ie);
    }
  }
}
