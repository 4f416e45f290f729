package com.scholary.placeholdarr.routing;

import com.scholary.placeholdarr.config.BackendProperties;
import com.scholary.placeholdarr.config.BackendProperties.Instance;
import com.scholary.placeholdarr.media.MediaKind;
import com.scholary.placeholdarr.media.QualityTier;
import java.net.URI;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves backend and library coordinates for a media kind and quality tier.
 *
 * <p>Stateless apart from the configuration it is built from; coordinates are resolved once at
 * construction.
 */
public class QualityRouter {

  private static final Logger LOGGER = LoggerFactory.getLogger(QualityRouter.class);

  private final Map<MediaKind, BackendCoordinates> standard = new EnumMap<>(MediaKind.class);
  private final Map<MediaKind, BackendCoordinates> highQuality = new EnumMap<>(MediaKind.class);

  public QualityRouter(BackendProperties properties) {
    standard.put(MediaKind.MOVIE, toCoordinates(properties.radarr()));
    standard.put(MediaKind.EPISODE, toCoordinates(properties.sonarr()));
    if (properties.radarrHighQuality() != null) {
      highQuality.put(MediaKind.MOVIE, toCoordinates(properties.radarrHighQuality()));
    }
    if (properties.sonarrHighQuality() != null) {
      highQuality.put(MediaKind.EPISODE, toCoordinates(properties.sonarrHighQuality()));
    }

    LOGGER.info("Initialized quality router: highQualityKinds={}", highQuality.keySet());
  }

  /**
   * Coordinates for a kind and tier.
   *
   * @throws IllegalArgumentException if the high-quality tier is requested but not configured
   */
  public BackendCoordinates route(MediaKind kind, QualityTier tier) {
    if (tier == QualityTier.STANDARD) {
      return standard.get(kind);
    }
    BackendCoordinates coordinates = highQuality.get(kind);
    if (coordinates == null) {
      throw new IllegalArgumentException("No high-quality backend configured for " + kind);
    }
    return coordinates;
  }

  public Optional<BackendCoordinates> find(MediaKind kind, QualityTier tier) {
    if (tier == QualityTier.STANDARD) {
      return Optional.of(standard.get(kind));
    }
    return Optional.ofNullable(highQuality.get(kind));
  }

  public boolean supportsHighQuality() {
    return !highQuality.isEmpty();
  }

  /**
   * Decide the tier of an incoming request.
   *
   * <p>High quality if the media already lives under a high-quality library folder, or if the
   * originating webhook came from a high-quality backend's port. Ports only count when the backend
   * URL names one explicitly.
   *
   * @param filePath on-disk path of the media, may be null
   * @param sourcePort port of the originating webhook, may be null
   */
  public QualityTier resolveTier(String filePath, Integer sourcePort) {
    if (highQuality.isEmpty()) {
      return QualityTier.STANDARD;
    }
    Path path = filePath == null ? null : Paths.get(filePath).toAbsolutePath().normalize();
    for (BackendCoordinates coordinates : highQuality.values()) {
      if (path != null && path.startsWith(coordinates.libraryPath())) {
        return QualityTier.HIGH_QUALITY;
      }
      int port = explicitPort(coordinates.backendUrl());
      if (sourcePort != null && port != -1 && sourcePort == port) {
        return QualityTier.HIGH_QUALITY;
      }
    }
    return QualityTier.STANDARD;
  }

  private static BackendCoordinates toCoordinates(Instance instance) {
    String url = instance.url();
    while (url.endsWith("/")) {
      url = url.substring(0, url.length() - 1);
    }
    Path library = Paths.get(instance.libraryFolder()).toAbsolutePath().normalize();
    return new BackendCoordinates(url, instance.apiKey(), library, instance.sectionId());
  }

  // -1 when the URL has no explicit port.
  private static int explicitPort(String url) {
    return URI.create(url).getPort();
  }
}
