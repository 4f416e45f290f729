package com.scholary.placeholdarr.routing;

import java.nio.file.Path;

/**
 * Where a request of one kind and tier is served from.
 *
 * @param backendUrl base URL of the Radarr/Sonarr instance, without trailing slash
 * @param backendKey API key of that instance
 * @param libraryPath library root the instance imports into
 * @param catalogSectionId Plex library section showing that library
 */
public record BackendCoordinates(
    String backendUrl, String backendKey, Path libraryPath, int catalogSectionId) {}
