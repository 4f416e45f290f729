package com.scholary.placeholdarr.api;

import com.scholary.placeholdarr.media.MediaKind;
import com.scholary.placeholdarr.registry.UnitIdentity;
import com.scholary.placeholdarr.service.MonitoringService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read-only REST API for inspecting the monitoring registry.
 *
 * <p>Provides endpoints for:
 *
 * <ul>
 *   <li>Listing every monitored unit
 *   <li>Looking up one movie ({@code /monitor/units/movie/{tmdbId}}) or episode ({@code
 *       /monitor/units/episode/{tvdbId}?season=1&episode=2})
 * </ul>
 */
@RestController
@RequestMapping("/monitor")
@Tag(name = "Monitor", description = "Acquisition status of placeholder media")
public class MonitorController {

  private final MonitoringService monitoringService;

  public MonitorController(MonitoringService monitoringService) {
    this.monitoringService = monitoringService;
  }

  @GetMapping("/units")
  @Operation(
      summary = "List monitored units",
      description = "Snapshot of every unit awaiting a file, in registration order")
  public List<UnitStatusResponse> listUnits() {
    return monitoringService.listUnits().stream()
        .map(UnitStatusResponse::from)
        .collect(Collectors.toList());
  }

  @GetMapping("/units/{kind}/{externalId}")
  @Operation(
      summary = "Get unit status",
      description =
          "Current status of one movie or episode. Episodes require the season and episode "
              + "query parameters.")
  public ResponseEntity<UnitStatusResponse> getUnit(
      @PathVariable String kind,
      @PathVariable String externalId,
      @RequestParam(required = false) Integer season,
      @RequestParam(required = false) Integer episode) {
    UnitIdentity identity = new UnitIdentity(parseKind(kind), externalId, season, episode);
    return monitoringService
        .currentStatus(identity)
        .map(unit -> ResponseEntity.ok(UnitStatusResponse.from(unit)))
        .orElse(ResponseEntity.notFound().build());
  }

  private static MediaKind parseKind(String kind) {
    try {
      return MediaKind.valueOf(kind.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Unknown media kind: " + kind, e);
    }
  }
}
