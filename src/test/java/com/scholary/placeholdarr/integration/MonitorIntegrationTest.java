package com.scholary.placeholdarr.integration;

import static org.assertj.core.api.Assertions.assertThat;

import com.scholary.placeholdarr.api.UnitStatusResponse;
import com.scholary.placeholdarr.media.MediaKind;
import com.scholary.placeholdarr.media.QualityTier;
import com.scholary.placeholdarr.poller.BatchPoller;
import com.scholary.placeholdarr.registry.UnitIdentity;
import com.scholary.placeholdarr.registry.UnitRegistration;
import com.scholary.placeholdarr.service.MonitoringService;
import com.scholary.placeholdarr.status.UnitState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

/**
 * End-to-end test of the application context and the monitor REST API.
 *
 * <p>Backends are never reached: every test finishes well within the first poll interval.
 */
@SpringBootTest(
    webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
    properties = {"monitor.titleUpdates=false", "monitor.checkInterval=1h"})
class MonitorIntegrationTest {

  @Autowired private TestRestTemplate restTemplate;
  @Autowired private MonitoringService monitoringService;
  @Autowired private BatchPoller poller;

  @AfterEach
  void tearDown() {
    monitoringService
        .listUnits()
        .forEach(unit -> monitoringService.unregister(unit.getIdentity()));
  }

  @Test
  void listUnits_shouldBeEmptyOnStartup() {
    ResponseEntity<UnitStatusResponse[]> response =
        restTemplate.getForEntity("/monitor/units", UnitStatusResponse[].class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(response.getBody()).isEmpty();
  }

  @Test
  void registeredMovie_shouldBeVisibleAsSearching() {
    monitoringService.registerUnit(
        new UnitRegistration(UnitIdentity.movie("42"), 7, "Dune", QualityTier.STANDARD, null));

    ResponseEntity<UnitStatusResponse> response =
        restTemplate.getForEntity("/monitor/units/movie/42", UnitStatusResponse.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    UnitStatusResponse body = response.getBody();
    assertThat(body).isNotNull();
    assertThat(body.unit()).isEqualTo("tmdb:42");
    assertThat(body.kind()).isEqualTo(MediaKind.MOVIE);
    assertThat(body.state()).isEqualTo(UnitState.SEARCHING);
    assertThat(body.status()).isEqualTo("Searching...");
    assertThat(poller.isRunning()).isTrue();
  }

  @Test
  void registeredEpisode_shouldBeFoundBySeasonAndEpisode() {
    monitoringService.registerUnit(
        new UnitRegistration(
            UnitIdentity.episode("73739", 1, 2),
            5002,
            "Lost - S01E02",
            QualityTier.STANDARD,
            null));

    ResponseEntity<UnitStatusResponse> response =
        restTemplate.getForEntity(
            "/monitor/units/episode/73739?season=1&episode=2", UnitStatusResponse.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(response.getBody().title()).isEqualTo("Lost - S01E02");
  }

  @Test
  void unknownUnit_shouldReturnNotFound() {
    ResponseEntity<String> response =
        restTemplate.getForEntity("/monitor/units/movie/999", String.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
  }

  @Test
  void malformedIdentity_shouldReturnBadRequest() {
    assertThat(restTemplate.getForEntity("/monitor/units/book/1", String.class).getStatusCode())
        .isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(
            restTemplate.getForEntity("/monitor/units/episode/73739", String.class).getStatusCode())
        .isEqualTo(HttpStatus.BAD_REQUEST);
  }
}
