package com.scholary.placeholdarr.poller;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.scholary.placeholdarr.MutableClock;
import com.scholary.placeholdarr.backend.BackendClient;
import com.scholary.placeholdarr.backend.BackendClients;
import com.scholary.placeholdarr.backend.BackendException;
import com.scholary.placeholdarr.backend.BackendQueueItem;
import com.scholary.placeholdarr.backend.BackendUnit;
import com.scholary.placeholdarr.config.MonitorProperties;
import com.scholary.placeholdarr.lookahead.PlayMode;
import com.scholary.placeholdarr.media.MediaKind;
import com.scholary.placeholdarr.media.QualityTier;
import com.scholary.placeholdarr.registry.MonitoredUnit;
import com.scholary.placeholdarr.registry.MonitoringRegistry;
import com.scholary.placeholdarr.registry.RemovalReason;
import com.scholary.placeholdarr.registry.UnitIdentity;
import com.scholary.placeholdarr.registry.UnitRegistration;
import com.scholary.placeholdarr.status.DisplayStatus;
import com.scholary.placeholdarr.status.StatusCode;
import com.scholary.placeholdarr.status.StatusVocabulary;
import com.scholary.placeholdarr.status.UnitState;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.TaskScheduler;

@ExtendWith(MockitoExtension.class)
class BatchPollerTest {

  private static final Duration INTERVAL = Duration.ofSeconds(10);
  private static final UnitIdentity DUNE = UnitIdentity.movie("42");
  private static final UnitIdentity PILOT = UnitIdentity.episode("81189", 1, 1);

  @Mock private BackendClient radarr;
  @Mock private BackendClient sonarr;
  @Mock private TaskScheduler scheduler;

  private MutableClock clock;
  private MonitoringRegistry registry;
  private BatchPoller poller;

  @BeforeEach
  void setUp() {
    when(radarr.kind()).thenReturn(MediaKind.MOVIE);
    when(radarr.tier()).thenReturn(QualityTier.STANDARD);
    when(sonarr.kind()).thenReturn(MediaKind.EPISODE);
    when(sonarr.tier()).thenReturn(QualityTier.STANDARD);

    clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
    registry = new MonitoringRegistry(clock);
    MonitorProperties properties =
        new MonitorProperties(
            INTERVAL,
            Duration.ofHours(1),
            5,
            Duration.ofSeconds(10),
            3,
            3,
            false,
            PlayMode.EPISODE,
            false,
            1);
    poller =
        new BatchPoller(
            registry,
            new BackendClients(List.of(radarr, sonarr)),
            new StatusVocabulary(),
            scheduler,
            properties,
            clock);
  }

  @Test
  void firstInsertion_shouldStartPolling() {
    registry.add(movie(DUNE, 7));
    registry.add(movie(UnitIdentity.movie("43"), 8));

    assertThat(poller.isRunning()).isTrue();
    verify(scheduler, times(1)).schedule(any(Runnable.class), any(Instant.class));
  }

  @Test
  void runCycle_shouldFollowDownloadToAvailable() {
    registry.add(movie(DUNE, 7));
    when(radarr.fetchQueue())
        .thenReturn(List.of(new BackendQueueItem(7, "downloading", 1000, 400)), List.of());
    when(radarr.fetchUnit(7)).thenReturn(new BackendUnit(7, true));

    poller.runCycle();
    MonitoredUnit downloading = registry.find(DUNE).orElseThrow();
    assertThat(downloading.getState()).isEqualTo(UnitState.DOWNLOADING);
    assertThat(downloading.getProgressPercent()).isEqualTo(60);

    poller.runCycle();
    assertThat(registry.find(DUNE).orElseThrow().getStatus()).isEqualTo(DisplayStatus.AVAILABLE);
  }

  @Test
  void runCycle_shouldFetchEachQueueOncePerCycle() {
    registry.add(movie(DUNE, 7));
    registry.add(movie(UnitIdentity.movie("43"), 8));
    registry.add(movie(UnitIdentity.movie("44"), 9));
    registry.add(episode(PILOT, 100));
    registry.add(episode(UnitIdentity.episode("81189", 1, 2), 101));
    when(radarr.fetchQueue())
        .thenReturn(
            List.of(
                new BackendQueueItem(7, "queued", 0, 0),
                new BackendQueueItem(9, "downloading", 100, 10)));
    when(sonarr.fetchQueue()).thenReturn(List.of(new BackendQueueItem(101, "paused", 50, 50)));

    poller.runCycle();

    verify(radarr, times(1)).fetchQueue();
    verify(sonarr, times(1)).fetchQueue();
    assertThat(registry.find(DUNE).orElseThrow().getStatus()).isEqualTo(DisplayStatus.QUEUED);
    assertThat(registry.find(UnitIdentity.movie("44")).orElseThrow().getProgressPercent())
        .isEqualTo(90);
    assertThat(registry.find(UnitIdentity.episode("81189", 1, 2)).orElseThrow().getStatus())
        .isEqualTo(DisplayStatus.QUEUED);
    assertThat(registry.find(PILOT).orElseThrow().getStatus()).isEqualTo(DisplayStatus.SEARCHING);
  }

  @Test
  void runCycle_shouldIsolateFailingBackend() {
    registry.add(movie(DUNE, 7));
    registry.add(episode(PILOT, 100));
    when(radarr.fetchQueue()).thenThrow(new BackendException("connection refused"));
    when(sonarr.fetchQueue())
        .thenReturn(List.of(new BackendQueueItem(100, "downloading", 200, 100)));

    poller.runCycle();

    assertThat(registry.find(DUNE).orElseThrow().getStatus()).isEqualTo(DisplayStatus.SEARCHING);
    assertThat(registry.find(PILOT).orElseThrow().getProgressPercent()).isEqualTo(50);
    verify(scheduler, times(2)).schedule(any(Runnable.class), any(Instant.class));
  }

  @Test
  void runCycle_shouldRetryWhenDownloadVanishesWithoutFile() {
    registry.add(movie(DUNE, 7));
    when(radarr.fetchQueue())
        .thenReturn(
            List.of(new BackendQueueItem(7, "downloading", 100, 50)),
            List.of(),
            List.of(new BackendQueueItem(7, "downloading", 100, 20)));
    when(radarr.fetchUnit(7)).thenReturn(new BackendUnit(7, false));

    poller.runCycle();
    clock.advance(Duration.ofMinutes(50));
    poller.runCycle();

    MonitoredUnit retrying = registry.find(DUNE).orElseThrow();
    assertThat(retrying.getState()).isEqualTo(UnitState.RETRYING);
    assertThat(retrying.isRetrying()).isTrue();
    assertThat(retrying.getStartedAt()).isEqualTo(clock.instant());

    poller.runCycle();
    assertThat(registry.find(DUNE).orElseThrow().getStatus())
        .isEqualTo(DisplayStatus.downloading(80));
  }

  @Test
  void runCycle_shouldTreatFailureStatusAsRetry() {
    registry.add(movie(DUNE, 7));
    when(radarr.fetchQueue()).thenReturn(List.of(new BackendQueueItem(7, "failed", 100, 100)));

    poller.runCycle();

    MonitoredUnit unit = registry.find(DUNE).orElseThrow();
    assertThat(unit.getStatus()).isEqualTo(DisplayStatus.RETRYING);
    assertThat(unit.isRetrying()).isTrue();
  }

  @Test
  void runCycle_shouldKeepProcessingWhileImportRuns() {
    registry.add(movie(DUNE, 7));
    when(radarr.fetchQueue())
        .thenReturn(List.of(new BackendQueueItem(7, "importPending", 100, 0)), List.of());
    when(radarr.fetchUnit(7)).thenReturn(new BackendUnit(7, false));

    poller.runCycle();
    poller.runCycle();

    MonitoredUnit unit = registry.find(DUNE).orElseThrow();
    assertThat(unit.getStatus()).isEqualTo(DisplayStatus.PROCESSING);
    assertThat(unit.isRetrying()).isFalse();
  }

  @Test
  void runCycle_shouldKeepStatusWhenFileCheckFails() {
    registry.add(movie(DUNE, 7));
    when(radarr.fetchQueue())
        .thenReturn(List.of(new BackendQueueItem(7, "downloading", 100, 40)), List.of());
    when(radarr.fetchUnit(7)).thenThrow(new BackendException("timeout"));

    poller.runCycle();
    poller.runCycle();

    assertThat(registry.find(DUNE).orElseThrow().getStatus())
        .isEqualTo(DisplayStatus.downloading(60));
  }

  @Test
  void runCycle_shouldConfirmNeverSeenUnitsOnlyEveryFewCycles() {
    registry.add(movie(DUNE, 7));
    when(radarr.fetchQueue()).thenReturn(List.of());
    when(radarr.fetchUnit(7)).thenReturn(new BackendUnit(7, false));

    poller.runCycle();
    poller.runCycle();
    verify(radarr, never()).fetchUnit(7);

    poller.runCycle();
    verify(radarr, times(1)).fetchUnit(7);
    assertThat(registry.find(DUNE).orElseThrow().getStatus()).isEqualTo(DisplayStatus.SEARCHING);
  }

  @Test
  void runCycle_shouldExpireAfterMaxAttempts() {
    registry.add(movie(DUNE, 7));
    when(radarr.fetchQueue()).thenReturn(List.of());
    when(radarr.fetchUnit(7)).thenReturn(new BackendUnit(7, false));

    for (int cycle = 0; cycle < 5; cycle++) {
      poller.runCycle();
    }
    assertThat(registry.find(DUNE)).isPresent();

    poller.runCycle();
    assertThat(registry.find(DUNE)).isEmpty();
    verify(radarr, times(5)).fetchQueue();
  }

  @Test
  void runCycle_shouldExpireAfterMaxMonitorTime() {
    registry.add(movie(DUNE, 7));
    clock.advance(Duration.ofMinutes(61));

    poller.runCycle();

    assertThat(registry.isEmpty()).isTrue();
    verify(radarr, never()).fetchQueue();
  }

  @Test
  void runCycle_shouldStopWhenRegistryIsEmpty() {
    registry.add(movie(DUNE, 7));
    registry.remove(DUNE, RemovalReason.EXPLICIT);

    poller.runCycle();

    assertThat(poller.isRunning()).isFalse();
    verify(scheduler, times(1)).schedule(any(Runnable.class), any(Instant.class));

    registry.add(movie(DUNE, 7));
    assertThat(poller.isRunning()).isTrue();
    verify(scheduler, times(2)).schedule(any(Runnable.class), any(Instant.class));
  }

  @Test
  void runCycle_shouldSkipUnitsWithoutConfiguredBackend() {
    registry.add(new UnitRegistration(DUNE, 7, "Dune", QualityTier.HIGH_QUALITY, null));

    poller.runCycle();

    assertThat(registry.find(DUNE).orElseThrow().getStatus()).isEqualTo(DisplayStatus.SEARCHING);
    verify(radarr, never()).fetchQueue();
    verify(scheduler, times(2)).schedule(any(Runnable.class), any(Instant.class));
  }

  @Test
  void runCycle_shouldLeaveAvailableUnitsToCleanup() {
    registry.add(movie(DUNE, 7));
    when(radarr.fetchQueue()).thenReturn(List.of());
    when(radarr.fetchUnit(7)).thenReturn(new BackendUnit(7, true));
    registry.updateStatus(DUNE, DisplayStatus.downloading(99));

    poller.runCycle();
    poller.runCycle();

    MonitoredUnit unit = registry.find(DUNE).orElseThrow();
    assertThat(unit.getStatus().code()).isEqualTo(StatusCode.AVAILABLE);
    assertThat(unit.getAttemptCount()).isEqualTo(1);
    verify(radarr, times(1)).fetchQueue();
  }

  private static UnitRegistration movie(UnitIdentity identity, long backendRef) {
    return new UnitRegistration(identity, backendRef, "Dune", QualityTier.STANDARD, null);
  }

  private static UnitRegistration episode(UnitIdentity identity, long backendRef) {
    return new UnitRegistration(identity, backendRef, "Lost - Pilot", QualityTier.STANDARD, null);
  }
}
