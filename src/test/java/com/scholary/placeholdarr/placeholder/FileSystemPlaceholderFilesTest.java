package com.scholary.placeholdarr.placeholder;

import static org.assertj.core.api.Assertions.assertThat;

import com.scholary.placeholdarr.MutableClock;
import com.scholary.placeholdarr.config.BackendProperties;
import com.scholary.placeholdarr.config.BackendProperties.Instance;
import com.scholary.placeholdarr.media.QualityTier;
import com.scholary.placeholdarr.registry.MonitoredUnit;
import com.scholary.placeholdarr.registry.MonitoringRegistry;
import com.scholary.placeholdarr.registry.UnitIdentity;
import com.scholary.placeholdarr.registry.UnitRegistration;
import com.scholary.placeholdarr.routing.QualityRouter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileSystemPlaceholderFilesTest {

  @TempDir Path tempDir;

  private Path movies;
  private Path tv;
  private FileSystemPlaceholderFiles placeholderFiles;
  private MonitoringRegistry registry;

  @BeforeEach
  void setUp() throws IOException {
    movies = Files.createDirectories(tempDir.resolve("movies"));
    tv = Files.createDirectories(tempDir.resolve("tv"));
    QualityRouter router =
        new QualityRouter(
            new BackendProperties(
                new Instance("http://radarr:7878", "key", movies.toString(), 1),
                null,
                new Instance("http://sonarr:8989", "key", tv.toString(), 2),
                null,
                5,
                30,
                3,
                1000));
    placeholderFiles = new FileSystemPlaceholderFiles(router);
    registry = new MonitoringRegistry(new MutableClock(Instant.parse("2024-05-01T10:00:00Z")));
  }

  @Test
  void delete_shouldRemoveMoviePlaceholderByTmdbTag() throws IOException {
    Path placeholder =
        touch(movies.resolve("Dune (2021) {tmdb-42}{edition-Dummy}/Dune (2021) (dummy).mp4"));
    Path realFile = touch(movies.resolve("Dune (2021) {tmdb-42}/Dune (2021).mkv"));
    Path otherMovie = touch(movies.resolve("Heat (1995) {tmdb-949}/Heat (1995) (dummy).mp4"));

    int deleted = placeholderFiles.delete(unit(UnitIdentity.movie("42"), 7));

    assertThat(deleted).isEqualTo(1);
    assertThat(placeholder).doesNotExist();
    assertThat(realFile).exists();
    assertThat(otherMovie).exists();
  }

  @Test
  void delete_shouldNotConfuseSimilarTmdbIds() throws IOException {
    Path other = touch(movies.resolve("Film {tmdb-420}/Film (dummy).mp4"));

    assertThat(placeholderFiles.delete(unit(UnitIdentity.movie("42"), 7))).isZero();
    assertThat(other).exists();
  }

  @Test
  void delete_shouldRemoveEpisodePlaceholderByIdTag() throws IOException {
    Path placeholder =
        touch(tv.resolve("Lost (2004) {tvdb-73739}/Season 01/Lost - s01e02 (dummy) [ID:5002].mp4"));
    Path sibling =
        touch(tv.resolve("Lost (2004) {tvdb-73739}/Season 01/Lost - s01e03 (dummy) [ID:5003].mp4"));

    int deleted = placeholderFiles.delete(unit(UnitIdentity.episode("73739", 1, 2), 5002));

    assertThat(deleted).isEqualTo(1);
    assertThat(placeholder).doesNotExist();
    assertThat(sibling).exists();
  }

  @Test
  void delete_shouldFallBackToEpisodeNumberInSeriesFolder() throws IOException {
    Path placeholder =
        touch(tv.resolve("Lost (2004) {tvdb-73739}/Season 01/Lost - s01e02 (dummy).mp4"));
    Path otherSeries =
        touch(tv.resolve("Other {tvdb-1}/Season 01/Other - s01e02 (dummy).mp4"));

    int deleted = placeholderFiles.delete(unit(UnitIdentity.episode("73739", 1, 2), 5002));

    assertThat(deleted).isEqualTo(1);
    assertThat(placeholder).doesNotExist();
    assertThat(otherSeries).exists();
  }

  @Test
  void delete_shouldTolerateMissingLibraryFolder() throws IOException {
    Files.delete(movies);

    assertThat(placeholderFiles.delete(unit(UnitIdentity.movie("42"), 7))).isZero();
  }

  private MonitoredUnit unit(UnitIdentity identity, long backendRef) {
    registry.add(new UnitRegistration(identity, backendRef, "title", QualityTier.STANDARD, null));
    return registry.find(identity).orElseThrow();
  }

  private static Path touch(Path file) throws IOException {
    Files.createDirectories(file.getParent());
    return Files.createFile(file);
  }
}
