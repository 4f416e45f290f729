package com.scholary.placeholdarr.placeholder;

import com.scholary.placeholdarr.media.MediaKind;
import com.scholary.placeholdarr.registry.MonitoredUnit;
import com.scholary.placeholdarr.registry.UnitIdentity;
import com.scholary.placeholdarr.routing.QualityRouter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Deletes placeholder files from the library folder of the unit's backend.
 *
 * <p>Placeholders are found by the ID tags embedded in their names, never by title:
 *
 * <ul>
 *   <li>movie: file marked {@code (dummy)} inside a folder tagged {@code {tmdb-<id>}}
 *   <li>episode: file marked {@code (dummy)} and tagged {@code [ID:<episodeId>]}, or a file marked
 *       {@code (dummy)} with the matching {@code sXXeYY} inside a folder tagged {@code {tvdb-<id>}}
 * </ul>
 */
@Component
public class FileSystemPlaceholderFiles implements PlaceholderFileManager {

  private static final Logger LOGGER = LoggerFactory.getLogger(FileSystemPlaceholderFiles.class);

  private static final String DUMMY_MARKER = "(dummy)";

  // Library root / title folder / season folder / file
  private static final int MAX_DEPTH = 3;

  private final QualityRouter router;

  public FileSystemPlaceholderFiles(QualityRouter router) {
    this.router = router;
  }

  @Override
  public int delete(MonitoredUnit unit) {
    Path library = router.route(unit.getKind(), unit.getQualityTier()).libraryPath();
    if (library == null || !Files.isDirectory(library)) {
      LOGGER.debug(
          "Library folder {} not found, nothing to delete for {}", library, unit.getIdentity());
      return 0;
    }

    List<Path> matches;
    try (Stream<Path> paths = Files.walk(library, MAX_DEPTH)) {
      matches =
          paths
              .filter(Files::isRegularFile)
              .filter(matcher(unit, library))
              .collect(Collectors.toList());
    } catch (IOException e) {
      LOGGER.warn(
          "Failed to scan {} for placeholders of {}: {}",
          library,
          unit.getIdentity(),
          e.getMessage());
      return 0;
    }

    int deleted = 0;
    for (Path file : matches) {
      try {
        if (Files.deleteIfExists(file)) {
          deleted++;
          LOGGER.info("Deleted placeholder file: {}", file);
        }
      } catch (IOException e) {
        LOGGER.warn("Failed to delete placeholder {}: {}", file, e.getMessage());
      }
    }

    if (deleted == 0) {
      LOGGER.info("No placeholder file exists for '{}'", unit.getDisplayTitle());
    }
    return deleted;
  }

  private static Predicate<Path> matcher(MonitoredUnit unit, Path library) {
    UnitIdentity identity = unit.getIdentity();
    if (identity.kind() == MediaKind.MOVIE) {
      String folderTag = "{tmdb-" + identity.externalId() + "}";
      return file -> isDummy(file) && inTaggedFolder(file, library, folderTag);
    }

    String idTag = "[ID:" + unit.getBackendRef() + "]";
    String folderTag = "{tvdb-" + identity.externalId() + "}";
    String episodeTag = String.format("s%02de%02d", identity.season(), identity.episode());
    return file -> {
      if (!isDummy(file)) {
        return false;
      }
      String name = file.getFileName().toString();
      if (name.contains(idTag)) {
        return true;
      }
      return name.toLowerCase(Locale.ROOT).contains(episodeTag)
          && inTaggedFolder(file, library, folderTag);
    };
  }

  private static boolean isDummy(Path file) {
    return file.getFileName().toString().contains(DUMMY_MARKER);
  }

  private static boolean inTaggedFolder(Path file, Path library, String tag) {
    Path relative = library.relativize(file);
    // The title folder is the first element below the library root.
    return relative.getNameCount() > 1 && relative.getName(0).toString().contains(tag);
  }
}
