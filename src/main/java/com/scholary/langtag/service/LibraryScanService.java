package com.scholary.langtag.service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.IntConsumer;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Walks directories for Matroska files and classifies them one after another.
 *
 * <p>Files are processed strictly sequentially. Unreadable roots are reported as failed files so
 * the rest of the scan continues.
 */
@Service
public class LibraryScanService {

  private static final Logger LOGGER = LoggerFactory.getLogger(LibraryScanService.class);

  static final String MKV_EXTENSION = ".mkv";

  private final FileClassificationService classificationService;

  public LibraryScanService(FileClassificationService classificationService) {
    this.classificationService = classificationService;
  }

  /**
   * Scan files and directories.
   *
   * @param roots files or directories; directories are searched recursively
   * @param dryRun compute verdicts without writing
   * @param progress receives the completed percentage after each file
   */
  public ScanSummary scan(List<Path> roots, boolean dryRun, IntConsumer progress) {
    Instant started = Instant.now();
    List<FileReport> reports = new ArrayList<>();
    List<Path> files = new ArrayList<>();

    for (Path root : roots) {
      try {
        files.addAll(findMediaFiles(root));
      } catch (IOException e) {
        LOGGER.error("Cannot scan {}: {}", root, e.getMessage());
        reports.add(FileReport.failed(root.toString(), "Cannot scan: " + e.getMessage()));
      }
    }
    LOGGER.info("Found {} media file(s) to check", files.size());

    for (int i = 0; i < files.size(); i++) {
      reports.add(classificationService.classify(files.get(i), dryRun));
      progress.accept((i + 1) * 100 / files.size());
    }

    ScanSummary summary = ScanSummary.of(reports, Duration.between(started, Instant.now()));
    LOGGER.info(
        "Scan finished: files={}, skipped={}, processed={}, failed={}, tracksUpdated={},"
            + " tracksFailed={}, tracksSkipped={}, runtimeMs={}",
        summary.filesScanned(),
        summary.filesSkipped(),
        summary.filesProcessed(),
        summary.filesFailed(),
        summary.tracksUpdated(),
        summary.tracksFailed(),
        summary.tracksSkipped(),
        summary.runtimeMillis());
    return summary;
  }

  static List<Path> findMediaFiles(Path root) throws IOException {
    if (Files.isRegularFile(root)) {
      return isMediaFile(root) ? List.of(root) : List.of();
    }
    if (!Files.isDirectory(root)) {
      throw new IOException("No such file or directory: " + root);
    }
    try (Stream<Path> paths = Files.walk(root)) {
      return paths
          .filter(Files::isRegularFile)
          .filter(LibraryScanService::isMediaFile)
          .sorted()
          .toList();
    }
  }

  private static boolean isMediaFile(Path path) {
    return path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(MKV_EXTENSION);
  }
}
