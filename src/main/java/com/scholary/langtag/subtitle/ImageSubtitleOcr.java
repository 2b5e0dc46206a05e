package com.scholary.langtag.subtitle;

import com.scholary.langtag.config.DetectionProperties;
import com.scholary.langtag.media.MediaExtractor;
import com.scholary.langtag.media.MediaTrack;
import com.scholary.langtag.media.OcrEngine;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Renders frames of a bitmap subtitle track and reads their text. */
@Component
public class ImageSubtitleOcr {

  private static final Logger LOGGER = LoggerFactory.getLogger(ImageSubtitleOcr.class);

  static final int MAX_FRAMES = 50;
  static final int MAX_RECOGNIZED_FRAMES = 30;

  private final MediaExtractor mediaExtractor;
  private final OcrEngine ocrEngine;
  private final DetectionProperties properties;

  public ImageSubtitleOcr(
      MediaExtractor mediaExtractor, OcrEngine ocrEngine, DetectionProperties properties) {
    this.mediaExtractor = mediaExtractor;
    this.ocrEngine = ocrEngine;
    this.properties = properties;
  }

  /**
   * Recognize the text of up to 30 rendered frames.
   *
   * @return one entry per frame that yielded more than two characters
   */
  public List<String> recognize(Path file, MediaTrack track) throws IOException {
    Path baseDir = Files.createDirectories(Path.of(properties.tempDir()));
    Path frameDir = Files.createTempDirectory(baseDir, "ocr_");
    try {
      List<Path> frames = mediaExtractor.extractSubtitleFrames(file, track, frameDir, MAX_FRAMES);
      if (frames.isEmpty()) {
        LOGGER.warn("Could not render any subtitle frames for {}", track.selector());
        return List.of();
      }

      List<String> texts = new ArrayList<>();
      for (Path frame : frames.subList(0, Math.min(MAX_RECOGNIZED_FRAMES, frames.size()))) {
        try {
          String text = ocrEngine.recognize(frame).strip();
          if (text.length() > 2) {
            texts.add(text);
          }
        } catch (IOException e) {
          LOGGER.debug("OCR failed for {}: {}", frame.getFileName(), e.getMessage());
        }
      }
      LOGGER.info("Recognized text in {}/{} subtitle frames", texts.size(), frames.size());
      return texts;
    } finally {
      deleteRecursively(frameDir);
    }
  }

  private static void deleteRecursively(Path dir) {
    try (Stream<Path> paths = Files.walk(dir)) {
      paths.sorted(Comparator.reverseOrder()).forEach(ImageSubtitleOcr::deleteQuietly);
    } catch (IOException e) {
      LOGGER.warn("Failed to clean up OCR directory: {}", dir, e);
    }
  }

  private static void deleteQuietly(Path path) {
    try {
      Files.deleteIfExists(path);
    } catch (IOException e) {
      LOGGER.warn("Failed to delete temp file: {}", path, e);
    }
  }
}
