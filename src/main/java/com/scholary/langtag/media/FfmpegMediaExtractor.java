package com.scholary.langtag.media;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Extracts audio samples, full audio tracks and subtitle payloads using ffmpeg.
 *
 * <p>Each extraction walks the {@link StreamMapping} candidates in order and keeps the first
 * output that passes its size check. Audio samples additionally go through a volumedetect pass so
 * a window that landed on silence is rejected before it reaches the speech model.
 */
@Component
public class FfmpegMediaExtractor implements MediaExtractor {

  private static final Logger LOGGER = LoggerFactory.getLogger(FfmpegMediaExtractor.class);

  // Example: [Parsed_volumedetect_0 @ 0x...] mean_volume: -27.3 dB
  private static final Pattern MEAN_VOLUME_PATTERN =
      Pattern.compile("mean_volume:\\s*(-?[0-9.]+)\\s*dB");

  private static final long MIN_SUBTITLE_BYTES = 100;
  private static final Duration FRAME_EXTRACTION_TIMEOUT = Duration.ofSeconds(120);

  private final FfmpegProperties properties;
  private final ProcessRunner processRunner;

  public FfmpegMediaExtractor(FfmpegProperties properties, ProcessRunner processRunner) {
    this.properties = properties;
    this.processRunner = processRunner;
  }

  @Override
  public Optional<Path> extractAudioSample(
      Path file, MediaTrack track, TimeRange window, Path outputDir) {
    Duration timeout = Duration.ofSeconds(properties.sampleTimeoutSeconds());

    for (String mapping : StreamMapping.candidates(track)) {
      Path output = outputDir.resolve(tempName("sample", track, ".wav"));
      List<String> command = new ArrayList<>();
      command.add(properties.ffmpegBinary());
      command.addAll(List.of("-y", "-v", "error"));
      command.addAll(List.of("-ss", String.valueOf((long) window.start())));
      command.addAll(List.of("-i", file.toString()));
      command.addAll(List.of("-t", String.valueOf((long) window.duration())));
      command.addAll(audioOutputArguments(mapping, output));

      try {
        ProcessResult result = processRunner.run(command, timeout);
        if (result.succeeded() && sizeOf(output) > properties.minSampleBytes()) {
          if (hasAudibleSignal(output)) {
            LOGGER.debug(
                "Extracted sample at {}s from {} with mapping {}",
                (long) window.start(),
                track.selector(),
                mapping);
            return Optional.of(output);
          }
          LOGGER.debug("Sample at {}s has very low volume, skipping", (long) window.start());
        }
      } catch (IOException e) {
        LOGGER.debug("Sample extraction with mapping {} failed: {}", mapping, e.getMessage());
      }
      deleteQuietly(output);
    }
    return Optional.empty();
  }

  @Override
  public Optional<Path> extractFullAudio(
      Path file, MediaTrack track, Path outputDir, Duration timeout) {
    for (String mapping : StreamMapping.candidates(track)) {
      Path output = outputDir.resolve(tempName("full", track, ".wav"));
      List<String> command = new ArrayList<>();
      command.add(properties.ffmpegBinary());
      command.addAll(List.of("-y", "-v", "error", "-i", file.toString()));
      command.addAll(audioOutputArguments(mapping, output));

      try {
        ProcessResult result = processRunner.run(command, timeout);
        if (result.succeeded() && sizeOf(output) > properties.minSampleBytes()) {
          LOGGER.info("Extracted full audio of {} with mapping {}", track.selector(), mapping);
          return Optional.of(output);
        }
      } catch (ProcessTimeoutException e) {
        LOGGER.error("Full audio extraction timed out after {}s", timeout.toSeconds());
        deleteQuietly(output);
        return Optional.empty();
      } catch (IOException e) {
        LOGGER.debug("Full audio extraction with mapping {} failed: {}", mapping, e.getMessage());
      }
      deleteQuietly(output);
    }
    LOGGER.warn("All full audio extraction attempts failed for {}", track.selector());
    return Optional.empty();
  }

  @Override
  public Optional<Path> extractSubtitle(Path file, MediaTrack track, Path outputDir) {
    boolean image = track.isImageSubtitle();
    String suffix = image ? ".sup" : ".srt";
    String codec = image ? "copy" : "srt";
    Duration timeout = Duration.ofSeconds(properties.sampleTimeoutSeconds());

    for (String mapping : StreamMapping.candidates(track)) {
      Path output = outputDir.resolve(tempName("sub", track, suffix));
      List<String> command =
          List.of(
              properties.ffmpegBinary(),
              "-y",
              "-v",
              "warning",
              "-i",
              file.toString(),
              "-map",
              mapping,
              "-c:s",
              codec,
              output.toString());
      try {
        ProcessResult result = processRunner.run(command, timeout);
        if (result.succeeded() && sizeOf(output) > MIN_SUBTITLE_BYTES) {
          LOGGER.debug("Extracted subtitle {} ({} bytes)", track.selector(), sizeOf(output));
          return Optional.of(output);
        }
      } catch (IOException e) {
        LOGGER.debug("Subtitle extraction with mapping {} failed: {}", mapping, e.getMessage());
      }
      deleteQuietly(output);
    }
    LOGGER.warn("All subtitle extraction attempts failed for {}", track.selector());
    return Optional.empty();
  }

  /**
   * Render subtitle bitmaps to PNG.
   *
   * <p>Three methods are tried in order: the subtitle stream scaled as video, a copied .sup
   * bitstream decoded on its own, and the subtitles overlaid on the video stream.
   */
  @Override
  public List<Path> extractSubtitleFrames(
      Path file, MediaTrack track, Path outputDir, int maxFrames) {
    String pattern = outputDir.resolve("sub_%04d.png").toString();
    String frames = String.valueOf(maxFrames);
    String subtitleStream = "[0:s:" + track.trackIndex() + "]";

    runFrameMethod(
        "subtitle filter",
        List.of(
            properties.ffmpegBinary(), "-y", "-v", "warning", "-i", file.toString(),
            "-filter_complex", subtitleStream + "scale=iw:ih[sub]", "-map", "[sub]",
            "-frames:v", frames, "-vsync", "0", pattern));
    List<Path> images = listFrames(outputDir);

    if (images.isEmpty()) {
      Path supFile = outputDir.resolve("subtitles.sup");
      runFrameMethod(
          "stream copy",
          List.of(
              properties.ffmpegBinary(), "-y", "-v", "warning", "-i", file.toString(),
              "-map", "0:" + track.selector(), "-c", "copy", supFile.toString()));
      if (sizeOf(supFile) > 0) {
        runFrameMethod(
            "sup decode",
            List.of(
                properties.ffmpegBinary(), "-y", "-v", "warning", "-i", supFile.toString(),
                "-frames:v", frames, "-vsync", "0", pattern));
        images = listFrames(outputDir);
      }
    }

    if (images.isEmpty()) {
      runFrameMethod(
          "video overlay",
          List.of(
              properties.ffmpegBinary(), "-y", "-v", "warning", "-i", file.toString(),
              "-filter_complex", "[0:v]" + subtitleStream + "overlay[v]", "-map", "[v]",
              "-frames:v", frames, "-vsync", "0", "-q:v", "2", pattern));
      images = listFrames(outputDir);
    }

    if (images.isEmpty()) {
      LOGGER.warn("No subtitle images extracted from {} using any method", track.selector());
    }
    return images;
  }

  private void runFrameMethod(String name, List<String> command) {
    try {
      ProcessResult result = processRunner.run(command, FRAME_EXTRACTION_TIMEOUT);
      if (!result.succeeded()) {
        LOGGER.debug("Frame extraction via {} exited with code {}", name, result.exitCode());
      }
    } catch (IOException e) {
      LOGGER.debug("Frame extraction via {} failed: {}", name, e.getMessage());
    }
  }

  private List<Path> listFrames(Path outputDir) {
    try (Stream<Path> files = Files.list(outputDir)) {
      return files
          .filter(p -> p.getFileName().toString().startsWith("sub_"))
          .filter(p -> p.getFileName().toString().endsWith(".png"))
          .sorted()
          .toList();
    } catch (IOException e) {
      LOGGER.debug("Could not list frames in {}: {}", outputDir, e.getMessage());
      return List.of();
    }
  }

  /**
   * Check a sample's mean volume with ffmpeg's volumedetect filter.
   *
   * <p>Returns true when the volume cannot be determined.
   */
  boolean hasAudibleSignal(Path sample) {
    try {
      ProcessResult result =
          processRunner.run(
              List.of(
                  properties.ffmpegBinary(),
                  "-i",
                  sample.toString(),
                  "-af",
                  "volumedetect",
                  "-f",
                  "null",
                  "-"),
              Duration.ofSeconds(properties.probeTimeoutSeconds()));
      Matcher matcher = MEAN_VOLUME_PATTERN.matcher(result.stderr());
      if (matcher.find()) {
        return Double.parseDouble(matcher.group(1)) > properties.silenceFloorDb();
      }
    } catch (IOException | NumberFormatException e) {
      LOGGER.debug("Volume check failed for {}: {}", sample, e.getMessage());
    }
    return true;
  }

  private List<String> audioOutputArguments(String mapping, Path output) {
    return List.of(
        "-map",
        mapping,
        "-ar",
        String.valueOf(properties.sampleRate()),
        "-ac",
        "1",
        "-af",
        properties.audioFilter(),
        "-f",
        "wav",
        output.toString());
  }

  private static String tempName(String prefix, MediaTrack track, String suffix) {
    return String.format(
        Locale.ROOT,
        "%s_%s%d_%s%s",
        prefix,
        track.type().selector(),
        track.trackIndex(),
        UUID.randomUUID(),
        suffix);
  }

  private static long sizeOf(Path path) {
    try {
      return Files.exists(path) ? Files.size(path) : 0L;
    } catch (IOException e) {
      return 0L;
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
