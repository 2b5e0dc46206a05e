package com.scholary.langtag.media;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Pulls decoded audio and subtitle payloads out of a container.
 *
 * <p>Every method reports failure as an empty result; callers fall through to their next window
 * or tier instead of handling exceptions. Output files are created in {@code outputDir} and belong
 * to the caller, who must delete them.
 */
public interface MediaExtractor {

  /**
   * Cut a mono WAV sample for one time window.
   *
   * @return the sample, or empty when no mapping produced a large enough, audible file
   */
  Optional<Path> extractAudioSample(Path file, MediaTrack track, TimeRange window, Path outputDir);

  /**
   * Decode the entire audio track to a mono WAV.
   *
   * @param timeout wall-clock bound for the whole extraction
   * @return the audio, or empty on failure or timeout
   */
  Optional<Path> extractFullAudio(Path file, MediaTrack track, Path outputDir, Duration timeout);

  /**
   * Extract a subtitle track: text codecs as SRT, image codecs as a raw {@code .sup} bitstream.
   *
   * @return the payload, or empty when extraction produced nothing usable
   */
  Optional<Path> extractSubtitle(Path file, MediaTrack track, Path outputDir);

  /**
   * Render frames of an image subtitle track to PNG files for OCR.
   *
   * @return extracted frames sorted by name, empty when every method failed
   */
  List<Path> extractSubtitleFrames(Path file, MediaTrack track, Path outputDir, int maxFrames);
}
