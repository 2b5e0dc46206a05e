package com.scholary.langtag.subtitle;

import com.scholary.langtag.logging.StructuredLogger;
import com.scholary.langtag.media.MediaProbe;
import com.scholary.langtag.media.MediaTrack;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Decides whether a subtitle track is forced.
 *
 * <p>Text tracks go through the statistics classifier and, when it asks for it, the speech
 * overlap analysis of the file's first audio track. Bitmap tracks use the packet-rate proxy.
 * Degenerate inputs (no cues, unknown runtime) are never classified as forced.
 */
@Component
public class ForcedSubtitleDetector {

  private static final Logger LOGGER = LoggerFactory.getLogger(ForcedSubtitleDetector.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  private final MediaProbe mediaProbe;
  private final ForcedSubtitleClassifier statisticsClassifier;
  private final ImageSubtitleClassifier imageClassifier;
  private final SpeechOverlapAnalyzer speechOverlapAnalyzer;

  public ForcedSubtitleDetector(
      MediaProbe mediaProbe,
      ForcedSubtitleClassifier statisticsClassifier,
      ImageSubtitleClassifier imageClassifier,
      SpeechOverlapAnalyzer speechOverlapAnalyzer) {
    this.mediaProbe = mediaProbe;
    this.statisticsClassifier = statisticsClassifier;
    this.imageClassifier = imageClassifier;
    this.speechOverlapAnalyzer = speechOverlapAnalyzer;
  }

  /**
   * Classify one subtitle track.
   *
   * @param file the container
   * @param track the subtitle track
   * @param entries parsed cues, ignored for bitmap tracks
   * @param audioTrack audio track to compare against, empty when the file has none
   * @param durationSeconds container runtime, 0 when unknown
   */
  public ForcedVerdict detect(
      Path file,
      MediaTrack track,
      List<SubtitleEntry> entries,
      Optional<MediaTrack> audioTrack,
      double durationSeconds) {
    ForcedVerdict verdict = decide(file, track, entries, audioTrack, durationSeconds);
    STRUCTURED_LOGGER.logForcedDecision(
        track.selector(), verdict.forced(), verdict.tier().level(), verdict.reason());
    return verdict;
  }

  private ForcedVerdict decide(
      Path file,
      MediaTrack track,
      List<SubtitleEntry> entries,
      Optional<MediaTrack> audioTrack,
      double durationSeconds) {
    if (durationSeconds <= 0) {
      return ForcedVerdict.full("Could not determine file duration", ConfidenceTier.LOW);
    }
    if (track.isImageSubtitle()) {
      return imageClassifier.classify(
          mediaProbe.subtitlePacketCount(file, track), durationSeconds);
    }
    if (entries.isEmpty()) {
      return ForcedVerdict.full("No subtitle entries found", ConfidenceTier.LOW);
    }

    SubtitleStatistics stats = SubtitleStatistics.from(entries, durationSeconds);
    LOGGER.debug(
        "Subtitle statistics for {}: count={}, density={}, coverage={}%, avgDuration={}s",
        track.selector(),
        stats.entryCount(),
        String.format("%.1f", stats.density()),
        String.format("%.1f", stats.coveragePercent()),
        String.format("%.1f", stats.averageDisplaySeconds()));

    ForcedVerdict verdict = statisticsClassifier.classify(stats, durationSeconds);
    if (!verdict.audioAnalysisRequested()) {
      return verdict;
    }
    if (audioTrack.isEmpty()) {
      return statisticsClassifier.heuristic(
          stats, verdict.reason() + " (no audio track, using heuristic)");
    }

    LOGGER.info("Ambiguous subtitle statistics for {}, analyzing speech", track.selector());
    return speechOverlapAnalyzer
        .analyze(file, audioTrack.get(), stats, durationSeconds)
        .orElseGet(
            () ->
                statisticsClassifier.heuristic(
                    stats, verdict.reason() + " (audio analysis failed, using heuristic)"));
  }
}
