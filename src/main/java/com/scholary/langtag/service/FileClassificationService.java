package com.scholary.langtag.service;

import com.scholary.langtag.config.DetectionProperties;
import com.scholary.langtag.config.SubtitleProperties;
import com.scholary.langtag.config.TrackingProperties;
import com.scholary.langtag.logging.StructuredLogger;
import com.scholary.langtag.media.MediaProbe;
import com.scholary.langtag.media.MediaTrack;
import com.scholary.langtag.media.TrackType;
import com.scholary.langtag.tracking.ProcessingTracker;
import com.scholary.langtag.tracking.TrackingEntry;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Classifies all unlabeled tracks of one file and records the outcome in the processing tracker.
 *
 * <p>The tracker is consulted per track type. A type already settled for the unchanged file is
 * skipped, unless force-reprocess or the reprocess-all switch for that type is on; those switches
 * bypass the tracker without deleting its entry. Dry runs never mark files.
 *
 * <p>Only one file is classified at a time across scan jobs and direct requests, so metadata
 * writes and tracker updates never interleave.
 */
@Service
public class FileClassificationService {

  private static final Logger LOGGER = LoggerFactory.getLogger(FileClassificationService.class);

  private final MediaProbe mediaProbe;
  private final AudioTrackProcessor audioProcessor;
  private final SubtitleTrackProcessor subtitleProcessor;
  private final ProcessingTracker tracker;
  private final DetectionProperties detectionProperties;
  private final SubtitleProperties subtitleProperties;
  private final TrackingProperties trackingProperties;
  private final ReentrantLock classificationLock = new ReentrantLock();

  public FileClassificationService(
      MediaProbe mediaProbe,
      AudioTrackProcessor audioProcessor,
      SubtitleTrackProcessor subtitleProcessor,
      ProcessingTracker tracker,
      DetectionProperties detectionProperties,
      SubtitleProperties subtitleProperties,
      TrackingProperties trackingProperties) {
    this.mediaProbe = mediaProbe;
    this.audioProcessor = audioProcessor;
    this.subtitleProcessor = subtitleProcessor;
    this.tracker = tracker;
    this.detectionProperties = detectionProperties;
    this.subtitleProperties = subtitleProperties;
    this.trackingProperties = trackingProperties;
  }

  /** Classify a file with the configured dry-run setting. */
  public FileReport classify(Path file) {
    return classify(file, detectionProperties.dryRun());
  }

  /**
   * Classify a file.
   *
   * @param file the container
   * @param dryRun compute verdicts without writing metadata or marking the file
   * @return the report; per-track problems are listed in it rather than thrown
   */
  public FileReport classify(Path file, boolean dryRun) {
    classificationLock.lock();
    String correlationId = UUID.randomUUID().toString();
    StructuredLogger.setFileContext(correlationId, file.toString());
    try {
      return doClassify(file, dryRun);
    } catch (IOException e) {
      LOGGER.error("Cannot read tracks of {}: {}", file, e.getMessage());
      return FileReport.failed(file.toString(), e.getMessage());
    } catch (RuntimeException e) {
      LOGGER.error("Processing failed for {}", file, e);
      return FileReport.failed(file.toString(), "Processing failed: " + e.getMessage());
    } finally {
      StructuredLogger.clearFileContext();
      classificationLock.unlock();
    }
  }

  private FileReport doClassify(Path file, boolean dryRun) throws IOException {
    boolean processSubtitles = subtitleProperties.processSubtitles();

    Optional<TrackingEntry> entry =
        trackingProperties.enabled() ? tracker.find(file) : Optional.empty();
    boolean skipAudio =
        entry.map(TrackingEntry::audioProcessed).orElse(false)
            && !detectionProperties.forceReprocess()
            && !detectionProperties.reprocessAllAudio();
    boolean skipSubtitles =
        entry.map(TrackingEntry::subtitleProcessed).orElse(false)
            && !detectionProperties.forceReprocess()
            && !subtitleProperties.reprocessAllSubtitles();

    if (skipAudio && (skipSubtitles || !processSubtitles)) {
      LOGGER.info("Skipping {} (already processed)", file.getFileName());
      return FileReport.skipped(file.toString());
    }

    LOGGER.info("Processing: {}", file.getFileName());
    List<MediaTrack> tracks = mediaProbe.listTracks(file);
    double duration = mediaProbe.durationSeconds(file).orElse(0.0);

    TrackBatch<AudioTrackResult> audio = TrackBatch.empty();
    boolean audioSettled = skipAudio;
    if (!skipAudio && detectionProperties.processAudio()) {
      List<MediaTrack> selected =
          select(tracks, TrackType.AUDIO, detectionProperties.reprocessAllAudio());
      if (selected.isEmpty()) {
        LOGGER.info("No audio tracks to classify in {}", file.getFileName());
      }
      audio = audioProcessor.process(file, selected, duration, dryRun);
      audioSettled = audio.settled();
    }

    TrackBatch<SubtitleTrackResult> subtitles = TrackBatch.empty();
    boolean subtitlesSettled = skipSubtitles;
    if (!skipSubtitles && processSubtitles) {
      List<MediaTrack> selected =
          select(tracks, TrackType.SUBTITLE, subtitleProperties.reprocessAllSubtitles());
      if (selected.isEmpty()) {
        LOGGER.info("No subtitle tracks to classify in {}", file.getFileName());
      }
      Optional<MediaTrack> firstAudio =
          tracks.stream().filter(t -> t.type() == TrackType.AUDIO).findFirst();
      subtitles = subtitleProcessor.process(file, selected, firstAudio, duration, dryRun);
      subtitlesSettled = subtitles.settled();
    }

    if (trackingProperties.enabled() && !dryRun) {
      tracker.markProcessed(file, audioSettled, subtitlesSettled);
    }
    return FileReport.of(file.toString(), audio, subtitles, audioSettled, subtitlesSettled);
  }

  private static List<MediaTrack> select(
      List<MediaTrack> tracks, TrackType type, boolean includeLabeled) {
    Predicate<MediaTrack> wanted =
        includeLabeled ? track -> true : MediaTrack::hasUndefinedLanguage;
    return tracks.stream().filter(t -> t.type() == type).filter(wanted).toList();
  }
}
