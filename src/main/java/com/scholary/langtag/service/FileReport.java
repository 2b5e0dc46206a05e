package com.scholary.langtag.service;

import java.util.ArrayList;
import java.util.List;

/**
 * Everything that happened to one file during a run.
 *
 * <p>Per-track failures are data, never exceptions. {@code error} is only set when the file as a
 * whole could not be processed, for example because no probe tool could read it.
 */
public record FileReport(
    String file,
    boolean skippedByTracker,
    List<AudioTrackResult> audioTracks,
    List<SubtitleTrackResult> subtitleTracks,
    List<SkippedTrack> skippedTracks,
    List<TrackFailure> failures,
    boolean audioSettled,
    boolean subtitlesSettled,
    String error) {

  public FileReport {
    audioTracks = List.copyOf(audioTracks);
    subtitleTracks = List.copyOf(subtitleTracks);
    skippedTracks = List.copyOf(skippedTracks);
    failures = List.copyOf(failures);
  }

  public static FileReport skipped(String file) {
    return new FileReport(file, true, List.of(), List.of(), List.of(), List.of(), true, true, null);
  }

  public static FileReport failed(String file, String error) {
    return new FileReport(
        file, false, List.of(), List.of(), List.of(), List.of(), false, false, error);
  }

  public static FileReport of(
      String file,
      TrackBatch<AudioTrackResult> audio,
      TrackBatch<SubtitleTrackResult> subtitles,
      boolean audioSettled,
      boolean subtitlesSettled) {
    List<SkippedTrack> skipped = new ArrayList<>(audio.skipped());
    skipped.addAll(subtitles.skipped());
    List<TrackFailure> failures = new ArrayList<>(audio.failures());
    failures.addAll(subtitles.failures());
    return new FileReport(
        file,
        false,
        audio.updated(),
        subtitles.updated(),
        skipped,
        failures,
        audioSettled,
        subtitlesSettled,
        null);
  }

  public int updatedTrackCount() {
    return audioTracks.size() + subtitleTracks.size();
  }
}
