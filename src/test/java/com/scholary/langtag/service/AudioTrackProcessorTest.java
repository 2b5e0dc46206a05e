package com.scholary.langtag.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.scholary.langtag.detection.AudioLanguageDetector;
import com.scholary.langtag.detection.LanguageVerdict;
import com.scholary.langtag.detection.VerdictMethod;
import com.scholary.langtag.media.MediaTrack;
import com.scholary.langtag.media.MetadataWriter;
import com.scholary.langtag.media.TrackType;
import com.scholary.langtag.service.TrackFailure.Kind;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class AudioTrackProcessorTest {

  private static final Path MOVIE = Path.of("/media/movie.mkv");
  private static final MediaTrack FIRST = new MediaTrack(TrackType.AUDIO, 0, 1, "aac", null, null);
  private static final MediaTrack SECOND =
      new MediaTrack(TrackType.AUDIO, 1, 2, "aac", "und", null);

  @Mock private AudioLanguageDetector detector;
  @Mock private MetadataWriter metadataWriter;

  private AudioTrackProcessor processor;

  @BeforeEach
  void setUp() {
    processor = new AudioTrackProcessor(detector, metadataWriter);
  }

  @Test
  void process_shouldWriteEachDetectedLanguage() throws IOException {
    when(detector.detect(MOVIE, FIRST, 7200.0))
        .thenReturn(Optional.of(new LanguageVerdict("fr", 0.95, VerdictMethod.FULL_TRACK)));
    when(detector.detect(MOVIE, SECOND, 7200.0))
        .thenReturn(Optional.of(new LanguageVerdict("zxx", 0.8, VerdictMethod.SAMPLED_SEGMENT)));

    TrackBatch<AudioTrackResult> batch =
        processor.process(MOVIE, List.of(FIRST, SECOND), 7200.0, false);

    assertThat(batch.settled()).isTrue();
    assertThat(batch.updated())
        .containsExactly(
            new AudioTrackResult(0, null, "fr", 0.95, VerdictMethod.FULL_TRACK),
            new AudioTrackResult(1, "und", "zxx", 0.8, VerdictMethod.SAMPLED_SEGMENT));
    verify(metadataWriter).writeAudioLanguage(MOVIE, FIRST, "fr", false);
    verify(metadataWriter).writeAudioLanguage(MOVIE, SECOND, "zxx", false);
  }

  @Test
  void process_shouldContinueAfterFailedTrack() throws IOException {
    when(detector.detect(MOVIE, FIRST, 7200.0)).thenReturn(Optional.empty());
    when(detector.detect(MOVIE, SECOND, 7200.0))
        .thenReturn(Optional.of(new LanguageVerdict("de", 0.92, VerdictMethod.SAMPLED_SEGMENT)));

    TrackBatch<AudioTrackResult> batch =
        processor.process(MOVIE, List.of(FIRST, SECOND), 7200.0, true);

    assertThat(batch.settled()).isFalse();
    assertThat(batch.failures())
        .containsExactly(
            new TrackFailure(
                TrackType.AUDIO,
                0,
                Kind.LOW_CONFIDENCE,
                "Failed to detect language for audio track"));
    assertThat(batch.updated()).extracting(AudioTrackResult::trackIndex).containsExactly(1);
    verify(metadataWriter).writeAudioLanguage(MOVIE, SECOND, "de", true);
  }

  @Test
  void process_shouldClassifyFailureKinds() throws IOException {
    when(detector.detect(MOVIE, FIRST, 0.0)).thenThrow(new IOException("cannot create temp dir"));
    when(detector.detect(MOVIE, SECOND, 0.0))
        .thenReturn(Optional.of(new LanguageVerdict("de", 0.92, VerdictMethod.SAMPLED_SEGMENT)));
    doThrow(new IOException("read-only file"))
        .when(metadataWriter)
        .writeAudioLanguage(any(), any(), anyString(), anyBoolean());

    TrackBatch<AudioTrackResult> batch =
        processor.process(MOVIE, List.of(FIRST, SECOND), 0.0, false);

    assertThat(batch.failures())
        .extracting(TrackFailure::kind)
        .containsExactly(Kind.EXTRACTION, Kind.WRITE);
    assertThat(batch.updated()).isEmpty();
  }
}
