package com.scholary.langtag.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.scholary.langtag.config.DetectionProperties;
import com.scholary.langtag.config.SubtitleProperties;
import com.scholary.langtag.config.SubtitleProperties.ForcedThresholds;
import com.scholary.langtag.media.MediaExtractor;
import com.scholary.langtag.media.MediaTrack;
import com.scholary.langtag.media.MetadataWriter;
import com.scholary.langtag.media.TrackType;
import com.scholary.langtag.service.TrackFailure.Kind;
import com.scholary.langtag.subtitle.ConfidenceTier;
import com.scholary.langtag.subtitle.ForcedSubtitleDetector;
import com.scholary.langtag.subtitle.ForcedVerdict;
import com.scholary.langtag.subtitle.LanguageGuess;
import com.scholary.langtag.subtitle.SdhDetector;
import com.scholary.langtag.subtitle.SubtitleEntry;
import com.scholary.langtag.subtitle.SubtitleLanguageDetector;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SubtitleTrackProcessorTest {

  private static final Path MOVIE = Path.of("/media/movie.mkv");
  private static final MediaTrack AUDIO = new MediaTrack(TrackType.AUDIO, 0, 1, "aac", "en", null);
  private static final MediaTrack TEXT_TRACK =
      new MediaTrack(TrackType.SUBTITLE, 0, 2, "S_TEXT/UTF8", "und", null);
  private static final MediaTrack PGS_TRACK =
      new MediaTrack(TrackType.SUBTITLE, 1, 3, "S_HDMV/PGS", null, null);

  private static final String SRT =
      """
      1
      00:00:01,000 --> 00:00:03,000
      [door closes]

      2
      00:00:04,000 --> 00:00:06,000
      We should leave before dawn.
      """;

  @Mock private MediaExtractor mediaExtractor;
  @Mock private SubtitleLanguageDetector languageDetector;
  @Mock private ForcedSubtitleDetector forcedDetector;
  @Mock private MetadataWriter metadataWriter;

  @TempDir Path tempDir;

  private SubtitleTrackProcessor processor;

  @BeforeEach
  void setUp() {
    DetectionProperties detection =
        new DetectionProperties(0.9, 3, true, 300, tempDir.toString(), true, false, false, false);
    SubtitleProperties subtitles =
        new SubtitleProperties(true, false, true, 0.85, false, ForcedThresholds.defaults());
    processor =
        new SubtitleTrackProcessor(
            mediaExtractor,
            languageDetector,
            forcedDetector,
            new SdhDetector(),
            metadataWriter,
            subtitles,
            detection);
  }

  private Path srtPayload() throws IOException {
    Path payload = tempDir.resolve("subtitle_0.srt");
    Files.writeString(payload, SRT);
    when(mediaExtractor.extractSubtitle(eq(MOVIE), eq(TEXT_TRACK), any()))
        .thenReturn(Optional.of(payload));
    return payload;
  }

  @Test
  void process_shouldWriteLanguageTitleAndFlags() throws IOException {
    Path payload = srtPayload();
    when(languageDetector.detectText(anyList()))
        .thenReturn(Optional.of(new LanguageGuess("en", 0.99)));
    when(forcedDetector.detect(
            eq(MOVIE), eq(TEXT_TRACK), anyList(), eq(Optional.of(AUDIO)), eq(600.0)))
        .thenReturn(ForcedVerdict.forced("Very few subtitles (2 < 50)", ConfidenceTier.HIGH));

    TrackBatch<SubtitleTrackResult> batch =
        processor.process(MOVIE, List.of(TEXT_TRACK), Optional.of(AUDIO), 600.0, false);

    assertThat(batch.settled()).isTrue();
    assertThat(batch.updated())
        .containsExactly(
            new SubtitleTrackResult(0, "und", "en", 0.99, true, true, "English [Forced] [SDH]"));
    verify(metadataWriter)
        .writeSubtitleMetadata(MOVIE, TEXT_TRACK, "en", "English [Forced] [SDH]", true, false);
    assertThat(payload).doesNotExist();
  }

  @Test
  void process_shouldPassParsedCuesToDetectors() throws IOException {
    srtPayload();
    when(languageDetector.detectText(anyList()))
        .thenReturn(Optional.of(new LanguageGuess("en", 0.99)));
    when(forcedDetector.detect(any(), any(), anyList(), any(), anyDouble()))
        .thenReturn(ForcedVerdict.full("Dense", ConfidenceTier.HIGH));

    processor.process(MOVIE, List.of(TEXT_TRACK), Optional.empty(), 600.0, true);

    @SuppressWarnings("unchecked")
    ArgumentCaptor<List<SubtitleEntry>> cues = ArgumentCaptor.forClass(List.class);
    verify(languageDetector).detectText(cues.capture());
    assertThat(cues.getValue()).extracting(SubtitleEntry::index).containsExactly(1, 2);
    verify(metadataWriter)
        .writeSubtitleMetadata(MOVIE, TEXT_TRACK, "en", "English [SDH]", false, true);
  }

  @Test
  void process_shouldSkipTrackBelowConfidenceThreshold() throws IOException {
    srtPayload();
    when(languageDetector.detectText(anyList()))
        .thenReturn(Optional.of(new LanguageGuess("en", 0.6)));

    TrackBatch<SubtitleTrackResult> batch =
        processor.process(MOVIE, List.of(TEXT_TRACK), Optional.of(AUDIO), 600.0, false);

    assertThat(batch.updated()).isEmpty();
    assertThat(batch.skipped())
        .containsExactly(
            new SkippedTrack(
                TrackType.SUBTITLE, 0, "en", 0.6, SubtitleTrackProcessor.BELOW_THRESHOLD));
    assertThat(batch.settled()).isTrue();
    verifyNoInteractions(forcedDetector, metadataWriter);
  }

  @Test
  void process_shouldReportExtractionFailure() {
    when(mediaExtractor.extractSubtitle(any(), any(), any())).thenReturn(Optional.empty());

    TrackBatch<SubtitleTrackResult> batch =
        processor.process(MOVIE, List.of(TEXT_TRACK), Optional.of(AUDIO), 600.0, false);

    assertThat(batch.failures()).extracting(TrackFailure::kind).containsExactly(Kind.EXTRACTION);
    assertThat(batch.settled()).isFalse();
  }

  @Test
  void process_shouldReportMissingLanguage() throws IOException {
    srtPayload();
    when(languageDetector.detectText(anyList())).thenReturn(Optional.empty());

    TrackBatch<SubtitleTrackResult> batch =
        processor.process(MOVIE, List.of(TEXT_TRACK), Optional.of(AUDIO), 600.0, false);

    assertThat(batch.failures()).extracting(TrackFailure::kind).containsExactly(Kind.INFERENCE);
  }

  @Test
  void process_shouldReportWriteFailure() throws IOException {
    srtPayload();
    when(languageDetector.detectText(anyList()))
        .thenReturn(Optional.of(new LanguageGuess("en", 0.99)));
    when(forcedDetector.detect(any(), any(), anyList(), any(), anyDouble()))
        .thenReturn(ForcedVerdict.full("Dense", ConfidenceTier.HIGH));
    doThrow(new IOException("mkvpropedit exited with code 2"))
        .when(metadataWriter)
        .writeSubtitleMetadata(any(), any(), anyString(), anyString(), anyBoolean(), anyBoolean());

    TrackBatch<SubtitleTrackResult> batch =
        processor.process(MOVIE, List.of(TEXT_TRACK), Optional.of(AUDIO), 600.0, false);

    assertThat(batch.failures())
        .containsExactly(
            new TrackFailure(TrackType.SUBTITLE, 0, Kind.WRITE, "mkvpropedit exited with code 2"));
  }

  @Test
  void process_shouldUseOcrForBitmapTracks() throws IOException {
    Path payload = Files.write(tempDir.resolve("subtitle_1.sup"), new byte[64]);
    when(mediaExtractor.extractSubtitle(eq(MOVIE), eq(PGS_TRACK), any()))
        .thenReturn(Optional.of(payload));
    when(languageDetector.detectImage(MOVIE, PGS_TRACK))
        .thenReturn(Optional.of(new LanguageGuess("de", 0.9)));
    when(forcedDetector.detect(MOVIE, PGS_TRACK, List.of(), Optional.of(AUDIO), 600.0))
        .thenReturn(ForcedVerdict.full("High frame density (40.0/min)", ConfidenceTier.HIGH));

    TrackBatch<SubtitleTrackResult> batch =
        processor.process(MOVIE, List.of(PGS_TRACK), Optional.of(AUDIO), 600.0, false);

    assertThat(batch.updated()).extracting(SubtitleTrackResult::title).containsExactly("German");
    verify(languageDetector, never()).detectText(anyList());
    assertThat(payload).doesNotExist();
  }
}
