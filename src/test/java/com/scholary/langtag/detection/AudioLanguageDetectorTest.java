package com.scholary.langtag.detection;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.scholary.langtag.config.DetectionProperties;
import com.scholary.langtag.media.MediaExtractor;
import com.scholary.langtag.media.MediaTrack;
import com.scholary.langtag.media.TrackType;
import com.scholary.langtag.whisper.TranscriptSegment;
import com.scholary.langtag.whisper.WhisperProperties;
import com.scholary.langtag.whisper.WhisperResponse;
import com.scholary.langtag.whisper.WhisperService;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/** Exercises the retry, full-track and aggregation steps against a scripted speech service. */
@ExtendWith(MockitoExtension.class)
class AudioLanguageDetectorTest {

  private static final Path MOVIE = Path.of("/media/movie.mkv");
  private static final MediaTrack TRACK =
      new MediaTrack(TrackType.AUDIO, 0, 1, "aac", "und", null);

  private static final String FRENCH_TEXT =
      "Bonjour tout le monde, nous sommes réunis ici pour parler de la situation du pays.";
  private static final String GERMAN_TEXT =
      "Wir treffen uns morgen früh am Bahnhof und fahren dann gemeinsam in die Stadt.";
  private static final String ENGLISH_TEXT =
      "The committee will reconvene on Thursday to discuss the proposed budget for next year.";

  @Mock private MediaExtractor mediaExtractor;
  @Mock private WhisperService whisperService;

  @TempDir Path tempDir;

  private Path workDir;
  private AudioLanguageDetector detector;

  @BeforeEach
  void setUp() {
    workDir = tempDir.resolve("work");
    DetectionProperties properties =
        new DetectionProperties(0.9, 3, true, 300, workDir.toString(), true, false, false, false);
    WhisperProperties whisperProperties =
        new WhisperProperties("http://localhost:9000", 5, 30, 1, true, 250, 30);
    HallucinationFilter filter = new HallucinationFilter();
    AudioSampleAnalyzer analyzer =
        new AudioSampleAnalyzer(
            new TranscriptionAttemptEvaluator(whisperService),
            new VerdictClassifier(filter),
            properties,
            whisperProperties);
    detector =
        new AudioLanguageDetector(
            mediaExtractor, analyzer, new SampleWindowPlanner(), properties);
  }

  private void samplesExtractable() {
    when(mediaExtractor.extractAudioSample(any(), any(), any(), any()))
        .thenAnswer(invocation -> Optional.of(audioFile(invocation.getArgument(3), "sample")));
  }

  private void fullTrackExtractable() {
    when(mediaExtractor.extractFullAudio(any(), any(), any(), any()))
        .thenAnswer(invocation -> Optional.of(audioFile(invocation.getArgument(2), "full")));
  }

  private static Path audioFile(Path dir, String prefix) throws IOException {
    Path file = Files.createTempFile(dir, prefix, ".wav");
    Files.write(file, new byte[4096]);
    return file;
  }

  private static WhisperResponse speech(String language, double probability, String text) {
    return new WhisperResponse(
        List.of(new TranscriptSegment(0.0, 5.0, text, null)), language, probability);
  }

  private static boolean isFullTrack(Path audio) {
    return audio.getFileName().toString().startsWith("full");
  }

  @Test
  void detect_shouldFallBackToFullTrackWhenSamplesAreUnsure() throws IOException {
    samplesExtractable();
    fullTrackExtractable();
    when(whisperService.transcribe(any(), any()))
        .thenAnswer(
            invocation ->
                isFullTrack(invocation.getArgument(0))
                    ? speech("french", 0.95, FRENCH_TEXT)
                    : speech("french", 0.4, FRENCH_TEXT));

    Optional<LanguageVerdict> verdict = detector.detect(MOVIE, TRACK, 7200);

    assertThat(verdict).contains(new LanguageVerdict("fr", 0.95, VerdictMethod.FULL_TRACK));
    verify(mediaExtractor, times(3)).extractAudioSample(any(), any(), any(), any());
    verify(whisperService, times(4)).transcribe(any(), any());
    try (Stream<Path> leftovers = Files.list(workDir)) {
      assertThat(leftovers).isEmpty();
    }
  }

  @Test
  void detect_shouldStopAtFirstConfidentSample() throws IOException {
    samplesExtractable();
    when(whisperService.transcribe(any(), any()))
        .thenReturn(speech("english", 0.97, ENGLISH_TEXT));

    Optional<LanguageVerdict> verdict = detector.detect(MOVIE, TRACK, 7200);

    assertThat(verdict).contains(new LanguageVerdict("en", 0.97, VerdictMethod.SAMPLED_SEGMENT));
    verify(mediaExtractor, times(1)).extractAudioSample(any(), any(), any(), any());
    verify(mediaExtractor, never()).extractFullAudio(any(), any(), any(), any());
  }

  @Test
  void detect_shouldTrustFullTrackSilence() throws IOException {
    samplesExtractable();
    fullTrackExtractable();
    when(whisperService.transcribe(any(), any()))
        .thenReturn(new WhisperResponse(List.of(), "english", 0.99));

    Optional<LanguageVerdict> verdict = detector.detect(MOVIE, TRACK, 7200);

    assertThat(verdict).isPresent();
    assertThat(verdict.get().languageCode()).isEqualTo("zxx");
    assertThat(verdict.get().method()).isEqualTo(VerdictMethod.FULL_TRACK);
  }

  @Test
  void detect_shouldAggregateSamplesWhenFullTrackUnavailable() throws IOException {
    samplesExtractable();
    when(mediaExtractor.extractFullAudio(any(), any(), any(), any())).thenReturn(Optional.empty());
    Deque<WhisperResponse> responses =
        new ArrayDeque<>(
            List.of(
                speech("french", 0.5, FRENCH_TEXT),
                speech("german", 0.6, GERMAN_TEXT),
                speech("french", 0.45, FRENCH_TEXT)));
    when(whisperService.transcribe(any(), any())).thenAnswer(invocation -> responses.poll());

    Optional<LanguageVerdict> verdict = detector.detect(MOVIE, TRACK, 7200);

    assertThat(verdict)
        .contains(new LanguageVerdict("fr", 0.5, VerdictMethod.AGGREGATED_MAJORITY));
  }

  @Test
  void detect_shouldAggregateWhenFullTrackIsBelowThreshold() throws IOException {
    samplesExtractable();
    fullTrackExtractable();
    when(whisperService.transcribe(any(), any()))
        .thenAnswer(
            invocation ->
                isFullTrack(invocation.getArgument(0))
                    ? speech("german", 0.5, GERMAN_TEXT)
                    : speech("french", 0.7, FRENCH_TEXT));

    Optional<LanguageVerdict> verdict = detector.detect(MOVIE, TRACK, 7200);

    assertThat(verdict)
        .contains(new LanguageVerdict("fr", 0.7, VerdictMethod.AGGREGATED_MAJORITY));
  }

  @Test
  void detect_shouldFailWhenNothingCanBeExtracted() throws IOException {
    when(mediaExtractor.extractAudioSample(any(), any(), any(), any()))
        .thenReturn(Optional.empty());
    when(mediaExtractor.extractFullAudio(any(), any(), any(), any())).thenReturn(Optional.empty());

    assertThat(detector.detect(MOVIE, TRACK, 7200)).isEmpty();
    verify(mediaExtractor, times(15)).extractAudioSample(any(), any(), any(), any());
    verify(whisperService, never()).transcribe(any(), any());
  }
}
