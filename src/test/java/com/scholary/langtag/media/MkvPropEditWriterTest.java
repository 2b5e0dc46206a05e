package com.scholary.langtag.media;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class MkvPropEditWriterTest {

  private static final Path MOVIE = Path.of("/media/movie.mkv");
  private static final MediaTrack AUDIO =
      new MediaTrack(TrackType.AUDIO, 0, 1, "A_AC3", null, null);
  private static final MediaTrack SUBTITLE =
      new MediaTrack(TrackType.SUBTITLE, 2, 5, "S_TEXT/UTF8", "und", null);

  @Mock private ProcessRunner processRunner;

  private MkvPropEditWriter writer;

  @BeforeEach
  void setUp() {
    writer = new MkvPropEditWriter(MediaTestFixtures.ffmpegProperties(), processRunner);
  }

  @Test
  void trackSpec_shouldNumberFromOneWithinType() {
    assertThat(MkvPropEditWriter.trackSpec(AUDIO)).isEqualTo("track:a1");
    assertThat(MkvPropEditWriter.trackSpec(SUBTITLE)).isEqualTo("track:s3");
  }

  @Test
  void writeAudioLanguage_shouldSetLanguage() throws IOException {
    when(processRunner.run(any(), any())).thenReturn(new ProcessResult(0, "Done.", ""));

    writer.writeAudioLanguage(MOVIE, AUDIO, "fr", false);

    verify(processRunner)
        .run(
            eq(
                List.of(
                    "mkvpropedit",
                    "/media/movie.mkv",
                    "--edit",
                    "track:a1",
                    "--set",
                    "language=fr")),
            any());
  }

  @Test
  void writeSubtitleMetadata_shouldSetLanguageNameAndForcedFlag() throws IOException {
    when(processRunner.run(any(), any())).thenReturn(new ProcessResult(0, "Done.", ""));

    writer.writeSubtitleMetadata(MOVIE, SUBTITLE, "en", "English [Forced]", true, false);

    verify(processRunner)
        .run(
            eq(
                List.of(
                    "mkvpropedit",
                    "/media/movie.mkv",
                    "--edit",
                    "track:s3",
                    "--set",
                    "language=en",
                    "--set",
                    "name=English [Forced]",
                    "--set",
                    "flag-forced=1")),
            any());
  }

  @Test
  void dryRun_shouldNeverRunTheTool() throws IOException {
    writer.writeAudioLanguage(MOVIE, AUDIO, "fr", true);
    writer.writeSubtitleMetadata(MOVIE, SUBTITLE, "en", "English", false, true);

    verifyNoInteractions(processRunner);
  }

  @Test
  void writeAudioLanguage_shouldFailOnNonZeroExit() throws IOException {
    when(processRunner.run(any(), any()))
        .thenReturn(new ProcessResult(2, "", "Error: file is read-only"));

    assertThatThrownBy(() -> writer.writeAudioLanguage(MOVIE, AUDIO, "fr", false))
        .isInstanceOf(IOException.class)
        .hasMessageContaining("read-only");
  }
}
