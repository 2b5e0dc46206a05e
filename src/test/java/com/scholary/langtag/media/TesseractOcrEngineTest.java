package com.scholary.langtag.media;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TesseractOcrEngineTest {

  private static final Path FRAME = Path.of("/tmp/frames/sub_0001.png");
  private static final List<String> COMMAND =
      List.of("tesseract", FRAME.toString(), "stdout", "--psm", "6");

  @Mock private ProcessRunner processRunner;

  @Test
  void recognize_shouldReturnTrimmedText() throws IOException {
    when(processRunner.run(eq(COMMAND), any()))
        .thenReturn(new ProcessResult(0, "  Where are you going?\n\n", ""));
    TesseractOcrEngine engine =
        new TesseractOcrEngine(MediaTestFixtures.ffmpegProperties(), processRunner);

    assertThat(engine.recognize(FRAME)).isEqualTo("Where are you going?");
  }

  @Test
  void recognize_shouldFailOnNonZeroExit() throws IOException {
    when(processRunner.run(eq(COMMAND), any()))
        .thenReturn(new ProcessResult(1, "", "Error opening data file"));
    TesseractOcrEngine engine =
        new TesseractOcrEngine(MediaTestFixtures.ffmpegProperties(), processRunner);

    assertThatThrownBy(() -> engine.recognize(FRAME))
        .isInstanceOf(IOException.class)
        .hasMessageContaining("exited with code 1");
  }
}
