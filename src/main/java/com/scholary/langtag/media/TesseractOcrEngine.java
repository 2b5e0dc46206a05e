package com.scholary.langtag.media;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import org.springframework.stereotype.Component;

/** Runs {@code tesseract <image> stdout --psm 6}, treating each frame as one block of text. */
@Component
public class TesseractOcrEngine implements OcrEngine {

  private final FfmpegProperties properties;
  private final ProcessRunner processRunner;

  public TesseractOcrEngine(FfmpegProperties properties, ProcessRunner processRunner) {
    this.properties = properties;
    this.processRunner = processRunner;
  }

  @Override
  public String recognize(Path image) throws IOException {
    ProcessResult result =
        processRunner.run(
            List.of(properties.tesseractBinary(), image.toString(), "stdout", "--psm", "6"),
            Duration.ofSeconds(properties.probeTimeoutSeconds()));
    if (!result.succeeded()) {
      throw new IOException("tesseract exited with code " + result.exitCode() + " for " + image);
    }
    return result.stdout().trim();
  }
}
