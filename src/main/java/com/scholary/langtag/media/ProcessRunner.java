package com.scholary.langtag.media;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Runs external tools (ffmpeg, ffprobe, mkvmerge, mkvpropedit, tesseract) with a wall-clock bound.
 *
 * <p>stdout and stderr are redirected to temporary files rather than pipes, so a chatty tool can
 * never block on a full pipe buffer while we wait for it. On timeout the process is asked to stop,
 * then killed, and a {@link ProcessTimeoutException} is raised.
 */
@Component
public class ProcessRunner {

  private static final Logger LOGGER = LoggerFactory.getLogger(ProcessRunner.class);

  private static final Duration GRACEFUL_SHUTDOWN = Duration.ofSeconds(2);

  /**
   * Run a command to completion.
   *
   * @param command executable followed by its arguments
   * @param timeout maximum wall-clock time
   * @return exit code and captured output
   * @throws ProcessTimeoutException if the process outlives the timeout
   * @throws IOException if the process cannot be started or is interrupted
   */
  public ProcessResult run(List<String> command, Duration timeout) throws IOException {
    LOGGER.debug("Executing: {}", String.join(" ", command));

    Path stdoutFile = Files.createTempFile("proc-out-", ".log");
    Path stderrFile = Files.createTempFile("proc-err-", ".log");
    try {
      Process process =
          new ProcessBuilder(command)
              .redirectOutput(stdoutFile.toFile())
              .redirectError(stderrFile.toFile())
              .start();

      boolean finished;
      try {
        finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
      } catch (InterruptedException e) {
        destroy(process);
        Thread.currentThread().interrupt();
        throw new IOException(command.get(0) + " interrupted", e);
      }

      if (!finished) {
        LOGGER.warn("{} exceeded {}s, destroying process", command.get(0), timeout.toSeconds());
        destroy(process);
        throw new ProcessTimeoutException(command.get(0), timeout);
      }

      return new ProcessResult(
          process.exitValue(),
          readLossy(stdoutFile),
          readLossy(stderrFile));
    } finally {
      Files.deleteIfExists(stdoutFile);
      Files.deleteIfExists(stderrFile);
    }
  }

  // tools print file names in arbitrary encodings; replace rather than fail
  private static String readLossy(Path file) throws IOException {
    return new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
  }

  private void destroy(Process process) {
    process.destroy();
    try {
      if (!process.waitFor(GRACEFUL_SHUTDOWN.toMillis(), TimeUnit.MILLISECONDS)) {
        process.destroyForcibly();
      }
    } catch (InterruptedException e) {
      process.destroyForcibly();
      Thread.currentThread().interrupt();
    }
  }
}
