package com.scholary.langtag.media;

import java.io.IOException;
import java.time.Duration;

/** Thrown when an external tool exceeds its wall-clock bound and had to be destroyed. */
public class ProcessTimeoutException extends IOException {

  private final Duration timeout;

  public ProcessTimeoutException(String command, Duration timeout) {
    super(String.format("%s did not finish within %ds", command, timeout.toSeconds()));
    this.timeout = timeout;
  }

  public Duration getTimeout() {
    return timeout;
  }
}
