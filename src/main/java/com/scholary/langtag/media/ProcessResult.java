package com.scholary.langtag.media;

/** Exit status and captured output of one external process run. */
public record ProcessResult(int exitCode, String stdout, String stderr) {

  public boolean succeeded() {
    return exitCode == 0;
  }
}
