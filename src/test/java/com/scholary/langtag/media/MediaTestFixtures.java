package com.scholary.langtag.media;

/** Shared configuration for media toolchain tests. */
final class MediaTestFixtures {

  private MediaTestFixtures() {}

  static FfmpegProperties ffmpegProperties() {
    return new FfmpegProperties(
        "ffmpeg",
        "ffprobe",
        "mkvmerge",
        "mkvpropedit",
        "tesseract",
        16000,
        "highpass=f=80,lowpass=f=8000",
        1000,
        -60.0,
        30,
        60);
  }
}
