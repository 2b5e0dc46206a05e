package com.scholary.langtag.whisper;

import java.nio.file.Path;

/**
 * Interface for transcription services.
 *
 * <p>This abstraction keeps the detection engine independent of how the speech model is hosted.
 */
public interface WhisperService {

  /**
   * Transcribe an audio file.
   *
   * @param audioFile the mono WAV to transcribe
   * @param options decoding parameters
   * @return the transcription response
   * @throws WhisperException if transcription fails
   */
  WhisperResponse transcribe(Path audioFile, TranscriptionOptions options);
}
