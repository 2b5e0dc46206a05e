package com.scholary.langtag.whisper;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Map;
import org.junit.jupiter.api.Test;

class WhisperClientTest {

  private final ObjectMapper objectMapper = new ObjectMapper();

  private WhisperClient client(boolean vadSupported) {
    return new WhisperClient(
        new WhisperProperties("http://localhost:9000", 5, 30, 1, vadSupported, 250, 30),
        objectMapper);
  }

  @Test
  void formFields_shouldIncludeVoiceFilterSettingsWhenSupported() {
    Map<String, String> fields = client(true).formFields(TranscriptionOptions.filtered());

    assertThat(fields)
        .containsEntry("task", "transcribe")
        .containsEntry("condition_on_previous_text", "false")
        .containsEntry("no_speech_threshold", "0.6")
        .containsEntry("beam_size", "3")
        .containsEntry("best_of", "2")
        .containsEntry("temperature", "0.0")
        .containsEntry("vad_filter", "true")
        .containsEntry("vad_min_speech_duration_ms", "250")
        .containsEntry("vad_max_speech_duration_s", "30");
  }

  @Test
  void formFields_shouldKeepDeclarationOrder() {
    Map<String, String> fields = client(true).formFields(TranscriptionOptions.filtered());

    assertThat(fields.keySet())
        .containsExactly(
            "task",
            "repetition_penalty",
            "no_repeat_ngram_size",
            "compression_ratio_threshold",
            "log_prob_threshold",
            "no_speech_threshold",
            "condition_on_previous_text",
            "beam_size",
            "best_of",
            "temperature",
            "word_timestamps",
            "vad_filter",
            "vad_min_speech_duration_ms",
            "vad_max_speech_duration_s");
  }

  @Test
  void formFields_shouldOmitVoiceFilterSettingsForUnfilteredAttempt() {
    Map<String, String> fields = client(true).formFields(TranscriptionOptions.unfiltered());

    assertThat(fields)
        .containsEntry("vad_filter", "false")
        .containsEntry("temperature", "0.2")
        .doesNotContainKey("vad_min_speech_duration_ms");
  }

  @Test
  void formFields_shouldDisableVoiceFilterWhenServiceLacksSupport() {
    Map<String, String> fields = client(false).formFields(TranscriptionOptions.speechTiming());

    assertThat(fields)
        .containsEntry("vad_filter", "false")
        .containsEntry("word_timestamps", "true")
        .containsEntry("beam_size", "1")
        .doesNotContainKey("vad_max_speech_duration_s");
  }

  @Test
  void response_shouldDeserializeServiceJson() throws Exception {
    String json =
        """
        {"language": "french", "language_probability": 0.87, "duration": 60.0,
         "segments": [{"id": 0, "start": 1.5, "end": 3.0, "text": " Bonjour", "avg_logprob": -0.2},
                      {"id": 1, "start": 4.0, "end": 5.0, "text": " merci"}]}
        """;

    WhisperResponse response = objectMapper.readValue(json, WhisperResponse.class);

    assertThat(response.language()).isEqualTo("french");
    assertThat(response.languageProbability()).isEqualTo(0.87);
    assertThat(response.segments()).hasSize(2);
    assertThat(response.segments().get(0).confidence()).isEqualTo(0.8, within(1e-9));
    assertThat(response.segments().get(1).confidence()).isNull();
  }

  @Test
  void response_shouldTolerateMissingSegments() throws Exception {
    WhisperResponse response =
        objectMapper.readValue(
            "{\"language\": \"en\", \"language_probability\": 0.5}", WhisperResponse.class);

    assertThat(response.segments()).isEmpty();
  }
}
