package com.scholary.langtag.whisper;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublisher;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * HTTP client for calling the faster-whisper transcription API.
 *
 * <p>This handles the low-level HTTP communication: building multipart requests, sending files,
 * parsing responses, and retrying on transient failures.
 *
 * <p>Besides the caller's decoding options, every request carries a fixed set of
 * anti-hallucination parameters (repetition penalty, no-repeat n-gram size, compression and
 * log-probability thresholds, no conditioning on previous text). Voice-activity parameters are
 * only sent when the service declares VAD support.
 */
@Component
public class WhisperClient implements WhisperService {

  private static final Logger LOGGER = LoggerFactory.getLogger(WhisperClient.class);

  private static final Map<String, String> DECODING_DEFAULTS;

  static {
    Map<String, String> defaults = new LinkedHashMap<>();
    defaults.put("task", "transcribe");
    defaults.put("repetition_penalty", "1.2");
    defaults.put("no_repeat_ngram_size", "3");
    defaults.put("compression_ratio_threshold", "2.0");
    defaults.put("log_prob_threshold", "-0.8");
    defaults.put("no_speech_threshold", "0.6");
    defaults.put("condition_on_previous_text", "false");
    DECODING_DEFAULTS = Collections.unmodifiableMap(defaults);
  }

  private final HttpClient httpClient;
  private final WhisperProperties properties;
  private final ObjectMapper objectMapper;

  public WhisperClient(WhisperProperties properties, ObjectMapper objectMapper) {
    this.properties = properties;
    this.objectMapper = objectMapper;

    this.httpClient =
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
            .build();

    LOGGER.info(
        "Initialized Whisper client: baseUrl={}, vadSupported={}",
        properties.baseUrl(),
        properties.vadSupported());
  }

  /**
   * Transcribe an audio file.
   *
   * <p>Sends the audio file to the Whisper API as multipart/form-data and returns the parsed
   * response. Includes retry logic for transient failures.
   *
   * @throws WhisperException if transcription fails after retries
   */
  @Override
  public WhisperResponse transcribe(Path audioFile, TranscriptionOptions options) {
    LOGGER.debug("Transcribing: file={}, options={}", audioFile.getFileName(), options);

    int attempt = 0;
    Exception lastException = null;

    while (attempt < properties.maxRetries()) {
      try {
        return attemptTranscribe(audioFile, options);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new WhisperException("Transcription interrupted", e);
      } catch (IOException e) {
        lastException = e;
        attempt++;
        if (attempt < properties.maxRetries()) {
          // Exponential backoff with jitter
          long backoffMs = (long) (Math.pow(2, attempt) * 1000 + Math.random() * 1000);
          LOGGER.warn(
              "Transcription attempt {} failed, retrying in {}ms: {}",
              attempt,
              backoffMs,
              e.getMessage());
          try {
            Thread.sleep(backoffMs);
          } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new WhisperException("Transcription interrupted", ie);
          }
        }
      }
    }

    throw new WhisperException(
        String.format("Transcription failed after %d attempts", properties.maxRetries()),
        lastException);
  }

  private WhisperResponse attemptTranscribe(Path audioFile, TranscriptionOptions options)
      throws IOException, InterruptedException {

    String boundary = UUID.randomUUID().toString();
    BodyPublisher bodyPublisher = buildMultipartBody(audioFile, formFields(options), boundary);

    HttpRequest request =
        HttpRequest.newBuilder()
            .uri(URI.create(properties.baseUrl() + "/api/v1/transcribe"))
            .timeout(Duration.ofSeconds(properties.readTimeout()))
            .header("Content-Type", "multipart/form-data; boundary=" + boundary)
            .POST(bodyPublisher)
            .build();

    LOGGER.debug("Sending transcription request to {}", request.uri());

    HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

    if (response.statusCode() != 200) {
      throw new IOException(
          String.format(
              "Whisper API returned status %d: %s", response.statusCode(), response.body()));
    }

    WhisperResponse whisperResponse =
        objectMapper.readValue(response.body(), WhisperResponse.class);

    LOGGER.debug(
        "Transcription successful: {} segments, language={}, probability={}",
        whisperResponse.segments().size(),
        whisperResponse.language(),
        whisperResponse.languageProbability());

    return whisperResponse;
  }

  /** Form fields for one request, in a stable order. */
  Map<String, String> formFields(TranscriptionOptions options) {
    boolean vad = options.vadFilter() && properties.vadSupported();

    Map<String, String> fields = new LinkedHashMap<>(DECODING_DEFAULTS);
    fields.put("beam_size", String.valueOf(options.beamSize()));
    fields.put("best_of", String.valueOf(options.bestOf()));
    fields.put("temperature", String.valueOf(options.temperature()));
    fields.put("word_timestamps", String.valueOf(options.wordTimestamps()));
    fields.put("vad_filter", String.valueOf(vad));
    if (vad) {
      fields.put("vad_min_speech_duration_ms", String.valueOf(properties.vadMinSpeechMs()));
      fields.put("vad_max_speech_duration_s", String.valueOf(properties.vadMaxSpeechSeconds()));
    }
    return fields;
  }

  /**
   * Build a multipart/form-data body for the transcription request.
   *
   * <p>Java's HttpClient has no multipart support, so the body is assembled by hand: the file
   * part first, then one part per form field, then the closing boundary.
   */
  private BodyPublisher buildMultipartBody(
      Path audioFile, Map<String, String> fields, String boundary) throws IOException {

    String filename = audioFile.getFileName().toString();
    byte[] fileBytes = Files.readAllBytes(audioFile);

    StringBuilder sb = new StringBuilder();
    sb.append("--").append(boundary).append("\r\n");
    sb.append("Content-Disposition: form-data; name=\"file\"; filename=\"")
        .append(filename)
        .append("\"\r\n");
    sb.append("Content-Type: audio/wav\r\n\r\n");

    byte[] prefix = sb.toString().getBytes(StandardCharsets.UTF_8);

    sb = new StringBuilder();
    sb.append("\r\n");
    for (Map.Entry<String, String> field : fields.entrySet()) {
      sb.append("--").append(boundary).append("\r\n");
      sb.append("Content-Disposition: form-data; name=\"")
          .append(field.getKey())
          .append("\"\r\n\r\n");
      sb.append(field.getValue()).append("\r\n");
    }
    sb.append("--").append(boundary).append("--\r\n");

    byte[] suffix = sb.toString().getBytes(StandardCharsets.UTF_8);

    byte[] body = new byte[prefix.length + fileBytes.length + suffix.length];
    System.arraycopy(prefix, 0, body, 0, prefix.length);
    System.arraycopy(fileBytes, 0, body, prefix.length, fileBytes.length);
    System.arraycopy(suffix, 0, body, prefix.length + fileBytes.length, suffix.length);

    return BodyPublishers.ofByteArray(body);
  }
}
