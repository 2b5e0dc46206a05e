package com.scholary.langtag.whisper;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for Whisper API client.
 *
 * <p>These control how we connect to the Whisper service and handle timeouts/retries.
 * {@code vadSupported} states whether the deployed service accepts voice-activity filter
 * parameters; when false, every transcription runs unfiltered.
 */
@ConfigurationProperties(prefix = "whisper")
@Validated
public record WhisperProperties(
    @NotBlank String baseUrl,
    @Positive int connectTimeout,
    @Positive int readTimeout,
    @Positive int maxRetries,
    boolean vadSupported,
    @Positive int vadMinSpeechMs,
    @Positive int vadMaxSpeechSeconds) {}
