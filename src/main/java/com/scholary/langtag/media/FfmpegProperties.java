package com.scholary.langtag.media;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the external media toolchain.
 *
 * <p>Binary names are resolved through PATH unless given as absolute paths. The audio settings
 * produce the mono 16 kHz WAV that the speech model expects; the filter chain boosts quiet
 * dialogue and trims rumble and hiss before recognition.
 */
@ConfigurationProperties(prefix = "ffmpeg")
@Validated
public record FfmpegProperties(
    @NotBlank String ffmpegBinary,
    @NotBlank String ffprobeBinary,
    @NotBlank String mkvmergeBinary,
    @NotBlank String mkvpropeditBinary,
    @NotBlank String tesseractBinary,
    @Positive int sampleRate,
    @NotBlank String audioFilter,
    @Positive long minSampleBytes,
    double silenceFloorDb,
    @Positive int probeTimeoutSeconds,
    @Positive int sampleTimeoutSeconds) {}
