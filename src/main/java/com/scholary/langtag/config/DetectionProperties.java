package com.scholary.langtag.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for audio language detection and run-wide modes.
 *
 * <p>{@code forceReprocess} ignores the processing tracker for both track types;
 * {@code reprocessAllAudio} also classifies audio tracks that already carry a language tag.
 * {@code dryRun} computes verdicts without writing metadata or marking files processed.
 */
@ConfigurationProperties(prefix = "detection")
@Validated
public record DetectionProperties(
    @DecimalMin("0.0") @DecimalMax("1.0") double confidenceThreshold,
    @Positive int maxRetries,
    boolean vadFilter,
    @Positive int operationTimeoutSeconds,
    @NotBlank String tempDir,
    boolean processAudio,
    boolean reprocessAllAudio,
    boolean forceReprocess,
    boolean dryRun) {}
