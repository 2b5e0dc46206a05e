package com.scholary.langtag.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for subtitle track processing.
 *
 * <p>{@code analyzeForcedAudio} enables the speech-overlap analysis for subtitle tracks whose
 * timing statistics are ambiguous. It decodes the full audio track, so it is off by default.
 */
@ConfigurationProperties(prefix = "subtitles")
@Validated
public record SubtitleProperties(
    boolean processSubtitles,
    boolean analyzeForcedAudio,
    boolean detectSdh,
    @DecimalMin("0.0") @DecimalMax("1.0") double confidenceThreshold,
    boolean reprocessAllSubtitles,
    @NotNull @Valid ForcedThresholds forced) {

  /**
   * Tier-1 thresholds of the forced-subtitle classifier.
   *
   * @param lowDensity entries per minute below which a sparse track looks forced
   * @param highDensity entries per minute above which a dense track looks full
   * @param lowCoverage percent of runtime below which a track looks forced
   * @param highCoverage percent of runtime above which a track looks full
   * @param minCount entry count below which a track is forced
   * @param maxCount entry count above which a long track is full
   */
  public record ForcedThresholds(
      @Positive double lowDensity,
      @Positive double highDensity,
      @Positive double lowCoverage,
      @Positive double highCoverage,
      @Positive int minCount,
      @Positive int maxCount) {

    public static ForcedThresholds defaults() {
      return new ForcedThresholds(3.0, 8.0, 25.0, 50.0, 50, 300);
    }
  }
}
