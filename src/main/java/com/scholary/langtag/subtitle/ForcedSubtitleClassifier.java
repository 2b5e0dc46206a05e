package com.scholary.langtag.subtitle;

import com.scholary.langtag.config.SubtitleProperties;
import com.scholary.langtag.config.SubtitleProperties.ForcedThresholds;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.springframework.stereotype.Component;

/**
 * Decides forced vs. full subtitles from timing statistics alone.
 *
 * <p>Clear-cut tracks are settled by single thresholds ({@link ConfidenceTier#HIGH}). Otherwise
 * four independent signals vote, and a one-sided vote of at least two decides
 * ({@link ConfidenceTier#MEDIUM}). Anything left is ambiguous: either speech-overlap analysis is
 * requested or, when that is disabled, a midpoint heuristic decides ({@link ConfidenceTier#LOW}).
 */
@Component
public class ForcedSubtitleClassifier {

  static final double DENSITY_FLOOR = 2.0;
  static final double DENSITY_CEILING = 10.0;
  static final double HEURISTIC_DENSITY = 5.5;
  static final double HEURISTIC_COVERAGE = 37.5;

  private final SubtitleProperties properties;

  public ForcedSubtitleClassifier(SubtitleProperties properties) {
    this.properties = properties;
  }

  public ForcedVerdict classify(SubtitleStatistics stats, double durationSeconds) {
    ForcedThresholds thresholds = properties.forced();
    double density = stats.density();
    double coverage = stats.coveragePercent();
    int count = stats.entryCount();
    double durationMinutes = durationSeconds / 60.0;

    if (density < thresholds.lowDensity() && coverage < thresholds.lowCoverage()) {
      return ForcedVerdict.forced(
          format("Very low density (%.1f subs/min) and coverage (%.1f%%)", density, coverage),
          ConfidenceTier.HIGH);
    }
    if (count < thresholds.minCount()) {
      return ForcedVerdict.forced(
          format("Very few subtitles (%d < %d)", count, thresholds.minCount()),
          ConfidenceTier.HIGH);
    }
    if (density < DENSITY_FLOOR) {
      return ForcedVerdict.forced(
          format("Extremely low density (%.1f subs/min)", density), ConfidenceTier.HIGH);
    }
    if (density > thresholds.highDensity() && coverage > 30.0) {
      return ForcedVerdict.full(
          format("High density (%.1f subs/min) and good coverage (%.1f%%)", density, coverage),
          ConfidenceTier.HIGH);
    }
    if (count > thresholds.maxCount() && durationMinutes > 30.0) {
      return ForcedVerdict.full(
          format("Many subtitles (%d) for a %.0f minute runtime", count, durationMinutes),
          ConfidenceTier.HIGH);
    }
    if (density > DENSITY_CEILING) {
      return ForcedVerdict.full(
          format("Very high density (%.1f subs/min)", density), ConfidenceTier.HIGH);
    }

    List<String> forcedIndicators = new ArrayList<>();
    List<String> fullIndicators = new ArrayList<>();
    if (density < 5.0) {
      forcedIndicators.add(format("low density (%.1f)", density));
    } else if (density > 6.0) {
      fullIndicators.add(format("good density (%.1f)", density));
    }
    if (coverage < 30.0) {
      forcedIndicators.add(format("low coverage (%.1f%%)", coverage));
    } else if (coverage > 40.0) {
      fullIndicators.add(format("good coverage (%.1f%%)", coverage));
    }
    if (count < 150) {
      forcedIndicators.add(format("low count (%d)", count));
    } else if (count > 250) {
      fullIndicators.add(format("high count (%d)", count));
    }
    if (stats.gapVariance() > 100.0) {
      forcedIndicators.add("irregular timing");
    } else if (stats.gapVariance() < 50.0) {
      fullIndicators.add("regular timing");
    }

    if (forcedIndicators.size() >= 2 && fullIndicators.isEmpty()) {
      return ForcedVerdict.forced(
          "Multiple forced indicators: " + String.join(", ", forcedIndicators),
          ConfidenceTier.MEDIUM);
    }
    if (fullIndicators.size() >= 2 && forcedIndicators.isEmpty()) {
      return ForcedVerdict.full(
          "Multiple full indicators: " + String.join(", ", fullIndicators),
          ConfidenceTier.MEDIUM);
    }

    String reason =
        format(
            "Ambiguous metrics: density=%.1f, coverage=%.1f%%, count=%d", density, coverage, count);
    if (!properties.analyzeForcedAudio()) {
      return heuristic(stats, reason + " (audio analysis disabled, using heuristic)");
    }
    return ForcedVerdict.requestAudioAnalysis(reason);
  }

  /** Midpoint heuristic for ambiguous tracks without usable speech evidence. */
  public ForcedVerdict heuristic(SubtitleStatistics stats, String reason) {
    boolean forced =
        stats.density() < HEURISTIC_DENSITY || stats.coveragePercent() < HEURISTIC_COVERAGE;
    return new ForcedVerdict(forced, reason, ConfidenceTier.LOW, false);
  }

  private static String format(String template, Object... args) {
    return String.format(Locale.ROOT, template, args);
  }
}
