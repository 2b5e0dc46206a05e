package com.scholary.langtag.detection;

import com.scholary.langtag.media.TimeRange;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Chooses where in a track to cut audio samples for each retry.
 *
 * <p>Windows are placed at fixed fractions of the runtime, with a different set per retry so a
 * retry does not land on the same silence, intro or credits as the one before. Starts are kept
 * between max(60 s, 5 %) and 85 % of the runtime.
 */
@Component
public class SampleWindowPlanner {

  static final double UNKNOWN_DURATION_SECONDS = 7200;

  private static final double[][] LONG_FRACTIONS = {
    {0.15, 0.25, 0.35, 0.50, 0.65},
    {0.08, 0.20, 0.45, 0.75, 0.88},
    {0.12, 0.40, 0.60, 0.80, 0.90}
  };
  private static final double[][] MEDIUM_FRACTIONS = {
    {0.15, 0.30, 0.50, 0.70},
    {0.08, 0.40, 0.65, 0.85},
    {0.25, 0.45, 0.75, 0.90}
  };
  private static final double[][] SHORT_FRACTIONS = {
    {0.20, 0.50, 0.80},
    {0.10, 0.35, 0.75},
    {0.30, 0.60, 0.90}
  };

  /**
   * Plan the windows for one retry.
   *
   * @param durationSeconds container runtime, 0 or negative when unknown
   * @param retryAttempt 0-based retry number; retries past the table reuse the last set
   * @return windows in the order they should be tried
   */
  public List<TimeRange> windowsFor(double durationSeconds, int retryAttempt) {
    double duration = durationSeconds > 0 ? durationSeconds : UNKNOWN_DURATION_SECONDS;

    double[][] fractionSets;
    int windowSeconds;
    if (duration > 3600) {
      fractionSets = LONG_FRACTIONS;
      windowSeconds = 90;
    } else if (duration > 1800) {
      fractionSets = MEDIUM_FRACTIONS;
      windowSeconds = 75;
    } else {
      fractionSets = SHORT_FRACTIONS;
      windowSeconds = 60;
    }

    double minStart = Math.max(60, duration * 0.05);
    double maxStart = duration * 0.85;
    double[] fractions = fractionSets[Math.min(Math.max(retryAttempt, 0), fractionSets.length - 1)];

    List<TimeRange> windows = new ArrayList<>(fractions.length);
    for (double fraction : fractions) {
      long start = (long) Math.max(minStart, Math.min(maxStart, duration * fraction));
      windows.add(TimeRange.ofDuration(start, windowSeconds));
    }
    return windows;
  }
}
