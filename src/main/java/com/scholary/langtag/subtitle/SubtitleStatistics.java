package com.scholary.langtag.subtitle;

import com.scholary.langtag.media.TimeRange;
import java.util.ArrayList;
import java.util.List;

/**
 * Timing profile of a subtitle track relative to the runtime of its container.
 *
 * @param entryCount number of parsed cues
 * @param totalDisplaySeconds summed display time of cues with a positive duration
 * @param coveragePercent display time as a percentage of the runtime
 * @param density cues per minute of runtime
 * @param averageDisplaySeconds mean display time of cues with a positive duration
 * @param gapVariance population variance of the gaps between consecutive cues
 * @param intervals display intervals of cues with a positive duration, in file order
 */
public record SubtitleStatistics(
    int entryCount,
    double totalDisplaySeconds,
    double coveragePercent,
    double density,
    double averageDisplaySeconds,
    double gapVariance,
    List<TimeRange> intervals) {

  public SubtitleStatistics {
    intervals = intervals == null ? List.of() : List.copyOf(intervals);
  }

  public static SubtitleStatistics empty() {
    return new SubtitleStatistics(0, 0.0, 0.0, 0.0, 0.0, 0.0, List.of());
  }

  /**
   * Compute statistics for parsed cues.
   *
   * @param entries cues in file order
   * @param durationSeconds container runtime
   * @return all-zero statistics when there are no cues or the runtime is unknown
   */
  public static SubtitleStatistics from(List<SubtitleEntry> entries, double durationSeconds) {
    if (entries == null || entries.isEmpty() || durationSeconds <= 0) {
      return empty();
    }

    List<TimeRange> intervals = new ArrayList<>();
    double total = 0.0;
    for (SubtitleEntry entry : entries) {
      if (entry.end() > entry.start() && entry.start() >= 0) {
        intervals.add(new TimeRange(entry.start(), entry.end()));
        total += entry.duration();
      }
    }

    double coverage = total / durationSeconds * 100.0;
    double density = entries.size() / (durationSeconds / 60.0);
    double average = intervals.isEmpty() ? 0.0 : total / intervals.size();

    List<Double> gaps = new ArrayList<>();
    for (int i = 1; i < intervals.size(); i++) {
      double gap = intervals.get(i).start() - intervals.get(i - 1).end();
      if (gap >= 0) {
        gaps.add(gap);
      }
    }

    return new SubtitleStatistics(
        entries.size(), total, coverage, density, average, populationVariance(gaps), intervals);
  }

  static double populationVariance(List<Double> values) {
    if (values.size() < 2) {
      return 0.0;
    }
    double mean = values.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
    double sumSquares = 0.0;
    for (double value : values) {
      sumSquares += (value - mean) * (value - mean);
    }
    return sumSquares / values.size();
  }
}
