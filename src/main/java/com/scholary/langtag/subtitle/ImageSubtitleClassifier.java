package com.scholary.langtag.subtitle;

import java.util.Locale;
import java.util.OptionalLong;
import org.springframework.stereotype.Component;

/**
 * Forced-subtitle proxy for bitmap tracks, which carry no per-cue text timing.
 *
 * <p>Each displayed subtitle is at least one packet, so the packet rate stands in for cue density.
 */
@Component
public class ImageSubtitleClassifier {

  static final long MIN_PACKETS = 100;

  public ForcedVerdict classify(OptionalLong packetCount, double durationSeconds) {
    if (packetCount.isEmpty() || durationSeconds <= 0) {
      return ForcedVerdict.full("Could not count subtitle frames", ConfidenceTier.LOW);
    }
    long packets = packetCount.getAsLong();
    double perMinute = packets / (durationSeconds / 60.0);

    if (packets < MIN_PACKETS) {
      return ForcedVerdict.forced(
          String.format(Locale.ROOT, "Very low frame count (%d)", packets), ConfidenceTier.HIGH);
    }
    if (perMinute < 5.0) {
      return ForcedVerdict.forced(
          format("Very low frame density (%.1f/min)", perMinute), ConfidenceTier.HIGH);
    }
    if (perMinute > 30.0) {
      return ForcedVerdict.full(
          format("High frame density (%.1f/min)", perMinute), ConfidenceTier.HIGH);
    }
    if (perMinute < 15.0) {
      return ForcedVerdict.forced(
          format("Low-to-moderate frame density (%.1f/min)", perMinute), ConfidenceTier.LOW);
    }
    return ForcedVerdict.full(
        format("Moderate frame density (%.1f/min)", perMinute), ConfidenceTier.LOW);
  }

  private static String format(String template, double value) {
    return String.format(Locale.ROOT, template, value);
  }
}
