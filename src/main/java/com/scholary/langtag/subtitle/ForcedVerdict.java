package com.scholary.langtag.subtitle;

/**
 * Outcome of the forced-subtitle classifier.
 *
 * @param forced whether the track only covers foreign or unintelligible dialogue
 * @param reason human-readable explanation with the deciding metrics
 * @param tier how decisive the evidence was
 * @param audioAnalysisRequested the statistics were ambiguous and speech overlap should decide
 */
public record ForcedVerdict(
    boolean forced, String reason, ConfidenceTier tier, boolean audioAnalysisRequested) {

  public static ForcedVerdict forced(String reason, ConfidenceTier tier) {
    return new ForcedVerdict(true, reason, tier, false);
  }

  public static ForcedVerdict full(String reason, ConfidenceTier tier) {
    return new ForcedVerdict(false, reason, tier, false);
  }

  public static ForcedVerdict requestAudioAnalysis(String reason) {
    return new ForcedVerdict(false, reason, ConfidenceTier.LOW, true);
  }
}
