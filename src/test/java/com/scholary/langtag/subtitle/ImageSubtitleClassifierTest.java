package com.scholary.langtag.subtitle;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.OptionalLong;
import org.junit.jupiter.api.Test;

class ImageSubtitleClassifierTest {

  private final ImageSubtitleClassifier classifier = new ImageSubtitleClassifier();

  @Test
  void classify_shouldCallTrackWithFewFramesForced() {
    ForcedVerdict verdict = classifier.classify(OptionalLong.of(40), 7200);

    assertThat(verdict.forced()).isTrue();
    assertThat(verdict.tier()).isEqualTo(ConfidenceTier.HIGH);
  }

  @Test
  void classify_shouldUseFrameRatePerMinute() {
    // 120 minutes
    assertThat(classifier.classify(OptionalLong.of(480), 7200))
        .isEqualTo(ForcedVerdict.forced("Very low frame density (4.0/min)", ConfidenceTier.HIGH));
    assertThat(classifier.classify(OptionalLong.of(4800), 7200))
        .isEqualTo(ForcedVerdict.full("High frame density (40.0/min)", ConfidenceTier.HIGH));
    assertThat(classifier.classify(OptionalLong.of(1200), 7200).forced()).isTrue();
    assertThat(classifier.classify(OptionalLong.of(1200), 7200).tier())
        .isEqualTo(ConfidenceTier.LOW);
    assertThat(classifier.classify(OptionalLong.of(2400), 7200).forced()).isFalse();
  }

  @Test
  void classify_shouldDefaultToFullWithoutPacketCount() {
    ForcedVerdict verdict = classifier.classify(OptionalLong.empty(), 7200);

    assertThat(verdict.forced()).isFalse();
    assertThat(verdict.tier()).isEqualTo(ConfidenceTier.LOW);
  }
}
