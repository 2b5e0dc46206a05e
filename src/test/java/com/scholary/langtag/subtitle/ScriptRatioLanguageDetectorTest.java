package com.scholary.langtag.subtitle;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class ScriptRatioLanguageDetectorTest {

  private final ScriptRatioLanguageDetector detector = new ScriptRatioLanguageDetector();

  @Test
  void guess_shouldRecognizeCyrillic() {
    LanguageGuess guess = detector.guess("Привет, как дела? Всё хорошо, спасибо.");

    assertThat(guess.languageCode()).isEqualTo("ru");
    assertThat(guess.confidence()).isBetween(0.8, 0.9);
  }

  @Test
  void guess_shouldRecognizeArabicAndCjk() {
    assertThat(detector.guess("مرحبا كيف حالك اليوم يا صديقي").languageCode()).isEqualTo("ar");
    assertThat(detector.guess("我们明天早上在火车站见面吧好吗").languageCode()).isEqualTo("zh");
  }

  @Test
  void guess_shouldCapConfidenceForLatinText() {
    LanguageGuess guess = detector.guess("This is a perfectly ordinary sentence of subtitle text.");

    assertThat(guess.languageCode()).isEqualTo("en");
    assertThat(guess.confidence()).isLessThanOrEqualTo(0.65);
  }

  @Test
  void guess_shouldBeUndeterminedForShortOrUnknownScripts() {
    assertThat(detector.guess("Hi there")).isEqualTo(new LanguageGuess("und", 0.0));
    assertThat(detector.guess("Καλημέρα σας φίλοι μου")).isEqualTo(new LanguageGuess("und", 0.1));
  }

  @Test
  void rank_shouldReturnSingleGuess() {
    assertThat(detector.rank("Привет, как дела? Всё хорошо.")).hasSize(1);
  }
}
