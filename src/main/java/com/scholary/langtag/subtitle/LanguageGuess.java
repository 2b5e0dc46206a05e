package com.scholary.langtag.subtitle;

/**
 * One candidate language for a piece of text.
 *
 * @param languageCode normalized code, {@code und} when nothing could be determined
 * @param confidence probability in [0, 1]
 */
public record LanguageGuess(String languageCode, double confidence) {

  public LanguageGuess withConfidenceScaled(double factor) {
    return new LanguageGuess(languageCode, confidence * factor);
  }
}
