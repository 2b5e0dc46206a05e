package com.scholary.langtag.subtitle;

import java.util.List;

/** Identifies the language of written text. */
public interface TextLanguageDetector {

  /**
   * Rank candidate languages for a text.
   *
   * @return guesses ordered by descending confidence, empty when the text is inconclusive
   */
  List<LanguageGuess> rank(String text);
}
