package com.scholary.langtag.subtitle;

import com.github.pemistahl.lingua.api.Language;
import com.github.pemistahl.lingua.api.LanguageDetector;
import com.scholary.langtag.language.LanguageCodes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

/** N-gram language identification backed by Lingua. */
@Component
@Primary
public class LinguaTextLanguageDetector implements TextLanguageDetector {

  private final LanguageDetector detector;

  public LinguaTextLanguageDetector(LanguageDetector detector) {
    this.detector = detector;
  }

  @Override
  public List<LanguageGuess> rank(String text) {
    List<LanguageGuess> guesses = new ArrayList<>();
    if (text == null || text.isBlank()) {
      return guesses;
    }
    Map<Language, Double> values = detector.computeLanguageConfidenceValues(text);
    for (Map.Entry<Language, Double> entry : values.entrySet()) {
      Language language = entry.getKey();
      if (language == Language.UNKNOWN) {
        continue;
      }
      String isoCode = language.getIsoCode639_1().name().toLowerCase(Locale.ROOT);
      String code = LanguageCodes.normalize(LanguageCodes.toLegacy(isoCode));
      guesses.add(new LanguageGuess(code, entry.getValue()));
    }
    guesses.sort(Comparator.comparingDouble(LanguageGuess::confidence).reversed());
    return guesses;
  }
}
