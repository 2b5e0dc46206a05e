package com.scholary.langtag.subtitle;

import com.scholary.langtag.language.LanguageCodes;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Coarse fallback that guesses a language from the writing system alone.
 *
 * <p>Only a handful of scripts map to one dominant language, and Latin text is assumed English
 * with a capped confidence that normally stays below the acceptance threshold.
 */
@Component
public class ScriptRatioLanguageDetector implements TextLanguageDetector {

  @Override
  public List<LanguageGuess> rank(String text) {
    return List.of(guess(text));
  }

  public LanguageGuess guess(String text) {
    if (text == null || text.strip().length() < 10) {
      return new LanguageGuess(LanguageCodes.UNDETERMINED, 0.0);
    }

    int total = 0;
    int latin = 0;
    int cyrillic = 0;
    int arabic = 0;
    int cjk = 0;
    for (int i = 0; i < text.length(); ) {
      int cp = text.codePointAt(i);
      i += Character.charCount(cp);
      if (cp == ' ' || cp == '\n') {
        continue;
      }
      total++;
      if (cp < 0x250) {
        latin++;
      } else if (cp >= 0x400 && cp <= 0x4FF) {
        cyrillic++;
      } else if (cp >= 0x600 && cp <= 0x6FF) {
        arabic++;
      } else if (cp >= 0x4E00 && cp <= 0x9FFF) {
        cjk++;
      }
    }
    if (total == 0) {
      return new LanguageGuess(LanguageCodes.UNDETERMINED, 0.0);
    }

    double cyrillicRatio = (double) cyrillic / total;
    double arabicRatio = (double) arabic / total;
    double cjkRatio = (double) cjk / total;
    double latinRatio = (double) latin / total;

    if (cyrillicRatio > 0.3) {
      return guessFor("rus", Math.min(0.9, 0.5 + cyrillicRatio * 0.5));
    }
    if (arabicRatio > 0.3) {
      return guessFor("ara", Math.min(0.9, 0.5 + arabicRatio * 0.5));
    }
    if (cjkRatio > 0.3) {
      return guessFor("chi", Math.min(0.85, 0.45 + cjkRatio * 0.5));
    }
    if (latinRatio > 0.7) {
      double lengthBonus = Math.min(0.2, text.length() / 5000.0);
      return guessFor("eng", Math.min(0.65, 0.3 + (latinRatio - 0.7) * 0.3 + lengthBonus));
    }
    return new LanguageGuess(LanguageCodes.UNDETERMINED, 0.1);
  }

  private static LanguageGuess guessFor(String legacyCode, double confidence) {
    return new LanguageGuess(LanguageCodes.normalize(legacyCode), confidence);
  }
}
