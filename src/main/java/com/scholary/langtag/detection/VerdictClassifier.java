package com.scholary.langtag.detection;

import com.scholary.langtag.language.LanguageCodes;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns transcription evidence into a language code or {@code zxx}.
 *
 * <p>Order matters:
 *
 * <ol>
 *   <li>very confident, substantial text is accepted without further checks
 *   <li>hallucinated text means no linguistic content
 *   <li>text produced only after voice filtering found no speech must clear a stricter bar
 *   <li>otherwise the standard has-speech test applies
 * </ol>
 */
@Component
public class VerdictClassifier {

  private static final Logger LOGGER = LoggerFactory.getLogger(VerdictClassifier.class);

  private final HallucinationFilter hallucinationFilter;

  public VerdictClassifier(HallucinationFilter hallucinationFilter) {
    this.hallucinationFilter = hallucinationFilter;
  }

  public String classify(TranscriptionEvidence evidence) {
    double confidence = evidence.confidence();
    int length = evidence.textLength();
    int words = evidence.wordCount();

    if (confidence > 0.95 && length > 50) {
      return languageCode(evidence.languageName());
    }

    if (!evidence.text().isEmpty() && hallucinationFilter.isLikelyHallucination(evidence.text())) {
      LOGGER.debug("Likely hallucination, marking as no linguistic content");
      return LanguageCodes.NO_LINGUISTIC_CONTENT;
    }

    boolean hasSpeech;
    if (evidence.variant() == AttemptVariant.UNFILTERED && evidence.vadRemovedAll()) {
      hasSpeech =
          (confidence > 0.7 && length > 30 && words > 5)
              || (confidence > 0.5 && length > 100 && words > 20);
      if (!hasSpeech) {
        LOGGER.debug(
            "Voice filter removed all audio and unfiltered text is weak (confidence={})",
            String.format("%.3f", confidence));
      }
    } else {
      hasSpeech =
          (confidence > 0.6 && length > 0)
              || (confidence > 0.3 && length > 15 && words > 2)
              || (confidence > 0.2 && length > 50 && words > 8)
              || (length > 100 && words > 15);
    }

    if (!hasSpeech) {
      LOGGER.debug(
          "Insufficient evidence of speech: confidence={}, length={}, words={}",
          String.format("%.3f", confidence),
          length,
          words);
      return LanguageCodes.NO_LINGUISTIC_CONTENT;
    }
    return languageCode(evidence.languageName());
  }

  static String languageCode(String languageName) {
    String lower = languageName.trim().toLowerCase(Locale.ROOT);
    String code = LanguageCodes.codeForName(languageName);
    // Dutch arrives either as a name or as "nl"; pin both to the legacy code
    if ("dutch".equals(lower) || "nl".equals(lower)) {
      code = "dut";
    }
    return LanguageCodes.normalize(code);
  }
}
