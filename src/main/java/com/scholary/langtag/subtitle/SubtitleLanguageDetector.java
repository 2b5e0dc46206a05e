package com.scholary.langtag.subtitle;

import com.scholary.langtag.language.LanguageCodes;
import com.scholary.langtag.media.MediaTrack;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Identifies the language of a subtitle track from its text.
 *
 * <p>Text tracks are sampled at the beginning, middle and end so an opening credits block does
 * not dominate. Bitmap tracks go through OCR first, and their confidence is discounted for
 * recognition errors. When the text detector fails or has no answer, the script-ratio heuristic
 * takes over.
 */
@Component
public class SubtitleLanguageDetector {

  private static final Logger LOGGER = LoggerFactory.getLogger(SubtitleLanguageDetector.class);

  static final int MAX_SAMPLE_CHARS = 5000;
  static final int MIN_SAMPLE_CHARS = 50;
  static final double OCR_CONFIDENCE_FACTOR = 0.75;

  private static final Pattern MARKUP_TAG = Pattern.compile("<[^>]+>");
  private static final Pattern STYLE_OVERRIDE = Pattern.compile("\\{[^}]+\\}");

  private final TextLanguageDetector textDetector;
  private final ScriptRatioLanguageDetector scriptFallback;
  private final ImageSubtitleOcr imageOcr;

  public SubtitleLanguageDetector(
      TextLanguageDetector textDetector,
      ScriptRatioLanguageDetector scriptFallback,
      ImageSubtitleOcr imageOcr) {
    this.textDetector = textDetector;
    this.scriptFallback = scriptFallback;
    this.imageOcr = imageOcr;
  }

  /**
   * Detect the language of parsed text cues.
   *
   * @return the best guess, {@code und} with zero confidence when there is too little text, or
   *     empty when there are no cues at all
   */
  public Optional<LanguageGuess> detectText(List<SubtitleEntry> entries) {
    if (entries.isEmpty()) {
      LOGGER.warn("No subtitle entries found");
      return Optional.empty();
    }
    String sample = textSample(entries);
    if (sample.strip().length() < MIN_SAMPLE_CHARS) {
      LOGGER.warn("Insufficient subtitle text for language detection");
      return Optional.of(new LanguageGuess(LanguageCodes.UNDETERMINED, 0.0));
    }
    LOGGER.debug("Analyzing {} subtitle entries ({} characters)", entries.size(), sample.length());
    return Optional.of(rankOrFallback(sample));
  }

  /**
   * Detect the language of a bitmap subtitle track through OCR.
   *
   * @return the discounted guess, or empty when OCR produced too little text
   */
  public Optional<LanguageGuess> detectImage(Path file, MediaTrack track) throws IOException {
    List<String> texts = imageOcr.recognize(file, track);
    if (texts.isEmpty()) {
      LOGGER.warn("No text extracted from subtitle images via OCR");
      return Optional.empty();
    }
    String combined = String.join(" ", texts);
    if (combined.strip().length() < MIN_SAMPLE_CHARS) {
      LOGGER.warn("Insufficient OCR text for detection ({} chars)", combined.length());
      return Optional.empty();
    }

    List<LanguageGuess> ranked;
    try {
      ranked = textDetector.rank(combined);
    } catch (RuntimeException e) {
      LOGGER.warn("Language detection failed: {}", e.getMessage());
      return Optional.of(scriptFallback.guess(combined));
    }
    if (ranked.isEmpty()) {
      LOGGER.warn("Language detection returned no results for OCR text");
      return Optional.empty();
    }
    LanguageGuess guess = ranked.get(0).withConfidenceScaled(OCR_CONFIDENCE_FACTOR);
    LOGGER.info(
        "OCR detected language: {} (confidence: {})",
        guess.languageCode(),
        String.format("%.2f", guess.confidence()));
    return Optional.of(guess);
  }

  private LanguageGuess rankOrFallback(String text) {
    try {
      List<LanguageGuess> ranked = textDetector.rank(text);
      if (!ranked.isEmpty()) {
        LOGGER.debug(
            "Subtitle language candidates: {}", ranked.subList(0, Math.min(3, ranked.size())));
        return ranked.get(0);
      }
      LOGGER.warn("Text language detection returned no results, using script analysis");
    } catch (RuntimeException e) {
      LOGGER.warn("Text language detection failed, using script analysis: {}", e.getMessage());
    }
    return scriptFallback.guess(text);
  }

  /**
   * Build a detection sample from the beginning, middle and end of a track.
   *
   * <p>Ten cues are taken around each anchor, markup is removed and the sample stops growing once
   * it reaches {@value #MAX_SAMPLE_CHARS} characters.
   */
  static String textSample(List<SubtitleEntry> entries) {
    int n = entries.size();
    List<Integer> anchors = new ArrayList<>(List.of(0));
    if (n > 10) {
      anchors.add(n / 2);
    }
    if (n > 20) {
      anchors.add(n - 1);
    }

    List<String> parts = new ArrayList<>();
    int length = 0;
    for (int anchor : anchors) {
      int from = Math.max(0, anchor - 5);
      int to = Math.min(n, anchor + 5);
      for (SubtitleEntry entry : entries.subList(from, to)) {
        String clean = MARKUP_TAG.matcher(entry.text()).replaceAll("");
        clean = STYLE_OVERRIDE.matcher(clean).replaceAll("").strip();
        if (!clean.isEmpty()) {
          parts.add(clean);
          length += clean.length();
        }
        if (length >= MAX_SAMPLE_CHARS) {
          return String.join(" ", parts);
        }
      }
    }
    return String.join(" ", parts);
  }
}
