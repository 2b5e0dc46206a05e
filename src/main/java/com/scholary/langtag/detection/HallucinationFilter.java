package com.scholary.langtag.detection;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.zip.Deflater;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Decides whether a transcript is fabricated model output rather than real speech.
 *
 * <p>Speech models asked to transcribe silence, music or noise tend to emit degenerate text:
 * character runs, a handful of words looped over and over, scripts the audio never contained, or
 * stock filler phrases seen in their training data. Each check below targets one of those shapes.
 * The filter deliberately prefers precision for "no linguistic content": a short genuine utterance
 * may be flagged, which is acceptable since samples are retried elsewhere in the track.
 *
 * <p>Stateless and deterministic.
 */
@Component
public class HallucinationFilter {

  private static final Logger LOGGER = LoggerFactory.getLogger(HallucinationFilter.class);

  private static final Pattern REPEATED_CHARACTER = Pattern.compile("(.)\\1{4,}");
  private static final Pattern REPEATED_BLOCK = Pattern.compile("(.{1,3})\\1{3,}");
  private static final Pattern PUNCTUATION =
      Pattern.compile("[^\\w\\s]", Pattern.UNICODE_CHARACTER_CLASS);
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private static final double OVERPRODUCED_SCRIPT_RATIO = 0.7;
  private static final double MIN_UNIQUE_WORD_RATIO = 0.2;
  private static final double MIN_COMPRESSION_RATIO = 0.3;
  private static final int SHORT_TEXT_LENGTH = 50;

  private static final List<String> STOCK_PHRASES =
      List.of(
              "okay up here we go",
              "i'm going to go get some water",
              "let's go",
              "here we go",
              "okay let's go",
              "alright let's go",
              "come on let's go",
              "okay here we go",
              "let me get some water",
              "i'm going to get some water",
              "i need to get some water",
              "hold on let me",
              "wait let me",
              "okay wait",
              "hold on",
              "one second",
              "just a second",
              "give me a second",
              "let me just")
          .stream()
          .map(HallucinationFilter::stripPunctuation)
          .toList();

  // matched against punctuation-stripped text, hence the optional apostrophes
  private static final List<Pattern> SHORT_TEXT_PATTERNS =
      List.of(
          Pattern.compile(
              "\\b(okay|ok|alright|let'?s|here we go|come on)\\b.*\\b(go|water|get|just|wait)\\b"),
          Pattern.compile("\\bi'?m (going to|gonna) (go|get)"),
          Pattern.compile(
              "\\b(hold on|wait|give me|let me) (a |just |)?(second|minute|moment)\\b"));

  /**
   * Check a transcript for hallucination patterns.
   *
   * @param text transcript text, may be null
   * @return true when the text looks like model output on non-speech audio
   */
  public boolean isLikelyHallucination(String text) {
    if (text == null || text.isBlank()) {
      return true;
    }
    String trimmed = text.strip();
    int length = trimmed.codePointCount(0, trimmed.length());

    if (length < 3) {
      return true;
    }

    String withoutSpaces = trimmed.replace(" ", "");
    if (distinctCodePoints(withoutSpaces) <= 3 && length > 10) {
      return true;
    }
    if (distinctCodePoints(withoutSpaces.replace("\n", "")) <= 2 && length > 20) {
      return true;
    }

    if (REPEATED_CHARACTER.matcher(trimmed).find() || REPEATED_BLOCK.matcher(trimmed).find()) {
      return true;
    }

    if (overproducedScriptRatio(trimmed, length) > OVERPRODUCED_SCRIPT_RATIO) {
      return true;
    }

    String[] words = WHITESPACE.split(trimmed);
    int uniqueWords = new HashSet<>(Arrays.asList(words)).size();
    if (words.length > 3 && (double) uniqueWords / words.length < MIN_UNIQUE_WORD_RATIO) {
      return true;
    }
    if (length > 20 && words.length > 5 && uniqueWords <= 2) {
      return true;
    }

    if (compressionRatio(trimmed) < MIN_COMPRESSION_RATIO) {
      return true;
    }

    String lower = trimmed.toLowerCase(Locale.ROOT);
    String clean = stripPunctuation(lower);
    for (String phrase : STOCK_PHRASES) {
      if (clean.contains(phrase)) {
        LOGGER.debug("Detected common hallucination phrase: '{}'", phrase);
        return true;
      }
    }

    if (lower.length() < SHORT_TEXT_LENGTH) {
      for (Pattern pattern : SHORT_TEXT_PATTERNS) {
        if (pattern.matcher(clean).find()) {
          LOGGER.debug("Detected generic hallucination pattern: {}", pattern.pattern());
          return true;
        }
      }
    }

    return false;
  }

  /** Share of code points in Khmer, Thai, Myanmar, Bengali or Georgian. */
  static double overproducedScriptRatio(String text, int length) {
    long count =
        text.codePoints()
            .filter(
                cp ->
                    (cp >= 0x1780 && cp <= 0x17FF)
                        || (cp >= 0x0E00 && cp <= 0x0E7F)
                        || (cp >= 0x1000 && cp <= 0x109F)
                        || (cp >= 0x0980 && cp <= 0x09FF)
                        || (cp >= 0x10A0 && cp <= 0x10FF))
            .count();
    return length == 0 ? 0.0 : (double) count / length;
  }

  /** Deflated size over raw size of the UTF-8 bytes; low values mean highly redundant text. */
  static double compressionRatio(String text) {
    byte[] input = text.getBytes(StandardCharsets.UTF_8);
    if (input.length == 0) {
      return 1.0;
    }
    Deflater deflater = new Deflater();
    try {
      deflater.setInput(input);
      deflater.finish();
      byte[] buffer = new byte[1024];
      long compressed = 0;
      while (!deflater.finished()) {
        compressed += deflater.deflate(buffer);
      }
      return (double) compressed / input.length;
    } finally {
      deflater.end();
    }
  }

  private static String stripPunctuation(String text) {
    return PUNCTUATION.matcher(text).replaceAll("");
  }

  private static long distinctCodePoints(String text) {
    return text.codePoints().distinct().count();
  }
}
