package com.scholary.langtag.subtitle;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Recognizes subtitles for the deaf and hard of hearing by their sound descriptions.
 *
 * <p>A cue counts as descriptive when a bracketed, parenthesized, asterisked or music-note span
 * names a sound. Styling spans without a sound keyword, such as {@code [Italic]}, do not count.
 */
@Component
public class SdhDetector {

  private static final Logger LOGGER = LoggerFactory.getLogger(SdhDetector.class);

  static final double ENTRY_RATIO_THRESHOLD = 0.10;
  static final int PHRASE_THRESHOLD = 3;

  private static final List<Pattern> SPAN_PATTERNS =
      List.of(
          Pattern.compile("\\[[A-Za-z\\s]{3,}\\]", Pattern.CASE_INSENSITIVE),
          Pattern.compile("\\([A-Za-z\\s]{3,}\\)", Pattern.CASE_INSENSITIVE),
          Pattern.compile("♪[^♪]+♪", Pattern.CASE_INSENSITIVE),
          Pattern.compile("\\*[A-Za-z\\s]{3,}\\*", Pattern.CASE_INSENSITIVE));

  private static final Pattern SPAN_DELIMITERS = Pattern.compile("[\\[\\]()*]");

  private static final List<String> SOUND_KEYWORDS =
      List.of(
          "narrator", "narrating", "speaking", "whispering", "shouting", "yelling", "screaming",
          "music", "playing", "door", "closes", "opens", "phone", "ringing", "rings",
          "footsteps", "sighs", "sigh", "laughs", "laugh", "cries", "cry", "crying",
          "knocking", "knock", "barking", "bark", "meowing", "beeping", "beep",
          "gunshot", "explosion", "thunder", "applause", "cheering", "clapping",
          "breathing", "coughing", "snoring", "groaning", "grunting",
          "chatter", "chattering", "murmuring", "rustling", "creaking",
          "dramatic music", "tense music", "suspenseful music", "upbeat music",
          "in distance", "muffled", "echoing", "faintly");

  private static final List<Pattern> PHRASE_PATTERNS =
      List.of(
              "narrator", "speaking", "whispering", "shouting",
              "music playing", "door closes", "phone ringing",
              "footsteps", "sighs", "laughs", "cries",
              "in the distance", "muffled", "echoing",
              "dramatic music", "tense music")
          .stream()
          .map(phrase -> Pattern.compile("\\b" + phrase + "\\b"))
          .collect(Collectors.toUnmodifiableList());

  public boolean isSdh(List<SubtitleEntry> entries) {
    if (entries == null || entries.isEmpty()) {
      return false;
    }

    long described = entries.stream().filter(entry -> hasSoundDescription(entry.text())).count();
    double ratio = (double) described / entries.size();
    LOGGER.debug(
        "SDH indicators in {}/{} subtitles ({}%)",
        described,
        entries.size(),
        String.format("%.1f", ratio * 100));
    if (ratio > ENTRY_RATIO_THRESHOLD) {
      return true;
    }

    String fullText =
        entries.stream()
            .map(entry -> entry.text().toLowerCase(Locale.ROOT))
            .collect(Collectors.joining(" "));
    long phrases = PHRASE_PATTERNS.stream().filter(p -> p.matcher(fullText).find()).count();
    if (phrases >= PHRASE_THRESHOLD) {
      LOGGER.debug("Found {} SDH phrase patterns", phrases);
      return true;
    }
    return false;
  }

  static boolean hasSoundDescription(String text) {
    for (Pattern pattern : SPAN_PATTERNS) {
      Matcher matcher = pattern.matcher(text);
      while (matcher.find()) {
        String content = SPAN_DELIMITERS.matcher(matcher.group()).replaceAll("");
        content = content.strip().toLowerCase(Locale.ROOT);
        if (SOUND_KEYWORDS.stream().anyMatch(content::contains)) {
          return true;
        }
      }
    }
    return false;
  }
}
