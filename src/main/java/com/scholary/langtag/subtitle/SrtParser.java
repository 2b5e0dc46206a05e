package com.scholary.langtag.subtitle;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Minimal SubRip reader.
 *
 * <p>Blocks are separated by a blank line and need an integer index, a timing line and at least
 * one text line. Malformed blocks are skipped. A block whose timestamps cannot be read is kept
 * as a zero-length cue at 0s, so it still counts towards cue density but adds no display time.
 */
public final class SrtParser {

  private static final Logger LOGGER = LoggerFactory.getLogger(SrtParser.class);

  private static final Pattern TIMESTAMP =
      Pattern.compile("(\\d+):(\\d{1,2}):(\\d{1,2})[,.](\\d{1,3})");
  private static final String ARROW = " --> ";

  private SrtParser() {}

  public static List<SubtitleEntry> parse(Path file) throws IOException {
    // malformed bytes decode to U+FFFD
    String content = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
    return parse(content);
  }

  public static List<SubtitleEntry> parse(String content) {
    List<SubtitleEntry> entries = new ArrayList<>();
    if (content == null) {
      return entries;
    }
    String normalized = content.replace("\uFEFF", "").replace("\r\n", "\n").replace('\r', '\n');
    for (String block : normalized.strip().split("\n\n")) {
      String[] lines = block.strip().split("\n");
      if (lines.length < 3) {
        continue;
      }
      try {
        int index = Integer.parseInt(lines[0].strip());
        String timing = lines[1];
        int arrow = timing.indexOf(ARROW);
        if (arrow < 0) {
          continue;
        }
        double start = 0.0;
        double end = 0.0;
        try {
          start = parseTimestamp(timing.substring(0, arrow));
          end = parseTimestamp(timing.substring(arrow + ARROW.length()));
        } catch (IllegalArgumentException e) {
          LOGGER.debug("Keeping subtitle {} without timing: {}", index, e.getMessage());
          start = 0.0;
          end = 0.0;
        }
        StringBuilder text = new StringBuilder();
        for (int i = 2; i < lines.length; i++) {
          if (i > 2) {
            text.append('\n');
          }
          text.append(lines[i]);
        }
        entries.add(new SubtitleEntry(index, start, end, text.toString().strip()));
      } catch (IllegalArgumentException e) {
        LOGGER.debug("Skipping malformed subtitle block: {}", e.getMessage());
      }
    }
    return entries;
  }

  /** Parse {@code HH:MM:SS,mmm} into seconds. */
  static double parseTimestamp(String value) {
    Matcher matcher = TIMESTAMP.matcher(value.strip());
    if (!matcher.lookingAt()) {
      throw new IllegalArgumentException("Invalid SRT timestamp: " + value);
    }
    double hours = Double.parseDouble(matcher.group(1));
    double minutes = Double.parseDouble(matcher.group(2));
    double seconds = Double.parseDouble(matcher.group(3) + "." + matcher.group(4));
    return hours * 3600 + minutes * 60 + seconds;
  }
}
