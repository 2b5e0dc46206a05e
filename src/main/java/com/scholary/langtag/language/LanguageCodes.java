package com.scholary.langtag.language;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Static language tables and the code normalizer.
 *
 * <p>Three code spaces meet here: language names reported by the speech model ("french"),
 * ISO 639-2/B legacy codes that Matroska tooling writes ("fre"), and ISO 639-1 codes ("fr"). All
 * verdicts are stabilized to the 639-1 form when one exists, so a track tagged {@code eng} by
 * one tool and {@code en} by another compares equal.
 *
 * <p>The tables are immutable and loaded once with the class.
 */
public final class LanguageCodes {

  /** Reserved code for "undetermined". */
  public static final String UNDETERMINED = "und";

  /** Reserved code for "no linguistic content". */
  public static final String NO_LINGUISTIC_CONTENT = "zxx";

  private static final Set<String> UNDEFINED_SYNONYMS =
      Set.of("", "und", "unknown", "undefined", "undetermined");

  private static final Map<String, String> LEGACY_TO_TWO_LETTER =
      Map.ofEntries(
          Map.entry("ger", "de"),
          Map.entry("eng", "en"),
          Map.entry("spa", "es"),
          Map.entry("fre", "fr"),
          Map.entry("ita", "it"),
          Map.entry("por", "pt"),
          Map.entry("rus", "ru"),
          Map.entry("jpn", "ja"),
          Map.entry("kor", "ko"),
          Map.entry("chi", "zh"),
          Map.entry("ara", "ar"),
          Map.entry("hin", "hi"),
          Map.entry("dut", "nl"),
          Map.entry("swe", "sv"),
          Map.entry("nor", "no"),
          Map.entry("dan", "da"),
          Map.entry("fin", "fi"),
          Map.entry("pol", "pl"),
          Map.entry("cze", "cs"),
          Map.entry("hun", "hu"),
          Map.entry("gre", "el"),
          Map.entry("tur", "tr"),
          Map.entry("heb", "he"),
          Map.entry("tha", "th"),
          Map.entry("vie", "vi"),
          Map.entry("ukr", "uk"),
          Map.entry("bul", "bg"),
          Map.entry("rum", "ro"),
          Map.entry("slo", "sk"),
          Map.entry("slv", "sl"),
          Map.entry("srp", "sr"),
          Map.entry("hrv", "hr"),
          Map.entry("bos", "bs"),
          Map.entry("alb", "sq"),
          Map.entry("mac", "mk"),
          Map.entry("lit", "lt"),
          Map.entry("lav", "lv"),
          Map.entry("est", "et"),
          Map.entry("mlt", "mt"),
          Map.entry("ice", "is"),
          Map.entry("gle", "ga"),
          Map.entry("wel", "cy"),
          Map.entry("baq", "eu"),
          Map.entry("cat", "ca"),
          Map.entry("glg", "gl"),
          Map.entry("per", "fa"),
          Map.entry("urd", "ur"),
          Map.entry("ben", "bn"),
          Map.entry("guj", "gu"),
          Map.entry("pan", "pa"),
          Map.entry("tam", "ta"),
          Map.entry("tel", "te"),
          Map.entry("kan", "kn"),
          Map.entry("mal", "ml"),
          Map.entry("mar", "mr"),
          Map.entry("nep", "ne"),
          Map.entry("sin", "si"),
          Map.entry("bur", "my"),
          Map.entry("khm", "km"),
          Map.entry("lao", "lo"),
          Map.entry("tib", "bo"),
          Map.entry("mon", "mn"),
          Map.entry("kaz", "kk"),
          Map.entry("uzb", "uz"),
          Map.entry("kir", "ky"),
          Map.entry("tgk", "tg"),
          Map.entry("tuk", "tk"),
          Map.entry("aze", "az"),
          Map.entry("arm", "hy"),
          Map.entry("geo", "ka"),
          Map.entry("amh", "am"),
          Map.entry("swa", "sw"),
          Map.entry("yor", "yo"),
          Map.entry("ibo", "ig"),
          Map.entry("hau", "ha"),
          Map.entry("som", "so"),
          Map.entry("afr", "af"),
          Map.entry("zul", "zu"),
          Map.entry("xho", "xh"),
          Map.entry("may", "ms"),
          Map.entry("ind", "id"),
          Map.entry("tgl", "tl"),
          Map.entry("jav", "jv"),
          Map.entry("sun", "su"),
          Map.entry("epo", "eo"),
          Map.entry("lat", "la"));

  // ISO 639-2/T spellings that some muxers write instead of the /B form
  private static final Map<String, String> ALTERNATE_TO_TWO_LETTER =
      Map.of(
          "deu", "de",
          "fra", "fr",
          "nld", "nl",
          "ces", "cs",
          "slk", "sk",
          "ron", "ro");

  private static final Map<String, String> ALTERNATE_TO_LEGACY =
      Map.of(
          "deu", "ger",
          "fra", "fre",
          "nld", "dut",
          "ces", "cze",
          "slk", "slo",
          "ron", "rum");

  private static final Map<String, String> TWO_LETTER_TO_LEGACY = invert(LEGACY_TO_TWO_LETTER);

  private static final Map<String, String> NAME_TO_LEGACY =
      Map.ofEntries(
          Map.entry("english", "eng"),
          Map.entry("spanish", "spa"),
          Map.entry("french", "fre"),
          Map.entry("german", "ger"),
          Map.entry("italian", "ita"),
          Map.entry("portuguese", "por"),
          Map.entry("russian", "rus"),
          Map.entry("japanese", "jpn"),
          Map.entry("chinese", "chi"),
          Map.entry("korean", "kor"),
          Map.entry("arabic", "ara"),
          Map.entry("hindi", "hin"),
          Map.entry("dutch", "dut"),
          Map.entry("swedish", "swe"),
          Map.entry("norwegian", "nor"),
          Map.entry("danish", "dan"),
          Map.entry("finnish", "fin"),
          Map.entry("polish", "pol"),
          Map.entry("czech", "cze"),
          Map.entry("hungarian", "hun"),
          Map.entry("greek", "gre"),
          Map.entry("turkish", "tur"),
          Map.entry("hebrew", "heb"),
          Map.entry("thai", "tha"),
          Map.entry("vietnamese", "vie"),
          Map.entry("ukrainian", "ukr"),
          Map.entry("bulgarian", "bul"),
          Map.entry("romanian", "rum"),
          Map.entry("slovak", "slo"),
          Map.entry("slovenian", "slv"),
          Map.entry("serbian", "srp"),
          Map.entry("croatian", "hrv"),
          Map.entry("bosnian", "bos"),
          Map.entry("albanian", "alb"),
          Map.entry("macedonian", "mac"),
          Map.entry("lithuanian", "lit"),
          Map.entry("latvian", "lav"),
          Map.entry("estonian", "est"),
          Map.entry("maltese", "mlt"),
          Map.entry("icelandic", "ice"),
          Map.entry("irish", "gle"),
          Map.entry("welsh", "wel"),
          Map.entry("basque", "baq"),
          Map.entry("catalan", "cat"),
          Map.entry("galician", "glg"),
          Map.entry("persian", "per"),
          Map.entry("urdu", "urd"),
          Map.entry("bengali", "ben"),
          Map.entry("gujarati", "guj"),
          Map.entry("punjabi", "pan"),
          Map.entry("tamil", "tam"),
          Map.entry("telugu", "tel"),
          Map.entry("kannada", "kan"),
          Map.entry("malayalam", "mal"),
          Map.entry("marathi", "mar"),
          Map.entry("nepali", "nep"),
          Map.entry("sinhalese", "sin"),
          Map.entry("burmese", "bur"),
          Map.entry("khmer", "khm"),
          Map.entry("lao", "lao"),
          Map.entry("tibetan", "tib"),
          Map.entry("mongolian", "mon"),
          Map.entry("kazakh", "kaz"),
          Map.entry("uzbek", "uzb"),
          Map.entry("kyrgyz", "kir"),
          Map.entry("tajik", "tgk"),
          Map.entry("turkmen", "tuk"),
          Map.entry("azerbaijani", "aze"),
          Map.entry("armenian", "arm"),
          Map.entry("georgian", "geo"),
          Map.entry("amharic", "amh"),
          Map.entry("swahili", "swa"),
          Map.entry("yoruba", "yor"),
          Map.entry("igbo", "ibo"),
          Map.entry("hausa", "hau"),
          Map.entry("somali", "som"),
          Map.entry("afrikaans", "afr"),
          Map.entry("zulu", "zul"),
          Map.entry("xhosa", "xho"),
          Map.entry("malay", "may"),
          Map.entry("indonesian", "ind"),
          Map.entry("tagalog", "tgl"),
          Map.entry("cebuano", "ceb"),
          Map.entry("javanese", "jav"),
          Map.entry("sundanese", "sun"),
          Map.entry("esperanto", "epo"),
          Map.entry("latin", "lat"),
          Map.entry("mandarin", "chi"),
          Map.entry("cantonese", "chi"),
          Map.entry("simplified chinese", "chi"),
          Map.entry("traditional chinese", "chi"),
          Map.entry("farsi", "per"),
          Map.entry("filipino", "tgl"),
          Map.entry("bahasa indonesia", "ind"),
          Map.entry("bahasa malaysia", "may"),
          Map.entry("no linguistic content", "zxx"));

  private static final Map<String, String> DISPLAY_NAMES =
      Map.ofEntries(
          Map.entry("eng", "English"),
          Map.entry("spa", "Spanish"),
          Map.entry("fre", "French"),
          Map.entry("ger", "German"),
          Map.entry("ita", "Italian"),
          Map.entry("por", "Portuguese"),
          Map.entry("rus", "Russian"),
          Map.entry("jpn", "Japanese"),
          Map.entry("chi", "Chinese"),
          Map.entry("kor", "Korean"),
          Map.entry("ara", "Arabic"),
          Map.entry("hin", "Hindi"),
          Map.entry("dut", "Dutch"),
          Map.entry("swe", "Swedish"),
          Map.entry("nor", "Norwegian"),
          Map.entry("dan", "Danish"),
          Map.entry("fin", "Finnish"),
          Map.entry("pol", "Polish"),
          Map.entry("cze", "Czech"),
          Map.entry("hun", "Hungarian"),
          Map.entry("gre", "Greek"),
          Map.entry("tur", "Turkish"),
          Map.entry("heb", "Hebrew"),
          Map.entry("tha", "Thai"),
          Map.entry("vie", "Vietnamese"),
          Map.entry("ukr", "Ukrainian"),
          Map.entry("bul", "Bulgarian"),
          Map.entry("rum", "Romanian"),
          Map.entry("slo", "Slovak"),
          Map.entry("slv", "Slovenian"),
          Map.entry("srp", "Serbian"),
          Map.entry("hrv", "Croatian"),
          Map.entry("bos", "Bosnian"),
          Map.entry("zxx", "No Linguistic Content"),
          Map.entry("alb", "Albanian"),
          Map.entry("mac", "Macedonian"),
          Map.entry("lit", "Lithuanian"),
          Map.entry("lav", "Latvian"),
          Map.entry("est", "Estonian"),
          Map.entry("mlt", "Maltese"),
          Map.entry("ice", "Icelandic"),
          Map.entry("gle", "Irish"),
          Map.entry("wel", "Welsh"),
          Map.entry("baq", "Basque"),
          Map.entry("cat", "Catalan"),
          Map.entry("glg", "Galician"),
          Map.entry("per", "Persian"),
          Map.entry("urd", "Urdu"),
          Map.entry("ben", "Bengali"),
          Map.entry("guj", "Gujarati"),
          Map.entry("pan", "Punjabi"),
          Map.entry("tam", "Tamil"),
          Map.entry("tel", "Telugu"),
          Map.entry("kan", "Kannada"),
          Map.entry("mal", "Malayalam"),
          Map.entry("mar", "Marathi"),
          Map.entry("nep", "Nepali"),
          Map.entry("sin", "Sinhalese"),
          Map.entry("bur", "Burmese"),
          Map.entry("khm", "Khmer"),
          Map.entry("lao", "Lao"),
          Map.entry("tib", "Tibetan"),
          Map.entry("mon", "Mongolian"),
          Map.entry("kaz", "Kazakh"),
          Map.entry("uzb", "Uzbek"),
          Map.entry("kir", "Kyrgyz"),
          Map.entry("tgk", "Tajik"),
          Map.entry("tuk", "Turkmen"),
          Map.entry("aze", "Azerbaijani"),
          Map.entry("arm", "Armenian"),
          Map.entry("geo", "Georgian"),
          Map.entry("amh", "Amharic"),
          Map.entry("swa", "Swahili"),
          Map.entry("yor", "Yoruba"),
          Map.entry("ibo", "Igbo"),
          Map.entry("hau", "Hausa"),
          Map.entry("som", "Somali"),
          Map.entry("afr", "Afrikaans"),
          Map.entry("zul", "Zulu"),
          Map.entry("xho", "Xhosa"),
          Map.entry("may", "Malay"),
          Map.entry("ind", "Indonesian"),
          Map.entry("tgl", "Tagalog"),
          Map.entry("jav", "Javanese"),
          Map.entry("sun", "Sundanese"),
          Map.entry("epo", "Esperanto"),
          Map.entry("lat", "Latin"));

  private LanguageCodes() {}

  /**
   * Stabilize a raw language identifier.
   *
   * <p>Total function: undefined synonyms become {@code und}, {@code zxx} passes through, known
   * three-letter codes collapse to two letters, everything else is returned lower-cased so
   * operators can still see what the container carried.
   *
   * @param raw a code or name as found in metadata, possibly null
   * @return the normalized code, never null
   */
  public static String normalize(String raw) {
    if (raw == null) {
      return UNDETERMINED;
    }
    String code = raw.trim().toLowerCase(Locale.ROOT);

    if (UNDEFINED_SYNONYMS.contains(code)) {
      return UNDETERMINED;
    }
    if (NO_LINGUISTIC_CONTENT.equals(code)) {
      return NO_LINGUISTIC_CONTENT;
    }

    String twoLetter = LEGACY_TO_TWO_LETTER.get(code);
    if (twoLetter != null) {
      return twoLetter;
    }
    twoLetter = ALTERNATE_TO_TWO_LETTER.get(code);
    if (twoLetter != null) {
      return twoLetter;
    }
    return code;
  }

  /** True when the tag is missing or one of the undefined synonyms. */
  public static boolean isUndefined(String raw) {
    return raw == null || UNDEFINED_SYNONYMS.contains(raw.trim().toLowerCase(Locale.ROOT));
  }

  /**
   * Map a language name reported by the speech model to a legacy three-letter code.
   *
   * <p>Unknown names are returned unchanged (the model often reports two-letter codes directly).
   */
  public static String codeForName(String languageName) {
    if (languageName == null) {
      return UNDETERMINED;
    }
    String key = languageName.trim().toLowerCase(Locale.ROOT);
    return NAME_TO_LEGACY.getOrDefault(key, languageName.trim());
  }

  /** Convert an ISO 639-1 code to its ISO 639-2/B form; unknown codes pass through. */
  public static String toLegacy(String twoLetterCode) {
    if (twoLetterCode == null) {
      return UNDETERMINED;
    }
    String key = twoLetterCode.trim().toLowerCase(Locale.ROOT);
    return TWO_LETTER_TO_LEGACY.getOrDefault(key, key);
  }

  /**
   * Human-readable name for a code in either form, used for track titles.
   *
   * @return the display name, or the upper-cased code when unknown
   */
  public static String displayName(String code) {
    if (code == null || code.isBlank()) {
      return UNDETERMINED.toUpperCase(Locale.ROOT);
    }
    String key = code.trim().toLowerCase(Locale.ROOT);
    String name = DISPLAY_NAMES.get(key);
    if (name == null) {
      name = DISPLAY_NAMES.get(TWO_LETTER_TO_LEGACY.getOrDefault(key, key));
    }
    if (name == null) {
      name = DISPLAY_NAMES.get(ALTERNATE_TO_LEGACY.getOrDefault(key, key));
    }
    return name != null ? name : key.toUpperCase(Locale.ROOT);
  }

  private static Map<String, String> invert(Map<String, String> source) {
    Map<String, String> inverted = new HashMap<>();
    source.forEach((key, value) -> inverted.putIfAbsent(value, key));
    return Map.copyOf(inverted);
  }
}
