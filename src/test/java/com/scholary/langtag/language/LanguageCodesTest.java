package com.scholary.langtag.language;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class LanguageCodesTest {

  @Test
  void normalize_shouldCollapseLegacyCodesToTwoLetters() {
    assertThat(LanguageCodes.normalize("ENG")).isEqualTo("en");
    assertThat(LanguageCodes.normalize("eng")).isEqualTo("en");
    assertThat(LanguageCodes.normalize("fre")).isEqualTo("fr");
    assertThat(LanguageCodes.normalize("ger")).isEqualTo("de");
    assertThat(LanguageCodes.normalize("dut")).isEqualTo("nl");
  }

  @Test
  void normalize_shouldAcceptTerminologyCodes() {
    assertThat(LanguageCodes.normalize("deu")).isEqualTo("de");
    assertThat(LanguageCodes.normalize("fra")).isEqualTo("fr");
    assertThat(LanguageCodes.normalize("nld")).isEqualTo("nl");
  }

  @ParameterizedTest
  @ValueSource(strings = {"", "  ", "und", "UND", "unknown", "Undefined", "undetermined"})
  void normalize_shouldMapUndefinedSynonymsToUnd(String raw) {
    assertThat(LanguageCodes.normalize(raw)).isEqualTo(LanguageCodes.UNDETERMINED);
    assertThat(LanguageCodes.isUndefined(raw)).isTrue();
  }

  @Test
  void normalize_shouldHandleNull() {
    assertThat(LanguageCodes.normalize(null)).isEqualTo("und");
    assertThat(LanguageCodes.isUndefined(null)).isTrue();
  }

  @Test
  void normalize_shouldPassNoLinguisticContentThrough() {
    assertThat(LanguageCodes.normalize("ZXX")).isEqualTo("zxx");
    assertThat(LanguageCodes.isUndefined("zxx")).isFalse();
  }

  @Test
  void normalize_shouldLowerCaseUnknownCodes() {
    assertThat(LanguageCodes.normalize(" QQQ ")).isEqualTo("qqq");
  }

  @ParameterizedTest
  @ValueSource(strings = {"eng", "en", "fre", "fr", "und", "zxx", "xyz", "ENG", "deu"})
  void normalize_shouldBeIdempotent(String raw) {
    String once = LanguageCodes.normalize(raw);
    assertThat(LanguageCodes.normalize(once)).isEqualTo(once);
  }

  @Test
  void codeForName_shouldMapModelLanguageNames() {
    assertThat(LanguageCodes.codeForName("French")).isEqualTo("fre");
    assertThat(LanguageCodes.codeForName("english")).isEqualTo("eng");
    assertThat(LanguageCodes.codeForName("mandarin")).isEqualTo("chi");
    assertThat(LanguageCodes.codeForName("fr")).isEqualTo("fr");
  }

  @Test
  void toLegacy_shouldConvertTwoLetterCodes() {
    assertThat(LanguageCodes.toLegacy("fr")).isEqualTo("fre");
    assertThat(LanguageCodes.toLegacy("DE")).isEqualTo("ger");
    assertThat(LanguageCodes.toLegacy("xx")).isEqualTo("xx");
  }

  @Test
  void displayName_shouldResolveEitherCodeForm() {
    assertThat(LanguageCodes.displayName("fre")).isEqualTo("French");
    assertThat(LanguageCodes.displayName("fr")).isEqualTo("French");
    assertThat(LanguageCodes.displayName("deu")).isEqualTo("German");
    assertThat(LanguageCodes.displayName("zxx")).isEqualTo("No Linguistic Content");
    assertThat(LanguageCodes.displayName("qqq")).isEqualTo("QQQ");
  }
}
