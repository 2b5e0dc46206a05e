package com.scholary.langtag.detection;

import com.scholary.langtag.language.LanguageCodes;

/**
 * Final language decision for one audio track.
 *
 * @param languageCode normalized code, {@code zxx} for no linguistic content
 * @param confidence confidence of the evidence that carried the decision
 * @param method how the decision was reached
 */
public record LanguageVerdict(String languageCode, double confidence, VerdictMethod method) {

  public boolean isNoLinguisticContent() {
    return LanguageCodes.NO_LINGUISTIC_CONTENT.equals(languageCode);
  }
}
