package com.scholary.langtag.detection;

import com.scholary.langtag.language.LanguageCodes;

/** Language code and confidence obtained from one audio sample. */
public record SampleVerdict(String languageCode, double confidence, AttemptVariant variant) {

  public boolean isNoLinguisticContent() {
    return LanguageCodes.NO_LINGUISTIC_CONTENT.equals(languageCode);
  }
}
