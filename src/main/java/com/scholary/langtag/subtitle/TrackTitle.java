package com.scholary.langtag.subtitle;

import com.scholary.langtag.language.LanguageCodes;

/** Builds subtitle track titles such as {@code English [Forced]} or {@code French [SDH]}. */
public final class TrackTitle {

  private TrackTitle() {}

  public static String of(String languageCode, boolean forced, boolean sdh) {
    StringBuilder title = new StringBuilder(LanguageCodes.displayName(languageCode));
    if (forced) {
      title.append(" [Forced]");
    }
    if (sdh) {
      title.append(" [SDH]");
    }
    return title.toString();
  }
}
