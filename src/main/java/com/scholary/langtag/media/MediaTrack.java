package com.scholary.langtag.media;

import com.scholary.langtag.language.LanguageCodes;
import java.util.Locale;
import java.util.Set;

/**
 * Snapshot of one audio or subtitle stream as reported by the container.
 *
 * @param type audio or subtitle
 * @param trackIndex 0-based index among tracks of the same type
 * @param streamIndex container-wide stream id
 * @param codec codec identifier as reported by the probe, may be empty
 * @param language current language tag, may be null
 * @param name current track title, may be null
 */
public record MediaTrack(
    TrackType type, int trackIndex, int streamIndex, String codec, String language, String name) {

  private static final Set<String> IMAGE_CODEC_MARKERS =
      Set.of("pgs", "hdmv", "dvd", "dvbsub", "vobsub");

  public MediaTrack {
    if (type == null) {
      throw new IllegalArgumentException("Track type is required");
    }
    if (trackIndex < 0) {
      throw new IllegalArgumentException("Track index cannot be negative");
    }
    codec = codec == null ? "" : codec;
  }

  public boolean hasUndefinedLanguage() {
    return LanguageCodes.isUndefined(language);
  }

  /** True for bitmap subtitle formats (PGS, VobSub, DVB) that carry no text. */
  public boolean isImageSubtitle() {
    if (type != TrackType.SUBTITLE) {
      return false;
    }
    String lower = codec.toLowerCase(Locale.ROOT);
    return IMAGE_CODEC_MARKERS.stream().anyMatch(lower::contains);
  }

  /** Selector such as {@code a:0} or {@code s:2}. */
  public String selector() {
    return type.selector() + ":" + trackIndex;
  }
}
