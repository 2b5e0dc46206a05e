package com.scholary.langtag.media;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Ways of addressing a track in an ffmpeg {@code -map} argument, in the order they are tried.
 *
 * <p>Some containers report stream ids that ffmpeg numbers differently, so extraction walks this
 * list until one mapping produces usable output.
 */
public enum StreamMapping {
  TYPE_RELATIVE {
    @Override
    public String argument(MediaTrack track) {
      return "0:" + track.selector();
    }
  },
  ABSOLUTE_STREAM {
    @Override
    public String argument(MediaTrack track) {
      return "0:" + track.streamIndex();
    }
  },
  SHORT_SELECTOR {
    @Override
    public String argument(MediaTrack track) {
      return track.selector();
    }
  };

  public abstract String argument(MediaTrack track);

  /** Distinct map arguments for a track, highest priority first. */
  public static List<String> candidates(MediaTrack track) {
    Set<String> arguments = new LinkedHashSet<>();
    for (StreamMapping mapping : values()) {
      arguments.add(mapping.argument(track));
    }
    return List.copyOf(arguments);
  }
}
