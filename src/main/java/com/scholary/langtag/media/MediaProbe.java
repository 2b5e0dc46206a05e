package com.scholary.langtag.media;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.OptionalDouble;
import java.util.OptionalLong;

/** Reads stream layout and timing from a media container. */
public interface MediaProbe {

  /**
   * List the audio and subtitle tracks of a file in container order.
   *
   * @throws IOException if no probe tool could read the file
   */
  List<MediaTrack> listTracks(Path file) throws IOException;

  /** Container duration in seconds, empty when it cannot be determined. */
  OptionalDouble durationSeconds(Path file);

  /** Number of packets in an image subtitle stream, empty when it cannot be counted. */
  OptionalLong subtitlePacketCount(Path file, MediaTrack track);
}
