package com.scholary.langtag.media;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;
import java.util.OptionalLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reads track layout with {@code mkvmerge -J}, falling back to {@code ffprobe -show_streams}.
 *
 * <p>mkvmerge reports the language that players actually honour, while ffprobe sometimes surfaces
 * stale tags, so ffprobe is only consulted when mkvmerge is missing or fails. Duration and packet
 * counts always come from ffprobe.
 */
@Component
public class MkvMergeProbe implements MediaProbe {

  private static final Logger LOGGER = LoggerFactory.getLogger(MkvMergeProbe.class);

  private final FfmpegProperties properties;
  private final ProcessRunner processRunner;
  private final ObjectMapper objectMapper;

  public MkvMergeProbe(
      FfmpegProperties properties, ProcessRunner processRunner, ObjectMapper objectMapper) {
    this.properties = properties;
    this.processRunner = processRunner;
    this.objectMapper = objectMapper;
  }

  @Override
  public List<MediaTrack> listTracks(Path file) throws IOException {
    try {
      return listWithMkvMerge(file);
    } catch (IOException e) {
      LOGGER.warn("mkvmerge could not read {}, falling back to ffprobe: {}", file, e.getMessage());
      return listWithFfprobe(file);
    }
  }

  private List<MediaTrack> listWithMkvMerge(Path file) throws IOException {
    ProcessResult result =
        processRunner.run(
            List.of(properties.mkvmergeBinary(), "-J", file.toString()), probeTimeout());
    // mkvmerge exits 1 for warnings but still prints a usable identification
    if (result.exitCode() > 1) {
      throw new IOException("mkvmerge exited with code " + result.exitCode());
    }
    return parseMkvMergeJson(result.stdout());
  }

  List<MediaTrack> parseMkvMergeJson(String json) throws IOException {
    JsonNode root = objectMapper.readTree(json);
    List<MediaTrack> tracks = new ArrayList<>();
    int audioCount = 0;
    int subtitleCount = 0;

    for (JsonNode track : root.path("tracks")) {
      String type = track.path("type").asText("");
      JsonNode props = track.path("properties");
      TrackType trackType;
      int trackIndex;
      if ("audio".equals(type)) {
        trackType = TrackType.AUDIO;
        trackIndex = audioCount++;
      } else if ("subtitles".equals(type)) {
        trackType = TrackType.SUBTITLE;
        trackIndex = subtitleCount++;
      } else {
        continue;
      }
      tracks.add(
          new MediaTrack(
              trackType,
              trackIndex,
              track.path("id").asInt(),
              props.path("codec_id").asText(""),
              textOrNull(props.path("language")),
              textOrNull(props.path("track_name"))));
    }

    LOGGER.debug("mkvmerge reported {} audio and {} subtitle tracks", audioCount, subtitleCount);
    return tracks;
  }

  private List<MediaTrack> listWithFfprobe(Path file) throws IOException {
    ProcessResult result =
        processRunner.run(
            List.of(
                properties.ffprobeBinary(),
                "-v",
                "quiet",
                "-print_format",
                "json",
                "-show_streams",
                file.toString()),
            probeTimeout());
    if (!result.succeeded()) {
      throw new IOException("ffprobe exited with code " + result.exitCode() + " for " + file);
    }
    return parseFfprobeJson(result.stdout());
  }

  List<MediaTrack> parseFfprobeJson(String json) throws IOException {
    JsonNode root = objectMapper.readTree(json);
    List<MediaTrack> tracks = new ArrayList<>();
    int audioCount = 0;
    int subtitleCount = 0;
    int position = 0;

    for (JsonNode stream : root.path("streams")) {
      String codecType = stream.path("codec_type").asText("");
      int streamIndex = stream.path("index").asInt(position);
      position++;
      TrackType trackType;
      int trackIndex;
      if ("audio".equals(codecType)) {
        trackType = TrackType.AUDIO;
        trackIndex = audioCount++;
      } else if ("subtitle".equals(codecType)) {
        trackType = TrackType.SUBTITLE;
        trackIndex = subtitleCount++;
      } else {
        continue;
      }
      JsonNode tags = stream.path("tags");
      String language = textOrNull(tags.path("language"));
      if (language == null) {
        language = textOrNull(tags.path("LANGUAGE"));
      }
      tracks.add(
          new MediaTrack(
              trackType,
              trackIndex,
              streamIndex,
              stream.path("codec_name").asText(""),
              language,
              textOrNull(tags.path("title"))));
    }
    return tracks;
  }

  @Override
  public OptionalDouble durationSeconds(Path file) {
    try {
      ProcessResult result =
          processRunner.run(
              List.of(
                  properties.ffprobeBinary(),
                  "-v",
                  "error",
                  "-show_entries",
                  "format=duration",
                  "-of",
                  "default=noprint_wrappers=1:nokey=1",
                  file.toString()),
              probeTimeout());
      if (!result.succeeded()) {
        LOGGER.debug("ffprobe duration failed for {}: exit {}", file, result.exitCode());
        return OptionalDouble.empty();
      }
      double duration = Double.parseDouble(result.stdout().trim());
      return duration > 0 ? OptionalDouble.of(duration) : OptionalDouble.empty();
    } catch (IOException | NumberFormatException e) {
      LOGGER.debug("Could not determine duration of {}: {}", file, e.getMessage());
      return OptionalDouble.empty();
    }
  }

  @Override
  public OptionalLong subtitlePacketCount(Path file, MediaTrack track) {
    try {
      ProcessResult result =
          processRunner.run(
              List.of(
                  properties.ffprobeBinary(),
                  "-v",
                  "error",
                  "-select_streams",
                  "s:" + track.trackIndex(),
                  "-count_packets",
                  "-show_entries",
                  "stream=nb_read_packets",
                  "-of",
                  "csv=p=0",
                  file.toString()),
              probeTimeout());
      if (!result.succeeded()) {
        return OptionalLong.empty();
      }
      return OptionalLong.of(Long.parseLong(result.stdout().trim()));
    } catch (IOException | NumberFormatException e) {
      LOGGER.debug(
          "Could not count packets of {} in {}: {}", track.selector(), file, e.getMessage());
      return OptionalLong.empty();
    }
  }

  private Duration probeTimeout() {
    return Duration.ofSeconds(properties.probeTimeoutSeconds());
  }

  private static String textOrNull(JsonNode node) {
    if (node.isMissingNode() || node.isNull()) {
      return null;
    }
    String text = node.asText();
    return text.isEmpty() ? null : text;
  }
}
