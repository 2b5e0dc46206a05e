package com.scholary.langtag.tracking;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.langtag.config.TrackingProperties;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Processing tracker persisted as {@code processed_files.json} in the tracking directory.
 *
 * <p>The table is loaded once and rewritten after every change. A corrupt or unreadable file is
 * logged and replaced by an empty table. Writes go through a temporary file and an atomic move so
 * an interrupted run never leaves half a table behind.
 */
@Component
public class JsonFileProcessingTracker implements ProcessingTracker {

  private static final Logger LOGGER = LoggerFactory.getLogger(JsonFileProcessingTracker.class);

  static final String TABLE_FILE = "processed_files.json";

  private static final TypeReference<LinkedHashMap<String, TrackingEntry>> TABLE_TYPE =
      new TypeReference<>() {};

  private final Path tableFile;
  private final ObjectMapper objectMapper;
  private final Clock clock;
  private final Map<String, TrackingEntry> entries;

  @Autowired
  public JsonFileProcessingTracker(TrackingProperties properties, ObjectMapper objectMapper) {
    this(Path.of(properties.directory()), objectMapper, Clock.systemUTC());
  }

  JsonFileProcessingTracker(Path directory, ObjectMapper objectMapper, Clock clock) {
    this.tableFile = directory.resolve(TABLE_FILE);
    this.objectMapper = objectMapper;
    this.clock = clock;
    this.entries = load();
  }

  @Override
  public synchronized Optional<TrackingEntry> find(Path file) {
    String key = key(file);
    TrackingEntry entry = entries.get(key);
    if (entry == null) {
      return Optional.empty();
    }

    try {
      long size = Files.size(file);
      double mtime = mtimeSeconds(file);
      if (entry.matches(size, mtime)) {
        return Optional.of(entry);
      }
      LOGGER.info("File changed since it was processed, dropping tracking entry: {}", key);
    } catch (NoSuchFileException e) {
      LOGGER.info("Tracked file no longer exists, dropping tracking entry: {}", key);
    } catch (IOException e) {
      LOGGER.warn("Cannot stat tracked file {}, dropping tracking entry: {}", key, e.getMessage());
    }
    entries.remove(key);
    save();
    return Optional.empty();
  }

  @Override
  public synchronized void markProcessed(
      Path file, boolean audioProcessed, boolean subtitleProcessed) {
    if (!audioProcessed && !subtitleProcessed) {
      return;
    }
    try {
      TrackingEntry entry =
          new TrackingEntry(
              Files.size(file),
              mtimeSeconds(file),
              audioProcessed,
              subtitleProcessed,
              clock.millis() / 1000.0);
      entries.put(key(file), entry);
      save();
      LOGGER.debug(
          "Marked processed: file={}, audio={}, subtitles={}",
          file,
          audioProcessed,
          subtitleProcessed);
    } catch (IOException e) {
      throw new UncheckedIOException("Cannot stat file to mark it processed: " + file, e);
    }
  }

  @Override
  public synchronized void clearEntry(Path file) {
    if (entries.remove(key(file)) != null) {
      save();
    }
  }

  @Override
  public synchronized void clearAll() {
    entries.clear();
    save();
    LOGGER.info("Cleared all tracking entries");
  }

  @Override
  public synchronized TrackerStats stats() {
    int audioOnly = 0;
    int subtitleOnly = 0;
    int both = 0;
    for (TrackingEntry entry : entries.values()) {
      if (entry.audioProcessed() && entry.subtitleProcessed()) {
        both++;
      } else if (entry.audioProcessed()) {
        audioOnly++;
      } else if (entry.subtitleProcessed()) {
        subtitleOnly++;
      }
    }
    return new TrackerStats(entries.size(), audioOnly, subtitleOnly, both);
  }

  private Map<String, TrackingEntry> load() {
    if (!Files.exists(tableFile)) {
      return new LinkedHashMap<>();
    }
    try {
      Map<String, TrackingEntry> loaded = objectMapper.readValue(tableFile.toFile(), TABLE_TYPE);
      if (loaded == null) {
        return new LinkedHashMap<>();
      }
      LOGGER.info("Loaded {} tracking entries from {}", loaded.size(), tableFile);
      return loaded;
    } catch (IOException e) {
      LOGGER.warn("Could not load tracking file: {}. Starting fresh.", e.getMessage());
      return new LinkedHashMap<>();
    }
  }

  private void save() {
    try {
      Files.createDirectories(tableFile.getParent());
      Path temp = tableFile.resolveSibling(TABLE_FILE + ".tmp");
      objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), entries);
      Files.move(
          temp, tableFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    } catch (IOException e) {
      LOGGER.error("Could not save tracking file {}: {}", tableFile, e.getMessage());
    }
  }

  private static String key(Path file) {
    return file.toAbsolutePath().normalize().toString();
  }

  private static double mtimeSeconds(Path file) throws IOException {
    return Files.getLastModifiedTime(file).toMillis() / 1000.0;
  }
}
