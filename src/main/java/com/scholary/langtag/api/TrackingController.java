package com.scholary.langtag.api;

import com.scholary.langtag.tracking.ProcessingTracker;
import com.scholary.langtag.tracking.TrackerStats;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** Inspect and reset the processing tracker. */
@RestController
@Tag(name = "Tracking", description = "Processed-file tracker maintenance")
public class TrackingController {

  private static final Logger LOGGER = LoggerFactory.getLogger(TrackingController.class);

  private final ProcessingTracker tracker;

  public TrackingController(ProcessingTracker tracker) {
    this.tracker = tracker;
  }

  @GetMapping("/api/tracking")
  @Operation(summary = "Tracker statistics", description = "Count tracked files by settled types")
  public ResponseEntity<TrackerStats> stats() {
    return ResponseEntity.ok(tracker.stats());
  }

  @DeleteMapping("/api/tracking")
  @Operation(summary = "Clear tracker", description = "Forget every processed file")
  public ResponseEntity<Void> clearAll() {
    tracker.clearAll();
    return ResponseEntity.noContent().build();
  }

  @DeleteMapping("/api/tracking/entry")
  @Operation(summary = "Clear entry", description = "Forget one processed file")
  public ResponseEntity<Void> clearEntry(@RequestParam String path) {
    LOGGER.info("Clearing tracking entry: {}", path);
    tracker.clearEntry(Path.of(path));
    return ResponseEntity.noContent().build();
  }
}
