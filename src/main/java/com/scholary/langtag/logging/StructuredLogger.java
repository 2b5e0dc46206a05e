package com.scholary.langtag.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Provides methods to log classification events with structured fields that can be queried in
 * a log search backend. Each event sets {@code event_type} plus its own fields, and removes them
 * again once the line is written.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log one sampled-segment attempt of the audio retry loop. */
  public void logRetryAttempt(
      String track, int attempt, int maxRetries, String languageCode, double confidence) {
    try {
      MDC.put("event_type", "retry_attempt");
      MDC.put("track", track);
      MDC.put("attempt", String.valueOf(attempt));
      MDC.put("maxRetries", String.valueOf(maxRetries));
      MDC.put("languageCode", languageCode);
      MDC.put("confidence", String.format("%.3f", confidence));

      logger.info(
          "Retry attempt: track={}, attempt={}/{}, language={}, confidence={}",
          track,
          attempt,
          maxRetries,
          languageCode,
          String.format("%.3f", confidence));
    } finally {
      clearEventFields();
    }
  }

  /** Log the final language verdict of a track. */
  public void logLanguageVerdict(
      String track, String languageCode, double confidence, String method) {
    try {
      MDC.put("event_type", "language_verdict");
      MDC.put("track", track);
      MDC.put("languageCode", languageCode);
      MDC.put("confidence", String.format("%.3f", confidence));
      MDC.put("method", method);

      logger.info(
          "Language verdict: track={}, language={}, confidence={}, method={}",
          track,
          languageCode,
          String.format("%.3f", confidence),
          method);
    } finally {
      clearEventFields();
    }
  }

  /** Log a forced-subtitle decision. */
  public void logForcedDecision(String track, boolean forced, int tier, String reason) {
    try {
      MDC.put("event_type", "forced_decision");
      MDC.put("track", track);
      MDC.put("forced", String.valueOf(forced));
      MDC.put("tier", String.valueOf(tier));

      logger.info(
          "Forced decision: track={}, forced={}, tier={}, reason={}", track, forced, tier, reason);
    } finally {
      clearEventFields();
    }
  }

  /** Log a per-track failure. */
  public void logTrackFailed(String track, String errorType, String message) {
    try {
      MDC.put("event_type", "track_failed");
      MDC.put("track", track);
      MDC.put("errorType", errorType);

      logger.warn("Track failed: track={}, error={}, message={}", track, errorType, message);
    } finally {
      clearEventFields();
    }
  }

  /** Set file context in MDC. */
  public static void setFileContext(String correlationId, String file) {
    MDC.put("correlationId", correlationId);
    MDC.put("file", file);
  }

  /** Clear file context from MDC. */
  public static void clearFileContext() {
    MDC.remove("correlationId");
    MDC.remove("file");
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("track");
    MDC.remove("attempt");
    MDC.remove("maxRetries");
    MDC.remove("languageCode");
    MDC.remove("confidence");
    MDC.remove("method");
    MDC.remove("forced");
    MDC.remove("tier");
    MDC.remove("errorType");
  }
}
