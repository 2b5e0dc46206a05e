package com.scholary.langtag.tracking;

/** Counts of tracked files by which track types they had settled. */
public record TrackerStats(int totalTracked, int audioOnly, int subtitleOnly, int both) {}
