package com.scholary.langtag.detection;

/** How an audio language verdict was reached. */
public enum VerdictMethod {
  SAMPLED_SEGMENT,
  FULL_TRACK,
  AGGREGATED_MAJORITY
}
