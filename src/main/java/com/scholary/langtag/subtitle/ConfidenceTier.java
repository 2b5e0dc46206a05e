package com.scholary.langtag.subtitle;

/** How decisive the statistics were for a forced-subtitle verdict. */
public enum ConfidenceTier {
  LOW(1),
  MEDIUM(2),
  HIGH(3);

  private final int level;

  ConfidenceTier(int level) {
    this.level = level;
  }

  public int level() {
    return level;
  }
}
