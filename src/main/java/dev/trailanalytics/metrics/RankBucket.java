package dev.trailanalytics.metrics;

/** Inclusive rank range of a heatmap bucket. */
public record RankBucket(int start, int end) {

  /** Axis label, e.g. {@code "1-3"}. */
  public String label() {
    return start + "-" + end;
  }

  public boolean contains(int rank) {
    return rank >= start && rank <= end;
  }
}
