package dev.trailanalytics.metrics;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Statistics of a top-N score window.
 *
 * @param mean mean score of the window (NaN when empty)
 * @param std population standard deviation of the window (NaN when empty)
 * @param rci race competitiveness index, {@code mean - std} (NaN when empty)
 */
public record TopStats(double mean, double std, double rci) {

  static final TopStats UNDEFINED = new TopStats(Double.NaN, Double.NaN, Double.NaN);

  @JsonIgnore
  public boolean isDefined() {
    return Double.isFinite(rci);
  }
}
