package dev.trailanalytics.metrics;

import dev.trailanalytics.sex.Sex;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Metric profile of one race, optionally restricted to one sex. Recomputed on demand, never
 * stored.
 *
 * @param raceId the race
 * @param sex the sex the records were restricted to, or null for the whole field
 * @param byN top-N mean, standard deviation and RCI per requested N, in request order
 * @param aucNormalized normalized area under the rank curve (NaN when undefined)
 * @param giniCoefficient Gini coefficient of the top-N window (NaN when undefined)
 */
public record MetricRow(
    String raceId,
    @Nullable Sex sex,
    Map<Integer, TopStats> byN,
    double aucNormalized,
    double giniCoefficient) {

  public MetricRow {
    byN = Collections.unmodifiableMap(new LinkedHashMap<>(byN));
  }

  /** RCI for one N, NaN when N was not requested or is undefined. */
  public double rci(int n) {
    TopStats stats = byN.get(n);
    return stats == null ? Double.NaN : stats.rci();
  }
}
