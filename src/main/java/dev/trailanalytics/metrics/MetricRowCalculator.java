package dev.trailanalytics.metrics;

import dev.trailanalytics.race.Race;
import dev.trailanalytics.race.ResultRecord;
import dev.trailanalytics.sex.Sex;
import dev.trailanalytics.sex.SexFilter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/** Builds {@link MetricRow}s from canonical races. */
public final class MetricRowCalculator {

  private MetricRowCalculator() {
    // utility class
  }

  /**
   * Computes the metric row of a race.
   *
   * @param race the race
   * @param sex restrict to this sex (races inferred as the other sex yield an all-undefined row);
   *     null for the whole field
   * @param normalizeFemale apply the female score correction when {@code sex} is female
   * @param nValues the N thresholds for the top-N statistics
   * @param topN rank window for AUC and Gini
   */
  public static MetricRow compute(
      Race race,
      @Nullable Sex sex,
      boolean normalizeFemale,
      List<Integer> nValues,
      int topN) {
    List<ResultRecord> records =
        sex == null ? race.results() : SexFilter.panelResults(race, sex, normalizeFemale);
    Map<Integer, TopStats> byN = new LinkedHashMap<>();
    for (int n : nValues) {
      byN.put(n, RaceMetrics.topStats(records, n));
    }
    return new MetricRow(
        race.raceId(),
        sex,
        byN,
        RaceMetrics.aucNormalized(records, topN),
        RaceMetrics.gini(RaceMetrics.scoresWithinRank(records, topN)));
  }
}
