package dev.trailanalytics.metrics;

import java.util.Collections;
import java.util.List;

/**
 * Chart datasets of one race over a top-N window.
 *
 * @param raceId the race
 * @param label display label
 * @param rankCurve (rank, score) points of ranks 1..topN
 * @param lorenzCurve Lorenz curve of the window's scores
 * @param gini Gini coefficient of the window's scores (NaN when undefined)
 * @param bucketMeans heatmap row, one mean per bucket (null for an empty bucket)
 */
public record RaceChartSeries(
    String raceId,
    String label,
    List<RankPoint> rankCurve,
    List<LorenzPoint> lorenzCurve,
    double gini,
    List<Double> bucketMeans) {

  public RaceChartSeries {
    rankCurve = List.copyOf(rankCurve);
    lorenzCurve = List.copyOf(lorenzCurve);
    bucketMeans = Collections.unmodifiableList(bucketMeans);
  }
}
