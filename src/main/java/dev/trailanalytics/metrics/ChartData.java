package dev.trailanalytics.metrics;

import java.util.List;

/**
 * Rank curve, Lorenz and heatmap datasets for a selection.
 *
 * @param topN the rank window
 * @param buckets heatmap columns shared by every series
 * @param series one entry per loaded race, ordered by race id
 */
public record ChartData(int topN, List<RankBucket> buckets, List<RaceChartSeries> series) {

  public ChartData {
    buckets = List.copyOf(buckets);
    series = List.copyOf(series);
  }
}
