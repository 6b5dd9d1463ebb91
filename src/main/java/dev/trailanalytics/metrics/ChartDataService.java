package dev.trailanalytics.metrics;

import dev.trailanalytics.race.Race;
import dev.trailanalytics.race.RaceCatalog;
import dev.trailanalytics.race.ResultRecord;
import dev.trailanalytics.selection.SelectionContext;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/** Produces the rank-curve, Lorenz-curve and bucket-heatmap datasets of the selected races. */
@Service
public class ChartDataService {

  private static final Logger log = LoggerFactory.getLogger(ChartDataService.class);

  private final RaceCatalog raceCatalog;

  public ChartDataService(RaceCatalog raceCatalog) {
    this.raceCatalog = raceCatalog;
  }

  /**
   * Builds the chart datasets of every selected race that loads.
   *
   * @param selection the panel selection
   * @param topN the rank window (ranks 1..topN)
   */
  public ChartData build(SelectionContext selection, int topN) {
    if (topN < 1) {
      throw new IllegalArgumentException("topN must be at least 1, got: " + topN);
    }
    List<RankBucket> buckets = RaceMetrics.bucketRanges(topN, RaceMetrics.bucketCount(topN));
    List<RaceChartSeries> series = new ArrayList<>();
    for (Race race : raceCatalog.loadRaces(selection.selectedIds())) {
      series.add(seriesFor(race, topN, buckets));
    }
    log.debug("Built chart data for {} races (topN={})", series.size(), topN);
    return new ChartData(topN, buckets, series);
  }

  static RaceChartSeries seriesFor(Race race, int topN, List<RankBucket> buckets) {
    List<ResultRecord> window =
        race.results().stream()
            .filter(r -> r.rank() >= 1 && r.rank() <= topN)
            .sorted(Comparator.comparingInt(ResultRecord::rank))
            .toList();
    double[] scores = window.stream().mapToDouble(ResultRecord::score).toArray();
    return new RaceChartSeries(
        race.raceId(),
        race.displayName(),
        window.stream().map(r -> new RankPoint(r.rank(), r.score())).toList(),
        RaceMetrics.lorenzCurve(scores),
        RaceMetrics.gini(scores),
        RaceMetrics.bucketMeans(window, buckets));
  }
}
