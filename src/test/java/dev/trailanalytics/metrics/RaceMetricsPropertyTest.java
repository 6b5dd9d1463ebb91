package dev.trailanalytics.metrics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import dev.trailanalytics.race.ResultRecord;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;
import net.jqwik.api.constraints.DoubleRange;
import net.jqwik.api.constraints.IntRange;

/**
 * Property-based tests for the inequality and window metrics of {@link RaceMetrics}: bounds that
 * must hold for every score set, not only for hand-picked examples.
 */
class RaceMetricsPropertyTest {

  @Provide
  Arbitrary<double[]> scoreSets() {
    return Arbitraries.doubles()
        .between(-200.0, 1000.0)
        .array(double[].class)
        .ofMinSize(1)
        .ofMaxSize(60);
  }

  @Property
  void gini_lies_between_zero_and_one(@ForAll("scoreSets") double[] scores) {
    double gini = RaceMetrics.gini(scores);

    if (Double.isNaN(gini)) {
      // only possible when every value was negative
      assertThat(Arrays.stream(scores).allMatch(v -> v < 0)).isTrue();
    } else {
      assertThat(gini).isBetween(0.0, 1.0);
    }
  }

  @Property
  void equal_scores_have_zero_gini(
      @ForAll @DoubleRange(min = 0.0, max = 1000.0) double score,
      @ForAll @IntRange(min = 1, max = 50) int count) {
    double[] scores = new double[count];
    Arrays.fill(scores, score);

    assertThat(RaceMetrics.gini(scores)).isCloseTo(0.0, within(1e-9));
  }

  @Property
  void lorenz_curve_runs_from_origin_to_one_and_never_decreases(
      @ForAll("scoreSets") double[] scores) {
    List<LorenzPoint> curve = RaceMetrics.lorenzCurve(scores);

    assertThat(curve.get(0)).isEqualTo(new LorenzPoint(0.0, 0.0));
    LorenzPoint last = curve.get(curve.size() - 1);
    assertThat(last.populationShare()).isCloseTo(1.0, within(1e-9));
    assertThat(last.scoreShare()).isCloseTo(1.0, within(1e-9));
    for (int i = 1; i < curve.size(); i++) {
      assertThat(curve.get(i).populationShare())
          .isGreaterThanOrEqualTo(curve.get(i - 1).populationShare());
      assertThat(curve.get(i).scoreShare())
          .isGreaterThanOrEqualTo(curve.get(i - 1).scoreShare() - 1e-12);
    }
  }

  @Property
  void rci_is_undefined_only_for_an_empty_window(
      @ForAll @IntRange(min = 0, max = 20) int finishers,
      @ForAll @IntRange(min = 1, max = 30) int n) {
    List<ResultRecord> results = new ArrayList<>();
    for (int rank = 1; rank <= finishers; rank++) {
      results.add(new ResultRecord(rank, 1000.0 - rank * 10, null, null, null));
    }

    double rci = RaceMetrics.rci(results, n, true);

    assertThat(Double.isNaN(rci)).isEqualTo(finishers == 0);
  }

  @Property
  void bucket_means_have_one_entry_per_range(@ForAll @IntRange(min = 1, max = 300) int topN) {
    List<RankBucket> ranges = RaceMetrics.bucketRanges(topN, RaceMetrics.bucketCount(topN));

    assertThat(RaceMetrics.bucketMeans(List.of(), ranges)).hasSize(ranges.size());
    assertThat(ranges).allMatch(r -> r.start() <= topN);
    assertThat(ranges.get(ranges.size() - 1).end()).isEqualTo(topN);
  }
}
