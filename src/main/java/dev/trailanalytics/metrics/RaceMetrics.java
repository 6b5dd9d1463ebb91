package dev.trailanalytics.metrics;

import dev.trailanalytics.race.ResultRecord;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Computes the competitiveness and inequality metrics of a race result set.
 *
 * <p>All methods are pure functions. Undefined results (empty windows, too few points) are
 * reported as {@link Double#NaN}, never as 0 and never by throwing; callers must render them
 * distinctly from zero.
 */
public final class RaceMetrics {

  /** Reference score ceiling used to normalize the area under the rank curve. */
  public static final double MAX_SCORE_FOR_NORMALIZATION = 1000.0;

  private RaceMetrics() {}

  /** Arithmetic mean; NaN for an empty array. */
  public static double mean(double[] values) {
    if (values.length == 0) {
      return Double.NaN;
    }
    double sum = 0.0;
    for (double v : values) {
      sum += v;
    }
    return sum / values.length;
  }

  /** Population standard deviation (divides by n, not n-1); NaN for an empty array. */
  public static double populationStd(double[] values) {
    if (values.length == 0) {
      return Double.NaN;
    }
    double m = mean(values);
    double sumSquares = 0.0;
    for (double v : values) {
      sumSquares += (v - m) * (v - m);
    }
    return Math.sqrt(sumSquares / values.length);
  }

  /**
   * Selects the top-N scores of a result set.
   *
   * <p>Only records with rank >= 1 are considered, in ascending rank order. With {@code
   * limitByRank} the window is additionally restricted to ranks 1..n, so a race missing its first
   * ranks yields fewer than n scores. Without it the window is the first n records by rank order,
   * whatever their rank values.
   */
  public static double[] topScores(List<ResultRecord> results, int n, boolean limitByRank) {
    return results.stream()
        .filter(r -> r.rank() >= 1 && Double.isFinite(r.score()))
        .sorted(Comparator.comparingInt(ResultRecord::rank))
        .filter(r -> !limitByRank || r.rank() <= n)
        .limit(Math.max(0, n))
        .mapToDouble(ResultRecord::score)
        .toArray();
  }

  /** RCI_N: mean minus population standard deviation of the top-N window; NaN when empty. */
  public static double rci(List<ResultRecord> results, int n, boolean limitByRank) {
    double[] values = topScores(results, n, limitByRank);
    if (values.length == 0) {
      return Double.NaN;
    }
    return mean(values) - populationStd(values);
  }

  /** Mean, standard deviation and RCI of the first n records by rank order. */
  public static TopStats topStats(List<ResultRecord> results, int n) {
    double[] values = topScores(results, n, false);
    if (values.length == 0) {
      return TopStats.UNDEFINED;
    }
    double m = mean(values);
    double sd = populationStd(values);
    return new TopStats(m, sd, m - sd);
  }

  /**
   * Gini coefficient of the non-negative finite values: 0 for perfect equality, approaching 1 for
   * maximal inequality.
   *
   * @return NaN when no value qualifies, 0 when all qualifying values are 0
   */
  public static double gini(double[] values) {
    double[] x = nonNegativeSorted(values);
    int n = x.length;
    if (n == 0) {
      return Double.NaN;
    }
    double sum = Arrays.stream(x).sum();
    if (sum == 0.0) {
      return 0.0;
    }
    double weighted = 0.0;
    for (int i = 0; i < n; i++) {
      weighted += (i + 1) * x[i];
    }
    return (2.0 * weighted) / (n * sum) - (n + 1.0) / n;
  }

  /**
   * Lorenz curve of the non-negative finite values, starting at (0, 0) and ending at (1, 1).
   * Empty or zero-sum inputs produce the equality line (0, 0)-(1, 1).
   */
  public static List<LorenzPoint> lorenzCurve(double[] values) {
    double[] v = nonNegativeSorted(values);
    int n = v.length;
    double total = Arrays.stream(v).sum();
    if (n == 0 || total == 0.0) {
      return List.of(new LorenzPoint(0.0, 0.0), new LorenzPoint(1.0, 1.0));
    }
    List<LorenzPoint> points = new ArrayList<>(n + 1);
    points.add(new LorenzPoint(0.0, 0.0));
    double cumulative = 0.0;
    for (int i = 0; i < n; i++) {
      cumulative += v[i];
      points.add(new LorenzPoint((double) (i + 1) / n, cumulative / total));
    }
    return List.copyOf(points);
  }

  /**
   * Trapezoidal area under the (rank, score) curve of ranks 1..topN, divided by {@code topN *
   * 1000}.
   *
   * @return NaN when fewer than two records fall in the window
   */
  public static double aucNormalized(List<ResultRecord> results, int topN) {
    List<ResultRecord> window =
        results.stream()
            .filter(r -> r.rank() >= 1 && r.rank() <= topN)
            .sorted(Comparator.comparingInt(ResultRecord::rank))
            .toList();
    if (window.size() < 2) {
      return Double.NaN;
    }
    double area = 0.0;
    for (int i = 1; i < window.size(); i++) {
      ResultRecord prev = window.get(i - 1);
      ResultRecord cur = window.get(i);
      area += (cur.rank() - prev.rank()) * (cur.score() + prev.score()) / 2.0;
    }
    return area / (topN * MAX_SCORE_FOR_NORMALIZATION);
  }

  /** Heatmap bucket count for a window: {@code clamp(ceil(topN / 10), 3, 10)}. */
  public static int bucketCount(int topN) {
    int count = (int) Math.ceil(topN / 10.0);
    return Math.min(10, Math.max(3, count));
  }

  /**
   * Splits ranks 1..topN into contiguous ranges of {@code ceil(topN / bucketCount)} ranks. Ranges
   * that would start beyond topN are omitted, so fewer than {@code bucketCount} ranges may be
   * returned.
   */
  public static List<RankBucket> bucketRanges(int topN, int bucketCount) {
    int size = Math.max(1, (int) Math.ceil((double) topN / bucketCount));
    List<RankBucket> ranges = new ArrayList<>();
    for (int i = 0; i < bucketCount; i++) {
      int start = i * size + 1;
      if (start > topN) {
        break;
      }
      ranges.add(new RankBucket(start, Math.min(topN, (i + 1) * size)));
    }
    return List.copyOf(ranges);
  }

  /**
   * Mean score per bucket; an element is null when no record falls in its range. The result has
   * exactly one element per range.
   */
  public static List<Double> bucketMeans(List<ResultRecord> results, List<RankBucket> ranges) {
    List<Double> means = new ArrayList<>(ranges.size());
    for (RankBucket range : ranges) {
      double[] bucket =
          results.stream()
              .filter(r -> range.contains(r.rank()))
              .mapToDouble(ResultRecord::score)
              .toArray();
      means.add(bucket.length == 0 ? null : mean(bucket));
    }
    return Collections.unmodifiableList(means);
  }

  /** Scores of the records ranked 1..topN, in rank order. */
  public static double[] scoresWithinRank(List<ResultRecord> results, int topN) {
    return results.stream()
        .filter(r -> r.rank() >= 1 && r.rank() <= topN)
        .sorted(Comparator.comparingInt(ResultRecord::rank))
        .mapToDouble(ResultRecord::score)
        .toArray();
  }

  private static double[] nonNegativeSorted(double[] values) {
    return Arrays.stream(values).filter(v -> Double.isFinite(v) && v >= 0).sorted().toArray();
  }
}
