package dev.trailanalytics.compare;

import dev.trailanalytics.config.AnalyticsProperties;
import dev.trailanalytics.metrics.RaceMetrics;
import dev.trailanalytics.metrics.TopStats;
import dev.trailanalytics.race.Race;
import dev.trailanalytics.race.RaceCatalog;
import dev.trailanalytics.race.RaceMetadata;
import dev.trailanalytics.race.ResultRecord;
import dev.trailanalytics.selection.SelectionContext;
import dev.trailanalytics.sex.Sex;
import dev.trailanalytics.sex.SexFilter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Cross-race and cross-sex comparisons built on sex-normalized RCI values.
 *
 * <ul>
 *   <li><b>Ladder</b>: one point per race, sex and N, so each race shows as a small RCI profile.
 *   <li><b>Parity</b>: male and female RCI of the same race and N paired into one row.
 *   <li><b>Closest matches</b>: the ladder points whose RCI is nearest to a chosen point.
 * </ul>
 */
@Service
public class ComparativeAnalysisService {

  private static final Logger log = LoggerFactory.getLogger(ComparativeAnalysisService.class);

  public static final List<Integer> LADDER_N_LEVELS = List.of(3, 5, 10, 20, 30);
  public static final List<Integer> PARITY_N_LEVELS = List.of(3, 5, 10, 20);

  private final RaceCatalog raceCatalog;
  private final AnalyticsProperties properties;

  public ComparativeAnalysisService(RaceCatalog raceCatalog, AnalyticsProperties properties) {
    this.raceCatalog = raceCatalog;
    this.properties = properties;
  }

  /** Ladder points of the selected races; races that fail to load are skipped. */
  public List<LadderPoint> ladderPoints(SelectionContext selection, List<Integer> nLevels) {
    List<Race> races = raceCatalog.loadRaces(selection.selectedIds());
    List<LadderPoint> points = derivePoints(races, nLevels);
    log.debug("Derived {} ladder points from {} races", points.size(), races.size());
    return points;
  }

  /** Parity rows of the selected races. */
  public List<ParityRow> parityRows(SelectionContext selection, List<Integer> nLevels) {
    return pairBySex(derivePoints(raceCatalog.loadRaces(selection.selectedIds()), nLevels));
  }

  /** Closest matches using the configured result limit. */
  public List<ClosestMatch> closestMatches(LadderPoint reference, List<LadderPoint> points) {
    return closestMatches(reference, points, properties.getClosestMatchLimit());
  }

  /**
   * Computes ladder points: for each race, each sex the race is not inferred to exclude, and each
   * N, the top-N statistics of the sex-filtered records (female scores normalized). Points with an
   * undefined RCI are discarded. The output is flat; consumers partition it by sex.
   */
  public static List<LadderPoint> derivePoints(List<Race> races, List<Integer> nLevels) {
    List<LadderPoint> points = new ArrayList<>();
    for (Race race : races) {
      RaceMetadata meta = race.metadata();
      String seriesLabel = meta.seriesTags().isEmpty() ? "-" : meta.seriesLabel();
      for (Sex sex : Sex.values()) {
        if (SexFilter.isExcluded(race, sex)) {
          continue;
        }
        List<ResultRecord> records = SexFilter.resultsFor(race.results(), sex, true);
        for (int n : nLevels) {
          TopStats stats = RaceMetrics.topStats(records, n);
          if (!stats.isDefined()) {
            continue;
          }
          points.add(
              new LadderPoint(
                  race.raceId(),
                  meta.year(),
                  seriesLabel,
                  sex,
                  n,
                  stats.rci(),
                  stats.mean(),
                  stats.std()));
        }
      }
    }
    return points;
  }

  /**
   * Groups ladder points by (raceId, year, seriesLabel, N) and keeps the groups where both a male
   * and a female RCI are present and finite. Rows keep the order in which their key first
   * appeared.
   */
  public static List<ParityRow> pairBySex(List<LadderPoint> points) {
    Map<ParityKey, double[]> grouped = new LinkedHashMap<>();
    for (LadderPoint p : points) {
      ParityKey key = new ParityKey(p.raceId(), p.year(), p.seriesLabel(), p.n());
      double[] pair = grouped.computeIfAbsent(key, k -> new double[] {Double.NaN, Double.NaN});
      pair[p.sex() == Sex.MALE ? 0 : 1] = p.rci();
    }
    List<ParityRow> rows = new ArrayList<>();
    grouped.forEach(
        (key, pair) -> {
          if (Double.isFinite(pair[0]) && Double.isFinite(pair[1])) {
            rows.add(
                new ParityRow(
                    key.raceId(), key.year(), key.seriesLabel(), key.n(), pair[0], pair[1]));
          }
        });
    return rows;
  }

  /**
   * Ranks every other point by absolute RCI distance to {@code reference} and returns the nearest
   * {@code limit}. Points sharing the reference's (raceId, sex, n) key are skipped; ties keep input
   * order.
   */
  public static List<ClosestMatch> closestMatches(
      LadderPoint reference, List<LadderPoint> points, int limit) {
    return points.stream()
        .filter(p -> !p.hasKey(reference.raceId(), reference.sex(), reference.n()))
        .map(p -> new ClosestMatch(p, Math.abs(p.rci() - reference.rci())))
        .sorted(Comparator.comparingDouble(ClosestMatch::delta))
        .limit(Math.max(0, limit))
        .toList();
  }

  /** Finds the point with the given (raceId, sex, n) key. */
  public static Optional<LadderPoint> findPoint(
      List<LadderPoint> points, String raceId, Sex sex, int n) {
    return points.stream().filter(p -> p.hasKey(raceId, sex, n)).findFirst();
  }

  private record ParityKey(String raceId, @Nullable Integer year, String seriesLabel, int n) {}
}
