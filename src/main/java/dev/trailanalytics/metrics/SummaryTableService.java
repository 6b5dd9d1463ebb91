package dev.trailanalytics.metrics;

import dev.trailanalytics.race.Race;
import dev.trailanalytics.race.RaceCatalog;
import dev.trailanalytics.race.RaceMetadata;
import dev.trailanalytics.race.ResultRecord;
import dev.trailanalytics.selection.RowComparator;
import dev.trailanalytics.selection.SelectionContext;
import dev.trailanalytics.selection.SortSpec;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Service;

/**
 * Builds the race summary table: headline top-N means, RCI at 5/10/20, AUC and Gini over the top
 * 30, for every selected race that loads and passes the panel filter.
 */
@Service
public class SummaryTableService {

  static final int HEADLINE_WINDOW = 30;

  private final RaceCatalog raceCatalog;

  public SummaryTableService(RaceCatalog raceCatalog) {
    this.raceCatalog = raceCatalog;
  }

  public List<SummaryRow> buildRows(SelectionContext selection, SortSpec sort) {
    List<SummaryRow> rows = new ArrayList<>();
    for (Race race : raceCatalog.loadRaces(selection.selectedIds())) {
      if (!selection.filter().matches(race.metadata())) {
        continue;
      }
      rows.add(summarize(race));
    }
    rows.sort(RowComparator.by(sort));
    return rows;
  }

  /** Summary line of one race. Headline windows are limited by rank value. */
  public static SummaryRow summarize(Race race) {
    RaceMetadata meta = race.metadata();
    List<ResultRecord> results = race.results();
    return new SummaryRow(
        race.raceId(),
        race.displayName(),
        meta.year(),
        meta.seriesLabel(),
        meta.countryCode() == null ? "" : meta.countryCode(),
        meta.dataSource() == null ? "" : meta.dataSource(),
        RaceMetrics.mean(RaceMetrics.topScores(results, 3, true)),
        RaceMetrics.mean(RaceMetrics.topScores(results, 5, true)),
        RaceMetrics.mean(RaceMetrics.topScores(results, 10, true)),
        RaceMetrics.rci(results, 5, true),
        RaceMetrics.rci(results, 10, true),
        RaceMetrics.rci(results, 20, true),
        RaceMetrics.aucNormalized(results, HEADLINE_WINDOW),
        RaceMetrics.gini(RaceMetrics.scoresWithinRank(results, HEADLINE_WINDOW)));
  }
}
