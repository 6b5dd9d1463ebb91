package dev.trailanalytics.compare;

import dev.trailanalytics.metrics.MetricRow;
import dev.trailanalytics.metrics.MetricRowCalculator;
import dev.trailanalytics.race.Race;
import dev.trailanalytics.race.RaceCatalog;
import dev.trailanalytics.race.RaceMetadata;
import dev.trailanalytics.selection.RowComparator;
import dev.trailanalytics.selection.SelectionContext;
import dev.trailanalytics.selection.SortSpec;
import dev.trailanalytics.sex.Sex;
import dev.trailanalytics.sex.SexFilter;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Service;

/**
 * Builds the per-sex RCI tables (RCI at N = 3, 5, 10, 20).
 *
 * <p>A race contributes to the table of one sex only if it is selected, passes the panel filter
 * and is not inferred to be a race of the other sex. RCI windows are the first N finishers of the
 * sex by rank order, not ranks 1..N of the overall classification.
 */
@Service
public class RciTableService {

  public static final List<Integer> RCI_N_LEVELS = List.of(3, 5, 10, 20);

  static final int METRIC_WINDOW = 30;

  private final RaceCatalog raceCatalog;

  public RciTableService(RaceCatalog raceCatalog) {
    this.raceCatalog = raceCatalog;
  }

  /**
   * Computes the RCI table of one sex.
   *
   * @param selection the panel selection and filter
   * @param sex the table's sex
   * @param normalizeFemale apply the female score correction (normalized panels)
   * @param sort the table's sort spec
   * @return rows with at least one defined RCI, sorted
   */
  public List<RciRow> buildRows(
      SelectionContext selection, Sex sex, boolean normalizeFemale, SortSpec sort) {
    List<RciRow> rows = new ArrayList<>();
    for (Race race : raceCatalog.loadRaces(selection.selectedIds())) {
      if (!selection.filter().matches(race.metadata()) || SexFilter.isExcluded(race, sex)) {
        continue;
      }
      RciRow row = toRow(race, sex, normalizeFemale);
      if (row.hasAnyDefinedValue()) {
        rows.add(row);
      }
    }
    rows.sort(RowComparator.by(sort));
    return rows;
  }

  static RciRow toRow(Race race, Sex sex, boolean normalizeFemale) {
    MetricRow metrics =
        MetricRowCalculator.compute(race, sex, normalizeFemale, RCI_N_LEVELS, METRIC_WINDOW);
    RaceMetadata meta = race.metadata();
    return new RciRow(
        race.raceId(),
        race.displayName(),
        meta.countryCode() == null ? "" : meta.countryCode(),
        meta.seriesLabel(),
        metrics.rci(3),
        metrics.rci(5),
        metrics.rci(10),
        metrics.rci(20));
  }
}
