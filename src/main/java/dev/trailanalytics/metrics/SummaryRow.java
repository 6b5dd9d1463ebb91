package dev.trailanalytics.metrics;

import dev.trailanalytics.selection.SortableRow;
import org.jspecify.annotations.Nullable;

/**
 * One line of the race summary table. Undefined metrics are NaN.
 *
 * @param raceId the race
 * @param name display name
 * @param year edition year
 * @param series series label ({@code ", "}-joined tags)
 * @param country country code
 * @param dataSource data source
 * @param top3 mean score of ranks 1-3
 * @param top5 mean score of ranks 1-5
 * @param top10 mean score of ranks 1-10
 * @param rci5 RCI over ranks 1-5
 * @param rci10 RCI over ranks 1-10
 * @param rci20 RCI over ranks 1-20
 * @param aucNorm normalized area under the rank curve of ranks 1-30
 * @param gini Gini coefficient of ranks 1-30
 */
public record SummaryRow(
    String raceId,
    String name,
    @Nullable Integer year,
    String series,
    String country,
    String dataSource,
    double top3,
    double top5,
    double top10,
    double rci5,
    double rci10,
    double rci20,
    double aucNorm,
    double gini)
    implements SortableRow {

  @Override
  public @Nullable Object sortValue(String key) {
    return switch (key) {
      case "name" -> name;
      case "year" -> year == null ? null : year.doubleValue();
      case "series" -> series;
      case "country" -> country;
      case "src" -> dataSource;
      case "top3" -> top3;
      case "top5" -> top5;
      case "top10" -> top10;
      case "rci5" -> rci5;
      case "rci10" -> rci10;
      case "rci20" -> rci20;
      case "aucNorm" -> aucNorm;
      case "gini" -> gini;
      default -> null;
    };
  }
}
