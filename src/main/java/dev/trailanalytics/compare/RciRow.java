package dev.trailanalytics.compare;

import dev.trailanalytics.selection.SortableRow;
import org.jspecify.annotations.Nullable;

/**
 * One line of a per-sex RCI table. Undefined values are NaN.
 *
 * @param raceId the race
 * @param name display name
 * @param country country code, empty when unknown
 * @param series series label, empty when none
 * @param rc3 RCI of the first 3 finishers of the sex
 * @param rc5 RCI of the first 5
 * @param rc10 RCI of the first 10
 * @param rc20 RCI of the first 20
 */
public record RciRow(
    String raceId,
    String name,
    String country,
    String series,
    double rc3,
    double rc5,
    double rc10,
    double rc20)
    implements SortableRow {

  public boolean hasAnyDefinedValue() {
    return Double.isFinite(rc3)
        || Double.isFinite(rc5)
        || Double.isFinite(rc10)
        || Double.isFinite(rc20);
  }

  @Override
  public @Nullable Object sortValue(String key) {
    return switch (key) {
      case "name" -> name;
      case "country" -> country;
      case "series" -> series;
      case "rc3" -> rc3;
      case "rc5" -> rc5;
      case "rc10" -> rc10;
      case "rc20" -> rc20;
      default -> null;
    };
  }
}
