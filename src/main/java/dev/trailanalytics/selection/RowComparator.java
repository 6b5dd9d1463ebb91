package dev.trailanalytics.selection;

import java.text.Collator;
import java.util.Comparator;
import java.util.Locale;
import org.jspecify.annotations.Nullable;

/**
 * Orders table rows by one column.
 *
 * <p>When both cells are finite numbers they compare numerically. Otherwise both cells are
 * stringified (null as the empty string, NaN as {@code "NaN"}) and compared with a collator. The
 * direction is applied last. The order among rows with equal cells is unspecified.
 */
public final class RowComparator<T extends SortableRow> implements Comparator<T> {

  private static final Collator COLLATOR = Collator.getInstance(Locale.ROOT);

  private final SortSpec spec;

  private RowComparator(SortSpec spec) {
    this.spec = spec;
  }

  public static <T extends SortableRow> RowComparator<T> by(SortSpec spec) {
    return new RowComparator<>(spec);
  }

  @Override
  public int compare(T a, T b) {
    int cmp = compareValues(a.sortValue(spec.key()), b.sortValue(spec.key()));
    return spec.direction() == SortDirection.ASC ? cmp : -cmp;
  }

  static int compareValues(@Nullable Object va, @Nullable Object vb) {
    if (isFiniteNumber(va) && isFiniteNumber(vb)) {
      return Double.compare(((Number) va).doubleValue(), ((Number) vb).doubleValue());
    }
    return COLLATOR.compare(stringify(va), stringify(vb));
  }

  private static boolean isFiniteNumber(@Nullable Object value) {
    return value instanceof Number number && Double.isFinite(number.doubleValue());
  }

  private static String stringify(@Nullable Object value) {
    if (value == null) {
      return "";
    }
    if (value instanceof Double d && Double.isFinite(d) && d == Math.rint(d)) {
      return Long.toString(d.longValue());
    }
    return String.valueOf(value);
  }
}
