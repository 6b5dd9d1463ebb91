package dev.trailanalytics.selection;

import org.jspecify.annotations.Nullable;

/** A table row whose cells can be looked up by column key for sorting. */
public interface SortableRow {

  /**
   * Value of a column. Numbers (including NaN for undefined metrics) are returned as {@link
   * Double}, text as {@link String}; unknown keys return null.
   */
  @Nullable Object sortValue(String key);
}
