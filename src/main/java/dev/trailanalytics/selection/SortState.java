package dev.trailanalytics.selection;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Sort spec of each table of a panel, keyed by table name (e.g. {@code "male"}, {@code "female"}).
 */
public class SortState {

  private final Map<String, SortSpec> specs = new LinkedHashMap<>();
  private final SortSpec fallback;

  public SortState(SortSpec fallback) {
    this.fallback = fallback;
  }

  public SortSpec get(String table) {
    return specs.getOrDefault(table, fallback);
  }

  public void set(String table, SortSpec spec) {
    specs.put(table, spec);
  }

  /** Applies a header click on {@code key} to the given table and returns the new spec. */
  public SortSpec click(String table, String key) {
    SortSpec next = get(table).clicked(key);
    specs.put(table, next);
    return next;
  }
}
