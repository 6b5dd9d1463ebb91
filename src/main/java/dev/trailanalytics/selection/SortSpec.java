package dev.trailanalytics.selection;

/**
 * Active sort column and direction of a table.
 *
 * @param key the column key, e.g. {@code "rc10"}
 * @param direction ascending or descending
 */
public record SortSpec(String key, SortDirection direction) {

  public SortSpec {
    if (key == null || key.isBlank()) {
      throw new IllegalArgumentException("Sort key must not be blank");
    }
    if (direction == null) {
      direction = SortDirection.DESC;
    }
  }

  public static SortSpec descending(String key) {
    return new SortSpec(key, SortDirection.DESC);
  }

  /**
   * Header-click transition: clicking the active column flips the direction, clicking another
   * column sorts it descending.
   */
  public SortSpec clicked(String clickedKey) {
    if (key.equals(clickedKey)) {
      return new SortSpec(key, direction.flip());
    }
    return descending(clickedKey);
  }
}
