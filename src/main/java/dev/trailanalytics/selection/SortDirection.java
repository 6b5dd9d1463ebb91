package dev.trailanalytics.selection;

public enum SortDirection {
  ASC,
  DESC;

  public SortDirection flip() {
    return this == ASC ? DESC : ASC;
  }
}
