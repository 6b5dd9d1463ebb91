package dev.trailanalytics.compare;

import org.jspecify.annotations.Nullable;

/**
 * Male and female RCI of the same race and N.
 *
 * @param raceId the race
 * @param year edition year
 * @param seriesLabel series label
 * @param n the top-N window size
 * @param rciMale RCI of the male field
 * @param rciFemale sex-normalized RCI of the female field
 */
public record ParityRow(
    String raceId,
    @Nullable Integer year,
    String seriesLabel,
    int n,
    double rciMale,
    double rciFemale) {

  /** Female minus male RCI; positive when the women's field is the more competitive one. */
  public double delta() {
    return rciFemale - rciMale;
  }
}
