package dev.trailanalytics.compare;

import dev.trailanalytics.sex.Sex;
import org.jspecify.annotations.Nullable;

/**
 * One (race, sex, N) RCI sample of the ladder visualization. Scores are sex-normalized, so male
 * and female points share one axis.
 *
 * @param raceId the race
 * @param year edition year
 * @param seriesLabel series label, {@code "-"} when the race has no series
 * @param sex the sex the sample was computed for
 * @param n the top-N window size
 * @param rci RCI of the window (always finite)
 * @param topMean mean score of the window
 * @param topStd population standard deviation of the window
 */
public record LadderPoint(
    String raceId,
    @Nullable Integer year,
    String seriesLabel,
    Sex sex,
    int n,
    double rci,
    double topMean,
    double topStd) {

  /** True when this point has the given (raceId, sex, n) key. */
  public boolean hasKey(String otherRaceId, Sex otherSex, int otherN) {
    return raceId.equals(otherRaceId) && sex == otherSex && n == otherN;
  }
}
