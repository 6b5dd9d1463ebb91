package dev.trailanalytics.race;

import org.jspecify.annotations.Nullable;

/**
 * One finisher line of a race in canonical form.
 *
 * @param rank the finishing position (1-based; ties are not deduplicated)
 * @param score the race score ("index" on the wire), always finite once normalized
 * @param runner optional runner name
 * @param sex optional raw sex label as supplied by the source ("gender" on the wire)
 * @param nationality optional nationality text
 */
public record ResultRecord(
    int rank,
    double score,
    @Nullable String runner,
    @Nullable String sex,
    @Nullable String nationality) {

  /** Returns a copy of this record carrying a different score. */
  public ResultRecord withScore(double newScore) {
    return new ResultRecord(rank, newScore, runner, sex, nationality);
  }
}
