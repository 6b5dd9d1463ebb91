package dev.trailanalytics.sex;

import dev.trailanalytics.race.Race;
import dev.trailanalytics.race.ResultRecord;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** Restricts races and result sets to one sex, optionally applying the female score correction. */
public final class SexFilter {

  private SexFilter() {
    // utility class
  }

  /**
   * A race is excluded from a single-sex panel when its inferred overall sex is known and differs
   * from the panel's. Excluded races contribute no records at all to that panel.
   */
  public static boolean isExcluded(Race race, Sex panelSex) {
    Sex raceSex = SexClassifier.inferRaceSex(race.raceId(), race.metadata());
    return raceSex != null && raceSex != panelSex;
  }

  /**
   * Keeps the records whose label normalizes to {@code sex}; a null sex keeps every record.
   *
   * @param normalizeFemale when true and {@code sex} is {@link Sex#FEMALE}, the returned records
   *     are copies carrying the corrected score; the input records are never modified
   */
  public static List<ResultRecord> resultsFor(
      List<ResultRecord> results, @Nullable Sex sex, boolean normalizeFemale) {
    if (sex == null) {
      return results;
    }
    List<ResultRecord> filtered =
        results.stream().filter(r -> SexClassifier.normalizeLabel(r.sex()) == sex).toList();
    if (!normalizeFemale || sex != Sex.FEMALE) {
      return filtered;
    }
    return filtered.stream()
        .map(r -> r.withScore(FemaleScoreNormalizer.normalize(r.score())))
        .toList();
  }

  /** Records of {@code race} that feed a panel restricted to {@code sex}; empty when excluded. */
  public static List<ResultRecord> panelResults(Race race, Sex sex, boolean normalizeFemale) {
    if (isExcluded(race, sex)) {
      return List.of();
    }
    return resultsFor(race.results(), sex, normalizeFemale);
  }
}
