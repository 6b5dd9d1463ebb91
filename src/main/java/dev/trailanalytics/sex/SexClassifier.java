package dev.trailanalytics.sex;

import dev.trailanalytics.race.RaceMetadata;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;

/**
 * Infers the sex of a result record from its raw label, and of a whole race from its name.
 *
 * <p>Record labels go through a fixed synonym table (English and French). A race whose name or id
 * mentions men/hommes (checked first) or women/femmes is treated as a single-sex race.
 */
public final class SexClassifier {

  private static final Set<String> MALE_LABELS = Set.of("m", "men", "man", "male", "homme", "h");
  private static final Set<String> FEMALE_LABELS =
      Set.of("f", "women", "woman", "female", "femme", "w");

  private static final Pattern MALE_RACE = Pattern.compile("\\b(men|hommes?)\\b");
  private static final Pattern FEMALE_RACE = Pattern.compile("\\b(women|femmes?)\\b");

  private SexClassifier() {
    // utility class
  }

  /**
   * Maps a raw record label to a sex.
   *
   * @param label the raw label, e.g. {@code "M"}, {@code "Femme"}
   * @return the sex, or null when the label is absent or not recognized
   */
  public static @Nullable Sex normalizeLabel(@Nullable String label) {
    if (label == null) {
      return null;
    }
    String lower = label.trim().toLowerCase(Locale.ROOT);
    if (MALE_LABELS.contains(lower)) {
      return Sex.MALE;
    }
    if (FEMALE_LABELS.contains(lower)) {
      return Sex.FEMALE;
    }
    return null;
  }

  /**
   * Infers the overall sex of a race from its name and id, e.g. {@code "Western States (Women)"}.
   *
   * @return the inferred sex, or null for mixed or undetermined races
   */
  public static @Nullable Sex inferRaceSex(String raceId, @Nullable RaceMetadata metadata) {
    String name = metadata == null || metadata.name() == null ? "" : metadata.name();
    String text = (name + " " + raceId).toLowerCase(Locale.ROOT);
    if (MALE_RACE.matcher(text).find()) {
      return Sex.MALE;
    }
    if (FEMALE_RACE.matcher(text).find()) {
      return Sex.FEMALE;
    }
    return null;
  }
}
