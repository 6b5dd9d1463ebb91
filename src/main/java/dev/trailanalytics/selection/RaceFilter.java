package dev.trailanalytics.selection;

import com.fasterxml.jackson.annotation.JsonIgnore;
import dev.trailanalytics.race.RaceMetadata;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Country and series constraints applied to race metadata.
 *
 * @param country required country, or null/blank for no constraint
 * @param seriesTags accepted series tags; empty means no constraint, otherwise a race matches
 *     when it carries at least one of them
 */
public record RaceFilter(@Nullable String country, List<String> seriesTags) {

  public static final RaceFilter NONE = new RaceFilter(null, List.of());

  public RaceFilter {
    country = country == null || country.isBlank() ? null : country;
    seriesTags =
        seriesTags == null
            ? List.of()
            : seriesTags.stream().filter(t -> t != null && !t.isBlank()).toList();
  }

  /**
   * Tests race metadata against this filter. Unknown metadata (race not loaded) fails every active
   * constraint and passes when the filter is empty.
   */
  public boolean matches(@Nullable RaceMetadata metadata) {
    if (country != null) {
      String raceCountry = metadata == null ? null : metadata.countryCode();
      if (!country.equals(raceCountry)) {
        return false;
      }
    }
    if (!seriesTags.isEmpty()) {
      List<String> raceSeries = metadata == null ? List.of() : metadata.seriesTags();
      return seriesTags.stream().anyMatch(raceSeries::contains);
    }
    return true;
  }

  public RaceFilter withCountry(@Nullable String newCountry) {
    return new RaceFilter(newCountry, seriesTags);
  }

  public RaceFilter withSeries(List<String> newSeriesTags) {
    return new RaceFilter(country, newSeriesTags);
  }

  @JsonIgnore
  public boolean isEmpty() {
    return country == null && seriesTags.isEmpty();
  }
}
