package dev.trailanalytics.race;

import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Descriptive metadata of a race document.
 *
 * @param name display name of the race
 * @param year edition year
 * @param countryCode country the race is held in ("country" on the wire)
 * @param seriesTags series the race belongs to, in source order (never null, may be empty)
 * @param dataSource where the results come from (e.g. "ITRA")
 * @param distanceKm course distance in kilometres
 * @param elevationM positive elevation in metres
 * @param prizeMoney free-text prize money description
 * @param notes free-text notes
 * @param sourceUrl link to the published results
 */
public record RaceMetadata(
    @Nullable String name,
    @Nullable Integer year,
    @Nullable String countryCode,
    List<String> seriesTags,
    @Nullable String dataSource,
    @Nullable Double distanceKm,
    @Nullable Double elevationM,
    @Nullable String prizeMoney,
    @Nullable String notes,
    @Nullable String sourceUrl) {

  public RaceMetadata {
    seriesTags = seriesTags == null ? List.of() : List.copyOf(seriesTags);
  }

  /** Metadata with every optional field absent. */
  public static RaceMetadata empty() {
    return new RaceMetadata(null, null, null, List.of(), null, null, null, null, null, null);
  }

  /** Series tags joined with {@code ", "}, or an empty string when the race has none. */
  public String seriesLabel() {
    return String.join(", ", seriesTags);
  }
}
