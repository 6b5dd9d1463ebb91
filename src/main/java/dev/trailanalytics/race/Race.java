package dev.trailanalytics.race;

import java.util.List;

/**
 * A race in canonical form: identifier, metadata and its results ordered by ascending rank.
 *
 * <p>Instances are produced by {@link RaceNormalizer} and are read-only afterwards.
 */
public record Race(String raceId, RaceMetadata metadata, List<ResultRecord> results) {

  public Race {
    if (raceId == null || raceId.isBlank()) {
      throw new IllegalArgumentException("raceId must not be blank");
    }
    metadata = metadata == null ? RaceMetadata.empty() : metadata;
    results = results == null ? List.of() : List.copyOf(results);
  }

  /** The race name when present, otherwise its identifier. */
  public String displayName() {
    String name = metadata.name();
    return name == null || name.isBlank() ? raceId : name;
  }
}
