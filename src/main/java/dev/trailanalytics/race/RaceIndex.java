package dev.trailanalytics.race;

import java.util.List;
import org.jspecify.annotations.Nullable;

/** Read-only view of the known races and whatever metadata has been loaded for them. */
public interface RaceIndex {

  /** Identifiers of every race listed in the manifest, in manifest order. */
  List<String> raceIds();

  /** Metadata of a loaded race, or null when the race is unknown or not loaded yet. */
  @Nullable RaceMetadata metadata(String raceId);
}
