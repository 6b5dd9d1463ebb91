package dev.trailanalytics.api;

import dev.trailanalytics.race.RaceMetadata;
import org.jspecify.annotations.Nullable;

/**
 * One manifest race with its metadata when already loaded.
 *
 * @param raceId the race identifier
 * @param metadata the race metadata, null while the race has not been loaded
 */
public record RaceListing(String raceId, @Nullable RaceMetadata metadata) {}
