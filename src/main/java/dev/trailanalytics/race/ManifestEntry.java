package dev.trailanalytics.race;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One line of the race manifest.
 *
 * @param raceId unique race identifier
 * @param locator where the race document lives, relative to the data root
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ManifestEntry(
    @JsonProperty("race_id") String raceId, @JsonProperty("path") String locator) {}
