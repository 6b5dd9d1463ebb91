package dev.trailanalytics.ingestion;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import org.jspecify.annotations.Nullable;

/**
 * Form-style input for importing one race: metadata as free text plus the pasted results table.
 *
 * <p>Numeric fields are text because they come straight from form inputs; blank or non-numeric
 * values become absent metadata rather than errors.
 *
 * @param raceId identifier of the race, also used for the manifest entry
 * @param name display name of the race
 * @param series comma-separated series tags
 * @param country country code
 * @param dataSource origin of the results
 * @param year edition year
 * @param distanceKm course distance in kilometres
 * @param elevationM positive elevation in metres
 * @param prizeMoney free-text prize money
 * @param notes free-text notes
 * @param sourceUrl link to the published results
 * @param resultsText the pasted results table
 */
public record ImportRequest(
        @NotBlank(message = "Race ID is required.") @JsonProperty("race_id") String raceId,
        @NotBlank(message = "Race name is required.") @JsonProperty("name") String name,
        @JsonProperty("series") @Nullable String series,
        @JsonProperty("country") @Nullable String country,
        @JsonProperty("data_source") @Nullable String dataSource,
        @JsonProperty("year") @Nullable String year,
        @JsonProperty("distance_km") @Nullable String distanceKm,
        @JsonProperty("elevation_m") @Nullable String elevationM,
        @JsonProperty("prize_money") @Nullable String prizeMoney,
        @JsonProperty("notes") @Nullable String notes,
        @JsonProperty("source_url") @Nullable String sourceUrl,
        @JsonProperty("results") @Nullable String resultsText) {}
