package dev.trailanalytics.ingestion;

import dev.trailanalytics.config.AnalyticsProperties;
import dev.trailanalytics.race.Manifest;
import dev.trailanalytics.race.ManifestEntry;
import dev.trailanalytics.race.NumericText;
import dev.trailanalytics.race.Race;
import dev.trailanalytics.race.RaceCatalog;
import dev.trailanalytics.race.RaceDocumentWriter;
import dev.trailanalytics.race.RaceMetadata;
import dev.trailanalytics.race.RaceNormalizer;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Builds the race document and the updated manifest for a race entered by hand.
 *
 * <p>The import is all-or-nothing: an invalid request or a results table without a single valid
 * row is rejected with one {@link IllegalArgumentException} carrying the reason. Nothing is
 * written; the caller decides where the returned documents go.
 *
 * <p>The manifest entry for the race is inserted, or replaces the existing entry with the same
 * race id, and points at {@code {coursesPath}/{raceId}.json}.
 */
@Service
public class RaceImportService {

    private static final Logger log = LoggerFactory.getLogger(RaceImportService.class);

    private final Validator validator;
    private final RaceCatalog raceCatalog;
    private final RaceDocumentWriter documentWriter;
    private final AnalyticsProperties properties;

    public RaceImportService(Validator validator,
                             RaceCatalog raceCatalog,
                             RaceDocumentWriter documentWriter,
                             AnalyticsProperties properties) {
        this.validator = validator;
        this.raceCatalog = raceCatalog;
        this.documentWriter = documentWriter;
        this.properties = properties;
    }

    /**
     * Validates the request, parses its results and renders both documents.
     *
     * @param request the import form
     * @return the canonical race with its documents and a status message
     * @throws IllegalArgumentException if the request is invalid or no result row is usable
     */
    public ImportDraft buildDraft(ImportRequest request) {
        Set<ConstraintViolation<ImportRequest>> violations = validator.validate(request);
        if (!violations.isEmpty()) {
            String messages = violations.stream()
                    .map(ConstraintViolation::getMessage)
                    .sorted()
                    .collect(Collectors.joining(" "));
            throw new IllegalArgumentException(messages);
        }

        ParseOutcome outcome = PastedResultsParser.parse(request.resultsText());
        if (outcome instanceof ParseOutcome.Failure failure) {
            throw new IllegalArgumentException(failure.reason());
        }
        ParseOutcome.Success success = (ParseOutcome.Success) outcome;

        String raceId = request.raceId().trim();
        RaceMetadata metadata = new RaceMetadata(
                request.name().trim(),
                nullableInteger(request.year()),
                nullableText(request.country()),
                parseSeries(request.series()),
                nullableText(request.dataSource()),
                nullableNumber(request.distanceKm()),
                nullableNumber(request.elevationM()),
                nullableText(request.prizeMoney()),
                nullableText(request.notes()),
                nullableText(request.sourceUrl()));
        Race race = new Race(raceId, metadata, success.records());

        Manifest manifest = raceCatalog.manifest()
                .withEntry(new ManifestEntry(raceId, locatorFor(raceId)));

        String status = "JSON built successfully (" + race.results().size() + " results).";
        log.info("Built import draft for race '{}': {} results, {} rows skipped",
                raceId, race.results().size(), success.skippedRows());
        return new ImportDraft(
                race,
                documentWriter.writeRace(race),
                documentWriter.writeManifest(manifest),
                success.skippedRows(),
                status);
    }

    /** Where a race document is expected to live, relative to the data root. */
    String locatorFor(String raceId) {
        String base = properties.getCoursesPath();
        String prefix = base.endsWith("/") ? base : base + "/";
        return prefix + raceId + ".json";
    }

    /** Splits a comma-separated series input into trimmed, non-blank tags. */
    static List<String> parseSeries(@Nullable String text) {
        if (text == null) {
            return List.of();
        }
        return RaceNormalizer.normalizeSeries(Arrays.asList(text.split(",")));
    }

    static @Nullable String nullableText(@Nullable String text) {
        if (text == null) {
            return null;
        }
        String trimmed = NumericText.strip(text);
        return trimmed.isEmpty() ? null : trimmed;
    }

    static @Nullable Double nullableNumber(@Nullable String text) {
        double value = NumericText.parseLoose(text);
        return Double.isFinite(value) ? value : null;
    }

    /**
     * Reads a whole number such as a year; blank or non-numeric text is absent.
     *
     * @throws IllegalArgumentException if the number has a fractional part
     */
    static @Nullable Integer nullableInteger(@Nullable String text) {
        Double value = nullableNumber(text);
        if (value == null) {
            return null;
        }
        if (value != Math.rint(value)) {
            throw new IllegalArgumentException(
                    "Year must be a whole number: " + NumericText.strip(text));
        }
        return value.intValue();
    }
}
