package dev.trailanalytics.ingestion;

import dev.trailanalytics.race.Race;

/**
 * Output of a successful import: the canonical race and the two documents to persist.
 *
 * @param race the imported race in canonical form
 * @param raceDocument the race document JSON, pretty-printed with a trailing newline
 * @param manifestDocument the updated manifest JSON, pretty-printed with a trailing newline
 * @param skippedRows pasted rows dropped for a missing rank or score
 * @param statusMessage user-facing summary of the import
 */
public record ImportDraft(
        Race race,
        String raceDocument,
        String manifestDocument,
        int skippedRows,
        String statusMessage) {}
