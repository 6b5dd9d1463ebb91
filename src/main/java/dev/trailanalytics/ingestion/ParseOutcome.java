package dev.trailanalytics.ingestion;

import dev.trailanalytics.race.ResultRecord;
import java.util.List;

/**
 * Result of parsing a pasted results table: either records (with the number of rows that were
 * silently skipped) or a single aggregate failure reason.
 */
public sealed interface ParseOutcome permits ParseOutcome.Success, ParseOutcome.Failure {

    /**
     * At least one valid row was found.
     *
     * @param records valid records sorted by ascending rank
     * @param skippedRows data rows dropped for a missing or invalid rank or score
     */
    record Success(List<ResultRecord> records, int skippedRows) implements ParseOutcome {

        public Success {
            records = List.copyOf(records);
        }
    }

    /**
     * Nothing usable was found.
     *
     * @param reason user-facing explanation
     */
    record Failure(String reason) implements ParseOutcome {}
}
