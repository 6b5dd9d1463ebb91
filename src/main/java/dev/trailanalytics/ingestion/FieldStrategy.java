package dev.trailanalytics.ingestion;

import dev.trailanalytics.race.NumericText;
import java.util.Optional;

/**
 * One way of locating a field's value in a row. Strategies are tried in order and the first
 * non-empty value wins.
 */
@FunctionalInterface
public interface FieldStrategy {

    Optional<String> resolve(TableRow row, ResultField field);

    /** Reads the cell under the first header alias of the field present in the table. */
    static FieldStrategy headerAlias() {
        return (row, field) -> {
            for (String alias : field.aliases()) {
                int idx = row.headers().indexOf(alias);
                if (idx >= 0) {
                    return nonEmpty(row.cell(idx));
                }
            }
            return Optional.empty();
        };
    }

    /** Reads the field's fixed column. */
    static FieldStrategy positional() {
        return (row, field) -> nonEmpty(row.cell(field.position()));
    }

    /**
     * Scans right to left (column 0 excluded) for the last cell that parses as a finite number and
     * contains no colon, so times such as {@code 12:34:56} are skipped.
     */
    static FieldStrategy rightmostNumeric() {
        return (row, field) -> {
            for (int i = row.cells().size() - 1; i >= 1; i--) {
                String cell = row.cell(i);
                if (cell.isEmpty() || cell.contains(":")) {
                    continue;
                }
                if (Double.isFinite(NumericText.parseLoose(cell))) {
                    return Optional.of(cell);
                }
            }
            return Optional.empty();
        };
    }

    private static Optional<String> nonEmpty(String value) {
        return value == null || value.isEmpty() ? Optional.empty() : Optional.of(value);
    }
}
