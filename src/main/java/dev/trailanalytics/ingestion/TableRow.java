package dev.trailanalytics.ingestion;

import java.util.List;

/**
 * One data row of a pasted table together with the table's normalized header names.
 *
 * @param cells trimmed cell values
 * @param headers normalized header names, empty for a header-less table
 */
public record TableRow(List<String> cells, List<String> headers) {

    public TableRow {
        cells = List.copyOf(cells);
        headers = List.copyOf(headers);
    }

    /** Cell at {@code index}, or an empty string when the row is shorter. */
    public String cell(int index) {
        return index >= 0 && index < cells.size() ? cells.get(index) : "";
    }
}
