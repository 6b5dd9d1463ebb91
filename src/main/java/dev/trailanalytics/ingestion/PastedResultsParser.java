package dev.trailanalytics.ingestion;

import dev.trailanalytics.race.NumericText;
import dev.trailanalytics.race.ResultRecord;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;

/**
 * Converts a results table pasted from a spreadsheet or web page into {@link ResultRecord}s.
 *
 * <p>The delimiter is detected with {@link DelimiterDetector}. When the first row contains a
 * known column name ({@link HeaderVocabulary}) it is used as the header and fields are read by
 * name; otherwise every row is data and fields are read from fixed columns:
 * <pre>
 * 0 = rank, 1 = runner, 3 = score, 5 = gender, 6 = nationality
 * </pre>
 *
 * <p>Each field is resolved by an ordered list of {@link FieldStrategy}s, the first non-empty value
 * winning: header alias, then fixed column, and for the score a final right-to-left scan for the
 * last numeric cell that is not a time.
 *
 * <p>Rows without a rank >= 1 or without a finite score are skipped and only counted. If no row
 * survives, the outcome is a single {@link ParseOutcome.Failure}.
 */
public final class PastedResultsParser {

    static final String EMPTY_INPUT = "Results input is empty.";
    static final String NO_DATA_ROWS = "No data rows found.";
    static final String NO_VALID_ROWS =
            "No valid rows found. Need numeric rank and race score/index columns.";

    private static final Pattern LINE_BREAK = Pattern.compile("\\r?\\n");

    private static final Map<ResultField, List<FieldStrategy>> STRATEGIES = strategies();

    private PastedResultsParser() {
        // utility class
    }

    /**
     * Parses a pasted block of delimited text.
     *
     * @param rawText the pasted text, possibly null
     * @return the parsed records or the reason nothing could be parsed
     */
    public static ParseOutcome parse(@Nullable String rawText) {
        String text = rawText == null ? "" : NumericText.strip(rawText);
        if (text.isEmpty()) {
            return new ParseOutcome.Failure(EMPTY_INPUT);
        }

        char delimiter = DelimiterDetector.detect(text);
        List<String> lines = Arrays.stream(LINE_BREAK.split(text))
                .map(NumericText::strip)
                .filter(line -> !line.isEmpty())
                .toList();

        List<String> firstRow = splitRow(lines.get(0), delimiter);
        boolean hasHeader = HeaderVocabulary.looksLikeHeader(firstRow);
        List<String> headers = hasHeader
                ? firstRow.stream().map(HeaderVocabulary::normalizeKey).toList()
                : List.of();
        List<String> dataLines = hasHeader ? lines.subList(1, lines.size()) : lines;
        if (dataLines.isEmpty()) {
            return new ParseOutcome.Failure(NO_DATA_ROWS);
        }

        List<ResultRecord> records = new ArrayList<>();
        int skipped = 0;
        for (String line : dataLines) {
            TableRow row = new TableRow(splitRow(line, delimiter), headers);
            Optional<ResultRecord> record = toRecord(row);
            if (record.isPresent()) {
                records.add(record.get());
            } else {
                skipped++;
            }
        }

        if (records.isEmpty()) {
            return new ParseOutcome.Failure(NO_VALID_ROWS);
        }
        records.sort(Comparator.comparingInt(ResultRecord::rank));
        return new ParseOutcome.Success(records, skipped);
    }

    /** Builds a record from one row, or empty when its rank or score is unusable. */
    static Optional<ResultRecord> toRecord(TableRow row) {
        double rank = NumericText.parseLoose(resolve(row, ResultField.RANK));
        double score = NumericText.parseLoose(resolve(row, ResultField.SCORE));
        if (!Double.isFinite(rank) || rank < 1 || !Double.isFinite(score)) {
            return Optional.empty();
        }
        return Optional.of(new ResultRecord(
                (int) Math.floor(rank),
                score,
                nullableText(resolve(row, ResultField.RUNNER)),
                nullableText(resolve(row, ResultField.GENDER)),
                nullableText(resolve(row, ResultField.NATIONALITY))));
    }

    /** Runs the field's strategies in order and returns the first value found, or "". */
    static String resolve(TableRow row, ResultField field) {
        for (FieldStrategy strategy : STRATEGIES.get(field)) {
            Optional<String> value = strategy.resolve(row, field);
            if (value.isPresent()) {
                return value.get();
            }
        }
        return "";
    }

    static List<String> splitRow(String line, char delimiter) {
        return Arrays.stream(line.split(Pattern.quote(String.valueOf(delimiter)), -1))
                .map(NumericText::strip)
                .toList();
    }

    private static @Nullable String nullableText(String value) {
        String trimmed = NumericText.strip(value);
        return trimmed.isEmpty() ? null : trimmed;
    }

    private static Map<ResultField, List<FieldStrategy>> strategies() {
        Map<ResultField, List<FieldStrategy>> map = new EnumMap<>(ResultField.class);
        List<FieldStrategy> byNameThenPosition =
                List.of(FieldStrategy.headerAlias(), FieldStrategy.positional());
        for (ResultField field : ResultField.values()) {
            map.put(field, byNameThenPosition);
        }
        map.put(ResultField.SCORE, List.of(
                FieldStrategy.headerAlias(),
                FieldStrategy.positional(),
                FieldStrategy.rightmostNumeric()));
        return map;
    }
}
