package dev.trailanalytics.compare;

import dev.trailanalytics.sex.Sex;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.springframework.stereotype.Service;

/**
 * Exports RCI tables as CSV.
 *
 * <p>Every cell is double-quoted with embedded quotes doubled; metric cells carry two decimals, or
 * nothing when the value is undefined. Lines are separated by {@code \n} without a trailing
 * newline.
 */
@Service
public class RciCsvExporter {

  static final List<String> HEADER =
      List.of("Race", "Country", "Series", "RCI3", "RCI5", "RCI10", "RCI20");

  private final Clock clock;

  public RciCsvExporter(Clock clock) {
    this.clock = clock;
  }

  /**
   * Renders rows as a CSV document named {@code rci_[normalized_]<sex>_<yyyy-MM-dd>.csv}.
   *
   * @param rows the table rows, already sorted
   * @param sex the table's sex
   * @param normalized whether the table is a sex-normalized one
   */
  public CsvExport export(List<RciRow> rows, Sex sex, boolean normalized) {
    String stamp = LocalDate.now(clock).format(DateTimeFormatter.ISO_LOCAL_DATE);
    String fileName =
        "rci_%s%s_%s.csv".formatted(normalized ? "normalized_" : "", sex.key(), stamp);
    return new CsvExport(fileName, toCsv(rows));
  }

  public static String toCsv(List<RciRow> rows) {
    List<String> lines = new ArrayList<>(rows.size() + 1);
    lines.add(line(HEADER.stream()));
    for (RciRow r : rows) {
      lines.add(
          line(
              Stream.of(
                  r.name(),
                  r.country(),
                  r.series(),
                  metric(r.rc3()),
                  metric(r.rc5()),
                  metric(r.rc10()),
                  metric(r.rc20()))));
    }
    return String.join("\n", lines);
  }

  private static String line(Stream<String> cells) {
    return cells.map(RciCsvExporter::cell).collect(Collectors.joining(","));
  }

  static String cell(String value) {
    String s = value == null ? "" : value;
    return "\"" + s.replace("\"", "\"\"") + "\"";
  }

  private static String metric(double value) {
    return Double.isFinite(value) ? String.format(Locale.US, "%.2f", value) : "";
  }
}
