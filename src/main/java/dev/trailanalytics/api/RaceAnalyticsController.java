package dev.trailanalytics.api;

import dev.trailanalytics.compare.ClosestMatch;
import dev.trailanalytics.compare.ComparativeAnalysisService;
import dev.trailanalytics.compare.CsvExport;
import dev.trailanalytics.compare.LadderPoint;
import dev.trailanalytics.compare.ParityRow;
import dev.trailanalytics.compare.RciCsvExporter;
import dev.trailanalytics.compare.RciRow;
import dev.trailanalytics.compare.RciTableService;
import dev.trailanalytics.config.AnalyticsProperties;
import dev.trailanalytics.ingestion.ImportDraft;
import dev.trailanalytics.ingestion.ImportRequest;
import dev.trailanalytics.ingestion.RaceImportService;
import dev.trailanalytics.metrics.ChartData;
import dev.trailanalytics.metrics.ChartDataService;
import dev.trailanalytics.metrics.MetricRow;
import dev.trailanalytics.metrics.MetricRowCalculator;
import dev.trailanalytics.metrics.SummaryRow;
import dev.trailanalytics.metrics.SummaryTableService;
import dev.trailanalytics.race.Race;
import dev.trailanalytics.race.RaceCatalog;
import dev.trailanalytics.selection.AnalyticsWorkspace;
import dev.trailanalytics.selection.Panel;
import dev.trailanalytics.selection.RaceFilter;
import dev.trailanalytics.selection.SortSpec;
import dev.trailanalytics.sex.Sex;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST adapter over the analytics panels.
 *
 * <p>Selections and sort states live in the {@link AnalyticsWorkspace} and persist between
 * requests, so a client mutates a panel and then reads its tables. Errors are mapped by {@code
 * GlobalExceptionHandler}: bad input is a 400, unreadable race data a 503.
 */
@RestController
@RequestMapping("/api")
public class RaceAnalyticsController {

  static final String SUMMARY_TABLE = "summary";
  static final String METRICS_N_VALUES = "3,5,10,20";

  private final RaceCatalog raceCatalog;
  private final AnalyticsWorkspace workspace;
  private final SummaryTableService summaryTableService;
  private final ChartDataService chartDataService;
  private final RciTableService rciTableService;
  private final RciCsvExporter rciCsvExporter;
  private final ComparativeAnalysisService comparativeAnalysisService;
  private final RaceImportService raceImportService;
  private final AnalyticsProperties properties;

  public RaceAnalyticsController(
      RaceCatalog raceCatalog,
      AnalyticsWorkspace workspace,
      SummaryTableService summaryTableService,
      ChartDataService chartDataService,
      RciTableService rciTableService,
      RciCsvExporter rciCsvExporter,
      ComparativeAnalysisService comparativeAnalysisService,
      RaceImportService raceImportService,
      AnalyticsProperties properties) {
    this.raceCatalog = raceCatalog;
    this.workspace = workspace;
    this.summaryTableService = summaryTableService;
    this.chartDataService = chartDataService;
    this.rciTableService = rciTableService;
    this.rciCsvExporter = rciCsvExporter;
    this.comparativeAnalysisService = comparativeAnalysisService;
    this.raceImportService = raceImportService;
    this.properties = properties;
  }

  @GetMapping("/races")
  public List<RaceListing> races() {
    return raceCatalog.raceIds().stream()
        .map(id -> new RaceListing(id, raceCatalog.metadata(id)))
        .toList();
  }

  @GetMapping("/races/{raceId}")
  public Race race(@PathVariable String raceId) {
    return raceCatalog.loadRace(raceId);
  }

  @GetMapping("/panels")
  public List<String> panels() {
    return workspace.panelNames();
  }

  @GetMapping("/panels/{panel}")
  public PanelState panel(@PathVariable String panel) {
    return PanelState.of(workspace.panel(panel));
  }

  /**
   * Bulk selection: {@code all}, {@code none}, or {@code year} with the {@code year} parameter.
   */
  @PostMapping("/panels/{panel}/selection")
  public PanelState select(
      @PathVariable String panel,
      @RequestParam String mode,
      @RequestParam(required = false) @Nullable Integer year) {
    Panel target = workspace.panel(panel);
    switch (mode) {
      case "all" -> target.selection().selectAll();
      case "none" -> target.selection().selectNone();
      case "year" -> {
        if (year == null) {
          throw new IllegalArgumentException("Selection mode 'year' requires a year parameter");
        }
        target.selection().selectByYear(year);
      }
      default ->
          throw new IllegalArgumentException(
              "Unknown selection mode: " + mode + " (expected all, none or year)");
    }
    return PanelState.of(target);
  }

  @PutMapping("/panels/{panel}/selection/{raceId}")
  public PanelState toggle(
      @PathVariable String panel, @PathVariable String raceId, @RequestParam boolean on) {
    Panel target = workspace.panel(panel);
    target.selection().toggle(raceId, on);
    return PanelState.of(target);
  }

  @PutMapping("/panels/{panel}/filter")
  public PanelState filter(@PathVariable String panel, @RequestBody RaceFilter filter) {
    Panel target = workspace.panel(panel);
    target.selection().setFilter(filter);
    return PanelState.of(target);
  }

  /** Header click on a table column; returns the table's new sort spec. */
  @PostMapping("/panels/{panel}/sort/{table}")
  public SortSpec sort(
      @PathVariable String panel, @PathVariable String table, @RequestParam String key) {
    return workspace.panel(panel).sorts().click(table, key);
  }

  @GetMapping("/panels/{panel}/summary")
  public List<SummaryRow> summary(@PathVariable String panel) {
    Panel target = workspace.panel(panel);
    return summaryTableService.buildRows(target.selection(), target.sorts().get(SUMMARY_TABLE));
  }

  /** Raw metric profiles of the selected races, for the whole field or one sex. */
  @GetMapping("/panels/{panel}/metrics")
  public List<MetricRow> metrics(
      @PathVariable String panel,
      @RequestParam(required = false) @Nullable String sex,
      @RequestParam(defaultValue = METRICS_N_VALUES) List<Integer> n,
      @RequestParam(required = false) @Nullable Integer topN) {
    Panel target = workspace.panel(panel);
    Sex restrictTo = sex == null ? null : Sex.fromKey(sex);
    int window = topN == null ? properties.getChartTopN() : topN;
    return raceCatalog.loadRaces(target.selection().selectedIds()).stream()
        .map(r -> MetricRowCalculator.compute(r, restrictTo, target.normalizeFemale(), n, window))
        .toList();
  }

  @GetMapping("/panels/{panel}/charts")
  public ChartData charts(
      @PathVariable String panel, @RequestParam(required = false) @Nullable Integer topN) {
    int window = topN == null ? properties.getChartTopN() : topN;
    return chartDataService.build(workspace.panel(panel).selection(), window);
  }

  @GetMapping("/panels/{panel}/rci/{sex}")
  public List<RciRow> rci(@PathVariable String panel, @PathVariable String sex) {
    return rciRows(workspace.panel(panel), Sex.fromKey(sex));
  }

  @GetMapping("/panels/{panel}/rci/{sex}/csv")
  public ResponseEntity<String> rciCsv(@PathVariable String panel, @PathVariable String sex) {
    Panel target = workspace.panel(panel);
    Sex tableSex = Sex.fromKey(sex);
    CsvExport export =
        rciCsvExporter.export(rciRows(target, tableSex), tableSex, target.normalizeFemale());
    return ResponseEntity.ok()
        .header(
            HttpHeaders.CONTENT_DISPOSITION,
            ContentDisposition.attachment().filename(export.fileName()).build().toString())
        .contentType(new MediaType("text", "csv", StandardCharsets.UTF_8))
        .body(export.content());
  }

  @GetMapping("/panels/{panel}/ladder")
  public List<LadderPoint> ladder(@PathVariable String panel) {
    return comparativeAnalysisService.ladderPoints(
        workspace.panel(panel).selection(), ComparativeAnalysisService.LADDER_N_LEVELS);
  }

  @GetMapping("/panels/{panel}/parity")
  public List<ParityRow> parity(@PathVariable String panel) {
    return comparativeAnalysisService.parityRows(
        workspace.panel(panel).selection(), ComparativeAnalysisService.PARITY_N_LEVELS);
  }

  /** Ladder points nearest in RCI to the point identified by race, sex and N. */
  @GetMapping("/panels/{panel}/closest")
  public List<ClosestMatch> closest(
      @PathVariable String panel,
      @RequestParam String raceId,
      @RequestParam String sex,
      @RequestParam int n) {
    List<LadderPoint> points = ladder(panel);
    Sex referenceSex = Sex.fromKey(sex);
    LadderPoint reference =
        ComparativeAnalysisService.findPoint(points, raceId, referenceSex, n)
            .orElseThrow(
                () ->
                    new IllegalArgumentException(
                        "No ladder point for " + raceId + " / " + sex + " / N=" + n));
    return comparativeAnalysisService.closestMatches(reference, points);
  }

  @PostMapping("/import")
  public ImportDraft importRace(@RequestBody ImportRequest request) {
    return raceImportService.buildDraft(request);
  }

  private List<RciRow> rciRows(Panel panel, Sex sex) {
    return rciTableService.buildRows(
        panel.selection(), sex, panel.normalizeFemale(), panel.sorts().get(sex.key()));
  }
}
