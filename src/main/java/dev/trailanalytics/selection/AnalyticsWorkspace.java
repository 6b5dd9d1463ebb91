package dev.trailanalytics.selection;

import dev.trailanalytics.config.AnalyticsProperties;
import dev.trailanalytics.race.RaceIndex;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Holds the panels of the application and their selection contexts.
 *
 * <ul>
 *   <li>{@code summary} - race summary table, sorted by {@code rci10} descending
 *   <li>{@code charts} - rank curve, Lorenz and heatmap datasets
 *   <li>{@code rci} - per-sex RCI tables on raw scores
 *   <li>{@code rci-normalized} - per-sex RCI tables with the female score correction
 *   <li>{@code visualization} - ladder and parity views; shares its selection context with {@code
 *       rci-normalized}, so changing one refreshes the other
 * </ul>
 */
@Component
public class AnalyticsWorkspace {

  private static final Logger log = LoggerFactory.getLogger(AnalyticsWorkspace.class);

  public static final String SUMMARY = "summary";
  public static final String CHARTS = "charts";
  public static final String RCI = "rci";
  public static final String RCI_NORMALIZED = "rci-normalized";
  public static final String VISUALIZATION = "visualization";

  private final Map<String, Panel> panels = new LinkedHashMap<>();
  private final int defaultYear;

  public AnalyticsWorkspace(RaceIndex raceIndex, AnalyticsProperties properties) {
    this.defaultYear = properties.getDefaultYear();
    SelectionContext publicSelection = new SelectionContext(raceIndex);
    register(SUMMARY, new SelectionContext(raceIndex), "rci10", false);
    register(CHARTS, new SelectionContext(raceIndex), "rci10", false);
    register(RCI, new SelectionContext(raceIndex), "rc10", false);
    register(RCI_NORMALIZED, publicSelection, "rc10", true);
    register(VISUALIZATION, publicSelection, "rc10", true);
  }

  private void register(
      String name, SelectionContext selection, String defaultSortKey, boolean normalizeFemale) {
    SortState sorts = new SortState(SortSpec.descending(defaultSortKey));
    panels.put(name, new Panel(name, selection, sorts, normalizeFemale));
  }

  /**
   * Looks up a panel by name.
   *
   * @throws IllegalArgumentException if no panel has that name
   */
  public Panel panel(String name) {
    Panel panel = panels.get(name);
    if (panel == null) {
      throw new IllegalArgumentException(
          "Unknown panel: " + name + " (known: " + panels.keySet() + ")");
    }
    return panel;
  }

  public List<String> panelNames() {
    return List.copyOf(panels.keySet());
  }

  /** Selects the default year on every distinct selection context. */
  public void selectDefaultYear() {
    Map<SelectionContext, Boolean> seen = new IdentityHashMap<>();
    for (Panel panel : panels.values()) {
      if (seen.put(panel.selection(), Boolean.TRUE) == null) {
        panel.selection().selectByYear(defaultYear);
      }
    }
    log.info("Panels initialized to year {}", defaultYear);
  }
}
