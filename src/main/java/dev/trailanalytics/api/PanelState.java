package dev.trailanalytics.api;

import dev.trailanalytics.selection.Panel;
import dev.trailanalytics.selection.RaceFilter;
import java.util.List;

/**
 * Snapshot of a panel's selection for clients.
 *
 * @param name the panel name
 * @param selectedIds selected race ids, in ascending order
 * @param filter the active country and series filter
 * @param normalizeFemale whether the panel works on the normalized female scale
 */
public record PanelState(
    String name, List<String> selectedIds, RaceFilter filter, boolean normalizeFemale) {

  static PanelState of(Panel panel) {
    return new PanelState(
        panel.name(),
        panel.selection().selectedIds(),
        panel.selection().filter(),
        panel.normalizeFemale());
  }
}
