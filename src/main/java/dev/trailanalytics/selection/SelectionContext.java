package dev.trailanalytics.selection;

import dev.trailanalytics.race.RaceIndex;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CopyOnWriteArrayList;
import org.jspecify.annotations.Nullable;

/**
 * Which races a panel works on: the selected race ids and the country/series filter.
 *
 * <p>Every mutation re-applies the active filter, so the selection never contains a race the
 * filter rejects, and then synchronously notifies the registered listeners. Panels that must stay
 * in sync hold a reference to the same instance; changing it from one panel refreshes all of them
 * before the mutating call returns.
 *
 * <p>Not thread-safe: a context belongs to one logical session.
 */
public class SelectionContext {

  private final RaceIndex index;
  private final Set<String> selected = new TreeSet<>();
  private final List<Runnable> listeners = new CopyOnWriteArrayList<>();
  private RaceFilter filter = RaceFilter.NONE;

  public SelectionContext(RaceIndex index) {
    this.index = Objects.requireNonNull(index, "index");
  }

  /** Selected race ids in ascending order. */
  public List<String> selectedIds() {
    return List.copyOf(selected);
  }

  public boolean isSelected(String raceId) {
    return selected.contains(raceId);
  }

  public int size() {
    return selected.size();
  }

  public RaceFilter filter() {
    return filter;
  }

  /** Registers a callback run after every change of this context. */
  public void addListener(Runnable listener) {
    listeners.add(listener);
  }

  /** Selects every known race that passes the active filter. */
  public void selectAll() {
    selected.clear();
    selected.addAll(index.raceIds());
    changed();
  }

  public void selectNone() {
    selected.clear();
    changed();
  }

  /** Replaces the selection with the races of one edition year that pass the active filter. */
  public void selectByYear(int year) {
    selected.clear();
    for (String raceId : index.raceIds()) {
      var metadata = index.metadata(raceId);
      if (metadata != null && metadata.year() != null && metadata.year() == year) {
        selected.add(raceId);
      }
    }
    changed();
  }

  /** Adds or removes one race. Adding a race the filter rejects has no effect. */
  public void toggle(String raceId, boolean on) {
    if (on) {
      selected.add(raceId);
    } else {
      selected.remove(raceId);
    }
    changed();
  }

  /** Sets the country constraint (null or blank clears it). Never re-adds filtered-out races. */
  public void setCountry(@Nullable String country) {
    filter = filter.withCountry(country);
    changed();
  }

  /** Sets the accepted series tags (empty clears the constraint). */
  public void setSeries(List<String> seriesTags) {
    filter = filter.withSeries(seriesTags);
    changed();
  }

  public void setFilter(RaceFilter newFilter) {
    filter = Objects.requireNonNull(newFilter, "filter");
    changed();
  }

  /** Removes selected races the active filter rejects. */
  void applyFilter() {
    selected.removeIf(id -> !filter.matches(index.metadata(id)));
  }

  private void changed() {
    applyFilter();
    for (Runnable listener : listeners) {
      listener.run();
    }
  }
}
