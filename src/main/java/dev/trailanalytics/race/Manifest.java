package dev.trailanalytics.race;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Index document listing every known race and where to retrieve it.
 *
 * @param courses the manifest entries; order carries no meaning
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Manifest(@JsonProperty("courses") List<ManifestEntry> courses) {

  public Manifest {
    courses = courses == null ? List.of() : List.copyOf(courses);
  }

  public Optional<ManifestEntry> find(String raceId) {
    return courses.stream().filter(e -> e.raceId().equals(raceId)).findFirst();
  }

  /**
   * Returns a manifest where {@code entry} replaces the entry with the same race id, or is
   * appended when none exists. Entries of the result are sorted by race id.
   */
  public Manifest withEntry(ManifestEntry entry) {
    List<ManifestEntry> updated = new ArrayList<>(courses.size() + 1);
    boolean replaced = false;
    for (ManifestEntry existing : courses) {
      if (existing.raceId().equals(entry.raceId())) {
        updated.add(entry);
        replaced = true;
      } else {
        updated.add(existing);
      }
    }
    if (!replaced) {
      updated.add(entry);
    }
    updated.sort(Comparator.comparing(ManifestEntry::raceId));
    return new Manifest(updated);
  }
}
