package dev.trailanalytics.race;

import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;

/**
 * Retrieves the raw manifest and race documents. Transport and storage belong to the
 * implementation; the engine only sees parsed JSON trees.
 */
public interface RaceDocumentSource {

  /** Reads the manifest document ({@code {courses: [{race_id, path}]}}). */
  JsonNode fetchManifest() throws IOException;

  /**
   * Reads one race document.
   *
   * @param locator the {@code path} of the race's manifest entry
   */
  JsonNode fetchRace(String locator) throws IOException;
}
