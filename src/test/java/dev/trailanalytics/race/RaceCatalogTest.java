package dev.trailanalytics.race;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class RaceCatalogTest {

  private static final String MANIFEST =
      """
      {"courses": [
        {"race_id": "b-race", "path": "data/courses/b-race.json"},
        {"race_id": "a-race", "path": "data/courses/a-race.json"}
      ]}
      """;

  private final ObjectMapper objectMapper = new ObjectMapper();

  @Mock RaceDocumentSource documentSource;

  private RaceCatalog catalog;

  @BeforeEach
  void setUp() {
    catalog = new RaceCatalog(documentSource, objectMapper);
  }

  private JsonNode json(String text) throws IOException {
    return objectMapper.readTree(text);
  }

  private JsonNode raceDocument(String raceId, int year) throws IOException {
    return json(
        """
        {"meta": {"race_id": "%s", "name": "Race %s", "year": %d},
         "results": [{"rank": 1, "index": 900}, {"rank": 2, "index": 850}]}
        """
            .formatted(raceId, raceId, year));
  }

  @Nested
  class ManifestLoading {

    @Test
    void load_manifest_returns_entries() throws IOException {
      when(documentSource.fetchManifest()).thenReturn(json(MANIFEST));

      List<ManifestEntry> entries = catalog.loadManifest();

      assertThat(entries)
          .extracting(ManifestEntry::raceId)
          .containsExactly("b-race", "a-race");
      assertThat(catalog.raceIds()).containsExactly("b-race", "a-race");
    }

    @Test
    void unreadable_manifest_is_a_total_failure() throws IOException {
      when(documentSource.fetchManifest()).thenThrow(new NoSuchFileException("courses_index.json"));

      assertThatThrownBy(() -> catalog.loadManifest())
          .isInstanceOf(IllegalStateException.class)
          .hasMessageContaining("Cannot load race manifest");
    }

    @Test
    void manifest_is_empty_before_loading() {
      assertThat(catalog.manifest().courses()).isEmpty();
      assertThat(catalog.raceIds()).isEmpty();
    }
  }

  @Nested
  class LoadRace {

    @BeforeEach
    void loadManifest() throws IOException {
      when(documentSource.fetchManifest()).thenReturn(json(MANIFEST));
      catalog.loadManifest();
    }

    @Test
    void unknown_race_id_is_rejected() {
      assertThatThrownBy(() -> catalog.loadRace("missing"))
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessage("Unknown race_id: missing");
    }

    @Test
    void race_is_fetched_once_and_cached() throws IOException {
      when(documentSource.fetchRace("data/courses/a-race.json"))
          .thenReturn(raceDocument("a-race", 2025));

      Race first = catalog.loadRace("a-race");
      Race second = catalog.loadRace("a-race");

      assertThat(second).isSameAs(first);
      assertThat(first.results()).hasSize(2);
      verify(documentSource, times(1)).fetchRace("data/courses/a-race.json");
    }

    @Test
    void unreadable_race_document_raises_illegal_state() throws IOException {
      when(documentSource.fetchRace("data/courses/a-race.json"))
          .thenThrow(new IOException("disk error"));

      assertThatThrownBy(() -> catalog.loadRace("a-race"))
          .isInstanceOf(IllegalStateException.class)
          .hasMessageContaining("data/courses/a-race.json");
    }

    @Test
    void batch_load_skips_failing_races_and_sorts_by_id() throws IOException {
      when(documentSource.fetchRace("data/courses/a-race.json"))
          .thenReturn(raceDocument("a-race", 2025));
      when(documentSource.fetchRace("data/courses/b-race.json"))
          .thenThrow(new IOException("corrupt"));

      List<Race> races = catalog.loadRaces(List.of("b-race", "a-race", "a-race", "unknown"));

      assertThat(races).extracting(Race::raceId).containsExactly("a-race");
    }

    @Test
    void metadata_is_available_only_after_loading() throws IOException {
      when(documentSource.fetchRace("data/courses/a-race.json"))
          .thenReturn(raceDocument("a-race", 2024));

      assertThat(catalog.metadata("a-race")).isNull();
      catalog.loadRace("a-race");

      RaceMetadata metadata = catalog.metadata("a-race");
      assertThat(metadata).isNotNull();
      assertThat(metadata.year()).isEqualTo(2024);
    }
  }
}
