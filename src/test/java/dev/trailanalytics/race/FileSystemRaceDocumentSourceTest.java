package dev.trailanalytics.race;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.trailanalytics.config.AnalyticsProperties;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileSystemRaceDocumentSourceTest {

  @TempDir Path dataRoot;

  private FileSystemRaceDocumentSource source;

  @BeforeEach
  void setUp() throws IOException {
    Files.createDirectories(dataRoot.resolve("data/courses"));
    Files.writeString(
        dataRoot.resolve("data/courses_index.json"),
        "{\"courses\": [{\"race_id\": \"r\", \"path\": \"data/courses/r.json\"}]}");
    Files.writeString(dataRoot.resolve("data/courses/r.json"), "{\"meta\": {\"race_id\": \"r\"}}");

    AnalyticsProperties properties = new AnalyticsProperties();
    properties.setDataRoot(dataRoot.toString());
    source = new FileSystemRaceDocumentSource(properties, new ObjectMapper());
  }

  @Test
  void reads_manifest_from_configured_path() throws IOException {
    JsonNode manifest = source.fetchManifest();

    assertThat(manifest.path("courses").get(0).get("race_id").asText()).isEqualTo("r");
  }

  @Test
  void reads_race_by_locator() throws IOException {
    assertThat(source.fetchRace("data/courses/r.json").path("meta").get("race_id").asText())
        .isEqualTo("r");
  }

  @Test
  void missing_file_is_reported() {
    assertThatThrownBy(() -> source.fetchRace("data/courses/missing.json"))
        .isInstanceOf(NoSuchFileException.class);
  }

  @Test
  void locator_may_not_escape_data_root() {
    assertThatThrownBy(() -> source.fetchRace("../outside.json"))
        .isInstanceOf(IOException.class)
        .hasMessageContaining("escapes data root");
  }
}
