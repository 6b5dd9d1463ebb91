package dev.trailanalytics.race;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.trailanalytics.config.AnalyticsProperties;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import org.springframework.stereotype.Component;

/**
 * Reads the manifest and race documents from a directory tree rooted at {@code
 * trail.analytics.data-root}. Locators are resolved relative to that root and may not escape it.
 */
@Component
public class FileSystemRaceDocumentSource implements RaceDocumentSource {

  private final Path dataRoot;
  private final String manifestPath;
  private final ObjectMapper objectMapper;

  public FileSystemRaceDocumentSource(AnalyticsProperties properties, ObjectMapper objectMapper) {
    this.dataRoot = Path.of(properties.getDataRoot()).toAbsolutePath().normalize();
    this.manifestPath = properties.getManifestPath();
    this.objectMapper = objectMapper;
  }

  @Override
  public JsonNode fetchManifest() throws IOException {
    return read(manifestPath);
  }

  @Override
  public JsonNode fetchRace(String locator) throws IOException {
    return read(locator);
  }

  private JsonNode read(String relativePath) throws IOException {
    Path file = dataRoot.resolve(relativePath).normalize();
    if (!file.startsWith(dataRoot)) {
      throw new IOException("Path escapes data root: " + relativePath);
    }
    if (!Files.isRegularFile(file)) {
      throw new NoSuchFileException(file.toString());
    }
    return objectMapper.readTree(file.toFile());
  }
}
