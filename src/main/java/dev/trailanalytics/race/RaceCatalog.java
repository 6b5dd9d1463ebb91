package dev.trailanalytics.race;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Session-wide cache of canonical races, loaded on demand from a {@link RaceDocumentSource}.
 *
 * <p>A race is fetched at most once and kept for the lifetime of the bean. The check-then-fetch
 * sequence is not synchronized: two callers asking for the same uncached race at the same time may
 * both fetch it, which is harmless because both store an identical normalized race.
 *
 * <p>Batch loads degrade gracefully: a race that cannot be loaded is logged and left out of the
 * batch instead of failing it.
 */
@Service
public class RaceCatalog implements RaceIndex {

  private static final Logger log = LoggerFactory.getLogger(RaceCatalog.class);

  private final RaceDocumentSource documentSource;
  private final ObjectMapper objectMapper;
  private final Map<String, Race> cache = new ConcurrentHashMap<>();
  private volatile Manifest manifest = new Manifest(List.of());

  public RaceCatalog(RaceDocumentSource documentSource, ObjectMapper objectMapper) {
    this.documentSource = documentSource;
    this.objectMapper = objectMapper;
  }

  /**
   * Loads (or reloads) the manifest.
   *
   * @return the manifest entries
   * @throws IllegalStateException if the manifest cannot be read or parsed
   */
  public List<ManifestEntry> loadManifest() {
    JsonNode document;
    try {
      document = documentSource.fetchManifest();
    } catch (IOException e) {
      throw new IllegalStateException("Cannot load race manifest: " + e.getMessage(), e);
    }
    Manifest loaded;
    try {
      loaded = objectMapper.treeToValue(document, Manifest.class);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Malformed race manifest: " + e.getOriginalMessage(), e);
    }
    manifest = loaded == null ? new Manifest(List.of()) : loaded;
    log.info("Loaded race manifest with {} entries", manifest.courses().size());
    return manifest.courses();
  }

  /** The currently loaded manifest (empty until {@link #loadManifest()} succeeds). */
  public Manifest manifest() {
    return manifest;
  }

  /**
   * Returns the race with the given id, fetching and normalizing it on first access.
   *
   * @throws IllegalArgumentException if the race id is not listed in the manifest
   * @throws IllegalStateException if the race document cannot be read
   */
  public Race loadRace(String raceId) {
    Race cached = cache.get(raceId);
    if (cached != null) {
      return cached;
    }
    ManifestEntry entry =
        manifest
            .find(raceId)
            .orElseThrow(() -> new IllegalArgumentException("Unknown race_id: " + raceId));
    JsonNode document;
    try {
      document = documentSource.fetchRace(entry.locator());
    } catch (IOException e) {
      throw new IllegalStateException("Cannot load race document: " + entry.locator(), e);
    }
    Race race = RaceNormalizer.normalize(document, raceId);
    cache.put(raceId, race);
    log.debug("Cached race {} ({} results)", raceId, race.results().size());
    return race;
  }

  /** Like {@link #loadRace(String)} but reports any failure as an absent race. */
  public Optional<Race> findRace(String raceId) {
    try {
      return Optional.of(loadRace(raceId));
    } catch (RuntimeException e) {
      log.warn("Skipping race {}: {}", raceId, e.getMessage());
      return Optional.empty();
    }
  }

  /**
   * Loads several races, ordered by race id. Races that fail to load are skipped.
   *
   * @param raceIds the ids to load
   * @return the loadable races sorted by id
   */
  public List<Race> loadRaces(Collection<String> raceIds) {
    List<Race> races = new ArrayList<>(raceIds.size());
    raceIds.stream().sorted().distinct().forEach(id -> findRace(id).ifPresent(races::add));
    return races;
  }

  /** Loads every race of the manifest so that metadata is available for filtering. */
  public void preloadAll() {
    int loaded = loadRaces(raceIds()).size();
    log.info("Preloaded {} of {} races", loaded, manifest.courses().size());
  }

  @Override
  public List<String> raceIds() {
    return manifest.courses().stream().map(ManifestEntry::raceId).toList();
  }

  @Override
  public @Nullable RaceMetadata metadata(String raceId) {
    Race race = cache.get(raceId);
    return race == null ? null : race.metadata();
  }
}
