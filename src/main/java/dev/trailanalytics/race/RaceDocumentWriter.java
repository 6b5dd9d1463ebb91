package dev.trailanalytics.race;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Renders canonical races and manifests back into their wire documents, pretty-printed with a
 * trailing newline.
 *
 * <p>The series field is written the way existing documents carry it: absent as {@code null}, a
 * single tag as a string, several tags as an array.
 */
@Component
public class RaceDocumentWriter {

  private final ObjectMapper objectMapper;

  public RaceDocumentWriter(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
  }

  /** Builds the {@code {meta, results}} tree of a race. */
  public ObjectNode toDocument(Race race) {
    RaceMetadata metadata = race.metadata();
    ObjectNode root = objectMapper.createObjectNode();
    ObjectNode meta = root.putObject("meta");
    meta.put("race_id", race.raceId());
    meta.put("name", metadata.name());
    putSeries(meta, metadata.seriesTags());
    meta.put("country", metadata.countryCode());
    meta.put("data_source", metadata.dataSource());
    meta.put("year", metadata.year());
    meta.put("distance_km", metadata.distanceKm());
    meta.put("elevation_m", metadata.elevationM());
    meta.put("prize_money", metadata.prizeMoney());
    meta.put("notes", metadata.notes());
    meta.put("source_url", metadata.sourceUrl());

    ArrayNode results = root.putArray("results");
    for (ResultRecord record : race.results()) {
      ObjectNode row = results.addObject();
      row.put("rank", record.rank());
      row.put("runner", record.runner());
      row.put("index", record.score());
      row.put("gender", record.sex());
      row.put("nationality", record.nationality());
    }
    return root;
  }

  /** Serializes a race document. */
  public String writeRace(Race race) {
    return write(toDocument(race));
  }

  /** Serializes a manifest document. */
  public String writeManifest(Manifest manifest) {
    return write(manifest);
  }

  private String write(Object value) {
    try {
      return objectMapper.writeValueAsString(value) + "\n";
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Cannot serialize document: " + e.getOriginalMessage(), e);
    }
  }

  private static void putSeries(ObjectNode meta, List<String> tags) {
    if (tags.isEmpty()) {
      meta.putNull("series");
    } else if (tags.size() == 1) {
      meta.put("series", tags.get(0));
    } else {
      ArrayNode series = meta.putArray("series");
      tags.forEach(series::add);
    }
  }
}
