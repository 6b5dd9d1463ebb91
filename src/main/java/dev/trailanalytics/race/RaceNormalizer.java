package dev.trailanalytics.race;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Turns loosely typed race documents into canonical {@link Race} instances.
 *
 * <p>This is the validation boundary for race data: every result whose rank or score cannot be
 * read as a finite number is dropped (not reported), the remaining results are sorted by ascending
 * rank, and the series field is coerced into a list whatever shape the source used. Downstream
 * metric code can therefore assume canonical types.
 *
 * <p>All methods are pure. Normalizing an already canonical race yields an equal race.
 */
public final class RaceNormalizer {

  private RaceNormalizer() {
    // utility class
  }

  /**
   * Normalizes a race document of the shape {@code {meta: {...}, results: [...]}}.
   *
   * @param document the raw JSON document
   * @param fallbackRaceId race id used when {@code meta.race_id} is missing or blank
   * @return the canonical race
   */
  public static Race normalize(JsonNode document, String fallbackRaceId) {
    JsonNode meta = document.path("meta");
    String raceId = text(meta, "race_id");
    if (raceId == null || raceId.isBlank()) {
      raceId = fallbackRaceId;
    }

    RaceMetadata metadata =
        new RaceMetadata(
            text(meta, "name"),
            integer(meta.get("year")),
            text(meta, "country"),
            normalizeSeries(meta.get("series")),
            text(meta, "data_source"),
            decimal(meta.get("distance_km")),
            decimal(meta.get("elevation_m")),
            text(meta, "prize_money"),
            text(meta, "notes"),
            text(meta, "source_url"));

    List<ResultRecord> results = new ArrayList<>();
    for (JsonNode raw : document.path("results")) {
      double rank = number(raw.get("rank"));
      double score = number(raw.get("index"));
      if (!Double.isFinite(rank) || !Double.isFinite(score)) {
        continue;
      }
      results.add(
          new ResultRecord(
              (int) rank,
              score,
              text(raw, "runner"),
              text(raw, "gender"),
              text(raw, "nationality")));
    }
    return new Race(raceId, metadata, sortByRank(results));
  }

  /** Re-normalizes a canonical race; returns an equal race for input that is already canonical. */
  public static Race normalize(Race race) {
    RaceMetadata meta = race.metadata();
    RaceMetadata metadata =
        new RaceMetadata(
            meta.name(),
            meta.year(),
            meta.countryCode(),
            normalizeSeries(meta.seriesTags()),
            meta.dataSource(),
            meta.distanceKm(),
            meta.elevationM(),
            meta.prizeMoney(),
            meta.notes(),
            meta.sourceUrl());
    List<ResultRecord> results =
        race.results().stream().filter(r -> Double.isFinite(r.score())).toList();
    return new Race(race.raceId(), metadata, sortByRank(results));
  }

  /**
   * Coerces a series field into a list of non-blank tags: a text value becomes a one-element
   * list, an array keeps its non-blank elements, anything else becomes an empty list.
   */
  public static List<String> normalizeSeries(@Nullable JsonNode series) {
    if (series == null || series.isNull() || series.isMissingNode()) {
      return List.of();
    }
    List<String> tags = new ArrayList<>();
    if (series.isArray()) {
      for (JsonNode element : series) {
        if (!element.isNull()) {
          tags.add(element.asText());
        }
      }
    } else if (series.isValueNode()) {
      tags.add(series.asText());
    }
    return normalizeSeries(tags);
  }

  /** Trims every tag and drops blank ones, keeping source order. */
  public static List<String> normalizeSeries(List<String> tags) {
    return tags.stream()
        .filter(t -> t != null && !t.isBlank())
        .map(String::trim)
        .toList();
  }

  private static List<ResultRecord> sortByRank(List<ResultRecord> results) {
    List<ResultRecord> sorted = new ArrayList<>(results);
    sorted.sort(Comparator.comparingInt(ResultRecord::rank));
    return sorted;
  }

  private static double number(@Nullable JsonNode node) {
    if (node == null || node.isNull() || node.isMissingNode()) {
      return Double.NaN;
    }
    if (node.isNumber()) {
      return node.asDouble();
    }
    if (node.isTextual()) {
      return NumericText.parse(node.asText());
    }
    return Double.NaN;
  }

  private static @Nullable Double decimal(@Nullable JsonNode node) {
    double value = number(node);
    return Double.isFinite(value) ? value : null;
  }

  private static @Nullable Integer integer(@Nullable JsonNode node) {
    double value = number(node);
    if (!Double.isFinite(value) || value != Math.rint(value)) {
      return null;
    }
    return (int) value;
  }

  private static @Nullable String text(JsonNode parent, String field) {
    JsonNode node = parent.get(field);
    if (node == null || node.isNull() || node.isMissingNode() || node.isContainerNode()) {
      return null;
    }
    return node.asText();
  }
}
