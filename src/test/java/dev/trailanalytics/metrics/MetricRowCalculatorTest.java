package dev.trailanalytics.metrics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.trailanalytics.fixture.RaceBuilder;
import dev.trailanalytics.race.Race;
import dev.trailanalytics.sex.Sex;
import java.util.List;
import org.junit.jupiter.api.Test;

class MetricRowCalculatorTest {

  private final Race mixed =
      new RaceBuilder()
          .raceId("mixed")
          .name("Mixed Trail")
          .result(1, 900, "H")
          .result(2, 850, "H")
          .result(3, 700, "F")
          .result(4, 650, "W")
          .build();

  @Test
  void whole_field_row_uses_every_record() {
    MetricRow row = MetricRowCalculator.compute(mixed, null, false, List.of(1, 4), 30);

    assertThat(row.sex()).isNull();
    assertThat(row.rci(1)).isCloseTo(900.0, within(0.001));
    assertThat(row.byN()).containsOnlyKeys(1, 4);
    assertThat(row.aucNormalized()).isFinite();
  }

  @Test
  void sex_row_keeps_only_that_sex() {
    MetricRow row = MetricRowCalculator.compute(mixed, Sex.FEMALE, false, List.of(1), 30);

    assertThat(row.rci(1)).isCloseTo(700.0, within(0.001));
  }

  @Test
  void unrequested_n_is_undefined() {
    MetricRow row = MetricRowCalculator.compute(mixed, Sex.MALE, false, List.of(3), 30);

    assertThat(row.rci(10)).isNaN();
  }

  @Test
  void excluded_race_yields_undefined_row() {
    Race womenOnly =
        new RaceBuilder().raceId("w").name("Skyrace Women").result(1, 800, "H").build();

    MetricRow row = MetricRowCalculator.compute(womenOnly, Sex.MALE, false, List.of(1, 3), 30);

    assertThat(row.rci(1)).isNaN();
    assertThat(row.aucNormalized()).isNaN();
    assertThat(row.giniCoefficient()).isNaN();
  }

  @Test
  void windows_keep_the_requested_order() {
    MetricRow row = MetricRowCalculator.compute(mixed, null, false, List.of(20, 3, 10, 1), 30);

    assertThat(row.byN().keySet()).containsExactly(20, 3, 10, 1);
  }

  @Test
  void serialized_row_lists_windows_in_request_order_without_helper_flags() {
    MetricRow row = MetricRowCalculator.compute(mixed, null, false, List.of(10, 3), 30);

    JsonNode json = new ObjectMapper().valueToTree(row);

    assertThat(json.get("byN").fieldNames()).toIterable().containsExactly("10", "3");
    assertThat(json.get("byN").get("3").has("rci")).isTrue();
    assertThat(json.get("byN").get("3").has("defined")).isFalse();
  }
}
