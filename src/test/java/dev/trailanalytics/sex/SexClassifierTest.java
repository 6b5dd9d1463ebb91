package dev.trailanalytics.sex;

import static org.assertj.core.api.Assertions.assertThat;

import dev.trailanalytics.fixture.RaceBuilder;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

class SexClassifierTest {

  @ParameterizedTest
  @ValueSource(strings = {"M", "men", "Man", "MALE", "homme", "H", " h "})
  void male_labels(String label) {
    assertThat(SexClassifier.normalizeLabel(label)).isEqualTo(Sex.MALE);
  }

  @ParameterizedTest
  @ValueSource(strings = {"F", "women", "Woman", "female", "Femme", "W"})
  void female_labels(String label) {
    assertThat(SexClassifier.normalizeLabel(label)).isEqualTo(Sex.FEMALE);
  }

  @ParameterizedTest
  @ValueSource(strings = {"", "X", "mixed", "hommes"})
  void unknown_labels_are_null(String label) {
    assertThat(SexClassifier.normalizeLabel(label)).isNull();
  }

  @Test
  void null_label_is_null() {
    assertThat(SexClassifier.normalizeLabel(null)).isNull();
  }

  @ParameterizedTest
  @CsvSource({
    "Western States Men, ws-2025, MALE",
    "Skyrace Hommes, sky, MALE",
    "Lavaredo (Women), lav-2025, FEMALE",
    "Trail des Femmes, tdf, FEMALE",
    "Transgrancanaria, tgc-women-2025, FEMALE"
  })
  void race_sex_is_inferred_from_name_or_id(String name, String raceId, Sex expected) {
    var metadata = new RaceBuilder().name(name).metadata();

    assertThat(SexClassifier.inferRaceSex(raceId, metadata)).isEqualTo(expected);
  }

  @Test
  void men_is_checked_before_women() {
    var metadata = new RaceBuilder().name("Men and Women Open").metadata();

    assertThat(SexClassifier.inferRaceSex("open", metadata)).isEqualTo(Sex.MALE);
  }

  @Test
  void mixed_race_has_no_inferred_sex() {
    var metadata = new RaceBuilder().name("Mont Blanc Marathon").metadata();

    assertThat(SexClassifier.inferRaceSex("mbm-2025", metadata)).isNull();
    assertThat(SexClassifier.inferRaceSex("mbm-2025", null)).isNull();
  }

  @Test
  void words_containing_men_do_not_match() {
    var metadata = new RaceBuilder().name("Clement Trail").metadata();

    assertThat(SexClassifier.inferRaceSex("clement", metadata)).isNull();
  }
}
