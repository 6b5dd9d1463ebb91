package dev.trailanalytics.metrics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import dev.trailanalytics.fixture.CatalogFixtures;
import dev.trailanalytics.fixture.RaceBuilder;
import dev.trailanalytics.race.Race;
import dev.trailanalytics.race.RaceCatalog;
import dev.trailanalytics.selection.SelectionContext;
import dev.trailanalytics.selection.SortDirection;
import dev.trailanalytics.selection.SortSpec;
import java.util.List;
import org.junit.jupiter.api.Test;

class SummaryTableServiceTest {

  private static final double TOLERANCE = 0.001;

  @Test
  void summarize_computes_headline_metrics() {
    Race race =
        new RaceBuilder()
            .raceId("r")
            .name("Trail R")
            .series("World Series", "Alpine Cup")
            .scores(900, 850, 800, 750, 700)
            .build();

    SummaryRow row = SummaryTableService.summarize(race);

    assertThat(row.name()).isEqualTo("Trail R");
    assertThat(row.series()).isEqualTo("World Series, Alpine Cup");
    assertThat(row.top3()).isCloseTo(850.0, within(TOLERANCE));
    assertThat(row.top5()).isCloseTo(800.0, within(TOLERANCE));
    assertThat(row.top10()).isCloseTo(800.0, within(TOLERANCE));
    assertThat(row.rci5()).isCloseTo(800.0 - Math.sqrt(5000.0), within(TOLERANCE));
    assertThat(row.rci20()).isCloseTo(row.rci5(), within(TOLERANCE));
    assertThat(row.aucNorm()).isCloseTo(3200.0 / 30000, within(TOLERANCE));
    assertThat(row.gini()).isBetween(0.0, 1.0);
  }

  @Test
  void race_without_results_has_undefined_metrics() {
    SummaryRow row = SummaryTableService.summarize(new RaceBuilder().build());

    assertThat(row.top3()).isNaN();
    assertThat(row.rci10()).isNaN();
    assertThat(row.aucNorm()).isNaN();
    assertThat(row.gini()).isNaN();
  }

  @Test
  void missing_name_and_country_fall_back() {
    Race race = new RaceBuilder().raceId("no-name").name(null).country(null).build();

    SummaryRow row = SummaryTableService.summarize(race);

    assertThat(row.name()).isEqualTo("no-name");
    assertThat(row.country()).isEmpty();
  }

  @Test
  void build_rows_applies_filter_and_sort() {
    Race strong =
        new RaceBuilder().raceId("strong").name("Zugspitz").country("FR").scores(950, 940).build();
    Race weak =
        new RaceBuilder().raceId("weak").name("Alpine").country("FR").scores(700, 600).build();
    Race foreign = new RaceBuilder().raceId("foreign").country("US").scores(990, 980).build();
    RaceCatalog catalog = CatalogFixtures.catalogOf(strong, weak, foreign);
    SelectionContext selection = new SelectionContext(catalog);
    selection.selectAll();
    selection.setCountry("FR");
    SummaryTableService service = new SummaryTableService(catalog);

    List<SummaryRow> descending = service.buildRows(selection, SortSpec.descending("rci10"));
    List<SummaryRow> byName = service.buildRows(selection, new SortSpec("name", SortDirection.ASC));

    assertThat(descending).extracting(SummaryRow::raceId).containsExactly("strong", "weak");
    assertThat(byName).extracting(SummaryRow::raceId).containsExactly("weak", "strong");
  }
}
