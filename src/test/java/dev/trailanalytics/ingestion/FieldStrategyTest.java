package dev.trailanalytics.ingestion;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

class FieldStrategyTest {

    @Test
    void headerAliasUsesFirstAliasPresent() {
        var row = new TableRow(List.of("1", "800", "900"), List.of("rank", "index", "race_score"));

        assertThat(FieldStrategy.headerAlias().resolve(row, ResultField.SCORE)).contains("900");
    }

    @Test
    void headerAliasIsEmptyWithoutHeaders() {
        var row = new TableRow(List.of("1", "A"), List.of());

        assertThat(FieldStrategy.headerAlias().resolve(row, ResultField.RANK)).isEmpty();
    }

    @Test
    void positionalReadsFixedColumn() {
        var row = new TableRow(List.of("1", "A", "x", "812"), List.of());

        assertThat(FieldStrategy.positional().resolve(row, ResultField.SCORE)).contains("812");
        assertThat(FieldStrategy.positional().resolve(row, ResultField.GENDER)).isEmpty();
    }

    @Test
    void rightmostNumericNeverReadsFirstColumn() {
        var row = new TableRow(List.of("5", "A"), List.of());

        assertThat(FieldStrategy.rightmostNumeric().resolve(row, ResultField.SCORE)).isEmpty();
    }

    @Test
    void rightmostNumericSkipsTimesAndText() {
        var row = new TableRow(List.of("1", "A", "845,5", "7:12:30", "FRA"), List.of());

        assertThat(FieldStrategy.rightmostNumeric().resolve(row, ResultField.SCORE))
                .contains("845,5");
    }
}
