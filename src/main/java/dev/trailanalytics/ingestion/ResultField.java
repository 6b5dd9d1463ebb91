package dev.trailanalytics.ingestion;

import java.util.List;

/**
 * Fields of a result row, with the header names each can be read from and its column in
 * header-less tables.
 */
public enum ResultField {
    RANK(List.of("rank", "position", "pos", "place", "overall_rank"), 0),
    RUNNER(List.of("runner", "name", "athlete", "runner_name", "full_name"), 1),
    SCORE(List.of("race_score", "score", "index", "itra_score", "utmb_index"), 3),
    GENDER(List.of("gender", "sex"), 5),
    NATIONALITY(List.of("nationality", "country", "nation", "nat"), 6);

    private final List<String> aliases;
    private final int position;

    ResultField(List<String> aliases, int position) {
        this.aliases = aliases;
        this.position = position;
    }

    /** Normalized header names, in priority order. */
    public List<String> aliases() {
        return aliases;
    }

    /** Column index used when the table has no usable header. */
    public int position() {
        return position;
    }
}
