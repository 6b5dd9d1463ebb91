package dev.trailanalytics.ingestion;

import dev.trailanalytics.race.NumericText;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Known column names of result tables and the normalization applied to header cells before they
 * are matched.
 */
public final class HeaderVocabulary {

    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^a-z0-9]+");
    private static final Pattern EDGE_UNDERSCORES = Pattern.compile("^_+|_+$");

    /** Names whose presence in the first row marks it as a header row. */
    static final Set<String> KNOWN_HEADERS = Set.of(
            "rank", "position", "pos", "place",
            "runner", "name", "athlete",
            "time",
            "race_score", "score", "index", "itra_score", "utmb_index",
            "gender", "sex",
            "nationality", "country", "nation", "nat");

    private HeaderVocabulary() {
        // utility class
    }

    /**
     * Normalizes a header cell: trims, lower-cases, strips a byte-order mark and collapses every
     * run of other characters into one underscore ({@code "Race Score"} becomes {@code
     * "race_score"}, {@code "UTMB® Index"} becomes {@code "utmb_index"}).
     */
    public static String normalizeKey(String cell) {
        String lower = cell == null
                ? ""
                : NumericText.strip(cell).toLowerCase(Locale.ROOT).replace("\uFEFF", "");
        String collapsed = NON_ALPHANUMERIC.matcher(lower).replaceAll("_");
        return EDGE_UNDERSCORES.matcher(collapsed).replaceAll("");
    }

    /** True when any cell of the row normalizes to a known header name. */
    public static boolean looksLikeHeader(List<String> cells) {
        return cells.stream().map(HeaderVocabulary::normalizeKey).anyMatch(KNOWN_HEADERS::contains);
    }
}
