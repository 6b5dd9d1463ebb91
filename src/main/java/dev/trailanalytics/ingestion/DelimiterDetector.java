package dev.trailanalytics.ingestion;

/**
 * Guesses the cell delimiter of pasted tabular text from its first non-blank line.
 *
 * <p>Tab wins when it is at least as frequent as comma and semicolon and present at all;
 * otherwise semicolon wins when it is strictly more frequent than comma; comma is the default.
 */
public final class DelimiterDetector {

    private DelimiterDetector() {
        // utility class
    }

    /**
     * Detects the delimiter of {@code text}.
     *
     * @param text the pasted block
     * @return {@code '\t'}, {@code ';'} or {@code ','}
     */
    public static char detect(String text) {
        String first = text.lines()
                .filter(line -> !line.isBlank())
                .findFirst()
                .orElse("");
        long tabs = count(first, '\t');
        long commas = count(first, ',');
        long semicolons = count(first, ';');
        if (tabs >= commas && tabs >= semicolons && tabs > 0) {
            return '\t';
        }
        if (semicolons > commas && semicolons > 0) {
            return ';';
        }
        return ',';
    }

    private static long count(String line, char c) {
        return line.chars().filter(ch -> ch == c).count();
    }
}
