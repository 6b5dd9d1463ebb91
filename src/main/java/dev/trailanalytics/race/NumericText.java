package dev.trailanalytics.race;

import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;

/**
 * Parses numbers out of free text. Invalid or blank input yields {@link Double#NaN} instead of an
 * exception so callers can drop the offending record.
 */
public final class NumericText {

  private static final Pattern DECIMAL =
      Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

  private NumericText() {
    // utility class
  }

  /**
   * Parses a plain decimal number ({@code "812"}, {@code " 950.5 "}, {@code "1e3"}). Surrounding
   * blanks are removed with {@link #strip(String)}.
   *
   * @return the parsed value, or NaN when the text is blank or not a decimal number
   */
  public static double parse(@Nullable String text) {
    if (text == null) {
      return Double.NaN;
    }
    String trimmed = strip(text);
    if (trimmed.isEmpty() || !DECIMAL.matcher(trimmed).matches()) {
      return Double.NaN;
    }
    return Double.parseDouble(trimmed);
  }

  /**
   * Like {@link #parse(String)} but accepts a decimal comma: the first {@code ','} is read as a
   * decimal point, so {@code "870,25"} parses to 870.25.
   */
  public static double parseLoose(@Nullable String text) {
    if (text == null) {
      return Double.NaN;
    }
    return parse(strip(text).replaceFirst(",", "."));
  }

  /**
   * Removes leading and trailing blanks, including non-breaking spaces ({@code U+00A0}, {@code
   * U+2007}, {@code U+202F}) and byte-order marks, which pasted web tables often carry.
   */
  public static String strip(String text) {
    int start = 0;
    int end = text.length();
    while (start < end && isBlank(text.charAt(start))) {
      start++;
    }
    while (end > start && isBlank(text.charAt(end - 1))) {
      end--;
    }
    return text.substring(start, end);
  }

  private static boolean isBlank(char c) {
    return Character.isWhitespace(c) || Character.isSpaceChar(c) || c == '\uFEFF';
  }
}
