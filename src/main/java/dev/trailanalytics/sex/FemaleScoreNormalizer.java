package dev.trailanalytics.sex;

/**
 * Quadratic correction that maps female race scores onto the male scale so both sexes can be
 * compared on one axis: {@code normalized = (-0.000466 * score + 1.532) * score}.
 */
public final class FemaleScoreNormalizer {

  static final double QUADRATIC = -0.000466;
  static final double LINEAR = 1.532;

  private FemaleScoreNormalizer() {
    // utility class
  }

  /** Returns the corrected score, or NaN for a non-finite input. */
  public static double normalize(double score) {
    if (!Double.isFinite(score)) {
      return Double.NaN;
    }
    return ((QUADRATIC * score) + LINEAR) * score;
  }
}
