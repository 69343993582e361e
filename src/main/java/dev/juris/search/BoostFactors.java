package dev.juris.search;

/**
 * Multiplicative boosts applied to BM25 scores.
 *
 * <p>A factor of 0 disables the corresponding boost.
 *
 * @param exactMatch multiplier applied when the whole tokenized query appears contiguously in the
 *     document
 * @param hierarchy strength of the authority boost, {@code 1 + (8 - hierarchy) * factor * 0.1}
 * @param recency strength of the freshness boost, {@code 1 + exp(-days / 365) * factor}
 */
public record BoostFactors(double exactMatch, double hierarchy, double recency) {

  /** No boosting at all. */
  public static final BoostFactors NONE = new BoostFactors(0.0, 0.0, 0.0);

  public BoostFactors {
    if (exactMatch < 0.0 || hierarchy < 0.0 || recency < 0.0) {
      throw new IllegalArgumentException("boost factors must not be negative");
    }
  }
}
