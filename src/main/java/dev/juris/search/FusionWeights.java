package dev.juris.search;

import org.jspecify.annotations.Nullable;

/**
 * Per-list weights for reciprocal rank fusion.
 *
 * @param semantic weight of the vector result list, in [0, 1]
 * @param keyword weight of the BM25 result list, in [0, 1]
 */
public record FusionWeights(double semantic, double keyword) {

  public static final FusionWeights DEFAULT = new FusionWeights(0.7, 0.3);

  public FusionWeights {
    if (semantic < 0.0 || semantic > 1.0 || keyword < 0.0 || keyword > 1.0) {
      throw new IllegalArgumentException(
          "fusion weights must be in [0.0, 1.0], got semantic="
              + semantic
              + ", keyword="
              + keyword);
    }
  }

  /**
   * Returns the weights tuned for a query category. Citation queries lean on exact terms,
   * conceptual and comparative ones on meaning. Categories without a tuning, and a null category,
   * keep {@code fallback}.
   */
  public static FusionWeights forQueryType(@Nullable QueryType type, FusionWeights fallback) {
    if (type == null) {
      return fallback;
    }
    return switch (type) {
      case CITATION -> new FusionWeights(0.3, 0.7);
      case PROCEDURAL -> new FusionWeights(0.6, 0.4);
      case CONCEPTUAL, COMPARATIVE -> new FusionWeights(0.8, 0.2);
      case ANALYTICAL -> new FusionWeights(0.7, 0.3);
      default -> fallback;
    };
  }
}
