package dev.juris.search;

import dev.juris.document.LegalArea;
import org.jspecify.annotations.Nullable;

/**
 * Per-query options of {@link HybridSearchService#hybridSearch}.
 *
 * @param topK number of results to return, positive
 * @param weights fusion weights; null uses the configured weights
 * @param queryType query category; when it has tuned weights they replace {@code weights}
 * @param legalArea restricts vector search to this area and boosts matching results; null for any
 * @param boost BM25 boost factors; null uses the configured factors
 */
public record HybridSearchOptions(
    int topK,
    @Nullable FusionWeights weights,
    @Nullable QueryType queryType,
    @Nullable LegalArea legalArea,
    @Nullable BoostFactors boost) {

  public HybridSearchOptions {
    if (topK <= 0) {
      throw new IllegalArgumentException("topK must be positive, got: " + topK);
    }
  }

  /** Options with the given result count and every other setting taken from configuration. */
  public static HybridSearchOptions topK(int topK) {
    return new HybridSearchOptions(topK, null, null, null, null);
  }

  public HybridSearchOptions withQueryType(@Nullable QueryType type) {
    return new HybridSearchOptions(topK, weights, type, legalArea, boost);
  }

  public HybridSearchOptions withLegalArea(@Nullable LegalArea area) {
    return new HybridSearchOptions(topK, weights, queryType, area, boost);
  }

  public HybridSearchOptions withWeights(@Nullable FusionWeights fusionWeights) {
    return new HybridSearchOptions(topK, fusionWeights, queryType, legalArea, boost);
  }

  public HybridSearchOptions withBoost(@Nullable BoostFactors factors) {
    return new HybridSearchOptions(topK, weights, queryType, legalArea, factors);
  }
}
