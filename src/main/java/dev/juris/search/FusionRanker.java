package dev.juris.search;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pure static utility fusing keyword and semantic result lists with Reciprocal Rank Fusion.
 *
 * <p>BM25 and cosine scores live on unrelated scales, so only rank positions are used: the item at
 * 0-based rank {@code r} of a list receives {@code weight / (k + r + 1)} from that list, and
 * contributions of the same id accumulate across lists.
 */
public final class FusionRanker {

  /** Conventional RRF damping constant. */
  public static final int DEFAULT_RRF_K = 60;

  private FusionRanker() {}

  /** Fuses with the default damping constant. */
  public static List<SearchResult> fuse(
      List<RankedCandidate> keywordResults,
      List<RankedCandidate> semanticResults,
      FusionWeights weights) {
    return fuse(keywordResults, semanticResults, weights, DEFAULT_RRF_K);
  }

  /**
   * Fuses two rank-sorted lists.
   *
   * @param keywordResults BM25 results, best first
   * @param semanticResults vector results, best first
   * @param weights per-list weights
   * @param rrfK damping constant, positive
   * @return fused results sorted by score descending; items keep the content and metadata of the
   *     first list that held them
   */
  public static List<SearchResult> fuse(
      List<RankedCandidate> keywordResults,
      List<RankedCandidate> semanticResults,
      FusionWeights weights,
      int rrfK) {
    if (rrfK <= 0) {
      throw new IllegalArgumentException("rrfK must be positive, got: " + rrfK);
    }
    if (keywordResults.isEmpty() && semanticResults.isEmpty()) {
      return List.of();
    }

    Map<String, FusedEntry> fused = new LinkedHashMap<>();
    accumulate(fused, semanticResults, weights.semantic(), rrfK);
    accumulate(fused, keywordResults, weights.keyword(), rrfK);

    return fused.values().stream()
        .sorted(Comparator.comparingDouble(FusedEntry::score).reversed())
        .map(FusedEntry::toSearchResult)
        .toList();
  }

  private static void accumulate(
      Map<String, FusedEntry> fused, List<RankedCandidate> ranked, double weight, int rrfK) {
    for (int rank = 0; rank < ranked.size(); rank++) {
      RankedCandidate candidate = ranked.get(rank);
      double contribution = weight / (rrfK + rank + 1);
      FusedEntry existing = fused.get(candidate.id());
      fused.put(
          candidate.id(),
          existing != null
              ? existing.plus(contribution)
              : new FusedEntry(candidate, contribution));
    }
  }

  private record FusedEntry(RankedCandidate candidate, double score) {

    FusedEntry plus(double contribution) {
      return new FusedEntry(candidate, score + contribution);
    }

    SearchResult toSearchResult() {
      return new SearchResult(candidate.id(), candidate.content(), score, candidate.metadata());
    }
  }
}
