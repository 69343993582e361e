package dev.juris.search;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for hybrid retrieval.
 *
 * <p>Properties are bound from {@code juris.search.*}.
 *
 * <ul>
 *   <li>{@code semantic-weight} / {@code keyword-weight} - default fusion weights (0.7 / 0.3)
 *   <li>{@code top-k} - default number of results (10)
 *   <li>{@code rrf-k} - reciprocal rank fusion damping constant (60)
 *   <li>{@code candidate-multiplier} - each source returns {@code topK * multiplier} candidates (2)
 *   <li>{@code min-vector-score} - minimum vector store relevance (0.5)
 *   <li>{@code boost.*} - BM25 boost factors; 0 disables a boost
 * </ul>
 *
 * <p>Validated at startup via {@link #validate()}.
 */
@Configuration
@ConfigurationProperties(prefix = "juris.search")
public class SearchProperties {

  private double semanticWeight = 0.7;
  private double keywordWeight = 0.3;
  private int topK = 10;
  private int rrfK = FusionRanker.DEFAULT_RRF_K;
  private int candidateMultiplier = 2;
  private double minVectorScore = 0.5;
  private final Boost boost = new Boost();

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    requireUnitInterval("semantic-weight", semanticWeight);
    requireUnitInterval("keyword-weight", keywordWeight);
    requireUnitInterval("min-vector-score", minVectorScore);
    if (topK < 1) {
      throw new IllegalStateException("juris.search.top-k must be >= 1, got: " + topK);
    }
    if (rrfK < 1) {
      throw new IllegalStateException("juris.search.rrf-k must be >= 1, got: " + rrfK);
    }
    if (candidateMultiplier < 1) {
      throw new IllegalStateException(
          "juris.search.candidate-multiplier must be >= 1, got: " + candidateMultiplier);
    }
    if (boost.exactMatch < 0.0 || boost.hierarchy < 0.0 || boost.recency < 0.0) {
      throw new IllegalStateException("juris.search.boost.* must not be negative");
    }
  }

  private static void requireUnitInterval(String name, double value) {
    if (value < 0.0 || value > 1.0) {
      throw new IllegalStateException(
          "juris.search." + name + " must be in [0.0, 1.0], got: " + value);
    }
  }

  public FusionWeights toWeights() {
    return new FusionWeights(semanticWeight, keywordWeight);
  }

  public BoostFactors toBoostFactors() {
    return new BoostFactors(boost.exactMatch, boost.hierarchy, boost.recency);
  }

  public double getSemanticWeight() {
    return semanticWeight;
  }

  public void setSemanticWeight(double semanticWeight) {
    this.semanticWeight = semanticWeight;
  }

  public double getKeywordWeight() {
    return keywordWeight;
  }

  public void setKeywordWeight(double keywordWeight) {
    this.keywordWeight = keywordWeight;
  }

  public int getTopK() {
    return topK;
  }

  public void setTopK(int topK) {
    this.topK = topK;
  }

  public int getRrfK() {
    return rrfK;
  }

  public void setRrfK(int rrfK) {
    this.rrfK = rrfK;
  }

  public int getCandidateMultiplier() {
    return candidateMultiplier;
  }

  public void setCandidateMultiplier(int candidateMultiplier) {
    this.candidateMultiplier = candidateMultiplier;
  }

  public double getMinVectorScore() {
    return minVectorScore;
  }

  public void setMinVectorScore(double minVectorScore) {
    this.minVectorScore = minVectorScore;
  }

  public Boost getBoost() {
    return boost;
  }

  /** BM25 boost multipliers, bound from {@code juris.search.boost.*}. */
  public static class Boost {

    private double exactMatch = 1.5;
    private double hierarchy = 0.5;
    private double recency = 0.2;

    public double getExactMatch() {
      return exactMatch;
    }

    public void setExactMatch(double exactMatch) {
      this.exactMatch = exactMatch;
    }

    public double getHierarchy() {
      return hierarchy;
    }

    public void setHierarchy(double hierarchy) {
      this.hierarchy = hierarchy;
    }

    public double getRecency() {
      return recency;
    }

    public void setRecency(double recency) {
      this.recency = recency;
    }
  }
}
