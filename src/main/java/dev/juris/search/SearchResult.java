package dev.juris.search;

import dev.langchain4j.data.document.Metadata;

/**
 * A ranked hybrid search hit.
 *
 * @param id chunk id
 * @param content chunk text
 * @param score fused and re-ranked score; higher is better
 * @param metadata chunk metadata ({@code article}, {@code hierarchy}, {@code legalArea}...)
 */
public record SearchResult(String id, String content, double score, Metadata metadata) {

  public SearchResult withScore(double newScore) {
    return new SearchResult(id, content, newScore, metadata);
  }
}
