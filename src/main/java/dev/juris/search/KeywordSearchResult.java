package dev.juris.search;

import dev.langchain4j.data.document.Metadata;
import java.util.List;

/**
 * A document matched by the BM25 index.
 *
 * @param id indexed document id
 * @param content indexed text
 * @param score boosted BM25 score, always positive
 * @param metadata metadata stored with the document
 * @param matches per-term occurrences that contributed to the score
 */
public record KeywordSearchResult(
    String id, String content, double score, Metadata metadata, List<TermMatch> matches) {

  public KeywordSearchResult {
    matches = List.copyOf(matches);
  }
}
