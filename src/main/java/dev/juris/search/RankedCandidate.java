package dev.juris.search;

import dev.langchain4j.data.document.Metadata;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.store.embedding.EmbeddingMatch;

/**
 * One entry of a rank-sorted input list of {@link FusionRanker}.
 *
 * @param id chunk id shared by both retrieval paths
 * @param content chunk text
 * @param score source-specific score, only used for ordering
 * @param metadata chunk metadata
 */
public record RankedCandidate(String id, String content, double score, Metadata metadata) {

  static RankedCandidate fromKeyword(KeywordSearchResult result) {
    return new RankedCandidate(result.id(), result.content(), result.score(), result.metadata());
  }

  static RankedCandidate fromMatch(EmbeddingMatch<TextSegment> match) {
    TextSegment segment = match.embedded();
    String content = segment != null ? segment.text() : "";
    Metadata metadata = segment != null ? segment.metadata() : new Metadata();
    return new RankedCandidate(match.embeddingId(), content, match.score(), metadata);
  }
}
