package dev.juris.search;

import static dev.langchain4j.store.embedding.filter.MetadataFilterBuilder.metadataKey;

import dev.juris.ingestion.chunking.Chunk;
import dev.juris.ingestion.chunking.ChunkMetadata;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.store.embedding.EmbeddingSearchRequest;
import dev.langchain4j.store.embedding.EmbeddingStore;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Hybrid retrieval over legal chunks: BM25 keyword search and vector search fused by reciprocal
 * rank, then re-ranked with legal-domain boosts.
 *
 * <p>Pipeline: resolve weights (query type, then options, then configuration) -> BM25 search for
 * {@code topK * candidateMultiplier} candidates -> vector search for as many candidates when the
 * query embedding is non-empty (optional legal area filter) -> {@link FusionRanker} -> {@link
 * LegalReranker} -> truncate to topK.
 *
 * <p>Ranking never fails because of the vector store: a store error is logged and the query is
 * answered from the keyword index alone.
 */
@Service
public class HybridSearchService {

  private static final Logger log = LoggerFactory.getLogger(HybridSearchService.class);

  private final Bm25Engine bm25Engine;
  private final EmbeddingStore<TextSegment> embeddingStore;
  private final LegalReranker reranker;
  private final SearchProperties properties;
  private final Set<String> embeddedIds = ConcurrentHashMap.newKeySet();

  public HybridSearchService(
      Bm25Engine bm25Engine,
      EmbeddingStore<TextSegment> embeddingStore,
      LegalReranker reranker,
      SearchProperties properties) {
    this.bm25Engine = bm25Engine;
    this.embeddingStore = embeddingStore;
    this.reranker = reranker;
    this.properties = properties;
  }

  /**
   * Adds chunks to the keyword index and, for chunks that carry an embedding, to the vector store.
   *
   * @param chunks chunks to index; re-indexing a chunk id replaces its keyword entry
   */
  public void index(List<Chunk> chunks) {
    List<String> ids = new ArrayList<>();
    List<Embedding> embeddings = new ArrayList<>();
    List<TextSegment> segments = new ArrayList<>();

    for (Chunk chunk : chunks) {
      bm25Engine.addDocument(chunk.id(), chunk.content(), chunk.metadata().toMetadata());
      if (chunk.embedding() != null) {
        ids.add(chunk.id());
        embeddings.add(chunk.embedding());
        segments.add(chunk.toTextSegment());
      }
    }

    if (!ids.isEmpty()) {
      List<String> replaced = ids.stream().filter(embeddedIds::contains).toList();
      if (!replaced.isEmpty()) {
        embeddingStore.removeAll(replaced);
      }
      embeddingStore.addAll(ids, embeddings, segments);
      embeddedIds.addAll(ids);
    }
    log.info(
        "Indexed {} chunks ({} with embeddings); keyword index size {}",
        chunks.size(),
        ids.size(),
        bm25Engine.size());
  }

  /** Searches with the configured result count and settings. */
  public List<SearchResult> hybridSearch(String query, @Nullable Embedding queryEmbedding) {
    return hybridSearch(query, queryEmbedding, HybridSearchOptions.topK(properties.getTopK()));
  }

  /**
   * Runs the hybrid retrieval pipeline.
   *
   * @param query query text
   * @param queryEmbedding embedding of the query; null or empty searches keywords only
   * @param options per-query options
   * @return at most {@code options.topK()} results, best first
   */
  public List<SearchResult> hybridSearch(
      String query, @Nullable Embedding queryEmbedding, HybridSearchOptions options) {
    FusionWeights configured =
        options.weights() != null ? options.weights() : properties.toWeights();
    FusionWeights weights = FusionWeights.forQueryType(options.queryType(), configured);
    BoostFactors boost = options.boost() != null ? options.boost() : properties.toBoostFactors();
    int candidates = options.topK() * properties.getCandidateMultiplier();

    List<RankedCandidate> keyword =
        bm25Engine.search(query, candidates, boost).stream()
            .map(RankedCandidate::fromKeyword)
            .toList();
    List<RankedCandidate> semantic = semanticSearch(queryEmbedding, candidates, options);

    List<SearchResult> fused =
        FusionRanker.fuse(keyword, semantic, weights, properties.getRrfK());
    List<SearchResult> ranked =
        reranker.rerank(fused, query, options.queryType(), options.legalArea());

    log.debug(
        "Hybrid query '{}' ({}): {} keyword + {} semantic candidates, weights {}",
        query,
        options.queryType(),
        keyword.size(),
        semantic.size(),
        weights);
    return ranked.size() > options.topK() ? ranked.subList(0, options.topK()) : ranked;
  }

  private List<RankedCandidate> semanticSearch(
      @Nullable Embedding queryEmbedding, int candidates, HybridSearchOptions options) {
    if (queryEmbedding == null || queryEmbedding.dimension() == 0) {
      return List.of();
    }

    EmbeddingSearchRequest.EmbeddingSearchRequestBuilder builder =
        EmbeddingSearchRequest.builder()
            .queryEmbedding(queryEmbedding)
            .maxResults(candidates)
            .minScore(properties.getMinVectorScore());
    if (options.legalArea() != null) {
      builder.filter(
          metadataKey(ChunkMetadata.KEY_LEGAL_AREA).isEqualTo(options.legalArea().value()));
    }

    try {
      return embeddingStore.search(builder.build()).matches().stream()
          .map(RankedCandidate::fromMatch)
          .toList();
    } catch (RuntimeException e) {
      log.warn("Vector search failed, ranking on keyword results only: {}", e.getMessage(), e);
      return List.of();
    }
  }

  /**
   * Empties the keyword index and the vector store. If the store cannot be cleared, the keyword
   * index is still emptied and {@link #stats()} keeps reporting the embeddings left in the store.
   */
  public void clear() {
    bm25Engine.clear();
    try {
      embeddingStore.removeAll();
      embeddedIds.clear();
      log.info("Search indices cleared");
    } catch (RuntimeException e) {
      log.warn(
          "Could not clear the vector store, it still holds {} embeddings: {}",
          embeddedIds.size(),
          e.getMessage(),
          e);
    }
  }

  public IndexStats stats() {
    return new IndexStats(bm25Engine.size(), embeddedIds.size());
  }
}
