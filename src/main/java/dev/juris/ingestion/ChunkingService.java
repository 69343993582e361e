package dev.juris.ingestion;

import dev.juris.document.LegalDocument;
import dev.juris.document.Section;
import dev.juris.ingestion.chunking.Chunk;
import dev.juris.ingestion.chunking.ChunkerConfig;
import dev.juris.ingestion.chunking.ChunkingOutcome;
import dev.juris.ingestion.chunking.ChunkingProgressListener;
import dev.juris.ingestion.chunking.CrossReferenceLinker;
import dev.juris.ingestion.chunking.DocumentContext;
import dev.juris.ingestion.chunking.FlowChunker;
import dev.juris.ingestion.chunking.SentenceSegmenter;
import dev.juris.ingestion.chunking.StructuralChunker;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Turns parsed legal documents into cross-referenced chunk sets.
 *
 * <p>Structured documents go through the {@link StructuralChunker} (one chunk per section, split
 * when oversized); flat text goes through the {@link FlowChunker}. When structure preservation is
 * disabled, a document that only carries sections is flattened into prefixed paragraphs and
 * flow-chunked. The resulting set is then passed through the {@link CrossReferenceLinker}.
 *
 * <p>Chunking is a pure transformation: the same document always yields the same chunk ids and
 * contents, and no state is shared between documents. Documents without content produce no chunks
 * and a warning rather than an error.
 */
@Service
public class ChunkingService {

  private static final Logger log = LoggerFactory.getLogger(ChunkingService.class);

  private final ChunkerConfig config;
  private final StructuralChunker structuralChunker;
  private final FlowChunker flowChunker;
  private final CrossReferenceLinker linker;
  private final int workerThreads;

  @Autowired
  public ChunkingService(ChunkingProperties properties) {
    this(properties.toConfig(), properties.getWorkerThreads());
  }

  public ChunkingService(ChunkerConfig config, int workerThreads) {
    if (workerThreads < 1) {
      throw new IllegalArgumentException("workerThreads must be at least 1");
    }
    SentenceSegmenter segmenter = new SentenceSegmenter(config.maxChunkSize());
    this.config = config;
    this.structuralChunker = new StructuralChunker(config, segmenter);
    this.flowChunker = new FlowChunker(config, segmenter);
    this.linker = new CrossReferenceLinker();
    this.workerThreads = workerThreads;
  }

  /**
   * Chunks a single document.
   *
   * @param document the parsed document
   * @return the document's chunks with cross-references; empty if it has no content
   */
  public List<Chunk> chunkDocument(LegalDocument document) {
    return chunkDocument(document, ChunkingProgressListener.NONE);
  }

  /**
   * Chunks a single document, reporting progress to the given listener.
   *
   * @param document the parsed document
   * @param listener receives progress from 0 to 100 percent
   * @return the document's chunks with cross-references; empty if it has no content
   */
  public List<Chunk> chunkDocument(LegalDocument document, ChunkingProgressListener listener) {
    ChunkingOutcome outcome;
    if (config.preserveStructure() && document.hasSections()) {
      listener.onProgress(0, "Processing structured content...");
      outcome = structuralChunker.chunk(document, listener);
    } else if (document.hasFullText()) {
      listener.onProgress(0, "Processing unstructured text...");
      outcome = flowChunker.chunk(document.fullText(), DocumentContext.from(document), 0);
    } else if (document.hasSections()) {
      listener.onProgress(0, "Processing flattened sections...");
      outcome = flowChunker.chunk(flatten(document), DocumentContext.from(document), 0);
    } else {
      log.warn("Document {} has no content to chunk", document.id());
      listener.onProgress(100, "Created 0 chunks");
      return List.of();
    }

    if (outcome.droppedFragments() > 0) {
      log.warn(
          "Dropped {} fragment(s) shorter than {} characters while chunking document {}",
          outcome.droppedFragments(),
          config.minChunkSize(),
          document.id());
    }

    listener.onProgress(90, "Adding cross-references...");
    List<Chunk> chunks = linker.link(outcome.chunks());

    listener.onProgress(100, "Created %d chunks".formatted(chunks.size()));
    log.debug("Chunked document {} into {} chunks", document.id(), chunks.size());
    return chunks;
  }

  /**
   * Chunks several independent documents on a bounded worker pool.
   *
   * @param documents the documents to chunk
   * @return chunk sets keyed by document id, in input order; a repeated id keeps its last chunk set
   */
  public Map<String, List<Chunk>> chunkDocuments(List<LegalDocument> documents) {
    if (documents.isEmpty()) {
      return Map.of();
    }

    ExecutorService pool = Executors.newFixedThreadPool(Math.min(workerThreads, documents.size()));
    try {
      List<Future<List<Chunk>>> futures = new ArrayList<>(documents.size());
      for (LegalDocument document : documents) {
        futures.add(pool.submit(() -> chunkDocument(document)));
      }

      Map<String, List<Chunk>> result = new LinkedHashMap<>();
      int total = 0;
      for (int i = 0; i < documents.size(); i++) {
        List<Chunk> chunks = futures.get(i).get();
        result.put(documents.get(i).id(), chunks);
        total += chunks.size();
      }
      log.info("Chunked {} documents into {} chunks", documents.size(), total);
      return result;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted while chunking documents", e);
    } catch (ExecutionException e) {
      throw new IllegalStateException(
          "Chunking failed: " + e.getCause().getMessage(), e.getCause());
    } finally {
      pool.shutdownNow();
    }
  }

  /** Renders the sections of a document as prefixed paragraphs. */
  private static String flatten(LegalDocument document) {
    List<String> paragraphs = new ArrayList<>();
    for (Section section : document.sections()) {
      String content = section.content().trim();
      if (!content.isEmpty()) {
        paragraphs.add(StructuralChunker.contextPrefix(section) + content);
      }
    }
    return String.join("\n\n", paragraphs);
  }
}
