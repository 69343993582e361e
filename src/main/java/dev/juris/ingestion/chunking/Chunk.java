package dev.juris.ingestion.chunking;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import java.util.List;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * A bounded unit of legal text prepared for indexing and retrieval.
 *
 * <p>Chunks are immutable. Cross-references and embeddings are attached by creating a new record
 * through {@link #withRelatedChunks(List)} and {@link #withEmbedding(Embedding)}.
 *
 * @param id deterministic id, {@code {documentId}_chunk_{chunkIndex}}
 * @param documentId id of the owning document
 * @param content chunk text including its contextual prefix or overlap
 * @param metadata descriptive metadata
 * @param keywords distinct legal keyword tags
 * @param relatedChunks ids of chunks of the same document this chunk cites
 * @param embedding vector representation; null until an external embedder provides one
 */
public record Chunk(
    String id,
    String documentId,
    String content,
    ChunkMetadata metadata,
    List<String> keywords,
    List<String> relatedChunks,
    @Nullable Embedding embedding) {

  public Chunk {
    Objects.requireNonNull(id, "id must not be null");
    Objects.requireNonNull(documentId, "documentId must not be null");
    Objects.requireNonNull(content, "content must not be null");
    Objects.requireNonNull(metadata, "metadata must not be null");
    keywords = keywords == null ? List.of() : List.copyOf(keywords);
    relatedChunks = relatedChunks == null ? List.of() : List.copyOf(relatedChunks);
  }

  /** Creates a freshly chunked record without cross-references or embedding. */
  static Chunk of(String content, ChunkMetadata metadata, List<String> keywords) {
    String documentId = metadata.documentId();
    return new Chunk(
        chunkId(documentId, metadata.chunkIndex()),
        documentId,
        content,
        metadata,
        keywords,
        List.of(),
        null);
  }

  /** Builds the deterministic chunk id for a document and chunk index. */
  public static String chunkId(String documentId, int chunkIndex) {
    return documentId + "_chunk_" + chunkIndex;
  }

  public Chunk withRelatedChunks(List<String> related) {
    return new Chunk(id, documentId, content, metadata, keywords, related, embedding);
  }

  public Chunk withEmbedding(Embedding vector) {
    return new Chunk(id, documentId, content, metadata, keywords, relatedChunks, vector);
  }

  /** Converts this chunk to a langchain4j {@link TextSegment} ready for embedding. */
  public TextSegment toTextSegment() {
    return TextSegment.from(content, metadata.toMetadata());
  }
}
