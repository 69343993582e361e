package dev.juris.ingestion.chunking;

import dev.juris.document.Section;
import dev.langchain4j.data.document.Metadata;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Descriptive metadata of a {@link Chunk}.
 *
 * <p>Section chunks carry the section attributes ({@code type}, {@code article}, {@code title},
 * {@code sectionPath}, {@code originalId}); when a section had to be split, {@code partNumber} and
 * {@code totalParts} are set. Flow chunks have type {@code "paragraph"} and record the range of
 * source paragraphs they cover.
 *
 * @param type section type value ({@code "article"}, {@code "chapter"}...) or {@code "paragraph"}
 * @param article article number; null if the chunk does not come from a numbered article
 * @param title section title; null if untitled
 * @param sectionPath ancestor labels joined by {@code " > "}; null for flow chunks
 * @param originalId id of the source section; null for flow chunks
 * @param chunkIndex position of the chunk in its document's chunk set
 * @param partNumber 1-based part number when the section was split; null otherwise
 * @param totalParts number of parts the section was split into; null if not split
 * @param startParagraph first source paragraph of a flow chunk; null for section chunks
 * @param endParagraph last source paragraph of a flow chunk; null for section chunks
 * @param document document-level attributes
 */
public record ChunkMetadata(
    String type,
    @Nullable String article,
    @Nullable String title,
    @Nullable String sectionPath,
    @Nullable String originalId,
    int chunkIndex,
    @Nullable Integer partNumber,
    @Nullable Integer totalParts,
    @Nullable Integer startParagraph,
    @Nullable Integer endParagraph,
    DocumentContext document) {

  public static final String TYPE_PARAGRAPH = "paragraph";

  public static final String KEY_DOCUMENT_ID = "documentId";
  public static final String KEY_DOCUMENT_TITLE = "documentTitle";
  public static final String KEY_DOCUMENT_TYPE = "documentType";
  public static final String KEY_TYPE = "type";
  public static final String KEY_ARTICLE = "article";
  public static final String KEY_TITLE = "title";
  public static final String KEY_SECTION_PATH = "sectionPath";
  public static final String KEY_ORIGINAL_ID = "originalId";
  public static final String KEY_HIERARCHY = "hierarchy";
  public static final String KEY_LEGAL_AREA = "legalArea";
  public static final String KEY_CHUNK_INDEX = "chunkIndex";
  public static final String KEY_PART_NUMBER = "partNumber";
  public static final String KEY_TOTAL_PARTS = "totalParts";
  public static final String KEY_AUTHORITY = "authority";
  public static final String KEY_PUBLICATION_DATE = "publicationDate";
  public static final String KEY_LAST_UPDATED = "lastUpdated";

  public ChunkMetadata {
    Objects.requireNonNull(type, "type must not be null");
    Objects.requireNonNull(document, "document must not be null");
    if (chunkIndex < 0) {
      throw new IllegalArgumentException("chunkIndex must not be negative");
    }
    if ((partNumber == null) != (totalParts == null)) {
      throw new IllegalArgumentException("partNumber and totalParts must be set together");
    }
  }

  /** Metadata for a section that fits in a single chunk. */
  static ChunkMetadata forSection(
      Section section, String sectionPath, DocumentContext document, int chunkIndex) {
    return new ChunkMetadata(
        section.type().value(),
        section.isNumberedArticle() ? section.number().trim() : null,
        section.title(),
        sectionPath,
        section.id(),
        chunkIndex,
        null,
        null,
        null,
        null,
        document);
  }

  /** Metadata for a run of flow paragraphs. */
  static ChunkMetadata forParagraphs(
      DocumentContext document, int chunkIndex, int startParagraph, int endParagraph) {
    return new ChunkMetadata(
        TYPE_PARAGRAPH,
        null,
        null,
        null,
        null,
        chunkIndex,
        null,
        null,
        startParagraph,
        endParagraph,
        document);
  }

  ChunkMetadata withPart(int part, int total) {
    return new ChunkMetadata(
        type, article, title, sectionPath, originalId, chunkIndex, part, total, startParagraph,
        endParagraph, document);
  }

  /** True when the source unit was emitted whole, without splitting. */
  public boolean isComplete() {
    return partNumber == null;
  }

  /** True for the final part of a split section, and for complete chunks. */
  public boolean isLastPart() {
    return partNumber == null || partNumber.equals(totalParts);
  }

  public String documentId() {
    return document.documentId();
  }

  public int hierarchy() {
    return document.hierarchy();
  }

  /**
   * Converts the metadata to a langchain4j {@link Metadata} instance with the camelCase keys read
   * by the keyword index, the vector store filter and the reranker.
   */
  public Metadata toMetadata() {
    Metadata metadata =
        Metadata.from(KEY_DOCUMENT_ID, document.documentId())
            .put(KEY_DOCUMENT_TITLE, document.documentTitle())
            .put(KEY_DOCUMENT_TYPE, document.documentType().value())
            .put(KEY_TYPE, type)
            .put(KEY_HIERARCHY, document.hierarchy())
            .put(KEY_LEGAL_AREA, document.legalArea().value())
            .put(KEY_CHUNK_INDEX, chunkIndex);
    putIfPresent(metadata, KEY_ARTICLE, article);
    putIfPresent(metadata, KEY_TITLE, title);
    putIfPresent(metadata, KEY_SECTION_PATH, sectionPath);
    putIfPresent(metadata, KEY_ORIGINAL_ID, originalId);
    putIfPresent(metadata, KEY_AUTHORITY, document.authority());
    putIfPresent(metadata, KEY_PUBLICATION_DATE, document.publicationDate());
    putIfPresent(metadata, KEY_LAST_UPDATED, document.lastUpdated());
    if (partNumber != null) {
      metadata.put(KEY_PART_NUMBER, partNumber);
      metadata.put(KEY_TOTAL_PARTS, totalParts);
    }
    return metadata;
  }

  private static void putIfPresent(Metadata metadata, String key, @Nullable String value) {
    if (value != null) {
      metadata.put(key, value);
    }
  }
}
