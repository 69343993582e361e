package dev.juris.ingestion.chunking;

import dev.juris.document.DocumentType;
import dev.juris.document.LegalArea;
import dev.juris.document.LegalDocument;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Document-level attributes stamped on every chunk of a document.
 *
 * @param documentId owning document id
 * @param documentTitle owning document title
 * @param documentType kind of legal instrument
 * @param hierarchy legal authority rank (1 = constitutional)
 * @param legalArea primary topical area of the document
 * @param authority issuing authority; null if unknown
 * @param publicationDate ISO-8601 publication date; null if unknown
 * @param lastUpdated ISO-8601 date of the last reform; null if unknown
 */
public record DocumentContext(
    String documentId,
    String documentTitle,
    DocumentType documentType,
    int hierarchy,
    LegalArea legalArea,
    @Nullable String authority,
    @Nullable String publicationDate,
    @Nullable String lastUpdated) {

  public DocumentContext {
    Objects.requireNonNull(documentId, "documentId must not be null");
    Objects.requireNonNull(documentTitle, "documentTitle must not be null");
    Objects.requireNonNull(documentType, "documentType must not be null");
    Objects.requireNonNull(legalArea, "legalArea must not be null");
  }

  public static DocumentContext from(LegalDocument document) {
    return new DocumentContext(
        document.id(),
        document.title(),
        document.type(),
        document.hierarchy(),
        document.primaryArea(),
        document.authority(),
        document.publicationDate(),
        document.lastUpdated() != null ? document.lastUpdated() : document.publicationDate());
  }
}
