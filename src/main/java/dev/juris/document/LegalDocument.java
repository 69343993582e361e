package dev.juris.document;

import java.util.List;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * A parsed legal document, either structured into {@link Section}s or carried as flat text.
 *
 * @param id document identifier
 * @param title full official title
 * @param shortTitle abbreviated title (e.g. "LFT"); null if none
 * @param type kind of legal instrument
 * @param hierarchy legal authority rank from 1 (constitutional) to 7 (administrative formats)
 * @param primaryArea main topical classification
 * @param authority issuing authority; null if unknown
 * @param publicationDate ISO-8601 publication date; null if unknown
 * @param lastUpdated ISO-8601 date of the last reform; null if unknown
 * @param sections flat section list in document order (the section arena); empty for flat text
 * @param fullText unstructured document text; null for structured documents
 */
public record LegalDocument(
    String id,
    String title,
    @Nullable String shortTitle,
    DocumentType type,
    int hierarchy,
    LegalArea primaryArea,
    @Nullable String authority,
    @Nullable String publicationDate,
    @Nullable String lastUpdated,
    List<Section> sections,
    @Nullable String fullText) {

  /** Highest authority rank (constitutional). */
  public static final int CONSTITUTIONAL_HIERARCHY = 1;

  /** Lowest authority rank (administrative formats). */
  public static final int LOWEST_HIERARCHY = 7;

  public LegalDocument {
    Objects.requireNonNull(id, "id must not be null");
    Objects.requireNonNull(title, "title must not be null");
    Objects.requireNonNull(type, "type must not be null");
    Objects.requireNonNull(primaryArea, "primaryArea must not be null");
    if (hierarchy < CONSTITUTIONAL_HIERARCHY || hierarchy > LOWEST_HIERARCHY) {
      throw new IllegalArgumentException(
          "hierarchy must be in [1, 7], got: " + hierarchy);
    }
    sections = sections == null ? List.of() : List.copyOf(sections);
  }

  public boolean hasSections() {
    return !sections.isEmpty();
  }

  public boolean hasFullText() {
    return fullText != null && !fullText.isBlank();
  }

  /** Builds the id-keyed lookup table over {@link #sections()}. */
  public SectionTable sectionTable() {
    return new SectionTable(sections);
  }
}
