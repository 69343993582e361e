package dev.juris.document;

import java.util.List;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * A structural unit of a legal document as delivered by the document parser.
 *
 * <p>Sections form a tree, but the tree is expressed through ids only: {@code parentId} and
 * {@code childIds} are weak references resolved through a {@link SectionTable}. Sections are never
 * mutated after parsing.
 *
 * @param id section identifier, unique within its document
 * @param type structural role (title, chapter, article...)
 * @param number article or fraction number as printed (e.g. {@code "123"}, {@code "IV"}); null if
 *     unnumbered
 * @param title heading text; null if untitled
 * @param content raw section text; empty for pure headings
 * @param level depth in the tree, 0 for top-level sections
 * @param parentId id of the enclosing section; null for top-level sections
 * @param childIds ids of the directly nested sections, in document order
 */
public record Section(
    String id,
    SectionType type,
    @Nullable String number,
    @Nullable String title,
    String content,
    int level,
    @Nullable String parentId,
    List<String> childIds) {

  public Section {
    Objects.requireNonNull(id, "id must not be null");
    Objects.requireNonNull(type, "type must not be null");
    content = content == null ? "" : content;
    childIds = childIds == null ? List.of() : List.copyOf(childIds);
    if (level < 0) {
      throw new IllegalArgumentException("level must not be negative");
    }
  }

  /** Convenience constructor for a top-level leaf section. */
  public Section(String id, SectionType type, @Nullable String number, @Nullable String title,
      String content) {
    this(id, type, number, title, content, 0, null, List.of());
  }

  /** Returns true if this section is a numbered article. */
  public boolean isNumberedArticle() {
    return type == SectionType.ARTICLE && number != null && !number.isBlank();
  }
}
