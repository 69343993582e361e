package dev.juris.document;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

class SectionTableTest {

  private static final Section TITLE =
      new Section("t1", SectionType.TITLE, "Primero", null, "", 0, null, List.of("c1"));
  private static final Section CHAPTER =
      new Section("c1", SectionType.CHAPTER, "I", null, "", 1, "t1", List.of("a1", "missing"));
  private static final Section ARTICLE =
      new Section("a1", SectionType.ARTICLE, "1", null, "Texto.", 2, "c1", List.of());

  private final SectionTable table = new SectionTable(List.of(TITLE, CHAPTER, ARTICLE));

  @Test
  void ancestors_are_ordered_root_first() {
    assertThat(table.ancestors(ARTICLE)).containsExactly(TITLE, CHAPTER);
    assertThat(table.ancestors(TITLE)).isEmpty();
  }

  @Test
  void dangling_child_ids_are_skipped() {
    assertThat(table.children(CHAPTER)).containsExactly(ARTICLE);
  }

  @Test
  void parent_lookup_resolves_by_id() {
    assertThat(table.parent(ARTICLE)).contains(CHAPTER);
    assertThat(table.parent(TITLE)).isEmpty();
    assertThat(table.get("nope")).isEmpty();
    assertThat(table.size()).isEqualTo(3);
  }

  @Test
  void cyclic_parents_terminate() {
    Section a = new Section("a", SectionType.SECTION, null, null, "", 0, "b", List.of());
    Section b = new Section("b", SectionType.SECTION, null, null, "", 0, "a", List.of());
    SectionTable cyclic = new SectionTable(List.of(a, b));

    assertThat(cyclic.ancestors(a)).containsExactly(b);
  }

  @Test
  void null_content_and_children_default_to_empty() {
    Section section = new Section("x", SectionType.PARAGRAPH, null, null, null, 0, null, null);

    assertThat(section.content()).isEmpty();
    assertThat(section.childIds()).isEmpty();
    assertThat(section.isNumberedArticle()).isFalse();
  }
}
