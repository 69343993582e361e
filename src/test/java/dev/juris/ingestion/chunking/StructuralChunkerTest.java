package dev.juris.ingestion.chunking;

import static org.assertj.core.api.Assertions.assertThat;

import dev.juris.document.LegalDocument;
import dev.juris.document.Section;
import dev.juris.document.SectionType;
import dev.juris.fixture.LegalDocumentBuilder;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class StructuralChunkerTest {

  private static final List<String> SENTENCES =
      List.of(
          "El patrón deberá pagar el salario íntegro en la fecha pactada.",
          "La jornada máxima diurna será de ocho horas por cada día laborado.",
          "Queda prohibido el trabajo extraordinario de los menores de edad.",
          "Las horas extraordinarias se pagarán al doble de la tarifa usual.");

  private final StructuralChunker chunker = new StructuralChunker(ChunkerConfig.defaults());

  // 200 max / 100 min keeps the split fixtures short
  private final StructuralChunker smallChunker =
      new StructuralChunker(new ChunkerConfig(200, 50, 2, 100, true));

  @Test
  void small_article_becomes_single_prefixed_chunk() {
    LegalDocument doc =
        new LegalDocumentBuilder()
            .article("123", "Del Trabajo", "Toda persona tiene derecho al trabajo digno.")
            .build();

    ChunkingOutcome outcome = chunker.chunk(doc, ChunkingProgressListener.NONE);

    assertThat(outcome.chunks()).hasSize(1);
    Chunk chunk = outcome.chunks().get(0);
    assertThat(chunk.content())
        .isEqualTo("[Artículo 123] [Del Trabajo]\n\nToda persona tiene derecho al trabajo digno.");
    assertThat(chunk.id()).isEqualTo("lft_chunk_0");
    assertThat(chunk.metadata().type()).isEqualTo("article");
    assertThat(chunk.metadata().article()).isEqualTo("123");
    assertThat(chunk.metadata().originalId()).isEqualTo("art-123");
    assertThat(chunk.metadata().sectionPath()).isEqualTo("Artículo 123");
    assertThat(chunk.metadata().isComplete()).isTrue();
    assertThat(chunk.keywords()).contains("derecho");
  }

  @Test
  void section_path_includes_ancestors() {
    Section title =
        new Section(
            "t1", SectionType.TITLE, "Primero", "Disposiciones", "", 0, null, List.of("a1"));
    Section article =
        new Section(
            "a1",
            SectionType.ARTICLE,
            "1",
            null,
            "La presente ley es de observancia general.",
            1,
            "t1",
            List.of());
    LegalDocument doc = new LegalDocumentBuilder().section(title).section(article).build();

    ChunkingOutcome outcome = chunker.chunk(doc, ChunkingProgressListener.NONE);

    assertThat(outcome.chunks()).hasSize(1);
    Chunk chunk = outcome.chunks().get(0);
    assertThat(chunk.metadata().sectionPath()).isEqualTo("Título Primero > Artículo 1");
    assertThat(chunk.metadata().chunkIndex()).isZero();
    assertThat(chunk.content()).startsWith("[Artículo 1]\n\n");
  }

  @Test
  void blank_sections_produce_no_chunks() {
    Section empty = new Section("c1", SectionType.CHAPTER, null, null, "  ");

    ChunkingOutcome outcome =
        chunker.chunkSection(empty, new LegalDocumentBuilder().section(empty).build(), 0);

    assertThat(outcome.chunks()).isEmpty();
    assertThat(outcome.droppedFragments()).isZero();
  }

  @Test
  void untitled_unnumbered_section_has_no_prefix() {
    Section chapter = new Section("c1", SectionType.CHAPTER, null, null, "Texto del capítulo.");

    assertThat(StructuralChunker.contextPrefix(chapter)).isEmpty();
  }

  @Test
  void oversized_article_is_split_into_numbered_parts() {
    String content = String.join(" ", SENTENCES) + " " + String.join(" ", SENTENCES);
    LegalDocument doc = new LegalDocumentBuilder().article("47", "Despido", content).build();
    String prefix = "[Artículo 47] [Despido]\n\n";

    List<Chunk> chunks = smallChunker.chunk(doc, ChunkingProgressListener.NONE).chunks();

    assertThat(chunks).hasSizeGreaterThan(1);
    for (int i = 0; i < chunks.size(); i++) {
      Chunk chunk = chunks.get(i);
      assertThat(chunk.content()).startsWith(prefix);
      assertThat(chunk.content().length()).isLessThanOrEqualTo(200 + prefix.length());
      assertThat(chunk.metadata().partNumber()).isEqualTo(i + 1);
      assertThat(chunk.metadata().totalParts()).isEqualTo(chunks.size());
      assertThat(chunk.metadata().chunkIndex()).isEqualTo(i);
      assertThat(chunk.metadata().article()).isEqualTo("47");
    }
    assertThat(chunks.get(chunks.size() - 1).metadata().isLastPart()).isTrue();
  }

  @Test
  void undersized_tail_borrows_sentences_from_previous_part() {
    String content = String.join(" ", SENTENCES) + " Así lo dispone la ley.";
    LegalDocument doc = new LegalDocumentBuilder().article("5", null, content).build();

    ChunkingOutcome outcome = smallChunker.chunk(doc, ChunkingProgressListener.NONE);

    assertThat(outcome.droppedFragments()).isZero();
    assertThat(outcome.chunks()).hasSize(2);
    assertThat(outcome.chunks().get(0).content())
        .isEqualTo("[Artículo 5]\n\n" + SENTENCES.get(0) + " " + SENTENCES.get(1));
    assertThat(outcome.chunks().get(1).content())
        .isEqualTo(
            "[Artículo 5]\n\n"
                + SENTENCES.get(2)
                + " "
                + SENTENCES.get(3)
                + " Así lo dispone la ley.");
  }

  @Test
  void tail_that_cannot_reach_minimum_is_dropped_without_losing_earlier_text() {
    String content = String.join(" ", SENTENCES.subList(0, 3)) + " " + "Fin de la norma.";
    LegalDocument doc = new LegalDocumentBuilder().article("6", null, content).build();

    ChunkingOutcome outcome = smallChunker.chunk(doc, ChunkingProgressListener.NONE);

    assertThat(outcome.droppedFragments()).isEqualTo(1);
    assertThat(outcome.chunks()).hasSize(1);
    assertThat(outcome.chunks().get(0).content())
        .isEqualTo("[Artículo 6]\n\n" + String.join(" ", SENTENCES.subList(0, 3)));
  }

  @Test
  void reports_progress_per_section_up_to_eighty_percent() {
    LegalDocument doc =
        new LegalDocumentBuilder()
            .article("1", "Objeto", "Esta ley tiene por objeto regular el trabajo.")
            .article("2", null, "Las normas del trabajo tienden a la justicia social.")
            .build();
    List<Integer> percents = new ArrayList<>();
    List<String> messages = new ArrayList<>();

    chunker.chunk(
        doc,
        (percent, message) -> {
          percents.add(percent);
          messages.add(message);
        });

    assertThat(percents).containsExactly(0, 40);
    assertThat(messages)
        .containsExactly("Processing section 1/2: Objeto", "Processing section 2/2: Untitled");
  }

  @Test
  void document_without_sections_yields_empty_outcome() {
    LegalDocument doc = new LegalDocumentBuilder().fullText("Texto plano.").build();

    assertThat(chunker.chunk(doc, ChunkingProgressListener.NONE).chunks()).isEmpty();
  }
}
