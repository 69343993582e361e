package dev.juris.ingestion;

import static org.assertj.core.api.Assertions.assertThat;

import dev.juris.document.LegalDocument;
import dev.juris.document.Section;
import dev.juris.fixture.LegalDocumentBuilder;
import dev.juris.ingestion.chunking.Chunk;
import dev.juris.ingestion.chunking.ChunkerConfig;
import dev.juris.ingestion.chunking.StructuralChunker;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.Combinators;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;
import net.jqwik.api.constraints.IntRange;

/**
 * Property-based tests for chunking invariants that must hold for every document, structured or
 * flat: size bounds, document ownership, unique chunk indices and idempotence.
 */
class ChunkingServicePropertyTest {

  private static final String OVERLAP_MARKER = "[...] ";

  // =========================================================================
  // Document generator
  // =========================================================================

  @Provide
  Arbitrary<LegalDocument> documents() {
    return articles()
        .list()
        .ofMinSize(1)
        .ofMaxSize(10)
        .map(
            articles -> {
              LegalDocumentBuilder builder = new LegalDocumentBuilder();
              for (int i = 0; i < articles.size(); i++) {
                String[] article = articles.get(i);
                builder.article(String.valueOf(i + 1), article[0], article[1]);
              }
              return builder.build();
            });
  }

  @Provide
  Arbitrary<LegalDocument> flatDocuments() {
    return paragraph()
        .list()
        .ofMinSize(1)
        .ofMaxSize(12)
        .map(
            paragraphs ->
                new LegalDocumentBuilder()
                    .id("tesis")
                    .fullText(String.join("\n\n", paragraphs))
                    .build());
  }

  private Arbitrary<String> paragraph() {
    return sentence().list().ofMinSize(1).ofMaxSize(8).map(s -> String.join(" ", s));
  }

  private Arbitrary<String[]> articles() {
    Arbitrary<String> title =
        sentence().map(s -> s.substring(0, Math.min(30, s.length()))).injectNull(0.3);
    Arbitrary<String> content =
        sentence().list().ofMinSize(1).ofMaxSize(25).map(s -> String.join(" ", s));
    return Combinators.combine(title, content).as((t, c) -> new String[] {t, c});
  }

  private Arbitrary<String> sentence() {
    return word()
        .list()
        .ofMinSize(2)
        .ofMaxSize(20)
        .map(
            words -> {
              String joined = String.join(" ", words);
              return Character.toUpperCase(joined.charAt(0)) + joined.substring(1) + ".";
            });
  }

  private Arbitrary<String> word() {
    return Arbitraries.strings().withCharRange('a', 'z').ofMinLength(1).ofMaxLength(12);
  }

  // =========================================================================
  // Properties
  // =========================================================================

  @Property(tries = 200)
  void chunks_never_exceed_max_size_plus_prefix(
      @ForAll("documents") LegalDocument document,
      @ForAll @IntRange(min = 100, max = 600) int maxChunkSize) {
    ChunkingService service = serviceWith(maxChunkSize);
    Map<String, Section> sections =
        document.sections().stream().collect(Collectors.toMap(Section::id, Function.identity()));

    for (Chunk chunk : service.chunkDocument(document)) {
      Section source = sections.get(chunk.metadata().originalId());
      int allowance = StructuralChunker.contextPrefix(source).length();
      assertThat(chunk.content().length()).isLessThanOrEqualTo(maxChunkSize + allowance);
      assertThat(chunk.content()).startsWith(StructuralChunker.contextPrefix(source));
    }
  }

  @Property(tries = 200)
  void chunks_belong_to_document_and_have_unique_indices(
      @ForAll("documents") LegalDocument document,
      @ForAll @IntRange(min = 100, max = 600) int maxChunkSize) {
    List<Chunk> chunks = serviceWith(maxChunkSize).chunkDocument(document);

    assertThat(chunks).isNotEmpty();
    assertThat(chunks).allSatisfy(c -> assertThat(c.metadata().documentId()).isEqualTo("lft"));
    assertThat(chunks).extracting(c -> c.metadata().chunkIndex()).doesNotHaveDuplicates();
    assertThat(chunks).extracting(Chunk::id).doesNotHaveDuplicates();
  }

  @Property(tries = 100)
  void chunking_is_idempotent(@ForAll("documents") LegalDocument document) {
    ChunkingService service = serviceWith(300);

    assertThat(service.chunkDocument(document)).isEqualTo(service.chunkDocument(document));
  }

  @Property(tries = 200)
  void flow_chunk_bodies_never_exceed_max_size(
      @ForAll("flatDocuments") LegalDocument document,
      @ForAll @IntRange(min = 100, max = 600) int maxChunkSize,
      @ForAll @IntRange(min = 0, max = 60) int overlapSize) {
    ChunkingService service =
        new ChunkingService(new ChunkerConfig(maxChunkSize, overlapSize, 1, 100, true), 1);

    for (Chunk chunk : service.chunkDocument(document)) {
      assertWithinFlowBounds(chunk, maxChunkSize, overlapSize);
    }
  }

  @Property(tries = 100)
  void flattened_sections_respect_flow_bounds(
      @ForAll("documents") LegalDocument document,
      @ForAll @IntRange(min = 100, max = 600) int maxChunkSize) {
    ChunkingService service =
        new ChunkingService(new ChunkerConfig(maxChunkSize, 50, 1, 100, false), 1);

    for (Chunk chunk : service.chunkDocument(document)) {
      assertWithinFlowBounds(chunk, maxChunkSize, 50);
    }
  }

  @Property(tries = 200)
  void flow_chunks_belong_to_document_and_have_unique_indices(
      @ForAll("flatDocuments") LegalDocument document,
      @ForAll @IntRange(min = 100, max = 600) int maxChunkSize) {
    List<Chunk> chunks = serviceWith(maxChunkSize).chunkDocument(document);

    assertThat(chunks).isNotEmpty();
    assertThat(chunks).allSatisfy(c -> assertThat(c.metadata().documentId()).isEqualTo("tesis"));
    assertThat(chunks).extracting(c -> c.metadata().chunkIndex()).doesNotHaveDuplicates();
    assertThat(chunks).extracting(Chunk::id).doesNotHaveDuplicates();
  }

  @Property(tries = 100)
  void flow_chunking_is_idempotent(
      @ForAll("flatDocuments") LegalDocument flat, @ForAll("documents") LegalDocument structured) {
    ChunkingService service = serviceWith(300);
    ChunkingService flattening =
        new ChunkingService(new ChunkerConfig(300, 50, 2, 100, false), 1);

    assertThat(service.chunkDocument(flat)).isEqualTo(service.chunkDocument(flat));
    assertThat(flattening.chunkDocument(structured))
        .isEqualTo(flattening.chunkDocument(structured));
  }

  /**
   * With a context window of one paragraph the overlap is a single line, so the body starts after
   * the first blank line of an overlapped chunk.
   */
  private static void assertWithinFlowBounds(Chunk chunk, int maxChunkSize, int overlapSize) {
    String content = chunk.content();
    String body = content;
    if (content.startsWith(OVERLAP_MARKER)) {
      int end = content.indexOf("\n\n");
      String overlap = content.substring(OVERLAP_MARKER.length(), end);
      body = content.substring(end + 2);
      assertThat(overlap.split("\\s+")).hasSizeLessThanOrEqualTo(overlapSize);
    }
    assertThat(body).isNotBlank();
    assertThat(body.length()).isLessThanOrEqualTo(maxChunkSize);
  }

  private static ChunkingService serviceWith(int maxChunkSize) {
    return new ChunkingService(new ChunkerConfig(maxChunkSize, 50, 2, 100, true), 1);
  }
}
