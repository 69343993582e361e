package dev.juris.ingestion.chunking;

import dev.juris.document.LegalDocument;
import dev.juris.document.Section;
import dev.juris.document.SectionTable;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Section-based chunker for structured legal documents.
 *
 * <p>Each section becomes one chunk when its content, stamped with a contextual prefix such as
 * {@code "[Artículo 123] [Del Trabajo]"}, fits within {@code maxChunkSize}. Larger sections are
 * segmented into sentences and packed greedily into parts; every part repeats the prefix and
 * records its {@code partNumber} and {@code totalParts}.
 *
 * <p>The segmenter guarantees that no sentence exceeds 80% of {@code maxChunkSize}, so every part
 * body stays within {@code maxChunkSize} and the packing loop always advances. A trailing part
 * shorter than {@code minChunkSize} takes whole sentences from the part before it; if it still
 * cannot reach the minimum it is dropped and reported.
 */
public class StructuralChunker {

  private static final String SENTENCE_SEPARATOR = " ";
  private static final String PATH_SEPARATOR = " > ";

  private final ChunkerConfig config;
  private final SentenceSegmenter segmenter;

  public StructuralChunker(ChunkerConfig config) {
    this(config, new SentenceSegmenter(config.maxChunkSize()));
  }

  public StructuralChunker(ChunkerConfig config, SentenceSegmenter segmenter) {
    this.config = config;
    this.segmenter = segmenter;
  }

  /**
   * Chunks every section of a structured document in document order.
   *
   * @param document the document whose sections are chunked
   * @param listener receives per-section progress between 0 and 80 percent
   * @return chunks with consecutive chunk indices starting at 0
   */
  public ChunkingOutcome chunk(LegalDocument document, ChunkingProgressListener listener) {
    if (!document.hasSections()) {
      return ChunkingOutcome.empty();
    }

    SectionTable table = document.sectionTable();
    DocumentContext context = DocumentContext.from(document);
    List<Section> sections = document.sections();
    List<Chunk> chunks = new ArrayList<>();
    int dropped = 0;

    for (int i = 0; i < sections.size(); i++) {
      Section section = sections.get(i);
      String title = section.title() != null ? section.title() : "Untitled";
      listener.onProgress(
          Math.round((float) i / sections.size() * 80),
          "Processing section %d/%d: %s".formatted(i + 1, sections.size(), title));

      ChunkingOutcome sectionOutcome = chunkSection(section, context, table, chunks.size());
      chunks.addAll(sectionOutcome.chunks());
      dropped += sectionOutcome.droppedFragments();
    }

    return new ChunkingOutcome(chunks, dropped);
  }

  /**
   * Chunks a single section of a document.
   *
   * @param section the section to chunk
   * @param document the owning document
   * @param startIndex chunk index assigned to the first emitted chunk
   * @return the section's chunks, empty when the section has no content
   */
  public ChunkingOutcome chunkSection(Section section, LegalDocument document, int startIndex) {
    return chunkSection(
        section, DocumentContext.from(document), document.sectionTable(), startIndex);
  }

  ChunkingOutcome chunkSection(
      Section section, DocumentContext context, SectionTable table, int startIndex) {
    String content = section.content().trim();
    if (content.isEmpty()) {
      return ChunkingOutcome.empty();
    }

    String prefix = contextPrefix(section);
    ChunkMetadata metadata =
        ChunkMetadata.forSection(section, sectionPath(section, table), context, startIndex);

    if (prefix.length() + content.length() <= config.maxChunkSize()) {
      return new ChunkingOutcome(
          List.of(Chunk.of(prefix + content, metadata, KeywordExtractor.extract(content))), 0);
    }

    List<List<String>> parts = packSentences(segmenter.segment(content));
    int dropped = rebalanceTail(parts);

    List<Chunk> chunks = new ArrayList<>();
    for (int i = 0; i < parts.size(); i++) {
      String body = String.join(SENTENCE_SEPARATOR, parts.get(i));
      ChunkMetadata partMetadata =
          ChunkMetadata.forSection(section, metadata.sectionPath(), context, startIndex + i)
              .withPart(i + 1, parts.size());
      chunks.add(Chunk.of(prefix + body, partMetadata, KeywordExtractor.extract(body)));
    }
    return new ChunkingOutcome(chunks, dropped);
  }

  /** Greedily packs sentences into parts whose joined length stays within maxChunkSize. */
  private List<List<String>> packSentences(List<String> sentences) {
    List<List<String>> parts = new ArrayList<>();
    List<String> current = new ArrayList<>();
    int currentLength = 0;

    for (String sentence : sentences) {
      int candidate =
          current.isEmpty() ? sentence.length() : currentLength + 1 + sentence.length();
      if (candidate > config.maxChunkSize() && !current.isEmpty()) {
        parts.add(current);
        current = new ArrayList<>();
        current.add(sentence);
        currentLength = sentence.length();
      } else {
        current.add(sentence);
        currentLength = candidate;
      }
    }

    if (!current.isEmpty()) {
      parts.add(current);
    }
    return parts;
  }

  /**
   * Moves trailing sentences of the second-to-last part into an undersized last part while both
   * stay within bounds. If the last part still falls short of minChunkSize, the moves are undone
   * and only the original last part is dropped.
   *
   * @return 1 if the last part was dropped, 0 otherwise
   */
  private int rebalanceTail(List<List<String>> parts) {
    if (parts.size() < 2 || joinedLength(parts.get(parts.size() - 1)) >= config.minChunkSize()) {
      return 0;
    }
    List<String> last = new ArrayList<>(parts.get(parts.size() - 1));
    List<String> previous = new ArrayList<>(parts.get(parts.size() - 2));

    while (joinedLength(last) < config.minChunkSize() && previous.size() > 1) {
      String moved = previous.get(previous.size() - 1);
      int grownLast = joinedLength(last) + 1 + moved.length();
      int shrunkPrevious = joinedLength(previous) - 1 - moved.length();
      if (grownLast > config.maxChunkSize() || shrunkPrevious < config.minChunkSize()) {
        break;
      }
      previous.remove(previous.size() - 1);
      last.add(0, moved);
    }

    if (joinedLength(last) < config.minChunkSize()) {
      parts.remove(parts.size() - 1);
      return 1;
    }
    parts.set(parts.size() - 2, previous);
    parts.set(parts.size() - 1, last);
    return 0;
  }

  private static int joinedLength(List<String> sentences) {
    int length = 0;
    for (String sentence : sentences) {
      length += sentence.length();
    }
    return sentences.isEmpty() ? 0 : length + sentences.size() - 1;
  }

  /**
   * Builds the contextual prefix of a section: {@code [Artículo N]} for numbered articles, then
   * {@code [Title]} when the section is titled, followed by a blank line. Empty if neither applies.
   */
  public static String contextPrefix(Section section) {
    List<String> parts = new ArrayList<>();
    if (section.isNumberedArticle()) {
      parts.add("[Artículo " + section.number() + "]");
    }
    if (section.title() != null && !section.title().isBlank()) {
      parts.add("[" + section.title().trim() + "]");
    }
    return parts.isEmpty() ? "" : String.join(" ", parts) + "\n\n";
  }

  /** Renders the labels of the section's ancestors and the section itself. */
  static String sectionPath(Section section, SectionTable table) {
    return Stream.concat(table.ancestors(section).stream(), Stream.of(section))
        .map(StructuralChunker::label)
        .collect(Collectors.joining(PATH_SEPARATOR));
  }

  private static String label(Section section) {
    if (section.number() != null && !section.number().isBlank()) {
      return section.type().label() + " " + section.number().trim();
    }
    if (section.title() != null && !section.title().isBlank()) {
      return section.title().trim();
    }
    return section.type().label();
  }
}
