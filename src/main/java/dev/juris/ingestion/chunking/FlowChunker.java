package dev.juris.ingestion.chunking;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Paragraph-based chunker for documents without usable structure.
 *
 * <p>Paragraphs (separated by blank lines) are accumulated into a buffer until the next one would
 * overflow {@code maxChunkSize}. The buffer is then emitted as a chunk, prefixed with an overlap
 * drawn from the previous chunk: the last two sentences of each of its last {@code contextWindow}
 * paragraphs, cut to the last {@code overlapSize} words and marked with a leading {@code [...]}.
 *
 * <p>A paragraph longer than {@code maxChunkSize} is first broken into sentence-packed pieces. When
 * the buffer is still below {@code minChunkSize} as the next paragraph overflows, leading sentences
 * of that paragraph top the buffer up; a buffer that cannot reach the minimum is dropped and
 * counted. A short trailing buffer is dropped as well, unless it would be the only chunk.
 */
public class FlowChunker {

  static final String OVERLAP_MARKER = "[...] ";

  private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\n\\s*\\n");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");
  private static final String PARAGRAPH_SEPARATOR = "\n\n";
  private static final int OVERLAP_SENTENCES_PER_PARAGRAPH = 2;

  private final ChunkerConfig config;
  private final SentenceSegmenter segmenter;

  public FlowChunker(ChunkerConfig config) {
    this(config, new SentenceSegmenter(config.maxChunkSize()));
  }

  public FlowChunker(ChunkerConfig config, SentenceSegmenter segmenter) {
    this.config = config;
    this.segmenter = segmenter;
  }

  /**
   * Chunks flat text into overlapping paragraph runs.
   *
   * @param text the document text
   * @param context document-level attributes stamped on each chunk
   * @param startIndex chunk index assigned to the first emitted chunk
   * @return emitted chunks and the number of dropped fragments
   */
  public ChunkingOutcome chunk(String text, DocumentContext context, int startIndex) {
    if (text == null || text.isBlank()) {
      return ChunkingOutcome.empty();
    }

    Deque<Unit> pending = new ArrayDeque<>(splitParagraphs(text));
    List<Chunk> chunks = new ArrayList<>();
    Buffer buffer = new Buffer();
    String overlap = "";
    int dropped = 0;

    while (!pending.isEmpty()) {
      Unit unit = pending.poll();

      if (buffer.isEmpty() || buffer.lengthWith(unit) <= config.maxChunkSize()) {
        buffer.add(unit);
        continue;
      }

      if (buffer.length() >= config.minChunkSize()) {
        chunks.add(emit(buffer, overlap, context, startIndex + chunks.size()));
        overlap = overlapFrom(buffer);
        buffer = new Buffer();
        buffer.add(unit);
        continue;
      }

      // Buffer too small to stand alone: borrow leading sentences of the overflowing paragraph.
      List<String> sentences = segmenter.segment(unit.text());
      int taken = 0;
      String head = "";
      while (taken < sentences.size()) {
        String sentence = sentences.get(taken);
        String candidate = head.isEmpty() ? sentence : head + " " + sentence;
        if (buffer.lengthWith(candidate) > config.maxChunkSize()) {
          break;
        }
        head = candidate;
        taken++;
      }

      if (taken == 0) {
        dropped++;
        buffer = new Buffer();
        buffer.add(unit);
      } else {
        buffer.add(new Unit(head, unit.paragraph()));
        if (taken < sentences.size()) {
          String rest = String.join(" ", sentences.subList(taken, sentences.size()));
          pending.push(new Unit(rest, unit.paragraph()));
        }
      }
    }

    if (!buffer.isEmpty()) {
      if (buffer.length() >= config.minChunkSize() || chunks.isEmpty()) {
        chunks.add(emit(buffer, overlap, context, startIndex + chunks.size()));
      } else {
        dropped++;
      }
    }

    return new ChunkingOutcome(chunks, dropped);
  }

  private Chunk emit(Buffer buffer, String overlap, DocumentContext context, int chunkIndex) {
    String body = buffer.text();
    ChunkMetadata metadata =
        ChunkMetadata.forParagraphs(
            context, chunkIndex, buffer.firstParagraph(), buffer.lastParagraph());
    return Chunk.of(overlap + body, metadata, KeywordExtractor.extract(body));
  }

  /** Builds the overlap that prefixes the chunk following the given buffer. */
  String overlapFrom(Buffer buffer) {
    if (config.contextWindow() == 0 || config.overlapSize() == 0) {
      return "";
    }
    List<Unit> units = buffer.units();
    int from = Math.max(0, units.size() - config.contextWindow());
    List<String> tails = new ArrayList<>();
    for (Unit unit : units.subList(from, units.size())) {
      String tail = segmenter.lastSentences(unit.text(), OVERLAP_SENTENCES_PER_PARAGRAPH);
      if (!tail.isEmpty()) {
        tails.add(tail);
      }
    }
    String context = String.join(PARAGRAPH_SEPARATOR, tails);

    List<String> words =
        Arrays.stream(WHITESPACE.split(context)).filter(w -> !w.isEmpty()).toList();
    if (words.isEmpty()) {
      return "";
    }
    if (words.size() > config.overlapSize()) {
      context = String.join(" ", words.subList(words.size() - config.overlapSize(), words.size()));
    }
    return OVERLAP_MARKER + context + PARAGRAPH_SEPARATOR;
  }

  /** Splits text into trimmed paragraphs, breaking oversized ones into sentence-packed pieces. */
  private List<Unit> splitParagraphs(String text) {
    List<Unit> units = new ArrayList<>();
    int paragraphIndex = 0;
    for (String raw : PARAGRAPH_BREAK.split(text)) {
      String paragraph = raw.trim();
      if (paragraph.isEmpty()) {
        continue;
      }
      if (paragraph.length() <= config.maxChunkSize()) {
        units.add(new Unit(paragraph, paragraphIndex));
      } else {
        for (String piece : packSentences(segmenter.segment(paragraph))) {
          units.add(new Unit(piece, paragraphIndex));
        }
      }
      paragraphIndex++;
    }
    return units;
  }

  private List<String> packSentences(List<String> sentences) {
    List<String> pieces = new ArrayList<>();
    StringBuilder current = new StringBuilder();
    for (String sentence : sentences) {
      if (!current.isEmpty() && current.length() + 1 + sentence.length() > config.maxChunkSize()) {
        pieces.add(current.toString());
        current.setLength(0);
      }
      if (!current.isEmpty()) {
        current.append(' ');
      }
      current.append(sentence);
    }
    if (!current.isEmpty()) {
      pieces.add(current.toString());
    }
    return pieces;
  }

  /** A paragraph, or a piece of one, tagged with the index of its source paragraph. */
  record Unit(String text, int paragraph) {}

  /** Accumulates units of the chunk under construction. */
  static final class Buffer {

    private final List<Unit> units = new ArrayList<>();
    private int length;

    boolean isEmpty() {
      return units.isEmpty();
    }

    int length() {
      return length;
    }

    int lengthWith(Unit unit) {
      return lengthWith(unit.text());
    }

    int lengthWith(String text) {
      return isEmpty() ? text.length() : length + PARAGRAPH_SEPARATOR.length() + text.length();
    }

    void add(Unit unit) {
      length = lengthWith(unit);
      units.add(unit);
    }

    List<Unit> units() {
      return units;
    }

    String text() {
      return String.join(PARAGRAPH_SEPARATOR, units.stream().map(Unit::text).toList());
    }

    int firstParagraph() {
      return units.get(0).paragraph();
    }

    int lastParagraph() {
      return units.get(units.size() - 1).paragraph();
    }
  }
}
