package dev.juris.ingestion.chunking;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Legal-aware sentence splitter.
 *
 * <p>Periods of common legal abbreviations ({@code Art.}, {@code Inc.}, {@code Frac.}, {@code
 * frac.}, {@code Núm.}, {@code párr.}) are masked before splitting so that "Art. 123" never ends a
 * sentence. Sentences end at {@code .}, {@code !} or {@code ?} followed by whitespace and an upper
 * case (possibly accented) letter.
 *
 * <p>Every returned unit is at most {@code floor(0.8 * maxChunkSize)} characters long: longer
 * sentences are re-split at word boundaries, and a single word that is still too long is cut at the
 * character level. Packing steps downstream can therefore always make progress.
 */
public class SentenceSegmenter {

  private static final char MASK = '\uE000';

  private static final Pattern ABBREVIATION =
      Pattern.compile("\\b(Art|Inc|Frac|frac|Núm|párr)\\.");

  private static final Pattern SENTENCE_BOUNDARY =
      Pattern.compile("(?<=[.!?])\\s+(?=[A-ZÁÉÍÓÚÑ])");

  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private final int maxUnitLength;

  public SentenceSegmenter(int maxChunkSize) {
    if (maxChunkSize < 2) {
      throw new IllegalArgumentException("maxChunkSize must be at least 2");
    }
    this.maxUnitLength = (int) Math.floor(maxChunkSize * 0.8);
  }

  /** Longest unit this segmenter emits. */
  public int maxUnitLength() {
    return maxUnitLength;
  }

  /**
   * Splits text into sentence-like units.
   *
   * @param text the text to split
   * @return ordered units, never empty: the input itself is returned when no unit remains
   */
  public List<String> segment(String text) {
    String masked = ABBREVIATION.matcher(text).replaceAll("$1" + MASK);

    List<String> result = new ArrayList<>();
    for (String raw : SENTENCE_BOUNDARY.split(masked)) {
      String sentence = raw.replace(MASK, '.').trim();
      if (sentence.isEmpty()) {
        continue;
      }
      if (sentence.length() > maxUnitLength) {
        result.addAll(splitAtWords(sentence));
      } else {
        result.add(sentence);
      }
    }

    return result.isEmpty() ? List.of(text) : result;
  }

  /**
   * Returns the last {@code count} sentences of a text, joined by a space.
   *
   * @param text the text to take sentences from
   * @param count how many trailing sentences to keep
   * @return the trailing sentences; the whole text if it has fewer
   */
  public String lastSentences(String text, int count) {
    List<String> sentences = segment(text);
    int from = Math.max(0, sentences.size() - count);
    return String.join(" ", sentences.subList(from, sentences.size())).trim();
  }

  private List<String> splitAtWords(String sentence) {
    List<String> parts = new ArrayList<>();
    List<String> words =
        Arrays.stream(WHITESPACE.split(sentence)).filter(w -> !w.isEmpty()).toList();
    StringBuilder current = new StringBuilder();

    for (String word : words) {
      if (word.length() > maxUnitLength) {
        if (!current.isEmpty()) {
          parts.add(current.toString());
          current.setLength(0);
        }
        parts.addAll(splitAtCharacters(word));
      } else if (!current.isEmpty() && current.length() + 1 + word.length() > maxUnitLength) {
        parts.add(current.toString());
        current.setLength(0);
        current.append(word);
      } else {
        if (!current.isEmpty()) {
          current.append(' ');
        }
        current.append(word);
      }
    }

    if (!current.isEmpty()) {
      parts.add(current.toString());
    }
    return parts;
  }

  private List<String> splitAtCharacters(String word) {
    List<String> pieces = new ArrayList<>();
    for (int i = 0; i < word.length(); i += maxUnitLength) {
      pieces.add(word.substring(i, Math.min(word.length(), i + maxUnitLength)));
    }
    return pieces;
  }
}
