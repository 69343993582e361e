package dev.juris.search;

import java.util.List;

/**
 * Occurrences of one query term in an indexed document.
 *
 * @param term the normalised query term
 * @param frequency number of occurrences in the document
 * @param positions token positions of the occurrences
 */
public record TermMatch(String term, int frequency, List<Integer> positions) {

  public TermMatch {
    positions = List.copyOf(positions);
  }
}
