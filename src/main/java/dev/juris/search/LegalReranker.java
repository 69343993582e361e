package dev.juris.search;

import dev.juris.document.LegalArea;
import dev.juris.ingestion.chunking.ChunkMetadata;
import dev.langchain4j.data.document.Metadata;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;
import org.springframework.stereotype.Component;

/**
 * Final ranking stage applying legal-domain boosts to fused results.
 *
 * <p>Each result's score is multiplied by:
 *
 * <ul>
 *   <li>{@value #AREA_BOOST} when its {@code legalArea} matches the requested area
 *   <li>{@value #CONSTITUTIONAL_BOOST} when it comes from a constitutional-level document
 *   <li>{@value #CITATION_BOOST} for citation queries that mention the result's article number
 *   <li>{@value #LEGAL_TERM_BOOST} for every distinct legal reference of the query (article,
 *       fracción, inciso, párrafo) found in its content
 * </ul>
 */
@Component
public class LegalReranker {

  static final double AREA_BOOST = 1.2;
  static final double CONSTITUTIONAL_BOOST = 1.3;
  static final double CITATION_BOOST = 1.5;
  static final double LEGAL_TERM_BOOST = 1.1;

  private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

  private static final List<Pattern> LEGAL_TERM_PATTERNS =
      List.of(
          Pattern.compile("\\b(?:artículo|art\\.?)\\s+(\\d+(?:\\.\\d+)*)\\b", FLAGS),
          Pattern.compile("\\b(?:fracción|frac\\.?)\\s+([IVX]+|\\d+)\\b", FLAGS),
          Pattern.compile("\\b(?:inciso|inc\\.?)\\s+([a-z]|\\d+)\\b", FLAGS),
          Pattern.compile("(?:\\bpárrafo|¶)\\s+(\\d+)\\b", FLAGS));

  /**
   * Re-scores and re-sorts fused results.
   *
   * @param results fused results
   * @param query original query text
   * @param queryType query category; only {@link QueryType#CITATION} has an effect here
   * @param legalArea requested area, or null for no area preference
   * @return results sorted by boosted score descending
   */
  public List<SearchResult> rerank(
      List<SearchResult> results,
      String query,
      @Nullable QueryType queryType,
      @Nullable LegalArea legalArea) {
    if (results.isEmpty()) {
      return List.of();
    }
    String lowerQuery = query.toLowerCase(Locale.ROOT);
    List<Pattern> legalTerms =
        extractLegalTerms(query).stream().map(LegalReranker::termPattern).toList();

    return results.stream()
        .map(r -> r.withScore(r.score() * boost(r, lowerQuery, legalTerms, queryType, legalArea)))
        .sorted(Comparator.comparingDouble(SearchResult::score).reversed())
        .toList();
  }

  private static double boost(
      SearchResult result,
      String lowerQuery,
      List<Pattern> legalTerms,
      @Nullable QueryType queryType,
      @Nullable LegalArea legalArea) {
    Metadata metadata = result.metadata();
    double boost = 1.0;

    if (legalArea != null
        && legalArea.value().equals(metadata.getString(ChunkMetadata.KEY_LEGAL_AREA))) {
      boost *= AREA_BOOST;
    }

    Integer hierarchy = metadata.getInteger(ChunkMetadata.KEY_HIERARCHY);
    if (hierarchy != null && hierarchy == 1) {
      boost *= CONSTITUTIONAL_BOOST;
    }

    String article = metadata.getString(ChunkMetadata.KEY_ARTICLE);
    if (queryType == QueryType.CITATION && article != null && mentions(lowerQuery, article)) {
      boost *= CITATION_BOOST;
    }

    String lowerContent = result.content().toLowerCase(Locale.ROOT);
    for (Pattern term : legalTerms) {
      if (term.matcher(lowerContent).find()) {
        boost *= LEGAL_TERM_BOOST;
      }
    }
    return boost;
  }

  /** Article numbers must match whole numbers: article "12" is not mentioned by "123". */
  private static boolean mentions(String lowerQuery, String article) {
    String number = article.trim().toLowerCase(Locale.ROOT);
    if (number.isEmpty()) {
      return false;
    }
    int from = lowerQuery.indexOf(number);
    while (from >= 0) {
      int end = from + number.length();
      boolean digitBefore = from > 0 && Character.isDigit(lowerQuery.charAt(from - 1));
      boolean digitAfter = end < lowerQuery.length() && Character.isDigit(lowerQuery.charAt(end));
      if (!digitBefore && !digitAfter) {
        return true;
      }
      from = lowerQuery.indexOf(number, from + 1);
    }
    return false;
  }

  /** Matches a lower-cased legal reference that is not part of a longer number or word. */
  private static Pattern termPattern(String term) {
    return Pattern.compile("(?<![\\p{L}\\d])" + Pattern.quote(term) + "(?![\\p{L}\\d])");
  }

  /** Distinct legal references of the query, lower-cased, in order of appearance per pattern. */
  static Set<String> extractLegalTerms(String query) {
    Set<String> terms = new LinkedHashSet<>();
    for (Pattern pattern : LEGAL_TERM_PATTERNS) {
      Matcher matcher = pattern.matcher(query);
      while (matcher.find()) {
        terms.add(matcher.group().toLowerCase(Locale.ROOT));
      }
    }
    return terms;
  }
}
