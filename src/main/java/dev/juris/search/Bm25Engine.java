package dev.juris.search;

import dev.juris.ingestion.chunking.ChunkMetadata;
import dev.langchain4j.data.document.Metadata;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * In-memory inverted index with Okapi BM25 scoring tuned for Spanish legal text.
 *
 * <p>Scoring uses {@code k1 = 1.2} and {@code b = 0.75} with {@code idf = ln((N - df + 0.5) / (df +
 * 0.5))}. The idf of a term that appears in half or more of the corpus is non-positive under this
 * formula; it is floored at {@link #MIN_IDF} so such a term still counts as a (weak) match instead
 * of cancelling the contribution of rarer terms. Documents whose boosted score is not positive are
 * discarded.
 *
 * <p>The index is the only shared mutable state of the retrieval core. Writers ({@link
 * #addDocument}, {@link #clear}) take the write lock and searches take the read lock, so concurrent
 * searches proceed in parallel and never observe a half-applied update. The average document length
 * is maintained as a running sum.
 */
@Component
public class Bm25Engine {

  private static final Logger log = LoggerFactory.getLogger(Bm25Engine.class);

  static final double K1 = 1.2;
  static final double B = 0.75;

  /** Lower bound for the idf of a matched term. */
  static final double MIN_IDF = 0.01;

  private static final double DAYS_PER_YEAR = 365.0;
  private static final int MAX_AUTHORITY = 8;

  private static final Pattern NON_TOKEN_CHARS = Pattern.compile("[^a-z0-9_\\sáéíóúñü]");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private static final Set<String> STOP_WORDS =
      Set.of(
          "el", "la", "de", "que", "y", "a", "en", "un", "es", "se", "no", "te", "lo", "le", "da",
          "su", "por", "son", "con", "para", "al", "del", "los", "las", "uno", "una", "ser",
          "estar", "tener", "hacer", "todo", "pero", "más", "poder", "ir", "saber", "ver", "dar",
          "como", "cuando", "donde", "quien", "cual", "cuyo", "cuya");

  private final Clock clock;
  private final ReadWriteLock lock = new ReentrantReadWriteLock();

  private final Map<String, IndexedDocument> documents = new LinkedHashMap<>();
  private final Map<String, Integer> documentFrequencies = new HashMap<>();
  private long totalTokens;

  public Bm25Engine(Clock clock) {
    this.clock = clock;
  }

  /**
   * Indexes a document, replacing any previous document with the same id.
   *
   * @param id document id
   * @param content text to index
   * @param metadata metadata used for boosting ({@code hierarchy}, {@code lastUpdated}); may be
   *     null
   */
  public void addDocument(String id, String content, @Nullable Metadata metadata) {
    List<String> tokens = tokenize(content);
    Map<String, Integer> termFrequencies = new HashMap<>();
    for (String token : tokens) {
      termFrequencies.merge(token, 1, Integer::sum);
    }
    IndexedDocument document =
        new IndexedDocument(
            id,
            content,
            tokens,
            termFrequencies,
            metadata != null ? metadata.copy() : new Metadata());

    lock.writeLock().lock();
    try {
      IndexedDocument previous = documents.put(id, document);
      if (previous != null) {
        unregister(previous);
      }
      for (String term : termFrequencies.keySet()) {
        documentFrequencies.merge(term, 1, Integer::sum);
      }
      totalTokens += tokens.size();
    } finally {
      lock.writeLock().unlock();
    }
  }

  /**
   * Ranks indexed documents against a query.
   *
   * @param query free-text query
   * @param topK maximum number of results
   * @param boost boost factors; {@link BoostFactors#NONE} disables boosting
   * @return results sorted by score descending; empty when the index is empty or no term matches
   */
  public List<KeywordSearchResult> search(String query, int topK, BoostFactors boost) {
    List<String> queryTerms = tokenize(query);
    if (queryTerms.isEmpty() || topK <= 0) {
      return List.of();
    }
    Set<String> distinctTerms = new LinkedHashSet<>(queryTerms);

    lock.readLock().lock();
    try {
      if (documents.isEmpty()) {
        return List.of();
      }
      double averageLength = (double) totalTokens / documents.size();
      Instant now = clock.instant();
      List<KeywordSearchResult> results = new ArrayList<>();

      for (IndexedDocument document : documents.values()) {
        double score = 0.0;
        List<TermMatch> matches = new ArrayList<>();

        for (String term : distinctTerms) {
          int frequency = document.termFrequencies().getOrDefault(term, 0);
          if (frequency == 0) {
            continue;
          }
          score += termScore(frequency, documentFrequencies.get(term), document, averageLength);
          matches.add(new TermMatch(term, frequency, positions(document.tokens(), term)));
        }

        if (score <= 0.0) {
          continue;
        }
        double boosted = score * boostFactor(document, queryTerms, boost, now);
        if (boosted > 0.0) {
          results.add(
              new KeywordSearchResult(
                  document.id(), document.content(), boosted, document.metadata().copy(), matches));
        }
      }

      results.sort(Comparator.comparingDouble(KeywordSearchResult::score).reversed());
      log.debug("BM25 query '{}' matched {} documents", query, results.size());
      return results.size() > topK ? List.copyOf(results.subList(0, topK)) : results;
    } finally {
      lock.readLock().unlock();
    }
  }

  /** Removes every document and resets all statistics. */
  public void clear() {
    lock.writeLock().lock();
    try {
      documents.clear();
      documentFrequencies.clear();
      totalTokens = 0;
    } finally {
      lock.writeLock().unlock();
    }
  }

  /** Number of indexed documents. */
  public int size() {
    lock.readLock().lock();
    try {
      return documents.size();
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * Normalises text into index terms: lower case, punctuation replaced by spaces (accented Spanish
   * letters kept), tokens of two characters or fewer and stop words removed.
   */
  static List<String> tokenize(@Nullable String text) {
    if (text == null || text.isBlank()) {
      return List.of();
    }
    String normalised = NON_TOKEN_CHARS.matcher(text.toLowerCase(Locale.ROOT)).replaceAll(" ");
    List<String> tokens = new ArrayList<>();
    for (String token : WHITESPACE.split(normalised)) {
      if (token.length() > 2 && !STOP_WORDS.contains(token)) {
        tokens.add(token);
      }
    }
    return tokens;
  }

  private double termScore(
      int frequency, int documentFrequency, IndexedDocument document, double averageLength) {
    int corpusSize = documents.size();
    double idf = Math.log((corpusSize - documentFrequency + 0.5) / (documentFrequency + 0.5));
    idf = Math.max(idf, MIN_IDF);
    double lengthRatio = averageLength > 0 ? document.tokens().size() / averageLength : 0.0;
    double numerator = frequency * (K1 + 1);
    double denominator = frequency + K1 * (1 - B + B * lengthRatio);
    return idf * (numerator / denominator);
  }

  private double boostFactor(
      IndexedDocument document, List<String> queryTerms, BoostFactors boost, Instant now) {
    double factor = 1.0;

    if (boost.exactMatch() > 0.0 && hasExactMatch(document.tokens(), queryTerms)) {
      factor *= boost.exactMatch();
    }

    Integer hierarchy = document.metadata().getInteger(ChunkMetadata.KEY_HIERARCHY);
    if (boost.hierarchy() > 0.0 && hierarchy != null && hierarchy > 0) {
      factor *= 1 + (MAX_AUTHORITY - hierarchy) * boost.hierarchy() * 0.1;
    }

    if (boost.recency() > 0.0) {
      Instant updated = parseDate(document.metadata().getString(ChunkMetadata.KEY_LAST_UPDATED));
      if (updated != null) {
        double days = Math.max(0.0, Duration.between(updated, now).toMillis() / 86_400_000.0);
        factor *= 1 + Math.exp(-days / DAYS_PER_YEAR) * boost.recency();
      }
    }

    return factor;
  }

  /** True when the query has more than one term and all of them appear contiguously in order. */
  static boolean hasExactMatch(List<String> documentTokens, List<String> queryTerms) {
    if (queryTerms.size() <= 1) {
      return false;
    }
    return Collections.indexOfSubList(documentTokens, queryTerms) >= 0;
  }

  private static List<Integer> positions(List<String> tokens, String term) {
    List<Integer> positions = new ArrayList<>();
    for (int i = 0; i < tokens.size(); i++) {
      if (tokens.get(i).equals(term)) {
        positions.add(i);
      }
    }
    return positions;
  }

  private void unregister(IndexedDocument document) {
    for (String term : document.termFrequencies().keySet()) {
      documentFrequencies.computeIfPresent(term, (t, df) -> df > 1 ? df - 1 : null);
    }
    totalTokens -= document.tokens().size();
  }

  private static @Nullable Instant parseDate(@Nullable String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    try {
      return Instant.parse(value);
    } catch (DateTimeParseException notAnInstant) {
      try {
        return OffsetDateTime.parse(value).toInstant();
      } catch (DateTimeParseException notAnOffsetDateTime) {
        try {
          return LocalDate.parse(value).atStartOfDay(ZoneOffset.UTC).toInstant();
        } catch (DateTimeParseException notADate) {
          log.debug("Ignoring unparseable lastUpdated value: {}", value);
          return null;
        }
      }
    }
  }

  private record IndexedDocument(
      String id,
      String content,
      List<String> tokens,
      Map<String, Integer> termFrequencies,
      Metadata metadata) {}
}
