package dev.juris.ingestion.chunking;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Links chunks that cite an article to the chunks holding that article.
 *
 * <p>For every chunk, article citations in its content ({@code "artículo 27"}, {@code "art. 5"})
 * are resolved against the {@code article} metadata of the other chunks of the same document. Each
 * match adds the target id to the citing chunk's {@code relatedChunks}; the link is directional.
 * Parts of the same section never link to each other, since their shared prefix names their own
 * article.
 *
 * <p>Lookups go through an article-number index, so a pass costs one scan per citation rather than
 * one scan of the whole set. Chunks from different documents are linked within their own document
 * only.
 */
public class CrossReferenceLinker {

  /**
   * Returns the chunk set with cross-references attached.
   *
   * @param chunks chunks of one or more documents, in order
   * @return new chunk records in the same order; chunks without citations keep an empty list
   */
  public List<Chunk> link(List<Chunk> chunks) {
    if (chunks.isEmpty()) {
      return List.of();
    }

    Map<String, Map<String, List<Chunk>>> indexByDocument = new LinkedHashMap<>();
    for (Chunk chunk : chunks) {
      String article = chunk.metadata().article();
      if (article == null || article.isBlank()) {
        continue;
      }
      indexByDocument
          .computeIfAbsent(chunk.documentId(), id -> new LinkedHashMap<>())
          .computeIfAbsent(article.trim(), number -> new ArrayList<>())
          .add(chunk);
    }

    List<Chunk> linked = new ArrayList<>(chunks.size());
    for (Chunk chunk : chunks) {
      Map<String, List<Chunk>> articleIndex =
          indexByDocument.getOrDefault(chunk.documentId(), Map.of());
      Set<String> related = new LinkedHashSet<>();
      for (String article : LegalCitations.citedArticles(chunk.content())) {
        for (Chunk target : articleIndex.getOrDefault(article, List.of())) {
          if (!isSameSource(chunk, target)) {
            related.add(target.id());
          }
        }
      }
      linked.add(chunk.withRelatedChunks(new ArrayList<>(related)));
    }
    return linked;
  }

  private static boolean isSameSource(Chunk chunk, Chunk target) {
    if (chunk.id().equals(target.id())) {
      return true;
    }
    String originalId = chunk.metadata().originalId();
    return originalId != null && Objects.equals(originalId, target.metadata().originalId());
  }
}
