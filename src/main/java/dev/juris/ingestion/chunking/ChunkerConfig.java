package dev.juris.ingestion.chunking;

/**
 * Size and overlap settings shared by the structural and flow chunkers.
 *
 * @param maxChunkSize maximum characters per chunk body, excluding the contextual prefix
 * @param overlapSize maximum number of words carried over between consecutive flow chunks
 * @param contextWindow number of trailing paragraphs of a flow chunk that feed the overlap
 * @param minChunkSize minimum characters for a chunk that is not the sole chunk of its unit
 * @param preserveStructure whether structured documents are chunked per section
 */
public record ChunkerConfig(
    int maxChunkSize,
    int overlapSize,
    int contextWindow,
    int minChunkSize,
    boolean preserveStructure) {

  static final int DEFAULT_MAX_CHUNK_SIZE = 512;
  static final int DEFAULT_OVERLAP_SIZE = 50;
  static final int DEFAULT_CONTEXT_WINDOW = 2;
  static final int DEFAULT_MIN_CHUNK_SIZE = 100;

  public ChunkerConfig {
    if (maxChunkSize < 100) {
      throw new IllegalArgumentException("maxChunkSize must be at least 100");
    }
    if (minChunkSize < 0 || minChunkSize > maxChunkSize) {
      throw new IllegalArgumentException(
          "minChunkSize must be in [0, maxChunkSize], got: " + minChunkSize);
    }
    if (overlapSize < 0) {
      throw new IllegalArgumentException("overlapSize must not be negative");
    }
    if (contextWindow < 0) {
      throw new IllegalArgumentException("contextWindow must not be negative");
    }
  }

  public static ChunkerConfig defaults() {
    return new ChunkerConfig(
        DEFAULT_MAX_CHUNK_SIZE,
        DEFAULT_OVERLAP_SIZE,
        DEFAULT_CONTEXT_WINDOW,
        DEFAULT_MIN_CHUNK_SIZE,
        true);
  }

  public ChunkerConfig withPreserveStructure(boolean preserve) {
    return new ChunkerConfig(maxChunkSize, overlapSize, contextWindow, minChunkSize, preserve);
  }
}
