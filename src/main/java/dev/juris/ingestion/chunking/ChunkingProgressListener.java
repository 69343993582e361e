package dev.juris.ingestion.chunking;

/**
 * Receives progress updates while a document is being chunked.
 *
 * <p>Percentages grow monotonically from 0 to 100 within a single document.
 */
@FunctionalInterface
public interface ChunkingProgressListener {

  /** Listener that ignores all updates. */
  ChunkingProgressListener NONE = (percent, message) -> {};

  /**
   * Called when chunking reaches a new stage.
   *
   * @param percent completion between 0 and 100
   * @param message human-readable description of the current stage
   */
  void onProgress(int percent, String message);
}
