package dev.juris.ingestion.chunking;

import java.util.List;

/**
 * Chunks produced from one source plus the number of fragments that were too small to emit.
 *
 * @param chunks emitted chunks in order
 * @param droppedFragments fragments below the minimum chunk size that were discarded
 */
public record ChunkingOutcome(List<Chunk> chunks, int droppedFragments) {

  public ChunkingOutcome {
    chunks = List.copyOf(chunks);
  }

  public static ChunkingOutcome empty() {
    return new ChunkingOutcome(List.of(), 0);
  }
}
