package dev.juris.ingestion;

import dev.juris.ingestion.chunking.ChunkerConfig;
import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for document chunking.
 *
 * <p>Properties are bound from {@code juris.chunking.*} in application.yml.
 *
 * <ul>
 *   <li>{@code max-chunk-size} - maximum characters per chunk body (default 512, at least 100)
 *   <li>{@code min-chunk-size} - minimum characters for a chunk that is not the sole chunk of its
 *       unit (default 100)
 *   <li>{@code overlap-size} - maximum words carried between flow chunks (default 50)
 *   <li>{@code context-window} - paragraphs of a flow chunk that feed the overlap (default 2)
 *   <li>{@code preserve-structure} - chunk structured documents per section (default true)
 *   <li>{@code worker-threads} - pool size for batch chunking (default 4, bounded [1, 64])
 * </ul>
 */
@Configuration
@ConfigurationProperties(prefix = "juris.chunking")
public class ChunkingProperties {

  private int maxChunkSize = 512;
  private int minChunkSize = 100;
  private int overlapSize = 50;
  private int contextWindow = 2;
  private boolean preserveStructure = true;
  private int workerThreads = 4;

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    if (maxChunkSize < 100) {
      throw new IllegalStateException(
          "juris.chunking.max-chunk-size must be at least 100, got: " + maxChunkSize);
    }
    if (minChunkSize < 0 || minChunkSize > maxChunkSize) {
      throw new IllegalStateException(
          "juris.chunking.min-chunk-size must be in [0, max-chunk-size], got: " + minChunkSize);
    }
    if (overlapSize < 0 || contextWindow < 0) {
      throw new IllegalStateException(
          "juris.chunking.overlap-size and context-window must not be negative");
    }
    if (workerThreads < 1 || workerThreads > 64) {
      throw new IllegalStateException(
          "juris.chunking.worker-threads must be in [1, 64], got: " + workerThreads);
    }
  }

  public ChunkerConfig toConfig() {
    return new ChunkerConfig(
        maxChunkSize, overlapSize, contextWindow, minChunkSize, preserveStructure);
  }

  public int getMaxChunkSize() {
    return maxChunkSize;
  }

  public void setMaxChunkSize(int maxChunkSize) {
    this.maxChunkSize = maxChunkSize;
  }

  public int getMinChunkSize() {
    return minChunkSize;
  }

  public void setMinChunkSize(int minChunkSize) {
    this.minChunkSize = minChunkSize;
  }

  public int getOverlapSize() {
    return overlapSize;
  }

  public void setOverlapSize(int overlapSize) {
    this.overlapSize = overlapSize;
  }

  public int getContextWindow() {
    return contextWindow;
  }

  public void setContextWindow(int contextWindow) {
    this.contextWindow = contextWindow;
  }

  public boolean isPreserveStructure() {
    return preserveStructure;
  }

  public void setPreserveStructure(boolean preserveStructure) {
    this.preserveStructure = preserveStructure;
  }

  public int getWorkerThreads() {
    return workerThreads;
  }

  public void setWorkerThreads(int workerThreads) {
    this.workerThreads = workerThreads;
  }
}
