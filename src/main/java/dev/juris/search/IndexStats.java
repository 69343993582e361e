package dev.juris.search;

/**
 * Sizes of the two retrieval indices.
 *
 * @param keywordDocuments chunks held by the BM25 index
 * @param semanticDocuments chunks added to the vector store since the last clear
 */
public record IndexStats(int keywordDocuments, int semanticDocuments) {}
