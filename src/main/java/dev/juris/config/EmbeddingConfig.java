package dev.juris.config;

import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.store.embedding.EmbeddingStore;
import dev.langchain4j.store.embedding.inmemory.InMemoryEmbeddingStore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configures the vector store used by hybrid search.
 *
 * <p>Embeddings are produced outside this application and arrive on the chunks, so no embedding
 * model is wired here. The default store keeps vectors in memory; a host application supplies its
 * own {@link EmbeddingStore} bean (pgvector, Elasticsearch...) to replace it.
 *
 * @see dev.juris.search.HybridSearchService
 */
@Configuration
public class EmbeddingConfig {

    /**
     * Provides the in-process vector store.
     *
     * @return an empty in-memory embedding store
     */
    @Bean
    @ConditionalOnMissingBean
    public EmbeddingStore<TextSegment> embeddingStore() {
        return new InMemoryEmbeddingStore<>();
    }
}
