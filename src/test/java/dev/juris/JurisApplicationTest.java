package dev.juris;

import static org.assertj.core.api.Assertions.assertThat;

import dev.juris.document.LegalDocument;
import dev.juris.fixture.LegalDocumentBuilder;
import dev.juris.ingestion.ChunkingService;
import dev.juris.ingestion.chunking.Chunk;
import dev.juris.search.HybridSearchOptions;
import dev.juris.search.HybridSearchService;
import dev.juris.search.QueryType;
import dev.juris.search.SearchResult;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest
class JurisApplicationTest {

    @Autowired
    ChunkingService chunkingService;

    @Autowired
    HybridSearchService hybridSearchService;

    @AfterEach
    void clearIndices() {
        hybridSearchService.clear();
    }

    @Test
    void chunksIndexesAndSearchesEndToEnd() {
        LegalDocument constitution = new LegalDocumentBuilder()
                .id("cpeum")
                .title("Constitución Política de los Estados Unidos Mexicanos")
                .hierarchy(1)
                .article("123", "Del Trabajo y de la Previsión Social",
                        "Toda persona tiene derecho al trabajo digno y socialmente útil.")
                .article("1", null,
                        "Todas las personas gozarán de derechos, conforme al artículo 123.")
                .build();

        List<Chunk> chunks = chunkingService.chunkDocument(constitution);
        hybridSearchService.index(chunks);

        List<SearchResult> results = hybridSearchService.hybridSearch(
                "artículo 123 trabajo", null,
                HybridSearchOptions.topK(5).withQueryType(QueryType.CITATION));

        assertThat(chunks).hasSize(2);
        assertThat(chunks.get(1).relatedChunks()).containsExactly("cpeum_chunk_0");
        assertThat(results).isNotEmpty();
        assertThat(results.get(0).id()).isEqualTo("cpeum_chunk_0");
        assertThat(hybridSearchService.stats().keywordDocuments()).isEqualTo(2);
    }
}
