package org.learningjava.ees.application.usecase;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.learningjava.ees.application.port.EmbeddingStorePort;
import org.learningjava.ees.domain.model.embedding.SimilarEmbedding;
import org.learningjava.ees.domain.model.embedding.SimilarityMetric;
import org.learningjava.ees.domain.model.embedding.SimilarityQuery;
import org.learningjava.ees.domain.model.provider.EmbeddingResult;
import org.mockito.ArgumentCaptor;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class SearchEmbeddingsUseCaseTest {

    private EmbeddingProviderFacade provider;
    private EmbeddingStorePort store;
    private SearchEmbeddingsUseCase useCase;

    @BeforeEach
    void setUp() {
        provider = mock(EmbeddingProviderFacade.class);
        store = mock(EmbeddingStorePort.class);
        useCase = new SearchEmbeddingsUseCase(provider, store);
    }

    @Test
    void search_queriesTheModelThatEmbeddedTheQuery() {
        float[] q = {1f, 0f};
        when(provider.generateEmbedding("what is a vector", null))
                .thenReturn(new EmbeddingResult(q, "nomic-embed-text", "ollama", null));
        when(store.searchSimilar(any())).thenReturn(List.of());

        useCase.search("what is a vector", null, 5, 0.7, SimilarityMetric.DOT_PRODUCT);

        ArgumentCaptor<SimilarityQuery> cap = ArgumentCaptor.forClass(SimilarityQuery.class);
        verify(store).searchSimilar(cap.capture());
        SimilarityQuery sent = cap.getValue();
        assertSame(q, sent.queryEmbedding());
        assertEquals("nomic-embed-text", sent.modelName());
        assertEquals(5, sent.limit());
        assertEquals(0.7, sent.threshold());
        assertEquals(SimilarityMetric.DOT_PRODUCT, sent.metric());
    }

    @Test
    void search_returnsStoreHitsAsIs() {
        var hit = new SimilarEmbedding(1, "doc-1", "t", "m", 0.99, null, null);
        when(provider.generateEmbedding("q", "m")).thenReturn(new EmbeddingResult(new float[]{1f}, "m", "ollama", null));
        when(store.searchSimilar(any())).thenReturn(List.of(hit));

        assertEquals(List.of(hit), useCase.search("q", "m", 0, null, null));
    }

    @Test
    void search_blankQuery_isRejected() {
        assertThrows(IllegalArgumentException.class, () -> useCase.search(" ", null, 10, null, null));
        verifyNoInteractions(provider, store);
    }
}
