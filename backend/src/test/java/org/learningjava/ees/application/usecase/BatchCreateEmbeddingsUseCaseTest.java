package org.learningjava.ees.application.usecase;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.learningjava.ees.domain.error.ProviderModelException;
import org.learningjava.ees.domain.error.StorageException;
import org.learningjava.ees.domain.model.batch.BatchItem;
import org.learningjava.ees.domain.model.batch.BatchItemResult;
import org.learningjava.ees.domain.model.batch.BatchResult;
import org.learningjava.ees.domain.model.embedding.SavedEmbedding;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class BatchCreateEmbeddingsUseCaseTest {

    private CreateEmbeddingUseCase create;
    private ThreadPoolTaskExecutor executor;
    private BatchCreateEmbeddingsUseCase useCase;
    private final AtomicLong ids = new AtomicLong();

    @BeforeEach
    void setUp() {
        create = mock(CreateEmbeddingUseCase.class);
        executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(4);
        executor.setThreadNamePrefix("batch-test-");
        executor.initialize();
        useCase = new BatchCreateEmbeddingsUseCase(create, executor);

        when(create.create(anyString(), anyString(), any())).thenAnswer(inv ->
                new SavedEmbedding(ids.incrementAndGet(), inv.getArgument(0), modelOr(inv.getArgument(2))));
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    private static String modelOr(String m) {
        return m == null ? "nomic-embed-text" : m;
    }

    @Test
    void emptyUriInTheMiddle_failsOnlyThatItem() {
        BatchResult r = useCase.run(List.of(
                new BatchItem("doc-1", "first"),
                new BatchItem("", "second"),
                new BatchItem("doc-3", "third")), null);

        assertEquals(3, r.total());
        assertEquals(2, r.successful());
        assertEquals(1, r.failed());

        List<BatchItemResult> results = r.results();
        assertTrue(results.get(0).success());
        assertEquals("doc-1", results.get(0).uri());
        assertFalse(results.get(1).success());
        assertTrue(results.get(1).error().contains("uri"));
        assertEquals("doc-3", results.get(2).uri());

        verify(create, never()).create(eq(""), anyString(), any());
    }

    @Test
    void emptyText_isRejectedLocally() {
        BatchResult r = useCase.run(List.of(new BatchItem("doc-1", "  ")), null);

        assertEquals(1, r.failed());
        assertTrue(r.results().get(0).error().contains("text"));
        verifyNoInteractions(create);
    }

    @Test
    void resultsComeBackInInputOrder_evenWhenEarlyItemsAreSlow() {
        when(create.create(eq("slow"), anyString(), any())).thenAnswer(inv -> {
            Thread.sleep(150);
            return new SavedEmbedding(ids.incrementAndGet(), "slow", "m");
        });

        List<BatchItem> items = new ArrayList<>();
        items.add(new BatchItem("slow", "t"));
        for (int i = 0; i < 10; i++) items.add(new BatchItem("fast-" + i, "t"));

        BatchResult r = useCase.run(items, "m");

        assertEquals(items.size(), r.total());
        for (int i = 0; i < items.size(); i++) {
            assertEquals(items.get(i).uri(), r.results().get(i).uri());
        }
    }

    @Test
    void duplicateUris_runInInputOrder_soLastEntryWins() {
        List<String> seen = Collections.synchronizedList(new ArrayList<>());
        when(create.create(eq("dup"), anyString(), any())).thenAnswer(inv -> {
            String text = inv.getArgument(1);
            if (text.equals("v1")) Thread.sleep(100);
            seen.add(text);
            return new SavedEmbedding(1, "dup", "m");
        });

        BatchResult r = useCase.run(List.of(
                new BatchItem("dup", "v1"),
                new BatchItem("other", "x"),
                new BatchItem("dup", "v2"),
                new BatchItem("dup", "v3")), "m");

        assertEquals(4, r.successful());
        assertEquals(List.of("v1", "v2", "v3"), seen);
    }

    @Test
    void providerAndStorageFailures_becomeFailureResults() {
        when(create.create(eq("no-model"), anyString(), any()))
                .thenThrow(new ProviderModelException("ollama", "ghost", "Model not found: ghost"));
        when(create.create(eq("bad-dim"), anyString(), any()))
                .thenThrow(new StorageException("Dimension mismatch"));

        BatchResult r = useCase.run(List.of(
                new BatchItem("no-model", "t"),
                new BatchItem("ok", "t"),
                new BatchItem("bad-dim", "t")), null);

        assertEquals(3, r.total());
        assertEquals(1, r.successful());
        assertEquals(2, r.failed());
        assertEquals(r.total(), r.successful() + r.failed());
        assertTrue(r.results().get(0).error().contains("ghost"));
        assertTrue(r.results().get(2).error().contains("Dimension"));
    }

    @Test
    void itemModel_overridesBatchModel() {
        useCase.run(List.of(
                new BatchItem("a", "t", "bge-m3"),
                new BatchItem("b", "t")), "nomic-embed-text");

        verify(create).create("a", "t", "bge-m3");
        verify(create).create("b", "t", "nomic-embed-text");
    }

    @Test
    void emptyBatch_isEmptyResult() {
        BatchResult r = useCase.run(List.of(), null);
        assertEquals(0, r.total());
        assertEquals(0, r.failed());
    }
}
