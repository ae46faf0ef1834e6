package com.williamcallahan.competencysearch.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.williamcallahan.competencysearch.config.AppProperties;
import com.williamcallahan.competencysearch.domain.Competency;
import com.williamcallahan.competencysearch.domain.CompetencyFilter;
import com.williamcallahan.competencysearch.domain.CompetencyFixtures;
import com.williamcallahan.competencysearch.domain.Language;
import com.williamcallahan.competencysearch.domain.SearchMode;
import com.williamcallahan.competencysearch.domain.SearchQuery;
import com.williamcallahan.competencysearch.domain.SearchResult;
import com.williamcallahan.competencysearch.domain.SparseVector;
import com.williamcallahan.competencysearch.domain.errors.SearchFailureException;
import com.williamcallahan.competencysearch.domain.errors.StorageFailureException;
import com.williamcallahan.competencysearch.domain.errors.ValidationException;
import com.williamcallahan.competencysearch.service.encoding.EncodingService;
import com.williamcallahan.competencysearch.service.encoding.EncodingService.EncodedText;
import com.williamcallahan.competencysearch.service.filter.FilterTranslator;
import com.williamcallahan.competencysearch.service.filter.RetrievalPredicate;
import com.williamcallahan.competencysearch.service.store.ScoredCandidate;
import com.williamcallahan.competencysearch.service.store.VectorRepository;
import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Verifies search validation, branch fan-out, fusion and strict failure handling.
 */
class HybridSearchServiceTest {

    private static final float[] DENSE_QUERY = {0.1f, 0.2f, 0.3f};
    private static final SparseVector SPARSE_QUERY = new SparseVector(List.of(1L, 3L), List.of(1.0f, 1.0f));

    private EncodingService encodingService;
    private VectorRepository vectorRepository;
    private AppProperties appProperties;

    @BeforeEach
    void setUp() {
        encodingService = mock(EncodingService.class);
        vectorRepository = mock(VectorRepository.class);
        appProperties = new AppProperties();
        when(encodingService.encode(anyString(), anyBoolean(), anyBoolean()))
                .thenReturn(new EncodedText(DENSE_QUERY, SPARSE_QUERY));
        when(vectorRepository.getAll(any())).thenAnswer(invocation -> storedPayloads(invocation.getArgument(0)));
    }

    @Test
    void hybridQueriesBothBranchesAtOversampledDepthAndFuses() {
        when(vectorRepository.queryDense(eq(DENSE_QUERY), eq(6), any(RetrievalPredicate.class)))
                .thenReturn(List.of(new ScoredCandidate("a", 0.9), new ScoredCandidate("b", 0.7)));
        when(vectorRepository.querySparse(eq(SPARSE_QUERY), eq(6), any(RetrievalPredicate.class)))
                .thenReturn(List.of(new ScoredCandidate("a", 8.0), new ScoredCandidate("c", 2.0)));

        List<SearchResult> results = directService().search(new SearchQuery("Python", SearchMode.HYBRID, 2, null));

        assertEquals(2, results.size());
        assertEquals("a", results.get(0).identifier());
        assertEquals(1.0, results.get(0).score(), 1e-12);
        assertEquals("b", results.get(1).identifier());
        assertTrue(results.get(1).score() < 1.0);
        verify(encodingService).encode("Python", true, true);
    }

    @Test
    void semanticReturnsRawScoresAtDepthTop() {
        when(vectorRepository.queryDense(eq(DENSE_QUERY), eq(3), any(RetrievalPredicate.class)))
                .thenReturn(List.of(new ScoredCandidate("a", 0.83), new ScoredCandidate("b", 0.41)));

        List<SearchResult> results = directService().search(new SearchQuery("Python", SearchMode.SEMANTIC, 3, null));

        assertEquals(0.83, results.get(0).score(), 1e-12);
        verify(encodingService).encode("Python", true, false);
        verify(vectorRepository, never()).querySparse(any(), anyInt(), any());
    }

    @Test
    void sparseOnlyQueriesSparseBranch() {
        when(vectorRepository.querySparse(eq(SPARSE_QUERY), eq(4), any(RetrievalPredicate.class)))
                .thenReturn(List.of(new ScoredCandidate("c", 5.5)));

        List<SearchResult> results = directService().search(new SearchQuery("ESCO-S123", SearchMode.SPARSE, 4, null));

        assertEquals(List.of("c"), results.stream().map(SearchResult::identifier).toList());
        verify(vectorRepository, never()).queryDense(any(), anyInt(), any());
    }

    @Test
    void filtersReachTheStoreAsOnePredicate() {
        when(vectorRepository.queryDense(any(), anyInt(), any(RetrievalPredicate.class))).thenAnswer(invocation -> {
            RetrievalPredicate predicate = invocation.getArgument(2);
            assertEquals(1, predicate.conditions().size());
            assertEquals("lang", predicate.conditions().get(0).field());
            return List.of();
        });

        List<SearchResult> results = directService().search(
                new SearchQuery("Python", SearchMode.SEMANTIC, 5, List.of(CompetencyFilter.eq("lang", "fr"))));

        assertTrue(results.isEmpty());
    }

    @Test
    void unknownFilterFieldSkipsEncodingAndRetrieval() {
        List<SearchResult> results = directService().search(
                new SearchQuery("Python", SearchMode.HYBRID, 5, List.of(CompetencyFilter.eq("colour", "blue"))));

        assertTrue(results.isEmpty());
        verify(encodingService, never()).encode(anyString(), anyBoolean(), anyBoolean());
        verifyNoInteractions(vectorRepository);
    }

    @Test
    void hybridFailsWholeWhenOneBranchFails() {
        when(vectorRepository.queryDense(any(), anyInt(), any(RetrievalPredicate.class)))
                .thenReturn(List.of(new ScoredCandidate("a", 0.9)));
        when(vectorRepository.querySparse(any(), anyInt(), any(RetrievalPredicate.class)))
                .thenThrow(new StorageFailureException("Qdrant sparse query failed"));

        SearchFailureException failure = assertThrows(
                SearchFailureException.class,
                () -> directService().search(new SearchQuery("Python", SearchMode.HYBRID, 5, null)));

        assertEquals(1, failure.branchFailures().size());
        assertEquals(HybridSearchService.SPARSE_BRANCH, failure.branchFailures().get(0).branch());
        assertEquals("StorageFailureException", failure.branchFailures().get(0).failureType());
    }

    @Test
    void singleBranchRethrowsStorageFailure() {
        StorageFailureException storageFailure = new StorageFailureException("Qdrant dense query failed");
        when(vectorRepository.queryDense(any(), anyInt(), any(RetrievalPredicate.class))).thenThrow(storageFailure);

        StorageFailureException thrown = assertThrows(
                StorageFailureException.class,
                () -> directService().search(new SearchQuery("Python", SearchMode.SEMANTIC, 5, null)));

        assertSame(storageFailure, thrown);
    }

    @Test
    void hybridBranchTimeoutIsReported() {
        appProperties.getSearch().setQueryTimeout(Duration.ofMillis(50));
        when(vectorRepository.queryDense(any(), anyInt(), any(RetrievalPredicate.class))).thenAnswer(invocation -> {
            Thread.sleep(2_000);
            return List.of();
        });
        when(vectorRepository.querySparse(any(), anyInt(), any(RetrievalPredicate.class))).thenReturn(List.of());
        ExecutorService executorService = Executors.newFixedThreadPool(2);
        try {
            HybridSearchService hybridSearchService = new HybridSearchService(
                    encodingService, new FilterTranslator(), vectorRepository, executorService, appProperties);

            SearchFailureException failure = assertThrows(
                    SearchFailureException.class,
                    () -> hybridSearchService.search(new SearchQuery("Python", SearchMode.HYBRID, 5, null)));

            assertEquals("Timeout", failure.branchFailures().get(0).failureType());
        } finally {
            executorService.shutdownNow();
        }
    }

    @Test
    void hybridCancelsSlowBranchOnceTheOtherFails() {
        appProperties.getSearch().setQueryTimeout(Duration.ofSeconds(10));
        when(vectorRepository.queryDense(any(), anyInt(), any(RetrievalPredicate.class))).thenAnswer(invocation -> {
            Thread.sleep(2_000);
            return List.of();
        });
        when(vectorRepository.querySparse(any(), anyInt(), any(RetrievalPredicate.class)))
                .thenThrow(new StorageFailureException("Qdrant sparse query failed"));
        ExecutorService executorService = Executors.newFixedThreadPool(2);
        try {
            HybridSearchService hybridSearchService = new HybridSearchService(
                    encodingService, new FilterTranslator(), vectorRepository, executorService, appProperties);

            long startedAt = System.nanoTime();
            SearchFailureException failure = assertThrows(
                    SearchFailureException.class,
                    () -> hybridSearchService.search(new SearchQuery("Python", SearchMode.HYBRID, 5, null)));
            long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAt);

            assertTrue(elapsedMillis < 1_500, "hybrid waited " + elapsedMillis + "ms for the slow branch");
            Map<String, String> failureTypes = new LinkedHashMap<>();
            failure.branchFailures().forEach(branchFailure ->
                    failureTypes.put(branchFailure.branch(), branchFailure.failureType()));
            assertEquals(HybridSearchService.BRANCH_CANCELLED, failureTypes.get(HybridSearchService.DENSE_BRANCH));
            assertEquals("StorageFailureException", failureTypes.get(HybridSearchService.SPARSE_BRANCH));
        } finally {
            executorService.shutdownNow();
        }
    }

    @Test
    void saturatedExecutorFailsSingleBranchAsStorageFailure() {
        HybridSearchService hybridSearchService = rejectingService();

        StorageFailureException thrown = assertThrows(
                StorageFailureException.class,
                () -> hybridSearchService.search(new SearchQuery("Python", SearchMode.SEMANTIC, 5, null)));

        assertTrue(thrown.isRetryable());
        assertTrue(thrown.getCause() instanceof RejectedExecutionException);
        verify(vectorRepository, never()).queryDense(any(), anyInt(), any(RetrievalPredicate.class));
    }

    @Test
    void saturatedExecutorFailsHybridWithRejectedBranch() {
        HybridSearchService hybridSearchService = rejectingService();

        SearchFailureException failure = assertThrows(
                SearchFailureException.class,
                () -> hybridSearchService.search(new SearchQuery("Python", SearchMode.HYBRID, 5, null)));

        assertEquals(1, failure.branchFailures().size());
        assertEquals(HybridSearchService.DENSE_BRANCH, failure.branchFailures().get(0).branch());
        assertEquals(HybridSearchService.BRANCH_REJECTED, failure.branchFailures().get(0).failureType());
    }

    @Test
    void dropsCandidatesDeletedBeforeHydration() {
        when(vectorRepository.queryDense(any(), anyInt(), any(RetrievalPredicate.class)))
                .thenReturn(List.of(new ScoredCandidate("gone", 0.9), new ScoredCandidate("a", 0.8)));
        doReturn(Map.of("a", competency("a"))).when(vectorRepository).getAll(any());

        List<SearchResult> results = directService().search(new SearchQuery("Python", SearchMode.SEMANTIC, 5, null));

        assertEquals(List.of("a"), results.stream().map(SearchResult::identifier).toList());
    }

    @Test
    void rejectsInvalidQueries() {
        HybridSearchService hybridSearchService = directService();

        assertThrows(ValidationException.class,
                () -> hybridSearchService.search(new SearchQuery(" ", SearchMode.HYBRID, 5, null)));
        assertThrows(ValidationException.class,
                () -> hybridSearchService.search(new SearchQuery("Python", null, 5, null)));
        assertThrows(ValidationException.class,
                () -> hybridSearchService.search(new SearchQuery("Python", SearchMode.HYBRID, 0, null)));
        assertThrows(ValidationException.class,
                () -> hybridSearchService.search(new SearchQuery("Python", SearchMode.HYBRID, 101, null)));
        assertThrows(ValidationException.class,
                () -> hybridSearchService.search(new SearchQuery("x".repeat(10_001), SearchMode.HYBRID, 5, null)));
        verifyNoInteractions(vectorRepository);
    }

    private HybridSearchService directService() {
        return new HybridSearchService(
                encodingService, new FilterTranslator(), vectorRepository, Runnable::run, appProperties);
    }

    private HybridSearchService rejectingService() {
        Executor saturated = command -> {
            throw new RejectedExecutionException("search executor saturated");
        };
        return new HybridSearchService(
                encodingService, new FilterTranslator(), vectorRepository, saturated, appProperties);
    }

    private static Map<String, Competency> storedPayloads(Collection<String> identifiers) {
        Map<String, Competency> payloads = new LinkedHashMap<>();
        for (String identifier : identifiers) {
            payloads.put(identifier, competency(identifier));
        }
        return payloads;
    }

    private static Competency competency(String code) {
        return CompetencyFixtures.skill(code, Language.EN, "Skill " + code, null);
    }
}
