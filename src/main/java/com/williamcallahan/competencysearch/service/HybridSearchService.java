package com.williamcallahan.competencysearch.service;

import com.williamcallahan.competencysearch.config.AppProperties;
import com.williamcallahan.competencysearch.config.SearchTuning;
import com.williamcallahan.competencysearch.domain.Competency;
import com.williamcallahan.competencysearch.domain.SearchMode;
import com.williamcallahan.competencysearch.domain.SearchQuery;
import com.williamcallahan.competencysearch.domain.SearchResult;
import com.williamcallahan.competencysearch.domain.errors.SearchFailureException;
import com.williamcallahan.competencysearch.domain.errors.StorageFailureException;
import com.williamcallahan.competencysearch.domain.errors.ValidationException;
import com.williamcallahan.competencysearch.service.encoding.EncodingService;
import com.williamcallahan.competencysearch.service.encoding.EncodingService.EncodedText;
import com.williamcallahan.competencysearch.service.filter.FilterTranslator;
import com.williamcallahan.competencysearch.service.filter.RetrievalPredicate;
import com.williamcallahan.competencysearch.service.store.ScoredCandidate;
import com.williamcallahan.competencysearch.service.store.VectorRepository;
import com.williamcallahan.competencysearch.support.FailureMessages;
import com.williamcallahan.competencysearch.support.RetrievalErrorClassifier;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Executes semantic, sparse and hybrid searches over the competency store.
 *
 * <p>A search validates its input, compiles the filters once into a predicate shared by every
 * branch, encodes the query, queries the store, fuses rankings with reciprocal rank fusion in hybrid
 * mode, truncates to {@code top} and hydrates the survivors with one batch read. Hybrid mode queries
 * both branches concurrently, each {@code app.search.oversample-factor × top} deep, and fails as a
 * whole when either branch fails: results are never silently degraded to one branch.</p>
 */
@Service
public class HybridSearchService {
    private static final Logger log = LoggerFactory.getLogger(HybridSearchService.class);

    static final String DENSE_BRANCH = "dense";
    static final String SPARSE_BRANCH = "sparse";
    static final String BRANCH_TIMEOUT = "Timeout";
    static final String BRANCH_REJECTED = "Rejected";
    static final String BRANCH_CANCELLED = "Cancelled";
    static final String BRANCH_INTERRUPTED = "Interrupted";

    private final EncodingService encodingService;
    private final FilterTranslator filterTranslator;
    private final VectorRepository vectorRepository;
    private final Executor executor;
    private final SearchTuning searchTuning;

    /**
     * Wires encoding, filtering and storage dependencies for search.
     *
     * @param encodingService dense and sparse query encoding
     * @param filterTranslator filter compiler
     * @param vectorRepository vector store port
     * @param executor bounded executor for branch fan-out
     * @param appProperties application configuration
     */
    public HybridSearchService(
            EncodingService encodingService,
            FilterTranslator filterTranslator,
            VectorRepository vectorRepository,
            @Qualifier("searchTaskExecutor") Executor executor,
            AppProperties appProperties) {
        this.encodingService = Objects.requireNonNull(encodingService, "encodingService");
        this.filterTranslator = Objects.requireNonNull(filterTranslator, "filterTranslator");
        this.vectorRepository = Objects.requireNonNull(vectorRepository, "vectorRepository");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.searchTuning = Objects.requireNonNull(appProperties, "appProperties").getSearch();
    }

    /**
     * Runs a search.
     *
     * @param query text, mode, result count and filters
     * @return at most {@code top} results by descending score
     * @throws ValidationException when the query or a filter is malformed
     * @throws com.williamcallahan.competencysearch.domain.errors.EncodingFailureException when encoding fails
     * @throws StorageFailureException when a single-branch query or the hydration read fails
     * @throws SearchFailureException when a hybrid branch fails
     */
    public List<SearchResult> search(SearchQuery query) {
        validate(query);
        RetrievalPredicate predicate = filterTranslator.translate(query.filters());
        if (predicate.matchesNothing()) {
            log.debug("[SEARCH] Filters match nothing; skipping retrieval");
            return List.of();
        }

        SearchMode mode = query.mode();
        EncodedText encodedQuery = encodingService.encode(query.text(), mode.usesDense(), mode.usesSparse());

        List<RankedIdentifier> ranked = switch (mode) {
            case SEMANTIC -> singleBranch(
                    DENSE_BRANCH,
                    () -> vectorRepository.queryDense(encodedQuery.denseVector(), query.top(), predicate));
            case SPARSE -> singleBranch(
                    SPARSE_BRANCH,
                    () -> vectorRepository.querySparse(encodedQuery.sparseVector(), query.top(), predicate));
            case HYBRID -> hybrid(encodedQuery, query.top(), predicate);
        };

        List<RankedIdentifier> survivors = ranked.size() <= query.top() ? ranked : ranked.subList(0, query.top());
        List<SearchResult> results = hydrate(survivors);
        log.debug(
                "[SEARCH] mode={} top={} filters={} results={}",
                mode.token(),
                query.top(),
                query.filters().size(),
                results.size());
        return results;
    }

    private void validate(SearchQuery query) {
        if (query == null) {
            throw new ValidationException("Search query is required");
        }
        if (query.text() == null || query.text().isBlank()) {
            throw new ValidationException("Search text must not be blank");
        }
        if (query.text().length() > searchTuning.getMaxTextLength()) {
            throw new ValidationException(
                    "Search text must not exceed " + searchTuning.getMaxTextLength() + " characters");
        }
        if (query.mode() == null) {
            throw new ValidationException("Search type is required");
        }
        if (query.top() < 1 || query.top() > searchTuning.getMaxTop()) {
            throw new ValidationException("top must be between 1 and " + searchTuning.getMaxTop());
        }
    }

    private List<RankedIdentifier> singleBranch(String branch, Supplier<List<ScoredCandidate>> branchQuery) {
        BranchOutcome outcome = runBranches(Map.of(branch, branchQuery));
        if (!outcome.failures().isEmpty()) {
            SearchFailureException.BranchFailure failure = outcome.failures().get(0);
            if (outcome.storageFailure() != null) {
                throw outcome.storageFailure();
            }
            throw new StorageFailureException(
                    failure.branch() + " retrieval failed: " + failure.failureType() + " " + failure.failureDetails());
        }
        List<RankedIdentifier> ranked = new ArrayList<>();
        for (ScoredCandidate candidate : outcome.results().get(branch)) {
            ranked.add(new RankedIdentifier(candidate.identifier(), candidate.score()));
        }
        return ranked;
    }

    private List<RankedIdentifier> hybrid(EncodedText encodedQuery, int top, RetrievalPredicate predicate) {
        int depth = searchTuning.getOversampleFactor() * top;
        Map<String, Supplier<List<ScoredCandidate>>> branchQueries = new LinkedHashMap<>();
        branchQueries.put(
                DENSE_BRANCH, () -> vectorRepository.queryDense(encodedQuery.denseVector(), depth, predicate));
        branchQueries.put(
                SPARSE_BRANCH, () -> vectorRepository.querySparse(encodedQuery.sparseVector(), depth, predicate));

        BranchOutcome outcome = runBranches(branchQueries);
        if (!outcome.failures().isEmpty()) {
            throw new SearchFailureException(
                    "Hybrid retrieval failed for " + outcome.failures().size() + " branch(es)", outcome.failures());
        }

        List<ReciprocalRankFusion.FusedCandidate> fused = ReciprocalRankFusion.fuse(
                outcome.results().get(DENSE_BRANCH), outcome.results().get(SPARSE_BRANCH), searchTuning.getRrfK());
        log.debug("[SEARCH] Fused {} candidates at depth {}", fused.size(), depth);
        List<RankedIdentifier> ranked = new ArrayList<>(fused.size());
        for (ReciprocalRankFusion.FusedCandidate candidate : fused) {
            ranked.add(new RankedIdentifier(candidate.identifier(), candidate.score()));
        }
        return ranked;
    }

    /**
     * Starts every branch query on the executor and joins them under one shared deadline.
     *
     * <p>The join returns as soon as any branch fails; branches still running at that point are
     * cancelled and reported, since the request cannot succeed anymore.</p>
     */
    private BranchOutcome runBranches(Map<String, Supplier<List<ScoredCandidate>>> branchQueries) {
        Map<String, CompletableFuture<List<ScoredCandidate>>> futures = new LinkedHashMap<>();
        List<SearchFailureException.BranchFailure> failures = new ArrayList<>();
        StorageFailureException storageFailure = null;
        for (Map.Entry<String, Supplier<List<ScoredCandidate>>> branchQuery : branchQueries.entrySet()) {
            String branch = branchQuery.getKey();
            try {
                futures.put(branch, CompletableFuture.supplyAsync(branchQuery.getValue(), executor));
            } catch (RejectedExecutionException rejected) {
                log.warn("[SEARCH] {} branch rejected: executor saturated", branch);
                failures.add(new SearchFailureException.BranchFailure(
                        branch, BRANCH_REJECTED, "Search executor is saturated"));
                storageFailure = new StorageFailureException(
                        branch + " retrieval rejected: search executor is saturated", rejected);
                futures.values().forEach(started -> started.cancel(true));
                return new BranchOutcome(Map.of(), failures, storageFailure);
            }
        }

        Duration timeout = searchTuning.getQueryTimeout();
        String unfinishedFailureType = awaitBranches(futures.values(), timeout);

        Map<String, List<ScoredCandidate>> results = new LinkedHashMap<>();
        for (Map.Entry<String, CompletableFuture<List<ScoredCandidate>>> entry : futures.entrySet()) {
            String branch = entry.getKey();
            CompletableFuture<List<ScoredCandidate>> future = entry.getValue();
            if (!future.isDone()) {
                future.cancel(true);
                log.warn("[SEARCH] {} branch abandoned ({})", branch, unfinishedFailureType);
                failures.add(new SearchFailureException.BranchFailure(
                        branch, unfinishedFailureType, unfinishedDetails(unfinishedFailureType, timeout)));
                continue;
            }
            if (!future.isCompletedExceptionally()) {
                results.put(branch, future.join());
                continue;
            }
            Throwable cause = unwrap(future.handle((value, error) -> error).join());
            String failureType = RetrievalErrorClassifier.determineErrorType(cause);
            log.warn("[SEARCH] {} branch failed (exceptionType={})", branch, failureType);
            failures.add(new SearchFailureException.BranchFailure(
                    branch, failureType, FailureMessages.sanitize(cause.getMessage())));
            if (cause instanceof StorageFailureException branchStorageFailure && storageFailure == null) {
                storageFailure = branchStorageFailure;
            }
        }
        return new BranchOutcome(results, failures, storageFailure);
    }

    /**
     * Waits until every branch completes, one fails, or the timeout elapses.
     *
     * @return failure type to report for branches that are still running
     */
    private static String awaitBranches(
            Collection<CompletableFuture<List<ScoredCandidate>>> futures, Duration timeout) {
        CompletableFuture<Void> firstFailure = new CompletableFuture<>();
        futures.forEach(future -> future.whenComplete((value, error) -> {
            if (error != null) {
                firstFailure.complete(null);
            }
        }));
        CompletableFuture<Void> allCompleted = CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0]))
                .exceptionally(error -> null);
        try {
            CompletableFuture.anyOf(allCompleted, firstFailure).get(timeout.toNanos(), TimeUnit.NANOSECONDS);
            return BRANCH_CANCELLED;
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
            return BRANCH_INTERRUPTED;
        } catch (TimeoutException timeoutException) {
            return BRANCH_TIMEOUT;
        } catch (ExecutionException executionException) {
            // both joined futures complete normally
            throw new IllegalStateException("Branch join failed unexpectedly", executionException);
        }
    }

    private static String unfinishedDetails(String failureType, Duration timeout) {
        if (BRANCH_TIMEOUT.equals(failureType)) {
            return "Branch query exceeded timeout " + timeout.toMillis() + "ms";
        }
        if (BRANCH_INTERRUPTED.equals(failureType)) {
            return "Branch query was interrupted";
        }
        return "Branch query cancelled after another branch failed";
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private List<SearchResult> hydrate(List<RankedIdentifier> survivors) {
        if (survivors.isEmpty()) {
            return List.of();
        }
        List<String> identifiers = survivors.stream().map(RankedIdentifier::identifier).toList();
        Map<String, Competency> payloads = vectorRepository.getAll(identifiers);
        List<SearchResult> results = new ArrayList<>(survivors.size());
        for (RankedIdentifier survivor : survivors) {
            Competency competency = payloads.get(survivor.identifier());
            if (competency == null) {
                // deleted between retrieval and hydration
                log.debug("[SEARCH] Dropping {} with no stored payload", survivor.identifier());
                continue;
            }
            results.add(new SearchResult(survivor.identifier(), competency, survivor.score()));
        }
        return List.copyOf(results);
    }

    private record RankedIdentifier(String identifier, double score) {}

    private record BranchOutcome(
            Map<String, List<ScoredCandidate>> results,
            List<SearchFailureException.BranchFailure> failures,
            StorageFailureException storageFailure) {}
}
