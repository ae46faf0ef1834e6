package com.williamcallahan.competencysearch.config;

import java.time.Duration;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Search and fusion settings.
 */
public class SearchTuning {
    private static final Logger log = LoggerFactory.getLogger(SearchTuning.class);

    private static final int RRF_K_DEF = 60;
    private static final int OVERSAMPLE_DEF = 3;
    private static final int MAX_OVERSAMPLE = 10;
    private static final int MAX_TOP_DEF = 100;
    private static final int MAX_TEXT_LENGTH_DEF = 10_000;
    private static final Duration QUERY_TIMEOUT_DEF = Duration.ofSeconds(10);
    private static final int EXECUTOR_THREADS_DEF = 8;
    private static final String RRF_K_KEY = "app.search.rrf-k";
    private static final String OVERSAMPLE_KEY = "app.search.oversample-factor";
    private static final String MAX_TOP_KEY = "app.search.max-top";
    private static final String MAX_TEXT_LENGTH_KEY = "app.search.max-text-length";
    private static final String QUERY_TIMEOUT_KEY = "app.search.query-timeout";
    private static final String EXECUTOR_THREADS_KEY = "app.search.executor-threads";
    private static final String POSITIVE_FMT = "%s must be greater than 0.";
    private static final String RANGE_FMT = "%s must be between %d and %d.";

    private int rrfK = RRF_K_DEF;
    private int oversampleFactor = OVERSAMPLE_DEF;
    private int maxTop = MAX_TOP_DEF;
    private int maxTextLength = MAX_TEXT_LENGTH_DEF;
    private Duration queryTimeout = QUERY_TIMEOUT_DEF;
    private int executorThreads = EXECUTOR_THREADS_DEF;

    /**
     * Validates search settings.
     */
    public void validateConfiguration() {
        requirePositive(RRF_K_KEY, rrfK);
        requirePositive(MAX_TOP_KEY, maxTop);
        requirePositive(MAX_TEXT_LENGTH_KEY, maxTextLength);
        requirePositive(EXECUTOR_THREADS_KEY, executorThreads);
        if (oversampleFactor < 1 || oversampleFactor > MAX_OVERSAMPLE) {
            throw new IllegalArgumentException(
                    String.format(Locale.ROOT, RANGE_FMT, OVERSAMPLE_KEY, 1, MAX_OVERSAMPLE));
        }
        if (queryTimeout == null || queryTimeout.isZero() || queryTimeout.isNegative()) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, POSITIVE_FMT, QUERY_TIMEOUT_KEY));
        }
        if (fusionDepthExceedsRankOrderBound()) {
            log.warn("[CONFIG] {} x {} = {} exceeds {} + 2; for top above {} a candidate found by both branches "
                            + "may rank below one found by a single branch",
                    OVERSAMPLE_KEY, MAX_TOP_KEY, oversampleFactor * maxTop, RRF_K_KEY, largestRankOrderedTop());
        }
    }

    /**
     * Whether a full-depth hybrid query can rank a single-branch candidate above a candidate found by
     * both branches.
     *
     * <p>A candidate at rank {@code d} in both lists scores {@code 2/(k+d)}, which stays at or above the
     * best single-branch score {@code 1/(k+1)} only while {@code d <= k + 2}.</p>
     *
     * @return {@code true} when {@code oversampleFactor × maxTop > rrfK + 2}
     */
    public boolean fusionDepthExceedsRankOrderBound() {
        return (long) oversampleFactor * maxTop > (long) rrfK + 2;
    }

    /**
     * Largest {@code top} whose branch depth keeps both-branch candidates ahead of single-branch ones.
     *
     * @return {@code (rrfK + 2) / oversampleFactor}
     */
    public int largestRankOrderedTop() {
        return (rrfK + 2) / oversampleFactor;
    }

    public int getRrfK() {
        return rrfK;
    }

    public void setRrfK(int rrfK) {
        this.rrfK = rrfK;
    }

    public int getOversampleFactor() {
        return oversampleFactor;
    }

    public void setOversampleFactor(int oversampleFactor) {
        this.oversampleFactor = oversampleFactor;
    }

    public int getMaxTop() {
        return maxTop;
    }

    public void setMaxTop(int maxTop) {
        this.maxTop = maxTop;
    }

    public int getMaxTextLength() {
        return maxTextLength;
    }

    public void setMaxTextLength(int maxTextLength) {
        this.maxTextLength = maxTextLength;
    }

    public Duration getQueryTimeout() {
        return queryTimeout;
    }

    public void setQueryTimeout(Duration queryTimeout) {
        this.queryTimeout = queryTimeout;
    }

    public int getExecutorThreads() {
        return executorThreads;
    }

    public void setExecutorThreads(int executorThreads) {
        this.executorThreads = executorThreads;
    }

    private static void requirePositive(String propertyKey, int value) {
        if (value < 1) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, POSITIVE_FMT, propertyKey));
        }
    }
}
