package com.williamcallahan.competencysearch.service;

import com.williamcallahan.competencysearch.service.store.ScoredCandidate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reciprocal rank fusion of a dense and a sparse ranking.
 *
 * <p>A candidate at rank {@code r} of a branch receives {@code 1 / (k + r)} from it; a branch that
 * did not return the candidate contributes nothing. The sum is divided by its maximum
 * {@code 2 / (k + 1)}, so fused scores lie in [0, 1] and a candidate ranked first by both branches
 * scores exactly 1.</p>
 */
public final class ReciprocalRankFusion {

    /** Rank used for ordering when a branch did not return the candidate. */
    public static final int ABSENT_RANK = Integer.MAX_VALUE;

    private ReciprocalRankFusion() {}

    /**
     * One fused candidate.
     *
     * @param identifier store identifier
     * @param score normalized fused score
     * @param denseRank 1-based dense rank, {@link #ABSENT_RANK} when absent
     * @param sparseRank 1-based sparse rank, {@link #ABSENT_RANK} when absent
     */
    public record FusedCandidate(String identifier, double score, int denseRank, int sparseRank) {}

    /**
     * Fuses two branch rankings.
     *
     * @param denseCandidates dense hits
     * @param sparseCandidates sparse hits
     * @param rrfK smoothing constant, at least 1
     * @return fused candidates by descending score, then dense rank, sparse rank and identifier
     */
    public static List<FusedCandidate> fuse(
            List<ScoredCandidate> denseCandidates, List<ScoredCandidate> sparseCandidates, int rrfK) {
        if (rrfK < 1) {
            throw new IllegalArgumentException("rrfK must be at least 1");
        }
        Map<String, Integer> denseRanks = ranks(denseCandidates);
        Map<String, Integer> sparseRanks = ranks(sparseCandidates);

        Map<String, Double> fusedScores = new LinkedHashMap<>();
        denseRanks.forEach((identifier, rank) -> fusedScores.merge(identifier, contribution(rrfK, rank), Double::sum));
        sparseRanks.forEach((identifier, rank) -> fusedScores.merge(identifier, contribution(rrfK, rank), Double::sum));

        double maximum = 2.0 / (rrfK + 1);
        List<FusedCandidate> fused = new ArrayList<>(fusedScores.size());
        fusedScores.forEach((identifier, score) -> fused.add(new FusedCandidate(
                identifier,
                Math.min(1.0, score / maximum),
                denseRanks.getOrDefault(identifier, ABSENT_RANK),
                sparseRanks.getOrDefault(identifier, ABSENT_RANK))));
        fused.sort(Comparator.comparingDouble(FusedCandidate::score)
                .reversed()
                .thenComparingInt(FusedCandidate::denseRank)
                .thenComparingInt(FusedCandidate::sparseRank)
                .thenComparing(FusedCandidate::identifier));
        return List.copyOf(fused);
    }

    private static double contribution(int rrfK, int rank) {
        return 1.0 / (rrfK + rank);
    }

    /**
     * Ranks a branch by descending score; the sort is stable, so equal scores keep the store's order.
     * A repeated identifier keeps its best rank.
     */
    private static Map<String, Integer> ranks(List<ScoredCandidate> candidates) {
        List<ScoredCandidate> ordered = new ArrayList<>(candidates);
        ordered.sort(Comparator.comparingDouble(ScoredCandidate::score).reversed());
        Map<String, Integer> ranksByIdentifier = new LinkedHashMap<>();
        int rank = 1;
        for (ScoredCandidate candidate : ordered) {
            ranksByIdentifier.putIfAbsent(candidate.identifier(), rank++);
        }
        return ranksByIdentifier;
    }
}
