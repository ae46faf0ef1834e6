package com.williamcallahan.competencysearch.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.competencysearch.service.ReciprocalRankFusion.FusedCandidate;
import com.williamcallahan.competencysearch.service.store.ScoredCandidate;
import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Verifies reciprocal rank fusion scores, normalization and tie-breaking.
 */
class ReciprocalRankFusionTest {

    @Test
    void firstInBothBranchesScoresOne() {
        List<FusedCandidate> fused = ReciprocalRankFusion.fuse(
                List.of(new ScoredCandidate("a", 0.9), new ScoredCandidate("b", 0.5)),
                List.of(new ScoredCandidate("a", 12.0), new ScoredCandidate("b", 3.0)),
                60);

        assertEquals("a", fused.get(0).identifier());
        assertEquals(1.0, fused.get(0).score(), 1e-12);
        assertEquals(1, fused.get(0).denseRank());
        assertEquals(1, fused.get(0).sparseRank());
    }

    @Test
    void absentBranchContributesNothing() {
        List<FusedCandidate> fused = ReciprocalRankFusion.fuse(
                List.of(new ScoredCandidate("a", 0.9)), List.of(new ScoredCandidate("b", 4.0)), 60);

        assertEquals(2, fused.size());
        double expected = (1.0 / 61) / (2.0 / 61);
        assertEquals(expected, fused.get(0).score(), 1e-12);
        assertEquals(expected, fused.get(1).score(), 1e-12);
    }

    @Test
    void tiesPreferBetterDenseRank() {
        List<FusedCandidate> fused = ReciprocalRankFusion.fuse(
                List.of(new ScoredCandidate("z", 0.9)), List.of(new ScoredCandidate("a", 4.0)), 60);

        assertEquals("z", fused.get(0).identifier());
        assertEquals(ReciprocalRankFusion.ABSENT_RANK, fused.get(0).sparseRank());
        assertEquals("a", fused.get(1).identifier());
    }

    @Test
    void mirroredRanksTieOnScoreAndPreferDenseRank() {
        List<FusedCandidate> fused = ReciprocalRankFusion.fuse(
                List.of(new ScoredCandidate("b", 0.9), new ScoredCandidate("a", 0.8)),
                List.of(new ScoredCandidate("a", 4.0), new ScoredCandidate("b", 2.0)),
                60);

        assertEquals(List.of("b", "a"), fused.stream().map(FusedCandidate::identifier).toList());
        assertEquals(fused.get(0).score(), fused.get(1).score(), 1e-12);
    }

    @Test
    void ranksBranchesByDescendingScore() {
        List<FusedCandidate> fused = ReciprocalRankFusion.fuse(
                List.of(new ScoredCandidate("low", 0.1), new ScoredCandidate("high", 0.9)), List.of(), 60);

        assertEquals("high", fused.get(0).identifier());
        assertEquals(1, fused.get(0).denseRank());
    }

    @Test
    void scoresStayWithinUnitInterval() {
        List<FusedCandidate> fused = ReciprocalRankFusion.fuse(
                List.of(new ScoredCandidate("a", 0.9), new ScoredCandidate("b", 0.8), new ScoredCandidate("c", 0.7)),
                List.of(new ScoredCandidate("c", 5.0), new ScoredCandidate("d", 4.0)),
                1);

        for (FusedCandidate candidate : fused) {
            assertTrue(candidate.score() >= 0.0 && candidate.score() <= 1.0);
        }
        for (int i = 1; i < fused.size(); i++) {
            assertTrue(fused.get(i - 1).score() >= fused.get(i).score());
        }
    }

    @Test
    void emptyBranchesFuseToNothing() {
        assertTrue(ReciprocalRankFusion.fuse(List.of(), List.of(), 60).isEmpty());
    }

    @Test
    void rejectsNonPositiveK() {
        assertThrows(IllegalArgumentException.class, () -> ReciprocalRankFusion.fuse(List.of(), List.of(), 0));
    }
}
