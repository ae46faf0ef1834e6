package com.williamcallahan.competencysearch.domain.errors;

import java.io.Serial;
import java.io.Serializable;
import java.util.List;
import java.util.Objects;

/**
 * Signals that one or both retrieval branches of a hybrid search failed.
 *
 * <p>Hybrid results are never degraded to a single branch, so any branch failure fails the request.</p>
 */
public class SearchFailureException extends CompetencySearchException {

    @Serial
    private static final long serialVersionUID = 1L;

    private final List<BranchFailure> branchFailures;

    /**
     * Creates a search failure with branch-specific details.
     *
     * @param message human-readable summary message
     * @param branchFailures failed branches
     */
    public SearchFailureException(String message, List<BranchFailure> branchFailures) {
        super(message, true);
        this.branchFailures = List.copyOf(Objects.requireNonNull(branchFailures, "branchFailures"));
    }

    /**
     * Returns the branch failures captured while joining the retrieval calls.
     *
     * @return immutable branch failure list
     */
    public List<BranchFailure> branchFailures() {
        return branchFailures;
    }

    /**
     * Captures one failed retrieval branch.
     *
     * @param branch branch name ({@code dense} or {@code sparse})
     * @param failureType normalized failure type
     * @param failureDetails compact failure details
     */
    public record BranchFailure(String branch, String failureType, String failureDetails) implements Serializable {

        @Serial
        private static final long serialVersionUID = 1L;

        public BranchFailure {
            branch = sanitize(branch);
            failureType = sanitize(failureType);
            failureDetails = sanitize(failureDetails);
            if (branch.isBlank()) {
                throw new IllegalArgumentException("branch cannot be blank");
            }
            if (failureType.isBlank()) {
                throw new IllegalArgumentException("failureType cannot be blank");
            }
        }

        private static String sanitize(String rawValue) {
            if (rawValue == null) {
                return "";
            }
            return rawValue.trim();
        }
    }
}
