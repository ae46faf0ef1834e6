package com.williamcallahan.competencysearch.service.filter;

import java.util.List;
import java.util.Objects;

/**
 * One normalized condition of a {@link RetrievalPredicate}.
 *
 * <p>A negated condition holds for documents where the positive match does not, including documents
 * that lack the field entirely.</p>
 *
 * @param field payload path
 * @param match positive match
 * @param negated whether the condition excludes the match
 */
public record FieldCondition(String field, Match match, boolean negated) {

    public FieldCondition {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(match, "match");
    }

    /**
     * Positive match kinds a store adapter must render.
     */
    public sealed interface Match permits ExactValue, AnyOf, NumericRange, Empty {}

    /**
     * Exact equality with a {@code String}, {@code Long}, {@code Double} or {@code Boolean}.
     */
    public record ExactValue(Object value) implements Match {
        public ExactValue {
            Objects.requireNonNull(value, "value");
        }
    }

    /**
     * Membership in a non-empty list of strings or of longs.
     */
    public record AnyOf(List<Object> values) implements Match {
        public AnyOf {
            values = List.copyOf(values);
            if (values.isEmpty()) {
                throw new IllegalArgumentException("AnyOf requires at least one value");
            }
        }

        public boolean isKeywordSet() {
            return values.get(0) instanceof String;
        }
    }

    /**
     * Numeric bounds, each one optional.
     */
    public record NumericRange(Double gt, Double gte, Double lt, Double lte) implements Match {}

    /**
     * Field absent, null, or an empty array.
     */
    public record Empty() implements Match {}
}
