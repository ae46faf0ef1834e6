package com.williamcallahan.competencysearch.service.filter;

import com.williamcallahan.competencysearch.service.filter.FieldCondition.AnyOf;
import com.williamcallahan.competencysearch.service.filter.FieldCondition.Empty;
import com.williamcallahan.competencysearch.service.filter.FieldCondition.ExactValue;
import com.williamcallahan.competencysearch.service.filter.FieldCondition.NumericRange;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Store-agnostic conjunction of field conditions compiled from a filter list.
 *
 * <p>Compiled once per search and shared by both retrieval branches. Adapters either render it into
 * their native filter or evaluate it with {@link #test(Map)}.</p>
 */
public final class RetrievalPredicate {

    private static final RetrievalPredicate MATCH_ALL = new RetrievalPredicate(List.of(), false);
    private static final RetrievalPredicate MATCH_NOTHING = new RetrievalPredicate(List.of(), true);

    private final List<FieldCondition> conditions;
    private final boolean matchesNothing;

    private RetrievalPredicate(List<FieldCondition> conditions, boolean matchesNothing) {
        this.conditions = List.copyOf(conditions);
        this.matchesNothing = matchesNothing;
    }

    public static RetrievalPredicate matchAll() {
        return MATCH_ALL;
    }

    public static RetrievalPredicate matchNothing() {
        return MATCH_NOTHING;
    }

    public static RetrievalPredicate allOf(List<FieldCondition> conditions) {
        Objects.requireNonNull(conditions, "conditions");
        return conditions.isEmpty() ? MATCH_ALL : new RetrievalPredicate(conditions, false);
    }

    public List<FieldCondition> conditions() {
        return conditions;
    }

    /**
     * Reports whether no document can satisfy this predicate, so the store need not be queried.
     */
    public boolean matchesNothing() {
        return matchesNothing;
    }

    public boolean isUnconstrained() {
        return !matchesNothing && conditions.isEmpty();
    }

    /**
     * Evaluates the predicate against a stored payload.
     *
     * <p>Array payload values satisfy a positive match when any element does, as Qdrant does.</p>
     *
     * @param payload payload map with nested {@code metadata}
     * @return true when every condition holds
     */
    public boolean test(Map<String, Object> payload) {
        if (matchesNothing) {
            return false;
        }
        for (FieldCondition condition : conditions) {
            boolean positive = matches(resolve(payload, condition.field()), condition.match());
            if (positive == condition.negated()) {
                return false;
            }
        }
        return true;
    }

    private static Object resolve(Map<String, Object> payload, String field) {
        Object current = payload;
        for (String segment : field.split("\\.")) {
            if (!(current instanceof Map<?, ?> currentMap)) {
                return null;
            }
            current = currentMap.get(segment);
        }
        return current;
    }

    private static boolean matches(Object storedValue, FieldCondition.Match match) {
        if (match instanceof Empty) {
            return storedValue == null || (storedValue instanceof Collection<?> values && values.isEmpty());
        }
        if (storedValue instanceof Collection<?> values) {
            for (Object element : values) {
                if (matchesScalar(element, match)) {
                    return true;
                }
            }
            return false;
        }
        return matchesScalar(storedValue, match);
    }

    private static boolean matchesScalar(Object storedValue, FieldCondition.Match match) {
        if (storedValue == null) {
            return false;
        }
        if (match instanceof ExactValue exactValue) {
            return equalsStored(storedValue, exactValue.value());
        }
        if (match instanceof AnyOf anyOf) {
            for (Object candidate : anyOf.values()) {
                if (equalsStored(storedValue, candidate)) {
                    return true;
                }
            }
            return false;
        }
        if (match instanceof NumericRange range) {
            if (!isNumber(storedValue)) {
                return false;
            }
            double number = ((Number) storedValue).doubleValue();
            return (range.gt() == null || number > range.gt())
                    && (range.gte() == null || number >= range.gte())
                    && (range.lt() == null || number < range.lt())
                    && (range.lte() == null || number <= range.lte());
        }
        return false;
    }

    private static boolean equalsStored(Object storedValue, Object expected) {
        if (expected instanceof String expectedText) {
            return expectedText.equals(storedValue);
        }
        if (expected instanceof Boolean expectedFlag) {
            return expectedFlag.equals(storedValue);
        }
        if (expected instanceof Long expectedInteger) {
            return isIntegral(storedValue) && ((Number) storedValue).longValue() == expectedInteger;
        }
        if (expected instanceof Double expectedDecimal) {
            return isNumber(storedValue) && ((Number) storedValue).doubleValue() == expectedDecimal;
        }
        return false;
    }

    private static boolean isNumber(Object value) {
        return value instanceof Number;
    }

    private static boolean isIntegral(Object value) {
        return value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte;
    }

    @Override
    public String toString() {
        return matchesNothing ? "RetrievalPredicate[nothing]" : "RetrievalPredicate" + conditions;
    }
}
