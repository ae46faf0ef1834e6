package com.williamcallahan.competencysearch.service.store;

import static io.qdrant.client.ConditionFactory.isEmpty;
import static io.qdrant.client.ConditionFactory.match;
import static io.qdrant.client.ConditionFactory.matchKeyword;
import static io.qdrant.client.ConditionFactory.matchKeywords;
import static io.qdrant.client.ConditionFactory.matchValues;
import static io.qdrant.client.ConditionFactory.range;

import com.williamcallahan.competencysearch.service.filter.FieldCondition;
import com.williamcallahan.competencysearch.service.filter.FieldCondition.AnyOf;
import com.williamcallahan.competencysearch.service.filter.FieldCondition.Empty;
import com.williamcallahan.competencysearch.service.filter.FieldCondition.ExactValue;
import com.williamcallahan.competencysearch.service.filter.FieldCondition.NumericRange;
import com.williamcallahan.competencysearch.service.filter.RetrievalPredicate;
import io.qdrant.client.grpc.Common.Condition;
import io.qdrant.client.grpc.Common.Filter;
import io.qdrant.client.grpc.Common.Range;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Renders a {@link RetrievalPredicate} into a Qdrant payload filter.
 *
 * <p>Positive conditions go to {@code must}, negated ones to {@code must_not}. Decimal equality is
 * rendered as a closed range because Qdrant's match condition only covers integers, keywords and
 * booleans.</p>
 */
public class QdrantFilterRenderer {

    /**
     * Builds a Qdrant filter from the provided predicate.
     *
     * @param predicate compiled predicate, which must not be a match-nothing predicate
     * @return filter when at least one condition is present
     */
    public Optional<Filter> render(RetrievalPredicate predicate) {
        Objects.requireNonNull(predicate, "predicate");
        if (predicate.matchesNothing()) {
            throw new IllegalArgumentException("A match-nothing predicate has no Qdrant rendering");
        }
        if (predicate.conditions().isEmpty()) {
            return Optional.empty();
        }
        Filter.Builder filterBuilder = Filter.newBuilder();
        for (FieldCondition fieldCondition : predicate.conditions()) {
            Condition condition = toCondition(fieldCondition.field(), fieldCondition.match());
            if (fieldCondition.negated()) {
                filterBuilder.addMustNot(condition);
            } else {
                filterBuilder.addMust(condition);
            }
        }
        return Optional.of(filterBuilder.build());
    }

    private static Condition toCondition(String field, FieldCondition.Match match) {
        if (match instanceof Empty) {
            return isEmpty(field);
        }
        if (match instanceof ExactValue exactValue) {
            Object value = exactValue.value();
            if (value instanceof String keyword) {
                return matchKeyword(field, keyword);
            }
            if (value instanceof Long integer) {
                return match(field, integer);
            }
            if (value instanceof Boolean flag) {
                return match(field, flag);
            }
            double decimal = ((Number) value).doubleValue();
            return range(field, Range.newBuilder().setGte(decimal).setLte(decimal).build());
        }
        if (match instanceof AnyOf anyOf) {
            if (anyOf.isKeywordSet()) {
                List<String> keywords = anyOf.values().stream().map(String.class::cast).toList();
                return matchKeywords(field, keywords);
            }
            List<Long> integers = anyOf.values().stream().map(Long.class::cast).toList();
            return matchValues(field, integers);
        }
        NumericRange numericRange = (NumericRange) match;
        Range.Builder rangeBuilder = Range.newBuilder();
        if (numericRange.gt() != null) {
            rangeBuilder.setGt(numericRange.gt());
        }
        if (numericRange.gte() != null) {
            rangeBuilder.setGte(numericRange.gte());
        }
        if (numericRange.lt() != null) {
            rangeBuilder.setLt(numericRange.lt());
        }
        if (numericRange.lte() != null) {
            rangeBuilder.setLte(numericRange.lte());
        }
        return range(field, rangeBuilder.build());
    }
}
