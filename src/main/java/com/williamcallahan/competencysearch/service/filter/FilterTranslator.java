package com.williamcallahan.competencysearch.service.filter;

import com.williamcallahan.competencysearch.domain.CompetencyFilter;
import com.williamcallahan.competencysearch.domain.FilterOperator;
import com.williamcallahan.competencysearch.domain.errors.ValidationException;
import com.williamcallahan.competencysearch.service.filter.FieldCondition.AnyOf;
import com.williamcallahan.competencysearch.service.filter.FieldCondition.Empty;
import com.williamcallahan.competencysearch.service.filter.FieldCondition.ExactValue;
import com.williamcallahan.competencysearch.service.filter.FieldCondition.NumericRange;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Compiles a list of filters into one conjunctive {@link RetrievalPredicate}.
 *
 * <p>Every filter is validated before any field lookup, so a malformed value is reported even when
 * the field is unknown. A field that is neither a top-level competency field nor a
 * {@code metadata.} path makes the whole predicate match nothing.</p>
 */
@Component
public class FilterTranslator {
    private static final Logger log = LoggerFactory.getLogger(FilterTranslator.class);

    /**
     * Translates filters into a predicate.
     *
     * @param filters conjunctive filters (null or empty means unconstrained)
     * @return compiled predicate
     * @throws ValidationException when a filter has a blank field, no operator, or a value of the wrong shape
     */
    public RetrievalPredicate translate(List<CompetencyFilter> filters) {
        if (filters == null || filters.isEmpty()) {
            return RetrievalPredicate.matchAll();
        }
        List<FieldCondition> conditions = new ArrayList<>(filters.size());
        boolean matchesNothing = false;
        for (int position = 0; position < filters.size(); position++) {
            CompetencyFilter filter = filters.get(position);
            if (filter == null) {
                throw new ValidationException("Filter at position " + position + " is null");
            }
            Compiled compiled = compile(filter);
            String field = filter.field().trim();
            if (!CompetencyFieldSchema.isKnownField(field)) {
                log.debug("[SEARCH] Filter on unknown field '{}' matches nothing", field);
                matchesNothing = true;
            } else if (compiled.matchesNothing()) {
                matchesNothing = true;
            } else if (compiled.condition() != null) {
                conditions.add(compiled.condition());
            }
        }
        return matchesNothing ? RetrievalPredicate.matchNothing() : RetrievalPredicate.allOf(conditions);
    }

    private Compiled compile(CompetencyFilter filter) {
        if (filter.field() == null || filter.field().isBlank()) {
            throw new ValidationException("Filter field must not be blank");
        }
        FilterOperator operator = filter.operator();
        if (operator == null) {
            throw new ValidationException("Filter on '" + filter.field() + "' has no operator");
        }
        String field = filter.field().trim();
        Object value = filter.value();
        if (operator == FilterOperator.EQ || operator == FilterOperator.NEQ) {
            boolean negated = operator == FilterOperator.NEQ;
            if (value == null) {
                return Compiled.of(new FieldCondition(field, new Empty(), negated));
            }
            return Compiled.of(new FieldCondition(field, new ExactValue(scalar(field, operator, value)), negated));
        }
        if (operator == FilterOperator.IN || operator == FilterOperator.NIN) {
            List<Object> members = members(field, operator, value);
            if (members.isEmpty()) {
                // in [] selects nothing, nin [] excludes nothing
                return operator == FilterOperator.IN ? Compiled.NOTHING : Compiled.NO_CONDITION;
            }
            return Compiled.of(new FieldCondition(field, new AnyOf(members), operator == FilterOperator.NIN));
        }
        return Compiled.of(new FieldCondition(field, range(field, operator, value), false));
    }

    private static Object scalar(String field, FilterOperator operator, Object value) {
        if (value instanceof String || value instanceof Boolean) {
            return value;
        }
        if (value instanceof Number number) {
            return normalizeNumber(field, operator, number);
        }
        throw new ValidationException("Operator '" + operator.token() + "' on '" + field
                + "' expects a string, number or boolean value");
    }

    private static List<Object> members(String field, FilterOperator operator, Object value) {
        if (!(value instanceof Collection<?> collection)) {
            throw new ValidationException(
                    "Operator '" + operator.token() + "' on '" + field + "' expects an array value");
        }
        List<Object> members = new ArrayList<>(collection.size());
        Class<?> memberType = null;
        for (Object element : collection) {
            Object member = element instanceof Number number ? normalizeNumber(field, operator, number) : element;
            if (!(member instanceof String) && !(member instanceof Long)) {
                throw new ValidationException("Operator '" + operator.token() + "' on '" + field
                        + "' accepts only strings or integers");
            }
            if (memberType != null && memberType != member.getClass()) {
                throw new ValidationException("Operator '" + operator.token() + "' on '" + field
                        + "' cannot mix strings and integers");
            }
            memberType = member.getClass();
            members.add(member);
        }
        return members;
    }

    private static NumericRange range(String field, FilterOperator operator, Object value) {
        if (!(value instanceof Number number)) {
            throw new ValidationException(
                    "Operator '" + operator.token() + "' on '" + field + "' expects a numeric value");
        }
        double bound = number.doubleValue();
        if (Double.isNaN(bound) || Double.isInfinite(bound)) {
            throw new ValidationException("Operator '" + operator.token() + "' on '" + field
                    + "' expects a finite numeric value");
        }
        return switch (operator) {
            case GT -> new NumericRange(bound, null, null, null);
            case GTE -> new NumericRange(null, bound, null, null);
            case LT -> new NumericRange(null, null, bound, null);
            case LTE -> new NumericRange(null, null, null, bound);
            default -> throw new IllegalStateException("Not a range operator: " + operator);
        };
    }

    /**
     * Integral numbers become {@code Long}, everything else {@code Double}.
     */
    private static Object normalizeNumber(String field, FilterOperator operator, Number number) {
        if (number instanceof Integer || number instanceof Long || number instanceof Short || number instanceof Byte) {
            return number.longValue();
        }
        if (number instanceof BigInteger bigInteger) {
            if (bigInteger.bitLength() < Long.SIZE) {
                return bigInteger.longValue();
            }
            throw new ValidationException(
                    "Operator '" + operator.token() + "' on '" + field + "' has an integer out of range");
        }
        if (number instanceof BigDecimal bigDecimal) {
            BigDecimal stripped = bigDecimal.stripTrailingZeros();
            if (stripped.scale() <= 0 && stripped.precision() - stripped.scale() < 19) {
                return stripped.longValue();
            }
            return bigDecimal.doubleValue();
        }
        double decimal = number.doubleValue();
        if (Double.isNaN(decimal) || Double.isInfinite(decimal)) {
            throw new ValidationException(
                    "Operator '" + operator.token() + "' on '" + field + "' expects a finite number");
        }
        return decimal;
    }

    private record Compiled(FieldCondition condition, boolean matchesNothing) {
        static final Compiled NOTHING = new Compiled(null, true);
        static final Compiled NO_CONDITION = new Compiled(null, false);

        static Compiled of(FieldCondition condition) {
            return new Compiled(condition, false);
        }
    }
}
