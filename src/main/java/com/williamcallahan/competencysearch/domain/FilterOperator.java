package com.williamcallahan.competencysearch.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Comparison operators accepted in search filters.
 */
public enum FilterOperator {
    EQ("eq"),
    NEQ("neq"),
    IN("in"),
    NIN("nin"),
    GT("gt"),
    GTE("gte"),
    LT("lt"),
    LTE("lte");

    private final String token;

    FilterOperator(String token) {
        this.token = token;
    }

    @JsonValue
    public String token() {
        return token;
    }

    @JsonCreator
    public static FilterOperator fromToken(String token) {
        return WireTokens.resolve(FilterOperator.class, values(), FilterOperator::token, token);
    }

    /**
     * Reports whether the operator compares numbers by order.
     */
    public boolean isRange() {
        return this == GT || this == GTE || this == LT || this == LTE;
    }
}
