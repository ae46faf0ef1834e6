package com.williamcallahan.competencysearch.domain;

/**
 * One search filter condition: {@code field operator value}.
 *
 * <p>Values keep the shape they had on the wire: {@code String}, {@code Number}, {@code Boolean},
 * {@code List} for set operators, or {@code null}.</p>
 *
 * @param field top-level competency field or dotted {@code metadata.} path
 * @param operator comparison operator
 * @param value operand
 */
public record CompetencyFilter(String field, FilterOperator operator, Object value) {

    public static CompetencyFilter eq(String field, Object value) {
        return new CompetencyFilter(field, FilterOperator.EQ, value);
    }

    public static CompetencyFilter of(String field, FilterOperator operator, Object value) {
        return new CompetencyFilter(field, operator, value);
    }
}
