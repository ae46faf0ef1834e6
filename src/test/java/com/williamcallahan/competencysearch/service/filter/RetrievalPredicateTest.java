package com.williamcallahan.competencysearch.service.filter;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.competencysearch.service.filter.FieldCondition.AnyOf;
import com.williamcallahan.competencysearch.service.filter.FieldCondition.Empty;
import com.williamcallahan.competencysearch.service.filter.FieldCondition.ExactValue;
import com.williamcallahan.competencysearch.service.filter.FieldCondition.NumericRange;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

/**
 * Verifies in-process predicate evaluation against stored payloads.
 */
class RetrievalPredicateTest {

    private static final Map<String, Object> PAYLOAD = Map.of(
            "lang", "fr",
            "provider", "rome",
            "keywords", List.of("Cuisinier", "Chef de rang"),
            "metadata", Map.of("level", 3L, "score", 0.75));

    @Test
    void conjunctionRequiresEveryCondition() {
        RetrievalPredicate predicate = RetrievalPredicate.allOf(List.of(
                new FieldCondition("lang", new ExactValue("fr"), false),
                new FieldCondition("provider", new ExactValue("esco"), false)));

        assertFalse(predicate.test(PAYLOAD));
    }

    @Test
    void arrayValuesMatchWhenAnyElementMatches() {
        RetrievalPredicate predicate = RetrievalPredicate.allOf(
                List.of(new FieldCondition("keywords", new ExactValue("Cuisinier"), false)));

        assertTrue(predicate.test(PAYLOAD));
    }

    @Test
    void negatedSetExcludesMembers() {
        RetrievalPredicate predicate = RetrievalPredicate.allOf(
                List.of(new FieldCondition("provider", new AnyOf(List.<Object>of("rome", "esco")), true)));

        assertFalse(predicate.test(PAYLOAD));
    }

    @Test
    void nestedMetadataRange() {
        RetrievalPredicate predicate = RetrievalPredicate.allOf(List.of(
                new FieldCondition("metadata.level", new NumericRange(null, 3.0, null, null), false),
                new FieldCondition("metadata.score", new NumericRange(null, null, 1.0, null), false)));

        assertTrue(predicate.test(PAYLOAD));
    }

    @Test
    void integerEqualityIgnoresDecimals() {
        RetrievalPredicate predicate = RetrievalPredicate.allOf(
                List.of(new FieldCondition("metadata.score", new ExactValue(1L), false)));

        assertFalse(predicate.test(PAYLOAD));
    }

    @Test
    void emptyMatchesMissingField() {
        RetrievalPredicate predicate = RetrievalPredicate.allOf(
                List.of(new FieldCondition("category", new Empty(), false)));

        assertTrue(predicate.test(PAYLOAD));
    }

    @Test
    void matchNothingRejectsEverything() {
        assertFalse(RetrievalPredicate.matchNothing().test(PAYLOAD));
        assertTrue(RetrievalPredicate.matchAll().test(PAYLOAD));
    }
}
