package com.williamcallahan.competencysearch.service.store;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.competencysearch.service.filter.FieldCondition;
import com.williamcallahan.competencysearch.service.filter.FieldCondition.AnyOf;
import com.williamcallahan.competencysearch.service.filter.FieldCondition.ExactValue;
import com.williamcallahan.competencysearch.service.filter.FieldCondition.NumericRange;
import com.williamcallahan.competencysearch.service.filter.RetrievalPredicate;
import io.qdrant.client.grpc.Common.Condition;
import io.qdrant.client.grpc.Common.Filter;
import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Verifies translation of compiled predicates into Qdrant payload filters.
 */
class QdrantFilterRendererTest {

    private final QdrantFilterRenderer filterRenderer = new QdrantFilterRenderer();

    @Test
    void unconstrainedPredicateRendersNoFilter() {
        assertTrue(filterRenderer.render(RetrievalPredicate.matchAll()).isEmpty());
    }

    @Test
    void matchNothingHasNoRendering() {
        assertThrows(IllegalArgumentException.class, () -> filterRenderer.render(RetrievalPredicate.matchNothing()));
    }

    @Test
    void splitsPositiveAndNegatedConditions() {
        RetrievalPredicate predicate = RetrievalPredicate.allOf(List.of(
                new FieldCondition("lang", new ExactValue("fr"), false),
                new FieldCondition("provider", new AnyOf(List.<Object>of("rome", "esco")), true)));

        Filter filter = filterRenderer.render(predicate).orElseThrow();

        assertEquals(1, filter.getMustCount());
        assertEquals(1, filter.getMustNotCount());
        Condition mustCondition = filter.getMust(0);
        assertEquals("lang", mustCondition.getField().getKey());
        assertEquals("fr", mustCondition.getField().getMatch().getKeyword());
        assertEquals(
                List.of("rome", "esco"),
                filter.getMustNot(0).getField().getMatch().getKeywords().getStringsList());
    }

    @Test
    void integerEqualityUsesIntegerMatch() {
        RetrievalPredicate predicate = RetrievalPredicate.allOf(
                List.of(new FieldCondition("metadata.level", new ExactValue(3L), false)));

        Condition condition = filterRenderer.render(predicate).orElseThrow().getMust(0);

        assertEquals("metadata.level", condition.getField().getKey());
        assertEquals(3L, condition.getField().getMatch().getInteger());
    }

    @Test
    void decimalEqualityBecomesClosedRange() {
        RetrievalPredicate predicate = RetrievalPredicate.allOf(
                List.of(new FieldCondition("metadata.score", new ExactValue(0.5), false)));

        Condition condition = filterRenderer.render(predicate).orElseThrow().getMust(0);

        assertEquals(0.5, condition.getField().getRange().getGte());
        assertEquals(0.5, condition.getField().getRange().getLte());
    }

    @Test
    void rangeKeepsOnlySetBounds() {
        RetrievalPredicate predicate = RetrievalPredicate.allOf(
                List.of(new FieldCondition("metadata.level", new NumericRange(2.0, null, null, null), false)));

        Condition condition = filterRenderer.render(predicate).orElseThrow().getMust(0);

        assertTrue(condition.getField().getRange().hasGt());
        assertFalse(condition.getField().getRange().hasLt());
    }
}
