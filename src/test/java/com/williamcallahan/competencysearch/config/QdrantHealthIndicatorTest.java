package com.williamcallahan.competencysearch.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.google.common.util.concurrent.Futures;
import io.grpc.StatusRuntimeException;
import io.qdrant.client.QdrantClient;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

/**
 * Verifies that the actuator health check reflects collection availability.
 */
class QdrantHealthIndicatorTest {

    private QdrantClient qdrantClient;
    private QdrantHealthIndicator qdrantHealthIndicator;

    @BeforeEach
    void setUp() {
        qdrantClient = mock(QdrantClient.class);
        qdrantHealthIndicator = new QdrantHealthIndicator(qdrantClient, new AppProperties());
    }

    @Test
    void reportsUpWhenCollectionExists() {
        when(qdrantClient.collectionExistsAsync(eq("entities"), any(Duration.class)))
                .thenReturn(Futures.immediateFuture(true));

        Health health = qdrantHealthIndicator.health();

        assertEquals(Status.UP, health.getStatus());
        assertEquals("entities", health.getDetails().get("collection"));
    }

    @Test
    void reportsDownWhenCollectionIsMissing() {
        when(qdrantClient.collectionExistsAsync(eq("entities"), any(Duration.class)))
                .thenReturn(Futures.immediateFuture(false));

        Health health = qdrantHealthIndicator.health();

        assertEquals(Status.DOWN, health.getStatus());
        assertEquals("Collection missing", health.getDetails().get("status"));
    }

    @Test
    void reportsDownWhenQdrantIsUnreachable() {
        when(qdrantClient.collectionExistsAsync(eq("entities"), any(Duration.class)))
                .thenReturn(Futures.immediateFailedFuture(
                        new StatusRuntimeException(io.grpc.Status.UNAVAILABLE.withDescription("connection refused"))));

        Health health = qdrantHealthIndicator.health();

        assertEquals(Status.DOWN, health.getStatus());
    }
}
