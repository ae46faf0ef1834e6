package com.williamcallahan.competencysearch.config;

import com.williamcallahan.competencysearch.domain.errors.StorageFailureException;
import com.williamcallahan.competencysearch.service.store.QdrantFutureAwaiter;
import io.qdrant.client.QdrantClient;
import java.time.Duration;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Spring Actuator health indicator for the Qdrant collection.
 *
 * <p>Exposed as the {@code qdrant} component of {@code /actuator/health}.</p>
 */
@Component
@ConditionalOnProperty(name = "app.vector-store.type", havingValue = AppProperties.STORE_QDRANT, matchIfMissing = true)
public class QdrantHealthIndicator implements HealthIndicator {

    /** Health detail key for human-readable status message. */
    private static final String DETAIL_KEY_STATUS = "status";
    private static final String DETAIL_KEY_COLLECTION = "collection";

    private final QdrantClient qdrantClient;
    private final String collection;
    private final Duration timeout;

    public QdrantHealthIndicator(QdrantClient qdrantClient, AppProperties appProperties) {
        this.qdrantClient = qdrantClient;
        this.collection = appProperties.getQdrant().getCollection();
        this.timeout = appProperties.getQdrant().getOperationTimeout();
    }

    /**
     * Reports UP when the collection exists and DOWN with the failure reason otherwise.
     */
    @Override
    public Health health() {
        try {
            boolean exists = QdrantFutureAwaiter.awaitFuture(
                    qdrantClient.collectionExistsAsync(collection, timeout), timeout, "health check");
            if (exists) {
                return Health.up()
                        .withDetail(DETAIL_KEY_STATUS, "Collection available")
                        .withDetail(DETAIL_KEY_COLLECTION, collection)
                        .build();
            }
            return Health.down()
                    .withDetail(DETAIL_KEY_STATUS, "Collection missing")
                    .withDetail(DETAIL_KEY_COLLECTION, collection)
                    .build();
        } catch (StorageFailureException storageFailure) {
            return Health.down()
                    .withDetail(DETAIL_KEY_STATUS, storageFailure.getMessage())
                    .withDetail(DETAIL_KEY_COLLECTION, collection)
                    .build();
        }
    }
}
