package com.williamcallahan.competencysearch.config;

import com.williamcallahan.competencysearch.domain.errors.StorageFailureException;
import com.williamcallahan.competencysearch.service.filter.CompetencyFieldSchema;
import com.williamcallahan.competencysearch.service.store.QdrantFutureAwaiter;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import io.qdrant.client.QdrantClient;
import io.qdrant.client.grpc.Collections.CollectionInfo;
import io.qdrant.client.grpc.Collections.CreateCollection;
import io.qdrant.client.grpc.Collections.Distance;
import io.qdrant.client.grpc.Collections.Modifier;
import io.qdrant.client.grpc.Collections.PayloadSchemaType;
import io.qdrant.client.grpc.Collections.SparseVectorConfig;
import io.qdrant.client.grpc.Collections.SparseVectorParams;
import io.qdrant.client.grpc.Collections.VectorParams;
import io.qdrant.client.grpc.Collections.VectorParamsMap;
import io.qdrant.client.grpc.Collections.VectorsConfig;
import jakarta.annotation.PostConstruct;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Makes sure the configured collection exists with the expected schema before the application
 * serves traffic.
 *
 * <p>A missing collection is created with the named dense vector, an IDF-weighted sparse vector and
 * keyword payload indexes on the fields filters hit most. An existing collection whose dense vector
 * size or distance disagrees with configuration aborts startup.</p>
 */
@Component
@ConditionalOnProperty(name = "app.vector-store.type", havingValue = AppProperties.STORE_QDRANT, matchIfMissing = true)
public class QdrantCollectionInitializer {
    private static final Logger log = LoggerFactory.getLogger(QdrantCollectionInitializer.class);

    private final QdrantClient qdrantClient;
    private final QdrantStore settings;

    public QdrantCollectionInitializer(QdrantClient qdrantClient, AppProperties appProperties) {
        this.qdrantClient = Objects.requireNonNull(qdrantClient, "qdrantClient");
        this.settings = Objects.requireNonNull(appProperties, "appProperties").getQdrant();
    }

    /**
     * Creates or verifies the collection.
     *
     * @throws IllegalStateException when the existing collection does not match configuration
     * @throws StorageFailureException when Qdrant cannot be reached
     */
    @PostConstruct
    public void ensureCollection() {
        String collection = settings.getCollection();
        Duration timeout = settings.getOperationTimeout();
        boolean exists = QdrantFutureAwaiter.awaitFuture(
                qdrantClient.collectionExistsAsync(collection, timeout), timeout, "collection exists");
        if (exists) {
            verifyCollection(collection, timeout);
            return;
        }
        if (createCollection(collection, timeout)) {
            createKeywordIndexes(collection, timeout);
        } else {
            verifyCollection(collection, timeout);
        }
    }

    /**
     * Returns {@code false} when another instance created the collection first.
     */
    private boolean createCollection(String collection, Duration timeout) {
        VectorParams denseParams = VectorParams.newBuilder()
                .setSize(settings.getVectorDimensions())
                .setDistance(Distance.valueOf(settings.getDistance()))
                .build();
        CreateCollection createCollection = CreateCollection.newBuilder()
                .setCollectionName(collection)
                .setVectorsConfig(VectorsConfig.newBuilder()
                        .setParamsMap(VectorParamsMap.newBuilder()
                                .putMap(settings.getDenseVectorName(), denseParams)
                                .build())
                        .build())
                .setSparseVectorsConfig(SparseVectorConfig.newBuilder()
                        .putMap(settings.getSparseVectorName(),
                                SparseVectorParams.newBuilder().setModifier(Modifier.Idf).build())
                        .build())
                .build();
        try {
            QdrantFutureAwaiter.awaitFuture(
                    qdrantClient.createCollectionAsync(createCollection, timeout), timeout, "create collection");
        } catch (StorageFailureException creationFailure) {
            if (isAlreadyExists(creationFailure)) {
                log.info("[QDRANT] Collection '{}' was created concurrently", collection);
                return false;
            }
            throw creationFailure;
        }
        log.info(
                "[QDRANT] Created collection '{}' (dense '{}' size={} distance={}, sparse '{}' modifier=Idf)",
                collection,
                settings.getDenseVectorName(),
                settings.getVectorDimensions(),
                settings.getDistance(),
                settings.getSparseVectorName());
        return true;
    }

    private void createKeywordIndexes(String collection, Duration timeout) {
        for (String field : CompetencyFieldSchema.KEYWORD_INDEX_FIELDS) {
            QdrantFutureAwaiter.awaitFuture(
                    qdrantClient.createPayloadIndexAsync(
                            collection, field, PayloadSchemaType.Keyword, null, true, null, timeout),
                    timeout,
                    "create payload index " + field);
            log.debug("[QDRANT] Created keyword index on '{}'", field);
        }
    }

    private void verifyCollection(String collection, Duration timeout) {
        CollectionInfo collectionInfo = QdrantFutureAwaiter.awaitFuture(
                qdrantClient.getCollectionInfoAsync(collection, timeout), timeout, "collection info");
        VectorsConfig vectorsConfig = collectionInfo.getConfig().getParams().getVectorsConfig();
        if (!vectorsConfig.hasParamsMap()) {
            throw new IllegalStateException("Qdrant collection '" + collection + "' does not use named vectors");
        }
        Map<String, VectorParams> vectorNameToParams = vectorsConfig.getParamsMap().getMapMap();
        VectorParams denseParams = vectorNameToParams.get(settings.getDenseVectorName());
        if (denseParams == null) {
            throw new IllegalStateException("Qdrant collection '" + collection + "' has no dense vector named '"
                    + settings.getDenseVectorName() + "'");
        }
        if (denseParams.getSize() != settings.getVectorDimensions()) {
            throw new IllegalStateException("Qdrant collection '" + collection + "' has dense vectors of size "
                    + denseParams.getSize() + " but app.qdrant.vector-dimensions is "
                    + settings.getVectorDimensions());
        }
        if (!denseParams.getDistance().name().equals(settings.getDistance())) {
            throw new IllegalStateException("Qdrant collection '" + collection + "' uses distance "
                    + denseParams.getDistance().name() + " but app.qdrant.distance is " + settings.getDistance());
        }
        if (!collectionInfo.getConfig().getParams().getSparseVectorsConfig().containsMap(settings.getSparseVectorName())) {
            throw new IllegalStateException("Qdrant collection '" + collection + "' has no sparse vector named '"
                    + settings.getSparseVectorName() + "'");
        }
        log.info("[QDRANT] Verified collection '{}' (size={}, distance={})",
                collection, denseParams.getSize(), settings.getDistance());
    }

    private static boolean isAlreadyExists(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof StatusRuntimeException statusException
                    && statusException.getStatus().getCode() == Status.Code.ALREADY_EXISTS) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }
}
