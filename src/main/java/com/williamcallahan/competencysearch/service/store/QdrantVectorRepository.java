package com.williamcallahan.competencysearch.service.store;

import static io.qdrant.client.PointIdFactory.id;
import static io.qdrant.client.QueryFactory.nearest;
import static io.qdrant.client.VectorFactory.vector;
import static io.qdrant.client.VectorInputFactory.vectorInput;
import static io.qdrant.client.VectorsFactory.namedVectors;

import com.williamcallahan.competencysearch.config.QdrantStore;
import com.williamcallahan.competencysearch.domain.Competency;
import com.williamcallahan.competencysearch.domain.SparseVector;
import com.williamcallahan.competencysearch.domain.errors.StorageFailureException;
import com.williamcallahan.competencysearch.domain.errors.ValidationException;
import com.williamcallahan.competencysearch.service.filter.RetrievalPredicate;
import com.williamcallahan.competencysearch.support.RetrySupport;
import io.qdrant.client.QdrantClient;
import io.qdrant.client.grpc.Common.PointId;
import io.qdrant.client.grpc.Points.PointStruct;
import io.qdrant.client.grpc.Points.QueryPoints;
import io.qdrant.client.grpc.Points.RetrievedPoint;
import io.qdrant.client.grpc.Points.ScoredPoint;
import io.qdrant.client.grpc.Points.UpdateResult;
import io.qdrant.client.grpc.Points.UpdateStatus;
import io.qdrant.client.grpc.Points.Vector;
import io.qdrant.client.grpc.Points.WithPayloadSelector;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Qdrant-backed vector repository using one collection with a named dense vector and a named
 * sparse vector per point.
 *
 * <p>Uses {@code io.qdrant:client} gRPC primitives directly. Every call is bounded by
 * {@code app.qdrant.operation-timeout}; connection-level failures are retried up to
 * {@code app.qdrant.connection-retry-attempts} before surfacing as {@link StorageFailureException}.
 * Queries fetch identifiers and scores only, payloads are loaded afterwards in one batch.</p>
 */
public class QdrantVectorRepository implements VectorRepository {
    private static final Logger log = LoggerFactory.getLogger(QdrantVectorRepository.class);

    private final QdrantClient qdrantClient;
    private final QdrantFilterRenderer filterRenderer;
    private final CompetencyPayloadMapper payloadMapper;
    private final String collectionName;
    private final String denseVectorName;
    private final String sparseVectorName;
    private final Duration operationTimeout;
    private final int retryAttempts;

    /**
     * Wires the gRPC client and the collection settings.
     *
     * @param qdrantClient Qdrant gRPC client
     * @param filterRenderer renderer for compiled predicates
     * @param payloadMapper competency payload conversion
     * @param settings Qdrant settings
     */
    public QdrantVectorRepository(
            QdrantClient qdrantClient,
            QdrantFilterRenderer filterRenderer,
            CompetencyPayloadMapper payloadMapper,
            QdrantStore settings) {
        this.qdrantClient = Objects.requireNonNull(qdrantClient, "qdrantClient");
        this.filterRenderer = Objects.requireNonNull(filterRenderer, "filterRenderer");
        this.payloadMapper = Objects.requireNonNull(payloadMapper, "payloadMapper");
        this.collectionName = settings.getCollection();
        this.denseVectorName = settings.getDenseVectorName();
        this.sparseVectorName = settings.getSparseVectorName();
        this.operationTimeout = settings.getOperationTimeout();
        this.retryAttempts = settings.getConnectionRetryAttempts();
    }

    @Override
    public void upsert(String identifier, float[] denseVector, SparseVector sparseVector, Competency competency) {
        PointStruct point = buildPoint(identifier, denseVector, sparseVector, competency);
        UpdateResult updateResult = withRetry(
                "upsert",
                () -> QdrantFutureAwaiter.awaitFuture(
                        qdrantClient.upsertAsync(collectionName, List.of(point)), operationTimeout, "upsert"));
        requireApplied(updateResult, "upsert");
        log.debug("[QDRANT] Upserted point {} into {}", identifier, collectionName);
    }

    @Override
    public void delete(String identifier) {
        PointId pointId = pointId(identifier);
        UpdateResult updateResult = withRetry(
                "delete",
                () -> QdrantFutureAwaiter.awaitFuture(
                        qdrantClient.deleteAsync(collectionName, List.of(pointId)), operationTimeout, "delete"));
        requireApplied(updateResult, "delete");
    }

    @Override
    public Optional<Competency> get(String identifier) {
        return Optional.ofNullable(getAll(List.of(identifier)).get(identifier));
    }

    @Override
    public Map<String, Competency> getAll(Collection<String> identifiers) {
        if (identifiers.isEmpty()) {
            return Map.of();
        }
        List<PointId> pointIds = identifiers.stream().map(QdrantVectorRepository::pointId).toList();
        List<RetrievedPoint> retrievedPoints = withRetry(
                "retrieve",
                () -> QdrantFutureAwaiter.awaitFuture(
                        qdrantClient.retrieveAsync(collectionName, pointIds, true, false, null),
                        operationTimeout,
                        "retrieve"));
        Map<String, Competency> competenciesById = new LinkedHashMap<>();
        for (RetrievedPoint retrievedPoint : retrievedPoints) {
            String identifier = extractPointId(retrievedPoint.getId());
            Map<String, Object> payload = QdrantPayloadConverter.fromQdrantPayload(retrievedPoint.getPayloadMap());
            competenciesById.put(identifier, payloadMapper.fromPayload(identifier, payload));
        }
        return competenciesById;
    }

    @Override
    public List<ScoredCandidate> queryDense(float[] denseVector, int limit, RetrievalPredicate predicate) {
        QueryPoints.Builder queryBuilder = baseQuery(limit, predicate)
                .setQuery(nearest(denseVector))
                .setUsing(denseVectorName);
        return runQuery(queryBuilder.build(), "dense query");
    }

    @Override
    public List<ScoredCandidate> querySparse(SparseVector sparseVector, int limit, RetrievalPredicate predicate) {
        if (sparseVector.isEmpty()) {
            return List.of();
        }
        QueryPoints.Builder queryBuilder = baseQuery(limit, predicate)
                .setQuery(nearest(vectorInput(sparseVector.values(), sparseVector.integerIndices())))
                .setUsing(sparseVectorName);
        return runQuery(queryBuilder.build(), "sparse query");
    }

    private QueryPoints.Builder baseQuery(int limit, RetrievalPredicate predicate) {
        QueryPoints.Builder builder = QueryPoints.newBuilder()
                .setCollectionName(collectionName)
                .setWithPayload(WithPayloadSelector.newBuilder().setEnable(false).build())
                .setLimit(limit);
        filterRenderer.render(predicate).ifPresent(builder::setFilter);
        return builder;
    }

    private List<ScoredCandidate> runQuery(QueryPoints queryPoints, String operation) {
        List<ScoredPoint> scoredPoints = withRetry(
                operation,
                () -> QdrantFutureAwaiter.awaitFuture(
                        qdrantClient.queryAsync(queryPoints), operationTimeout, operation));
        List<ScoredCandidate> candidates = new ArrayList<>(scoredPoints.size());
        for (ScoredPoint scoredPoint : scoredPoints) {
            candidates.add(new ScoredCandidate(extractPointId(scoredPoint.getId()), scoredPoint.getScore()));
        }
        return List.copyOf(candidates);
    }

    private PointStruct buildPoint(
            String identifier, float[] denseVector, SparseVector sparseVector, Competency competency) {
        Map<String, Vector> namedVectorMap = new LinkedHashMap<>();
        namedVectorMap.put(denseVectorName, vector(Objects.requireNonNull(denseVector, "denseVector")));
        if (sparseVector != null && !sparseVector.isEmpty()) {
            namedVectorMap.put(sparseVectorName, vector(sparseVector.values(), sparseVector.integerIndices()));
        }
        return PointStruct.newBuilder()
                .setId(pointId(identifier))
                .setVectors(namedVectors(namedVectorMap))
                .putAllPayload(QdrantPayloadConverter.toQdrantPayload(payloadMapper.toPayload(competency)))
                .build();
    }

    private <T> T withRetry(String operation, Supplier<T> call) {
        return RetrySupport.executeWithRetry(
                call, "[QDRANT] " + operation, retryAttempts, RetrySupport.DEFAULT_INITIAL_BACKOFF);
    }

    private static void requireApplied(UpdateResult updateResult, String operation) {
        UpdateStatus status = updateResult.getStatus();
        if (status != UpdateStatus.Completed && status != UpdateStatus.Acknowledged) {
            throw new StorageFailureException("Qdrant " + operation + " was not applied (status=" + status + ")");
        }
    }

    private static PointId pointId(String identifier) {
        try {
            return id(UUID.fromString(identifier));
        } catch (IllegalArgumentException invalidUuid) {
            throw new ValidationException("Identifier is not a UUID: " + identifier);
        }
    }

    private static String extractPointId(PointId pointId) {
        if (pointId.hasUuid()) {
            return pointId.getUuid();
        }
        return String.valueOf(pointId.getNum());
    }
}
