package com.williamcallahan.competencysearch.service.store;

import com.williamcallahan.competencysearch.domain.Competency;
import com.williamcallahan.competencysearch.domain.SparseVector;
import com.williamcallahan.competencysearch.service.filter.RetrievalPredicate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.ToDoubleFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-local vector repository for development and tests.
 *
 * <p>Dense queries use exact cosine similarity, sparse queries the dot product; like Qdrant, sparse
 * queries only return records sharing at least one term with the query. Equal scores are ordered by
 * identifier so results are reproducible.</p>
 */
public class InMemoryVectorRepository implements VectorRepository {

    private static final Logger log = LoggerFactory.getLogger(InMemoryVectorRepository.class);

    private final ConcurrentHashMap<String, StoredPoint> points = new ConcurrentHashMap<>();
    private final CompetencyPayloadMapper payloadMapper;

    public InMemoryVectorRepository(CompetencyPayloadMapper payloadMapper) {
        this.payloadMapper = Objects.requireNonNull(payloadMapper, "payloadMapper");
        log.info("[STORE] Using in-memory vector repository; records are lost on shutdown");
    }

    @Override
    public void upsert(String identifier, float[] denseVector, SparseVector sparseVector, Competency competency) {
        Objects.requireNonNull(identifier, "identifier");
        StoredPoint storedPoint = new StoredPoint(
                denseVector.clone(),
                sparseVector == null ? SparseVector.empty() : sparseVector,
                competency,
                payloadMapper.toPayload(competency));
        points.put(identifier, storedPoint);
    }

    @Override
    public void delete(String identifier) {
        points.remove(identifier);
    }

    @Override
    public Optional<Competency> get(String identifier) {
        return Optional.ofNullable(points.get(identifier)).map(StoredPoint::competency);
    }

    @Override
    public Map<String, Competency> getAll(Collection<String> identifiers) {
        Map<String, Competency> found = new LinkedHashMap<>();
        for (String identifier : identifiers) {
            StoredPoint storedPoint = points.get(identifier);
            if (storedPoint != null) {
                found.put(identifier, storedPoint.competency());
            }
        }
        return found;
    }

    @Override
    public List<ScoredCandidate> queryDense(float[] denseVector, int limit, RetrievalPredicate predicate) {
        return rank(limit, predicate, storedPoint -> cosineSimilarity(denseVector, storedPoint.denseVector()), false);
    }

    @Override
    public List<ScoredCandidate> querySparse(SparseVector sparseVector, int limit, RetrievalPredicate predicate) {
        if (sparseVector.isEmpty()) {
            return List.of();
        }
        return rank(limit, predicate, storedPoint -> sparseVector.dot(storedPoint.sparseVector()), true);
    }

    /**
     * Returns the number of stored records.
     */
    public int size() {
        return points.size();
    }

    private List<ScoredCandidate> rank(
            int limit, RetrievalPredicate predicate, ToDoubleFunction<StoredPoint> scorer, boolean positiveOnly) {
        if (limit <= 0 || predicate.matchesNothing()) {
            return List.of();
        }
        List<ScoredCandidate> candidates = new ArrayList<>();
        for (Map.Entry<String, StoredPoint> entry : points.entrySet()) {
            StoredPoint storedPoint = entry.getValue();
            if (!predicate.test(storedPoint.payload())) {
                continue;
            }
            double score = scorer.applyAsDouble(storedPoint);
            if (positiveOnly && score <= 0.0) {
                continue;
            }
            candidates.add(new ScoredCandidate(entry.getKey(), score));
        }
        candidates.sort(Comparator.comparingDouble(ScoredCandidate::score)
                .reversed()
                .thenComparing(ScoredCandidate::identifier));
        return candidates.size() <= limit ? List.copyOf(candidates) : List.copyOf(candidates.subList(0, limit));
    }

    private static double cosineSimilarity(float[] left, float[] right) {
        if (left.length != right.length) {
            throw new IllegalArgumentException("Vectors must have same dimension");
        }
        double dotProduct = 0.0;
        double normLeft = 0.0;
        double normRight = 0.0;
        for (int i = 0; i < left.length; i++) {
            dotProduct += left[i] * right[i];
            normLeft += left[i] * left[i];
            normRight += right[i] * right[i];
        }
        if (normLeft == 0.0 || normRight == 0.0) {
            return 0.0;
        }
        return dotProduct / (Math.sqrt(normLeft) * Math.sqrt(normRight));
    }

    private record StoredPoint(
            float[] denseVector, SparseVector sparseVector, Competency competency, Map<String, Object> payload) {}
}
