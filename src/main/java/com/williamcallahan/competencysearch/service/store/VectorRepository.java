package com.williamcallahan.competencysearch.service.store;

import com.williamcallahan.competencysearch.domain.Competency;
import com.williamcallahan.competencysearch.domain.SparseVector;
import com.williamcallahan.competencysearch.domain.errors.StorageFailureException;
import com.williamcallahan.competencysearch.service.filter.RetrievalPredicate;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Storage port for competencies and their dense and sparse vectors.
 *
 * <p>Filtering happens inside the store, so the {@code limit} of a query is the number of hits left
 * after filtering. Every method raises {@link StorageFailureException} when the store fails.</p>
 */
public interface VectorRepository {

    /**
     * Writes both vectors and the payload of one record in a single operation, replacing any record
     * stored under the same identifier.
     *
     * @param identifier UUID string
     * @param denseVector dense vector
     * @param sparseVector sparse vector (may be empty)
     * @param competency payload
     */
    void upsert(String identifier, float[] denseVector, SparseVector sparseVector, Competency competency);

    /**
     * Removes a record. Removing an absent identifier is not an error.
     *
     * @param identifier UUID string
     */
    void delete(String identifier);

    /**
     * Fetches the payload stored under an identifier.
     *
     * @param identifier UUID string
     * @return payload, empty when absent
     */
    Optional<Competency> get(String identifier);

    /**
     * Fetches several payloads in one call.
     *
     * @param identifiers UUID strings
     * @return payloads keyed by identifier; absent identifiers are missing from the map
     */
    Map<String, Competency> getAll(Collection<String> identifiers);

    /**
     * Dense nearest-neighbour query.
     *
     * @param denseVector query vector
     * @param limit maximum hits
     * @param predicate filter applied inside the store
     * @return hits by descending similarity
     */
    List<ScoredCandidate> queryDense(float[] denseVector, int limit, RetrievalPredicate predicate);

    /**
     * Sparse lexical query.
     *
     * @param sparseVector query vector
     * @param limit maximum hits
     * @param predicate filter applied inside the store
     * @return hits by descending relevance
     */
    List<ScoredCandidate> querySparse(SparseVector sparseVector, int limit, RetrievalPredicate predicate);
}
