package com.williamcallahan.competencysearch.domain;

import java.util.List;

/**
 * Sparse vector with ascending unique indices, matching Qdrant's {@code SparseVector} shape.
 */
public record SparseVector(List<Long> indices, List<Float> values) {
    public SparseVector {
        indices = indices == null ? List.of() : List.copyOf(indices);
        values = values == null ? List.of() : List.copyOf(values);
        if (indices.size() != values.size()) {
            throw new IllegalArgumentException("Sparse vector indices and values must be same length");
        }
    }

    /**
     * Returns an empty sparse vector with no indices or values.
     */
    public static SparseVector empty() {
        return new SparseVector(List.of(), List.of());
    }

    public boolean isEmpty() {
        return indices.isEmpty();
    }

    /**
     * Returns indices narrowed to {@code int} for Qdrant gRPC APIs that require 32-bit indices.
     *
     * <p>Feature-hashed token indices fit within unsigned 32-bit range, so narrowing keeps them distinct.</p>
     */
    public List<Integer> integerIndices() {
        return indices.stream().map(Long::intValue).toList();
    }

    /**
     * Computes the dot product with another sparse vector.
     *
     * @param other vector to multiply with
     * @return sum of the products of weights sharing an index
     */
    public double dot(SparseVector other) {
        double product = 0.0;
        int left = 0;
        int right = 0;
        while (left < indices.size() && right < other.indices.size()) {
            int order = Long.compare(indices.get(left), other.indices.get(right));
            if (order == 0) {
                product += (double) values.get(left) * other.values.get(right);
                left++;
                right++;
            } else if (order < 0) {
                left++;
            } else {
                right++;
            }
        }
        return product;
    }
}
