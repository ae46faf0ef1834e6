package com.williamcallahan.competencysearch.service.encoding;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Deterministic CPU-only embedding built from signed feature hashing of lexical terms.
 *
 * <p>Not semantically strong: two texts are close only when they share terms. Used for local
 * development and tests where no embedding server runs.</p>
 */
public class LocalHashingEmbeddingClient implements EmbeddingClient {

    private static final int BUCKET_SEED = 17;
    private static final int SIGN_SEED = 31;

    private final int dimensions;

    public LocalHashingEmbeddingClient(int dimensions) {
        if (dimensions <= 0) {
            throw new IllegalArgumentException("dimensions must be positive");
        }
        this.dimensions = dimensions;
    }

    @Override
    public List<float[]> embed(List<String> texts) {
        if (texts == null || texts.isEmpty()) {
            return List.of();
        }
        List<float[]> vectors = new ArrayList<>(texts.size());
        for (String text : texts) {
            vectors.add(hashToVector(text));
        }
        return List.copyOf(vectors);
    }

    @Override
    public int dimensions() {
        return dimensions;
    }

    private float[] hashToVector(String text) {
        double[] accumulator = new double[dimensions];
        Map<String, Integer> countsByTerm = LexicalTokenizer.countTerms(text);
        for (Map.Entry<String, Integer> termCount : countsByTerm.entrySet()) {
            String term = termCount.getKey();
            int bucket = (int) (LexicalTokenizer.unsigned32ToLong(LexicalTokenizer.murmurHash32(term, BUCKET_SEED))
                    % dimensions);
            double sign = (LexicalTokenizer.murmurHash32(term, SIGN_SEED) & 1) == 0 ? 1.0 : -1.0;
            accumulator[bucket] += sign * termCount.getValue();
        }

        double squaredNorm = 0.0;
        for (double component : accumulator) {
            squaredNorm += component * component;
        }
        float[] vector = new float[dimensions];
        if (squaredNorm == 0.0) {
            return vector;
        }
        double norm = Math.sqrt(squaredNorm);
        for (int i = 0; i < dimensions; i++) {
            vector[i] = (float) (accumulator[i] / norm);
        }
        return vector;
    }
}
