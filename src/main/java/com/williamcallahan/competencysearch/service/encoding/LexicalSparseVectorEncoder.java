package com.williamcallahan.competencysearch.service.encoding;

import com.williamcallahan.competencysearch.domain.SparseVector;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Encodes text into a sparse lexical vector for the sparse retrieval branch.
 *
 * <p>Tokens are feature-hashed to unsigned 32-bit indices and weighted by BM25 term-frequency
 * saturation, {@code tf * (k1 + 1) / (tf + k1)}: a single occurrence weighs 1 and no amount of
 * repetition exceeds {@code k1 + 1}. The Qdrant collection pairs these vectors with
 * {@code modifier=idf}, which turns the dot product into a BM25-like relevance score. At most
 * {@value #MAX_UNIQUE_TOKENS} distinct indices are kept, the most frequent first.</p>
 */
public class LexicalSparseVectorEncoder {

    private static final int MAX_UNIQUE_TOKENS = 256;
    private static final int HASH_SEED = 0;
    static final double TERM_SATURATION_K1 = 1.2;

    /**
     * Encodes the provided text into a sparse vector representation.
     *
     * @param text document text (null treated as empty)
     * @return sparse vector with ascending unique indices and saturated term-frequency values
     */
    public SparseVector encode(String text) {
        Map<String, Integer> countsByTerm = LexicalTokenizer.countTerms(text);
        if (countsByTerm.isEmpty()) {
            return SparseVector.empty();
        }

        // distinct terms may collide on one index; their counts add up
        Map<Long, Integer> countsByIndex = new TreeMap<>();
        countsByTerm.forEach((term, count) -> countsByIndex.merge(
                LexicalTokenizer.unsigned32ToLong(LexicalTokenizer.murmurHash32(term, HASH_SEED)), count, Integer::sum));

        List<TokenCount> tokenCounts = new ArrayList<>(countsByIndex.size());
        countsByIndex.forEach((index, count) -> tokenCounts.add(new TokenCount(index, count)));

        List<TokenCount> retained = tokenCounts;
        if (tokenCounts.size() > MAX_UNIQUE_TOKENS) {
            tokenCounts.sort(
                    Comparator.comparingInt(TokenCount::count).reversed().thenComparingLong(TokenCount::index));
            retained = new ArrayList<>(tokenCounts.subList(0, MAX_UNIQUE_TOKENS));
            retained.sort(Comparator.comparingLong(TokenCount::index));
        }

        List<Long> indices = new ArrayList<>(retained.size());
        List<Float> values = new ArrayList<>(retained.size());
        for (TokenCount tokenCount : retained) {
            indices.add(tokenCount.index());
            values.add(saturate(tokenCount.count()));
        }
        return new SparseVector(indices, values);
    }

    static float saturate(int termFrequency) {
        return (float) (termFrequency * (TERM_SATURATION_K1 + 1.0) / (termFrequency + TERM_SATURATION_K1));
    }

    private record TokenCount(long index, int count) {}
}
