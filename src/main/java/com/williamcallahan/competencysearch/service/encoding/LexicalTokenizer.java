package com.williamcallahan.competencysearch.service.encoding;

import com.williamcallahan.competencysearch.support.AsciiTextNormalizer;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.standard.StandardAnalyzer;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;
import org.apache.lucene.util.StringHelper;

/**
 * Lucene-based tokenization and murmur3 feature hashing shared by the lexical encoders.
 *
 * <p>Text is accent-folded and lower-cased before analysis, so "Métier" and "metier" produce the same
 * term. Tokens shorter than two characters are dropped.</p>
 *
 * <p>{@link StandardAnalyzer} splits codes such as {@code ESCO-S123} into {@code esco} and {@code s123}.
 * Any whitespace-delimited chunk that the analyzer splits is also counted whole, so an exact code
 * match shares one more term with the query than a partial one.</p>
 */
final class LexicalTokenizer {

    private static final int MIN_TOKEN_LENGTH = 2;
    private static final String TOKEN_STREAM_FIELD = "indexed_text";
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private LexicalTokenizer() {}

    /**
     * Counts terms in first-occurrence order.
     *
     * @param text raw text (null treated as empty)
     * @return term counts, empty when the text has no usable token
     */
    static Map<String, Integer> countTerms(String text) {
        String normalized = normalize(text);
        Map<String, Integer> countsByTerm = new LinkedHashMap<>();
        if (normalized.isBlank()) {
            return countsByTerm;
        }
        try (StandardAnalyzer standardAnalyzer = new StandardAnalyzer()) {
            for (String lexicalToken : analyze(standardAnalyzer, normalized)) {
                countsByTerm.merge(lexicalToken, 1, Integer::sum);
            }
            for (String chunk : WHITESPACE.split(normalized)) {
                String compoundToken = trimPunctuation(chunk);
                if (compoundToken.length() >= MIN_TOKEN_LENGTH
                        && analyze(standardAnalyzer, compoundToken).size() > 1) {
                    countsByTerm.merge(compoundToken, 1, Integer::sum);
                }
            }
        }
        return countsByTerm;
    }

    private static List<String> analyze(StandardAnalyzer standardAnalyzer, String text) {
        List<String> lexicalTokens = new ArrayList<>();
        try (TokenStream tokenStream = standardAnalyzer.tokenStream(TOKEN_STREAM_FIELD, text)) {
            CharTermAttribute termAttribute = tokenStream.addAttribute(CharTermAttribute.class);
            tokenStream.reset();
            while (tokenStream.incrementToken()) {
                String lexicalToken = termAttribute.toString();
                if (lexicalToken.length() >= MIN_TOKEN_LENGTH) {
                    lexicalTokens.add(lexicalToken);
                }
            }
            tokenStream.end();
        } catch (IOException ioException) {
            throw new IllegalStateException("Failed to tokenize text for lexical encoding", ioException);
        }
        return lexicalTokens;
    }

    /**
     * Strips leading and trailing characters that are neither letters nor digits.
     */
    static String trimPunctuation(String chunk) {
        int start = 0;
        int end = chunk.length();
        while (start < end && !Character.isLetterOrDigit(chunk.charAt(start))) {
            start++;
        }
        while (end > start && !Character.isLetterOrDigit(chunk.charAt(end - 1))) {
            end--;
        }
        return chunk.substring(start, end);
    }

    /**
     * Murmur3 32-bit hash of a term, delegating to Lucene's {@link StringHelper#murmurhash3_x86_32}.
     *
     * <p>The seed must stay fixed: stored sparse vectors depend on it.</p>
     */
    static int murmurHash32(String term, int seed) {
        Objects.requireNonNull(term, "term");
        byte[] termBytes = term.getBytes(StandardCharsets.UTF_8);
        return StringHelper.murmurhash3_x86_32(termBytes, 0, termBytes.length, seed);
    }

    static long unsigned32ToLong(int value) {
        return value & 0xFFFF_FFFFL;
    }

    private static String normalize(String text) {
        if (text == null || text.isBlank()) {
            return "";
        }
        String folded = AsciiTextNormalizer.foldDiacritics(text);
        return AsciiTextNormalizer.toLowerAscii(folded).toLowerCase(Locale.ROOT);
    }
}
