package com.williamcallahan.competencysearch.service.encoding;

import com.williamcallahan.competencysearch.config.AppProperties;
import com.williamcallahan.competencysearch.domain.SparseVector;
import com.williamcallahan.competencysearch.domain.errors.EncodingFailureException;
import com.williamcallahan.competencysearch.support.FailureMessages;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Turns text into the dense and sparse vectors used by indexing and search.
 *
 * <p>Over-long input is truncated silently to {@code app.embedding.max-input-chars}. Encoder calls run
 * on the search executor under {@code app.embedding.timeout}; dense and sparse encodes of the same
 * text run concurrently and the first failure cancels the other.</p>
 */
@Service
public class EncodingService {
    private static final Logger log = LoggerFactory.getLogger(EncodingService.class);

    private static final String DENSE = "dense";
    private static final String SPARSE = "sparse";

    private final EmbeddingClient embeddingClient;
    private final LexicalSparseVectorEncoder sparseVectorEncoder;
    private final Executor executor;
    private final int maxInputChars;
    private final Duration timeout;

    /**
     * Wires the encoders and the executor they run on.
     *
     * @param embeddingClient dense embedding provider
     * @param sparseVectorEncoder lexical sparse encoder
     * @param executor bounded executor shared with the retrieval fan-out
     * @param appProperties application configuration
     */
    public EncodingService(
            EmbeddingClient embeddingClient,
            LexicalSparseVectorEncoder sparseVectorEncoder,
            @Qualifier("searchTaskExecutor") Executor executor,
            AppProperties appProperties) {
        this.embeddingClient = Objects.requireNonNull(embeddingClient, "embeddingClient");
        this.sparseVectorEncoder = Objects.requireNonNull(sparseVectorEncoder, "sparseVectorEncoder");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.maxInputChars = appProperties.getEmbedding().getMaxInputChars();
        this.timeout = appProperties.getEmbedding().getTimeout();
    }

    /**
     * Dense and sparse encodings of one text.
     *
     * @param denseVector dense vector, or {@code null} when it was not requested
     * @param sparseVector sparse vector, empty when it was not requested
     */
    public record EncodedText(float[] denseVector, SparseVector sparseVector) {
        public EncodedText {
            sparseVector = sparseVector == null ? SparseVector.empty() : sparseVector;
        }

        public boolean hasDense() {
            return denseVector != null;
        }
    }

    /**
     * Encodes a text with both encoders concurrently.
     *
     * @param text text to encode
     * @return both encodings
     * @throws EncodingFailureException when either encoder fails or times out
     */
    public EncodedText encodeBoth(String text) {
        return encode(text, true, true);
    }

    /**
     * Encodes a text with the requested encoders, concurrently when both are requested.
     *
     * @param text text to encode
     * @param dense whether to compute the dense vector
     * @param sparse whether to compute the sparse vector
     * @return requested encodings
     * @throws EncodingFailureException when a requested encoder fails or times out
     */
    public EncodedText encode(String text, boolean dense, boolean sparse) {
        String boundedText = truncate(text);
        CompletableFuture<float[]> denseFuture = CompletableFuture.completedFuture(null);
        CompletableFuture<SparseVector> sparseFuture = CompletableFuture.completedFuture(SparseVector.empty());
        long deadlineNanos = System.nanoTime() + timeout.toNanos();
        try {
            if (dense) {
                denseFuture = submit(() -> encodeDenseNow(boundedText), DENSE);
            }
            if (sparse) {
                sparseFuture = submit(() -> sparseVectorEncoder.encode(boundedText), SPARSE);
            }
            float[] denseVector = await(denseFuture, DENSE, deadlineNanos);
            SparseVector sparseVector = await(sparseFuture, SPARSE, deadlineNanos);
            return new EncodedText(denseVector, sparseVector);
        } finally {
            denseFuture.cancel(true);
            sparseFuture.cancel(true);
        }
    }

    /**
     * Encodes a text into a dense vector.
     *
     * @param text text to encode
     * @return dense vector with the provider's dimensions
     */
    public float[] encodeDense(String text) {
        return encode(text, true, false).denseVector();
    }

    /**
     * Encodes a text into a sparse vector.
     *
     * @param text text to encode
     * @return sparse vector, empty when the text has no usable term
     */
    public SparseVector encodeSparse(String text) {
        return encode(text, false, true).sparseVector();
    }

    String truncate(String text) {
        if (text == null) {
            return "";
        }
        if (text.length() <= maxInputChars) {
            return text;
        }
        int end = maxInputChars;
        if (Character.isHighSurrogate(text.charAt(end - 1))) {
            end--;
        }
        log.debug("[EMBEDDING] Truncated input from {} to {} characters", text.length(), end);
        return text.substring(0, end);
    }

    private float[] encodeDenseNow(String text) {
        float[] vector = embeddingClient.embed(text);
        if (vector == null || vector.length != embeddingClient.dimensions()) {
            int received = vector == null ? 0 : vector.length;
            throw new EncodingFailureException("Dense encoder returned " + received + " dimensions, expected "
                    + embeddingClient.dimensions());
        }
        return vector;
    }

    private <T> CompletableFuture<T> submit(Supplier<T> encoder, String encoderName) {
        try {
            return CompletableFuture.supplyAsync(encoder, executor);
        } catch (RejectedExecutionException rejected) {
            throw new EncodingFailureException(encoderName + " encoding rejected: executor saturated", rejected);
        }
    }

    private <T> T await(CompletableFuture<T> future, String encoderName, long deadlineNanos) {
        long remainingNanos = Math.max(0L, deadlineNanos - System.nanoTime());
        try {
            return future.get(remainingNanos, TimeUnit.NANOSECONDS);
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
            throw new EncodingFailureException(encoderName + " encoding was interrupted", interrupted);
        } catch (ExecutionException executionException) {
            Throwable cause = executionException.getCause() == null ? executionException : executionException.getCause();
            if (cause instanceof EncodingFailureException encodingFailure) {
                throw encodingFailure;
            }
            log.warn("[EMBEDDING] {} encoder failed ({})", encoderName, cause.getClass().getSimpleName());
            throw new EncodingFailureException(
                    encoderName + " encoding failed: " + FailureMessages.describe(cause), cause);
        } catch (TimeoutException timeoutException) {
            log.warn("[EMBEDDING] {} encoder timed out after {}ms", encoderName, timeout.toMillis());
            throw new EncodingFailureException(
                    encoderName + " encoding exceeded timeout " + timeout.toMillis() + "ms", timeoutException);
        }
    }
}
