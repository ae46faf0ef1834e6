package com.williamcallahan.competencysearch.service.encoding;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.williamcallahan.competencysearch.config.AppProperties;
import com.williamcallahan.competencysearch.domain.errors.EncodingFailureException;
import com.williamcallahan.competencysearch.service.encoding.EncodingService.EncodedText;
import java.time.Duration;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.client.ResourceAccessException;

/**
 * Verifies concurrent encoding, truncation and failure mapping.
 */
class EncodingServiceTest {

    private EmbeddingClient embeddingClient;
    private AppProperties appProperties;

    @BeforeEach
    void setUp() {
        embeddingClient = mock(EmbeddingClient.class);
        when(embeddingClient.dimensions()).thenReturn(3);
        appProperties = new AppProperties();
    }

    @Test
    void encodesBothVectors() {
        when(embeddingClient.embed("Python programming")).thenReturn(new float[] {0.1f, 0.2f, 0.3f});

        EncodedText encoded = directService().encodeBoth("Python programming");

        assertTrue(encoded.hasDense());
        assertEquals(3, encoded.denseVector().length);
        assertFalse(encoded.sparseVector().isEmpty());
    }

    @Test
    void sparseOnlySkipsDenseProvider() {
        EncodedText encoded = directService().encode("Python programming", false, true);

        assertNull(encoded.denseVector());
        assertFalse(encoded.sparseVector().isEmpty());
        verify(embeddingClient, never()).embed(anyString());
    }

    @Test
    void truncatesOverlongInput() {
        appProperties.getEmbedding().setMaxInputChars(5);

        assertEquals("abcde", directService().truncate("abcdefgh"));
        assertEquals("abc", directService().truncate("abc"));
    }

    @Test
    void truncationDoesNotSplitSurrogatePairs() {
        appProperties.getEmbedding().setMaxInputChars(3);

        assertEquals("ab", directService().truncate("ab😀c"));
    }

    @Test
    void rejectsVectorsOfWrongDimension() {
        when(embeddingClient.embed(anyString())).thenReturn(new float[] {0.1f, 0.2f});

        assertThrows(EncodingFailureException.class, () -> directService().encodeDense("Python"));
    }

    @Test
    void wrapsProviderFailures() {
        when(embeddingClient.embed(anyString())).thenThrow(new ResourceAccessException("Connection refused"));

        EncodingFailureException failure =
                assertThrows(EncodingFailureException.class, () -> directService().encodeBoth("Python"));

        assertTrue(failure.getMessage().startsWith("dense encoding failed"));
    }

    @Test
    void failsWhenEncoderExceedsTimeout() {
        appProperties.getEmbedding().setTimeout(Duration.ofMillis(50));
        when(embeddingClient.embed(anyString())).thenAnswer(invocation -> {
            Thread.sleep(2_000);
            return new float[] {0.1f, 0.2f, 0.3f};
        });
        ExecutorService executorService = Executors.newFixedThreadPool(2);
        try {
            EncodingService encodingService = new EncodingService(
                    embeddingClient, new LexicalSparseVectorEncoder(), executorService, appProperties);

            EncodingFailureException failure =
                    assertThrows(EncodingFailureException.class, () -> encodingService.encodeDense("Python"));

            assertTrue(failure.getMessage().contains("timeout"));
        } finally {
            executorService.shutdownNow();
        }
    }

    @Test
    void saturatedExecutorFailsAsRetryableEncodingFailure() {
        Executor saturated = command -> {
            throw new RejectedExecutionException("search executor saturated");
        };
        EncodingService encodingService =
                new EncodingService(embeddingClient, new LexicalSparseVectorEncoder(), saturated, appProperties);

        EncodingFailureException failure =
                assertThrows(EncodingFailureException.class, () -> encodingService.encodeBoth("Python"));

        assertTrue(failure.isRetryable());
        assertTrue(failure.getCause() instanceof RejectedExecutionException);
        verify(embeddingClient, never()).embed(anyString());
    }

    private EncodingService directService() {
        return new EncodingService(embeddingClient, new LexicalSparseVectorEncoder(), Runnable::run, appProperties);
    }
}
