package com.williamcallahan.competencysearch.service.encoding;

import com.williamcallahan.competencysearch.config.EmbeddingSettings;
import com.williamcallahan.competencysearch.domain.errors.EncodingFailureException;
import com.williamcallahan.competencysearch.support.FailureMessages;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

/**
 * Embedding client for an OpenAI-compatible {@code /v1/embeddings} server, without fallbacks.
 *
 * <p>Fails fast when the server is unreachable or answers with a malformed payload, so no record is
 * ever indexed with a synthetic vector. Every returned vector is checked against the configured
 * dimensions.</p>
 */
public class LocalEmbeddingClient implements EmbeddingClient {

    private static final Logger log = LoggerFactory.getLogger(LocalEmbeddingClient.class);

    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);
    private static final String EMBEDDINGS_PATH = "/v1/embeddings";

    private final String baseUrl;
    private final String modelName;
    private final int dimensions;
    private final int batchSize;
    private final RestTemplate restTemplate;

    /**
     * Creates a client for the configured embedding server.
     *
     * @param settings embedding settings (url, model, dimensions, batch size, read timeout)
     * @param restTemplateBuilder RestTemplate builder
     */
    public LocalEmbeddingClient(EmbeddingSettings settings, RestTemplateBuilder restTemplateBuilder) {
        Objects.requireNonNull(settings, "settings");
        this.baseUrl = stripTrailingSlash(settings.getServerUrl());
        this.modelName = settings.getModel();
        this.dimensions = settings.getDimensions();
        if (settings.getBatchSize() <= 0) {
            throw new IllegalArgumentException("batchSize must be positive");
        }
        this.batchSize = settings.getBatchSize();
        this.restTemplate = restTemplateBuilder
                .connectTimeout(CONNECT_TIMEOUT)
                .readTimeout(settings.getTimeout())
                .build();
    }

    @Override
    public List<float[]> embed(List<String> texts) {
        if (texts == null || texts.isEmpty()) {
            return List.of();
        }
        try {
            return embedInBatches(texts);
        } catch (RestClientResponseException apiException) {
            throw new EncodingFailureException(formatHttpFailure(apiException), apiException);
        } catch (RestClientException | IllegalStateException apiException) {
            String details = FailureMessages.sanitize(apiException.getMessage());
            String failureMessage = details.isBlank()
                    ? "Embedding request failed against " + baseUrl
                    : "Embedding request failed against " + baseUrl + ": " + details;
            throw new EncodingFailureException(failureMessage, apiException);
        }
    }

    @Override
    public int dimensions() {
        return dimensions;
    }

    private List<float[]> embedInBatches(List<String> texts) {
        List<float[]> embeddings = new ArrayList<>(texts.size());
        for (int startIndex = 0; startIndex < texts.size(); startIndex += batchSize) {
            int endIndex = Math.min(startIndex + batchSize, texts.size());
            List<String> batchInputTexts = List.copyOf(texts.subList(startIndex, endIndex));
            List<float[]> batchEmbeddings = fetchBatch(batchInputTexts);
            if (batchEmbeddings.size() != batchInputTexts.size()) {
                throw new IllegalStateException(
                        "Embedding response size mismatch for batch starting at index " + startIndex);
            }
            embeddings.addAll(batchEmbeddings);
        }
        log.debug("[EMBEDDING] Generated {} embeddings", embeddings.size());
        return List.copyOf(embeddings);
    }

    private List<float[]> fetchBatch(List<String> batchInputTexts) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        HttpEntity<EmbeddingBatchRequestPayload> entity =
                new HttpEntity<>(new EmbeddingBatchRequestPayload(modelName, batchInputTexts), headers);

        log.debug("[EMBEDDING] Calling embedding API batch with {} texts", batchInputTexts.size());
        EmbeddingResponsePayload response =
                restTemplate.postForObject(baseUrl + EMBEDDINGS_PATH, entity, EmbeddingResponsePayload.class);
        return parseEmbeddingResponse(response, batchInputTexts.size());
    }

    /**
     * Orders response entries by their declared index and validates each vector.
     */
    private List<float[]> parseEmbeddingResponse(EmbeddingResponsePayload response, int expectedCount) {
        if (response == null || response.data() == null || response.data().isEmpty()) {
            throw new IllegalStateException("Embedding response missing embedding entries");
        }

        float[][] embeddingsByIndex = new float[expectedCount][];
        List<EmbeddingVectorData> embeddingEntries = response.data();
        for (int entryIndex = 0; entryIndex < embeddingEntries.size(); entryIndex++) {
            EmbeddingVectorData embeddingEntry = embeddingEntries.get(entryIndex);
            if (embeddingEntry == null) {
                throw new IllegalStateException("Embedding response contained null entry at index " + entryIndex);
            }
            int targetIndex = embeddingEntry.index() == null ? entryIndex : embeddingEntry.index();
            if (targetIndex < 0 || targetIndex >= expectedCount) {
                throw new IllegalStateException("Embedding response index out of bounds: " + targetIndex
                        + " (expectedCount=" + expectedCount + ")");
            }
            if (embeddingsByIndex[targetIndex] != null) {
                throw new IllegalStateException("Embedding response contained duplicate index " + targetIndex);
            }
            embeddingsByIndex[targetIndex] = toEmbeddingVector(embeddingEntry.embedding(), targetIndex);
        }

        for (int expectedIndex = 0; expectedIndex < expectedCount; expectedIndex++) {
            if (embeddingsByIndex[expectedIndex] == null) {
                throw new IllegalStateException("Embedding response missing embedding for index " + expectedIndex);
            }
        }
        return Arrays.asList(embeddingsByIndex);
    }

    private float[] toEmbeddingVector(List<Double> embeddingValues, int embeddingIndex) {
        if (embeddingValues == null || embeddingValues.isEmpty()) {
            throw new IllegalStateException("Embedding response missing vector for index " + embeddingIndex);
        }
        if (embeddingValues.size() != dimensions) {
            throw new IllegalStateException("Embedding dimension mismatch at index " + embeddingIndex + ": expected "
                    + dimensions + " but received " + embeddingValues.size());
        }
        float[] embeddingVector = new float[embeddingValues.size()];
        for (int valueIndex = 0; valueIndex < embeddingValues.size(); valueIndex++) {
            Double embeddingValue = embeddingValues.get(valueIndex);
            if (embeddingValue == null) {
                throw new IllegalStateException("Embedding value was null at index " + valueIndex);
            }
            embeddingVector[valueIndex] = embeddingValue.floatValue();
        }
        return embeddingVector;
    }

    private static String formatHttpFailure(RestClientResponseException exception) {
        String payload = FailureMessages.sanitize(exception.getResponseBodyAsString());
        String prefix = "Embedding server returned HTTP " + exception.getStatusCode().value();
        return payload.isBlank() ? prefix : prefix + ": " + payload;
    }

    private static String stripTrailingSlash(String url) {
        String trimmed = Objects.requireNonNull(url, "serverUrl").trim();
        return trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
    }

    private record EmbeddingBatchRequestPayload(String model, List<String> input) {}

    private record EmbeddingResponsePayload(List<EmbeddingVectorData> data) {}

    private record EmbeddingVectorData(Integer index, List<Double> embedding) {}
}
