package com.williamcallahan.competencysearch.config;

import java.time.Duration;
import java.util.Locale;

/**
 * Dense embedding provider settings.
 *
 * <p>{@code local} calls an OpenAI-compatible {@code /v1/embeddings} server; {@code hash} uses the
 * deterministic in-process feature-hashing encoder.</p>
 */
public class EmbeddingSettings {

    public static final String PROVIDER_LOCAL = "local";
    public static final String PROVIDER_HASH = "hash";

    private static final String URL_DEF = "http://127.0.0.1:8088";
    private static final String MODEL_DEF = "Qwen/Qwen3-Embedding-0.6B";
    private static final int DIM_DEF = 1_024;
    private static final int BATCH_SIZE_DEF = 32;
    private static final int MAX_INPUT_CHARS_DEF = 8_192;
    private static final Duration TIMEOUT_DEF = Duration.ofSeconds(30);
    private static final String PROVIDER_KEY = "app.embedding.provider";
    private static final String URL_KEY = "app.embedding.server-url";
    private static final String MODEL_KEY = "app.embedding.model";
    private static final String DIM_KEY = "app.embedding.dimensions";
    private static final String BATCH_SIZE_KEY = "app.embedding.batch-size";
    private static final String MAX_INPUT_CHARS_KEY = "app.embedding.max-input-chars";
    private static final String TIMEOUT_KEY = "app.embedding.timeout";
    private static final String POSITIVE_FMT = "%s must be greater than 0.";

    private String provider = PROVIDER_LOCAL;
    private String serverUrl = URL_DEF;
    private String model = MODEL_DEF;
    private int dimensions = DIM_DEF;
    private int batchSize = BATCH_SIZE_DEF;
    private int maxInputChars = MAX_INPUT_CHARS_DEF;
    private Duration timeout = TIMEOUT_DEF;

    /**
     * Validates embedding settings.
     */
    public void validateConfiguration() {
        if (!PROVIDER_LOCAL.equals(provider) && !PROVIDER_HASH.equals(provider)) {
            throw new IllegalArgumentException(String.format(
                    Locale.ROOT,
                    "%s must be '%s' or '%s' (got '%s').",
                    PROVIDER_KEY,
                    PROVIDER_LOCAL,
                    PROVIDER_HASH,
                    provider));
        }
        if (PROVIDER_LOCAL.equals(provider)) {
            if (serverUrl == null || serverUrl.isBlank()) {
                throw new IllegalStateException(URL_KEY + " must not be blank for the local provider.");
            }
            if (model == null || model.isBlank()) {
                throw new IllegalStateException(MODEL_KEY + " must not be blank for the local provider.");
            }
        }
        requirePositive(DIM_KEY, dimensions);
        requirePositive(BATCH_SIZE_KEY, batchSize);
        requirePositive(MAX_INPUT_CHARS_KEY, maxInputChars);
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, POSITIVE_FMT, TIMEOUT_KEY));
        }
    }

    public String getProvider() {
        return provider;
    }

    public void setProvider(String provider) {
        this.provider = provider;
    }

    public String getServerUrl() {
        return serverUrl;
    }

    public void setServerUrl(String serverUrl) {
        this.serverUrl = serverUrl;
    }

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    public int getDimensions() {
        return dimensions;
    }

    public void setDimensions(int dimensions) {
        this.dimensions = dimensions;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    public int getMaxInputChars() {
        return maxInputChars;
    }

    public void setMaxInputChars(int maxInputChars) {
        this.maxInputChars = maxInputChars;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public void setTimeout(Duration timeout) {
        this.timeout = timeout;
    }

    private static void requirePositive(String propertyKey, int value) {
        if (value < 1) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, POSITIVE_FMT, propertyKey));
        }
    }
}
