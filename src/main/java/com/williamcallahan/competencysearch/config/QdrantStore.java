package com.williamcallahan.competencysearch.config;

import java.time.Duration;
import java.util.Locale;
import java.util.Set;

/**
 * Qdrant connection and collection schema settings.
 */
public class QdrantStore {

    private static final String HOST_DEF = "localhost";
    private static final int PORT_DEF = 6334;
    private static final String COLLECTION_DEF = "entities";
    private static final String DENSE_NAME_DEF = "dense";
    private static final String SPARSE_NAME_DEF = "sparse";
    private static final int DIM_DEF = 1_024;
    private static final String DISTANCE_DEF = "Cosine";
    private static final Duration OPERATION_TIMEOUT_DEF = Duration.ofSeconds(10);
    private static final int RETRY_ATTEMPTS_DEF = 2;
    private static final int MAX_PORT = 65_535;
    private static final Set<String> DISTANCES = Set.of("Cosine", "Dot", "Euclid", "Manhattan");
    private static final String HOST_KEY = "app.qdrant.host";
    private static final String PORT_KEY = "app.qdrant.port";
    private static final String COLLECTION_KEY = "app.qdrant.collection";
    private static final String DENSE_NAME_KEY = "app.qdrant.dense-vector-name";
    private static final String SPARSE_NAME_KEY = "app.qdrant.sparse-vector-name";
    private static final String DIM_KEY = "app.qdrant.vector-dimensions";
    private static final String DISTANCE_KEY = "app.qdrant.distance";
    private static final String OPERATION_TIMEOUT_KEY = "app.qdrant.operation-timeout";
    private static final String RETRY_ATTEMPTS_KEY = "app.qdrant.connection-retry-attempts";
    private static final String BLANK_FMT = "%s must not be blank.";
    private static final String POSITIVE_FMT = "%s must be greater than 0.";

    private String host = HOST_DEF;
    private int port = PORT_DEF;
    private boolean useTls;
    private String apiKey = "";
    private String collection = COLLECTION_DEF;
    private String denseVectorName = DENSE_NAME_DEF;
    private String sparseVectorName = SPARSE_NAME_DEF;
    private int vectorDimensions = DIM_DEF;
    private String distance = DISTANCE_DEF;
    private Duration operationTimeout = OPERATION_TIMEOUT_DEF;
    private int connectionRetryAttempts = RETRY_ATTEMPTS_DEF;

    /**
     * Validates Qdrant settings.
     */
    public void validateConfiguration() {
        requireText(HOST_KEY, host);
        requireText(COLLECTION_KEY, collection);
        requireText(DENSE_NAME_KEY, denseVectorName);
        requireText(SPARSE_NAME_KEY, sparseVectorName);
        if (port < 1 || port > MAX_PORT) {
            throw new IllegalArgumentException(
                    String.format(Locale.ROOT, "%s must be between 1 and %d.", PORT_KEY, MAX_PORT));
        }
        if (denseVectorName.equals(sparseVectorName)) {
            throw new IllegalArgumentException(DENSE_NAME_KEY + " and " + SPARSE_NAME_KEY + " must differ.");
        }
        if (vectorDimensions < 1) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, POSITIVE_FMT, DIM_KEY));
        }
        if (!DISTANCES.contains(distance)) {
            throw new IllegalArgumentException(String.format(
                    Locale.ROOT, "%s must be one of %s (got '%s').", DISTANCE_KEY, DISTANCES, distance));
        }
        if (operationTimeout == null || operationTimeout.isZero() || operationTimeout.isNegative()) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, POSITIVE_FMT, OPERATION_TIMEOUT_KEY));
        }
        if (connectionRetryAttempts < 1) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, POSITIVE_FMT, RETRY_ATTEMPTS_KEY));
        }
    }

    public String getHost() {
        return host;
    }

    public void setHost(String host) {
        this.host = host;
    }

    public int getPort() {
        return port;
    }

    public void setPort(int port) {
        this.port = port;
    }

    public boolean isUseTls() {
        return useTls;
    }

    public void setUseTls(boolean useTls) {
        this.useTls = useTls;
    }

    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey == null ? "" : apiKey;
    }

    public String getCollection() {
        return collection;
    }

    public void setCollection(String collection) {
        this.collection = collection;
    }

    public String getDenseVectorName() {
        return denseVectorName;
    }

    public void setDenseVectorName(String denseVectorName) {
        this.denseVectorName = denseVectorName;
    }

    public String getSparseVectorName() {
        return sparseVectorName;
    }

    public void setSparseVectorName(String sparseVectorName) {
        this.sparseVectorName = sparseVectorName;
    }

    public int getVectorDimensions() {
        return vectorDimensions;
    }

    public void setVectorDimensions(int vectorDimensions) {
        this.vectorDimensions = vectorDimensions;
    }

    public String getDistance() {
        return distance;
    }

    public void setDistance(String distance) {
        this.distance = distance;
    }

    public Duration getOperationTimeout() {
        return operationTimeout;
    }

    public void setOperationTimeout(Duration operationTimeout) {
        this.operationTimeout = operationTimeout;
    }

    public int getConnectionRetryAttempts() {
        return connectionRetryAttempts;
    }

    public void setConnectionRetryAttempts(int connectionRetryAttempts) {
        this.connectionRetryAttempts = connectionRetryAttempts;
    }

    private static void requireText(String propertyKey, String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, BLANK_FMT, propertyKey));
        }
    }
}
