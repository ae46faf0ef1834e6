package com.williamcallahan.competencysearch.config;

import jakarta.annotation.PostConstruct;
import java.util.Locale;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Root of the {@code app.*} configuration tree, validated once at startup.
 */
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    public static final String STORE_QDRANT = "qdrant";
    public static final String STORE_MEMORY = "memory";

    private static final String STORE_TYPE_KEY = "app.vector-store.type";
    private static final String DIM_MISMATCH_FMT =
            "app.embedding.dimensions (%d) must equal app.qdrant.vector-dimensions (%d).";

    private VectorStore vectorStore = new VectorStore();
    private QdrantStore qdrant = new QdrantStore();
    private EmbeddingSettings embedding = new EmbeddingSettings();
    private SearchTuning search = new SearchTuning();

    /**
     * Validates every nested section and the cross-section dimension invariant.
     *
     * @throws IllegalArgumentException when a value is out of range
     * @throws IllegalStateException when sections disagree with each other
     */
    @PostConstruct
    public void validateConfiguration() {
        vectorStore.validateConfiguration();
        qdrant.validateConfiguration();
        embedding.validateConfiguration();
        search.validateConfiguration();
        if (embedding.getDimensions() != qdrant.getVectorDimensions()) {
            throw new IllegalStateException(String.format(
                    Locale.ROOT, DIM_MISMATCH_FMT, embedding.getDimensions(), qdrant.getVectorDimensions()));
        }
    }

    public VectorStore getVectorStore() {
        return vectorStore;
    }

    public void setVectorStore(VectorStore vectorStore) {
        this.vectorStore = vectorStore;
    }

    public QdrantStore getQdrant() {
        return qdrant;
    }

    public void setQdrant(QdrantStore qdrant) {
        this.qdrant = qdrant;
    }

    public EmbeddingSettings getEmbedding() {
        return embedding;
    }

    public void setEmbedding(EmbeddingSettings embedding) {
        this.embedding = embedding;
    }

    public SearchTuning getSearch() {
        return search;
    }

    public void setSearch(SearchTuning search) {
        this.search = search;
    }

    /**
     * Selects the vector store adapter.
     */
    public static class VectorStore {
        private String type = STORE_QDRANT;

        public void validateConfiguration() {
            if (!STORE_QDRANT.equals(type) && !STORE_MEMORY.equals(type)) {
                throw new IllegalArgumentException(String.format(
                        Locale.ROOT, "%s must be '%s' or '%s' (got '%s').", STORE_TYPE_KEY, STORE_QDRANT, STORE_MEMORY, type));
            }
        }

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }
    }
}
