package com.williamcallahan.competencysearch.config;

import com.williamcallahan.competencysearch.service.encoding.EmbeddingClient;
import com.williamcallahan.competencysearch.service.encoding.LexicalSparseVectorEncoder;
import com.williamcallahan.competencysearch.service.encoding.LocalEmbeddingClient;
import com.williamcallahan.competencysearch.service.encoding.LocalHashingEmbeddingClient;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Encoder configuration with strict error propagation.
 *
 * <p>The dense provider is selected from {@code app.embedding.provider}. No runtime fallback is
 * attempted, so a provider failure surfaces immediately instead of indexing a synthetic vector.</p>
 */
@Configuration
public class EmbeddingConfig {
    private static final Logger log = LoggerFactory.getLogger(EmbeddingConfig.class);

    /**
     * Creates the client for an OpenAI-compatible embedding server.
     *
     * @param appProperties application configuration
     * @param restTemplateBuilder RestTemplate builder
     * @return local embedding client
     */
    @Bean
    @ConditionalOnMissingBean(EmbeddingClient.class)
    @ConditionalOnProperty(
            name = "app.embedding.provider",
            havingValue = EmbeddingSettings.PROVIDER_LOCAL,
            matchIfMissing = true)
    public EmbeddingClient localEmbeddingClient(AppProperties appProperties, RestTemplateBuilder restTemplateBuilder) {
        EmbeddingSettings settings = Objects.requireNonNull(appProperties, "appProperties").getEmbedding();
        log.info("[EMBEDDING] Using local embedding server (model={}, dimensions={})",
                settings.getModel(), settings.getDimensions());
        return new LocalEmbeddingClient(settings, restTemplateBuilder);
    }

    /**
     * Creates the deterministic hashing encoder used in development and tests.
     *
     * @param appProperties application configuration
     * @return hashing embedding client
     */
    @Bean
    @ConditionalOnMissingBean(EmbeddingClient.class)
    @ConditionalOnProperty(name = "app.embedding.provider", havingValue = EmbeddingSettings.PROVIDER_HASH)
    public EmbeddingClient hashingEmbeddingClient(AppProperties appProperties) {
        int dimensions = appProperties.getEmbedding().getDimensions();
        log.warn("[EMBEDDING] Using hashing embeddings ({} dimensions); results carry no semantic meaning", dimensions);
        return new LocalHashingEmbeddingClient(dimensions);
    }

    @Bean
    public LexicalSparseVectorEncoder lexicalSparseVectorEncoder() {
        return new LexicalSparseVectorEncoder();
    }
}
