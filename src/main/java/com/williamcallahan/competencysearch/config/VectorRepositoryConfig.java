package com.williamcallahan.competencysearch.config;

import com.williamcallahan.competencysearch.service.store.CompetencyPayloadMapper;
import com.williamcallahan.competencysearch.service.store.InMemoryVectorRepository;
import com.williamcallahan.competencysearch.service.store.QdrantFilterRenderer;
import com.williamcallahan.competencysearch.service.store.QdrantVectorRepository;
import com.williamcallahan.competencysearch.service.store.VectorRepository;
import io.qdrant.client.QdrantClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Selects the vector repository adapter from {@code app.vector-store.type}.
 */
@Configuration
public class VectorRepositoryConfig {
    private static final Logger log = LoggerFactory.getLogger(VectorRepositoryConfig.class);

    @Bean
    @ConditionalOnProperty(
            name = "app.vector-store.type",
            havingValue = AppProperties.STORE_QDRANT,
            matchIfMissing = true)
    public VectorRepository qdrantVectorRepository(
            QdrantClient qdrantClient, CompetencyPayloadMapper payloadMapper, AppProperties appProperties) {
        log.info("[QDRANT] Using collection '{}'", appProperties.getQdrant().getCollection());
        return new QdrantVectorRepository(
                qdrantClient, new QdrantFilterRenderer(), payloadMapper, appProperties.getQdrant());
    }

    @Bean
    @ConditionalOnProperty(name = "app.vector-store.type", havingValue = AppProperties.STORE_MEMORY)
    public VectorRepository inMemoryVectorRepository(CompetencyPayloadMapper payloadMapper) {
        log.warn("[STORE] Using the in-memory vector store; records are lost on shutdown");
        return new InMemoryVectorRepository(payloadMapper);
    }
}
