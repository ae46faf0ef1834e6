package com.williamcallahan.competencysearch.config;

import io.grpc.ManagedChannel;
import io.grpc.ManagedChannelBuilder;
import io.qdrant.client.QdrantClient;
import io.qdrant.client.QdrantGrpcClient;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Qdrant gRPC client with keepalive settings, created only when the Qdrant store is selected.
 *
 * <p>Without keepalive pings an idle channel can be dropped silently by load balancers in front of
 * Qdrant Cloud. The client owns its channel and is closed with the application context.</p>
 */
@Configuration
@ConditionalOnProperty(name = "app.vector-store.type", havingValue = AppProperties.STORE_QDRANT, matchIfMissing = true)
public class QdrantClientConfig {

    private static final Logger log = LoggerFactory.getLogger(QdrantClientConfig.class);

    /** Keepalive ping interval in seconds. */
    private static final long KEEPALIVE_TIME_SECONDS = 30;
    /** Keepalive timeout before connection is considered dead. */
    private static final long KEEPALIVE_TIMEOUT_SECONDS = 10;
    /** Idle timeout before keepalive pings start. */
    private static final long IDLE_TIMEOUT_MINUTES = 5;

    /**
     * Creates the Qdrant client.
     *
     * @param appProperties application configuration
     * @return configured Qdrant client
     */
    @Bean(destroyMethod = "close")
    public QdrantClient qdrantClient(AppProperties appProperties) {
        QdrantStore settings = appProperties.getQdrant();
        log.info("[QDRANT] Connecting to {}:{} (tls={})", settings.getHost(), settings.getPort(), settings.isUseTls());

        ManagedChannelBuilder<?> channelBuilder = ManagedChannelBuilder.forAddress(settings.getHost(), settings.getPort());
        if (settings.isUseTls()) {
            channelBuilder.useTransportSecurity();
        } else {
            channelBuilder.usePlaintext();
        }
        channelBuilder
                .keepAliveTime(KEEPALIVE_TIME_SECONDS, TimeUnit.SECONDS)
                .keepAliveTimeout(KEEPALIVE_TIMEOUT_SECONDS, TimeUnit.SECONDS)
                .keepAliveWithoutCalls(true)
                .idleTimeout(IDLE_TIMEOUT_MINUTES, TimeUnit.MINUTES);

        ManagedChannel channel = Objects.requireNonNull(channelBuilder.build(), "ManagedChannel");
        QdrantGrpcClient.Builder grpcClientBuilder = QdrantGrpcClient.newBuilder(channel, true);
        String apiKey = settings.getApiKey();
        if (apiKey != null && !apiKey.isBlank()) {
            grpcClientBuilder.withApiKey(apiKey);
        }
        return new QdrantClient(Objects.requireNonNull(grpcClientBuilder.build(), "QdrantGrpcClient"));
    }
}
