package com.williamcallahan.competencysearch.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Bounded executor shared by query encoding and retrieval fan-out.
 */
@Configuration
public class SearchExecutorConfig {

    private static final int QUEUE_CAPACITY = 1_000;
    private static final int AWAIT_TERMINATION_SECONDS = 10;

    @Bean(name = "searchTaskExecutor")
    public ThreadPoolTaskExecutor searchTaskExecutor(AppProperties appProperties) {
        int threads = appProperties.getSearch().getExecutorThreads();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(QUEUE_CAPACITY);
        executor.setThreadNamePrefix("search-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(AWAIT_TERMINATION_SECONDS);
        executor.initialize();
        return executor;
    }
}
