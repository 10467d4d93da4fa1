package net.salescoach.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Bounded pool for the concurrent account-context fetches.
 */
@Configuration
public class InsightFetchExecutorConfig {

    private static final int QUEUE_CAPACITY = 200;
    private static final int SHUTDOWN_TIMEOUT_SECONDS = 15;

    @Bean(name = "insightFetchExecutor")
    public ThreadPoolTaskExecutor insightFetchExecutor(@Value("${app.insights.fetch-pool-size:8}") int poolSize) {
        int size = Math.max(1, poolSize);
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setThreadNamePrefix("InsightFetch-");
        executor.setCorePoolSize(size);
        executor.setMaxPoolSize(size);
        executor.setQueueCapacity(QUEUE_CAPACITY);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(SHUTDOWN_TIMEOUT_SECONDS);
        executor.initialize();
        return executor;
    }
}
