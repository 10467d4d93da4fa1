/**
 * Configuration for the outbound AI gateway throttle
 * - Caps requests to the chat completions gateway across every caller in the process
 * - Denied permits fail fast instead of queueing
 */
package net.salescoach.config;

import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AiGatewayRateLimiterConfig {
    private static final Logger logger = LoggerFactory.getLogger(AiGatewayRateLimiterConfig.class);

    @Value("${app.ai.gateway.requests-per-minute:30}")
    private int requestsPerMinute;

    /**
     * Rate limiter for the AI gateway
     *
     * @return Configured rate limiter instance
     */
    @Bean
    public RateLimiter aiGatewayRateLimiter() {
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofMinutes(1))
                .limitForPeriod(Math.max(1, requestsPerMinute))
                .timeoutDuration(Duration.ZERO)
                .build();

        RateLimiter rateLimiter = RateLimiter.of("aiGatewayRateLimiter", config);

        logger.info("AI gateway rate limiter initialized with limit of {} requests per minute",
                Math.max(1, requestsPerMinute));

        return rateLimiter;
    }
}
