package net.salescoach.config;

import java.time.Clock;
import java.time.Duration;
import net.salescoach.support.ratelimit.CaffeineRequestLogStore;
import net.salescoach.support.ratelimit.RequestLogStore;
import net.salescoach.support.ratelimit.SlidingWindowRateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Per-identity sliding-window limiter for insight regeneration requests.
 *
 * <p>The in-process store suits a single instance; a shared store would replace
 * {@link RequestLogStore} when scaling out.</p>
 */
@Configuration
public class RegenerationRateLimitConfig {

    private static final Logger log = LoggerFactory.getLogger(RegenerationRateLimitConfig.class);
    private static final long MAX_TRACKED_IDENTITIES = 10_000L;

    @Bean
    public RequestLogStore regenerationRequestLogStore(
        @Value("${app.insights.rate-limit.window-seconds:60}") long windowSeconds) {
        return new CaffeineRequestLogStore(Duration.ofSeconds(Math.max(1L, windowSeconds)), MAX_TRACKED_IDENTITIES);
    }

    @Bean
    public SlidingWindowRateLimiter regenerationRateLimiter(
        RequestLogStore regenerationRequestLogStore,
        Clock clock,
        @Value("${app.insights.rate-limit.max-requests:10}") int maxRequests,
        @Value("${app.insights.rate-limit.window-seconds:60}") long windowSeconds) {
        log.info("Regeneration rate limit: {} requests per {}s per identity", maxRequests, windowSeconds);
        return new SlidingWindowRateLimiter(regenerationRequestLogStore, clock,
            Math.max(1, maxRequests), Duration.ofSeconds(Math.max(1L, windowSeconds)));
    }
}
