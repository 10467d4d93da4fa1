package net.salescoach.boot.scheduler;

import net.salescoach.support.ratelimit.SlidingWindowRateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically drops regeneration request logs whose window has elapsed, so idle identities
 * do not accumulate.
 */
@Component
public class RateLimitWindowPruneScheduler {

    private static final Logger log = LoggerFactory.getLogger(RateLimitWindowPruneScheduler.class);

    private final SlidingWindowRateLimiter regenerationRateLimiter;

    public RateLimitWindowPruneScheduler(SlidingWindowRateLimiter regenerationRateLimiter) {
        this.regenerationRateLimiter = regenerationRateLimiter;
    }

    @Scheduled(fixedDelayString = "${app.insights.rate-limit.prune-interval-ms:60000}")
    public void pruneExpiredWindows() {
        int pruned = regenerationRateLimiter.pruneExpired();
        if (pruned > 0) {
            log.debug("Pruned {} idle regeneration rate-limit entries", pruned);
        }
    }
}
