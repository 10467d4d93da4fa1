package net.salescoach.support.ratelimit;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sliding-log limiter: at most {@code maxRequests} accepted attempts per identity within
 * any {@code window}-long interval.
 */
public class SlidingWindowRateLimiter implements RegenerationRateLimiter {

    private static final Logger log = LoggerFactory.getLogger(SlidingWindowRateLimiter.class);

    private final RequestLogStore store;
    private final Clock clock;
    private final int maxRequests;
    private final Duration window;

    public SlidingWindowRateLimiter(RequestLogStore store, Clock clock, int maxRequests, Duration window) {
        if (maxRequests < 1) {
            throw new IllegalArgumentException("maxRequests must be positive");
        }
        if (window == null || window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("window must be positive");
        }
        this.store = store;
        this.clock = clock;
        this.maxRequests = maxRequests;
        this.window = window;
    }

    @Override
    public RateLimitDecision check(String identity) {
        if (identity == null || identity.isBlank()) {
            throw new IllegalArgumentException("identity is required");
        }
        Instant now = clock.instant();
        Instant windowStart = now.minus(window);
        AtomicReference<RateLimitDecision> decision = new AtomicReference<>();
        store.compute(identity, timestamps -> {
            List<Instant> live = new ArrayList<>();
            for (Instant timestamp : timestamps) {
                if (timestamp.isAfter(windowStart)) {
                    live.add(timestamp);
                }
            }
            if (live.size() >= maxRequests) {
                Duration retryAfter = Duration.between(now, live.get(0).plus(window));
                decision.set(RateLimitDecision.deny(retryAfter));
                return live;
            }
            live.add(now);
            decision.set(RateLimitDecision.allow());
            return live;
        });
        RateLimitDecision result = decision.get();
        if (!result.allowed()) {
            log.warn("Regeneration rate limit reached for identity={} (max {} per {}s)",
                identity, maxRequests, window.toSeconds());
        }
        return result;
    }

    /**
     * Discards request timestamps whose window has elapsed.
     *
     * @return number of identities no longer tracked
     */
    public int pruneExpired() {
        return store.pruneOlderThan(clock.instant().minus(window));
    }
}
