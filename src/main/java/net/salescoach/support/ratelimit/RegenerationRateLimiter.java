package net.salescoach.support.ratelimit;

/**
 * Gates how often one caller identity may trigger insight regeneration.
 */
public interface RegenerationRateLimiter {

    /**
     * Records an attempt for {@code identity} when allowed; denied attempts are not recorded.
     */
    RateLimitDecision check(String identity);
}
