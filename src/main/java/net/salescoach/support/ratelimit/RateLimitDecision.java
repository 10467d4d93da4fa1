package net.salescoach.support.ratelimit;

import java.time.Duration;
import java.util.Objects;

/**
 * Result of asking a {@link RegenerationRateLimiter} whether a caller may proceed.
 */
public sealed interface RateLimitDecision permits RateLimitDecision.Allowed, RateLimitDecision.Denied {

    default boolean allowed() {
        return this instanceof Allowed;
    }

    static RateLimitDecision allow() {
        return Allowed.INSTANCE;
    }

    static RateLimitDecision deny(Duration retryAfter) {
        return new Denied(retryAfter);
    }

    final class Allowed implements RateLimitDecision {
        private static final Allowed INSTANCE = new Allowed();

        private Allowed() {
        }

        @Override
        public String toString() {
            return "Allowed";
        }
    }

    /**
     * @param retryAfter time until the oldest request in the window expires
     */
    record Denied(Duration retryAfter) implements RateLimitDecision {
        public Denied {
            Objects.requireNonNull(retryAfter, "retryAfter");
            if (retryAfter.isNegative()) {
                retryAfter = Duration.ZERO;
            }
        }

        /**
         * Whole seconds for a {@code Retry-After} header, never below one.
         */
        public long retryAfterSeconds() {
            long seconds = retryAfter.toSeconds();
            if (retryAfter.toNanosPart() > 0 || seconds == 0) {
                seconds++;
            }
            return seconds;
        }
    }
}
