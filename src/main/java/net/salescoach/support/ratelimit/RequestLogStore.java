package net.salescoach.support.ratelimit;

import java.time.Instant;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Storage seam for per-identity request timestamps used by sliding-window limiting.
 */
public interface RequestLogStore {

    /**
     * Atomically replaces the timestamps recorded for {@code identity}.
     *
     * @param identity caller identity
     * @param update receives the current timestamps, oldest first, and returns the new list
     * @return the list returned by {@code update}
     */
    List<Instant> compute(String identity, UnaryOperator<List<Instant>> update);

    /**
     * Drops timestamps older than {@code cutoff}, removing identities left with none.
     *
     * @return number of identities removed
     */
    int pruneOlderThan(Instant cutoff);

    long trackedIdentities();
}
