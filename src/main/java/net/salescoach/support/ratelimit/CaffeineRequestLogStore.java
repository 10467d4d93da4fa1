package net.salescoach.support.ratelimit;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentMap;
import java.util.function.UnaryOperator;

/**
 * In-process request log backed by a Caffeine cache.
 *
 * <p>Entries also expire after {@code idleExpiry} without access, so identities that stop
 * calling are eventually dropped even if pruning never runs. State is lost on restart and is
 * not shared across instances.</p>
 */
public class CaffeineRequestLogStore implements RequestLogStore {

    private final Cache<String, List<Instant>> requestLog;

    public CaffeineRequestLogStore(Duration idleExpiry, long maximumIdentities) {
        this.requestLog = Caffeine.newBuilder()
            .expireAfterAccess(idleExpiry)
            .maximumSize(maximumIdentities)
            .build();
    }

    @Override
    public List<Instant> compute(String identity, UnaryOperator<List<Instant>> update) {
        ConcurrentMap<String, List<Instant>> view = requestLog.asMap();
        List<Instant> result = view.compute(identity, (key, existing) -> {
            List<Instant> current = existing == null ? List.of() : existing;
            List<Instant> next = update.apply(current);
            return next == null || next.isEmpty() ? null : List.copyOf(next);
        });
        return result == null ? List.of() : result;
    }

    @Override
    public int pruneOlderThan(Instant cutoff) {
        ConcurrentMap<String, List<Instant>> view = requestLog.asMap();
        int removed = 0;
        for (String identity : new ArrayList<>(view.keySet())) {
            List<Instant> remaining = view.computeIfPresent(identity, (key, timestamps) -> {
                List<Instant> kept = timestamps.stream().filter(ts -> ts.isAfter(cutoff)).toList();
                return kept.isEmpty() ? null : kept;
            });
            if (remaining == null) {
                removed++;
            }
        }
        return removed;
    }

    @Override
    public long trackedIdentities() {
        return requestLog.asMap().size();
    }
}
