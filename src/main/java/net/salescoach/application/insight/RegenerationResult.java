package net.salescoach.application.insight;

import jakarta.annotation.Nullable;
import net.salescoach.domain.insight.AccountInsightSnapshot;

/**
 * Outcome of one regeneration request.
 *
 * @param snapshot the freshly written snapshot, or the stored one (possibly absent) when
 *        there was nothing to analyze
 */
public record RegenerationResult(Outcome outcome, @Nullable AccountInsightSnapshot snapshot) {

    public enum Outcome {
        REGENERATED,
        NOTHING_TO_ANALYZE
    }

    public static RegenerationResult regenerated(AccountInsightSnapshot snapshot) {
        return new RegenerationResult(Outcome.REGENERATED, snapshot);
    }

    public static RegenerationResult nothingToAnalyze(@Nullable AccountInsightSnapshot existing) {
        return new RegenerationResult(Outcome.NOTHING_TO_ANALYZE, existing);
    }

    public boolean regenerated() {
        return outcome == Outcome.REGENERATED;
    }
}
