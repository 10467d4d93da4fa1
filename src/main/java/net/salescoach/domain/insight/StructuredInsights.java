package net.salescoach.domain.insight;

import jakarta.annotation.Nullable;
import java.util.List;
import net.salescoach.domain.analysis.CompetitorMention;
import net.salescoach.domain.analysis.CriticalGap;
import net.salescoach.domain.analysis.DealHeatAnalysis;

/**
 * Deterministic fold of every call's validated analyses for one account.
 */
public record StructuredInsights(
    List<CriticalGap> criticalGapsSummary,
    List<CompetitorMention> competitorsSummary,
    @Nullable String prospectPersona,
    @Nullable CoachingTrend coachingTrend,
    @Nullable DealHeatAnalysis latestHeatAnalysis
) {
    public StructuredInsights {
        criticalGapsSummary = criticalGapsSummary == null ? List.of() : List.copyOf(criticalGapsSummary);
        competitorsSummary = competitorsSummary == null ? List.of() : List.copyOf(competitorsSummary);
    }

    public static StructuredInsights empty() {
        return new StructuredInsights(List.of(), List.of(), null, null, null);
    }
}
