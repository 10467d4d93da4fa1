package net.salescoach.domain.analysis;

import jakarta.annotation.Nullable;
import java.util.List;

/**
 * Strategic alignment audit for one call, including the critical gaps it left open.
 *
 * <p>Competitors embedded in the strategy payload are carried here; calls analysed after
 * competitive intel became its own kind also have a {@link CompetitiveIntelAnalysis}.</p>
 */
public record StrategyAnalysis(
    @Nullable Double threadingScore,
    @Nullable String threadingGrade,
    @Nullable String strategicSummary,
    List<MissedOpportunity> missedOpportunities,
    List<CriticalGap> criticalGaps,
    List<CompetitorMention> competitors
) {
    public StrategyAnalysis {
        missedOpportunities = missedOpportunities == null ? List.of() : List.copyOf(missedOpportunities);
        criticalGaps = criticalGaps == null ? List.of() : List.copyOf(criticalGaps);
        competitors = competitors == null ? List.of() : List.copyOf(competitors);
    }
}
