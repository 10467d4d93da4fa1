package net.salescoach.domain.insight;

import jakarta.annotation.Nullable;
import java.util.List;

/**
 * Free-text account synthesis produced by the AI tool call.
 *
 * <p>Only {@code businessContext} is guaranteed. {@code industry} is already restricted to
 * the known industry codes.</p>
 */
public record InsightNarrative(
    String businessContext,
    List<String> painPoints,
    @Nullable DecisionProcess decisionProcess,
    List<String> competitorsMentioned,
    @Nullable String communicationSummary,
    List<String> keyOpportunities,
    @Nullable String relationshipHealth,
    @Nullable String industry
) {
    public InsightNarrative {
        painPoints = painPoints == null ? List.of() : List.copyOf(painPoints);
        competitorsMentioned = competitorsMentioned == null ? List.of() : List.copyOf(competitorsMentioned);
        keyOpportunities = keyOpportunities == null ? List.of() : List.copyOf(keyOpportunities);
    }
}
