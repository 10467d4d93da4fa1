package net.salescoach.domain.insight;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.annotation.Nullable;
import java.time.Instant;
import java.util.List;
import net.salescoach.domain.analysis.CompetitorMention;
import net.salescoach.domain.analysis.CriticalGap;
import net.salescoach.domain.analysis.DealHeatAnalysis;

/**
 * Account-level insight record persisted in {@code prospects.ai_extracted_info}.
 *
 * <p>Replaced wholesale on every regeneration; nothing is merged across runs.</p>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record AccountInsightSnapshot(
    @JsonProperty("business_context") @Nullable String businessContext,
    @JsonProperty("pain_points") List<String> painPoints,
    @JsonProperty("decision_process") @Nullable DecisionProcess decisionProcess,
    @JsonProperty("competitors_mentioned") List<String> competitorsMentioned,
    @JsonProperty("communication_summary") @Nullable String communicationSummary,
    @JsonProperty("key_opportunities") List<String> keyOpportunities,
    @JsonProperty("relationship_health") @Nullable String relationshipHealth,
    @Nullable String industry,
    @JsonProperty("last_analyzed_at") @Nullable Instant lastAnalyzedAt,
    @JsonProperty("critical_gaps_summary") List<CriticalGap> criticalGapsSummary,
    @JsonProperty("competitors_summary") List<CompetitorMention> competitorsSummary,
    @JsonProperty("prospect_persona") @Nullable String prospectPersona,
    @JsonProperty("coaching_trend") @Nullable CoachingTrend coachingTrend,
    @JsonProperty("latest_heat_analysis") @Nullable DealHeatAnalysis latestHeatAnalysis
) {
    public AccountInsightSnapshot {
        painPoints = painPoints == null ? List.of() : List.copyOf(painPoints);
        competitorsMentioned = competitorsMentioned == null ? List.of() : List.copyOf(competitorsMentioned);
        keyOpportunities = keyOpportunities == null ? List.of() : List.copyOf(keyOpportunities);
        criticalGapsSummary = criticalGapsSummary == null ? List.of() : List.copyOf(criticalGapsSummary);
        competitorsSummary = competitorsSummary == null ? List.of() : List.copyOf(competitorsSummary);
    }

    /**
     * Merges the AI narrative with the deterministic structured fold.
     */
    public static AccountInsightSnapshot compose(InsightNarrative narrative,
                                                 StructuredInsights structured,
                                                 Instant analyzedAt) {
        return new AccountInsightSnapshot(
            narrative.businessContext(),
            narrative.painPoints(),
            narrative.decisionProcess(),
            narrative.competitorsMentioned(),
            narrative.communicationSummary(),
            narrative.keyOpportunities(),
            narrative.relationshipHealth(),
            narrative.industry(),
            analyzedAt,
            structured.criticalGapsSummary(),
            structured.competitorsSummary(),
            structured.prospectPersona(),
            structured.coachingTrend(),
            structured.latestHeatAnalysis()
        );
    }
}
