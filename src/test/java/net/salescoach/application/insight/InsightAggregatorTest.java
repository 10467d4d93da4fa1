package net.salescoach.application.insight;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import net.salescoach.application.analysis.AnalysisSchemaValidator;
import net.salescoach.domain.analysis.AnalysisKind;
import net.salescoach.domain.analysis.CoachingAnalysis;
import net.salescoach.domain.analysis.CompetitiveIntelAnalysis;
import net.salescoach.domain.analysis.CompetitorMention;
import net.salescoach.domain.analysis.CriticalGap;
import net.salescoach.domain.analysis.DealHeatAnalysis;
import net.salescoach.domain.analysis.DegradationReason;
import net.salescoach.domain.analysis.GapCategory;
import net.salescoach.domain.analysis.GapImpact;
import net.salescoach.domain.analysis.PsychologyAnalysis;
import net.salescoach.domain.analysis.RawAnalysisRecord;
import net.salescoach.domain.analysis.StrategyAnalysis;
import net.salescoach.domain.analysis.ValidatedAnalysis;
import net.salescoach.domain.analysis.ValidatedCallAnalysis;
import net.salescoach.domain.insight.StructuredInsights;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;

class InsightAggregatorTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final InsightAggregator aggregator = new InsightAggregator();

    private static JsonNode json(String text) {
        return MAPPER.readTree(text);
    }

    private static <T> ValidatedAnalysis<T> absent() {
        return ValidatedAnalysis.degraded(null, DegradationReason.NOT_YET_ANALYZED, List.of());
    }

    private static <T> ValidatedAnalysis<T> ok(T value) {
        return ValidatedAnalysis.ok(value, 2);
    }

    private static CriticalGap gap(GapCategory category, String description) {
        return new CriticalGap(category, description, GapImpact.HIGH, "Ask about it", true);
    }

    private static StrategyAnalysis strategy(List<CriticalGap> gaps, List<CompetitorMention> competitors) {
        return new StrategyAnalysis(70.0, "Moderate", null, List.of(), gaps, competitors);
    }

    private static CoachingAnalysis coaching(String grade, String focus) {
        return new CoachingAnalysis(grade, null, focus, List.of(), List.of(), null, null);
    }

    private static DealHeatAnalysis heat(double score, String temperature) {
        return new DealHeatAnalysis(score, temperature, null, List.of(), null, null);
    }

    private static PsychologyAnalysis persona(String persona) {
        return new PsychologyAnalysis(null, persona, "D", null, null, List.of(), List.of());
    }

    private static ValidatedCallAnalysis call(LocalDate date,
                                              ValidatedAnalysis<StrategyAnalysis> strategy,
                                              ValidatedAnalysis<PsychologyAnalysis> psychology,
                                              ValidatedAnalysis<CoachingAnalysis> coaching,
                                              ValidatedAnalysis<DealHeatAnalysis> dealHeat,
                                              ValidatedAnalysis<CompetitiveIntelAnalysis> competitiveIntel) {
        return new ValidatedCallAnalysis(UUID.randomUUID(), date, absent(), strategy, absent(),
            psychology, coaching, dealHeat, competitiveIntel);
    }

    private static ValidatedCallAnalysis strategyOnlyCall(LocalDate date, List<CriticalGap> gaps) {
        return call(date, ok(strategy(gaps, List.of())), absent(), absent(), absent(), absent());
    }

    @Test
    @DisplayName("Gap repeated across calls appears once; the newer call's gaps come first")
    void aggregate_DeduplicatesGapsAcrossCalls() {
        ValidatedCallAnalysis older = strategyOnlyCall(LocalDate.of(2026, 2, 1),
            List.of(gap(GapCategory.BUDGET, "no budget owner")));
        ValidatedCallAnalysis newer = strategyOnlyCall(LocalDate.of(2026, 2, 15),
            List.of(gap(GapCategory.BUDGET, "no budget owner"), gap(GapCategory.TIMELINE, "no deadline")));

        StructuredInsights insights = aggregator.aggregate(List.of(newer, older));

        assertThat(insights.criticalGapsSummary())
            .extracting(CriticalGap::category, CriticalGap::description)
            .containsExactly(
                tuple(GapCategory.BUDGET, "no budget owner"),
                tuple(GapCategory.TIMELINE, "no deadline"));
    }

    @Test
    @DisplayName("Stored strategy payloads of two calls fold into two gaps in newest-first scan order")
    void aggregate_FoldsValidatedStrategyPayloads_InScanOrder() {
        AnalysisSchemaValidator validator = new AnalysisSchemaValidator();
        UUID olderId = UUID.randomUUID();
        UUID newerId = UUID.randomUUID();
        RawAnalysisRecord olderRecord = new RawAnalysisRecord(olderId, Map.of(AnalysisKind.STRATEGY, json("""
            {"strategic_threading": {"score": 60, "grade": "Moderate"},
             "critical_gaps": [{"category": "Budget", "description": "no budget owner", "impact": "High",
                                "suggested_question": "Who approves this?"}]}
            """)));
        RawAnalysisRecord newerRecord = new RawAnalysisRecord(newerId, Map.of(AnalysisKind.STRATEGY, json("""
            {"strategic_threading": {"score": 65, "grade": "Moderate"},
             "critical_gaps": [{"category": "Budget", "description": "no budget owner", "impact": "High"},
                               {"category": "Timeline", "description": "no deadline", "impact": "Medium"}]}
            """)));

        StructuredInsights insights = aggregator.aggregate(List.of(
            validator.validateRecord(newerRecord, LocalDate.of(2026, 2, 15)),
            validator.validateRecord(olderRecord, LocalDate.of(2026, 2, 1))));

        assertThat(insights.criticalGapsSummary())
            .extracting(CriticalGap::category, CriticalGap::description)
            .containsExactly(
                tuple(GapCategory.BUDGET, "no budget owner"),
                tuple(GapCategory.TIMELINE, "no deadline"));
    }

    @Test
    void aggregate_IgnoresCoachingGradeRejectedByValidation() {
        AnalysisSchemaValidator validator = new AnalysisSchemaValidator();
        UUID callId = UUID.randomUUID();
        RawAnalysisRecord record = new RawAnalysisRecord(callId,
            Map.of(AnalysisKind.COACHING, json("{\"overall_grade\": \"Z\"}")));

        ValidatedCallAnalysis validated = validator.validateRecord(record, LocalDate.of(2026, 2, 1));
        StructuredInsights insights = aggregator.aggregate(List.of(validated));

        assertThat(validated.coaching().isDegraded()).isTrue();
        assertThat(validated.coachingValue()).get()
            .satisfies(partial -> assertThat(partial.overallGrade()).isNull());
        assertThat(insights.coachingTrend()).isNull();
    }

    @Test
    void aggregate_KeepsSameDescription_UnderDifferentCategories() {
        ValidatedCallAnalysis only = strategyOnlyCall(LocalDate.of(2026, 2, 1), List.of(
            gap(GapCategory.BUDGET, "unclear"),
            gap(GapCategory.AUTHORITY, "unclear"),
            gap(GapCategory.BUDGET, "  unclear ")));

        assertThat(aggregator.aggregate(List.of(only)).criticalGapsSummary()).hasSize(2);
    }

    @Test
    void aggregate_CapsGapsAtFive_PreferringNewestCalls() {
        List<CriticalGap> newerGaps = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            newerGaps.add(gap(GapCategory.NEED, "newer gap " + i));
        }
        ValidatedCallAnalysis newer = strategyOnlyCall(LocalDate.of(2026, 3, 1), newerGaps);
        ValidatedCallAnalysis older = strategyOnlyCall(LocalDate.of(2026, 1, 1), List.of(
            gap(GapCategory.TECHNICAL, "older gap 0"),
            gap(GapCategory.TECHNICAL, "older gap 1"),
            gap(GapCategory.TECHNICAL, "older gap 2")));

        List<CriticalGap> summary = aggregator.aggregate(List.of(newer, older)).criticalGapsSummary();

        assertThat(summary).hasSize(InsightAggregator.MAX_CRITICAL_GAPS);
        assertThat(summary).extracting(CriticalGap::description)
            .containsExactly("newer gap 0", "newer gap 1", "newer gap 2", "newer gap 3", "older gap 0");
    }

    @Test
    void aggregate_TakesLatestValuesFromNewestCall() {
        ValidatedCallAnalysis callA = call(LocalDate.of(2026, 3, 10), absent(), ok(persona("Analytical CFO")),
            ok(coaching("B", "Discovery depth")), ok(heat(8, "Hot")), absent());
        ValidatedCallAnalysis callB = call(LocalDate.of(2026, 2, 10), absent(), ok(persona("Skeptical buyer")),
            ok(coaching("C", "Closing")), ok(heat(4, "Cool")), absent());

        StructuredInsights insights = aggregator.aggregate(List.of(callA, callB));

        assertThat(insights.latestHeatAnalysis()).isEqualTo(heat(8, "Hot"));
        assertThat(insights.prospectPersona()).isEqualTo("Analytical CFO");
        assertThat(insights.coachingTrend()).isNotNull();
        assertThat(insights.coachingTrend().avgGrade()).isEqualTo("B");
        assertThat(insights.coachingTrend().primaryFocusArea()).isEqualTo("Discovery depth");
        assertThat(insights.coachingTrend().recentGrades()).containsExactly("B", "C");
    }

    @Test
    void aggregate_SkipsCallsWithoutAKind_WhenPickingLatest() {
        ValidatedCallAnalysis newest = call(LocalDate.of(2026, 3, 10), absent(), absent(), absent(), absent(), absent());
        ValidatedCallAnalysis older = call(LocalDate.of(2026, 2, 10), absent(), ok(persona("Champion")),
            absent(), ok(heat(6, "Warm")), absent());

        StructuredInsights insights = aggregator.aggregate(List.of(newest, older));

        assertThat(insights.latestHeatAnalysis()).isEqualTo(heat(6, "Warm"));
        assertThat(insights.prospectPersona()).isEqualTo("Champion");
        assertThat(insights.coachingTrend()).isNull();
    }

    @Test
    void aggregate_UsesPartialValueOfDegradedAnalysis() {
        ValidatedAnalysis<DealHeatAnalysis> drifted = ValidatedAnalysis.degraded(
            heat(5, "Warm"), DegradationReason.SCHEMA_DRIFT, List.of());
        ValidatedCallAnalysis call = call(LocalDate.of(2026, 3, 10), absent(), absent(), absent(), drifted, absent());

        assertThat(aggregator.aggregate(List.of(call)).latestHeatAnalysis()).isEqualTo(heat(5, "Warm"));
    }

    @Test
    void aggregate_MergesCompetitorsCaseInsensitively_AndCapsAtFive() {
        CompetitiveIntelAnalysis intel = new CompetitiveIntelAnalysis(List.of(
            new CompetitorMention("Globex", "Current Vendor", "Incumbent"),
            new CompetitorMention("Initech", "Evaluating", null),
            new CompetitorMention("Umbrella", null, null)));
        StrategyAnalysis embedded = strategy(List.of(), List.of(
            new CompetitorMention("globex ", "Past Vendor", null),
            new CompetitorMention("Hooli", null, null),
            new CompetitorMention("Soylent", null, null),
            new CompetitorMention("Vandelay", null, null)));
        ValidatedCallAnalysis call = call(LocalDate.of(2026, 3, 10), ok(embedded), absent(), absent(), absent(), ok(intel));

        List<CompetitorMention> competitors = aggregator.aggregate(List.of(call)).competitorsSummary();

        assertThat(competitors).extracting(CompetitorMention::name)
            .containsExactly("Globex", "Initech", "Umbrella", "Hooli", "Soylent");
        assertThat(competitors.get(0).status()).isEqualTo("Current Vendor");
    }

    @Test
    void aggregate_IsIdempotent() {
        List<ValidatedCallAnalysis> calls = List.of(
            strategyOnlyCall(LocalDate.of(2026, 3, 1), List.of(gap(GapCategory.TIMELINE, "no deadline"))),
            call(LocalDate.of(2026, 2, 1), absent(), ok(persona("Champion")), ok(coaching("A", "Pacing")),
                ok(heat(7, "Warm")), absent()));

        assertThat(aggregator.aggregate(calls)).isEqualTo(aggregator.aggregate(calls));
    }

    @Test
    void aggregate_ReturnsEmptyInsights_ForNoCalls() {
        assertThat(aggregator.aggregate(List.of())).isEqualTo(StructuredInsights.empty());
    }

    @Test
    void aggregate_AcceptsUndatedCallsLast() {
        ValidatedCallAnalysis dated = strategyOnlyCall(LocalDate.of(2026, 3, 1), List.of());
        ValidatedCallAnalysis undated = strategyOnlyCall(null, List.of(gap(GapCategory.NEED, "unclear need")));

        assertThat(aggregator.aggregate(List.of(dated, undated)).criticalGapsSummary()).hasSize(1);
    }

    @Test
    void aggregate_Throws_WhenInputIsOldestFirst() {
        ValidatedCallAnalysis older = strategyOnlyCall(LocalDate.of(2026, 1, 1), List.of());
        ValidatedCallAnalysis newer = strategyOnlyCall(LocalDate.of(2026, 2, 1), List.of());

        assertThatThrownBy(() -> aggregator.aggregate(List.of(older, newer)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("newest first");
    }

    @Test
    void aggregate_Throws_WhenUndatedCallPrecedesDatedOne() {
        ValidatedCallAnalysis undated = strategyOnlyCall(null, List.of());
        ValidatedCallAnalysis dated = strategyOnlyCall(LocalDate.of(2026, 2, 1), List.of());

        assertThatThrownBy(() -> aggregator.aggregate(List.of(undated, dated)))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
