package net.salescoach.application.analysis;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import net.salescoach.domain.analysis.AnalysisKind;
import net.salescoach.domain.analysis.BehaviorAnalysis;
import net.salescoach.domain.analysis.CallMetadataAnalysis;
import net.salescoach.domain.analysis.CoachingAnalysis;
import net.salescoach.domain.analysis.CompetitiveIntelAnalysis;
import net.salescoach.domain.analysis.CriticalGap;
import net.salescoach.domain.analysis.DealHeatAnalysis;
import net.salescoach.domain.analysis.DegradationReason;
import net.salescoach.domain.analysis.FieldIssue;
import net.salescoach.domain.analysis.GapCategory;
import net.salescoach.domain.analysis.GapImpact;
import net.salescoach.domain.analysis.HeatFactor;
import net.salescoach.domain.analysis.RawAnalysisRecord;
import net.salescoach.domain.analysis.StrategyAnalysis;
import net.salescoach.domain.analysis.ValidatedAnalysis;
import net.salescoach.domain.analysis.ValidatedCallAnalysis;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;

class AnalysisSchemaValidatorTest {

    private static final String STRATEGY_V2 = """
        {
          "strategic_threading": {
            "score": 72,
            "grade": "Moderate",
            "strategic_summary": "Good discovery, weak on budget.",
            "score_breakdown": {"relevance": 80},
            "missed_opportunities": [{"pain": "Manual invoicing", "severity": "High", "suggested_pitch": "Automation"}]
          },
          "critical_gaps": [
            {"category": "Budget", "description": "no budget owner", "impact": "High", "suggested_question": "Who approves this?"}
          ],
          "competitive_intel": [
            {"competitor_name": "Globex", "usage_status": "Current Vendor", "competitive_position": "Incumbent"}
          ]
        }
        """;

    private ObjectMapper objectMapper;
    private AnalysisSchemaValidator validator;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper();
        validator = new AnalysisSchemaValidator();
    }

    private JsonNode json(String raw) {
        return objectMapper.readTree(raw);
    }

    @Test
    void validate_ReturnsNotYetAnalyzed_WhenBlobAbsent() {
        ValidatedAnalysis<StrategyAnalysis> result = validator.validate(AnalysisKind.STRATEGY, null, StrategyAnalysis.class);

        assertThat(result).isInstanceOfSatisfying(ValidatedAnalysis.Degraded.class, degraded -> {
            assertThat(degraded.reason()).isEqualTo(DegradationReason.NOT_YET_ANALYZED);
            assertThat(degraded.partialValue()).isNull();
            assertThat(degraded.issues()).isEmpty();
        });
    }

    @Test
    void validate_ReturnsInvalidPayload_WhenBlobIsNotAnObject() {
        ValidatedAnalysis<?> result = validator.validate(AnalysisKind.COACHING, json("\"A+\""));

        assertThat(result).isInstanceOfSatisfying(ValidatedAnalysis.Degraded.class, degraded -> {
            assertThat(degraded.reason()).isEqualTo(DegradationReason.INVALID_PAYLOAD);
            assertThat(degraded.partialValue()).isNull();
            assertThat(degraded.reasonCode()).isEqualTo("invalid_payload");
        });
    }

    @Test
    void validate_RejectsMismatchedRepresentationType() {
        assertThatThrownBy(() -> validator.validate(AnalysisKind.STRATEGY, json("{}"), CoachingAnalysis.class))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Nested
    class Strategy {

        @Test
        void validate_ReturnsOk_ForCurrentSchema() {
            ValidatedAnalysis<StrategyAnalysis> result =
                validator.validate(AnalysisKind.STRATEGY, json(STRATEGY_V2), StrategyAnalysis.class);

            assertThat(result).isInstanceOf(ValidatedAnalysis.Ok.class);
            assertThat(((ValidatedAnalysis.Ok<StrategyAnalysis>) result).schemaVersion()).isEqualTo(2);
            StrategyAnalysis strategy = result.usableValue().orElseThrow();
            assertThat(strategy.threadingScore()).isEqualTo(72.0);
            assertThat(strategy.strategicSummary()).isEqualTo("Good discovery, weak on budget.");
            assertThat(strategy.criticalGaps()).containsExactly(
                new CriticalGap(GapCategory.BUDGET, "no budget owner", GapImpact.HIGH, "Who approves this?", true));
            assertThat(strategy.missedOpportunities()).hasSize(1);
            assertThat(strategy.competitors()).singleElement()
                .satisfies(competitor -> assertThat(competitor.name()).isEqualTo("Globex"));
        }

        @Test
        @DisplayName("First-generation payload with bare-string gaps validates as schema drift, gaps normalized")
        void validate_FallsBackToV1_AndNormalizesLegacyGaps() {
            JsonNode legacy = json("""
                {
                  "strategic_threading": {"score": 55, "grade": "Weak"},
                  "critical_gaps": ["No timeline discussed", "  Unknown decision maker  "]
                }
                """);

            ValidatedAnalysis<StrategyAnalysis> result =
                validator.validate(AnalysisKind.STRATEGY, legacy, StrategyAnalysis.class);

            assertThat(result).isInstanceOfSatisfying(ValidatedAnalysis.Degraded.class, degraded -> {
                assertThat(degraded.reason()).isEqualTo(DegradationReason.SCHEMA_DRIFT);
                assertThat((List<FieldIssue>) degraded.issues()).extracting(FieldIssue::path)
                    .contains("strategic_threading.strategic_summary", "strategic_threading.score_breakdown");
            });
            StrategyAnalysis strategy = result.usableValue().orElseThrow();
            assertThat(strategy.strategicSummary()).isNull();
            assertThat(strategy.criticalGaps()).containsExactly(
                CriticalGap.fromPlainText("No timeline discussed"),
                CriticalGap.fromPlainText("Unknown decision maker"));
            assertThat(strategy.criticalGaps()).allSatisfy(gap -> {
                assertThat(gap.structured()).isFalse();
                assertThat(gap.category()).isNull();
                assertThat(gap.impact()).isNull();
            });
        }

        @Test
        void validate_ReportsMalformedFields_WhenOptionalGapFieldsUnknown() {
            JsonNode payload = json(STRATEGY_V2.replace("\"impact\": \"High\"", "\"impact\": \"Critical\""));

            ValidatedAnalysis<StrategyAnalysis> result =
                validator.validate(AnalysisKind.STRATEGY, payload, StrategyAnalysis.class);

            assertThat(result).isInstanceOfSatisfying(ValidatedAnalysis.Degraded.class, degraded -> {
                assertThat(degraded.reason()).isEqualTo(DegradationReason.MALFORMED_FIELDS);
                assertThat((List<FieldIssue>) degraded.issues()).extracting(FieldIssue::path).containsExactly("critical_gaps[0].impact");
            });
            assertThat(result.usableValue().orElseThrow().criticalGaps().get(0).impact()).isNull();
        }

        @Test
        void validate_ReturnsInvalidPayload_WithPartialRead_WhenNoVersionMatches() {
            JsonNode payload = json("""
                {"strategic_threading": {"grade": "Weak"}, "critical_gaps": "none"}
                """);

            ValidatedAnalysis<StrategyAnalysis> result =
                validator.validate(AnalysisKind.STRATEGY, payload, StrategyAnalysis.class);

            assertThat(result).isInstanceOfSatisfying(ValidatedAnalysis.Degraded.class,
                degraded -> assertThat(degraded.reason()).isEqualTo(DegradationReason.INVALID_PAYLOAD));
            StrategyAnalysis partial = result.usableValue().orElseThrow();
            assertThat(partial.threadingGrade()).isEqualTo("Weak");
            assertThat(partial.threadingScore()).isNull();
            assertThat(partial.criticalGaps()).isEmpty();
        }

        @Test
        void validate_DoesNotMutateInput() {
            JsonNode payload = json(STRATEGY_V2);
            JsonNode snapshot = payload.deepCopy();

            validator.validate(AnalysisKind.STRATEGY, payload, StrategyAnalysis.class);

            assertThat(payload).isEqualTo(snapshot);
        }
    }

    @Nested
    class DealHeat {

        @Test
        void validate_ConvertsLegacyFactorObject_ToSignedFactors() {
            JsonNode legacy = json("""
                {"heat_score": 6, "temperature": "Warm",
                 "key_factors": {"positive": ["Budget confirmed"], "negative": ["No champion"]}}
                """);

            ValidatedAnalysis<DealHeatAnalysis> result =
                validator.validate(AnalysisKind.DEAL_HEAT, legacy, DealHeatAnalysis.class);

            assertThat(result).isInstanceOfSatisfying(ValidatedAnalysis.Degraded.class,
                degraded -> assertThat(degraded.reason()).isEqualTo(DegradationReason.SCHEMA_DRIFT));
            assertThat(result.usableValue().orElseThrow().keyFactors()).containsExactly(
                new HeatFactor("Budget confirmed", "Positive", null, false),
                new HeatFactor("No champion", "Negative", null, false));
        }

        @Test
        void validate_ReturnsOk_ForCurrentSchema() {
            JsonNode current = json("""
                {"heat_score": 8, "temperature": "Hot", "trend": "Heating Up",
                 "key_factors": [{"factor": "Exec sponsor engaged", "impact": "Positive", "reasoning": "CFO joined"}],
                 "winning_probability": "70%", "recommended_action": "Send proposal"}
                """);

            ValidatedAnalysis<DealHeatAnalysis> result =
                validator.validate(AnalysisKind.DEAL_HEAT, current, DealHeatAnalysis.class);

            assertThat(result.isDegraded()).isFalse();
            DealHeatAnalysis heat = result.usableValue().orElseThrow();
            assertThat(heat.heatScore()).isEqualTo(8.0);
            assertThat(heat.keyFactors()).singleElement()
                .satisfies(factor -> assertThat(factor.structured()).isTrue());
        }
    }

    @Test
    void validate_RequiresKnownCoachingGrade() {
        ValidatedAnalysis<CoachingAnalysis> result =
            validator.validate(AnalysisKind.COACHING, json("{\"overall_grade\": \"Z\"}"), CoachingAnalysis.class);

        assertThat(result).isInstanceOfSatisfying(ValidatedAnalysis.Degraded.class,
            degraded -> assertThat(degraded.reason()).isEqualTo(DegradationReason.INVALID_PAYLOAD));
        assertThat(result.usableValue()).get()
            .satisfies(partial -> assertThat(partial.overallGrade()).isNull());
    }

    @Test
    @DisplayName("A rejected required field is left out of the partial value; valid fields are kept")
    void validate_DropsRejectedRequiredFields_FromPartialValue() {
        JsonNode payload = json("""
            {"overall_score": 61, "grade": "Maybe", "metrics": {"patience": {"score": 7}}}
            """);

        ValidatedAnalysis<BehaviorAnalysis> result =
            validator.validate(AnalysisKind.BEHAVIOR, payload, BehaviorAnalysis.class);

        assertThat(result).isInstanceOfSatisfying(ValidatedAnalysis.Degraded.class,
            degraded -> assertThat(degraded.reason()).isEqualTo(DegradationReason.INVALID_PAYLOAD));
        BehaviorAnalysis partial = result.usableValue().orElseThrow();
        assertThat(partial.grade()).isNull();
        assertThat(partial.overallScore()).isEqualTo(61.0);
        assertThat(payload.path("grade").asString()).isEqualTo("Maybe");
    }

    @Test
    void validate_ReadsMetadataParticipants_AndSkipsNamelessOnes() {
        JsonNode payload = json("""
            {"summary": "Kickoff", "topics": ["pricing"], "logistics": {"duration_minutes": 30},
             "participants": [{"name": "Dana Cole", "role": "CFO", "is_decision_maker": true}, {"role": "Analyst"}]}
            """);

        ValidatedAnalysis<CallMetadataAnalysis> result =
            validator.validate(AnalysisKind.METADATA, payload, CallMetadataAnalysis.class);

        assertThat(result).isInstanceOfSatisfying(ValidatedAnalysis.Degraded.class, degraded -> {
            assertThat(degraded.reason()).isEqualTo(DegradationReason.MALFORMED_FIELDS);
            assertThat((List<FieldIssue>) degraded.issues()).extracting(FieldIssue::path).containsExactly("participants[1]");
        });
        assertThat(result.usableValue().orElseThrow().participants()).singleElement()
            .satisfies(participant -> assertThat(participant.name()).isEqualTo("Dana Cole"));
    }

    @Test
    void validate_RecordsMissingUsageStatus_ForCompetitiveIntel() {
        JsonNode payload = json("{\"competitive_intel\": [{\"competitor_name\": \"Initech\"}]}");

        ValidatedAnalysis<CompetitiveIntelAnalysis> result =
            validator.validate(AnalysisKind.COMPETITIVE_INTEL, payload, CompetitiveIntelAnalysis.class);

        assertThat(result).isInstanceOfSatisfying(ValidatedAnalysis.Degraded.class, degraded -> {
            assertThat(degraded.reason()).isEqualTo(DegradationReason.MALFORMED_FIELDS);
            assertThat(degraded.issues()).containsExactly(FieldIssue.missing("competitive_intel[0].usage_status"));
        });
    }

    @Test
    void validateRecord_MarksAbsentKindsAsNotYetAnalyzed() {
        UUID callId = UUID.randomUUID();
        RawAnalysisRecord record = new RawAnalysisRecord(callId, Map.of(AnalysisKind.STRATEGY, json(STRATEGY_V2)));

        ValidatedCallAnalysis validated = validator.validateRecord(record, LocalDate.of(2026, 3, 1));

        assertThat(validated.callId()).isEqualTo(callId);
        assertThat(validated.strategy().isDegraded()).isFalse();
        assertThat(validated.coaching()).isInstanceOfSatisfying(ValidatedAnalysis.Degraded.class,
            degraded -> assertThat(degraded.reason()).isEqualTo(DegradationReason.NOT_YET_ANALYZED));
        assertThat(validated.competitiveIntelValue()).isEmpty();
    }
}
