package net.salescoach.application.analysis;

import static net.salescoach.application.analysis.FieldShape.ARRAY;
import static net.salescoach.application.analysis.FieldShape.NUMBER;
import static net.salescoach.application.analysis.FieldShape.OBJECT;
import static net.salescoach.application.analysis.FieldShape.TEXT;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import net.salescoach.domain.analysis.AnalysisKind;
import net.salescoach.domain.analysis.BehaviorAnalysis;
import net.salescoach.domain.analysis.CallMetadataAnalysis;
import net.salescoach.domain.analysis.CoachingAnalysis;
import net.salescoach.domain.analysis.CompetitiveIntelAnalysis;
import net.salescoach.domain.analysis.DealHeatAnalysis;
import net.salescoach.domain.analysis.PsychologyAnalysis;
import net.salescoach.domain.analysis.StrategyAnalysis;

/**
 * Schema version history of every analysis kind.
 *
 * <p>Version 1 is the single-prompt pipeline; version 2 is the multi-agent pipeline, which
 * only ever added required fields. Competitive intel did not exist before version 2.</p>
 */
final class AnalysisSchemaCatalog {

    private AnalysisSchemaCatalog() {
    }

    static Map<AnalysisKind, AnalysisSchemaFamily<?>> defaultFamilies() {
        Map<AnalysisKind, AnalysisSchemaFamily<?>> families = new EnumMap<>(AnalysisKind.class);

        List<RequiredField> behaviorV1 = List.of(
            RequiredField.of("overall_score", NUMBER),
            RequiredField.oneOf("grade", "Pass", "Fail"),
            RequiredField.of("metrics", OBJECT));
        families.put(AnalysisKind.BEHAVIOR, new AnalysisSchemaFamily<>(
            AnalysisKind.BEHAVIOR, BehaviorAnalysis.class, AnalysisPayloadReaders::behavior, List.of(
                new SchemaVersion(1, behaviorV1),
                new SchemaVersion(2, extend(behaviorV1,
                    RequiredField.of("metrics.patience", OBJECT),
                    RequiredField.of("metrics.talk_listen_ratio", OBJECT),
                    RequiredField.of("metrics.next_steps", OBJECT),
                    RequiredField.of("metrics.question_quality.score", NUMBER))))));

        List<RequiredField> strategyV1 = List.of(
            RequiredField.of("strategic_threading.score", NUMBER),
            RequiredField.of("strategic_threading.grade", TEXT),
            RequiredField.of("critical_gaps", ARRAY));
        families.put(AnalysisKind.STRATEGY, new AnalysisSchemaFamily<>(
            AnalysisKind.STRATEGY, StrategyAnalysis.class, AnalysisPayloadReaders::strategy, List.of(
                new SchemaVersion(1, strategyV1),
                new SchemaVersion(2, extend(strategyV1,
                    RequiredField.of("strategic_threading.strategic_summary", TEXT),
                    RequiredField.of("strategic_threading.score_breakdown", OBJECT))))));

        List<RequiredField> metadataV1 = List.of(
            RequiredField.of("summary", TEXT),
            RequiredField.of("participants", ARRAY));
        families.put(AnalysisKind.METADATA, new AnalysisSchemaFamily<>(
            AnalysisKind.METADATA, CallMetadataAnalysis.class, AnalysisPayloadReaders::metadata, List.of(
                new SchemaVersion(1, metadataV1),
                new SchemaVersion(2, extend(metadataV1,
                    RequiredField.of("topics", ARRAY),
                    RequiredField.of("logistics.duration_minutes", NUMBER))))));

        List<RequiredField> psychologyV1 = List.of(
            RequiredField.of("prospect_persona", TEXT),
            RequiredField.of("disc_profile", TEXT));
        families.put(AnalysisKind.PSYCHOLOGY, new AnalysisSchemaFamily<>(
            AnalysisKind.PSYCHOLOGY, PsychologyAnalysis.class, AnalysisPayloadReaders::psychology, List.of(
                new SchemaVersion(1, psychologyV1),
                new SchemaVersion(2, extend(psychologyV1,
                    RequiredField.of("primary_speaker_name", TEXT),
                    RequiredField.of("communication_style", OBJECT),
                    RequiredField.of("dos_and_donts", OBJECT))))));

        List<RequiredField> coachingV1 = List.of(
            RequiredField.oneOf("overall_grade", "A+", "A", "B", "C", "D", "F"));
        families.put(AnalysisKind.COACHING, new AnalysisSchemaFamily<>(
            AnalysisKind.COACHING, CoachingAnalysis.class, AnalysisPayloadReaders::coaching, List.of(
                new SchemaVersion(1, coachingV1),
                new SchemaVersion(2, extend(coachingV1,
                    RequiredField.of("executive_summary", TEXT),
                    RequiredField.of("primary_focus_area", TEXT),
                    RequiredField.of("top_3_strengths", ARRAY),
                    RequiredField.of("top_3_areas_for_improvement", ARRAY))))));

        List<RequiredField> dealHeatV1 = List.of(
            RequiredField.of("heat_score", NUMBER),
            RequiredField.of("temperature", TEXT));
        families.put(AnalysisKind.DEAL_HEAT, new AnalysisSchemaFamily<>(
            AnalysisKind.DEAL_HEAT, DealHeatAnalysis.class, AnalysisPayloadReaders::dealHeat, List.of(
                new SchemaVersion(1, dealHeatV1),
                new SchemaVersion(2, extend(dealHeatV1,
                    RequiredField.of("trend", TEXT),
                    RequiredField.of("key_factors", ARRAY),
                    RequiredField.of("recommended_action", TEXT))))));

        families.put(AnalysisKind.COMPETITIVE_INTEL, new AnalysisSchemaFamily<>(
            AnalysisKind.COMPETITIVE_INTEL, CompetitiveIntelAnalysis.class, AnalysisPayloadReaders::competitiveIntel,
            List.of(new SchemaVersion(2, List.of(RequiredField.of("competitive_intel", ARRAY))))));

        return Collections.unmodifiableMap(families);
    }

    private static List<RequiredField> extend(List<RequiredField> base, RequiredField... added) {
        List<RequiredField> fields = new ArrayList<>(base);
        Collections.addAll(fields, added);
        return fields;
    }
}
