package net.salescoach.application.analysis;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import net.salescoach.domain.analysis.BehaviorAnalysis;
import net.salescoach.domain.analysis.CallMetadataAnalysis;
import net.salescoach.domain.analysis.CallParticipant;
import net.salescoach.domain.analysis.CoachingAnalysis;
import net.salescoach.domain.analysis.CompetitiveIntelAnalysis;
import net.salescoach.domain.analysis.CompetitorMention;
import net.salescoach.domain.analysis.CriticalGap;
import net.salescoach.domain.analysis.DealHeatAnalysis;
import net.salescoach.domain.analysis.FieldIssue;
import net.salescoach.domain.analysis.GapCategory;
import net.salescoach.domain.analysis.GapEntry;
import net.salescoach.domain.analysis.GapImpact;
import net.salescoach.domain.analysis.HeatFactor;
import net.salescoach.domain.analysis.MissedOpportunity;
import net.salescoach.domain.analysis.PsychologyAnalysis;
import net.salescoach.domain.analysis.StrategyAnalysis;
import tools.jackson.databind.JsonNode;

/**
 * Per-kind readers producing the typed representation shared by every schema version.
 *
 * <p>Loosely typed list elements (bare strings in first-generation payloads, objects in
 * current ones) are decoded into a tagged variant and normalized to the structured shape
 * right here, so nothing downstream sees the legacy form.</p>
 */
final class AnalysisPayloadReaders {

    private AnalysisPayloadReaders() {
    }

    static BehaviorAnalysis behavior(JsonNode payload, List<FieldIssue> issues) {
        return new BehaviorAnalysis(
            JsonFields.number(payload, "overall_score", issues),
            JsonFields.text(payload, "grade", issues),
            JsonFields.number(payload, "metrics.patience.score", issues),
            JsonFields.integer(payload, "metrics.patience.interruption_count", issues),
            JsonFields.number(payload, "metrics.talk_listen_ratio.score", issues),
            JsonFields.number(payload, "metrics.talk_listen_ratio.rep_talk_percentage", issues),
            JsonFields.number(payload, "metrics.next_steps.score", issues),
            JsonFields.bool(payload, "metrics.next_steps.secured", issues),
            JsonFields.number(payload, "metrics.question_quality.score", issues)
        );
    }

    static StrategyAnalysis strategy(JsonNode payload, List<FieldIssue> issues) {
        List<CriticalGap> gaps = gapEntries(payload, "critical_gaps", issues).stream()
            .map(GapEntry::normalize)
            .toList();
        return new StrategyAnalysis(
            JsonFields.number(payload, "strategic_threading.score", issues),
            JsonFields.text(payload, "strategic_threading.grade", issues),
            JsonFields.text(payload, "strategic_threading.strategic_summary", issues),
            missedOpportunities(payload, issues),
            gaps,
            competitors(payload, "competitive_intel", issues)
        );
    }

    static CallMetadataAnalysis metadata(JsonNode payload, List<FieldIssue> issues) {
        List<CallParticipant> participants = new ArrayList<>();
        Optional<JsonNode> array = JsonFields.array(payload, "participants", issues);
        if (array.isPresent()) {
            int index = 0;
            for (JsonNode element : array.get()) {
                String path = "participants[" + index++ + "]";
                String name = element.isObject() ? JsonFields.text(element, "name") : null;
                if (name == null) {
                    issues.add(FieldIssue.unexpected(path, "object with name"));
                    continue;
                }
                participants.add(new CallParticipant(
                    name,
                    JsonFields.text(element, "role"),
                    element.path("is_decision_maker").isBoolean() ? element.path("is_decision_maker").asBoolean() : null,
                    JsonFields.text(element, "sentiment")
                ));
            }
        }
        List<String> topics = JsonFields.at(payload, "topics").isMissingNode()
            ? JsonFields.stringList(payload, "key_topics", issues)
            : JsonFields.stringList(payload, "topics", issues);
        return new CallMetadataAnalysis(
            JsonFields.text(payload, "summary", issues),
            topics,
            JsonFields.number(payload, "logistics.duration_minutes", issues),
            participants
        );
    }

    static PsychologyAnalysis psychology(JsonNode payload, List<FieldIssue> issues) {
        return new PsychologyAnalysis(
            JsonFields.text(payload, "primary_speaker_name", issues),
            JsonFields.text(payload, "prospect_persona", issues),
            JsonFields.text(payload, "disc_profile", issues),
            JsonFields.text(payload, "communication_style.tone", issues),
            JsonFields.text(payload, "communication_style.preference", issues),
            JsonFields.stringList(payload, "dos_and_donts.do", issues),
            JsonFields.stringList(payload, "dos_and_donts.dont", issues)
        );
    }

    static CoachingAnalysis coaching(JsonNode payload, List<FieldIssue> issues) {
        return new CoachingAnalysis(
            JsonFields.text(payload, "overall_grade", issues),
            JsonFields.text(payload, "executive_summary", issues),
            JsonFields.text(payload, "primary_focus_area", issues),
            JsonFields.stringList(payload, "top_3_strengths", issues),
            JsonFields.stringList(payload, "top_3_areas_for_improvement", issues),
            JsonFields.text(payload, "coaching_prescription", issues),
            JsonFields.text(payload, "immediate_action", issues)
        );
    }

    static DealHeatAnalysis dealHeat(JsonNode payload, List<FieldIssue> issues) {
        return new DealHeatAnalysis(
            JsonFields.number(payload, "heat_score", issues),
            JsonFields.text(payload, "temperature", issues),
            JsonFields.text(payload, "trend", issues),
            heatFactors(payload, issues),
            JsonFields.text(payload, "winning_probability", issues),
            JsonFields.text(payload, "recommended_action", issues)
        );
    }

    static CompetitiveIntelAnalysis competitiveIntel(JsonNode payload, List<FieldIssue> issues) {
        return new CompetitiveIntelAnalysis(competitors(payload, "competitive_intel", issues));
    }

    private static List<GapEntry> gapEntries(JsonNode payload, String path, List<FieldIssue> issues) {
        Optional<JsonNode> array = JsonFields.array(payload, path, issues);
        if (array.isEmpty()) {
            return List.of();
        }
        List<GapEntry> entries = new ArrayList<>();
        int index = 0;
        for (JsonNode element : array.get()) {
            String elementPath = path + "[" + index++ + "]";
            if (element.isString() && !element.asString().isBlank()) {
                entries.add(new GapEntry.Plain(element.asString().trim()));
                continue;
            }
            String description = element.isObject() ? JsonFields.text(element, "description") : null;
            if (description == null) {
                issues.add(FieldIssue.unexpected(elementPath, "string or object with description"));
                continue;
            }
            String categoryLabel = JsonFields.text(element, "category");
            GapCategory category = GapCategory.fromLabel(categoryLabel).orElse(null);
            if (categoryLabel != null && category == null) {
                issues.add(FieldIssue.unexpected(elementPath + ".category", "known gap category"));
            }
            String impactLabel = JsonFields.text(element, "impact");
            GapImpact impact = GapImpact.fromLabel(impactLabel).orElse(null);
            if (impactLabel != null && impact == null) {
                issues.add(FieldIssue.unexpected(elementPath + ".impact", "High, Medium or Low"));
            }
            entries.add(new GapEntry.Structured(new CriticalGap(
                category, description, impact, JsonFields.text(element, "suggested_question"), true)));
        }
        return entries;
    }

    private static List<MissedOpportunity> missedOpportunities(JsonNode payload, List<FieldIssue> issues) {
        String path = "strategic_threading.missed_opportunities";
        Optional<JsonNode> array = JsonFields.array(payload, path, issues);
        if (array.isEmpty()) {
            return List.of();
        }
        List<MissedOpportunity> opportunities = new ArrayList<>();
        int index = 0;
        for (JsonNode element : array.get()) {
            String elementPath = path + "[" + index++ + "]";
            if (element.isString() && !element.asString().isBlank()) {
                opportunities.add(new MissedOpportunity(element.asString().trim(), null, null, null, false));
                continue;
            }
            String pain = element.isObject() ? JsonFields.text(element, "pain") : null;
            if (pain == null) {
                issues.add(FieldIssue.unexpected(elementPath, "string or object with pain"));
                continue;
            }
            opportunities.add(new MissedOpportunity(
                pain,
                JsonFields.text(element, "severity"),
                JsonFields.text(element, "suggested_pitch"),
                JsonFields.text(element, "talk_track"),
                true));
        }
        return opportunities;
    }

    private static List<CompetitorMention> competitors(JsonNode payload, String path, List<FieldIssue> issues) {
        Optional<JsonNode> array = JsonFields.array(payload, path, issues);
        if (array.isEmpty()) {
            return List.of();
        }
        List<CompetitorMention> mentions = new ArrayList<>();
        int index = 0;
        for (JsonNode element : array.get()) {
            String elementPath = path + "[" + index++ + "]";
            String name = element.isObject() ? JsonFields.text(element, "competitor_name") : null;
            if (name == null) {
                issues.add(FieldIssue.unexpected(elementPath, "object with competitor_name"));
                continue;
            }
            String status = JsonFields.text(element, "usage_status");
            if (status == null) {
                issues.add(FieldIssue.missing(elementPath + ".usage_status"));
            }
            mentions.add(new CompetitorMention(name, status, JsonFields.text(element, "competitive_position")));
        }
        return mentions;
    }

    private static List<HeatFactor> heatFactors(JsonNode payload, List<FieldIssue> issues) {
        JsonNode node = JsonFields.at(payload, "key_factors");
        if (node.isObject()) {
            // First-generation shape: {positive: [...], negative: [...]}
            List<HeatFactor> factors = new ArrayList<>();
            JsonFields.stringList(node, "positive", issues)
                .forEach(text -> factors.add(new HeatFactor(text, "Positive", null, false)));
            JsonFields.stringList(node, "negative", issues)
                .forEach(text -> factors.add(new HeatFactor(text, "Negative", null, false)));
            return factors;
        }
        Optional<JsonNode> array = JsonFields.array(payload, "key_factors", issues);
        if (array.isEmpty()) {
            return List.of();
        }
        List<HeatFactor> factors = new ArrayList<>();
        int index = 0;
        for (JsonNode element : array.get()) {
            String elementPath = "key_factors[" + index++ + "]";
            if (element.isString() && !element.asString().isBlank()) {
                factors.add(new HeatFactor(element.asString().trim(), null, null, false));
                continue;
            }
            String factor = element.isObject() ? JsonFields.text(element, "factor") : null;
            if (factor == null) {
                issues.add(FieldIssue.unexpected(elementPath, "string or object with factor"));
                continue;
            }
            factors.add(new HeatFactor(factor, JsonFields.text(element, "impact"), JsonFields.text(element, "reasoning"), true));
        }
        return factors;
    }
}
