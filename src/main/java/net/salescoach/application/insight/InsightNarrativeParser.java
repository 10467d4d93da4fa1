package net.salescoach.application.insight;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import net.salescoach.application.ai.InsightGenerationException;
import net.salescoach.application.ai.InsightGenerationException.ErrorCode;
import net.salescoach.domain.insight.DecisionProcess;
import net.salescoach.domain.insight.InsightNarrative;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import tools.jackson.databind.JsonNode;

/**
 * Maps {@code submit_account_insights} tool arguments onto {@link InsightNarrative}.
 *
 * <p>Only {@code business_context} is required. An industry outside the known codes is
 * dropped rather than stored.</p>
 */
@Component
public class InsightNarrativeParser {

    private static final Logger log = LoggerFactory.getLogger(InsightNarrativeParser.class);
    private static final int MAX_LIST_ENTRIES = 20;

    /**
     * @throws InsightGenerationException {@code TOOL_PAYLOAD_INVALID} without a business context
     */
    public InsightNarrative parse(JsonNode arguments) {
        String businessContext = optionalText(arguments, "business_context")
            .orElseThrow(() -> new InsightGenerationException(ErrorCode.TOOL_PAYLOAD_INVALID,
                "Insight tool arguments are missing business_context"));

        String industry = null;
        Optional<String> rawIndustry = optionalText(arguments, "industry");
        if (rawIndustry.isPresent()) {
            industry = IndustryCatalog.normalize(rawIndustry.get()).orElse(null);
            if (industry == null) {
                log.warn("Dropping unrecognized industry '{}' from insight synthesis", rawIndustry.get());
            }
        }

        return new InsightNarrative(
            businessContext,
            stringList(arguments, "pain_points"),
            decisionProcess(arguments.path("decision_process")),
            stringList(arguments, "competitors_mentioned"),
            optionalText(arguments, "communication_summary").orElse(null),
            stringList(arguments, "key_opportunities"),
            optionalText(arguments, "relationship_health").orElse(null),
            industry
        );
    }

    private DecisionProcess decisionProcess(JsonNode node) {
        if (!node.isObject()) {
            return null;
        }
        List<String> stakeholders = stringList(node, "stakeholders");
        String timeline = optionalText(node, "timeline").orElse(null);
        String budgetSignals = optionalText(node, "budget_signals").orElse(null);
        if (stakeholders.isEmpty() && timeline == null && budgetSignals == null) {
            return null;
        }
        return new DecisionProcess(stakeholders, timeline, budgetSignals);
    }

    private Optional<String> optionalText(JsonNode payload, String field) {
        JsonNode node = payload.path(field);
        if (!node.isString()) {
            return Optional.empty();
        }
        return Optional.of(node.asString())
            .filter(StringUtils::hasText)
            .map(String::trim);
    }

    private List<String> stringList(JsonNode payload, String field) {
        JsonNode node = payload.path(field);
        if (!node.isArray()) {
            return List.of();
        }
        List<String> values = new ArrayList<>();
        for (JsonNode element : node) {
            String text = element.asString(null);
            if (!StringUtils.hasText(text)) {
                continue;
            }
            values.add(text.trim());
            if (values.size() == MAX_LIST_ENTRIES) {
                break;
            }
        }
        return values.isEmpty() ? List.of() : List.copyOf(values);
    }
}
