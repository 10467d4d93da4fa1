package net.salescoach.application.insight;

import java.text.NumberFormat;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;
import net.salescoach.application.ai.ToolDefinition;
import net.salescoach.domain.account.Account;
import net.salescoach.domain.account.CallRecord;
import net.salescoach.domain.account.EmailLogEntry;
import net.salescoach.domain.account.Stakeholder;
import net.salescoach.domain.analysis.CallParticipant;
import net.salescoach.domain.analysis.CriticalGap;
import net.salescoach.domain.analysis.ValidatedCallAnalysis;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.node.ArrayNode;
import tools.jackson.databind.node.ObjectNode;

/**
 * Builds the bounded synthesis prompt and the {@code submit_account_insights} tool schema.
 *
 * <p>At most the configured number of most recent calls and emails are included, each cut to
 * a fixed excerpt length.</p>
 */
@Component
public class InsightPromptBuilder {

    static final String TOOL_NAME = "submit_account_insights";

    static final String SYSTEM_PROMPT = """
        You are a sales intelligence analyst. Analyze the call history, email communications and
        stakeholder information for one account and produce concise, specific account insights.

        Rules:
        - Base every statement on the supplied data. Do not invent names, numbers or dates.
        - business_context: 2-3 sentences about the company and its situation.
        - pain_points: each pain point the prospect actually expressed.
        - decision_process: who decides, the timeline, and any budget signals.
        - key_opportunities: 2-3 concrete opportunities for the rep.
        - industry: choose the closest listed value, or "other".
        """;

    private final ObjectMapper objectMapper;
    private final int maxCallsInContext;
    private final int maxEmailsInContext;
    private final int callExcerptChars;
    private final int emailExcerptChars;

    public InsightPromptBuilder(ObjectMapper objectMapper,
                                @Value("${app.insights.max-calls-in-context:10}") int maxCallsInContext,
                                @Value("${app.insights.max-emails-in-context:10}") int maxEmailsInContext,
                                @Value("${app.insights.call-excerpt-chars:1000}") int callExcerptChars,
                                @Value("${app.insights.email-excerpt-chars:500}") int emailExcerptChars) {
        this.objectMapper = objectMapper;
        this.maxCallsInContext = Math.max(1, maxCallsInContext);
        this.maxEmailsInContext = Math.max(1, maxEmailsInContext);
        this.callExcerptChars = Math.max(100, callExcerptChars);
        this.emailExcerptChars = Math.max(100, emailExcerptChars);
    }

    public String systemPrompt() {
        return SYSTEM_PROMPT;
    }

    /**
     * Tool the model is forced to call; only {@code business_context} is required.
     */
    public ToolDefinition insightsTool() {
        ObjectNode parameters = objectMapper.createObjectNode();
        parameters.put("type", "object");
        ObjectNode properties = parameters.putObject("properties");
        stringProperty(properties, "business_context", "2-3 sentences about the company");
        stringArrayProperty(properties, "pain_points", "Specific pain points mentioned");
        ObjectNode decisionProcess = properties.putObject("decision_process");
        decisionProcess.put("type", "object");
        ObjectNode decisionProperties = decisionProcess.putObject("properties");
        stringArrayProperty(decisionProperties, "stakeholders", "People involved in the decision");
        stringProperty(decisionProperties, "timeline", "Decision or purchase timeline");
        stringProperty(decisionProperties, "budget_signals", "Budget signals observed");
        stringArrayProperty(properties, "competitors_mentioned", "Competitor names mentioned");
        stringProperty(properties, "communication_summary", "Summary of recent communications");
        stringArrayProperty(properties, "key_opportunities", "2-3 specific opportunities");
        stringProperty(properties, "relationship_health", "Brief relationship assessment");
        ObjectNode industry = stringProperty(properties, "industry", "The industry of the account based on communications");
        ArrayNode industryValues = industry.putArray("enum");
        IndustryCatalog.CODES.forEach(industryValues::add);
        parameters.putArray("required").add("business_context");
        return new ToolDefinition(TOOL_NAME, "Submit the analyzed account insights", parameters);
    }

    /**
     * Renders the account context.
     *
     * @param context fetched account data, calls newest first
     * @param validatedByCall validated analyses keyed by call ID
     */
    public String buildUserPrompt(AccountContext context, Map<UUID, ValidatedCallAnalysis> validatedByCall) {
        Account account = context.account();
        StringBuilder prompt = new StringBuilder();
        prompt.append("## ACCOUNT: ").append(account.accountName()).append('\n');
        prompt.append("Status: ").append(orDefault(account.status(), "Unknown")).append('\n');
        prompt.append("Heat Score: ").append(account.heatScore() == null ? "Not rated" : account.heatScore() + "/10").append('\n');
        prompt.append("Potential Revenue: ").append(account.potentialRevenue() == null
            ? "Unknown"
            : NumberFormat.getCurrencyInstance(Locale.US).format(account.potentialRevenue())).append('\n');

        appendStakeholders(prompt, context.stakeholders(), participantNames(validatedByCall));
        appendCalls(prompt, context.calls(), validatedByCall);
        appendEmails(prompt, context.emails(), context.stakeholders());

        prompt.append("""

            ## TASK
            Analyze ALL the data above and generate comprehensive account insights. Focus on:
            1. Understanding their business and situation
            2. Identifying ALL pain points mentioned
            3. Mapping the decision process
            4. Noting any competitors
            5. Summarizing recent communication state
            6. Identifying opportunities for the rep
            """);
        return prompt.toString();
    }

    private void appendStakeholders(StringBuilder prompt, List<Stakeholder> stakeholders, Set<String> participants) {
        prompt.append("\n## STAKEHOLDERS (").append(stakeholders.size()).append(")\n");
        for (Stakeholder stakeholder : stakeholders) {
            prompt.append("- ").append(stakeholder.name());
            if (stakeholder.jobTitle() != null) {
                prompt.append(" (").append(stakeholder.jobTitle()).append(')');
            }
            prompt.append(" - ").append(orDefault(stakeholder.influenceLevel(), "unknown influence"));
            if (stakeholder.championScore() != null) {
                prompt.append(", Champion: ").append(stakeholder.championScore()).append("/10");
            }
            if (stakeholder.primaryContact()) {
                prompt.append(" [PRIMARY]");
            }
            if (participants.contains(normalizeName(stakeholder.name()))) {
                prompt.append(" [ON CALLS]");
            }
            prompt.append('\n');
        }
    }

    private void appendCalls(StringBuilder prompt, List<CallRecord> calls, Map<UUID, ValidatedCallAnalysis> validatedByCall) {
        prompt.append("\n## CALL HISTORY (").append(calls.size()).append(" calls)\n");
        for (CallRecord call : calls.subList(0, Math.min(calls.size(), maxCallsInContext))) {
            prompt.append("\n### ").append(call.callDate() == null ? "Undated" : call.callDate())
                .append(" - ").append(orDefault(call.callType(), "Call")).append('\n');
            ValidatedCallAnalysis analysis = validatedByCall.get(call.id());
            if (analysis != null) {
                analysis.metadataValue()
                    .map(metadata -> metadata.summary())
                    .ifPresent(summary -> prompt.append("Summary: ").append(summary).append('\n'));
                List<String> gapDescriptions = analysis.strategyValue()
                    .map(strategy -> strategy.criticalGaps().stream().map(CriticalGap::description).toList())
                    .orElse(List.of());
                if (!gapDescriptions.isEmpty()) {
                    prompt.append("Gaps: ").append(String.join(", ", gapDescriptions)).append('\n');
                }
            }
            if (call.rawText() != null) {
                prompt.append("Transcript: ").append(excerpt(call.rawText(), callExcerptChars)).append('\n');
            }
        }
    }

    private void appendEmails(StringBuilder prompt, List<EmailLogEntry> emails, List<Stakeholder> stakeholders) {
        if (emails.isEmpty()) {
            return;
        }
        Map<UUID, Stakeholder> stakeholdersById = new HashMap<>();
        stakeholders.forEach(stakeholder -> stakeholdersById.put(stakeholder.id(), stakeholder));
        prompt.append("\n## EMAIL COMMUNICATIONS (").append(emails.size()).append(" emails)\n");
        for (EmailLogEntry email : emails.subList(0, Math.min(emails.size(), maxEmailsInContext))) {
            String contact = orDefault(email.contactName(), "");
            Stakeholder stakeholder = email.stakeholderId() == null ? null : stakeholdersById.get(email.stakeholderId());
            if (stakeholder != null) {
                contact = stakeholder.jobTitle() == null
                    ? stakeholder.name()
                    : stakeholder.name() + " (" + stakeholder.jobTitle() + ")";
            }
            prompt.append("\n[").append(email.emailDate() == null ? "Undated" : email.emailDate()).append("] ")
                .append(email.outgoing() ? "SENT" : "RECEIVED");
            if (!contact.isEmpty()) {
                prompt.append(" - ").append(contact);
            }
            prompt.append('\n');
            if (email.subject() != null) {
                prompt.append("Subject: ").append(email.subject()).append('\n');
            }
            if (email.body() != null) {
                prompt.append(excerpt(email.body(), emailExcerptChars)).append('\n');
            }
        }
    }

    private static Set<String> participantNames(Map<UUID, ValidatedCallAnalysis> validatedByCall) {
        Set<String> names = new HashSet<>();
        validatedByCall.values().forEach(analysis -> analysis.metadataValue().ifPresent(metadata ->
            names.addAll(metadata.participants().stream()
                .map(CallParticipant::name)
                .filter(Objects::nonNull)
                .map(InsightPromptBuilder::normalizeName)
                .collect(Collectors.toSet()))));
        return names;
    }

    static String normalizeName(String name) {
        return name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
    }

    static String excerpt(String text, int maxChars) {
        if (text.length() <= maxChars) {
            return text;
        }
        int end = maxChars;
        // Never split a surrogate pair
        if (end > 0 && Character.isHighSurrogate(text.charAt(end - 1))) {
            end--;
        }
        return text.substring(0, end) + "...";
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }

    private static ObjectNode stringProperty(ObjectNode properties, String name, String description) {
        ObjectNode property = properties.putObject(name);
        property.put("type", "string");
        property.put("description", description);
        return property;
    }

    private static void stringArrayProperty(ObjectNode properties, String name, String description) {
        ObjectNode property = properties.putObject(name);
        property.put("type", "array");
        property.putObject("items").put("type", "string");
        property.put("description", description);
    }
}
