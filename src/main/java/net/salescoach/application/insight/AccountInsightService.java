package net.salescoach.application.insight;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import net.salescoach.adapters.persistence.AccountInsightRepository;
import net.salescoach.application.ai.AiGatewayClient;
import net.salescoach.application.ai.InsightGenerationException;
import net.salescoach.application.ai.InsightGenerationException.ErrorCode;
import net.salescoach.application.analysis.AnalysisSchemaValidator;
import net.salescoach.domain.account.CallRecord;
import net.salescoach.domain.analysis.RawAnalysisRecord;
import net.salescoach.domain.analysis.ValidatedCallAnalysis;
import net.salescoach.domain.insight.AccountInsightSnapshot;
import net.salescoach.domain.insight.InsightNarrative;
import net.salescoach.domain.insight.StructuredInsights;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import tools.jackson.databind.JsonNode;

/**
 * Regenerates the account-level insight snapshot.
 *
 * <p>Pipeline: load context, validate every call's stored analyses, fold them into the
 * structured section, ask the model for the narrative section via a forced tool call, then
 * replace the stored snapshot in a single write. Any failure before the write leaves the
 * previous snapshot untouched.</p>
 */
@Service
public class AccountInsightService {

    private static final Logger log = LoggerFactory.getLogger(AccountInsightService.class);

    private static final String DEFAULT_MODEL = "google/gemini-2.5-flash";

    private final AccountContextLoader contextLoader;
    private final AnalysisSchemaValidator schemaValidator;
    private final InsightAggregator aggregator;
    private final InsightPromptBuilder promptBuilder;
    private final InsightNarrativeParser narrativeParser;
    private final AiGatewayClient aiGatewayClient;
    private final AccountInsightRepository insightRepository;
    private final Clock clock;
    private final String model;

    public AccountInsightService(AccountContextLoader contextLoader,
                                 AnalysisSchemaValidator schemaValidator,
                                 InsightAggregator aggregator,
                                 InsightPromptBuilder promptBuilder,
                                 InsightNarrativeParser narrativeParser,
                                 AiGatewayClient aiGatewayClient,
                                 AccountInsightRepository insightRepository,
                                 Clock clock,
                                 @Value("${app.ai.gateway.insights-model:" + DEFAULT_MODEL + "}") String model) {
        this.contextLoader = contextLoader;
        this.schemaValidator = schemaValidator;
        this.aggregator = aggregator;
        this.promptBuilder = promptBuilder;
        this.narrativeParser = narrativeParser;
        this.aiGatewayClient = aiGatewayClient;
        this.insightRepository = insightRepository;
        this.clock = clock;
        this.model = StringUtils.hasText(model) ? model.trim() : DEFAULT_MODEL;
    }

    /**
     * Loads the stored snapshot for an account.
     */
    public Optional<AccountInsightSnapshot> findSnapshot(UUID accountId) {
        return insightRepository.findSnapshot(accountId);
    }

    /**
     * Rebuilds and persists the snapshot for {@code accountId}.
     *
     * @return the new snapshot, or the stored one when the account has no calls and no emails
     * @throws InsightGenerationException when the account is missing, the AI round trip
     *         fails, or the write fails
     */
    public RegenerationResult regenerate(UUID accountId) {
        log.info("Regenerating account insights for accountId={}", accountId);
        AccountContext context = contextLoader.load(accountId);

        if (context.hasNothingToAnalyze()) {
            log.info("No calls or emails for accountId={}; leaving insights unchanged", accountId);
            return RegenerationResult.nothingToAnalyze(insightRepository.findSnapshot(accountId).orElse(null));
        }

        List<ValidatedCallAnalysis> validated = validateNewestFirst(context);
        StructuredInsights structured = aggregator.aggregate(validated);

        Map<UUID, ValidatedCallAnalysis> validatedByCall = new LinkedHashMap<>();
        validated.forEach(analysis -> validatedByCall.put(analysis.callId(), analysis));
        String userPrompt = promptBuilder.buildUserPrompt(context, validatedByCall);

        JsonNode arguments = aiGatewayClient.invokeTool(
            model, promptBuilder.systemPrompt(), userPrompt, promptBuilder.insightsTool());
        InsightNarrative narrative = narrativeParser.parse(arguments);

        AccountInsightSnapshot snapshot = AccountInsightSnapshot.compose(narrative, structured, clock.instant());
        try {
            insightRepository.replaceSnapshot(accountId, snapshot);
        } catch (DataAccessException persistenceFailure) {
            log.error("Failed to persist account insights for accountId={}", accountId, persistenceFailure);
            throw new InsightGenerationException(ErrorCode.PERSISTENCE_FAILED,
                "Account insights could not be saved", persistenceFailure);
        }

        if (narrative.industry() != null && !StringUtils.hasText(context.account().industry())) {
            log.info("Auto-populated industry '{}' for accountId={}", narrative.industry(), accountId);
        }
        log.info("Account insights regenerated for accountId={} (calls={}, emails={}, degradedSections={})",
            accountId, context.calls().size(), context.emails().size(), context.degradedSections());
        return RegenerationResult.regenerated(snapshot);
    }

    private List<ValidatedCallAnalysis> validateNewestFirst(AccountContext context) {
        List<CallRecord> calls = new ArrayList<>(context.calls());
        calls.sort(CallRecord.NEWEST_FIRST);
        List<ValidatedCallAnalysis> validated = new ArrayList<>(calls.size());
        for (CallRecord call : calls) {
            RawAnalysisRecord raw = context.analyses().getOrDefault(call.id(), RawAnalysisRecord.empty(call.id()));
            validated.add(schemaValidator.validateRecord(raw, call.callDate()));
        }
        return validated;
    }
}
