package net.salescoach.application.research;

import java.util.List;
import net.salescoach.application.ai.AiGatewayClient;
import net.salescoach.support.stream.AnalysisFrame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Flux;

/**
 * Streams a free-text research brief for a company.
 */
@Service
public class AccountResearchService {

    private static final Logger log = LoggerFactory.getLogger(AccountResearchService.class);

    private static final String DEFAULT_MODEL = "google/gemini-2.5-pro";

    private final AiGatewayClient aiGatewayClient;
    private final ResearchPromptBuilder promptBuilder;
    private final String model;

    public AccountResearchService(AiGatewayClient aiGatewayClient,
                                  ResearchPromptBuilder promptBuilder,
                                  @Value("${app.ai.gateway.research-model:" + DEFAULT_MODEL + "}") String model) {
        this.aiGatewayClient = aiGatewayClient;
        this.promptBuilder = promptBuilder;
        this.model = StringUtils.hasText(model) ? model.trim() : DEFAULT_MODEL;
    }

    public String model() {
        return model;
    }

    /**
     * Validates the request and returns the upstream frame stream. Nothing is sent upstream
     * until the flux is subscribed.
     *
     * @throws InvalidResearchRequestException when the request breaks a field rule
     */
    public Flux<AnalysisFrame> stream(AccountResearchRequest request) {
        if (request == null) {
            throw new InvalidResearchRequestException(List.of("body: Request body is required"));
        }
        List<String> violations = request.violations();
        if (!violations.isEmpty()) {
            log.warn("Account research request rejected: {}", violations);
            throw new InvalidResearchRequestException(violations);
        }
        log.info("Streaming account research for company={}", request.companyName().trim());
        return aiGatewayClient.streamCompletion(model, promptBuilder.systemPrompt(), promptBuilder.buildUserPrompt(request));
    }
}
