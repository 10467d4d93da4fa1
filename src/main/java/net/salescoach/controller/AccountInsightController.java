package net.salescoach.controller;

import java.security.Principal;
import java.util.UUID;
import net.salescoach.application.ai.InsightGenerationException;
import net.salescoach.application.insight.AccountInsightService;
import net.salescoach.application.insight.RegenerationResult;
import net.salescoach.controller.support.ErrorResponseUtils;
import net.salescoach.support.ratelimit.RateLimitDecision;
import net.salescoach.support.ratelimit.RegenerationRateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Regenerates and reads account insight snapshots.
 *
 * <p>Every regeneration is rate limited per authenticated identity before any data is
 * fetched. Failures never touch the stored snapshot.</p>
 */
@RestController
@RequestMapping("/api/accounts")
public class AccountInsightController {

    private static final Logger log = LoggerFactory.getLogger(AccountInsightController.class);

    private static final String PRODUCTION_ENVIRONMENT_MODE = "production";
    private static final String UPSTREAM_RETRY_AFTER_SECONDS = "60";
    private static final String GENERIC_FAILURE = "Insight generation failed. Please try again.";

    private final AccountInsightService insightService;
    private final RegenerationRateLimiter rateLimiter;
    private final boolean exposeDetailedErrors;

    public AccountInsightController(AccountInsightService insightService,
                                    RegenerationRateLimiter rateLimiter,
                                    @Value("${app.environment.mode:production}") String environmentMode) {
        this.insightService = insightService;
        this.rateLimiter = rateLimiter;
        this.exposeDetailedErrors = !PRODUCTION_ENVIRONMENT_MODE.equals(
            ErrorResponseUtils.normalizeEnvironmentMode(environmentMode));
    }

    @PostMapping("/{accountId}/insights/regenerate")
    public ResponseEntity<RegenerationResponse> regenerate(@PathVariable UUID accountId, Principal principal) {
        if (principal == null || principal.getName() == null || principal.getName().isBlank()) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(RegenerationResponse.failure("Unauthorized"));
        }

        RateLimitDecision decision = rateLimiter.check(principal.getName());
        if (decision instanceof RateLimitDecision.Denied denied) {
            return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                .header(HttpHeaders.RETRY_AFTER, String.valueOf(denied.retryAfterSeconds()))
                .body(RegenerationResponse.rateLimited(
                    "Rate limit exceeded. Try again in " + denied.retryAfterSeconds() + " seconds."));
        }

        try {
            RegenerationResult result = insightService.regenerate(accountId);
            if (!result.regenerated()) {
                return ResponseEntity.ok(RegenerationResponse.nothingToAnalyze(result.snapshot()));
            }
            return ResponseEntity.ok(RegenerationResponse.regenerated(result.snapshot()));
        } catch (InsightGenerationException failure) {
            return failureResponse(accountId, failure);
        }
    }

    @GetMapping("/{accountId}/insights")
    public ResponseEntity<?> currentInsights(@PathVariable UUID accountId) {
        return insightService.findSnapshot(accountId)
            .<ResponseEntity<?>>map(ResponseEntity::ok)
            .orElseGet(() -> ErrorResponseUtils.notFound("No insights for account " + accountId));
    }

    private ResponseEntity<RegenerationResponse> failureResponse(UUID accountId, InsightGenerationException failure) {
        log.warn("Insight regeneration failed for accountId={} code={}", accountId, failure.errorCode().wireValue());
        return switch (failure.errorCode()) {
            case ACCOUNT_NOT_FOUND -> ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(RegenerationResponse.failure("Account not found"));
            case UPSTREAM_RATE_LIMITED -> ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                .header(HttpHeaders.RETRY_AFTER, UPSTREAM_RETRY_AFTER_SECONDS)
                .body(RegenerationResponse.rateLimited("AI service is busy. Please try again shortly."));
            case UPSTREAM_QUOTA_EXCEEDED -> ResponseEntity.status(HttpStatus.PAYMENT_REQUIRED)
                .body(RegenerationResponse.failure(clientMessage(failure, "AI usage quota exhausted.")));
            case UPSTREAM_TIMEOUT -> ResponseEntity.status(HttpStatus.GATEWAY_TIMEOUT)
                .body(RegenerationResponse.failure(clientMessage(failure, GENERIC_FAILURE)));
            case PERSISTENCE_FAILED -> ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(RegenerationResponse.failure(clientMessage(failure, GENERIC_FAILURE)));
            case AI_NOT_CONFIGURED -> ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(RegenerationResponse.failure("AI service not configured"));
            default -> ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                .body(RegenerationResponse.failure(clientMessage(failure, GENERIC_FAILURE)));
        };
    }

    private String clientMessage(InsightGenerationException failure, String fallback) {
        if (exposeDetailedErrors && failure.getMessage() != null && !failure.getMessage().isBlank()) {
            return failure.getMessage();
        }
        return fallback;
    }
}
