package net.salescoach.controller;

import jakarta.servlet.http.HttpServletResponse;
import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import net.salescoach.application.ai.InsightGenerationException;
import net.salescoach.application.research.AccountResearchRequest;
import net.salescoach.application.research.AccountResearchService;
import net.salescoach.application.research.InvalidResearchRequestException;
import net.salescoach.controller.support.ErrorResponseUtils;
import net.salescoach.support.stream.AnalysisFrame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;

/**
 * Streams account research briefs as server-sent events.
 *
 * <p>Event sequence: {@code message_start}, any number of {@code message_delta}, then either
 * {@code done} or a terminal {@code error}. Closing the stream from either side cancels the
 * upstream request.</p>
 */
@RestController
@RequestMapping("/api/accounts/research")
public class AccountResearchController {

    private static final Logger log = LoggerFactory.getLogger(AccountResearchController.class);

    private static final long SSE_TIMEOUT_MILLIS = Duration.ofMinutes(4).toMillis();
    private static final String PRODUCTION_ENVIRONMENT_MODE = "production";

    private final AccountResearchService researchService;
    private final ResearchSseOrchestrator sseOrchestrator;
    private final boolean exposeDetailedErrors;

    public AccountResearchController(AccountResearchService researchService,
                                     @Value("${app.environment.mode:production}") String environmentMode) {
        this.researchService = researchService;
        this.sseOrchestrator = new ResearchSseOrchestrator();
        this.exposeDetailedErrors = !PRODUCTION_ENVIRONMENT_MODE.equals(
            ErrorResponseUtils.normalizeEnvironmentMode(environmentMode));
    }

    @PostMapping(path = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter streamResearch(@RequestBody(required = false) AccountResearchRequest request,
                                     HttpServletResponse response) {
        response.setHeader("X-Accel-Buffering", "no");
        response.setHeader("Cache-Control", "no-cache, no-transform");

        SseEmitter emitter = new SseEmitter(SSE_TIMEOUT_MILLIS);

        Flux<AnalysisFrame> frames;
        try {
            frames = researchService.stream(request);
        } catch (InvalidResearchRequestException invalid) {
            sseOrchestrator.emitTerminalError(emitter, ResearchErrorCode.INVALID_REQUEST, invalid.getMessage());
            return emitter;
        }

        String companyName = request.companyName().trim();
        AtomicBoolean streamClosed = new AtomicBoolean(false);
        AtomicBoolean messageStarted = new AtomicBoolean(false);
        AtomicReference<Disposable> subscription = new AtomicReference<>();
        StringBuilder message = new StringBuilder();

        Runnable cancelUpstream = () -> {
            if (streamClosed.compareAndSet(false, true)) {
                Disposable active = subscription.get();
                if (active != null) {
                    active.dispose();
                }
            }
        };
        sseOrchestrator.wireEmitterLifecycle(emitter, companyName, cancelUpstream);

        subscription.set(frames.subscribe(
            frame -> relayFrame(emitter, frame, messageStarted, message),
            error -> {
                if (streamClosed.compareAndSet(false, true)) {
                    ResearchErrorCode code = resolveErrorCode(error);
                    log.warn("Research stream for company={} ended with {}", companyName, code.wireValue());
                    sseOrchestrator.emitTerminalError(emitter, code, resolveClientMessage(code, error.getMessage()));
                }
            },
            () -> {
                if (streamClosed.compareAndSet(false, true)) {
                    try {
                        sendMessageStartEvent(emitter, messageStarted);
                        sseOrchestrator.sendEvent(emitter, "done", new DonePayload(message.toString()));
                    } catch (IllegalStateException doneDeliveryException) {
                        log.warn("Research done event delivery failed for company={}", companyName, doneDeliveryException);
                    } finally {
                        sseOrchestrator.safelyComplete(emitter);
                    }
                }
            }
        ));
        if (streamClosed.get()) {
            subscription.get().dispose();
        }
        return emitter;
    }

    private void relayFrame(SseEmitter emitter, AnalysisFrame frame, AtomicBoolean messageStarted, StringBuilder message) {
        switch (frame.kind()) {
            case DELTA -> {
                sendMessageStartEvent(emitter, messageStarted);
                message.append(frame.payload());
                sseOrchestrator.sendEvent(emitter, "message_delta", new MessageDeltaPayload(frame.payload()));
            }
            case COMMENT -> sseOrchestrator.sendComment(emitter, frame.payload());
            case DONE -> {
                // completion is signalled by the flux itself
            }
        }
    }

    private void sendMessageStartEvent(SseEmitter emitter, AtomicBoolean messageStarted) {
        if (messageStarted.compareAndSet(false, true)) {
            sseOrchestrator.sendEvent(emitter, "message_start",
                new MessageStartPayload(UUID.randomUUID().toString(), researchService.model()));
        }
    }

    private ResearchErrorCode resolveErrorCode(Throwable error) {
        if (error instanceof InsightGenerationException generationFailure) {
            return switch (generationFailure.errorCode()) {
                case UPSTREAM_RATE_LIMITED -> ResearchErrorCode.RATE_LIMITED;
                case UPSTREAM_QUOTA_EXCEEDED -> ResearchErrorCode.QUOTA_EXCEEDED;
                case UPSTREAM_TIMEOUT -> ResearchErrorCode.STREAM_TIMEOUT;
                case DECODE_ERROR -> ResearchErrorCode.DECODE_FAILED;
                case AI_NOT_CONFIGURED -> ResearchErrorCode.SERVICE_UNAVAILABLE;
                default -> ResearchErrorCode.RESEARCH_FAILED;
            };
        }
        return ResearchErrorCode.RESEARCH_FAILED;
    }

    private String resolveClientMessage(ResearchErrorCode code, String message) {
        if (exposeDetailedErrors && message != null && !message.isBlank()) {
            return message;
        }
        return code.defaultMessage();
    }
}
