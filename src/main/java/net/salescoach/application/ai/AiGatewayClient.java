package net.salescoach.application.ai;

import io.github.resilience4j.ratelimiter.RateLimiter;
import java.time.Duration;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import net.salescoach.application.ai.InsightGenerationException.ErrorCode;
import net.salescoach.support.stream.AnalysisFrame;
import net.salescoach.support.stream.CompletionFrameStream;
import net.salescoach.support.stream.StreamDecodeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.node.ArrayNode;
import tools.jackson.databind.node.ObjectNode;

/**
 * Client for the OpenAI-compatible chat completions gateway.
 *
 * <p>Two call shapes are supported: a forced tool call answered as one JSON document, and a
 * free-text completion streamed as server-sent events. Both check the HTTP status before any
 * body decoding, and both are bounded by a hard wall-clock timeout covering the whole round
 * trip rather than the gap between chunks.</p>
 */
@Service
public class AiGatewayClient {

    private static final Logger log = LoggerFactory.getLogger(AiGatewayClient.class);

    private static final String COMPLETIONS_PATH = "/chat/completions";
    private static final int MAX_LOGGED_BODY_CHARS = 2_000;

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final ToolPayloadExtractor toolPayloadExtractor;
    private final RateLimiter gatewayRateLimiter;
    private final boolean available;
    private final Duration timeout;

    /**
     * Creates the client against the configured gateway base URL.
     */
    public AiGatewayClient(WebClient.Builder webClientBuilder,
                           ObjectMapper objectMapper,
                           ToolPayloadExtractor toolPayloadExtractor,
                           @Qualifier("aiGatewayRateLimiter") RateLimiter gatewayRateLimiter,
                           @Value("${app.ai.gateway.base-url:https://ai.gateway.lovable.dev/v1}") String baseUrl,
                           @Value("${app.ai.gateway.api-key:}") String apiKey,
                           @Value("${app.ai.gateway.timeout-seconds:60}") long timeoutSeconds) {
        this.objectMapper = objectMapper;
        this.toolPayloadExtractor = toolPayloadExtractor;
        this.gatewayRateLimiter = gatewayRateLimiter;
        this.timeout = Duration.ofSeconds(Math.max(1L, timeoutSeconds));
        this.available = StringUtils.hasText(apiKey);
        String resolvedBaseUrl = normalizeBaseUrl(baseUrl);
        WebClient.Builder builder = webClientBuilder.clone()
            .baseUrl(resolvedBaseUrl)
            .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
        if (available) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey.trim());
            log.info("AI gateway client configured (baseUrl={}, timeout={}s)", resolvedBaseUrl, this.timeout.toSeconds());
        } else {
            log.warn("AI gateway client is disabled: no API key configured");
        }
        this.webClient = builder.build();
    }

    public boolean isAvailable() {
        return available;
    }

    /**
     * Sends a completion that must be answered with a call to {@code tool}, and returns the
     * decoded tool arguments.
     *
     * @throws InsightGenerationException on gateway, timeout, or tool-contract failure
     */
    public JsonNode invokeTool(String model, String systemPrompt, String userPrompt, ToolDefinition tool) {
        ensureAvailable();
        acquirePermit();
        String requestBody = serialize(toolRequest(model, systemPrompt, userPrompt, tool));

        String responseBody;
        try {
            responseBody = webClient.post()
                .uri(COMPLETIONS_PATH)
                .accept(MediaType.APPLICATION_JSON)
                .bodyValue(requestBody)
                .exchangeToMono(response -> response.statusCode().is2xxSuccessful()
                    ? response.bodyToMono(String.class).defaultIfEmpty("")
                    : upstreamError(response).flatMap(error -> Mono.<String>error(error)))
                .timeout(timeout)
                .block();
        } catch (InsightGenerationException upstreamFailure) {
            throw upstreamFailure;
        } catch (RuntimeException transportFailure) {
            throw translateTransportFailure(transportFailure, tool.name());
        }

        JsonNode completion;
        try {
            completion = objectMapper.readTree(responseBody == null ? "" : responseBody);
        } catch (JacksonException parseFailure) {
            throw new InsightGenerationException(ErrorCode.DECODE_ERROR,
                "AI gateway response for " + tool.name() + " was not valid JSON", parseFailure);
        }
        return toolPayloadExtractor.extract(completion, tool.name());
    }

    /**
     * Streams a free-text completion as decoded frames.
     *
     * <p>Gateway status errors surface as {@link InsightGenerationException} before any frame
     * is emitted. Cancelling the returned flux closes the upstream connection.</p>
     */
    public Flux<AnalysisFrame> streamCompletion(String model, String systemPrompt, String userPrompt) {
        return Flux.defer(() -> {
            ensureAvailable();
            acquirePermit();
            String requestBody = serialize(streamRequest(model, systemPrompt, userPrompt));
            AtomicBoolean deadlineReached = new AtomicBoolean(false);
            Mono<Long> deadline = Mono.delay(timeout).doOnNext(tick -> deadlineReached.set(true));
            return webClient.post()
                .uri(COMPLETIONS_PATH)
                .accept(MediaType.TEXT_EVENT_STREAM)
                .bodyValue(requestBody)
                .exchangeToFlux(response -> response.statusCode().is2xxSuccessful()
                    ? CompletionFrameStream.decode(response.bodyToFlux(DataBuffer.class), objectMapper)
                    : upstreamError(response).flatMapMany(error -> Flux.<AnalysisFrame>error(error)))
                .takeUntilOther(deadline)
                .concatWith(Mono.defer(() -> deadlineReached.get()
                    ? Mono.<AnalysisFrame>error(new TimeoutException("stream deadline reached"))
                    : Mono.<AnalysisFrame>empty()));
        }).onErrorMap(error -> !(error instanceof InsightGenerationException),
            error -> translateTransportFailure(error, "stream"));
    }

    private Mono<InsightGenerationException> upstreamError(ClientResponse response) {
        int status = response.statusCode().value();
        return response.bodyToMono(String.class)
            .defaultIfEmpty("")
            .map(body -> {
                log.error("AI gateway error: status={} body={}", status, abbreviate(body));
                return InsightGenerationException.fromUpstreamStatus(status, body);
            });
    }

    private InsightGenerationException translateTransportFailure(Throwable failure, String operation) {
        Throwable root = failure;
        if (root.getCause() != null && !(root instanceof TimeoutException) && !(root instanceof StreamDecodeException)) {
            Throwable cause = root.getCause();
            if (cause instanceof TimeoutException || cause instanceof InsightGenerationException) {
                root = cause;
            }
        }
        if (root instanceof InsightGenerationException insightFailure) {
            return insightFailure;
        }
        if (root instanceof TimeoutException) {
            log.error("AI gateway {} exceeded {}s", operation, timeout.toSeconds());
            return new InsightGenerationException(ErrorCode.UPSTREAM_TIMEOUT,
                "AI gateway did not answer within " + timeout.toSeconds() + "s", failure);
        }
        if (root instanceof StreamDecodeException) {
            log.error("AI gateway {} stream could not be decoded", operation, failure);
            return new InsightGenerationException(ErrorCode.DECODE_ERROR, failure.getMessage(), failure);
        }
        log.error("AI gateway {} failed", operation, failure);
        return new InsightGenerationException(ErrorCode.UPSTREAM_FAILURE,
            "AI gateway request failed: " + failure.getMessage(), failure);
    }

    private ObjectNode toolRequest(String model, String systemPrompt, String userPrompt, ToolDefinition tool) {
        ObjectNode request = baseRequest(model, systemPrompt, userPrompt);
        ObjectNode toolNode = request.putArray("tools").addObject();
        toolNode.put("type", "function");
        ObjectNode function = toolNode.putObject("function");
        function.put("name", tool.name());
        function.put("description", tool.description());
        function.set("parameters", tool.parameters());
        ObjectNode toolChoice = request.putObject("tool_choice");
        toolChoice.put("type", "function");
        toolChoice.putObject("function").put("name", tool.name());
        return request;
    }

    private ObjectNode streamRequest(String model, String systemPrompt, String userPrompt) {
        ObjectNode request = baseRequest(model, systemPrompt, userPrompt);
        request.put("stream", true);
        return request;
    }

    private ObjectNode baseRequest(String model, String systemPrompt, String userPrompt) {
        ObjectNode request = objectMapper.createObjectNode();
        request.put("model", model);
        ArrayNode messages = request.putArray("messages");
        messages.addObject().put("role", "system").put("content", systemPrompt);
        messages.addObject().put("role", "user").put("content", userPrompt);
        return request;
    }

    private String serialize(ObjectNode request) {
        try {
            return objectMapper.writeValueAsString(request);
        } catch (JacksonException serializationFailure) {
            throw new IllegalStateException("Failed to serialize AI gateway request", serializationFailure);
        }
    }

    private void ensureAvailable() {
        if (!available) {
            throw new InsightGenerationException(ErrorCode.AI_NOT_CONFIGURED, "AI gateway is not configured");
        }
    }

    private void acquirePermit() {
        if (!gatewayRateLimiter.acquirePermission()) {
            log.warn("Outbound AI gateway throttle denied a request (limiter={})", gatewayRateLimiter.getName());
            throw new InsightGenerationException(ErrorCode.UPSTREAM_RATE_LIMITED,
                "Outbound AI request budget exhausted; try again shortly");
        }
    }

    private static String normalizeBaseUrl(String baseUrl) {
        String candidate = StringUtils.hasText(baseUrl) ? baseUrl.trim() : "https://ai.gateway.lovable.dev/v1";
        while (candidate.endsWith("/")) {
            candidate = candidate.substring(0, candidate.length() - 1);
        }
        return candidate;
    }

    private static String abbreviate(String body) {
        if (body == null || body.length() <= MAX_LOGGED_BODY_CHARS) {
            return body;
        }
        return body.substring(0, MAX_LOGGED_BODY_CHARS) + "...";
    }
}
