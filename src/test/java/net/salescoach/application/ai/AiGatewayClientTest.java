package net.salescoach.application.ai;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import net.salescoach.application.ai.InsightGenerationException.ErrorCode;
import net.salescoach.support.stream.AnalysisFrame;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.test.StepVerifier;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;

class AiGatewayClientTest {

    private static final ToolDefinition TOOL = new ToolDefinition(
        "submit_account_insights", "Submit insights", new ObjectMapper().createObjectNode().put("type", "object"));

    private MockWebServer server;
    private ObjectMapper objectMapper;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        objectMapper = new ObjectMapper();
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    private AiGatewayClient client(String apiKey, RateLimiter rateLimiter, long timeoutSeconds) {
        return new AiGatewayClient(
            WebClient.builder(),
            objectMapper,
            new ToolPayloadExtractor(objectMapper),
            rateLimiter,
            server.url("/v1/").toString(),
            apiKey,
            timeoutSeconds
        );
    }

    private AiGatewayClient client() {
        return client("test-key", RateLimiter.ofDefaults("test-gateway"), 5);
    }

    @Test
    void isAvailable_ReturnsFalse_WhenApiKeyMissing() {
        AiGatewayClient disabled = client("", RateLimiter.ofDefaults("test-gateway"), 5);

        assertThat(disabled.isAvailable()).isFalse();
        assertThatThrownBy(() -> disabled.invokeTool("model", "sys", "user", TOOL))
            .isInstanceOfSatisfying(InsightGenerationException.class,
                ex -> assertThat(ex.errorCode()).isEqualTo(ErrorCode.AI_NOT_CONFIGURED));
        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    void invokeTool_SendsForcedToolChoice_AndReturnsArguments() throws InterruptedException {
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "application/json")
            .setBody("""
                {"choices":[{"message":{"tool_calls":[{"function":{"name":"submit_account_insights",
                "arguments":"{\\"business_context\\":\\"Grows fast\\"}"}}]}}]}
                """));

        JsonNode arguments = client().invokeTool("google/gemini-2.5-flash", "system", "user", TOOL);

        assertThat(arguments.path("business_context").asString()).isEqualTo("Grows fast");
        RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(request).isNotNull();
        assertThat(request.getPath()).isEqualTo("/v1/chat/completions");
        assertThat(request.getHeader("Authorization")).isEqualTo("Bearer test-key");
        JsonNode sent = objectMapper.readTree(request.getBody().readUtf8());
        assertThat(sent.path("model").asString()).isEqualTo("google/gemini-2.5-flash");
        assertThat(sent.path("messages").size()).isEqualTo(2);
        assertThat(sent.path("tool_choice").path("function").path("name").asString())
            .isEqualTo("submit_account_insights");
        assertThat(sent.path("stream").isMissingNode()).isTrue();
    }

    @Test
    void invokeTool_MapsStatus429_ToRateLimited() {
        server.enqueue(new MockResponse().setResponseCode(429).setBody("{\"error\":\"slow down\"}"));

        assertThatThrownBy(() -> client().invokeTool("model", "sys", "user", TOOL))
            .isInstanceOfSatisfying(InsightGenerationException.class, ex -> {
                assertThat(ex.errorCode()).isEqualTo(ErrorCode.UPSTREAM_RATE_LIMITED);
                assertThat(ex.upstreamStatus()).isEqualTo(429);
                assertThat(ex.upstreamBody()).contains("slow down");
            });
    }

    @Test
    void invokeTool_MapsStatus402_ToQuotaExceeded() {
        server.enqueue(new MockResponse().setResponseCode(402).setBody("payment required"));

        assertThatThrownBy(() -> client().invokeTool("model", "sys", "user", TOOL))
            .isInstanceOfSatisfying(InsightGenerationException.class,
                ex -> assertThat(ex.errorCode()).isEqualTo(ErrorCode.UPSTREAM_QUOTA_EXCEEDED));
    }

    @Test
    void invokeTool_MapsServerError_ToUpstreamFailure() {
        server.enqueue(new MockResponse().setResponseCode(500).setBody("boom"));

        assertThatThrownBy(() -> client().invokeTool("model", "sys", "user", TOOL))
            .isInstanceOfSatisfying(InsightGenerationException.class, ex -> {
                assertThat(ex.errorCode()).isEqualTo(ErrorCode.UPSTREAM_FAILURE);
                assertThat(ex.getMessage()).contains("HTTP 500");
            });
    }

    @Test
    void invokeTool_MapsNonJsonBody_ToDecodeError() {
        server.enqueue(new MockResponse().setHeader("Content-Type", "application/json").setBody("<html>oops</html>"));

        assertThatThrownBy(() -> client().invokeTool("model", "sys", "user", TOOL))
            .isInstanceOfSatisfying(InsightGenerationException.class,
                ex -> assertThat(ex.errorCode()).isEqualTo(ErrorCode.DECODE_ERROR));
    }

    @Test
    void invokeTool_TimesOut_WhenGatewayIsSlow() {
        server.enqueue(new MockResponse().setHeadersDelay(3, TimeUnit.SECONDS).setBody("{}"));

        assertThatThrownBy(() -> client("test-key", RateLimiter.ofDefaults("test-gateway"), 1)
                .invokeTool("model", "sys", "user", TOOL))
            .isInstanceOfSatisfying(InsightGenerationException.class,
                ex -> assertThat(ex.errorCode()).isEqualTo(ErrorCode.UPSTREAM_TIMEOUT));
    }

    @Test
    void invokeTool_RejectsLocally_WhenOutboundBudgetExhausted() {
        RateLimiter tight = RateLimiter.of("tight", RateLimiterConfig.custom()
            .limitForPeriod(1)
            .limitRefreshPeriod(Duration.ofMinutes(1))
            .timeoutDuration(Duration.ZERO)
            .build());
        AiGatewayClient throttled = client("test-key", tight, 5);
        server.enqueue(new MockResponse().setResponseCode(500));
        assertThatThrownBy(() -> throttled.invokeTool("model", "sys", "user", TOOL))
            .isInstanceOf(InsightGenerationException.class);

        assertThatThrownBy(() -> throttled.invokeTool("model", "sys", "user", TOOL))
            .isInstanceOfSatisfying(InsightGenerationException.class,
                ex -> assertThat(ex.errorCode()).isEqualTo(ErrorCode.UPSTREAM_RATE_LIMITED));
        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    void streamCompletion_EmitsDeltasThenDone() throws InterruptedException {
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "text/event-stream")
            .setBody("""
                : OPENROUTER PROCESSING

                data: {"choices":[{"delta":{"content":"## Company"}}]}

                data: {"choices":[{"delta":{"content":" Overview"}}]}

                data: [DONE]

                """));

        StepVerifier.create(client().streamCompletion("google/gemini-2.5-pro", "sys", "user"))
            .expectNext(AnalysisFrame.comment("OPENROUTER PROCESSING"))
            .expectNext(AnalysisFrame.delta("## Company"))
            .expectNext(AnalysisFrame.delta(" Overview"))
            .expectNext(AnalysisFrame.done())
            .verifyComplete();

        RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(request).isNotNull();
        assertThat(objectMapper.readTree(request.getBody().readUtf8()).path("stream").asBoolean()).isTrue();
    }

    @Test
    void streamCompletion_FailsBeforeAnyFrame_OnUpstreamStatus() {
        server.enqueue(new MockResponse().setResponseCode(402).setBody("no credits"));

        StepVerifier.create(client().streamCompletion("model", "sys", "user"))
            .expectErrorSatisfies(error -> assertThat(error)
                .isInstanceOfSatisfying(InsightGenerationException.class,
                    ex -> assertThat(ex.errorCode()).isEqualTo(ErrorCode.UPSTREAM_QUOTA_EXCEEDED)))
            .verify(Duration.ofSeconds(5));
    }

    @Test
    void streamCompletion_FailsWithTimeout_WhenDeadlinePasses() {
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "text/event-stream")
            .setBody("data: {\"choices\":[{\"delta\":{\"content\":\"slow\"}}]}\n\n")
            .setBodyDelay(3, TimeUnit.SECONDS));

        StepVerifier.create(client("test-key", RateLimiter.ofDefaults("test-gateway"), 1)
                .streamCompletion("model", "sys", "user"))
            .expectErrorSatisfies(error -> assertThat(error)
                .isInstanceOfSatisfying(InsightGenerationException.class,
                    ex -> assertThat(ex.errorCode()).isEqualTo(ErrorCode.UPSTREAM_TIMEOUT)))
            .verify(Duration.ofSeconds(5));
    }
}
