package net.salescoach.application.ai;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import net.salescoach.application.ai.InsightGenerationException.ErrorCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;

class ToolPayloadExtractorTest {

    private ObjectMapper objectMapper;
    private ToolPayloadExtractor extractor;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper();
        extractor = new ToolPayloadExtractor(objectMapper);
    }

    private JsonNode completionWithToolCall(String name, String argumentsJsonLiteral) {
        return objectMapper.readTree("""
            {"choices":[{"message":{"tool_calls":[{"type":"function","function":{"name":"%s","arguments":%s}}]}}]}
            """.formatted(name, argumentsJsonLiteral));
    }

    @Test
    void extract_ParsesStringArguments() {
        JsonNode completion = completionWithToolCall("submit_account_insights",
            "\"{\\\"business_context\\\":\\\"Regional logistics firm\\\"}\"");

        JsonNode arguments = extractor.extract(completion, "submit_account_insights");

        assertThat(arguments.path("business_context").asString()).isEqualTo("Regional logistics firm");
    }

    @Test
    void extract_AcceptsAlreadyDecodedArguments() {
        JsonNode completion = completionWithToolCall("submit_account_insights", "{\"business_context\":\"x\"}");

        assertThat(extractor.extract(completion, "submit_account_insights").path("business_context").asString())
            .isEqualTo("x");
    }

    @Test
    void extract_Throws_WhenNoToolCall() {
        JsonNode completion = objectMapper.readTree("{\"choices\":[{\"message\":{\"content\":\"plain text\"}}]}");

        assertThatThrownBy(() -> extractor.extract(completion, "submit_account_insights"))
            .isInstanceOfSatisfying(InsightGenerationException.class,
                ex -> assertThat(ex.errorCode()).isEqualTo(ErrorCode.TOOL_CALL_MISSING));
    }

    @Test
    void extract_Throws_WhenModelCalledAnotherTool() {
        JsonNode completion = completionWithToolCall("something_else", "\"{}\"");

        assertThatThrownBy(() -> extractor.extract(completion, "submit_account_insights"))
            .isInstanceOfSatisfying(InsightGenerationException.class,
                ex -> assertThat(ex.errorCode()).isEqualTo(ErrorCode.TOOL_CALL_MISMATCH));
    }

    @Test
    void extract_Throws_WhenArgumentsAreNotJson() {
        JsonNode completion = completionWithToolCall("submit_account_insights", "\"{not json\"");

        assertThatThrownBy(() -> extractor.extract(completion, "submit_account_insights"))
            .isInstanceOfSatisfying(InsightGenerationException.class,
                ex -> assertThat(ex.errorCode()).isEqualTo(ErrorCode.TOOL_PAYLOAD_INVALID));
    }

    @Test
    void extract_Throws_WhenArgumentsAreNotAnObject() {
        JsonNode completion = completionWithToolCall("submit_account_insights", "\"[1,2]\"");

        assertThatThrownBy(() -> extractor.extract(completion, "submit_account_insights"))
            .isInstanceOfSatisfying(InsightGenerationException.class,
                ex -> assertThat(ex.errorCode()).isEqualTo(ErrorCode.TOOL_PAYLOAD_INVALID));
    }
}
