package net.salescoach.application.ai;

import net.salescoach.application.ai.InsightGenerationException.ErrorCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;

/**
 * Pulls the single tool invocation out of a non-streamed chat completion and decodes its
 * arguments.
 *
 * <p>Every failure is final: a missing or foreign tool call means the model ignored the
 * output contract, and an unparseable argument string cannot improve without more input.</p>
 */
@Component
public class ToolPayloadExtractor {

    private static final Logger log = LoggerFactory.getLogger(ToolPayloadExtractor.class);

    private final ObjectMapper objectMapper;

    public ToolPayloadExtractor(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Extracts and parses the arguments of the first tool call.
     *
     * @param completion parsed completion document
     * @param expectedFunction function name the call must carry
     * @return arguments as a JSON object
     * @throws InsightGenerationException {@code TOOL_CALL_MISSING}, {@code TOOL_CALL_MISMATCH}
     *         or {@code TOOL_PAYLOAD_INVALID}
     */
    public JsonNode extract(JsonNode completion, String expectedFunction) {
        JsonNode toolCall = completion == null
            ? null
            : completion.path("choices").path(0).path("message").path("tool_calls").path(0);
        if (toolCall == null || !toolCall.isObject()) {
            throw new InsightGenerationException(ErrorCode.TOOL_CALL_MISSING,
                "AI response did not contain a tool call for " + expectedFunction);
        }
        JsonNode function = toolCall.path("function");
        String functionName = function.path("name").asString(null);
        if (functionName == null || !functionName.equals(expectedFunction)) {
            throw new InsightGenerationException(ErrorCode.TOOL_CALL_MISMATCH,
                "AI response called tool '%s', expected '%s'".formatted(functionName, expectedFunction));
        }
        JsonNode arguments = decodeArguments(function.path("arguments"), expectedFunction);
        if (!arguments.isObject()) {
            throw new InsightGenerationException(ErrorCode.TOOL_PAYLOAD_INVALID,
                "Tool arguments for " + expectedFunction + " were not a JSON object");
        }
        return arguments;
    }

    private JsonNode decodeArguments(JsonNode rawArguments, String expectedFunction) {
        if (rawArguments.isObject()) {
            // Some gateways return arguments already decoded
            return rawArguments;
        }
        if (!rawArguments.isString() || rawArguments.asString().isBlank()) {
            throw new InsightGenerationException(ErrorCode.TOOL_PAYLOAD_INVALID,
                "Tool call for " + expectedFunction + " carried no arguments");
        }
        try {
            return objectMapper.readTree(rawArguments.asString());
        } catch (JacksonException parseFailure) {
            log.warn("Tool arguments for {} failed to parse: {}", expectedFunction, parseFailure.getOriginalMessage());
            throw new InsightGenerationException(ErrorCode.TOOL_PAYLOAD_INVALID,
                "Tool arguments for " + expectedFunction + " were not valid JSON", parseFailure);
        }
    }
}
