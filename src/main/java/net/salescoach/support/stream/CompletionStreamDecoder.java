package net.salescoach.support.stream;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;

/**
 * Incremental decoder for OpenAI-compatible {@code text/event-stream} chat completions.
 *
 * <p>One instance decodes exactly one stream and is not thread-safe; chunks must be fed in
 * arrival order. Lifecycle is {@code IDLE -> READING -> (DONE | FAILED)}; once terminal,
 * further chunks are ignored.</p>
 *
 * <p>A {@code data:} line whose JSON does not parse is put back at the front of the buffer,
 * newline restored, and decoding waits for the next chunk. Only {@link #finish()} gives up
 * on such lines.</p>
 */
public class CompletionStreamDecoder {

    private static final Logger log = LoggerFactory.getLogger(CompletionStreamDecoder.class);

    static final String DATA_PREFIX = "data:";
    static final String COMMENT_PREFIX = ":";
    static final String TERMINATOR = "[DONE]";

    public enum State {
        IDLE,
        READING,
        DONE,
        FAILED
    }

    private final ObjectMapper objectMapper;
    private final CharsetDecoder utf8Decoder = StandardCharsets.UTF_8.newDecoder()
        .onMalformedInput(CodingErrorAction.REPLACE)
        .onUnmappableCharacter(CodingErrorAction.REPLACE);
    private final StringBuilder textBuffer = new StringBuilder();
    private ByteBuffer pendingBytes = ByteBuffer.allocate(0);
    private State state = State.IDLE;

    public CompletionStreamDecoder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public State state() {
        return state;
    }

    /**
     * Decodes one network chunk and returns the frames completed by it.
     *
     * @param chunk raw bytes; may end inside a UTF-8 sequence or inside a line
     * @return frames in stream order; a {@code DONE} frame is always last
     */
    public List<AnalysisFrame> feed(byte[] chunk) {
        if (isTerminal()) {
            return List.of();
        }
        state = State.READING;
        if (chunk == null || chunk.length == 0) {
            return List.of();
        }
        appendDecoded(chunk, false);
        return drainCompleteLines(false);
    }

    /**
     * Flushes the buffer once the source completes without a terminator.
     *
     * <p>Remaining lines are parsed best-effort; content that still fails to parse is
     * discarded. Always ends with a {@code DONE} frame unless the decoder is already terminal.</p>
     */
    public List<AnalysisFrame> finish() {
        if (isTerminal()) {
            return List.of();
        }
        appendDecoded(new byte[0], true);
        if (textBuffer.length() > 0 && textBuffer.charAt(textBuffer.length() - 1) != '\n') {
            textBuffer.append('\n');
        }
        List<AnalysisFrame> frames = new ArrayList<>(drainCompleteLines(true));
        if (state != State.DONE) {
            state = State.DONE;
            textBuffer.setLength(0);
            frames.add(AnalysisFrame.done());
        }
        return frames;
    }

    /**
     * Marks the stream failed after a read error; the buffer is discarded.
     */
    public void fail() {
        state = State.FAILED;
        textBuffer.setLength(0);
        pendingBytes = ByteBuffer.allocate(0);
    }

    private boolean isTerminal() {
        return state == State.DONE || state == State.FAILED;
    }

    private void appendDecoded(byte[] chunk, boolean endOfInput) {
        ByteBuffer input = ByteBuffer.allocate(pendingBytes.remaining() + chunk.length);
        input.put(pendingBytes).put(chunk).flip();
        CharBuffer output = CharBuffer.allocate(input.remaining() + 2);
        utf8Decoder.decode(input, output, endOfInput);
        if (endOfInput) {
            utf8Decoder.flush(output);
        }
        output.flip();
        textBuffer.append(output);
        // Incomplete trailing multi-byte sequence waits for the next chunk
        pendingBytes = input.slice();
    }

    private List<AnalysisFrame> drainCompleteLines(boolean finalFlush) {
        List<AnalysisFrame> frames = new ArrayList<>();
        int newlineIndex;
        while ((newlineIndex = textBuffer.indexOf("\n")) >= 0) {
            String line = textBuffer.substring(0, newlineIndex);
            textBuffer.delete(0, newlineIndex + 1);
            if (line.endsWith("\r")) {
                line = line.substring(0, line.length() - 1);
            }
            if (line.isBlank()) {
                continue;
            }
            if (line.startsWith(COMMENT_PREFIX)) {
                frames.add(AnalysisFrame.comment(line.substring(COMMENT_PREFIX.length()).trim()));
                continue;
            }
            if (!line.startsWith(DATA_PREFIX)) {
                continue;
            }
            String payload = line.substring(DATA_PREFIX.length()).trim();
            if (payload.isEmpty()) {
                continue;
            }
            if (TERMINATOR.equals(payload)) {
                state = State.DONE;
                textBuffer.setLength(0);
                frames.add(AnalysisFrame.done());
                return frames;
            }
            try {
                JsonNode event = objectMapper.readTree(payload);
                extractDelta(event).ifPresent(delta -> frames.add(AnalysisFrame.delta(delta)));
            } catch (JacksonException parseFailure) {
                if (finalFlush) {
                    log.debug("Discarding unparseable trailing stream line ({} chars): {}",
                        payload.length(), parseFailure.getOriginalMessage());
                    continue;
                }
                textBuffer.insert(0, line + "\n");
                break;
            }
        }
        return frames;
    }

    private Optional<String> extractDelta(JsonNode event) {
        JsonNode content = event.path("choices").path(0).path("delta").path("content");
        if (!content.isString()) {
            return Optional.empty();
        }
        String text = content.asString();
        return text.isEmpty() ? Optional.empty() : Optional.of(text);
    }
}
