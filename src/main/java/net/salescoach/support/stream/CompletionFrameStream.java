package net.salescoach.support.stream;

import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import reactor.core.publisher.Flux;
import tools.jackson.databind.ObjectMapper;

/**
 * Reactive adapter that runs a {@link CompletionStreamDecoder} over a response body.
 *
 * <p>The returned flux completes right after the {@code DONE} frame and cancels the body
 * subscription at that point, which releases the underlying connection. Cancelling the
 * returned flux does the same.</p>
 */
public final class CompletionFrameStream {

    private CompletionFrameStream() {
    }

    public static Flux<AnalysisFrame> decode(Flux<DataBuffer> body, ObjectMapper objectMapper) {
        return Flux.defer(() -> {
            CompletionStreamDecoder decoder = new CompletionStreamDecoder(objectMapper);
            return body
                .concatMapIterable(buffer -> decoder.feed(drain(buffer)))
                .concatWith(Flux.defer(() -> Flux.fromIterable(decoder.finish())))
                .takeUntil(AnalysisFrame::isDone)
                .onErrorMap(error -> !(error instanceof StreamDecodeException), error -> {
                    decoder.fail();
                    return new StreamDecodeException("Completion stream read failed: " + error.getMessage(), error);
                });
        });
    }

    private static byte[] drain(DataBuffer buffer) {
        try {
            byte[] bytes = new byte[buffer.readableByteCount()];
            buffer.read(bytes);
            return bytes;
        } finally {
            DataBufferUtils.release(buffer);
        }
    }
}
