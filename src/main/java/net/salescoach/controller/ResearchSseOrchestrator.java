package net.salescoach.controller;

import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * SSE transport operations for research streams: serialized sends, terminal errors and
 * emitter lifecycle wiring.
 */
class ResearchSseOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ResearchSseOrchestrator.class);

    /**
     * Wires completion, timeout, and error callbacks onto the SSE emitter.
     *
     * @param cancelUpstream releases the upstream subscription; must be idempotent
     */
    void wireEmitterLifecycle(SseEmitter emitter, String companyName, Runnable cancelUpstream) {
        emitter.onCompletion(cancelUpstream);
        emitter.onTimeout(() -> {
            cancelUpstream.run();
            emitTerminalError(emitter, ResearchErrorCode.STREAM_TIMEOUT, ResearchErrorCode.STREAM_TIMEOUT.defaultMessage());
        });
        emitter.onError(error -> {
            log.warn("Research stream failed for company={}", companyName, error);
            cancelUpstream.run();
        });
    }

    /**
     * Sends a named SSE event payload with emitter-level synchronization.
     */
    void sendEvent(SseEmitter emitter, String eventName, ResearchSsePayload payload) {
        synchronized (emitter) {
            try {
                emitter.send(SseEmitter.event().name(eventName).data(payload));
            } catch (IOException ioException) {
                throw new IllegalStateException("SSE send failed for event: " + eventName, ioException);
            }
        }
    }

    /**
     * Relays an upstream keepalive comment.
     */
    void sendComment(SseEmitter emitter, String comment) {
        synchronized (emitter) {
            try {
                emitter.send(SseEmitter.event().comment(comment));
            } catch (IOException ioException) {
                throw new IllegalStateException("SSE comment send failed", ioException);
            }
        }
    }

    /**
     * Emits a terminal error event and completes the emitter.
     */
    void emitTerminalError(SseEmitter emitter, ResearchErrorCode code, String safeMessage) {
        try {
            sendEvent(emitter, "error", new ErrorPayload(safeMessage, code.wireValue(), code.retryable()));
        } catch (IllegalStateException errorEventException) {
            log.warn("Research error event delivery failed", errorEventException);
        } finally {
            safelyComplete(emitter);
        }
    }

    /**
     * Completes the emitter, absorbing the expected race when the response is already committed.
     */
    void safelyComplete(SseEmitter emitter) {
        try {
            emitter.complete();
        } catch (IllegalStateException completionException) {
            log.warn("SSE emitter completion failed (response likely already committed): {}", completionException.getMessage());
        }
    }
}
