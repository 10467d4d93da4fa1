package net.salescoach.application.ai;

import jakarta.annotation.Nullable;
import java.util.Locale;
import java.util.Objects;

/**
 * Thrown when account insight generation or account research fails.
 *
 * <p>Carries a typed {@link ErrorCode} so controllers can tell "account does not exist"
 * from "tried and failed" without inspecting messages. Upstream status and body are kept
 * for logs only and are never returned to clients.</p>
 */
public class InsightGenerationException extends RuntimeException {

    /**
     * Canonical failure categories emitted by the insight pipeline.
     */
    public enum ErrorCode {
        DECODE_ERROR(true),
        TOOL_CALL_MISSING(true),
        TOOL_CALL_MISMATCH(true),
        TOOL_PAYLOAD_INVALID(true),
        UPSTREAM_RATE_LIMITED(true),
        UPSTREAM_QUOTA_EXCEEDED(true),
        UPSTREAM_FAILURE(true),
        UPSTREAM_TIMEOUT(true),
        AI_NOT_CONFIGURED(false),
        ACCOUNT_NOT_FOUND(false),
        PERSISTENCE_FAILED(true);

        private final boolean retryable;

        ErrorCode(boolean retryable) {
            this.retryable = retryable;
        }

        public boolean retryable() {
            return retryable;
        }

        public String wireValue() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    private final ErrorCode errorCode;
    private final Integer upstreamStatus;
    private final String upstreamBody;

    public InsightGenerationException(ErrorCode errorCode, String message) {
        this(errorCode, message, null, null, null);
    }

    public InsightGenerationException(ErrorCode errorCode, String message, Throwable cause) {
        this(errorCode, message, null, null, cause);
    }

    public InsightGenerationException(ErrorCode errorCode, String message,
                                      @Nullable Integer upstreamStatus, @Nullable String upstreamBody,
                                      @Nullable Throwable cause) {
        super(message, cause);
        this.errorCode = Objects.requireNonNull(errorCode, "errorCode must not be null");
        this.upstreamStatus = upstreamStatus;
        this.upstreamBody = upstreamBody;
    }

    /**
     * Maps a non-2xx gateway status to its error code: 429 rate limited, 402 quota, else failure.
     */
    public static InsightGenerationException fromUpstreamStatus(int status, String body) {
        ErrorCode code = switch (status) {
            case 429 -> ErrorCode.UPSTREAM_RATE_LIMITED;
            case 402 -> ErrorCode.UPSTREAM_QUOTA_EXCEEDED;
            default -> ErrorCode.UPSTREAM_FAILURE;
        };
        return new InsightGenerationException(code, "AI gateway returned " + describeStatus(status), status, body, null);
    }

    public ErrorCode errorCode() {
        return errorCode;
    }

    public boolean retryable() {
        return errorCode.retryable();
    }

    @Nullable
    public Integer upstreamStatus() {
        return upstreamStatus;
    }

    @Nullable
    public String upstreamBody() {
        return upstreamBody;
    }

    static String describeStatus(int status) {
        String explanation = switch (status) {
            case 400 -> "bad request";
            case 401 -> "unauthorized - check API key";
            case 402 -> "payment required - credits exhausted";
            case 403 -> "access denied";
            case 404 -> "not found - check base URL and model name";
            case 429 -> "rate limited - too many requests";
            case 500, 502, 503 -> "server error";
            default -> "unexpected status";
        };
        return "HTTP %d %s".formatted(status, explanation);
    }
}
