package net.salescoach.controller;

sealed interface ResearchSsePayload
    permits MessageStartPayload, MessageDeltaPayload, DonePayload, ErrorPayload {
}

enum ResearchErrorCode {
    INVALID_REQUEST("invalid_request", "Research request is invalid", false),
    SERVICE_UNAVAILABLE("service_unavailable", "AI service not configured", false),
    RATE_LIMITED("rate_limited", "Rate limit exceeded. Please try again later.", true),
    QUOTA_EXCEEDED("quota_exceeded", "Payment required. Please add funds to continue.", false),
    STREAM_TIMEOUT("stream_timeout", "AI research timed out", true),
    DECODE_FAILED("decode_failed", "AI research stream could not be read", true),
    RESEARCH_FAILED("research_failed", "AI research failed", true);

    private final String wireValue;
    private final String defaultMessage;
    private final boolean retryable;

    ResearchErrorCode(String wireValue, String defaultMessage, boolean retryable) {
        this.wireValue = wireValue;
        this.defaultMessage = defaultMessage;
        this.retryable = retryable;
    }

    String wireValue() {
        return wireValue;
    }

    String defaultMessage() {
        return defaultMessage;
    }

    boolean retryable() {
        return retryable;
    }
}

record MessageStartPayload(String id, String model) implements ResearchSsePayload {
}

record MessageDeltaPayload(String delta) implements ResearchSsePayload {
}

record DonePayload(String message) implements ResearchSsePayload {
}

record ErrorPayload(String error, String code, boolean retryable) implements ResearchSsePayload {
}
