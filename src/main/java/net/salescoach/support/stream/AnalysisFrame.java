package net.salescoach.support.stream;

import java.util.Objects;

/**
 * One decoded unit of a completion stream.
 *
 * @param kind frame classification
 * @param payload delta text, comment text, or empty for {@link Kind#DONE}
 */
public record AnalysisFrame(Kind kind, String payload) {

    public enum Kind {
        DELTA,
        DONE,
        COMMENT
    }

    public AnalysisFrame {
        Objects.requireNonNull(kind, "kind");
        payload = payload == null ? "" : payload;
    }

    public static AnalysisFrame delta(String text) {
        return new AnalysisFrame(Kind.DELTA, text);
    }

    public static AnalysisFrame done() {
        return new AnalysisFrame(Kind.DONE, "");
    }

    public static AnalysisFrame comment(String text) {
        return new AnalysisFrame(Kind.COMMENT, text);
    }

    public boolean isDelta() {
        return kind == Kind.DELTA;
    }

    public boolean isDone() {
        return kind == Kind.DONE;
    }
}
