package net.salescoach.domain.analysis;

import jakarta.annotation.Nullable;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of validating one stored analysis blob against its kind's schema family.
 *
 * <p>A {@link Degraded} result never carries fabricated values: fields the blob did not
 * provide stay {@code null} or empty in the partial value.</p>
 *
 * @param <T> typed representation shared by every schema version of the kind
 */
public sealed interface ValidatedAnalysis<T> permits ValidatedAnalysis.Ok, ValidatedAnalysis.Degraded {

    /**
     * Returns the typed value when one could be read, regardless of degradation.
     */
    Optional<T> usableValue();

    default boolean isDegraded() {
        return this instanceof Degraded;
    }

    static <T> ValidatedAnalysis<T> ok(T value, int schemaVersion) {
        return new Ok<>(value, schemaVersion);
    }

    static <T> ValidatedAnalysis<T> degraded(@Nullable T partialValue, DegradationReason reason, List<FieldIssue> issues) {
        return new Degraded<>(partialValue, reason, issues);
    }

    /**
     * Blob satisfied the current schema version with no field issues.
     */
    record Ok<T>(T value, int schemaVersion) implements ValidatedAnalysis<T> {
        public Ok {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public Optional<T> usableValue() {
            return Optional.of(value);
        }
    }

    /**
     * Blob was absent, outdated, or partially unreadable.
     */
    record Degraded<T>(@Nullable T partialValue, DegradationReason reason, List<FieldIssue> issues)
        implements ValidatedAnalysis<T> {
        public Degraded {
            Objects.requireNonNull(reason, "reason");
            issues = issues == null ? List.of() : List.copyOf(issues);
        }

        @Override
        public Optional<T> usableValue() {
            return Optional.ofNullable(partialValue);
        }

        public String reasonCode() {
            return reason.wireValue();
        }
    }
}
