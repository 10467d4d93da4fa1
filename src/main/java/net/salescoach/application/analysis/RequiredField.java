package net.salescoach.application.analysis;

import java.util.Optional;
import java.util.Set;
import net.salescoach.domain.analysis.FieldIssue;
import tools.jackson.databind.JsonNode;

/**
 * A field one schema version requires, addressed by dotted path from the payload root.
 *
 * @param path dotted path, for example {@code strategic_threading.score}
 * @param shape node shape the field must have
 * @param allowedValues permitted string values; empty when unrestricted
 */
record RequiredField(String path, FieldShape shape, Set<String> allowedValues) {

    RequiredField {
        allowedValues = allowedValues == null ? Set.of() : Set.copyOf(allowedValues);
    }

    static RequiredField of(String path, FieldShape shape) {
        return new RequiredField(path, shape, Set.of());
    }

    static RequiredField oneOf(String path, String... allowedValues) {
        return new RequiredField(path, FieldShape.TEXT, Set.of(allowedValues));
    }

    /**
     * Returns the violation for {@code payload}, if any.
     */
    Optional<FieldIssue> check(JsonNode payload) {
        JsonNode node = JsonFields.at(payload, path);
        if (node.isMissingNode() || node.isNull()) {
            return Optional.of(FieldIssue.missing(path));
        }
        if (!shape.matches(node)) {
            return Optional.of(FieldIssue.unexpected(path, shape.description()));
        }
        if (!allowedValues.isEmpty() && !allowedValues.contains(node.asString().trim())) {
            return Optional.of(FieldIssue.unexpected(path, "one of " + allowedValues));
        }
        return Optional.empty();
    }
}
