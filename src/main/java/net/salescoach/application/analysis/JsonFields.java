package net.salescoach.application.analysis;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import net.salescoach.domain.analysis.FieldIssue;
import org.springframework.util.StringUtils;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.node.MissingNode;
import tools.jackson.databind.node.ObjectNode;

/**
 * Null-tolerant accessors over analysis payloads.
 */
final class JsonFields {

    private JsonFields() {
    }

    /**
     * Resolves a dotted path; returns a missing node when any segment is absent.
     */
    static JsonNode at(JsonNode payload, String dottedPath) {
        JsonNode current = payload == null ? MissingNode.getInstance() : payload;
        for (String segment : dottedPath.split("\\.")) {
            if (!current.isObject()) {
                return MissingNode.getInstance();
            }
            current = current.path(segment);
        }
        return current;
    }

    /**
     * Returns a copy of {@code payload} with the fields at {@code dottedPaths} removed.
     */
    static JsonNode without(JsonNode payload, Collection<String> dottedPaths) {
        JsonNode copy = payload.deepCopy();
        for (String dottedPath : dottedPaths) {
            int lastDot = dottedPath.lastIndexOf('.');
            JsonNode parent = lastDot < 0 ? copy : at(copy, dottedPath.substring(0, lastDot));
            if (parent instanceof ObjectNode object) {
                object.remove(dottedPath.substring(lastDot + 1));
            }
        }
        return copy;
    }

    static String text(JsonNode payload, String dottedPath) {
        JsonNode node = at(payload, dottedPath);
        if (!node.isString()) {
            return null;
        }
        String value = node.asString();
        return StringUtils.hasText(value) ? value.trim() : null;
    }

    /**
     * Like {@link #text} but records an issue when the field exists with a non-string value.
     */
    static String text(JsonNode payload, String dottedPath, List<FieldIssue> issues) {
        JsonNode node = at(payload, dottedPath);
        if (!node.isMissingNode() && !node.isNull() && !node.isString()) {
            issues.add(FieldIssue.unexpected(dottedPath, "string"));
            return null;
        }
        return text(payload, dottedPath);
    }

    static Double number(JsonNode payload, String dottedPath, List<FieldIssue> issues) {
        JsonNode node = at(payload, dottedPath);
        if (node.isMissingNode() || node.isNull()) {
            return null;
        }
        if (!node.isNumber()) {
            issues.add(FieldIssue.unexpected(dottedPath, "number"));
            return null;
        }
        return node.asDouble();
    }

    static Integer integer(JsonNode payload, String dottedPath, List<FieldIssue> issues) {
        Double value = number(payload, dottedPath, issues);
        return value == null ? null : value.intValue();
    }

    static Boolean bool(JsonNode payload, String dottedPath, List<FieldIssue> issues) {
        JsonNode node = at(payload, dottedPath);
        if (node.isMissingNode() || node.isNull()) {
            return null;
        }
        if (!node.isBoolean()) {
            issues.add(FieldIssue.unexpected(dottedPath, "boolean"));
            return null;
        }
        return node.asBoolean();
    }

    /**
     * Reads a string array, skipping blank and non-string elements with an issue each.
     */
    static List<String> stringList(JsonNode payload, String dottedPath, List<FieldIssue> issues) {
        Optional<JsonNode> array = array(payload, dottedPath, issues);
        if (array.isEmpty()) {
            return List.of();
        }
        List<String> values = new ArrayList<>();
        int index = 0;
        for (JsonNode element : array.get()) {
            if (element.isString() && StringUtils.hasText(element.asString())) {
                values.add(element.asString().trim());
            } else if (!element.isNull()) {
                issues.add(FieldIssue.unexpected(dottedPath + "[" + index + "]", "non-blank string"));
            }
            index++;
        }
        return List.copyOf(values);
    }

    static Optional<JsonNode> array(JsonNode payload, String dottedPath, List<FieldIssue> issues) {
        JsonNode node = at(payload, dottedPath);
        if (node.isMissingNode() || node.isNull()) {
            return Optional.empty();
        }
        if (!node.isArray()) {
            issues.add(FieldIssue.unexpected(dottedPath, "array"));
            return Optional.empty();
        }
        return Optional.of(node);
    }
}
