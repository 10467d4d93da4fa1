package net.salescoach.application.analysis;

import tools.jackson.databind.JsonNode;

/**
 * JSON node shape a required field must have.
 */
enum FieldShape {
    TEXT("non-blank string") {
        @Override
        boolean matches(JsonNode node) {
            return node.isString() && !node.asString().isBlank();
        }
    },
    NUMBER("number") {
        @Override
        boolean matches(JsonNode node) {
            return node.isNumber();
        }
    },
    ARRAY("array") {
        @Override
        boolean matches(JsonNode node) {
            return node.isArray();
        }
    },
    OBJECT("object") {
        @Override
        boolean matches(JsonNode node) {
            return node.isObject();
        }
    };

    private final String description;

    FieldShape(String description) {
        this.description = description;
    }

    abstract boolean matches(JsonNode node);

    String description() {
        return description;
    }
}
