package net.salescoach.application.ai;

import tools.jackson.databind.node.ObjectNode;

/**
 * A function-style tool the model is forced to call.
 *
 * @param name function name the response must echo
 * @param description short description sent to the model
 * @param parameters JSON schema of the arguments object
 */
public record ToolDefinition(String name, String description, ObjectNode parameters) {
}
