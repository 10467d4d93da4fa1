package net.salescoach.application.research;

import java.util.List;

/**
 * Research request rejected before any upstream call.
 */
public class InvalidResearchRequestException extends RuntimeException {

    private final List<String> violations;

    public InvalidResearchRequestException(List<String> violations) {
        super("Validation failed: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> violations() {
        return violations;
    }
}
