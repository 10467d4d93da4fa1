package net.salescoach.application.analysis;

import java.util.ArrayList;
import java.util.List;
import net.salescoach.domain.analysis.FieldIssue;
import tools.jackson.databind.JsonNode;

/**
 * Required-field set of one schema version. Fields not listed are optional.
 */
record SchemaVersion(int version, List<RequiredField> requiredFields) {

    SchemaVersion {
        requiredFields = List.copyOf(requiredFields);
    }

    List<FieldIssue> violations(JsonNode payload) {
        List<FieldIssue> violations = new ArrayList<>();
        for (RequiredField field : requiredFields) {
            field.check(payload).ifPresent(violations::add);
        }
        return violations;
    }
}
