package net.salescoach.application.analysis;

import java.util.List;
import net.salescoach.domain.analysis.FieldIssue;
import tools.jackson.databind.JsonNode;

/**
 * Reads a payload of any schema version of one kind into the kind's typed representation.
 *
 * <p>Implementations never throw for malformed optional content: they leave the field
 * {@code null}/empty and record a {@link FieldIssue} instead.</p>
 */
@FunctionalInterface
interface AnalysisReader<T> {

    T read(JsonNode payload, List<FieldIssue> issues);
}
