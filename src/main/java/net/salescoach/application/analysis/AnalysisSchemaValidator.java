package net.salescoach.application.analysis;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.salescoach.domain.analysis.AnalysisKind;
import net.salescoach.domain.analysis.BehaviorAnalysis;
import net.salescoach.domain.analysis.CallMetadataAnalysis;
import net.salescoach.domain.analysis.CoachingAnalysis;
import net.salescoach.domain.analysis.CompetitiveIntelAnalysis;
import net.salescoach.domain.analysis.DealHeatAnalysis;
import net.salescoach.domain.analysis.DegradationReason;
import net.salescoach.domain.analysis.FieldIssue;
import net.salescoach.domain.analysis.PsychologyAnalysis;
import net.salescoach.domain.analysis.RawAnalysisRecord;
import net.salescoach.domain.analysis.StrategyAnalysis;
import net.salescoach.domain.analysis.ValidatedAnalysis;
import net.salescoach.domain.analysis.ValidatedCallAnalysis;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import tools.jackson.databind.JsonNode;

/**
 * Validates stored analysis blobs against their kind's schema versions, newest first.
 *
 * <p>Outcomes, in order of precedence:</p>
 * <ul>
 *   <li>absent blob: {@code Degraded(null, not_yet_analyzed)}</li>
 *   <li>non-object blob: {@code Degraded(null, invalid_payload)}</li>
 *   <li>current version satisfied, nothing malformed: {@code Ok}</li>
 *   <li>current version satisfied, optional fields malformed: {@code Degraded(value, malformed_fields)}</li>
 *   <li>only an older version satisfied: {@code Degraded(value, schema_drift)}</li>
 *   <li>no version satisfied: {@code Degraded(partial, invalid_payload)}, where every field that
 *       failed a required check is left out of the partial value</li>
 * </ul>
 *
 * <p>Input nodes are only read. Missing optional fields stay {@code null} in the result.</p>
 */
@Component
public class AnalysisSchemaValidator {

    private static final Logger log = LoggerFactory.getLogger(AnalysisSchemaValidator.class);

    private final Map<AnalysisKind, AnalysisSchemaFamily<?>> families;

    public AnalysisSchemaValidator() {
        this(AnalysisSchemaCatalog.defaultFamilies());
    }

    AnalysisSchemaValidator(Map<AnalysisKind, AnalysisSchemaFamily<?>> families) {
        for (AnalysisKind kind : AnalysisKind.values()) {
            if (!families.containsKey(kind)) {
                throw new IllegalArgumentException("No schema family registered for " + kind);
            }
        }
        this.families = Map.copyOf(families);
    }

    /**
     * Validates one blob of the given kind.
     */
    public ValidatedAnalysis<?> validate(AnalysisKind kind, JsonNode raw) {
        return validateWith(families.get(kind), raw);
    }

    /**
     * Validates one blob, returning the kind's typed representation.
     *
     * @throws IllegalArgumentException when {@code type} is not the kind's representation
     */
    public <T> ValidatedAnalysis<T> validate(AnalysisKind kind, JsonNode raw, Class<T> type) {
        AnalysisSchemaFamily<?> family = families.get(kind);
        if (!family.type().equals(type)) {
            throw new IllegalArgumentException(kind + " validates to " + family.type().getSimpleName()
                + ", not " + type.getSimpleName());
        }
        @SuppressWarnings("unchecked")
        AnalysisSchemaFamily<T> typed = (AnalysisSchemaFamily<T>) family;
        return validateWith(typed, raw);
    }

    /**
     * Validates every kind of one call's stored analysis.
     */
    public ValidatedCallAnalysis validateRecord(RawAnalysisRecord record, LocalDate callDate) {
        return new ValidatedCallAnalysis(
            record.callId(),
            callDate,
            validate(AnalysisKind.BEHAVIOR, record.blob(AnalysisKind.BEHAVIOR).orElse(null), BehaviorAnalysis.class),
            validate(AnalysisKind.STRATEGY, record.blob(AnalysisKind.STRATEGY).orElse(null), StrategyAnalysis.class),
            validate(AnalysisKind.METADATA, record.blob(AnalysisKind.METADATA).orElse(null), CallMetadataAnalysis.class),
            validate(AnalysisKind.PSYCHOLOGY, record.blob(AnalysisKind.PSYCHOLOGY).orElse(null), PsychologyAnalysis.class),
            validate(AnalysisKind.COACHING, record.blob(AnalysisKind.COACHING).orElse(null), CoachingAnalysis.class),
            validate(AnalysisKind.DEAL_HEAT, record.blob(AnalysisKind.DEAL_HEAT).orElse(null), DealHeatAnalysis.class),
            validate(AnalysisKind.COMPETITIVE_INTEL, record.blob(AnalysisKind.COMPETITIVE_INTEL).orElse(null),
                CompetitiveIntelAnalysis.class)
        );
    }

    private <T> ValidatedAnalysis<T> validateWith(AnalysisSchemaFamily<T> family, JsonNode raw) {
        if (raw == null || raw.isNull() || raw.isMissingNode()) {
            return ValidatedAnalysis.degraded(null, DegradationReason.NOT_YET_ANALYZED, List.of());
        }
        if (!raw.isObject()) {
            log.warn("Stored {} analysis is not a JSON object (nodeType={})", family.kind().wireName(), raw.getNodeType());
            return ValidatedAnalysis.degraded(null, DegradationReason.INVALID_PAYLOAD,
                List.of(FieldIssue.unexpected("$", "object")));
        }

        List<FieldIssue> currentViolations = family.current().violations(raw);
        List<FieldIssue> lastViolations = currentViolations;
        Set<String> rejectedPaths = new LinkedHashSet<>();
        for (SchemaVersion version : family.versions()) {
            List<FieldIssue> violations = version == family.current() ? currentViolations : version.violations(raw);
            lastViolations = violations;
            violations.forEach(issue -> rejectedPaths.add(issue.path()));
            if (!violations.isEmpty()) {
                continue;
            }
            List<FieldIssue> readIssues = new ArrayList<>();
            T value = family.reader().read(raw, readIssues);
            if (version == family.current()) {
                if (readIssues.isEmpty()) {
                    return ValidatedAnalysis.ok(value, version.version());
                }
                log.debug("{} analysis valid with malformed optional fields: {}", family.kind().wireName(), readIssues);
                return ValidatedAnalysis.degraded(value, DegradationReason.MALFORMED_FIELDS, readIssues);
            }
            log.warn("{} analysis matched schema v{} instead of v{}; missing {}",
                family.kind().wireName(), version.version(), family.current().version(), currentViolations);
            List<FieldIssue> issues = new ArrayList<>(currentViolations);
            issues.addAll(readIssues);
            return ValidatedAnalysis.degraded(value, DegradationReason.SCHEMA_DRIFT, issues);
        }

        // Fields that failed a required check never reach the partial value
        List<FieldIssue> issues = new ArrayList<>(lastViolations);
        T partial = family.reader().read(JsonFields.without(raw, rejectedPaths), issues);
        log.warn("{} analysis matched no schema version: {}", family.kind().wireName(), lastViolations);
        return ValidatedAnalysis.degraded(partial, DegradationReason.INVALID_PAYLOAD, issues);
    }
}
