package net.salescoach.domain.analysis;

import java.util.Arrays;
import java.util.Optional;

/**
 * Named categories of structured AI output stored per sales call.
 *
 * <p>Each kind maps to one jsonb column on {@code ai_call_analysis}.</p>
 */
public enum AnalysisKind {
    BEHAVIOR("behavior", "analysis_behavior"),
    STRATEGY("strategy", "analysis_strategy"),
    METADATA("metadata", "analysis_metadata"),
    PSYCHOLOGY("psychology", "analysis_psychology"),
    COACHING("coaching", "analysis_coaching"),
    DEAL_HEAT("deal_heat", "deal_heat_analysis"),
    COMPETITIVE_INTEL("competitive_intel", "analysis_competitive_intel");

    private final String wireName;
    private final String columnName;

    AnalysisKind(String wireName, String columnName) {
        this.wireName = wireName;
        this.columnName = columnName;
    }

    public String wireName() {
        return wireName;
    }

    public String columnName() {
        return columnName;
    }

    public static Optional<AnalysisKind> fromWireName(String wireName) {
        if (wireName == null) {
            return Optional.empty();
        }
        String normalized = wireName.trim().toLowerCase(java.util.Locale.ROOT);
        return Arrays.stream(values())
            .filter(kind -> kind.wireName.equals(normalized))
            .findFirst();
    }
}
