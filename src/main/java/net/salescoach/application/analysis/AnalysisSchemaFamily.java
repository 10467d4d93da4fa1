package net.salescoach.application.analysis;

import java.util.Comparator;
import java.util.List;
import net.salescoach.domain.analysis.AnalysisKind;

/**
 * Ordered schema versions of one analysis kind, newest first, sharing one reader.
 */
record AnalysisSchemaFamily<T>(AnalysisKind kind, Class<T> type, AnalysisReader<T> reader, List<SchemaVersion> versions) {

    AnalysisSchemaFamily {
        if (versions == null || versions.isEmpty()) {
            throw new IllegalArgumentException("At least one schema version is required for " + kind);
        }
        versions = versions.stream()
            .sorted(Comparator.comparingInt(SchemaVersion::version).reversed())
            .toList();
    }

    SchemaVersion current() {
        return versions.get(0);
    }
}
