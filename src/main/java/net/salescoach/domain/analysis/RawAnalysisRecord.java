package net.salescoach.domain.analysis;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import tools.jackson.databind.JsonNode;

/**
 * One call's stored AI output: an opaque JSON blob per analysis kind.
 *
 * <p>Any kind may be absent. Older calls lack newer kinds entirely.</p>
 */
public record RawAnalysisRecord(UUID callId, Map<AnalysisKind, JsonNode> blobs) {

    public RawAnalysisRecord {
        if (callId == null) {
            throw new IllegalArgumentException("callId is required");
        }
        EnumMap<AnalysisKind, JsonNode> copy = new EnumMap<>(AnalysisKind.class);
        if (blobs != null) {
            blobs.forEach((kind, node) -> {
                if (kind != null && node != null && !node.isNull() && !node.isMissingNode()) {
                    copy.put(kind, node);
                }
            });
        }
        blobs = Collections.unmodifiableMap(copy);
    }

    public static RawAnalysisRecord empty(UUID callId) {
        return new RawAnalysisRecord(callId, Map.of());
    }

    public Optional<JsonNode> blob(AnalysisKind kind) {
        return Optional.ofNullable(blobs.get(kind));
    }
}
