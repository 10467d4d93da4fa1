package net.salescoach.domain.analysis;

/**
 * Why a stored analysis blob could only be validated partially.
 */
public enum DegradationReason {
    /** No blob stored for this kind; expected for calls analysed before the kind existed. */
    NOT_YET_ANALYZED("not_yet_analyzed"),
    /** Blob satisfies an older schema version but not the current one. */
    SCHEMA_DRIFT("schema_drift"),
    /** Blob satisfies the current schema but some non-critical fields were unreadable. */
    MALFORMED_FIELDS("malformed_fields"),
    /** Blob satisfies no known schema version. */
    INVALID_PAYLOAD("invalid_payload");

    private final String wireValue;

    DegradationReason(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }
}
