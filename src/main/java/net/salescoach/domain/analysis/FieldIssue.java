package net.salescoach.domain.analysis;

/**
 * One field-level validation problem, addressed by dotted JSON path.
 */
public record FieldIssue(String path, String problem) {

    public static FieldIssue missing(String path) {
        return new FieldIssue(path, "missing");
    }

    public static FieldIssue unexpected(String path, String expectation) {
        return new FieldIssue(path, "expected " + expectation);
    }
}
