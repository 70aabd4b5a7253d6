package com.purchasingpower.issueflow.workflow.state;

/**
 * One entry of a model-proposed change set.
 *
 * <p>{@link Kind#UNRECOGNIZED} entries carry the raw JSON and the reason they were
 * rejected; they are logged and skipped, never applied.
 */
public record FileChange(Kind kind, String path, String content, String raw, String reason) {

    public enum Kind {
        MODIFY,
        DELETE,
        UNRECOGNIZED
    }

    public static FileChange modify(String path, String content) {
        return new FileChange(Kind.MODIFY, path, content, null, null);
    }

    public static FileChange delete(String path) {
        return new FileChange(Kind.DELETE, path, null, null, null);
    }

    public static FileChange unrecognized(String raw, String reason) {
        return new FileChange(Kind.UNRECOGNIZED, null, null, raw, reason);
    }

    public boolean isApplicable() {
        return kind != Kind.UNRECOGNIZED;
    }
}
