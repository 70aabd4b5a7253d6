package com.purchasingpower.issueflow.model.github;

/**
 * One file operation sent through the contents API. {@code content} is ignored for deletions.
 */
public record FileUpdate(String path, String content, boolean delete) {

    public static FileUpdate write(String path, String content) {
        return new FileUpdate(path, content, false);
    }

    public static FileUpdate delete(String path) {
        return new FileUpdate(path, null, true);
    }
}
