package com.purchasingpower.issueflow.model.github;

/**
 * Inline comment attached to a pull request review.
 */
public record ReviewComment(String path, int line, String body) {
}
