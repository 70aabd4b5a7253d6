package com.purchasingpower.issueflow.model.github;

public record PullRequest(
        int number,
        String title,
        String body,
        String state,
        String htmlUrl,
        String headRef,
        String headSha,
        String baseRef
) {
}
