package com.purchasingpower.issueflow.model.github;

import java.util.List;

/**
 * GitHub Actions run, with the numbers of the pull requests it ran for.
 */
public record WorkflowRun(
        long id,
        String name,
        String status,
        String conclusion,
        String headBranch,
        String headSha,
        List<Integer> pullRequestNumbers
) {
    public WorkflowRun {
        pullRequestNumbers = pullRequestNumbers == null ? List.of() : List.copyOf(pullRequestNumbers);
    }
}
