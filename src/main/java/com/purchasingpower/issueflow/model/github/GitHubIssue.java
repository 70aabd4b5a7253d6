package com.purchasingpower.issueflow.model.github;

import java.util.List;

/**
 * Issue as returned by {@code GET /repos/{repo}/issues/{number}}, reduced to the fields the workflow reads.
 */
public record GitHubIssue(
        int number,
        String title,
        String body,
        String state,
        List<String> labels
) {
    public GitHubIssue {
        labels = labels == null ? List.of() : List.copyOf(labels);
    }

    public boolean hasLabel(String label) {
        return labels.stream().anyMatch(l -> l.equalsIgnoreCase(label));
    }
}
