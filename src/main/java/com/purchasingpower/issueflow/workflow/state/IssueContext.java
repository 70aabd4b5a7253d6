package com.purchasingpower.issueflow.workflow.state;

import com.purchasingpower.issueflow.model.github.IssueComment;

import java.util.ArrayList;
import java.util.List;

/**
 * The text the agents see for an issue, plus the newest comment for the restart gate.
 *
 * @param text              trimmed issue body followed by one {@code "\nCOMMENT:\n" + body} block
 *                          per non-blank comment, joined by newlines
 * @param latestCommentId   id of the newest comment, or null when the issue has none
 * @param latestCommentBody body of the newest comment, empty when there is none
 */
public record IssueContext(String text, Long latestCommentId, String latestCommentBody) {

    public static IssueContext of(String issueBody, List<IssueComment> comments) {
        List<String> lines = new ArrayList<>();
        if (issueBody != null && !issueBody.isBlank()) {
            lines.add(issueBody.strip());
        }
        for (IssueComment comment : comments) {
            String body = comment.body() == null ? "" : comment.body().strip();
            if (!body.isEmpty()) {
                lines.add("\nCOMMENT:\n" + body);
            }
        }

        IssueComment latest = comments.isEmpty() ? null : comments.get(comments.size() - 1);
        return new IssueContext(
                String.join("\n", lines),
                latest == null ? null : latest.id(),
                latest == null || latest.body() == null ? "" : latest.body());
    }

    public boolean hasComment() {
        return latestCommentId != null;
    }
}
