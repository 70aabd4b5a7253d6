package com.purchasingpower.issueflow.model.github;

import java.time.Instant;

public record IssueComment(
        long id,
        String body,
        String author,
        boolean bot,
        Instant createdAt
) {
}
