package com.purchasingpower.issueflow.workflow.state;

import com.fasterxml.jackson.databind.JsonNode;
import com.purchasingpower.issueflow.model.github.ReviewComment;
import com.purchasingpower.issueflow.util.JsonNodes;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Standalone review of a pull request the workflow did not open.
 */
public record PullRequestReview(Decision decision, String summary, List<Finding> issues) {

    public enum Decision {
        APPROVE,
        REQUEST_CHANGES,
        COMMENT;

        static Decision parse(String value) {
            if (value == null) {
                return COMMENT;
            }
            String normalized = value.trim().toUpperCase(Locale.ROOT).replace(' ', '_');
            for (Decision decision : values()) {
                if (decision.name().equals(normalized)) {
                    return decision;
                }
            }
            return COMMENT;
        }
    }

    public record Finding(String severity, String message, String file, Integer line) {
    }

    public PullRequestReview {
        issues = issues == null ? List.of() : List.copyOf(issues);
    }

    public static PullRequestReview fromJson(JsonNode node) {
        List<Finding> findings = new ArrayList<>();
        JsonNode raw = node == null ? null : node.get("issues");
        if (raw != null && raw.isArray()) {
            for (JsonNode item : raw) {
                if (!item.isObject()) {
                    continue;
                }
                String severity = JsonNodes.text(item, "severity");
                findings.add(new Finding(
                        severity == null ? "info" : severity,
                        JsonNodes.textOrEmpty(item, "message"),
                        JsonNodes.text(item, "file"),
                        JsonNodes.integer(item, "line")));
            }
        }
        return new PullRequestReview(
                Decision.parse(JsonNodes.text(node, "decision")),
                JsonNodes.textOrEmpty(node, "summary"),
                findings);
    }

    /**
     * Findings that point at a file and a line, as inline review comments.
     */
    public List<ReviewComment> inlineComments() {
        return issues.stream()
                .filter(f -> f.file() != null && !f.file().isBlank() && f.line() != null && f.line() > 0)
                .map(f -> new ReviewComment(f.file(), f.line(), "%s: %s".formatted(f.severity(), f.message())))
                .toList();
    }

    /**
     * Review body: the summary, then {@code - severity: message (file:line)} per finding.
     * The location is left out when the finding names no file.
     */
    public String toBody() {
        List<String> lines = new ArrayList<>();
        if (!summary.isBlank()) {
            lines.add(summary.strip());
        }
        for (Finding finding : issues) {
            String location = finding.file() == null ? ""
                    : finding.line() == null ? " (" + finding.file() + ")"
                    : " (" + finding.file() + ":" + finding.line() + ")";
            lines.add("- %s: %s%s".formatted(finding.severity(), finding.message(), location));
        }
        return lines.isEmpty() ? "Review completed." : String.join("\n", lines);
    }
}
