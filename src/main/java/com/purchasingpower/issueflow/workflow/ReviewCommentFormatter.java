package com.purchasingpower.issueflow.workflow;

import com.purchasingpower.issueflow.workflow.state.ReviewFeedback;
import com.purchasingpower.issueflow.workflow.state.ReviewTask;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a review into the comment posted on the pull request.
 */
public final class ReviewCommentFormatter {

    static final String EMPTY_REVIEW = "Review completed.";

    private ReviewCommentFormatter() {
    }

    public static String format(ReviewFeedback review) {
        if (review.getFinalComment() != null && !review.getFinalComment().isBlank()) {
            return review.getFinalComment();
        }

        List<String> lines = new ArrayList<>();
        if (review.getSummary() != null && !review.getSummary().isBlank()) {
            lines.add(review.getSummary().strip());
        }
        if (review.getTasks() != null) {
            for (ReviewTask task : review.getTasks()) {
                String message = task.getMessage() == null ? "" : task.getMessage();
                boolean located = task.getFile() != null && !task.getFile().isBlank()
                        && task.getLine() != null && task.getLine() != 0;
                lines.add(located
                        ? "- %s (%s:%d)".formatted(message, task.getFile(), task.getLine())
                        : "- " + message);
            }
        }
        return lines.isEmpty() ? EMPTY_REVIEW : String.join("\n", lines);
    }
}
