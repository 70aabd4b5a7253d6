package com.purchasingpower.issueflow.workflow;

import com.purchasingpower.issueflow.workflow.state.ReviewFeedback;
import com.purchasingpower.issueflow.workflow.state.ReviewTask;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Review Comment Formatter Tests")
class ReviewCommentFormatterTest {

    @Test
    @DisplayName("Should prefer the final comment")
    void testFormat_ShouldUseFinalComment() {
        ReviewFeedback review = ReviewFeedback.builder().summary("ok").finalComment("Done").build();

        assertThat(ReviewCommentFormatter.format(review)).isEqualTo("Done");
    }

    @Test
    @DisplayName("Should list tasks under the summary with locations when known")
    void testFormat_ShouldListTasks() {
        // Given
        ReviewFeedback review = ReviewFeedback.builder()
                .summary("Two things left")
                .tasks(List.of(
                        ReviewTask.builder().message("Handle None").file("src/app.py").line(12).build(),
                        ReviewTask.builder().message("Add a test").file("tests/test_app.py").build()))
                .build();

        // When
        String comment = ReviewCommentFormatter.format(review);

        // Then
        assertThat(comment).isEqualTo("Two things left\n- Handle None (src/app.py:12)\n- Add a test");
    }

    @Test
    @DisplayName("Should fall back to a fixed text for an empty review")
    void testFormat_ShouldHandleEmptyReview() {
        assertThat(ReviewCommentFormatter.format(new ReviewFeedback())).isEqualTo(ReviewCommentFormatter.EMPTY_REVIEW);
    }
}
