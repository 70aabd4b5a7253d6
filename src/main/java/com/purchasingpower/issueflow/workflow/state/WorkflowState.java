package com.purchasingpower.issueflow.workflow.state;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Durable progress record for one (repository, issue) pair.
 *
 * <p>The whole record is rewritten on every checkpoint. {@code feedbackHistory} holds one
 * entry per completed review round; {@code lastFeedback} is the previous round's review and
 * is compared with the new one to detect that the loop has converged.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class WorkflowState {

    private int iteration;

    @JsonProperty("pr_number")
    private Integer prNumber;

    private WorkflowStep step;

    private Plan plan;

    @Builder.Default
    @JsonProperty("feedback_history")
    private List<ReviewFeedback> feedbackHistory = new ArrayList<>();

    @JsonProperty("last_issue_comment_id")
    private Long lastIssueCommentId;

    @JsonProperty("last_feedback")
    private ReviewFeedback lastFeedback;

    @JsonProperty("comment_decision")
    private RestartDecision commentDecision;

    private ReviewFeedback review;

    public static WorkflowState fresh() {
        return WorkflowState.builder().iteration(0).build();
    }

    /**
     * Drops everything a restart invalidates. The comment bookkeeping and PR number survive.
     */
    public void resetForRestart() {
        this.iteration = 0;
        this.plan = null;
        this.feedbackHistory = new ArrayList<>();
        this.lastFeedback = null;
        this.review = null;
        this.step = WorkflowStep.RESTART;
    }
}
