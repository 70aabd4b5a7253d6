package com.purchasingpower.issueflow.workflow;

import com.purchasingpower.issueflow.repository.WorkflowStateStore;
import com.purchasingpower.issueflow.workflow.agents.ReviewerAgent;
import com.purchasingpower.issueflow.workflow.state.IssueContext;
import com.purchasingpower.issueflow.workflow.state.RestartDecision;
import com.purchasingpower.issueflow.workflow.state.WorkflowState;
import com.purchasingpower.issueflow.workflow.state.WorkflowStep;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Decides what a new human comment on the issue means for in-flight work.
 *
 * <p>Each comment is judged at most once: its id is stored as {@code last_issue_comment_id}
 * together with the reviewer's verdict, whatever the verdict is.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RestartDecisionGate {

    public enum Outcome {
        /** Plan and review history were discarded; the caller stops for this invocation. */
        RESTARTED,
        /** The record is completed and nothing new invalidates it. */
        NO_OP_COMPLETED,
        PROCEED
    }

    private final ReviewerAgent reviewer;
    private final WorkflowStateStore stateStore;

    /**
     * Mutates {@code state} in place and persists it whenever a new comment was seen.
     */
    public Outcome evaluate(String repo, int issueNumber, IssueContext context, WorkflowState state) {
        if (!context.hasComment() || Objects.equals(context.latestCommentId(), state.getLastIssueCommentId())) {
            return completedOrProceed(state);
        }

        log.info("💬 New comment {} on {}#{}", context.latestCommentId(), repo, issueNumber);
        RestartDecision decision = reviewer.decideRestart(
                context.text(), context.latestCommentBody(), state.getPlan(), state.getFeedbackHistory());

        state.setLastIssueCommentId(context.latestCommentId());
        state.setCommentDecision(decision);

        if (decision.isRestart()) {
            state.resetForRestart();
            stateStore.save(repo, issueNumber, state);
            log.info("🔄 Restarting {}#{}: {}", repo, issueNumber, decision.getReason());
            return Outcome.RESTARTED;
        }

        stateStore.save(repo, issueNumber, state);
        return completedOrProceed(state);
    }

    private static Outcome completedOrProceed(WorkflowState state) {
        return state.getStep() == WorkflowStep.COMPLETED ? Outcome.NO_OP_COMPLETED : Outcome.PROCEED;
    }
}
