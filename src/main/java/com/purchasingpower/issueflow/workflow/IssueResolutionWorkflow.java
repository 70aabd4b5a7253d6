package com.purchasingpower.issueflow.workflow;

import com.purchasingpower.issueflow.client.GitHubClient;
import com.purchasingpower.issueflow.exception.StateStoreException;
import com.purchasingpower.issueflow.git.WorkingCopy;
import com.purchasingpower.issueflow.git.WorkingCopyService;
import com.purchasingpower.issueflow.model.github.GitHubIssue;
import com.purchasingpower.issueflow.model.github.IssueComment;
import com.purchasingpower.issueflow.model.github.PullRequest;
import com.purchasingpower.issueflow.repository.AgentErrorLog;
import com.purchasingpower.issueflow.repository.WorkflowStateStore;
import com.purchasingpower.issueflow.workflow.agents.CodeGeneratorAgent;
import com.purchasingpower.issueflow.workflow.agents.PRCreatorAgent;
import com.purchasingpower.issueflow.workflow.agents.RequirementAnalyzerAgent;
import com.purchasingpower.issueflow.workflow.agents.ReviewerAgent;
import com.purchasingpower.issueflow.workflow.state.ChangeSet;
import com.purchasingpower.issueflow.workflow.state.IssueContext;
import com.purchasingpower.issueflow.workflow.state.ReviewFeedback;
import com.purchasingpower.issueflow.workflow.state.WorkflowState;
import com.purchasingpower.issueflow.workflow.state.WorkflowStep;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Drives one GitHub issue from its text to a reviewed pull request.
 *
 * <p>Each invocation runs at most one review round and checkpoints the {@link WorkflowState}
 * before and after every step, so a crashed or interrupted invocation resumes from its last
 * checkpoint. The next round is started by the next trigger (a new push on the PR, a finished
 * CI run, a manual run) until the reviewer has no tasks left, repeats itself, or the round
 * budget is spent.
 *
 * <pre>
 * fetch issue → comment gate → requirements → clone + analyze → plan (once)
 *   → generate → apply/commit/push → PR → review → comment → completed | final_review
 * </pre>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IssueResolutionWorkflow {

    private final GitHubClient gitHubClient;
    private final WorkflowStateStore stateStore;
    private final AgentErrorLog errorLog;
    private final RestartDecisionGate restartGate;
    private final RequirementAnalyzerAgent requirementAnalyzer;
    private final RepositoryContextBuilder contextBuilder;
    private final ReviewerAgent reviewer;
    private final CodeGeneratorAgent codeGenerator;
    private final ChangePublisher changePublisher;
    private final PRCreatorAgent prCreator;
    private final WorkingCopyService workingCopyService;
    private final WorkflowSettings settings;

    /**
     * Runs one invocation for {@code repo#issueNumber}.
     *
     * @return true when the invocation finished a round, restarted, or found nothing to do;
     *         false when the round budget is spent, the token cannot push, or a step failed
     *         (failures are appended to the error log)
     */
    public boolean processIssue(String repo, int issueNumber) {
        return processIssue(repo, issueNumber, settings.getMaxIterations());
    }

    /**
     * Same as {@link #processIssue(String, int)} with a round budget for this invocation only.
     */
    public boolean processIssue(String repo, int issueNumber, int maxIterations) {
        log.info("🚀 Processing {}#{}", repo, issueNumber);
        try {
            return run(repo, issueNumber, maxIterations);
        } catch (Exception e) {
            errorLog.record(repo, issueNumber, lastCheckpoint(repo, issueNumber), e);
            log.error("❌ Issue processing failed for {}#{}", repo, issueNumber, e);
            return false;
        }
    }

    private boolean run(String repo, int issueNumber, int maxIterations) {
        WorkflowState state = stateStore.load(repo, issueNumber).orElseGet(WorkflowState::fresh);
        if (state.getFeedbackHistory() == null) {
            state.setFeedbackHistory(new ArrayList<>());
        }

        GitHubIssue issue = gitHubClient.getIssue(repo, issueNumber);
        List<IssueComment> comments = gitHubClient.getIssueComments(repo, issueNumber);
        IssueContext issueContext = IssueContext.of(issue.body(), comments);

        switch (restartGate.evaluate(repo, issueNumber, issueContext, state)) {
            case RESTARTED -> {
                return true;
            }
            case NO_OP_COMPLETED -> {
                log.info("✅ {}#{} is already completed, nothing to do", repo, issueNumber);
                return true;
            }
            case PROCEED -> log.debug("Comment gate passed for {}#{}", repo, issueNumber);
        }

        if (state.getIteration() >= maxIterations) {
            log.error("🛑 Max iterations ({}) reached for {}#{}", maxIterations, repo, issueNumber);
            return false;
        }
        if (!gitHubClient.canPush(repo)) {
            log.error("🔒 Token does not have push permissions for {}. Update the token with repo write access.", repo);
            return false;
        }

        prCreator.findExisting(repo, issueNumber).ifPresent(pr -> state.setPrNumber(pr.number()));
        checkpoint(repo, issueNumber, state, WorkflowStep.REQUIREMENTS);
        String requirements = requirementAnalyzer.analyze(issueContext.text());

        try (WorkingCopy workingCopy = workingCopyService.checkout(repo, settings.getBaseBranch())) {
            workingCopy.ensureBranch(settings.branchFor(issueNumber));

            checkpoint(repo, issueNumber, state, WorkflowStep.ANALYZE);
            RepositoryContext context = contextBuilder.build(workingCopy, issueContext.text());

            if (state.getPlan() == null) {
                state.setPlan(reviewer.generatePlan(requirements, context.structure(), context.relevantFiles()));
                checkpoint(repo, issueNumber, state, WorkflowStep.PLAN);
            }

            if (state.getIteration() < maxIterations) {
                runRound(repo, issueNumber, maxIterations, state, requirements, context, workingCopy);
                return true;
            }
            return false;
        }
    }

    private void runRound(String repo, int issueNumber, int maxIterations, WorkflowState state,
                          String requirements, RepositoryContext context, WorkingCopy workingCopy) {
        state.setIteration(state.getIteration() + 1);
        log.info("🔁 Round {}/{} for {}#{}", state.getIteration(), maxIterations, repo, issueNumber);
        checkpoint(repo, issueNumber, state, WorkflowStep.APPLY);

        ChangeSet changeSet = codeGenerator.generate(requirements, context.structure(), context.relevantFiles(),
                state.getPlan(), state.getFeedbackHistory());
        checkpoint(repo, issueNumber, state, WorkflowStep.APPLY);

        changePublisher.publish(repo, issueNumber, workingCopy, changeSet);
        // pushed, pull request not yet created or updated
        checkpoint(repo, issueNumber, state, WorkflowStep.PR);

        PullRequest pr = prCreator.createOrUpdate(repo, issueNumber, changeSet.commitMessage());
        state.setPrNumber(pr.number());
        checkpoint(repo, issueNumber, state, WorkflowStep.PR);

        String diff = gitHubClient.getPullRequestDiff(repo, pr.number());
        ReviewFeedback review = reviewer.reviewChanges(requirements, state.getPlan(), diff, state.getFeedbackHistory());
        state.getFeedbackHistory().add(review);
        state.setReview(review);
        checkpoint(repo, issueNumber, state, WorkflowStep.FINAL_REVIEW);

        gitHubClient.addIssueComment(repo, pr.number(), ReviewCommentFormatter.format(review));

        boolean repeated = review.equals(state.getLastFeedback());
        boolean converged = !review.hasTasks() || repeated;
        state.setLastFeedback(review);
        checkpoint(repo, issueNumber, state, converged ? WorkflowStep.COMPLETED : WorkflowStep.FINAL_REVIEW);

        if (converged) {
            log.info("🎉 {}#{} completed after {} round(s){}", repo, issueNumber, state.getIteration(),
                    repeated ? " (review repeated itself)" : "");
        } else {
            log.info("📝 {}#{} round {} left {} task(s) for the next round", repo, issueNumber,
                    state.getIteration(), review.getTasks().size());
        }
    }

    private void checkpoint(String repo, int issueNumber, WorkflowState state, WorkflowStep step) {
        state.setStep(step);
        stateStore.save(repo, issueNumber, state);
        log.debug("📍 {}#{} → {}", repo, issueNumber, step.getValue());
    }

    private WorkflowState lastCheckpoint(String repo, int issueNumber) {
        try {
            return stateStore.load(repo, issueNumber).orElse(null);
        } catch (StateStoreException e) {
            log.warn("Could not read state for the error log: {}", e.getMessage());
            return null;
        }
    }
}
