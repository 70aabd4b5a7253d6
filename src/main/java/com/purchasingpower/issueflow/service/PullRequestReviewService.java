package com.purchasingpower.issueflow.service;

import com.purchasingpower.issueflow.client.GitHubClient;
import com.purchasingpower.issueflow.exception.GitHubApiException;
import com.purchasingpower.issueflow.model.github.PullRequest;
import com.purchasingpower.issueflow.model.github.ReviewComment;
import com.purchasingpower.issueflow.model.github.WorkflowRun;
import com.purchasingpower.issueflow.workflow.agents.ReviewerAgent;
import com.purchasingpower.issueflow.workflow.state.PullRequestReview;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Reviews a pull request that was not opened by the issue workflow and posts the verdict as a PR review.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PullRequestReviewService {

    private final GitHubClient gitHubClient;
    private final ReviewerAgent reviewer;

    public PullRequestReview review(String repo, int pullNumber) {
        PullRequest pr = gitHubClient.getPull(repo, pullNumber);
        String description = pr.body() == null || pr.body().isBlank() ? pr.title() : pr.body();
        String diff = gitHubClient.getPullRequestDiff(repo, pullNumber);
        List<WorkflowRun> runs = gitHubClient.getWorkflowRuns(repo, pullNumber);

        PullRequestReview review = reviewer.reviewPullRequest(description, diff, runs);
        postReview(repo, pullNumber, review);
        log.info("🧾 Posted {} review on {}#{} ({} finding(s))", review.decision(), repo, pullNumber, review.issues().size());
        return review;
    }

    /**
     * GitHub answers 422 for the whole review when an inline comment points outside the diff;
     * the review is then posted again with the findings left in the body only.
     */
    private void postReview(String repo, int pullNumber, PullRequestReview review) {
        String event = review.decision().name();
        List<ReviewComment> inline = review.inlineComments();
        try {
            gitHubClient.createReview(repo, pullNumber, event, review.toBody(), inline);
        } catch (GitHubApiException e) {
            if (inline.isEmpty() || e.getStatusCode() != 422) {
                throw e;
            }
            log.warn("⚠️ GitHub rejected {} inline comment(s) on {}#{}, posting the review without them",
                    inline.size(), repo, pullNumber);
            gitHubClient.createReview(repo, pullNumber, event, review.toBody(), List.of());
        }
    }
}
