package com.purchasingpower.issueflow.service;

import com.purchasingpower.issueflow.workflow.IssueResolutionWorkflow;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * Runs workflow invocations in the background, one at a time per (repository, issue).
 *
 * <p>A submission for a key that is still running is chained behind the running one instead
 * of overlapping it; different keys run in parallel on the {@code workflowExecutor} pool.
 */
@Slf4j
@Service
public class IssueDispatchService {

    private final IssueResolutionWorkflow workflow;
    private final PullRequestReviewService pullRequestReviewService;
    private final Executor executor;
    private final Map<String, CompletableFuture<Boolean>> tails = new ConcurrentHashMap<>();

    public IssueDispatchService(IssueResolutionWorkflow workflow,
                                PullRequestReviewService pullRequestReviewService,
                                @Qualifier("workflowExecutor") Executor executor) {
        this.workflow = workflow;
        this.pullRequestReviewService = pullRequestReviewService;
        this.executor = executor;
    }

    public CompletableFuture<Boolean> dispatch(String repo, int issueNumber) {
        String key = repo + "#" + issueNumber;
        CompletableFuture<Boolean> next = tails.compute(key, (k, tail) -> {
            if (tail != null) {
                log.info("⏳ {} is busy, queueing another invocation", k);
            }
            CompletableFuture<?> previous = tail == null ? CompletableFuture.completedFuture(null) : tail;
            return previous
                    .handle((result, error) -> null)
                    .thenApplyAsync(ignored -> workflow.processIssue(repo, issueNumber), executor);
        });
        // outside compute: the remapping function must not touch the map
        next.whenComplete((result, error) -> {
            tails.remove(key, next);
            if (error != null) {
                log.error("❌ Dispatch of {} failed", key, error);
            } else {
                log.info("{} Invocation for {} finished: {}", Boolean.TRUE.equals(result) ? "✅" : "⚠️", key, result);
            }
        });
        return next;
    }

    public CompletableFuture<Void> dispatchPullRequestReview(String repo, int pullNumber) {
        return CompletableFuture
                .runAsync(() -> pullRequestReviewService.review(repo, pullNumber), executor)
                .whenComplete((ignored, error) -> {
                    if (error != null) {
                        log.error("❌ Review of {}#{} failed", repo, pullNumber, error);
                    }
                });
    }

    /**
     * Number of keys with an invocation running or queued.
     */
    public int inFlight() {
        return tails.size();
    }
}
