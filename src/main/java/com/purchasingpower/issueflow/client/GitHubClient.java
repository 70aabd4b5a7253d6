package com.purchasingpower.issueflow.client;

import com.purchasingpower.issueflow.model.github.FileUpdate;
import com.purchasingpower.issueflow.model.github.GitHubIssue;
import com.purchasingpower.issueflow.model.github.IssueComment;
import com.purchasingpower.issueflow.model.github.PullRequest;
import com.purchasingpower.issueflow.model.github.ReviewComment;
import com.purchasingpower.issueflow.model.github.WorkflowRun;

import java.util.List;
import java.util.Optional;

/**
 * Code-hosting operations used by the workflow. Repositories are addressed as {@code owner/name}.
 *
 * <p>Implementations retry rate-limited calls themselves; anything that still fails surfaces
 * as {@link com.purchasingpower.issueflow.exception.GitHubApiException}.
 */
public interface GitHubClient {

    GitHubIssue getIssue(String repo, int issueNumber);

    /**
     * All comments of an issue, oldest first.
     */
    List<IssueComment> getIssueComments(String repo, int issueNumber);

    /**
     * Whether the configured token may push to the repository (push or admin permission).
     */
    boolean canPush(String repo);

    /**
     * First pull request in any state whose head is {@code owner:branch}.
     */
    Optional<PullRequest> findPullByHead(String repo, String head);

    PullRequest getPull(String repo, int pullNumber);

    PullRequest createPullRequest(String repo, String head, String base, String title, String body);

    PullRequest updatePullRequest(String repo, int pullNumber, String title, String body);

    /**
     * Unified diff of a pull request.
     */
    String getPullRequestDiff(String repo, int pullNumber);

    void addIssueComment(String repo, int issueOrPullNumber, String body);

    /**
     * Creates {@code branch} from the head of {@code baseBranch} unless it already exists.
     */
    void ensureBranch(String repo, String baseBranch, String branch);

    /**
     * Writes or deletes each file on {@code branch} through the contents API, one commit per file.
     */
    void applyFileChanges(String repo, String branch, List<FileUpdate> files, String commitMessage);

    /**
     * Recent Actions runs that were triggered for the given pull request.
     */
    List<WorkflowRun> getWorkflowRuns(String repo, int pullNumber);

    void createReview(String repo, int pullNumber, String event, String body, List<ReviewComment> comments);
}
