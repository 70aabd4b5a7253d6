package com.purchasingpower.issueflow.support;

import com.purchasingpower.issueflow.client.GitHubClient;
import com.purchasingpower.issueflow.exception.GitHubApiException;
import com.purchasingpower.issueflow.model.github.FileUpdate;
import com.purchasingpower.issueflow.model.github.GitHubIssue;
import com.purchasingpower.issueflow.model.github.IssueComment;
import com.purchasingpower.issueflow.model.github.PullRequest;
import com.purchasingpower.issueflow.model.github.ReviewComment;
import com.purchasingpower.issueflow.model.github.WorkflowRun;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory GitHub for a single repository. Mutating calls are counted so tests can assert
 * that an invocation left GitHub untouched.
 */
public class FakeGitHubClient implements GitHubClient {

    public record PostedComment(int number, String body) {
    }

    public record PostedReview(int number, String event, String body, List<ReviewComment> comments) {
    }

    private final Map<Integer, GitHubIssue> issues = new HashMap<>();
    private final Map<Integer, List<IssueComment>> comments = new HashMap<>();
    private final List<PullRequest> pulls = new ArrayList<>();
    private final Map<Integer, String> diffs = new HashMap<>();

    public final List<PostedComment> postedComments = new ArrayList<>();
    public final List<PostedReview> postedReviews = new ArrayList<>();
    public final List<String> ensuredBranches = new ArrayList<>();
    public final List<FileUpdate> apiFileUpdates = new ArrayList<>();
    public final List<String> events = new ArrayList<>();

    /**
     * Thrown from {@link #createPullRequest} when set.
     */
    public RuntimeException pullRequestFailure;

    /**
     * When set, reviews carrying inline comments are rejected the way GitHub rejects
     * comments on lines outside the diff.
     */
    public boolean rejectInlineComments;

    private boolean canPush = true;
    private int mutations = 0;
    private long nextCommentId = 1000;

    public FakeGitHubClient withIssue(int number, String title, String body) {
        issues.put(number, new GitHubIssue(number, title, body, "open", List.of("ai-agent")));
        comments.putIfAbsent(number, new ArrayList<>());
        return this;
    }

    public long addHumanComment(int issueNumber, String body) {
        long id = nextCommentId++;
        comments.computeIfAbsent(issueNumber, n -> new ArrayList<>())
                .add(new IssueComment(id, body, "octocat", false, Instant.now()));
        return id;
    }

    public FakeGitHubClient withPushPermission(boolean canPush) {
        this.canPush = canPush;
        return this;
    }

    public void setDiff(int pullNumber, String diff) {
        diffs.put(pullNumber, diff);
    }

    public int mutationCount() {
        return mutations;
    }

    public List<PullRequest> pulls() {
        return pulls;
    }

    @Override
    public GitHubIssue getIssue(String repo, int issueNumber) {
        GitHubIssue issue = issues.get(issueNumber);
        if (issue == null) {
            throw new GitHubApiException("getIssue", 404, "Not Found", null);
        }
        return issue;
    }

    @Override
    public List<IssueComment> getIssueComments(String repo, int issueNumber) {
        return List.copyOf(comments.getOrDefault(issueNumber, List.of()));
    }

    @Override
    public boolean canPush(String repo) {
        return canPush;
    }

    @Override
    public Optional<PullRequest> findPullByHead(String repo, String head) {
        String branch = head.substring(head.indexOf(':') + 1);
        return pulls.stream().filter(pr -> pr.headRef().equals(branch)).findFirst();
    }

    @Override
    public PullRequest getPull(String repo, int pullNumber) {
        return pulls.stream().filter(pr -> pr.number() == pullNumber).findFirst()
                .orElseThrow(() -> new GitHubApiException("getPull", 404, "Not Found", null));
    }

    @Override
    public PullRequest createPullRequest(String repo, String head, String base, String title, String body) {
        if (pullRequestFailure != null) {
            throw pullRequestFailure;
        }
        mutations++;
        events.add("createPullRequest");
        int number = 100 + pulls.size() + 1;
        PullRequest pr = new PullRequest(number, title, body, "open",
                "https://github.com/" + repo + "/pull/" + number, head, "sha-" + number, base);
        pulls.add(pr);
        return pr;
    }

    @Override
    public PullRequest updatePullRequest(String repo, int pullNumber, String title, String body) {
        mutations++;
        events.add("updatePullRequest");
        PullRequest existing = getPull(repo, pullNumber);
        PullRequest updated = new PullRequest(pullNumber, title, body, existing.state(), existing.htmlUrl(),
                existing.headRef(), existing.headSha(), existing.baseRef());
        pulls.set(pulls.indexOf(existing), updated);
        return updated;
    }

    @Override
    public String getPullRequestDiff(String repo, int pullNumber) {
        return diffs.getOrDefault(pullNumber, "diff --git a/main.txt b/main.txt\n-hi\n+hello\n");
    }

    @Override
    public void addIssueComment(String repo, int issueOrPullNumber, String body) {
        mutations++;
        postedComments.add(new PostedComment(issueOrPullNumber, body));
    }

    @Override
    public void ensureBranch(String repo, String baseBranch, String branch) {
        mutations++;
        ensuredBranches.add(branch);
    }

    @Override
    public void applyFileChanges(String repo, String branch, List<FileUpdate> files, String commitMessage) {
        mutations++;
        apiFileUpdates.addAll(files);
    }

    @Override
    public List<WorkflowRun> getWorkflowRuns(String repo, int pullNumber) {
        return List.of();
    }

    @Override
    public void createReview(String repo, int pullNumber, String event, String body, List<ReviewComment> comments) {
        if (rejectInlineComments && !comments.isEmpty()) {
            throw new GitHubApiException("createReview", 422, "Line could not be resolved", null);
        }
        mutations++;
        postedReviews.add(new PostedReview(pullNumber, event, body, List.copyOf(comments)));
    }
}
