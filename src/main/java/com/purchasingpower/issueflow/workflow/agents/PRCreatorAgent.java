package com.purchasingpower.issueflow.workflow.agents;

import com.purchasingpower.issueflow.client.GitHubClient;
import com.purchasingpower.issueflow.model.github.PullRequest;
import com.purchasingpower.issueflow.workflow.WorkflowSettings;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Opens the pull request for an issue branch, or retitles the one that already exists.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PRCreatorAgent {

    private final GitHubClient gitHubClient;
    private final WorkflowSettings settings;

    public Optional<PullRequest> findExisting(String repo, int issueNumber) {
        return gitHubClient.findPullByHead(repo, headFor(repo, issueNumber));
    }

    public PullRequest createOrUpdate(String repo, int issueNumber, String commitMessage) {
        String title = "Resolve #" + issueNumber + ": " + commitMessage;
        String body = "Closes #" + issueNumber;

        Optional<PullRequest> existing = findExisting(repo, issueNumber);
        if (existing.isPresent()) {
            log.info("🔀 Updating PR #{} for issue #{}", existing.get().number(), issueNumber);
            return gitHubClient.updatePullRequest(repo, existing.get().number(), title, body);
        }

        log.info("🚀 Opening PR for issue #{}", issueNumber);
        return gitHubClient.createPullRequest(repo, settings.branchFor(issueNumber), settings.getBaseBranch(), title, body);
    }

    private String headFor(String repo, int issueNumber) {
        String owner = repo.substring(0, repo.indexOf('/'));
        return owner + ":" + settings.branchFor(issueNumber);
    }
}
