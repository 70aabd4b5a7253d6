package com.purchasingpower.issueflow.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.purchasingpower.issueflow.configuration.AppProperties;
import com.purchasingpower.issueflow.workflow.WorkflowSettings;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Maps GitHub webhook deliveries to work.
 *
 * <ul>
 *   <li>{@code issues} opened/edited/labeled/reopened with the trigger label: run the issue workflow</li>
 *   <li>{@code issue_comment} created by a human on a labeled issue: run the issue workflow</li>
 *   <li>{@code pull_request} and completed {@code workflow_run}: run the issue workflow for
 *       issue branches, otherwise review the pull request</li>
 * </ul>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GitHubEventRouter {

    private static final Set<String> ISSUE_ACTIONS = Set.of("opened", "edited", "labeled", "reopened");
    private static final Set<String> PULL_REQUEST_ACTIONS = Set.of("opened", "synchronize", "reopened", "ready_for_review");

    private final IssueDispatchService dispatchService;
    private final AppProperties appProperties;
    private final WorkflowSettings settings;

    /**
     * @return a short human-readable description of what was triggered, one entry per action taken;
     *         empty when the delivery was ignored
     */
    public List<String> route(String event, JsonNode payload) {
        String repo = payload.path("repository").path("full_name").asText("");
        String action = payload.path("action").asText("");
        if (repo.isEmpty()) {
            log.debug("Ignoring {} delivery without repository", event);
            return List.of();
        }

        return switch (event) {
            case "issues" -> routeIssue(repo, action, payload);
            case "issue_comment" -> routeIssueComment(repo, action, payload);
            case "pull_request" -> routePullRequest(repo, action, payload);
            case "workflow_run" -> routeWorkflowRun(repo, action, payload);
            default -> {
                log.debug("Ignoring unsupported event {}", event);
                yield List.of();
            }
        };
    }

    private List<String> routeIssue(String repo, String action, JsonNode payload) {
        JsonNode issue = payload.path("issue");
        if (!ISSUE_ACTIONS.contains(action) || !hasTriggerLabel(issue)) {
            return List.of();
        }
        return List.of(dispatchIssue(repo, issue.path("number").asInt()));
    }

    private List<String> routeIssueComment(String repo, String action, JsonNode payload) {
        JsonNode issue = payload.path("issue");
        JsonNode author = payload.path("comment").path("user");
        boolean fromBot = "Bot".equalsIgnoreCase(author.path("type").asText(""));
        if (!"created".equals(action) || fromBot || issue.has("pull_request") || !hasTriggerLabel(issue)) {
            return List.of();
        }
        return List.of(dispatchIssue(repo, issue.path("number").asInt()));
    }

    private List<String> routePullRequest(String repo, String action, JsonNode payload) {
        if (!PULL_REQUEST_ACTIONS.contains(action)) {
            return List.of();
        }
        JsonNode pr = payload.path("pull_request");
        return List.of(routeForPull(repo, pr.path("number").asInt(), pr.path("head").path("ref").asText("")));
    }

    private List<String> routeWorkflowRun(String repo, String action, JsonNode payload) {
        if (!"completed".equals(action)) {
            return List.of();
        }
        JsonNode run = payload.path("workflow_run");
        List<String> routed = new ArrayList<>();
        for (JsonNode pr : run.path("pull_requests")) {
            String head = pr.path("head").path("ref").asText(run.path("head_branch").asText(""));
            routed.add(routeForPull(repo, pr.path("number").asInt(), head));
        }
        return routed;
    }

    private String routeForPull(String repo, int pullNumber, String headRef) {
        int issueNumber = settings.issueNumberOf(headRef);
        if (issueNumber > 0) {
            return dispatchIssue(repo, issueNumber);
        }
        dispatchService.dispatchPullRequestReview(repo, pullNumber);
        log.info("🧐 Queued review of {}#{}", repo, pullNumber);
        return "review " + repo + "#" + pullNumber;
    }

    private String dispatchIssue(String repo, int issueNumber) {
        dispatchService.dispatch(repo, issueNumber);
        log.info("📨 Queued workflow for {}#{}", repo, issueNumber);
        return "workflow " + repo + "#" + issueNumber;
    }

    private boolean hasTriggerLabel(JsonNode issue) {
        String trigger = appProperties.getGithub().getTriggerLabel();
        for (JsonNode label : issue.path("labels")) {
            if (trigger.equalsIgnoreCase(label.path("name").asText())) {
                return true;
            }
        }
        return false;
    }
}
