package com.purchasingpower.issueflow.workflow.agents;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.purchasingpower.issueflow.client.LlmClient;
import com.purchasingpower.issueflow.model.github.WorkflowRun;
import com.purchasingpower.issueflow.model.prompt.RenderedPrompt;
import com.purchasingpower.issueflow.service.PromptLibraryService;
import com.purchasingpower.issueflow.util.JsonNodes;
import com.purchasingpower.issueflow.workflow.state.Plan;
import com.purchasingpower.issueflow.workflow.state.PullRequestReview;
import com.purchasingpower.issueflow.workflow.state.RestartDecision;
import com.purchasingpower.issueflow.workflow.state.ReviewFeedback;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * The reviewing half of the agent pair: plans the work, reviews each round's diff,
 * judges whether a new issue comment invalidates the plan, and reviews foreign pull requests.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReviewerAgent {

    private final LlmClient llmClient;
    private final PromptLibraryService promptLibrary;
    private final ObjectMapper objectMapper;

    public Plan generatePlan(String requirements, String repoStructure, String relevantFiles) {
        log.info("🗺️ Generating implementation plan");
        ObjectNode response = ask("implementation-plan", Map.of(
                "requirements", requirements,
                "structure", repoStructure,
                "files", relevantFiles));
        Plan plan = Plan.fromJson(response);
        log.info("✅ Plan ready: {} step(s), {} file(s) to modify", plan.getSteps().size(), plan.getFilesToModify().size());
        return plan;
    }

    public ReviewFeedback reviewChanges(String requirements, Plan plan, String diff, List<ReviewFeedback> feedbackHistory) {
        log.info("🧐 Reviewing diff ({} chars)", diff.length());
        ObjectNode response = ask("review-feedback", Map.of(
                "requirements", requirements,
                "plan", JsonNodes.pretty(objectMapper, plan),
                "diff", diff,
                "history", JsonNodes.pretty(objectMapper, feedbackHistory)));
        ReviewFeedback review = ReviewFeedback.fromJson(response);
        log.info("✅ Review done: {} task(s)", review.getTasks().size());
        return review;
    }

    public RestartDecision decideRestart(String issueContext, String commentBody, Plan plan,
                                         List<ReviewFeedback> feedbackHistory) {
        log.info("💬 Checking whether the new comment requires a restart");
        ObjectNode response = ask("issue-comment-review", Map.of(
                "issue", issueContext,
                "comment", commentBody,
                "plan", plan == null ? "null" : JsonNodes.pretty(objectMapper, plan),
                "history", JsonNodes.pretty(objectMapper, feedbackHistory)));
        RestartDecision decision = RestartDecision.fromJson(response);
        log.info("{} Restart decision: {} ({})", decision.isRestart() ? "🔄" : "➡️",
                decision.isRestart(), decision.getReason());
        return decision;
    }

    public PullRequestReview reviewPullRequest(String description, String diff, List<WorkflowRun> ciRuns) {
        log.info("🧐 Reviewing pull request ({} chars of diff, {} CI run(s))", diff.length(), ciRuns.size());
        ObjectNode response = ask("pull-request-review", Map.of(
                "description", description,
                "diff", diff,
                "ci", JsonNodes.pretty(objectMapper, ciRuns)));
        return PullRequestReview.fromJson(response);
    }

    private ObjectNode ask(String template, Map<String, Object> variables) {
        RenderedPrompt prompt = promptLibrary.render(template, variables);
        return llmClient.generateStructured(prompt.user(), prompt.system());
    }
}
