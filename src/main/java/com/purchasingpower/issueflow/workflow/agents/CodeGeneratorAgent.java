package com.purchasingpower.issueflow.workflow.agents;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.purchasingpower.issueflow.client.LlmClient;
import com.purchasingpower.issueflow.model.prompt.RenderedPrompt;
import com.purchasingpower.issueflow.service.PromptLibraryService;
import com.purchasingpower.issueflow.util.JsonNodes;
import com.purchasingpower.issueflow.workflow.state.ChangeSet;
import com.purchasingpower.issueflow.workflow.state.FileChange;
import com.purchasingpower.issueflow.workflow.state.Plan;
import com.purchasingpower.issueflow.workflow.state.ReviewFeedback;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Component
@RequiredArgsConstructor
public class CodeGeneratorAgent {

    private final LlmClient llmClient;
    private final PromptLibraryService promptLibrary;
    private final ObjectMapper objectMapper;

    /**
     * Asks the model for the files to write for this round. Earlier review rounds are
     * passed along so the model addresses their tasks.
     */
    public ChangeSet generate(String requirements, String repoStructure, String relevantFiles,
                              Plan plan, List<ReviewFeedback> feedbackHistory) {
        log.info("🤖 Generating code changes (review rounds so far: {})", feedbackHistory.size());

        Map<String, Object> reviewerContext = new LinkedHashMap<>();
        reviewerContext.put("relevant_files", relevantFiles);
        reviewerContext.put("plan", plan);
        reviewerContext.put("feedback_history", feedbackHistory);

        RenderedPrompt prompt = promptLibrary.render("code-generation", Map.of(
                "requirements", requirements,
                "structure", repoStructure,
                "context", JsonNodes.pretty(objectMapper, reviewerContext)));

        ObjectNode response = llmClient.generateStructured(prompt.user(), prompt.system());
        ChangeSet changeSet = ChangeSet.fromJson(response, objectMapper);

        for (FileChange skipped : changeSet.unrecognized()) {
            log.warn("⚠️ Skipping invalid file entry ({}): {}", skipped.reason(), skipped.raw());
        }
        log.info("✅ Generated {} file change(s): {}", changeSet.applicable().size(), changeSet.commitMessage());
        return changeSet;
    }
}
