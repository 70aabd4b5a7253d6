package com.purchasingpower.issueflow.workflow.agents;

import com.purchasingpower.issueflow.client.LlmClient;
import com.purchasingpower.issueflow.model.prompt.RenderedPrompt;
import com.purchasingpower.issueflow.service.PromptLibraryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Condenses the issue thread into requirements for the planner and the code generator.
 *
 * Falls back to the raw issue text when the model answers with nothing or fails,
 * so a flaky inference call never blocks a round.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RequirementAnalyzerAgent {

    private final LlmClient llmClient;
    private final PromptLibraryService promptLibrary;

    public String analyze(String issueContext) {
        log.info("🔍 Analyzing requirements ({} chars of issue text)", issueContext.length());

        RenderedPrompt prompt = promptLibrary.render("requirements-analysis", Map.of("issue", issueContext));
        try {
            String response = llmClient.generate(prompt.user(), prompt.system());
            if (response == null || response.isBlank()) {
                log.warn("⚠️ Empty requirements analysis, using the issue text as is");
                return issueContext;
            }
            log.info("✅ Requirements analysis completed");
            log.debug("Requirements:\n{}", response);
            return response.strip();
        } catch (RuntimeException e) {
            log.warn("⚠️ Requirements analysis failed ({}), using the issue text as is", e.getMessage());
            return issueContext;
        }
    }
}
