package com.purchasingpower.issueflow.model.prompt;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

/**
 * Prompt template loaded from YAML.
 *
 * <pre>
 * name: plan
 * version: 1.0
 * structured: true
 * systemPrompt: |
 *   You are a senior engineer...
 * userPrompt: |
 *   TASK: IMPLEMENTATION PLAN
 *   ...
 * </pre>
 *
 * The system prompt is sent as the system message; only the user prompt is rendered
 * with the caller's variables.
 *
 * @see com.purchasingpower.issueflow.service.PromptLibraryService
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)  // Allow extra fields like "examples" for documentation
public class PromptTemplate {
    private String name;
    private String version;
    private boolean structured;
    private String systemPrompt;
    private String userPrompt;
}
