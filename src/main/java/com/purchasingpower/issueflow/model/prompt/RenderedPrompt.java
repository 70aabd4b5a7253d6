package com.purchasingpower.issueflow.model.prompt;

/**
 * A template after rendering: the system message and the user message.
 */
public record RenderedPrompt(String system, String user) {
}
