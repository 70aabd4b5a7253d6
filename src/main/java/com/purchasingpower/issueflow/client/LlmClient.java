package com.purchasingpower.issueflow.client;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Chat-completion inference service.
 */
public interface LlmClient {

    /**
     * Plain-text completion. Never returns null.
     *
     * @param system optional system message
     */
    String generate(String prompt, String system);

    /**
     * Completion that must yield a JSON object. The response is run through
     * {@link StructuredOutputParser}, so free text around the object and one malformed
     * answer are tolerated.
     *
     * @throws com.purchasingpower.issueflow.exception.StructuredOutputException when no JSON
     *         object can be recovered
     */
    ObjectNode generateStructured(String prompt, String system);
}
