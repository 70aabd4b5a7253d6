package com.purchasingpower.issueflow.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.purchasingpower.issueflow.exception.StructuredOutputException;
import com.purchasingpower.issueflow.util.ExternalCallLogger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Recovers a JSON object from model output.
 *
 * <ol>
 *   <li>parse the whole text;</li>
 *   <li>parse the substring from the first {@code '{'} to the last {@code '}'};</li>
 *   <li>ask the model once to repair the text, then repeat 1 and 2 on the answer;</li>
 *   <li>give up with {@link StructuredOutputException}.</li>
 * </ol>
 * Only an object counts; a bare array or scalar is treated as a failure.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StructuredOutputParser {

    static final String REPAIR_SYSTEM = "Return only valid JSON.";
    static final String REPAIR_PROMPT = "Fix the following content to valid JSON. "
            + "Return only the JSON object and nothing else.\n\nContent:\n";

    private final ObjectMapper objectMapper;

    public ObjectNode parse(String raw, LlmClient repairer) {
        Optional<ObjectNode> parsed = tryParse(raw);
        if (parsed.isPresent()) {
            return parsed.get();
        }

        log.warn("⚠️ Model output is not a JSON object, requesting one repair: {}",
                ExternalCallLogger.truncate(raw, 200));
        String repaired = repairer.generate(REPAIR_PROMPT + (raw == null ? "" : raw), REPAIR_SYSTEM);

        return tryParse(repaired).orElseThrow(() -> {
            log.error("❌ Failed to parse structured response after repair");
            return new StructuredOutputException("Invalid JSON after repair", raw);
        });
    }

    public Optional<ObjectNode> tryParse(String content) {
        if (content == null || content.isBlank()) {
            return Optional.empty();
        }
        Optional<ObjectNode> direct = readObject(content);
        if (direct.isPresent()) {
            return direct;
        }
        int start = content.indexOf('{');
        int end = content.lastIndexOf('}');
        if (start == -1 || end <= start) {
            return Optional.empty();
        }
        return readObject(content.substring(start, end + 1));
    }

    private Optional<ObjectNode> readObject(String text) {
        try {
            JsonNode node = objectMapper.readTree(text);
            return node instanceof ObjectNode object ? Optional.of(object) : Optional.empty();
        } catch (JsonProcessingException e) {
            log.debug("Not valid JSON: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }
}
