package com.purchasingpower.issueflow.workflow;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.issueflow.git.WorkingCopy;
import com.purchasingpower.issueflow.util.JsonNodes;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Component
@RequiredArgsConstructor
public class RepositoryContextBuilder {

    static final String TRUNCATION_MARKER = "\n... [truncated]";

    private final FileSelector fileSelector;
    private final ObjectMapper objectMapper;
    private final WorkflowSettings settings;

    public RepositoryContext build(WorkingCopy workingCopy, String issueText) {
        String structure = JsonNodes.pretty(objectMapper, workingCopy.structure());
        List<String> selected = fileSelector.select(workingCopy.listFiles(), issueText);
        log.info("📂 Selected {} file(s) for context: {}", selected.size(), selected);

        List<Map<String, String>> snippets = new ArrayList<>();
        for (String path : selected) {
            String content = readTruncated(workingCopy, path);
            if (content == null) {
                continue;
            }
            Map<String, String> snippet = new LinkedHashMap<>();
            snippet.put("path", path);
            snippet.put("content", content);
            snippets.add(snippet);
        }

        String relevant = snippets.isEmpty() ? structure : JsonNodes.pretty(objectMapper, snippets);
        return new RepositoryContext(structure, relevant, selected);
    }

    private String readTruncated(WorkingCopy workingCopy, String path) {
        String content;
        try {
            content = workingCopy.readFile(path);
        } catch (IOException | UncheckedIOException e) {
            log.warn("⚠️ Failed to read {}: {}", path, e.getMessage());
            return null;
        }
        int max = settings.getMaxFileChars();
        if (content.length() > max) {
            return content.substring(0, max) + TRUNCATION_MARKER;
        }
        return content;
    }
}
