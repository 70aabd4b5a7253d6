package com.purchasingpower.issueflow.workflow.state;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.issueflow.util.JsonNodes;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.StreamSupport;

/**
 * Files to write or delete plus the commit message, as proposed by the code generator.
 *
 * <p>Expected shape:
 * <pre>
 * {
 *   "commit_message": "Fix greeting",
 *   "files_to_modify": [
 *     {"path": "src/app.py", "action": "modify", "content": "..."},
 *     {"path": "old.txt", "action": "delete"}
 *   ]
 * }
 * </pre>
 * Content given as an array of lines is joined with newlines; any other non-string
 * value is written as pretty-printed JSON.
 */
public record ChangeSet(String commitMessage, List<FileChange> files) {

    static final String DEFAULT_COMMIT_MESSAGE = "Apply automated changes";

    public ChangeSet {
        files = files == null ? List.of() : List.copyOf(files);
    }

    public List<FileChange> applicable() {
        return files.stream().filter(FileChange::isApplicable).toList();
    }

    public List<FileChange> unrecognized() {
        return files.stream().filter(f -> !f.isApplicable()).toList();
    }

    public static ChangeSet fromJson(JsonNode node, ObjectMapper mapper) {
        String message = JsonNodes.text(node, "commit_message");
        if (message == null || message.isBlank()) {
            message = DEFAULT_COMMIT_MESSAGE;
        }

        List<FileChange> files = new ArrayList<>();
        JsonNode entries = node == null ? null : node.get("files_to_modify");
        if (entries != null && entries.isArray()) {
            for (JsonNode entry : entries) {
                files.add(toFileChange(entry, mapper));
            }
        }
        return new ChangeSet(message.strip(), files);
    }

    private static FileChange toFileChange(JsonNode entry, ObjectMapper mapper) {
        if (!entry.isObject()) {
            return FileChange.unrecognized(entry.toString(), "entry is not an object");
        }
        String path = JsonNodes.text(entry, "path");
        if (path == null || path.isBlank()) {
            return FileChange.unrecognized(entry.toString(), "missing path");
        }
        String action = JsonNodes.text(entry, "action");
        if (action == null || action.isBlank()) {
            action = "modify";
        }
        return switch (action.trim().toLowerCase(Locale.ROOT)) {
            case "delete", "remove" -> FileChange.delete(path.strip());
            case "modify", "create", "update", "add" -> {
                JsonNode content = entry.get("content");
                if (content == null || content.isNull()) {
                    yield FileChange.unrecognized(entry.toString(), "missing content");
                }
                yield FileChange.modify(path.strip(), contentText(content, mapper));
            }
            default -> FileChange.unrecognized(entry.toString(), "unknown action '" + action + "'");
        };
    }

    private static String contentText(JsonNode content, ObjectMapper mapper) {
        if (content.isTextual()) {
            return content.asText();
        }
        if (content.isArray()) {
            return String.join("\n", StreamSupport.stream(content.spliterator(), false)
                    .map(line -> line.isValueNode() ? line.asText() : line.toString())
                    .toList());
        }
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(content);
        } catch (JsonProcessingException e) {
            return content.toString();
        }
    }
}
