package com.purchasingpower.issueflow.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.purchasingpower.issueflow.configuration.AppProperties;
import com.purchasingpower.issueflow.workflow.state.WorkflowState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;

/**
 * Append-only JSON Lines log of failed workflow invocations.
 *
 * <pre>
 * {"timestamp":"2024-05-01T10:00:00Z","repo":"acme/app","issue_number":7,"iteration":2,
 *  "step":"apply","error_type":"StructuredOutputException","message":"...","traceback":"..."}
 * </pre>
 */
@Slf4j
@Repository
public class AgentErrorLog {

    private final Path logFile;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Autowired
    public AgentErrorLog(AppProperties appProperties, ObjectMapper objectMapper) {
        this(Paths.get(appProperties.getErrorLog()), objectMapper, Clock.systemUTC());
    }

    public AgentErrorLog(Path logFile, ObjectMapper objectMapper, Clock clock) {
        this.logFile = logFile;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Appends one entry. Never throws; a failure to record is only logged.
     *
     * @param lastKnownState the last persisted checkpoint, or null when none could be read
     */
    public synchronized void record(String repo, int issueNumber, WorkflowState lastKnownState, Throwable error) {
        try {
            ObjectNode entry = objectMapper.createObjectNode();
            entry.put("timestamp", Instant.now(clock).toString());
            entry.put("repo", repo);
            entry.put("issue_number", issueNumber);
            if (lastKnownState != null) {
                entry.put("iteration", lastKnownState.getIteration());
                entry.put("step", lastKnownState.getStep() == null ? null : lastKnownState.getStep().getValue());
            } else {
                entry.putNull("iteration");
                entry.putNull("step");
            }
            entry.put("error_type", error.getClass().getSimpleName());
            entry.put("message", String.valueOf(error.getMessage()));
            entry.put("traceback", stackTrace(error));

            Path parent = logFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(logFile, objectMapper.writeValueAsString(entry) + "\n", StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException | RuntimeException e) {
            log.error("❌ Failed to record error for {}#{} in {}", repo, issueNumber, logFile, e);
        }
    }

    private static String stackTrace(Throwable error) {
        StringWriter writer = new StringWriter();
        error.printStackTrace(new PrintWriter(writer));
        return writer.toString();
    }
}
