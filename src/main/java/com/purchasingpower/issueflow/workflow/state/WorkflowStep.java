package com.purchasingpower.issueflow.workflow.state;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;

/**
 * Checkpoints persisted by the issue workflow.
 *
 * <pre>
 * requirements → analyze → plan → apply → pr → final_review → completed
 *                                  ↑__________________________|
 * restart is written by the comment gate and starts the sequence over.
 * </pre>
 */
public enum WorkflowStep {
    REQUIREMENTS,
    ANALYZE,
    PLAN,
    APPLY,
    PR,
    FINAL_REVIEW,
    COMPLETED,
    RESTART;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static WorkflowStep fromValue(String value) {
        return Arrays.stream(values())
                .filter(step -> step.getValue().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown workflow step: " + value));
    }
}
