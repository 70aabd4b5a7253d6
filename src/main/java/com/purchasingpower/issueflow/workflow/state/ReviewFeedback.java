package com.purchasingpower.issueflow.workflow.state;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.purchasingpower.issueflow.util.JsonNodes;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Reviewer verdict on one round's diff. Equality is structural, which is what
 * repeated-feedback detection relies on.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ReviewFeedback {

    private String summary;

    @Builder.Default
    private List<ReviewTask> tasks = new ArrayList<>();

    @JsonProperty("final_comment")
    private String finalComment;

    @JsonIgnore
    public boolean hasTasks() {
        return tasks != null && !tasks.isEmpty();
    }

    public static ReviewFeedback fromJson(JsonNode node) {
        List<ReviewTask> tasks = new ArrayList<>();
        JsonNode rawTasks = node == null ? null : node.get("tasks");
        if (rawTasks != null && rawTasks.isArray()) {
            for (JsonNode task : rawTasks) {
                if (task.isTextual()) {
                    tasks.add(ReviewTask.builder().message(task.asText()).build());
                } else if (task.isObject()) {
                    tasks.add(ReviewTask.builder()
                            .message(JsonNodes.textOrEmpty(task, "message"))
                            .file(JsonNodes.text(task, "file"))
                            .line(JsonNodes.integer(task, "line"))
                            .build());
                }
            }
        }
        return ReviewFeedback.builder()
                .summary(JsonNodes.textOrEmpty(node, "summary"))
                .tasks(tasks)
                .finalComment(JsonNodes.text(node, "final_comment"))
                .build();
    }
}
