package com.purchasingpower.issueflow.workflow.state;

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
 * Implementation plan produced once per run by the reviewer.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Plan {

    private String summary;

    @Builder.Default
    private List<String> steps = new ArrayList<>();

    @Builder.Default
    @JsonProperty("files_to_modify")
    private List<String> filesToModify = new ArrayList<>();

    @Builder.Default
    @JsonProperty("files_to_avoid")
    private List<String> filesToAvoid = new ArrayList<>();

    @Builder.Default
    @JsonProperty("acceptance_criteria")
    private List<String> acceptanceCriteria = new ArrayList<>();

    /**
     * Builds a plan from model output. Older prompts called the step list "plan".
     */
    public static Plan fromJson(JsonNode node) {
        List<String> steps = JsonNodes.textList(node, "steps");
        if (steps.isEmpty()) {
            steps = JsonNodes.textList(node, "plan");
        }
        return Plan.builder()
                .summary(JsonNodes.textOrEmpty(node, "summary"))
                .steps(steps)
                .filesToModify(JsonNodes.textList(node, "files_to_modify"))
                .filesToAvoid(JsonNodes.textList(node, "files_to_avoid"))
                .acceptanceCriteria(JsonNodes.textList(node, "acceptance_criteria"))
                .build();
    }
}
