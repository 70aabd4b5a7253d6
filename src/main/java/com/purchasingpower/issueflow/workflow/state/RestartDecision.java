package com.purchasingpower.issueflow.workflow.state;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.purchasingpower.issueflow.util.JsonNodes;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RestartDecision {
    private boolean restart;
    private String summary;
    private String reason;

    public static RestartDecision fromJson(JsonNode node) {
        return RestartDecision.builder()
                .restart(JsonNodes.flag(node, "restart"))
                .summary(JsonNodes.textOrEmpty(node, "summary"))
                .reason(JsonNodes.textOrEmpty(node, "reason"))
                .build();
    }
}
