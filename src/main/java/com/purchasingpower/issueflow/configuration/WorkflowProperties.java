package com.purchasingpower.issueflow.configuration;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class WorkflowProperties {

    /**
     * Upper bound on review rounds per issue, counted across invocations.
     */
    @Min(1)
    private int maxIterations = 5;

    @NotBlank
    private String baseBranch = "main";

    /**
     * Issue branches are named prefix + issue number, e.g. agent/issue-42.
     */
    @NotBlank
    private String branchPrefix = "agent/issue-";

    @Min(1)
    private int maxFileChars = 8000;
}
