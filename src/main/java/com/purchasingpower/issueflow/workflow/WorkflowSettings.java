package com.purchasingpower.issueflow.workflow;

import lombok.Builder;
import lombok.Value;

/**
 * Immutable knobs of one workflow instance.
 */
@Value
@Builder(toBuilder = true)
public class WorkflowSettings {

    @Builder.Default
    int maxIterations = 5;

    @Builder.Default
    String baseBranch = "main";

    @Builder.Default
    String branchPrefix = "agent/issue-";

    @Builder.Default
    int maxFileChars = 8000;

    public String branchFor(int issueNumber) {
        return branchPrefix + issueNumber;
    }

    /**
     * Issue number encoded in an issue branch name, or -1 when {@code branch} is not one.
     */
    public int issueNumberOf(String branch) {
        if (branch == null || !branch.startsWith(branchPrefix)) {
            return -1;
        }
        String suffix = branch.substring(branchPrefix.length());
        return suffix.matches("\\d{1,9}") ? Integer.parseInt(suffix) : -1;
    }
}
