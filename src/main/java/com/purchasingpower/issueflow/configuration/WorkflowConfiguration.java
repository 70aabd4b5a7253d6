package com.purchasingpower.issueflow.configuration;

import com.purchasingpower.issueflow.workflow.WorkflowSettings;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
public class WorkflowConfiguration {

    @Bean
    public WorkflowSettings workflowSettings(AppProperties appProperties) {
        WorkflowProperties workflow = appProperties.getWorkflow();
        WorkflowSettings settings = WorkflowSettings.builder()
                .maxIterations(workflow.getMaxIterations())
                .baseBranch(workflow.getBaseBranch())
                .branchPrefix(workflow.getBranchPrefix())
                .maxFileChars(workflow.getMaxFileChars())
                .build();
        log.info("⚙️ Workflow settings: {}", settings);
        return settings;
    }
}
