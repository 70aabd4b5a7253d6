package com.purchasingpower.issueflow.configuration;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    @NotBlank(message = "Workspace directory path is required")
    private String workspaceDir;

    @NotBlank(message = "State directory path is required")
    private String stateDir;

    @NotBlank(message = "Error log path is required")
    private String errorLog;

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private WorkflowProperties workflow = new WorkflowProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private GitHubProperties github = new GitHubProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private LlmProperties llm = new LlmProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private GitProperties git = new GitProperties();
}
