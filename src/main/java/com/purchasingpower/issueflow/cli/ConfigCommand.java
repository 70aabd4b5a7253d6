package com.purchasingpower.issueflow.cli;

import com.purchasingpower.issueflow.configuration.AppProperties;
import com.purchasingpower.issueflow.workflow.WorkflowSettings;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;

/**
 * {@code issueflow config}: the effective settings. Secrets are reported as set or missing, never printed.
 */
@Component
@RequiredArgsConstructor
@Command(name = "config", mixinStandardHelpOptions = true, description = "Print the effective configuration")
public class ConfigCommand implements Runnable {

    private final AppProperties appProperties;
    private final WorkflowSettings settings;

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        PrintWriter out = spec.commandLine().getOut();
        out.println("LLM endpoint: " + appProperties.getLlm().getBaseUrl());
        out.println("LLM model: " + appProperties.getLlm().getModel());
        out.println("LLM API key: " + presence(appProperties.getLlm().getApiKey()));
        out.println("GitHub API: " + appProperties.getGithub().getApiUrl());
        out.println("GitHub token: " + presence(appProperties.getGithub().getToken()));
        out.println("Webhook secret: " + presence(appProperties.getGithub().getWebhookSecret()));
        out.println("Trigger label: " + appProperties.getGithub().getTriggerLabel());
        out.println("Base branch: " + settings.getBaseBranch());
        out.println("Branch prefix: " + settings.getBranchPrefix());
        out.println("Max iterations: " + settings.getMaxIterations());
        out.println("State dir: " + appProperties.getStateDir());
        out.println("Workspace dir: " + appProperties.getWorkspaceDir());
        out.flush();
    }

    private static String presence(String secret) {
        return secret == null || secret.isBlank() ? "missing" : "set";
    }
}
