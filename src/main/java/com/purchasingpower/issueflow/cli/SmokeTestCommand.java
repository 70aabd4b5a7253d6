package com.purchasingpower.issueflow.cli;

import com.purchasingpower.issueflow.client.GitHubClient;
import com.purchasingpower.issueflow.client.LlmClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

/**
 * {@code issueflow test --repo owner/name}: checks that the GitHub token can read the repository
 * and that the inference endpoint answers. Exits 1 when either check fails.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@Command(name = "test", mixinStandardHelpOptions = true, description = "Check GitHub and LLM API access")
public class SmokeTestCommand implements Callable<Integer> {

    private final GitHubClient gitHubClient;
    private final LlmClient llmClient;

    @Spec
    private CommandSpec spec;

    @Mixin
    private RepositoryOption repository;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        boolean healthy = true;

        try {
            boolean canPush = gitHubClient.canPush(repository.repo());
            out.println("GitHub token: OK (push access: " + (canPush ? "yes" : "no") + ")");
        } catch (RuntimeException e) {
            log.debug("GitHub check failed", e);
            out.println("GitHub token failed: " + e.getMessage());
            healthy = false;
        }

        try {
            llmClient.generate("ping", null);
            out.println("LLM API: OK");
        } catch (RuntimeException e) {
            log.debug("LLM check failed", e);
            out.println("LLM API failed: " + e.getMessage());
            healthy = false;
        }

        out.flush();
        return healthy ? 0 : 1;
    }
}
