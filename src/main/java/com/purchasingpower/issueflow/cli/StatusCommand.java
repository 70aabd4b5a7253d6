package com.purchasingpower.issueflow.cli;

import com.purchasingpower.issueflow.client.GitHubClient;
import com.purchasingpower.issueflow.exception.GitHubApiException;
import com.purchasingpower.issueflow.exception.StateStoreException;
import com.purchasingpower.issueflow.model.github.GitHubIssue;
import com.purchasingpower.issueflow.repository.WorkflowStateStore;
import com.purchasingpower.issueflow.workflow.WorkflowSettings;
import com.purchasingpower.issueflow.workflow.state.WorkflowState;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * {@code issueflow status --repo owner/name --issue 42}: the issue as GitHub reports it,
 * then the stored workflow checkpoint.
 */
@Component
@RequiredArgsConstructor
@Command(name = "status", mixinStandardHelpOptions = true, description = "Show an issue and its workflow checkpoint")
public class StatusCommand implements Callable<Integer> {

    private final GitHubClient gitHubClient;
    private final WorkflowStateStore stateStore;
    private final WorkflowSettings settings;

    @Spec
    private CommandSpec spec;

    @Mixin
    private RepositoryOption repository;

    @Option(names = "--issue", required = true, paramLabel = "N", description = "Issue number")
    private int issue;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        String repo = repository.repo();

        try {
            GitHubIssue found = gitHubClient.getIssue(repo, issue);
            out.printf("Issue #%d: %s (%s)%n", issue, found.title(), found.state());
        } catch (GitHubApiException e) {
            err.println("Could not read issue " + repo + "#" + issue + ": " + e.getMessage());
            err.flush();
            return 1;
        }

        try {
            Optional<WorkflowState> stored = stateStore.load(repo, issue);
            out.println(stored.map(this::describe).orElse("Workflow: not started"));
            out.flush();
            return 0;
        } catch (StateStoreException e) {
            out.flush();
            err.println("Workflow: unreadable state (" + e.getMessage() + ")");
            err.flush();
            return 1;
        }
    }

    private String describe(WorkflowState state) {
        String step = state.getStep() == null ? "none" : state.getStep().getValue();
        String pr = state.getPrNumber() == null ? "no PR" : "PR #" + state.getPrNumber();
        return "Workflow: %s, round %d/%d, %s".formatted(step, state.getIteration(), settings.getMaxIterations(), pr);
    }
}
