package com.purchasingpower.issueflow.cli;

import com.purchasingpower.issueflow.workflow.IssueResolutionWorkflow;
import com.purchasingpower.issueflow.workflow.WorkflowSettings;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

/**
 * {@code issueflow run --repo owner/name --issue 42 [--max-iterations 3]}: one synchronous invocation.
 * Exits 0 when the invocation succeeded and 1 otherwise.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@Command(name = "run", mixinStandardHelpOptions = true, description = "Run the workflow once for an issue")
public class RunCommand implements Callable<Integer> {

    private final IssueResolutionWorkflow workflow;
    private final WorkflowSettings settings;

    @Spec
    private CommandSpec spec;

    @Mixin
    private RepositoryOption repository;

    @Option(names = "--issue", required = true, paramLabel = "N", description = "Issue number")
    private int issue;

    @Option(names = "--max-iterations", paramLabel = "N",
            description = "Round budget for this run (default: app.workflow.max-iterations)")
    private Integer maxIterations;

    @Override
    public Integer call() {
        if (issue <= 0) {
            throw new ParameterException(spec.commandLine(), "--issue must be a positive number");
        }
        if (maxIterations != null && maxIterations <= 0) {
            throw new ParameterException(spec.commandLine(), "--max-iterations must be a positive number");
        }
        int budget = maxIterations == null ? settings.getMaxIterations() : maxIterations;

        boolean success = workflow.processIssue(repository.repo(), issue, budget);
        log.info("{} {}#{} finished: {}", success ? "✅" : "❌", repository.repo(), issue, success ? "success" : "failure");

        PrintWriter out = spec.commandLine().getOut();
        out.println(success ? "Issue processed successfully." : "Issue processing failed.");
        out.flush();
        return success ? 0 : 1;
    }
}
